package com.gaia.core;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One schedulable unit of exploration work.
 * <p>
 * The scheduler reads only the typed fields. Everything else the agent sent
 * is kept in {@link #getAttributes()} and handed to the executor unchanged.
 * Instances are immutable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TestItem {

    private final String id;
    private final String priority;
    private final int newElements;
    private final String targetUrl;
    private final boolean noDomChange;
    private final Map<String, Object> attributes;

    private TestItem(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id cannot be null");
        this.priority = builder.priority;
        this.newElements = Math.max(0, builder.newElements);
        this.targetUrl = builder.targetUrl;
        this.noDomChange = builder.noDomChange;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /**
     * Raw priority tag as received. May be an unknown value.
     */
    @JsonProperty("priority")
    public String getPriority() {
        return priority;
    }

    @JsonProperty("new_elements")
    public int getNewElements() {
        return newElements;
    }

    @JsonProperty("target_url")
    public String getTargetUrl() {
        return targetUrl;
    }

    @JsonProperty("no_dom_change")
    public boolean isNoDomChange() {
        return noDomChange;
    }

    /**
     * Executor-specific payload fields (name, steps, expected_result, ...).
     */
    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * Parsed priority, empty if the raw tag is absent or unknown.
     */
    @JsonIgnore
    public Optional<Priority> priorityLevel() {
        return Priority.parse(priority);
    }

    /**
     * Priority with the MAY default applied.
     */
    @JsonIgnore
    public Priority effectivePriority() {
        return priorityLevel().orElse(Priority.MAY);
    }

    @JsonIgnore
    public boolean hasTargetUrl() {
        return targetUrl != null && !targetUrl.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .priority(priority)
                .newElements(newElements)
                .targetUrl(targetUrl)
                .noDomChange(noDomChange)
                .attributes(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convenience factory for an item with only the required fields.
     */
    public static TestItem of(String id, Priority priority) {
        return builder().id(id).priority(priority).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TestItem that = (TestItem) o;
        return newElements == that.newElements &&
                noDomChange == that.noDomChange &&
                id.equals(that.id) &&
                Objects.equals(priority, that.priority) &&
                Objects.equals(targetUrl, that.targetUrl) &&
                attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, priority, newElements, targetUrl, noDomChange, attributes);
    }

    @Override
    public String toString() {
        return "TestItem{" +
                "id='" + id + '\'' +
                ", priority=" + priority +
                ", newElements=" + newElements +
                ", targetUrl=" + targetUrl +
                ", noDomChange=" + noDomChange +
                '}';
    }

    /**
     * Builder for TestItem.
     */
    public static final class Builder {
        private String id;
        private String priority;
        private int newElements;
        private String targetUrl;
        private boolean noDomChange;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority != null ? priority.name() : null;
            return this;
        }

        public Builder newElements(int newElements) {
            this.newElements = newElements;
            return this;
        }

        public Builder targetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
            return this;
        }

        public Builder noDomChange(boolean noDomChange) {
            this.noDomChange = noDomChange;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public TestItem build() {
            return new TestItem(this);
        }
    }
}
