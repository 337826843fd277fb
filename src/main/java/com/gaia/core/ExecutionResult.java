package com.gaia.core;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of executing one test item.
 * <p>
 * Wire keys: {@code status}, {@code dom_signature}, {@code current_url},
 * {@code fatal}, {@code error}, {@code new_elements}. Any other key is carried
 * in {@link #getDetails()} and ends up in the priority log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionResult {

    private static final Set<String> TYPED_KEYS =
            Set.of("status", "dom_signature", "current_url", "fatal", "error", "new_elements");

    private final ExecutionStatus status;
    private final String domSignature;
    private final String currentUrl;
    private final boolean fatal;
    private final String error;
    private final Integer newElements;
    private final Map<String, Object> details;

    private ExecutionResult(Builder builder) {
        this.status = Objects.requireNonNull(builder.status, "status cannot be null");
        this.domSignature = builder.domSignature;
        this.currentUrl = builder.currentUrl;
        this.fatal = builder.fatal;
        this.error = builder.error;
        this.newElements = builder.newElements;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    @JsonProperty("status")
    public ExecutionStatus getStatus() {
        return status;
    }

    @JsonProperty("dom_signature")
    public String getDomSignature() {
        return domSignature;
    }

    @JsonProperty("current_url")
    public String getCurrentUrl() {
        return currentUrl;
    }

    /**
     * Whether a failure should suppress retry.
     */
    @JsonProperty("fatal")
    public boolean isFatal() {
        return fatal;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonProperty("new_elements")
    public Integer getNewElements() {
        return newElements;
    }

    @JsonAnyGetter
    public Map<String, Object> getDetails() {
        return details;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == ExecutionStatus.FAILED;
    }

    public boolean hasDomSignature() {
        return domSignature != null && !domSignature.isEmpty();
    }

    /**
     * Flattened view of this result for log details.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.value());
        if (domSignature != null) map.put("dom_signature", domSignature);
        if (currentUrl != null) map.put("current_url", currentUrl);
        if (fatal) map.put("fatal", true);
        if (error != null) map.put("error", error);
        if (newElements != null) map.put("new_elements", newElements);
        map.putAll(details);
        return map;
    }

    /**
     * Parse the executor map contract.
     */
    public static ExecutionResult fromMap(Map<String, ?> map) {
        if (map == null) {
            return failed("Executor returned no result");
        }
        Builder builder = builder()
                .status(ExecutionStatus.fromValue(stringValue(map.get("status"))))
                .domSignature(stringValue(map.get("dom_signature")))
                .currentUrl(stringValue(map.get("current_url")))
                .error(stringValue(map.get("error")));

        Object fatal = map.get("fatal");
        builder.fatal(fatal instanceof Boolean b ? b : fatal != null && Boolean.parseBoolean(fatal.toString()));

        Object newElements = map.get("new_elements");
        if (newElements != null) {
            builder.newElements(TestItemFactory.toCount(newElements));
        }

        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (!TYPED_KEYS.contains(entry.getKey())) {
                builder.detail(entry.getKey(), entry.getValue());
            }
        }
        return builder.build();
    }

    public static ExecutionResult success() {
        return builder().status(ExecutionStatus.SUCCESS).build();
    }

    public static ExecutionResult success(String domSignature) {
        return builder().status(ExecutionStatus.SUCCESS).domSignature(domSignature).build();
    }

    public static ExecutionResult failed(String error) {
        return builder().status(ExecutionStatus.FAILED).error(error).build();
    }

    public static ExecutionResult fatal(String error) {
        return builder().status(ExecutionStatus.FAILED).error(error).fatal(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "status=" + status.value() +
                ", domSignature=" + domSignature +
                ", fatal=" + fatal +
                ", error=" + error +
                '}';
    }

    /**
     * Builder for ExecutionResult.
     */
    public static final class Builder {
        private ExecutionStatus status = ExecutionStatus.FAILED;
        private String domSignature;
        private String currentUrl;
        private boolean fatal;
        private String error;
        private Integer newElements;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder domSignature(String domSignature) {
            this.domSignature = domSignature;
            return this;
        }

        public Builder currentUrl(String currentUrl) {
            this.currentUrl = currentUrl;
            return this;
        }

        public Builder fatal(boolean fatal) {
            this.fatal = fatal;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder newElements(Integer newElements) {
            this.newElements = newElements;
            return this;
        }

        public Builder detail(String name, Object value) {
            this.details.put(name, value);
            return this;
        }

        public ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }
}
