package com.gaia.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Factory for creating TestItems from the agent's loosely typed payloads.
 * <p>
 * Recognised keys: {@code id}, {@code priority}, {@code new_elements},
 * {@code target_url}, {@code no_dom_change}. All other keys become attributes.
 */
public class TestItemFactory {

    public static final String ID = "id";
    public static final String PRIORITY = "priority";
    public static final String NEW_ELEMENTS = "new_elements";
    public static final String TARGET_URL = "target_url";
    public static final String NO_DOM_CHANGE = "no_dom_change";

    private static final Set<String> TYPED_KEYS = Set.of(ID, PRIORITY, NEW_ELEMENTS, TARGET_URL, NO_DOM_CHANGE);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Create a TestItem from a map.
     *
     * @param map Raw item fields
     * @return Item, or empty if {@code id} or {@code priority} is missing or the id is blank
     */
    public static Optional<TestItem> fromMap(Map<String, ?> map) {
        if (map == null || !map.containsKey(ID) || !map.containsKey(PRIORITY)) {
            return Optional.empty();
        }
        Object rawId = map.get(ID);
        if (rawId == null || rawId.toString().isBlank()) {
            return Optional.empty();
        }

        Object rawPriority = map.get(PRIORITY);
        Object rawUrl = map.get(TARGET_URL);

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (!TYPED_KEYS.contains(entry.getKey())) {
                attributes.put(entry.getKey(), entry.getValue());
            }
        }

        return Optional.of(TestItem.builder()
                .id(rawId.toString())
                .priority(rawPriority != null ? rawPriority.toString() : null)
                .newElements(toCount(map.get(NEW_ELEMENTS)))
                .targetUrl(rawUrl != null ? rawUrl.toString() : null)
                .noDomChange(toBoolean(map.get(NO_DOM_CHANGE)))
                .attributes(attributes)
                .build());
    }

    /**
     * Create TestItems from a list of maps, dropping invalid entries.
     */
    public static List<TestItem> fromMaps(List<? extends Map<String, ?>> maps) {
        List<TestItem> items = new ArrayList<>();
        if (maps == null) {
            return items;
        }
        for (Map<String, ?> map : maps) {
            fromMap(map).ifPresent(items::add);
        }
        return items;
    }

    /**
     * Create TestItems from JSON. Accepts a single object or an array of objects.
     *
     * @param json JSON text
     * @return Valid items in input order
     */
    public static List<TestItem> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            List<TestItem> items = new ArrayList<>();
            if (root.isArray()) {
                for (JsonNode node : root) {
                    toMap(node).flatMap(TestItemFactory::fromMap).ifPresent(items::add);
                }
            } else {
                toMap(root).flatMap(TestItemFactory::fromMap).ifPresent(items::add);
            }
            return items;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }

    private static Optional<Map<String, Object>> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {}));
    }

    /**
     * Coerce a loose count to {@code [0, Integer.MAX_VALUE]}. Unparseable values count as 0.
     */
    static int toCount(Object value) {
        if (value instanceof Number number) {
            return clampCount(number.longValue());
        }
        if (value != null) {
            try {
                return clampCount(Long.parseLong(value.toString().trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static int clampCount(long count) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, count));
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
