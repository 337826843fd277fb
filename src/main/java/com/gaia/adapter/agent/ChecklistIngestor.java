package com.gaia.adapter.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the analysis agent's checklist output into scheduler items.
 * <p>
 * Expected input:
 * <pre>
 * {"checklist": [{"id": "TC001", "name": "Login", "priority": "MUST", "steps": [...], ...}]}
 * </pre>
 * Anything that is not an object with a checklist list yields no items.
 */
public class ChecklistIngestor {

    private static final Logger log = LoggerFactory.getLogger(ChecklistIngestor.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Convert agent output to scheduler item maps.
     *
     * @param agentOutput Parsed agent output, usually a Map
     * @return Scheduler items, empty if the input has no usable checklist
     */
    public static List<Map<String, Object>> toSchedulerItems(Object agentOutput) {
        if (!(agentOutput instanceof Map<?, ?> output)) {
            log.debug("Ignoring agent output that is not an object");
            return List.of();
        }
        Object checklist = output.get("checklist");
        if (!(checklist instanceof List<?> entries)) {
            log.debug("Ignoring agent output without a checklist list");
            return List.of();
        }

        List<Map<String, Object>> items = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> raw) {
                items.add(toSchedulerItem(raw));
            }
        }
        log.debug("Converted {} checklist entries", items.size());
        return items;
    }

    /**
     * Convert agent output given as JSON text.
     */
    public static List<Map<String, Object>> toSchedulerItems(String agentOutputJson) {
        if (agentOutputJson == null || agentOutputJson.isBlank()) {
            return List.of();
        }
        try {
            Object parsed = objectMapper.readValue(agentOutputJson, new TypeReference<Object>() {});
            return toSchedulerItems(parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid agent output JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> toSchedulerItem(Map<?, ?> raw) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", getOrDefault(raw, "id", ""));
        item.put("priority", getOrDefault(raw, "priority", "MAY"));
        item.put("name", getOrDefault(raw, "name", ""));
        item.put("category", getOrDefault(raw, "category", ""));
        item.put("steps", getOrDefault(raw, "steps", List.of()));
        item.put("precondition", getOrDefault(raw, "precondition", ""));
        item.put("expected_result", getOrDefault(raw, "expected_result", ""));
        item.put("new_elements", 0);
        item.put("target_url", null);
        item.put("no_dom_change", false);
        return item;
    }

    private static Object getOrDefault(Map<?, ?> map, String key, Object defaultValue) {
        Object value = map.get(key);
        return value != null ? value : defaultValue;
    }
}
