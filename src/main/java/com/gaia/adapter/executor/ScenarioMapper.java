package com.gaia.adapter.executor;

import com.gaia.core.TestItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts scheduler items into the remote host's test scenario format.
 */
public final class ScenarioMapper {

    static final String DEFAULT_STEP_ACTION = "click";
    static final String DEFAULT_ASSERTION_SELECTOR = "body";
    static final String DEFAULT_ASSERTION_CONDITION = "is_visible";

    private ScenarioMapper() {
    }

    /**
     * Build the scenario for one item.
     * Plain string steps become click steps with an empty selector; map steps pass through.
     */
    public static Map<String, Object> toScenario(TestItem item) {
        List<Object> steps = new ArrayList<>();
        Object rawSteps = item.getAttribute("steps").orElse(List.of());
        if (rawSteps instanceof List<?> list) {
            for (Object step : list) {
                if (step instanceof String description) {
                    Map<String, Object> mapped = new LinkedHashMap<>();
                    mapped.put("description", description);
                    mapped.put("action", DEFAULT_STEP_ACTION);
                    mapped.put("selector", "");
                    mapped.put("params", List.of());
                    steps.add(mapped);
                } else if (step instanceof Map<?, ?>) {
                    steps.add(step);
                }
            }
        }

        Map<String, Object> assertion = new LinkedHashMap<>();
        assertion.put("description", stringAttribute(item, "expected_result"));
        assertion.put("selector", DEFAULT_ASSERTION_SELECTOR);
        assertion.put("condition", DEFAULT_ASSERTION_CONDITION);
        assertion.put("params", List.of());

        Map<String, Object> scenario = new LinkedHashMap<>();
        scenario.put("id", item.getId());
        scenario.put("priority", item.effectivePriority().name());
        scenario.put("scenario", stringAttribute(item, "name"));
        scenario.put("steps", steps);
        scenario.put("assertion", assertion);
        if (item.hasTargetUrl()) {
            scenario.put("target_url", item.getTargetUrl());
        }
        return scenario;
    }

    private static String stringAttribute(TestItem item, String name) {
        return item.getAttribute(name).map(Object::toString).orElse("");
    }
}
