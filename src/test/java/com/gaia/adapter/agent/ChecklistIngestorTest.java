package com.gaia.adapter.agent;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChecklistIngestor.
 */
class ChecklistIngestorTest {

    @Test
    @DisplayName("Checklist entries become scheduler items")
    void convertsChecklist() {
        Map<String, Object> output = Map.of("checklist", List.of(
                Map.of("id", "TC001", "name", "Login", "priority", "MUST", "category", "auth",
                        "steps", List.of("Open", "Submit"), "expected_result", "Dashboard")));

        List<Map<String, Object>> items = ChecklistIngestor.toSchedulerItems(output);

        assertEquals(1, items.size());
        Map<String, Object> item = items.get(0);
        assertEquals("TC001", item.get("id"));
        assertEquals("MUST", item.get("priority"));
        assertEquals("Login", item.get("name"));
        assertEquals("auth", item.get("category"));
        assertEquals(List.of("Open", "Submit"), item.get("steps"));
        assertEquals("", item.get("precondition"));
        assertEquals("Dashboard", item.get("expected_result"));
        assertEquals(0, item.get("new_elements"));
        assertTrue(item.containsKey("target_url"));
        assertNull(item.get("target_url"));
        assertEquals(false, item.get("no_dom_change"));
    }

    @Test
    @DisplayName("Missing fields get defaults")
    void defaults() {
        List<Map<String, Object>> items = ChecklistIngestor.toSchedulerItems(
                Map.of("checklist", List.of(Map.of("name", "Anonymous"))));

        assertEquals("", items.get(0).get("id"));
        assertEquals("MAY", items.get(0).get("priority"));
        assertEquals(List.of(), items.get(0).get("steps"));
    }

    @Test
    @DisplayName("Unusable output yields no items")
    void unusableOutput() {
        assertTrue(ChecklistIngestor.toSchedulerItems((Object) null).isEmpty());
        assertTrue(ChecklistIngestor.toSchedulerItems(List.of("x")).isEmpty());
        assertTrue(ChecklistIngestor.toSchedulerItems(Map.of("checklist", "nope")).isEmpty());
        assertTrue(ChecklistIngestor.toSchedulerItems(Map.of("other", List.of())).isEmpty());
        assertEquals(1, ChecklistIngestor.toSchedulerItems(
                Map.of("checklist", List.of("skip me", Map.of("id", "T1")))).size());
    }

    @Test
    @DisplayName("Parse checklist from JSON text")
    void fromJson() {
        String json = """
            {"checklist": [
                {"id": "TC001", "priority": "SHOULD", "name": "Search"},
                {"id": "TC002", "priority": "MAY"}
            ]}
            """;

        List<Map<String, Object>> items = ChecklistIngestor.toSchedulerItems(json);

        assertEquals(2, items.size());
        assertEquals("Search", items.get(0).get("name"));
        assertTrue(ChecklistIngestor.toSchedulerItems("  ").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ChecklistIngestor.toSchedulerItems("{broken"));
    }
}
