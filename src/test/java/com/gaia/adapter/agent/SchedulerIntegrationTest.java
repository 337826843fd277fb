package com.gaia.adapter.agent;

import com.gaia.config.SchedulerConfig;
import com.gaia.core.ExecutionResult;
import com.gaia.core.TestExecutor;
import com.gaia.log.PriorityLogger;
import com.gaia.scheduler.DefaultAdaptiveScheduler;
import com.gaia.scheduler.SchedulerSummary;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SchedulerIntegration.
 */
class SchedulerIntegrationTest {

    @TempDir
    Path tempDir;

    private DefaultAdaptiveScheduler scheduler;

    @BeforeEach
    void setUp() {
        Path logFile = tempDir.resolve("priority_log.json");
        scheduler = new DefaultAdaptiveScheduler(
                new SchedulerConfig(100, 5, 20, 0.9, logFile.toString()), new PriorityLogger(logFile));
    }

    @Test
    @DisplayName("Agent checklist is ingested, entries without id are dropped by the scheduler")
    void receiveFromAgent() {
        SchedulerIntegration integration = new SchedulerIntegration(scheduler, item -> ExecutionResult.success());

        int received = integration.receiveFromAgent(Map.of("checklist", List.of(
                Map.of("id", "TC001", "priority", "MUST"),
                Map.of("id", "TC002", "priority", "SHOULD"),
                Map.of("name", "no id"))));

        assertEquals(3, received);
        assertEquals(2, scheduler.getQueue().size());
        assertEquals(2, integration.getSchedulerSummary().executionStats().totalReceived());
    }

    @Test
    @DisplayName("Full run executes checklist items in score order")
    void runAdaptiveExecution() {
        List<String> executed = new ArrayList<>();
        TestExecutor executor = item -> {
            executed.add(item.getId());
            return ExecutionResult.success();
        };
        SchedulerIntegration integration = new SchedulerIntegration(scheduler, executor);

        integration.receiveFromAgentJson("""
            {"checklist": [
                {"id": "TC001", "priority": "SHOULD"},
                {"id": "TC002", "priority": "MUST"},
                {"id": "TC003", "priority": "MUST"}
            ]}
            """);
        SchedulerSummary summary = integration.runAdaptiveExecution();

        assertEquals(List.of("TC002", "TC003", "TC001"), executed);
        assertEquals(3, summary.executionStats().totalSuccess());
        assertEquals(0, summary.queueSummary().remainingItems());
    }

    @Test
    @DisplayName("Null collaborators are rejected")
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> new SchedulerIntegration(null, item -> null));
        assertThrows(NullPointerException.class, () -> new SchedulerIntegration(scheduler, null));
    }
}
