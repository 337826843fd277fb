package com.gaia.scheduler;

import com.gaia.config.SchedulerConfig;
import com.gaia.core.ExecutionResult;
import com.gaia.core.ExecutionStatus;
import com.gaia.core.Priority;
import com.gaia.core.TestExecutor;
import com.gaia.core.TestItem;
import com.gaia.log.LogAction;
import com.gaia.log.LogEntry;
import com.gaia.log.PriorityLogger;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultAdaptiveScheduler.
 * Tests cover:
 * - Ingestion and ordering
 * - Outcome handling (success, failure, fatal, skipped, exception)
 * - DOM-change rescoring
 * - Run termination conditions
 */
class DefaultAdaptiveSchedulerTest {

    @TempDir
    Path tempDir;

    private DefaultAdaptiveScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = createScheduler(5);
    }

    // =====================================================================
    // Ingestion Tests
    // =====================================================================

    @Test
    @DisplayName("MUST item is served before SHOULD")
    void mustBeforeShould() {
        scheduler.ingestItems(List.of(
                Map.of("id", "T1", "priority", "MUST"),
                Map.of("id", "T2", "priority", "SHOULD")
        ));

        assertEquals("T1", scheduler.getQueue().pop().orElseThrow().getId());
    }

    @Test
    @DisplayName("Items without id or priority are dropped")
    void invalidItemsDropped() {
        scheduler.ingestItems(List.of(
                Map.of("id", "T1", "priority", "MUST"),
                Map.of("priority", "MUST"),
                Map.of("id", "T3")
        ));

        assertEquals(1, scheduler.getQueue().size());
        assertEquals(1, scheduler.getStats().totalReceived());
        assertEquals(SchedulerPhase.INGESTING, scheduler.getPhase());
    }

    @Test
    @DisplayName("Ingestion is logged per item")
    void ingestionLogged() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST), TestItem.of("T2", Priority.MAY)));

        List<LogEntry> entries = scheduler.getLogger().getEntries();
        assertEquals(2, entries.size());
        assertTrue(entries.stream().allMatch(e -> e.action() == LogAction.INGESTED));
    }

    @Test
    @DisplayName("Null input is ignored")
    void nullInputIgnored() {
        scheduler.ingestItems(null);
        scheduler.ingest(null);

        assertTrue(scheduler.getQueue().isEmpty());
        assertEquals(SchedulerPhase.IDLE, scheduler.getPhase());
    }

    // =====================================================================
    // Outcome Tests
    // =====================================================================

    @Test
    @DisplayName("Successful item is completed and not re-queued")
    void successCompletes() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST)));

        List<ExecutionResult> results = scheduler.executeNextBatch(item -> ExecutionResult.success());

        assertEquals(1, results.size());
        assertTrue(scheduler.getState().isTestCompleted("T1"));
        assertTrue(scheduler.getQueue().isEmpty());
        assertEquals(1, scheduler.getStats().totalSuccess());
        assertEquals(SchedulerPhase.IDLE, scheduler.getPhase());
    }

    @Test
    @DisplayName("Non-fatal failure is re-queued with failure bonus")
    void failureRequeued() {
        scheduler.ingestItems(List.of(Map.of("id", "T1", "priority", "MUST")));

        scheduler.executeNextBatch(item -> ExecutionResult.fromMap(Map.of("status", "failed", "fatal", false)), 1);

        assertTrue(scheduler.getQueue().size() > 0);
        assertTrue(scheduler.getQueue().contains("T1"));
        assertTrue(scheduler.getState().wasTestFailed("T1"));
        assertEquals(110, scheduler.getQueue().scoreOf("T1").orElseThrow());
        assertEquals(1, scheduler.getStats().totalFailed());
    }

    @Test
    @DisplayName("Failing item is retried within the same batch")
    void failureRetriedInBatch() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST)));
        AtomicInteger calls = new AtomicInteger();

        scheduler.executeNextBatch(item -> {
            calls.incrementAndGet();
            return ExecutionResult.failed("nope");
        });

        assertEquals(5, calls.get());
        assertTrue(scheduler.getQueue().contains("T1"));
    }

    @Test
    @DisplayName("Fatal failure is not retried")
    void fatalNotRetried() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST)));

        scheduler.executeNextBatch(item -> ExecutionResult.fatal("browser crashed"));

        assertTrue(scheduler.getQueue().isEmpty());
        assertTrue(scheduler.getState().wasTestFailed("T1"));
        assertEquals(1, scheduler.getStats().totalExecuted());
        assertEquals(1, scheduler.getStats().totalFailed());
    }

    @Test
    @DisplayName("Executor exception becomes a failure that is not retried")
    void exceptionNotRetried() {
        scheduler.ingest(List.of(TestItem.builder().id("T1").priority(Priority.MUST).targetUrl("/x").build()));

        List<ExecutionResult> results = scheduler.executeNextBatch(item -> {
            throw new IllegalStateException("driver gone");
        });

        ExecutionResult result = results.get(0);
        assertTrue(result.isFailed());
        assertEquals("driver gone", result.getError());
        assertEquals("T1", result.getDetails().get("item_id"));
        assertTrue(scheduler.getQueue().isEmpty());
        assertTrue(scheduler.getState().wasTestFailed("T1"));
        assertTrue(scheduler.getState().isUrlNew("/x"));
        assertEquals(1, scheduler.getStats().totalFailed());
    }

    @Test
    @DisplayName("Skipped item is counted but neither completed nor re-queued")
    void skippedItem() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.SHOULD)));

        scheduler.executeNextBatch(item -> ExecutionResult.builder().status(ExecutionStatus.SKIPPED).build());

        assertEquals(1, scheduler.getStats().totalSkipped());
        assertFalse(scheduler.getState().isTestCompleted("T1"));
        assertFalse(scheduler.getState().wasTestFailed("T1"));
        assertTrue(scheduler.getQueue().isEmpty());
    }

    @Test
    @DisplayName("Null result is treated as a failure")
    void nullResultIsFailure() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST)));

        List<ExecutionResult> results = scheduler.executeNextBatch(item -> null, 1);

        assertTrue(results.get(0).isFailed());
        assertTrue(scheduler.getQueue().contains("T1"));
    }

    @Test
    @DisplayName("Target URL or reported URL is recorded as visited")
    void urlRecorded() {
        scheduler.ingest(List.of(
                TestItem.builder().id("T1").priority(Priority.MUST).targetUrl("/login").build(),
                TestItem.of("T2", Priority.SHOULD)
        ));

        scheduler.executeNextBatch(item -> ExecutionResult.builder()
                .status(ExecutionStatus.SUCCESS)
                .currentUrl("/reported-" + item.getId())
                .build());

        assertFalse(scheduler.getState().isUrlNew("/login"));
        assertTrue(scheduler.getState().isUrlNew("/reported-T1"));
        assertFalse(scheduler.getState().isUrlNew("/reported-T2"));
    }

    @Test
    @DisplayName("Phase stays EXECUTING between batches while items remain")
    void phaseBetweenBatches() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST), TestItem.of("T2", Priority.MUST)));

        scheduler.executeNextBatch(item -> ExecutionResult.success(), 1);
        assertEquals(SchedulerPhase.EXECUTING, scheduler.getPhase());

        scheduler.executeNextBatch(item -> ExecutionResult.success(), 1);
        assertEquals(SchedulerPhase.IDLE, scheduler.getPhase());
    }

    // =====================================================================
    // Interrupt Tests
    // =====================================================================

    @Test
    @DisplayName("Interrupted item is re-queued and the run stops without failing the rest")
    void interruptStopsRun() {
        scheduler.ingest(List.of(
                TestItem.of("T1", Priority.MUST),
                TestItem.of("T2", Priority.MUST),
                TestItem.of("T3", Priority.MUST)
        ));
        AtomicInteger calls = new AtomicInteger();
        TestExecutor executor = item -> {
            if (calls.incrementAndGet() == 1) {
                throw new InterruptedException("cancelled");
            }
            return ExecutionResult.success();
        };

        SchedulerSummary interrupted;
        try {
            interrupted = scheduler.executeUntilComplete(executor);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals(1, calls.get());
        assertEquals(0, interrupted.executionStats().totalExecuted());
        assertEquals(0, interrupted.executionStats().totalFailed());
        assertEquals(3, interrupted.queueSummary().remainingItems());
        assertTrue(scheduler.getState().getFailedTestIds().isEmpty());
        assertEquals(SchedulerPhase.DONE, scheduler.getPhase());

        SchedulerSummary resumed = scheduler.executeUntilComplete(executor);

        assertEquals(3, resumed.executionStats().totalSuccess());
        assertEquals(0, resumed.executionStats().totalFailed());
        assertEquals(0, resumed.queueSummary().remainingItems());
    }

    @Test
    @DisplayName("Batch does not start while the thread is interrupted")
    void interruptedThreadRunsNothing() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST)));
        AtomicInteger calls = new AtomicInteger();

        List<ExecutionResult> results;
        Thread.currentThread().interrupt();
        try {
            results = scheduler.executeNextBatch(item -> {
                calls.incrementAndGet();
                return ExecutionResult.success();
            });
        } finally {
            Thread.interrupted();
        }

        assertTrue(results.isEmpty());
        assertEquals(0, calls.get());
        assertTrue(scheduler.getQueue().contains("T1"));
    }

    // =====================================================================
    // DOM Change Tests
    // =====================================================================

    @Test
    @DisplayName("New DOM signature across batches triggers rescoring")
    void domChangeTriggersRescore() {
        scheduler.ingest(List.of(
                TestItem.of("T1", Priority.MUST),
                TestItem.of("T2", Priority.SHOULD),
                TestItem.of("T3", Priority.MAY)
        ));
        Iterator<String> doms = List.of("dom-1", "dom-2").iterator();
        TestExecutor executor = item -> ExecutionResult.success(doms.next());

        scheduler.executeNextBatch(executor, 1);
        int afterFirst = scheduler.getStats().rescoreCount();
        scheduler.executeNextBatch(executor, 1);

        assertTrue(scheduler.getStats().rescoreCount() >= 1);
        assertTrue(scheduler.getStats().rescoreCount() > afterFirst);
        assertEquals("dom-2", scheduler.getState().getCurrentDomSignature());

        List<LogEntry> rescores = scheduler.getLogger().getEntries().stream()
                .filter(e -> e.action() == LogAction.RESCORE)
                .toList();
        assertEquals(scheduler.getStats().rescoreCount(), rescores.size());
        assertEquals("dom_change", rescores.get(rescores.size() - 1).reason());
    }

    @Test
    @DisplayName("Repeated DOM signature does not rescore again")
    void sameDomNoRescore() {
        scheduler.ingest(List.of(
                TestItem.of("T1", Priority.MUST),
                TestItem.of("T2", Priority.SHOULD),
                TestItem.of("T3", Priority.MAY)
        ));

        scheduler.executeNextBatch(item -> ExecutionResult.success("dom-1"));

        assertEquals(1, scheduler.getStats().rescoreCount());
        assertEquals(1, scheduler.getState().getVisitedDomSignatures().size());
    }

    @Test
    @DisplayName("Returning to a known DOM does not rescore")
    void knownDomNoRescore() {
        scheduler.ingest(List.of(
                TestItem.of("T1", Priority.MUST),
                TestItem.of("T2", Priority.SHOULD),
                TestItem.of("T3", Priority.MAY)
        ));
        Iterator<String> doms = List.of("dom-a", "dom-b", "dom-a").iterator();

        scheduler.executeNextBatch(item -> ExecutionResult.success(doms.next()));

        assertEquals(2, scheduler.getStats().rescoreCount());
        assertEquals("dom-a", scheduler.getState().getCurrentDomSignature());
    }

    @Test
    @DisplayName("Rescore reorders the remaining queue")
    void rescoreReorders() {
        scheduler.ingest(List.of(
                TestItem.of("T1", Priority.MUST),
                TestItem.builder().id("S1").priority(Priority.SHOULD).targetUrl("/next").build(),
                TestItem.of("S2", Priority.SHOULD)
        ));
        scheduler.getState().markTestFailed("S2");

        scheduler.executeNextBatch(item -> ExecutionResult.success("dom-1"), 1);

        // S1 80, S2 60 + 10 after rescore
        assertEquals(80, scheduler.getQueue().scoreOf("S1").orElseThrow());
        assertEquals(70, scheduler.getQueue().scoreOf("S2").orElseThrow());
    }

    // =====================================================================
    // Run Tests
    // =====================================================================

    @Test
    @DisplayName("Run stops when the queue empties and saves the log")
    void runUntilEmpty() {
        scheduler.ingest(List.of(
                TestItem.of("T1", Priority.MUST),
                TestItem.of("T2", Priority.MUST),
                TestItem.of("T3", Priority.MUST)
        ));

        SchedulerSummary summary = scheduler.executeUntilComplete(item -> ExecutionResult.success());

        assertEquals(3, summary.executionStats().totalExecuted());
        assertEquals(3, summary.executionStats().totalSuccess());
        assertEquals(3, summary.stateSummary().completedTests());
        assertEquals(2, summary.stateSummary().executionRounds());
        assertEquals(0, summary.queueSummary().remainingItems());
        assertEquals(3, summary.logSummary().successCount());
        assertEquals(SchedulerPhase.DONE, scheduler.getPhase());
        assertTrue(Files.exists(scheduler.getLogger().getLogFile()));
    }

    @Test
    @DisplayName("Run stops at max rounds")
    void runStopsAtMaxRounds() {
        DefaultAdaptiveScheduler single = createScheduler(1);
        single.ingest(List.of(TestItem.of("T1", Priority.MUST)));

        SchedulerSummary summary = single.executeUntilComplete(item -> ExecutionResult.failed("flaky"), 3, 0.9);

        assertEquals(3, summary.executionStats().totalExecuted());
        assertEquals(3, summary.executionStats().totalFailed());
        assertEquals(3, summary.stateSummary().executionRounds());
        assertEquals(1, summary.queueSummary().remainingItems());
        assertEquals("T1", summary.queueSummary().topPending().get(0).getId());
    }

    @Test
    @DisplayName("Run stops once the MUST completion threshold is met")
    void runStopsAtThreshold() {
        DefaultAdaptiveScheduler single = createScheduler(1);
        single.ingest(List.of(
                TestItem.of("M1", Priority.MUST),
                TestItem.of("M2", Priority.MUST),
                TestItem.of("M3", Priority.MUST),
                TestItem.of("M4", Priority.MUST)
        ));

        SchedulerSummary summary = single.executeUntilComplete(item -> ExecutionResult.success(), 20, 0.5);

        // 2 of 4 completed satisfies 0.5
        assertEquals(2, summary.executionStats().totalSuccess());
        assertEquals(2, summary.queueSummary().remainingItems());
    }

    @Test
    @DisplayName("Run without MUST work stops immediately")
    void runWithoutMustWork() {
        scheduler.ingest(List.of(TestItem.of("S1", Priority.SHOULD), TestItem.of("Y1", Priority.MAY)));

        SchedulerSummary summary = scheduler.executeUntilComplete(item -> ExecutionResult.success());

        assertEquals(0, summary.executionStats().totalExecuted());
        assertEquals(2, summary.queueSummary().remainingItems());
    }

    @Test
    @DisplayName("Run never propagates executor exceptions")
    void runSurvivesExceptions() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST), TestItem.of("T2", Priority.MUST)));

        SchedulerSummary summary = assertDoesNotThrow(() -> scheduler.executeUntilComplete(item -> {
            throw new RuntimeException("boom");
        }));

        assertEquals(2, summary.executionStats().totalFailed());
        assertEquals(0, summary.queueSummary().remainingItems());
    }

    @Test
    @DisplayName("Summary lists at most five pending items")
    void summaryTopPending() {
        List<TestItem> items = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            items.add(TestItem.of("T" + i, Priority.SHOULD));
        }
        scheduler.ingest(items);

        SchedulerSummary summary = scheduler.summary();

        assertEquals(8, summary.queueSummary().remainingItems());
        assertEquals(5, summary.queueSummary().topPending().size());
        assertEquals(8, summary.executionStats().totalReceived());
    }

    @Test
    @DisplayName("Clear resets state, queue, log and counters")
    void clearResets() {
        scheduler.ingest(List.of(TestItem.of("T1", Priority.MUST), TestItem.of("T2", Priority.MUST)));
        scheduler.executeNextBatch(item -> ExecutionResult.success("dom"), 1);

        scheduler.clear();

        assertTrue(scheduler.getQueue().isEmpty());
        assertTrue(scheduler.getLogger().getEntries().isEmpty());
        assertEquals(new ExecutionStats(0, 0, 0, 0, 0, 0), scheduler.getStats());
        assertEquals(0, scheduler.getState().getVisitedDomSignatures().size());
        assertEquals(SchedulerPhase.IDLE, scheduler.getPhase());
    }

    // =====================================================================
    // Helper Methods
    // =====================================================================

    private DefaultAdaptiveScheduler createScheduler(int topN) {
        Path logFile = tempDir.resolve("priority_log_" + topN + ".json");
        SchedulerConfig config = new SchedulerConfig(100, topN, 20, 0.9, logFile.toString());
        return new DefaultAdaptiveScheduler(config, new PriorityLogger(logFile));
    }
}
