package com.gaia.scheduler;

import com.gaia.core.ExecutionResult;
import com.gaia.core.TestExecutor;
import com.gaia.core.TestItem;
import com.gaia.log.PriorityLogger;
import com.gaia.queue.AdaptivePriorityQueue;
import com.gaia.state.GaiaState;

import java.util.List;
import java.util.Map;

/**
 * Adaptive test scheduler abstraction.
 * <p>
 * Orders test items by score, executes them through a {@link TestExecutor},
 * and rescores the remaining queue whenever execution reveals a new page state.
 * Runs sequentially: one item at a time.
 */
public interface AdaptiveScheduler {

    /**
     * Ingest raw items from the agent. Maps missing {@code id} or {@code priority}
     * are dropped silently.
     */
    void ingestItems(List<? extends Map<String, ?>> items);

    /**
     * Ingest typed items.
     */
    void ingest(List<TestItem> items);

    /**
     * Execute the next batch using the configured batch size.
     */
    List<ExecutionResult> executeNextBatch(TestExecutor executor);

    /**
     * Execute up to {@code maxItems} of the highest-scoring items.
     *
     * @return Results in execution order
     */
    List<ExecutionResult> executeNextBatch(TestExecutor executor, int maxItems);

    /**
     * Run rounds with the configured limits until a termination condition is met.
     */
    SchedulerSummary executeUntilComplete(TestExecutor executor);

    /**
     * Run rounds until the queue empties, the MUST completion threshold is met,
     * or {@code maxRounds} have started. Never throws on executor failure.
     *
     * @param completionThreshold Fraction of MUST work (0.0-1.0)
     */
    SchedulerSummary executeUntilComplete(TestExecutor executor, int maxRounds, double completionThreshold);

    /**
     * Current summary without running anything.
     */
    SchedulerSummary summary();

    GaiaState getState();

    ExecutionStats getStats();

    AdaptivePriorityQueue getQueue();

    PriorityLogger getLogger();

    SchedulerPhase getPhase();

    /**
     * Reset state, queue, log and counters.
     */
    void clear();
}
