package com.gaia.scheduler;

import com.gaia.config.SchedulerConfig;
import com.gaia.core.ExecutionResult;
import com.gaia.core.ExecutionStatus;
import com.gaia.core.Priority;
import com.gaia.core.TestExecutor;
import com.gaia.core.TestItem;
import com.gaia.core.TestItemFactory;
import com.gaia.log.LogAction;
import com.gaia.log.PriorityLogger;
import com.gaia.queue.AdaptivePriorityQueue;
import com.gaia.state.GaiaState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sequential adaptive scheduler.
 * <p>
 * Per batch: pop the top items, execute each, apply the outcome to state, and
 * rescore the queue when an item lands on a DOM signature not seen before.
 * Explicit non-fatal failures are re-queued; executor exceptions are not.
 * <p>
 * An interrupted executor call puts its item back in the queue and ends the
 * batch. A run stops before the next round while the thread is interrupted.
 */
public class DefaultAdaptiveScheduler implements AdaptiveScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultAdaptiveScheduler.class);

    static final String RESCORE_REASON_DOM_CHANGE = "dom_change";
    static final int SUMMARY_TOP_PENDING = 5;

    private final SchedulerConfig config;
    private final GaiaState state = new GaiaState();
    private final AdaptivePriorityQueue queue;
    private final PriorityLogger logger;
    private SchedulerPhase phase = SchedulerPhase.IDLE;

    private int totalReceived;
    private int totalExecuted;
    private int totalSuccess;
    private int totalFailed;
    private int totalSkipped;
    private int rescoreCount;

    public DefaultAdaptiveScheduler() {
        this(SchedulerConfig.defaults());
    }

    public DefaultAdaptiveScheduler(SchedulerConfig config) {
        this(config, new PriorityLogger(Path.of(config.logFile())));
    }

    public DefaultAdaptiveScheduler(SchedulerConfig config, PriorityLogger logger) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.queue = new AdaptivePriorityQueue(config.maxQueueSize());

        log.info("DefaultAdaptiveScheduler initialized (maxQueueSize={}, topN={}, logFile={})",
                config.maxQueueSize(), config.topNExecution(), logger.getLogFile());
    }

    @Override
    public void ingestItems(List<? extends Map<String, ?>> items) {
        if (items == null) {
            return;
        }
        List<TestItem> valid = new ArrayList<>(items.size());
        for (Map<String, ?> raw : items) {
            Optional<TestItem> item = TestItemFactory.fromMap(raw);
            if (item.isPresent()) {
                valid.add(item.get());
            } else {
                log.debug("Dropping item without id/priority: {}", raw);
            }
        }
        ingest(valid);
    }

    @Override
    public void ingest(List<TestItem> items) {
        if (items == null) {
            return;
        }
        for (TestItem item : items) {
            if (item.getId().isBlank()) {
                log.debug("Dropping item with blank id");
                continue;
            }
            queue.push(item, state);
            logger.logScore(item, state, LogAction.INGESTED);
            totalReceived++;
        }
        if (!items.isEmpty() && (phase == SchedulerPhase.IDLE || phase == SchedulerPhase.DONE)) {
            phase = SchedulerPhase.INGESTING;
        }
        log.debug("Ingested {} items, queue size {}", items.size(), queue.size());
    }

    @Override
    public List<ExecutionResult> executeNextBatch(TestExecutor executor) {
        return executeNextBatch(executor, config.topNExecution());
    }

    @Override
    public List<ExecutionResult> executeNextBatch(TestExecutor executor, int maxItems) {
        Objects.requireNonNull(executor, "executor cannot be null");

        List<ExecutionResult> results = new ArrayList<>();
        String baseline = state.getCurrentDomSignature();
        phase = SchedulerPhase.EXECUTING;

        for (int i = 0; i < maxItems; i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Interrupted, stopping batch with {} items queued", queue.size());
                break;
            }
            Optional<TestItem> next = queue.pop();
            if (next.isEmpty()) {
                break;
            }

            Optional<ExecutionResult> executed = executeItem(next.get(), executor);
            if (executed.isEmpty()) {
                break;
            }
            ExecutionResult result = executed.get();
            results.add(result);

            if (result.hasDomSignature()) {
                String domSignature = result.getDomSignature();
                if (!domSignature.equals(baseline)) {
                    handleDomChange(domSignature);
                    baseline = domSignature;
                } else {
                    state.markDomSeen(domSignature);
                }
            }
        }

        phase = queue.isEmpty() ? SchedulerPhase.IDLE : SchedulerPhase.EXECUTING;
        log.debug("Batch executed {} items, {} remaining", results.size(), queue.size());
        return results;
    }

    @Override
    public SchedulerSummary executeUntilComplete(TestExecutor executor) {
        return executeUntilComplete(executor, config.maxRounds(), config.completionThreshold());
    }

    @Override
    public SchedulerSummary executeUntilComplete(TestExecutor executor, int maxRounds, double completionThreshold) {
        Objects.requireNonNull(executor, "executor cannot be null");
        log.info("Starting adaptive run: {} queued, maxRounds={}, threshold={}",
                queue.size(), maxRounds, completionThreshold);

        for (int round = 1; round <= maxRounds; round++) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Interrupted before round {}, stopping with {} items queued", round, queue.size());
                break;
            }
            state.incrementRound();

            if (queue.isEmpty()) {
                log.debug("Round {}: queue empty, stopping", round);
                break;
            }

            if (completionThresholdMet(completionThreshold)) {
                log.debug("Round {}: completion threshold {} met, stopping", round, completionThreshold);
                break;
            }

            List<ExecutionResult> results = executeNextBatch(executor);
            if (results.isEmpty()) {
                break;
            }
        }

        phase = SchedulerPhase.DONE;

        try {
            logger.save();
        } catch (UncheckedIOException e) {
            log.error("Failed to persist priority log", e);
        }

        SchedulerSummary summary = summary();
        log.info("Adaptive run finished after {} rounds: executed={}, success={}, failed={}, rescores={}, remaining={}",
                state.getExecutionRound(), totalExecuted, totalSuccess, totalFailed, rescoreCount, queue.size());
        return summary;
    }

    @Override
    public SchedulerSummary summary() {
        return new SchedulerSummary(
                getStats(),
                state.snapshot(),
                new QueueSummary(queue.size(), queue.getTopN(SUMMARY_TOP_PENDING)),
                logger.getSummary()
        );
    }

    /**
     * Execute one item and apply its outcome to state, counters, queue and log.
     *
     * @return Outcome, or empty if the executor was interrupted and the item went back to the queue
     */
    private Optional<ExecutionResult> executeItem(TestItem item, TestExecutor executor) {
        String itemId = item.getId();

        ExecutionResult result;
        try {
            result = executor.execute(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.push(item, state);
            log.warn("Interrupted while executing item {}, re-queued", itemId);
            return Optional.empty();
        } catch (Exception e) {
            totalExecuted++;
            return Optional.of(handleExecutorError(item, e));
        }
        totalExecuted++;
        if (result == null) {
            result = ExecutionResult.failed("Executor returned no result");
        }

        switch (result.getStatus()) {
            case SUCCESS -> {
                state.markTestCompleted(itemId);
                totalSuccess++;
                logger.logExecution(item, state, ExecutionStatus.SUCCESS, result.toMap());
            }
            case FAILED -> {
                state.markTestFailed(itemId);
                totalFailed++;
                logger.logExecution(item, state, ExecutionStatus.FAILED, result.toMap());
                if (!result.isFatal()) {
                    queue.push(item, state);
                    log.debug("Item {} failed, re-queued for retry", itemId);
                } else {
                    log.debug("Item {} failed fatally, not retried", itemId);
                }
            }
            case SKIPPED -> {
                totalSkipped++;
                logger.logExecution(item, state, ExecutionStatus.SKIPPED, result.toMap());
            }
        }

        String url = item.hasTargetUrl() ? item.getTargetUrl() : result.getCurrentUrl();
        state.markUrlVisited(url);

        return Optional.of(result);
    }

    /**
     * Executor exceptions count as failures but are not retried.
     */
    private ExecutionResult handleExecutorError(TestItem item, Exception e) {
        String itemId = item.getId();
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn("Executor raised for item {}: {}", itemId, message);

        state.markTestFailed(itemId);
        totalFailed++;

        ExecutionResult error = ExecutionResult.builder()
                .status(ExecutionStatus.FAILED)
                .error(message)
                .detail("item_id", itemId)
                .build();
        logger.logExecution(item, state, ExecutionStatus.FAILED, error.toMap());
        return error;
    }

    private void handleDomChange(String domSignature) {
        if (!state.isDomNew(domSignature)) {
            state.markDomSeen(domSignature);
            return;
        }

        state.markDomSeen(domSignature);
        phase = SchedulerPhase.RESCORING;
        queue.rescoreAll(state);
        logger.logRescore(state, RESCORE_REASON_DOM_CHANGE);
        rescoreCount++;
        phase = SchedulerPhase.EXECUTING;
        log.debug("New DOM signature {}, queue rescored ({} items)", domSignature, queue.size());
    }

    /**
     * MUST completion ratio check.
     * Completed items do not retain their priority, so every completed id is
     * counted as MUST work: total = queued MUST + completed.
     */
    private boolean completionThresholdMet(double threshold) {
        int queuedMust = queue.count(item -> item.priorityLevel().orElse(null) == Priority.MUST);
        int completed = state.getCompletedTestIds().size();
        int totalMust = queuedMust + completed;

        if (totalMust == 0) {
            return true;
        }
        return (double) completed / totalMust >= threshold;
    }

    @Override
    public GaiaState getState() {
        return state;
    }

    @Override
    public ExecutionStats getStats() {
        return new ExecutionStats(totalReceived, totalExecuted, totalSuccess, totalFailed, totalSkipped, rescoreCount);
    }

    @Override
    public AdaptivePriorityQueue getQueue() {
        return queue;
    }

    @Override
    public PriorityLogger getLogger() {
        return logger;
    }

    @Override
    public SchedulerPhase getPhase() {
        return phase;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    @Override
    public void clear() {
        state.reset();
        queue.clear();
        logger.clear();
        totalReceived = 0;
        totalExecuted = 0;
        totalSuccess = 0;
        totalFailed = 0;
        totalSkipped = 0;
        rescoreCount = 0;
        phase = SchedulerPhase.IDLE;
        log.info("Scheduler reset");
    }
}
