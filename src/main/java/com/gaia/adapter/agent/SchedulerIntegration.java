package com.gaia.adapter.agent;

import com.gaia.adapter.executor.RemoteTestExecutor;
import com.gaia.adapter.executor.TimeoutTestExecutor;
import com.gaia.config.GaiaConfig;
import com.gaia.core.TestExecutor;
import com.gaia.scheduler.AdaptiveScheduler;
import com.gaia.scheduler.DefaultAdaptiveScheduler;
import com.gaia.scheduler.SchedulerSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Couples an adaptive scheduler with an executor.
 * <p>
 * Workflow: agent checklist → scheduler items → scheduler → executor → results → rescore.
 */
public class SchedulerIntegration {

    private static final Logger log = LoggerFactory.getLogger(SchedulerIntegration.class);

    private final AdaptiveScheduler scheduler;
    private final TestExecutor executor;

    public SchedulerIntegration(AdaptiveScheduler scheduler, TestExecutor executor) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Ingest the agent's checklist output. Invalid input is ignored.
     *
     * @param agentOutput Parsed agent output
     * @return Number of checklist entries handed to the scheduler
     */
    public int receiveFromAgent(Object agentOutput) {
        List<Map<String, Object>> items = ChecklistIngestor.toSchedulerItems(agentOutput);
        scheduler.ingestItems(items);
        log.info("Received {} checklist items from agent", items.size());
        return items.size();
    }

    /**
     * Ingest the agent's checklist output given as JSON text.
     */
    public int receiveFromAgentJson(String agentOutputJson) {
        List<Map<String, Object>> items = ChecklistIngestor.toSchedulerItems(agentOutputJson);
        scheduler.ingestItems(items);
        log.info("Received {} checklist items from agent", items.size());
        return items.size();
    }

    /**
     * Run the adaptive loop with the scheduler's configured limits.
     */
    public SchedulerSummary runAdaptiveExecution() {
        return scheduler.executeUntilComplete(executor);
    }

    public SchedulerSummary runAdaptiveExecution(int maxRounds, double completionThreshold) {
        return scheduler.executeUntilComplete(executor, maxRounds, completionThreshold);
    }

    public SchedulerSummary getSchedulerSummary() {
        return scheduler.summary();
    }

    public AdaptiveScheduler getScheduler() {
        return scheduler;
    }

    public TestExecutor getExecutor() {
        return executor;
    }

    /**
     * Build a scheduler and remote executor from config, ingest the agent output
     * and run to completion.
     *
     * @param agentOutput Parsed agent output
     * @param config      Configuration
     * @return Final summary
     */
    public static SchedulerSummary runPipeline(Object agentOutput, GaiaConfig config) {
        AdaptiveScheduler scheduler = new DefaultAdaptiveScheduler(config.scheduler());
        Duration timeout = Duration.ofSeconds(config.executor().executionTimeoutSeconds());

        try (TimeoutTestExecutor executor = new TimeoutTestExecutor(new RemoteTestExecutor(config.executor()), timeout)) {
            SchedulerIntegration integration = new SchedulerIntegration(scheduler, executor);
            integration.receiveFromAgent(agentOutput);
            return integration.runAdaptiveExecution();
        }
    }
}
