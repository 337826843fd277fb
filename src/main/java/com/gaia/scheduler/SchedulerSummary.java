package com.gaia.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gaia.log.LogSummary;
import com.gaia.state.StateSnapshot;

/**
 * Final report of a scheduling run, consumed by report generation.
 */
public record SchedulerSummary(
        @JsonProperty("execution_stats") ExecutionStats executionStats,
        @JsonProperty("state_summary") StateSnapshot stateSummary,
        @JsonProperty("queue_summary") QueueSummary queueSummary,
        @JsonProperty("log_summary") LogSummary logSummary
) {
}
