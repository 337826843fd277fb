package com.gaia.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of scheduler counters.
 *
 * @param totalReceived Items accepted at ingestion
 * @param totalExecuted Executor invocations
 * @param totalSuccess  Successful executions
 * @param totalFailed   Failed executions, including executor exceptions
 * @param totalSkipped  Executions reported as skipped
 * @param rescoreCount  Queue rescores triggered by DOM changes
 */
public record ExecutionStats(
        @JsonProperty("total_received") int totalReceived,
        @JsonProperty("total_executed") int totalExecuted,
        @JsonProperty("total_success") int totalSuccess,
        @JsonProperty("total_failed") int totalFailed,
        @JsonProperty("total_skipped") int totalSkipped,
        @JsonProperty("rescore_count") int rescoreCount
) {
}
