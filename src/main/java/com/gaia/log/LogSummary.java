package com.gaia.log;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate statistics derived from the priority log.
 *
 * @param totalEntries             Number of entries
 * @param executedTests            Number of executed entries
 * @param successCount             Executed entries with result success
 * @param failedCount              Executed entries with result failed
 * @param rescoreEvents            Number of rescore entries
 * @param averageScoresByPriority  Mean score per raw priority tag over scored entries
 */
public record LogSummary(
        @JsonProperty("total_entries") int totalEntries,
        @JsonProperty("executed_tests") int executedTests,
        @JsonProperty("success_count") int successCount,
        @JsonProperty("failed_count") int failedCount,
        @JsonProperty("rescore_events") int rescoreEvents,
        @JsonProperty("average_scores_by_priority") Map<String, Double> averageScoresByPriority
) {
    public static LogSummary empty() {
        return new LogSummary(0, 0, 0, 0, 0, Map.of());
    }
}
