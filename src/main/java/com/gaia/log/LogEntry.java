package com.gaia.log;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gaia.priority.ScoreBreakdown;
import com.gaia.state.StateSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable record in the priority log.
 * Fields that do not apply to the entry's action are null and omitted from JSON.
 *
 * @param action         Entry kind
 * @param id             Item id (null for rescore entries)
 * @param priority       Raw priority tag of the item
 * @param score          Total score at logging time
 * @param breakdown      Score terms at logging time
 * @param result         Execution status (executed entries)
 * @param details        Executor payload (executed entries)
 * @param reason         Rescore trigger (rescore entries)
 * @param stateSummary   State counts (rescore entries)
 * @param timestamp      ISO-8601 UTC timestamp
 * @param executionRound Round number when logged
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
        @JsonProperty("action") LogAction action,
        @JsonProperty("id") String id,
        @JsonProperty("priority") String priority,
        @JsonProperty("score") Integer score,
        @JsonProperty("breakdown") ScoreBreakdown breakdown,
        @JsonProperty("result") String result,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("reason") String reason,
        @JsonProperty("state_summary") StateSnapshot stateSummary,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("execution_round") int executionRound
) {
    public LogEntry {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : null;
    }
}
