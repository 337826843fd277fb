package com.gaia.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gaia.core.TestItem;

import java.util.List;

/**
 * Queue state at the end of a run.
 *
 * @param remainingItems Items still queued
 * @param topPending     Highest-scoring pending items
 */
public record QueueSummary(
        @JsonProperty("remaining_items") int remainingItems,
        @JsonProperty("top_pending") List<TestItem> topPending
) {
    public QueueSummary {
        topPending = List.copyOf(topPending);
    }
}
