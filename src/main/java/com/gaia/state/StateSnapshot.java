package com.gaia.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable counts taken from a {@link GaiaState}.
 *
 * @param visitedUrls          Number of URLs seen
 * @param visitedDomSignatures Number of distinct DOM signatures seen
 * @param completedTests       Number of completed test ids
 * @param failedTests          Number of currently failed test ids
 * @param executionRounds      Rounds started so far
 */
public record StateSnapshot(
        @JsonProperty("visited_urls") int visitedUrls,
        @JsonProperty("visited_dom_signatures") int visitedDomSignatures,
        @JsonProperty("completed_tests") int completedTests,
        @JsonProperty("failed_tests") int failedTests,
        @JsonProperty("execution_rounds") int executionRounds
) {
}
