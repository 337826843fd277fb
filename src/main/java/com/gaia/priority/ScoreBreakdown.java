package com.gaia.priority;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Score with each term reported separately for the priority log.
 *
 * @param totalScore       Final score, floored at zero
 * @param baseScore        Base score from the priority tag
 * @param domBonus         Bonus for newly discovered elements
 * @param urlBonus         Bonus for an unvisited target URL
 * @param failBonus        Retry bonus for a recently failed item
 * @param noChangePenalty  Stagnation penalty, zero or negative
 * @param newElementsCount Element count the DOM bonus was computed from
 */
public record ScoreBreakdown(
        @JsonProperty("total_score") int totalScore,
        @JsonProperty("base_priority_score") int baseScore,
        @JsonProperty("dom_bonus") int domBonus,
        @JsonProperty("url_bonus") int urlBonus,
        @JsonProperty("fail_bonus") int failBonus,
        @JsonProperty("no_change_penalty") int noChangePenalty,
        @JsonProperty("new_elements_count") int newElementsCount
) {
}
