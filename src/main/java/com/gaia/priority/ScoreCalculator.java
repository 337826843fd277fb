package com.gaia.priority;

import com.gaia.core.Priority;
import com.gaia.core.TestItem;
import com.gaia.state.GaiaState;

/**
 * Computes priority scores for test items against the current exploration state.
 * <p>
 * Formula:
 * <pre>
 * score = base(MUST=100, SHOULD=60, MAY=30, unknown=0)
 *       + new_elements * 15
 *       + 20 if target_url is set and not yet visited
 *       + 10 if the item recently failed
 *       - 25 if the item produced no DOM change
 * </pre>
 * floored at zero and capped at {@link Integer#MAX_VALUE}. Higher score = executed earlier.
 * <p>
 * Unknown priority tags score a base of 0 here; the MAY default applied by
 * {@link TestItem#effectivePriority()} is a separate policy.
 */
public final class ScoreCalculator {

    public static final int BONUS_NEW_ELEMENT = 15;
    public static final int BONUS_UNSEEN_URL = 20;
    public static final int BONUS_RECENT_FAIL = 10;
    public static final int PENALTY_NO_DOM_CHANGE = 25;

    private ScoreCalculator() {
    }

    /**
     * Calculate the priority score.
     *
     * @param item  Item to score
     * @param state Current state
     * @return Non-negative score
     */
    public static int computePriorityScore(TestItem item, GaiaState state) {
        return computeScoreBreakdown(item, state).totalScore();
    }

    /**
     * Calculate the score with every term reported individually.
     *
     * @param item  Item to score
     * @param state Current state
     * @return Breakdown; the penalty term is negative when applied
     */
    public static ScoreBreakdown computeScoreBreakdown(TestItem item, GaiaState state) {
        int base = item.priorityLevel().map(Priority::baseScore).orElse(0);
        long domBonus = (long) item.getNewElements() * BONUS_NEW_ELEMENT;
        int urlBonus = item.hasTargetUrl() && state.isUrlNew(item.getTargetUrl()) ? BONUS_UNSEEN_URL : 0;
        int failBonus = state.wasTestFailed(item.getId()) ? BONUS_RECENT_FAIL : 0;
        int penalty = item.isNoDomChange() ? PENALTY_NO_DOM_CHANGE : 0;

        long total = base + domBonus + urlBonus + failBonus - penalty;

        return new ScoreBreakdown(
                saturate(total),
                base,
                saturate(domBonus),
                urlBonus,
                failBonus,
                -penalty,
                item.getNewElements()
        );
    }

    private static int saturate(long value) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, value));
    }
}
