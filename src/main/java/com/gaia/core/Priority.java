package com.gaia.core;

import java.util.Optional;

/**
 * Priority tags assigned to test items by the upstream analysis agent.
 */
public enum Priority {
    /**
     * Required functionality. Base score 100.
     */
    MUST(100),

    /**
     * Expected functionality. Base score 60.
     */
    SHOULD(60),

    /**
     * Nice-to-have functionality. Base score 30.
     */
    MAY(30);

    private final int baseScore;

    Priority(int baseScore) {
        this.baseScore = baseScore;
    }

    public int baseScore() {
        return baseScore;
    }

    /**
     * Parse a raw priority tag. Matching is exact (upper case), as produced by the agent.
     *
     * @param raw Raw tag, may be null
     * @return Parsed priority, or empty if the tag is unknown
     */
    public static Optional<Priority> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (Priority p : values()) {
            if (p.name().equals(raw)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
