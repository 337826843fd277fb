package com.gaia.queue;

import com.gaia.core.TestItem;

import java.util.Objects;

/**
 * Test item wrapper with its computed score for heap ordering.
 * <p>
 * Comparison order:
 * 1. Score (higher first)
 * 2. Sequence (lower first, so equal scores are served FIFO)
 */
public final class ScoredItem implements Comparable<ScoredItem> {

    private final int score;
    private final long sequence;
    private final TestItem item;

    public ScoredItem(int score, long sequence, TestItem item) {
        this.score = score;
        this.sequence = sequence;
        this.item = Objects.requireNonNull(item, "item cannot be null");
    }

    public int getScore() {
        return score;
    }

    public long getSequence() {
        return sequence;
    }

    public TestItem getItem() {
        return item;
    }

    public String getItemId() {
        return item.getId();
    }

    @Override
    public int compareTo(ScoredItem other) {
        int scoreCmp = Integer.compare(other.score, this.score);
        if (scoreCmp != 0) {
            return scoreCmp;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "ScoredItem{" +
                "id='" + item.getId() + '\'' +
                ", score=" + score +
                ", seq=" + sequence +
                '}';
    }
}
