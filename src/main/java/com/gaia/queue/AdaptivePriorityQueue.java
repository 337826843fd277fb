package com.gaia.queue;

import com.gaia.core.TestItem;
import com.gaia.priority.ScoreCalculator;
import com.gaia.state.GaiaState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.PriorityQueue;
import java.util.function.Predicate;

/**
 * Bounded max-priority queue of test items that can be re-scored in place.
 * <p>
 * - Binary heap: O(log n) push and pop
 * - Scores are computed against the state passed to {@link #push}
 * - Completed items never enter the queue
 * - On overflow the lowest-ranked entries are evicted
 * <p>
 * Not thread-safe.
 */
public class AdaptivePriorityQueue {

    private static final Logger log = LoggerFactory.getLogger(AdaptivePriorityQueue.class);

    public static final int DEFAULT_MAX_SIZE = 100;

    private final int maxSize;
    private final PriorityQueue<ScoredItem> heap;
    private final Map<String, ScoredItem> index = new HashMap<>();
    private long sequence;

    public AdaptivePriorityQueue() {
        this(DEFAULT_MAX_SIZE);
    }

    public AdaptivePriorityQueue(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.heap = new PriorityQueue<>(Math.min(maxSize + 1, 1000));
    }

    /**
     * Add an item scored against the given state.
     * Completed items are ignored. An item already queued under the same id is replaced.
     *
     * @param item  Item to queue
     * @param state Current state
     */
    public void push(TestItem item, GaiaState state) {
        String itemId = item.getId();
        if (itemId.isBlank()) {
            throw new IllegalArgumentException("Item must have a non-blank id");
        }
        if (state.isTestCompleted(itemId)) {
            log.trace("Item {} already completed, not queued", itemId);
            return;
        }

        ScoredItem existing = index.remove(itemId);
        if (existing != null) {
            heap.remove(existing);
        }

        int score = ScoreCalculator.computePriorityScore(item, state);
        ScoredItem entry = new ScoredItem(score, sequence++, item);
        heap.offer(entry);
        index.put(itemId, entry);
        log.trace("Item {} queued with score {} (size={})", itemId, score, heap.size());

        while (heap.size() > maxSize) {
            evictLowest();
        }
    }

    /**
     * Remove and return the highest-scoring item.
     */
    public Optional<TestItem> pop() {
        ScoredItem entry = heap.poll();
        if (entry == null) {
            return Optional.empty();
        }
        index.remove(entry.getItemId());
        return Optional.of(entry.getItem());
    }

    /**
     * Return the highest-scoring item without removing it.
     */
    public Optional<TestItem> peek() {
        ScoredItem entry = heap.peek();
        return entry != null ? Optional.of(entry.getItem()) : Optional.empty();
    }

    /**
     * Recompute every score against the new state and rebuild the heap.
     * Items completed since they were queued are dropped.
     *
     * @param state Updated state
     */
    public void rescoreAll(GaiaState state) {
        List<ScoredItem> entries = new ArrayList<>(heap);
        entries.sort(Comparator.comparingLong(ScoredItem::getSequence));

        heap.clear();
        index.clear();

        for (ScoredItem entry : entries) {
            push(entry.getItem(), state);
        }
        log.debug("Rescored queue: {} -> {} items", entries.size(), heap.size());
    }

    /**
     * Get up to n items in descending score order without removing them.
     */
    public List<TestItem> getTopN(int n) {
        if (n <= 0 || heap.isEmpty()) {
            return List.of();
        }
        List<ScoredItem> sorted = new ArrayList<>(heap);
        Collections.sort(sorted);
        List<TestItem> top = new ArrayList<>(Math.min(n, sorted.size()));
        for (int i = 0; i < sorted.size() && i < n; i++) {
            top.add(sorted.get(i).getItem());
        }
        return top;
    }

    /**
     * Count queued items matching a predicate.
     */
    public int count(Predicate<TestItem> predicate) {
        int count = 0;
        for (ScoredItem entry : heap) {
            if (predicate.test(entry.getItem())) {
                count++;
            }
        }
        return count;
    }

    public boolean contains(String itemId) {
        return index.containsKey(itemId);
    }

    /**
     * Remove a queued item by id. O(n).
     *
     * @return true if the item was queued
     */
    public boolean remove(String itemId) {
        ScoredItem entry = index.remove(itemId);
        if (entry == null) {
            return false;
        }
        heap.remove(entry);
        return true;
    }

    /**
     * Score the item was queued with, if it is queued.
     */
    public OptionalInt scoreOf(String itemId) {
        ScoredItem entry = index.get(itemId);
        return entry != null ? OptionalInt.of(entry.getScore()) : OptionalInt.empty();
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public int maxSize() {
        return maxSize;
    }

    public void clear() {
        heap.clear();
        index.clear();
    }

    private void evictLowest() {
        ScoredItem lowest = Collections.max(heap);
        heap.remove(lowest);
        index.remove(lowest.getItemId());
        log.debug("Queue over capacity ({}), evicted {} (score={})",
                maxSize, lowest.getItemId(), lowest.getScore());
    }
}
