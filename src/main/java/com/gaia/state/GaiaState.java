package com.gaia.state;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Exploration progress that drives scoring decisions.
 * <p>
 * Not thread-safe: owned and mutated by a single scheduler. Mutators treat
 * null or empty input as "no signal" and do nothing.
 * <p>
 * Invariant: an id is never in both the completed and the failed set.
 */
public class GaiaState {

    private final Set<String> visitedUrls = new HashSet<>();
    private final Set<String> visitedDomSignatures = new HashSet<>();
    private final Set<String> failedTestIds = new HashSet<>();
    private final Set<String> completedTestIds = new HashSet<>();
    private String currentDomSignature;
    private int executionRound;

    public void markUrlVisited(String url) {
        if (isPresent(url)) {
            visitedUrls.add(url);
        }
    }

    /**
     * Record a DOM signature and make it the current one.
     */
    public void markDomSeen(String domSignature) {
        if (isPresent(domSignature)) {
            visitedDomSignatures.add(domSignature);
            currentDomSignature = domSignature;
        }
    }

    public void markTestFailed(String testId) {
        if (isPresent(testId)) {
            failedTestIds.add(testId);
        }
    }

    /**
     * Record a completed test. Clears any earlier failure for the same id.
     */
    public void markTestCompleted(String testId) {
        if (isPresent(testId)) {
            completedTestIds.add(testId);
            failedTestIds.remove(testId);
        }
    }

    public void incrementRound() {
        executionRound++;
    }

    public boolean isUrlNew(String url) {
        return !visitedUrls.contains(url);
    }

    public boolean isDomNew(String domSignature) {
        return !visitedDomSignatures.contains(domSignature);
    }

    public boolean wasTestFailed(String testId) {
        return failedTestIds.contains(testId);
    }

    public boolean isTestCompleted(String testId) {
        return completedTestIds.contains(testId);
    }

    /**
     * Restore initial values. Only for full scheduler resets.
     */
    public void reset() {
        visitedUrls.clear();
        visitedDomSignatures.clear();
        failedTestIds.clear();
        completedTestIds.clear();
        currentDomSignature = null;
        executionRound = 0;
    }

    public Set<String> getVisitedUrls() {
        return Collections.unmodifiableSet(visitedUrls);
    }

    public Set<String> getVisitedDomSignatures() {
        return Collections.unmodifiableSet(visitedDomSignatures);
    }

    public Set<String> getFailedTestIds() {
        return Collections.unmodifiableSet(failedTestIds);
    }

    public Set<String> getCompletedTestIds() {
        return Collections.unmodifiableSet(completedTestIds);
    }

    public String getCurrentDomSignature() {
        return currentDomSignature;
    }

    public int getExecutionRound() {
        return executionRound;
    }

    /**
     * Point-in-time counts for summaries and rescore log entries.
     */
    public StateSnapshot snapshot() {
        return new StateSnapshot(
                visitedUrls.size(),
                visitedDomSignatures.size(),
                completedTestIds.size(),
                failedTestIds.size(),
                executionRound
        );
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    @Override
    public String toString() {
        return "GaiaState{" +
                "round=" + executionRound +
                ", urls=" + visitedUrls.size() +
                ", doms=" + visitedDomSignatures.size() +
                ", completed=" + completedTestIds.size() +
                ", failed=" + failedTestIds.size() +
                '}';
    }
}
