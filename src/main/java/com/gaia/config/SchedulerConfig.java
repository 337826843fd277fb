package com.gaia.config;

/**
 * Configuration for the adaptive scheduler.
 *
 * @param maxQueueSize        Maximum items held in the priority queue
 * @param topNExecution       Items executed per batch
 * @param maxRounds           Round limit for a full run
 * @param completionThreshold Fraction of MUST work that ends a run early (0.0-1.0)
 * @param logFile             Path of the persisted priority log
 */
public record SchedulerConfig(
        int maxQueueSize,
        int topNExecution,
        int maxRounds,
        double completionThreshold,
        String logFile
) {
    public static final int DEFAULT_MAX_QUEUE_SIZE = 100;
    public static final int DEFAULT_TOP_N_EXECUTION = 5;
    public static final int DEFAULT_MAX_ROUNDS = 20;
    public static final double DEFAULT_COMPLETION_THRESHOLD = 0.9;
    public static final String DEFAULT_LOG_FILE = "priority_log.json";

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
                DEFAULT_MAX_QUEUE_SIZE,
                DEFAULT_TOP_N_EXECUTION,
                DEFAULT_MAX_ROUNDS,
                DEFAULT_COMPLETION_THRESHOLD,
                DEFAULT_LOG_FILE
        );
    }

    /**
     * Copy with a different log file, handy for tests writing to a temp dir.
     */
    public SchedulerConfig withLogFile(String logFile) {
        return new SchedulerConfig(maxQueueSize, topNExecution, maxRounds, completionThreshold, logFile);
    }
}
