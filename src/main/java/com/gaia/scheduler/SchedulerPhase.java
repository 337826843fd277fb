package com.gaia.scheduler;

/**
 * Lifecycle phases of an adaptive scheduler.
 */
public enum SchedulerPhase {
    /**
     * No items ingested, not running.
     */
    IDLE,

    /**
     * Items have been added and are waiting for execution.
     */
    INGESTING,

    /**
     * A batch is in flight, or a batch finished and items remain queued.
     */
    EXECUTING,

    /**
     * The queue is being rescored after a DOM change.
     */
    RESCORING,

    /**
     * A run ended on its round, threshold or empty-queue condition.
     */
    DONE
}
