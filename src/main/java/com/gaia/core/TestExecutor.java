package com.gaia.core;

/**
 * Performs a test item's action against the target application.
 * <p>
 * Implementations are expected to block on remote I/O. Any exception thrown
 * is converted by the scheduler into a failed, non-retried result.
 */
@FunctionalInterface
public interface TestExecutor {

    /**
     * Execute one test item.
     *
     * @param item Item to execute, never null
     * @return Execution outcome, never null
     * @throws Exception on unexpected failure
     */
    ExecutionResult execute(TestItem item) throws Exception;
}
