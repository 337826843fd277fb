package com.gaia.adapter.executor;

import com.gaia.core.ExecutionResult;
import com.gaia.core.ExecutionStatus;
import com.gaia.core.TestExecutor;
import com.gaia.core.TestItem;
import com.gaia.exception.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds each delegate call with a timeout.
 * <p>
 * A timed-out call is cancelled and reported as a retryable failure
 * ({@code fatal=false}). Exceptions thrown by the delegate are rethrown unchanged.
 */
public class TimeoutTestExecutor implements TestExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutTestExecutor.class);

    private final TestExecutor delegate;
    private final Duration timeout;
    private final ExecutorService executorService;

    public TimeoutTestExecutor(TestExecutor delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        // Cached pool: a call that ignores cancellation does not block the next one
        this.executorService = Executors.newCachedThreadPool(new ExecutorThreadFactory());
    }

    @Override
    public ExecutionResult execute(TestItem item) throws Exception {
        Future<ExecutionResult> future = executorService.submit(() -> delegate.execute(item));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Item {} timed out after {} ms", item.getId(), timeout.toMillis());
            return ExecutionResult.builder()
                    .status(ExecutionStatus.FAILED)
                    .fatal(false)
                    .error("Execution timed out after " + timeout.toMillis() + " ms")
                    .detail("timeout", true)
                    .build();
        } catch (java.util.concurrent.ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw new ExecutionException("Executor failed for item " + item.getId(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        executorService.shutdownNow();
        if (delegate instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close delegate executor", e);
            }
        }
    }

    private static final class ExecutorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "gaia-executor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
