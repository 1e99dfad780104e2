package com.williamcallahan.statuteindex.support;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry utility with exponential backoff for transient upstream failures.
 *
 * <p>An attempt is retried when it throws an exception the classifier deems transient, or when it
 * returns a result the caller marks as retryable (for example an HTTP 429). When attempts run out
 * the last retryable result is returned as-is and the last transient exception is rethrown.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Backoff multiplier between attempts. */
    public static final double DEFAULT_MULTIPLIER = 2.0;
    /** Maximum backoff duration to prevent excessive waits. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Pauses the calling thread; replaced in tests to keep them fast.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Executes an operation with retry.
     *
     * @param operation the operation to execute
     * @param retryableResult true for results that should be retried while attempts remain
     * @param transientFailure true for exceptions that should be retried while attempts remain
     * @param operationName name for logging purposes
     * @param maxAttempts maximum number of attempts, at least one
     * @param initialBackoff wait before the second attempt; doubles afterwards up to {@link #MAX_BACKOFF}
     * @param sleeper how to wait between attempts
     * @param <T> return type
     * @return the first non-retryable result, or the last result when attempts run out
     * @throws RuntimeException the last failure when it is not transient or attempts run out
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            Predicate<T> retryableResult,
            Predicate<RuntimeException> transientFailure,
            String operationName,
            int maxAttempts,
            Duration initialBackoff,
            Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Duration currentBackoff = initialBackoff;

        for (int attempt = 1; ; attempt++) {
            boolean lastAttempt = attempt >= maxAttempts;
            try {
                T result = operation.get();
                if (lastAttempt || !retryableResult.test(result)) {
                    return result;
                }
                log.warn("{} returned a retryable result on attempt {}/{}, retrying in {}ms",
                        operationName, attempt, maxAttempts, currentBackoff.toMillis());
            } catch (RuntimeException exception) {
                if (!transientFailure.test(exception)) {
                    log.warn("{} failed with non-transient error on attempt {}/{}, not retrying",
                            operationName, attempt, maxAttempts);
                    throw exception;
                }
                if (lastAttempt) {
                    log.error("{} failed after {} attempts, giving up", operationName, maxAttempts);
                    throw exception;
                }
                log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                        operationName, attempt, maxAttempts, currentBackoff.toMillis());
            }

            try {
                sleeper.sleep(currentBackoff);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Retry interrupted", interrupted);
            }

            long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
            currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
        }
    }
}
