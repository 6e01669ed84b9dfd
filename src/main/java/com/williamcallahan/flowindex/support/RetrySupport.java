package com.williamcallahan.flowindex.support;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff retry for operations that may fail transiently.
 *
 * <p>Only failures accepted by the supplied classifier are retried; anything else is rethrown
 * on the first attempt.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Default maximum attempts. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    /** Default initial backoff duration. */
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    /** Backoff multiplier between attempts. */
    public static final double DEFAULT_MULTIPLIER = 2.0;
    /** Upper bound on a single backoff wait. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Executes a supplier with default retry settings, retrying transient vector store failures.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param <T> return type
     * @return the result of the operation
     */
    public static <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(
                operation,
                operationName,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_INITIAL_BACKOFF,
                VectorStoreErrorClassifier::isTransientVectorStoreError);
    }

    /**
     * Executes a supplier with configurable retry.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param maxAttempts maximum number of attempts, at least 1
     * @param initialBackoff wait before the second attempt
     * @param isTransient decides whether a failure is worth another attempt
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException the last failure once attempts are exhausted, or the first non-transient one
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            String operationName,
            int maxAttempts,
            Duration initialBackoff,
            Predicate<Throwable> isTransient) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(isTransient, "isTransient");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }

        RuntimeException lastException = null;
        Duration currentBackoff = initialBackoff;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                lastException = exception;

                if (!isTransient.test(exception)) {
                    log.warn("{} failed with non-transient error on attempt {}/{}, not retrying",
                            operationName, attempt, maxAttempts);
                    throw exception;
                }

                if (attempt < maxAttempts) {
                    log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                            operationName, attempt, maxAttempts, currentBackoff.toMillis());
                    sleep(currentBackoff);
                    long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
                    currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
                } else {
                    log.error("{} failed after {} attempts, giving up", operationName, maxAttempts);
                }
            }
        }

        throw lastException;
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
