package com.spinbet.ledgersync.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry utility for capped exponential backoff.
 */
public final class RetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(RetryUtils.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private RetryUtils() {
    }

    /**
     * Delay before the given attempt: {@code min(base * 2^(attempt-1), cap)}.
     *
     * @param attempt     1-based attempt number
     * @param baseDelayMs delay of the first attempt
     * @param maxDelayMs  upper bound
     */
    public static long backoffDelay(int attempt, long baseDelayMs, long maxDelayMs) {
        int exponent = Math.max(0, attempt - 1);
        double delay = baseDelayMs * Math.pow(BACKOFF_MULTIPLIER, exponent);
        if (delay >= maxDelayMs) {
            return maxDelayMs;
        }
        return (long) delay;
    }

    /**
     * Execute with capped exponential backoff between attempts.
     *
     * @param task        task to execute
     * @param maxAttempts total number of attempts, at least one
     * @param baseDelayMs delay after the first failure
     * @param maxDelayMs  delay cap
     * @param sleeper     how to wait between attempts
     * @param <T>         return type
     * @return result of the first successful attempt
     * @throws Exception the last failure once all attempts are exhausted
     */
    public static <T> T executeWithRetry(RetryableTask<T> task,
                                         int maxAttempts,
                                         long baseDelayMs,
                                         long maxDelayMs,
                                         Sleeper sleeper) throws Exception {
        int attempts = Math.max(1, maxAttempts);
        Exception lastException = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return task.execute();
            } catch (Exception e) {
                lastException = e;
                if (attempt < attempts) {
                    long delay = backoffDelay(attempt, baseDelayMs, maxDelayMs);
                    logger.warn("Retry attempt {}/{} failed, waiting {}ms before retry: {}",
                            attempt, attempts, delay, e.getMessage());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        e.addSuppressed(interrupted);
                        throw e;
                    }
                } else {
                    logger.error("All {} attempts exhausted", attempts);
                }
            }
        }
        throw lastException;
    }

    @FunctionalInterface
    public interface RetryableTask<T> {
        T execute() throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD_SLEEP = Thread::sleep;

        void sleep(long millis) throws InterruptedException;
    }
}
