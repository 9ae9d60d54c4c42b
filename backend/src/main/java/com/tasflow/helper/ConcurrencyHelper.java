package com.tasflow.helper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;

import java.util.function.Supplier;

/**
 * Retries writes that lost an optimistic or pessimistic locking race.
 *
 * Only for secondary writes whose outcome the caller can live without; primary workflow
 * writes report a lost race to the caller instead of retrying.
 */
@Slf4j
public final class ConcurrencyHelper {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_INITIAL_DELAY_MS = 50;
    public static final long DEFAULT_MAX_DELAY_MS = 1000;

    private ConcurrencyHelper() {
    }

    /**
     * @return true when the action eventually succeeded
     */
    public static boolean executeWithRetry(Runnable action) {
        return executeWithRetry(action, DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    public static boolean executeWithRetry(Runnable action, int maxRetries, long initialDelayMs, long maxDelayMs) {
        return executeWithRetry(() -> {
            action.run();
            return Boolean.TRUE;
        }, Boolean.FALSE, maxRetries, initialDelayMs, maxDelayMs);
    }

    /**
     * @return the supplier's value, or {@code defaultValue} when every attempt lost its race
     */
    public static <T> T executeWithRetry(Supplier<T> func, T defaultValue) {
        return executeWithRetry(func, defaultValue, DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    public static <T> T executeWithRetry(Supplier<T> func, T defaultValue,
                                         int maxRetries, long initialDelayMs, long maxDelayMs) {
        long delay = initialDelayMs;
        for (int attempt = 0; ; attempt++) {
            try {
                return func.get();
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxRetries) {
                    log.warn("Giving up after {} retries: {}", maxRetries, e.getMessage());
                    return defaultValue;
                }
                log.debug("Concurrency conflict on attempt {}, retrying in {} ms", attempt + 1, delay);
            }

            try {
                Thread.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting to retry");
                return defaultValue;
            }
            delay = Math.min(delay * 2, maxDelayMs);
        }
    }
}
