package com.tierstore.runtime;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with capped exponential backoff. Interruption during backoff or before an attempt
 * ends the run with {@link CancellationException}; the interrupt flag stays set.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
        this.maxBackoff = maxBackoff == null ? this.initialBackoff : maxBackoff;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(2));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String operation, Callable<T> call, Predicate<Exception> retryable)
            throws RetryExhaustedException {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(operation + " cancelled before attempt " + attempt);
            }
            try {
                return call.call();
            } catch (CancellationException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw cancelled(operation, e);
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e) || attempt == maxAttempts) {
                    throw new RetryExhaustedException(operation, attempt, e);
                }
                long backoffMs = backoffMillis(attempt);
                log.warn("retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoffMs, e.getMessage());
                sleep(operation, backoffMs);
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, last);
    }

    long backoffMillis(int attempt) {
        long base = initialBackoff.toMillis();
        long cap = maxBackoff.toMillis();
        long delay = base << Math.min(attempt - 1, 20);
        return Math.min(delay, Math.max(cap, base));
    }

    private static void sleep(String operation, long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(operation, e);
        }
    }

    private static CancellationException cancelled(String operation, InterruptedException cause) {
        CancellationException cancellation = new CancellationException(operation + " interrupted");
        cancellation.initCause(cause);
        return cancellation;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                '}';
    }
}
