package com.tierstore.runtime;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void shouldRetryTransientFailuresUntilSuccess() throws Exception {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("flaky");
            }
            return "ok";
        }, e -> e instanceof IOException);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void shouldStopAtMaxAttemptsAndExposeLastFailure() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException exhausted = assertThrows(RetryExhaustedException.class,
                () -> policy.execute("op", () -> {
                    calls.incrementAndGet();
                    throw new IOException("down");
                }, e -> true));

        assertEquals(2, calls.get());
        assertEquals(2, exhausted.attempts());
        assertEquals("down", exhausted.last().getMessage());
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ZERO, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(RetryExhaustedException.class, () -> policy.execute("op", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad request");
        }, e -> e instanceof IOException));

        assertEquals(1, calls.get());
    }

    @Test
    void shouldCapExponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(6, Duration.ofMillis(200), Duration.ofSeconds(1));

        assertEquals(200, policy.backoffMillis(1));
        assertEquals(400, policy.backoffMillis(2));
        assertEquals(800, policy.backoffMillis(3));
        assertEquals(1000, policy.backoffMillis(4));
    }

    @Test
    void shouldSurfaceInterruptionAsCancellation() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO);
        try {
            Thread.currentThread().interrupt();
            assertThrows(CancellationException.class, () -> policy.execute("op", () -> "never", e -> true));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
