package com.tierstore.model;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.tierstore.error.GatewayTimeoutException;

/**
 * Fair admission gate for one model capability. Callers beyond the permit count queue in arrival
 * order.
 */
public final class CapabilityLimiter {
    private final String capability;
    private final int permits;
    private final Semaphore semaphore;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger queued = new AtomicInteger();

    public CapabilityLimiter(String capability, int permits) {
        this.capability = capability;
        this.permits = permits;
        this.semaphore = new Semaphore(permits, true);
    }

    public <T> T run(Duration acquireTimeout, Callable<T> call) throws Exception {
        acquire(acquireTimeout);
        inFlight.incrementAndGet();
        try {
            return call.call();
        } finally {
            inFlight.decrementAndGet();
            semaphore.release();
        }
    }

    private void acquire(Duration acquireTimeout) {
        queued.incrementAndGet();
        try {
            if (acquireTimeout == null) {
                semaphore.acquire();
            } else if (!semaphore.tryAcquire(acquireTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new GatewayTimeoutException(capability, acquireTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("interrupted waiting for " + capability + " capacity");
            cancellation.initCause(e);
            throw cancellation;
        } finally {
            queued.decrementAndGet();
        }
    }

    public String capability() {
        return capability;
    }

    public int permits() {
        return permits;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int queued() {
        return queued.get();
    }

    @Override
    public String toString() {
        return "CapabilityLimiter{" +
                "capability=" + capability +
                ", permits=" + permits +
                ", inFlight=" + inFlight.get() +
                ", queued=" + queued.get() +
                '}';
    }
}
