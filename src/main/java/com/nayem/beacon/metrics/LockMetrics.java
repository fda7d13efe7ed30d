package com.nayem.beacon.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for lock acquisition and holding.
 * <p>
 * A {@code null} registry turns every recording method into a no-op.
 * </p>
 */
public class LockMetrics {

    private final Counter acquiredCounter;
    private final Counter contentionCounter;
    private final Counter unavailableCounter;
    private final Counter timeoutCounter;
    private final Counter lostCounter;
    private final Timer acquireTimer;
    private final Timer heldTimer;

    public LockMetrics(MeterRegistry registry) {
        if (registry != null) {
            this.acquiredCounter = Counter.builder("beacon.lock.acquired")
                    .description("Number of successful lock acquisitions")
                    .register(registry);

            this.contentionCounter = Counter.builder("beacon.lock.contention")
                    .description("Number of acquisition attempts that observed another subscriber")
                    .register(registry);

            this.unavailableCounter = Counter.builder("beacon.lock.unavailable")
                    .description("Number of fail-when-locked acquisitions rejected")
                    .register(registry);

            this.timeoutCounter = Counter.builder("beacon.lock.timeout")
                    .description("Number of acquisitions that exceeded their timeout")
                    .register(registry);

            this.lostCounter = Counter.builder("beacon.lock.lost")
                    .description("Number of held locks whose subscription connection dropped")
                    .register(registry);

            this.acquireTimer = Timer.builder("beacon.lock.acquire.duration")
                    .description("Time spent acquiring a lock, including retries")
                    .register(registry);

            this.heldTimer = Timer.builder("beacon.lock.held.duration")
                    .description("Time a lock was held before release")
                    .register(registry);
        } else {
            this.acquiredCounter = null;
            this.contentionCounter = null;
            this.unavailableCounter = null;
            this.timeoutCounter = null;
            this.lostCounter = null;
            this.acquireTimer = null;
            this.heldTimer = null;
        }
    }

    public void recordAcquired(Duration waited) {
        if (acquiredCounter != null) {
            acquiredCounter.increment();
            acquireTimer.record(waited);
        }
    }

    public void recordContention() {
        if (contentionCounter != null) {
            contentionCounter.increment();
        }
    }

    public void recordUnavailable() {
        if (unavailableCounter != null) {
            unavailableCounter.increment();
        }
    }

    public void recordTimeout() {
        if (timeoutCounter != null) {
            timeoutCounter.increment();
        }
    }

    public void recordLost() {
        if (lostCounter != null) {
            lostCounter.increment();
        }
    }

    public void recordHeld(Duration held) {
        if (heldTimer != null) {
            heldTimer.record(held);
        }
    }

    public static LockMetrics noOp() {
        return new LockMetrics(null);
    }
}
