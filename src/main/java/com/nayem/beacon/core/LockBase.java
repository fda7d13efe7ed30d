package com.nayem.beacon.core;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Acquisition policy shared by lock implementations: a timeout, a fixed
 * interval between attempts, and an option to fail on the first contended
 * attempt.
 */
public abstract class LockBase implements AutoCloseable {

    protected final Duration timeout;
    protected final Duration checkInterval;
    protected final boolean failWhenLocked;

    protected LockBase(Duration timeout, Duration checkInterval, boolean failWhenLocked) {
        this.timeout = timeout;
        this.checkInterval = checkInterval;
        this.failWhenLocked = failWhenLocked;
    }

    /**
     * Acquires the lock with the configured policy.
     *
     * @return a handle that releases the lock when closed
     * @throws AlreadyLockedException if fail-when-locked is set and the lock is
     *                                held
     * @throws LockTimeoutException   if the timeout elapsed
     */
    public LockHandle acquire() {
        return acquire(null, null, null);
    }

    /**
     * Acquires the lock, overriding parts of the configured policy. {@code null}
     * arguments use the configured value.
     */
    public abstract LockHandle acquire(Duration timeout, Duration checkInterval, Boolean failWhenLocked);

    /**
     * Releases the lock. Safe to call any number of times.
     */
    public abstract void release();

    public abstract boolean isHeld();

    /**
     * Releases the lock only if {@code hold} is still the current hold.
     */
    protected abstract void release(Object hold);

    protected abstract boolean isHeld(Object hold);

    public abstract String getName();

    /**
     * Runs an action while holding the lock and returns its result.
     */
    public <R> R executeLocked(Supplier<R> action) {
        try (LockHandle handle = acquire()) {
            return action.get();
        }
    }

    public void runLocked(Runnable action) {
        try (LockHandle handle = acquire()) {
            action.run();
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public boolean isFailWhenLocked() {
        return failWhenLocked;
    }

    @Override
    public void close() {
        release();
    }
}
