package com.nayem.beacon.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof of a successful acquisition. Closing the handle releases the lock,
 * so the lock is scoped with try-with-resources:
 *
 * <pre>{@code
 * try (LockHandle handle = lock.acquire()) {
 *     // exclusive section
 * }
 * }</pre>
 *
 * A handle belongs to the hold it was issued for. Once that hold has ended,
 * closing the handle does not touch a later hold of the same lock.
 */
public final class LockHandle implements AutoCloseable {

    private final LockBase lock;
    private final Object hold;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LockHandle(LockBase lock, Object hold) {
        this.lock = lock;
        this.hold = hold;
    }

    public String getName() {
        return lock.getName();
    }

    /**
     * Returns true while the handle is open and the lock still holds the
     * resource. Turns false if the holding connection was lost.
     */
    public boolean isValid() {
        return !closed.get() && lock.isHeld(hold);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            lock.release(hold);
        }
    }
}
