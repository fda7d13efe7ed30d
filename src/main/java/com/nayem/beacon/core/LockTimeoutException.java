package com.nayem.beacon.core;

import java.time.Duration;

/**
 * Thrown when a lock could not be acquired before its timeout elapsed.
 */
public class LockTimeoutException extends LockException {

    private final Duration waited;

    public LockTimeoutException(String channel, Duration waited) {
        super(channel, "Timeout acquiring lock on channel '" + channel + "' after " + waited.toMillis() + "ms");
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}
