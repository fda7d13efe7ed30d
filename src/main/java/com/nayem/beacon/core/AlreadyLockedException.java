package com.nayem.beacon.core;

/**
 * Thrown when a fail-when-locked acquisition finds the lock held.
 */
public class AlreadyLockedException extends LockException {

    public AlreadyLockedException(String channel) {
        super(channel, "Lock unavailable: channel '" + channel + "' is held by another subscriber");
    }
}
