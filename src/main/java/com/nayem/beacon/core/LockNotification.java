package com.nayem.beacon.core;

/**
 * Payload published on a lock channel, serialized as
 * {@code {"action":"acquire"}} or {@code {"action":"release"}}.
 * <p>
 * Receivers never interpret it; only the publish receiver count matters.
 * </p>
 */
public record LockNotification(LockAction action) {

    public static LockNotification acquire() {
        return new LockNotification(LockAction.ACQUIRE);
    }

    public static LockNotification release() {
        return new LockNotification(LockAction.RELEASE);
    }
}
