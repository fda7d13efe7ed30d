package com.nayem.beacon.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Notification kinds published on a lock channel.
 */
public enum LockAction {
    ACQUIRE("acquire"),
    RELEASE("release");

    private final String value;

    LockAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
