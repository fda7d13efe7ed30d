package com.nayem.beacon.core;

/**
 * Base runtime exception for lock acquisition failures.
 */
public class LockException extends RuntimeException {

    private final String channel;

    public LockException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public LockException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    /**
     * Returns the channel of the lock that failed.
     */
    public String getChannel() {
        return channel;
    }
}
