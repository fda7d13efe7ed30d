package com.nayem.beacon.pubsub;

/**
 * Raised when the messaging connection cannot complete an operation.
 */
public class PubSubException extends RuntimeException {

    public PubSubException(String message) {
        super(message);
    }

    public PubSubException(String message, Throwable cause) {
        super(message, cause);
    }
}
