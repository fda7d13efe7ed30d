package com.nayem.beacon.pubsub;

/**
 * A pub/sub capable client connection.
 */
public interface PubSubConnection extends AutoCloseable {

    /**
     * Publishes a payload on a channel.
     *
     * @param channel the channel name
     * @param payload the message body
     * @return the number of subscribers that received the message
     */
    long publish(String channel, String payload);

    /**
     * Opens a new subscription bound to this connection.
     *
     * @return the subscription
     */
    PubSubSubscription openSubscription();

    boolean isOpen();

    /**
     * Closes the connection and every subscription opened from it.
     */
    @Override
    void close();
}
