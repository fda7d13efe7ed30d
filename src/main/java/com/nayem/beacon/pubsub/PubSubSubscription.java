package com.nayem.beacon.pubsub;

import java.time.Duration;
import java.util.Optional;

/**
 * A live subscription handle on a pub/sub connection.
 * <p>
 * Subscribe and unsubscribe confirmations are delivered through
 * {@link #nextMessage(Duration)} in the order the broker sends them, ahead of
 * any data message published after the subscription took effect.
 * </p>
 */
public interface PubSubSubscription extends AutoCloseable {

    /**
     * Subscribes to a channel. A {@link PubSubMessage.Type#SUBSCRIBE} event is
     * queued once the broker confirms.
     *
     * @param channel the channel name
     */
    void subscribe(String channel);

    /**
     * Unsubscribes from a channel. Safe to call for a channel that is not
     * subscribed.
     *
     * @param channel the channel name
     */
    void unsubscribe(String channel);

    /**
     * Waits for the next event on this subscription.
     *
     * @param timeout maximum time to wait
     * @return the event, or empty if nothing arrived in time
     * @throws PubSubException if the underlying connection is gone
     */
    Optional<PubSubMessage> nextMessage(Duration timeout);

    /**
     * Sends a health-check round trip over the subscription connection.
     *
     * @throws PubSubException if the underlying connection is gone
     */
    void ping();

    /**
     * Closes the subscription connection. Any channels still subscribed are
     * dropped by the broker.
     */
    @Override
    void close();
}
