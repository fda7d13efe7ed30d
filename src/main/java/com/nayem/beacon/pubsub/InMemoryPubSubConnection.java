package com.nayem.beacon.pubsub;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connection to an {@link InMemoryPubSubBroker}.
 */
public class InMemoryPubSubConnection implements PubSubConnection {

    private final InMemoryPubSubBroker broker;
    private final List<InMemoryPubSubSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    InMemoryPubSubConnection(InMemoryPubSubBroker broker) {
        this.broker = broker;
    }

    @Override
    public long publish(String channel, String payload) {
        ensureOpen();
        return broker.publish(channel, payload);
    }

    @Override
    public PubSubSubscription openSubscription() {
        ensureOpen();
        InMemoryPubSubSubscription subscription = new InMemoryPubSubSubscription(broker, subscriptions::remove);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Number of subscriptions opened on this connection and not yet closed.
     */
    public int openSubscriptionCount() {
        return subscriptions.size();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Simulates an abrupt loss of the connection: every subscription is dropped
     * by the broker and further use fails with {@link PubSubException}.
     */
    public void terminate() {
        open = false;
        for (InMemoryPubSubSubscription subscription : subscriptions) {
            subscription.terminate();
        }
        subscriptions.clear();
    }

    @Override
    public void close() {
        open = false;
        for (InMemoryPubSubSubscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }

    private void ensureOpen() {
        if (!open) {
            throw new PubSubException("Connection is closed");
        }
    }
}
