package com.nayem.beacon.pubsub;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process pub/sub broker.
 * <p>
 * Mirrors the parts of Redis pub/sub the lock relies on: subscribe
 * confirmations, publish receiver counts, and subscriptions disappearing when
 * their connection terminates. All channel mutations and publishes are
 * serialized on the broker, like commands on a single Redis node.
 * </p>
 */
public class InMemoryPubSubBroker {

    private final Map<String, Set<InMemoryPubSubSubscription>> channels = new ConcurrentHashMap<>();

    public InMemoryPubSubConnection connect() {
        return new InMemoryPubSubConnection(this);
    }

    /**
     * Returns the number of subscriptions currently registered on a channel.
     */
    public synchronized int subscriberCount(String channel) {
        Set<InMemoryPubSubSubscription> subscribers = channels.get(channel);
        return subscribers == null ? 0 : subscribers.size();
    }

    synchronized long publish(String channel, String payload) {
        Set<InMemoryPubSubSubscription> subscribers = channels.get(channel);
        if (subscribers == null) {
            return 0;
        }
        PubSubMessage message = PubSubMessage.message(channel, payload);
        for (InMemoryPubSubSubscription subscriber : subscribers) {
            subscriber.deliver(message);
        }
        return subscribers.size();
    }

    synchronized void subscribe(InMemoryPubSubSubscription subscription, String channel) {
        channels.computeIfAbsent(channel, c -> new LinkedHashSet<>()).add(subscription);
        subscription.deliver(PubSubMessage.subscribed(channel));
    }

    synchronized void unsubscribe(InMemoryPubSubSubscription subscription, String channel) {
        Set<InMemoryPubSubSubscription> subscribers = channels.get(channel);
        if (subscribers != null) {
            subscribers.remove(subscription);
            if (subscribers.isEmpty()) {
                channels.remove(channel);
            }
        }
        subscription.deliver(PubSubMessage.unsubscribed(channel));
    }

    synchronized void drop(InMemoryPubSubSubscription subscription) {
        channels.values().forEach(subscribers -> subscribers.remove(subscription));
        channels.values().removeIf(Set::isEmpty);
    }
}
