package com.nayem.beacon.pubsub;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

class InMemoryPubSubSubscription implements PubSubSubscription {

    private final InMemoryPubSubBroker broker;
    private final Consumer<InMemoryPubSubSubscription> onClose;
    private final BlockingQueue<PubSubMessage> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;
    private volatile boolean terminated;

    InMemoryPubSubSubscription(InMemoryPubSubBroker broker, Consumer<InMemoryPubSubSubscription> onClose) {
        this.broker = broker;
        this.onClose = onClose;
    }

    @Override
    public void subscribe(String channel) {
        ensureUsable();
        broker.subscribe(this, channel);
    }

    @Override
    public void unsubscribe(String channel) {
        if (closed) {
            return;
        }
        ensureUsable();
        broker.unsubscribe(this, channel);
    }

    @Override
    public Optional<PubSubMessage> nextMessage(Duration timeout) {
        ensureUsable();
        try {
            return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PubSubException("Interrupted while waiting for a message", e);
        }
    }

    @Override
    public void ping() {
        ensureUsable();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            broker.drop(this);
            queue.clear();
            onClose.accept(this);
        }
    }

    void terminate() {
        terminated = true;
        close();
    }

    void deliver(PubSubMessage message) {
        if (!closed) {
            queue.offer(message);
        }
    }

    private void ensureUsable() {
        if (terminated) {
            throw new PubSubException("Connection terminated");
        }
        if (closed) {
            throw new PubSubException("Subscription is closed");
        }
    }
}
