package com.nayem.beacon.pubsub;

import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

class LettucePubSubSubscription implements PubSubSubscription {

    private final StatefulRedisPubSubConnection<String, String> connection;
    private final Consumer<LettucePubSubSubscription> onClose;
    private final BlockingQueue<PubSubMessage> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LettucePubSubSubscription(StatefulRedisPubSubConnection<String, String> connection,
            Consumer<LettucePubSubSubscription> onClose) {
        this.connection = connection;
        this.onClose = onClose;
        this.connection.addListener(new RedisPubSubAdapter<String, String>() {
            @Override
            public void message(String channel, String message) {
                queue.offer(PubSubMessage.message(channel, message));
            }

            @Override
            public void subscribed(String channel, long count) {
                queue.offer(PubSubMessage.subscribed(channel));
            }

            @Override
            public void unsubscribed(String channel, long count) {
                queue.offer(PubSubMessage.unsubscribed(channel));
            }
        });
    }

    @Override
    public void subscribe(String channel) {
        connection.sync().subscribe(channel);
    }

    @Override
    public void unsubscribe(String channel) {
        if (connection.isOpen()) {
            connection.sync().unsubscribe(channel);
        }
    }

    @Override
    public Optional<PubSubMessage> nextMessage(Duration timeout) {
        PubSubMessage message;
        try {
            message = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PubSubException("Interrupted while waiting for a message", e);
        }
        if (message == null && !connection.isOpen()) {
            throw new PubSubException("Pub/sub connection is closed");
        }
        return Optional.ofNullable(message);
    }

    @Override
    public void ping() {
        connection.sync().ping();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                connection.close();
            } finally {
                onClose.accept(this);
            }
        }
    }
}
