package com.nayem.beacon.pubsub;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Redis pub/sub connection backed by Lettuce.
 * <p>
 * Publishes go through one regular connection; every subscription gets its own
 * pub/sub connection, since a connection in subscribed mode cannot issue
 * {@code PUBLISH}.
 * </p>
 * <p>
 * The client must not reconnect automatically. A lock is held only while its
 * subscription stays registered on the server, and a silent reconnect would
 * resubscribe after another party already observed the channel as free.
 * {@link #createClient(RedisURI)} builds a client configured that way.
 * </p>
 */
public class LettucePubSubConnection implements PubSubConnection {

    private static final Logger log = LoggerFactory.getLogger(LettucePubSubConnection.class);

    private final RedisClient client;
    private final boolean ownsClient;
    private final StatefulRedisConnection<String, String> connection;
    private final List<LettucePubSubSubscription> subscriptions = new CopyOnWriteArrayList<>();

    /**
     * Opens a connection on a shared client. The client is not shut down by
     * {@link #close()}.
     */
    public LettucePubSubConnection(RedisClient client) {
        this(client, false);
    }

    private LettucePubSubConnection(RedisClient client, boolean ownsClient) {
        this.client = client;
        this.ownsClient = ownsClient;
        this.connection = client.connect();
    }

    /**
     * Opens a connection with a dedicated client that is shut down on close.
     */
    public static LettucePubSubConnection create(RedisURI uri) {
        return new LettucePubSubConnection(createClient(uri), true);
    }

    public static RedisClient createClient(RedisURI uri) {
        RedisClient client = RedisClient.create(uri);
        client.setOptions(ClientOptions.builder()
                .autoReconnect(false)
                .socketOptions(SocketOptions.builder().keepAlive(true).build())
                .build());
        return client;
    }

    @Override
    public long publish(String channel, String payload) {
        Long receivers = connection.sync().publish(channel, payload);
        return receivers == null ? 0 : receivers;
    }

    @Override
    public PubSubSubscription openSubscription() {
        LettucePubSubSubscription subscription = new LettucePubSubSubscription(client.connectPubSub(),
                subscriptions::remove);
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
        return connection.isOpen();
    }

    @Override
    public void close() {
        for (LettucePubSubSubscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        connection.close();
        if (ownsClient) {
            log.debug("Shutting down dedicated Redis client");
            client.shutdown();
        }
    }
}
