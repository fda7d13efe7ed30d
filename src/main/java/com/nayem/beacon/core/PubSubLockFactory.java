package com.nayem.beacon.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.beacon.metrics.LockMetrics;
import com.nayem.beacon.pubsub.PubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Creates {@link PubSubLock}s with common options.
 * <p>
 * In shared mode every lock borrows a single connection opened on first use
 * and closed with the factory. Otherwise each lock owns a connection from the
 * supplier and closes it on release.
 * </p>
 */
public class PubSubLockFactory implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PubSubLockFactory.class);

    private final Supplier<? extends PubSubConnection> connectionSupplier;
    private final boolean sharedConnection;
    private final String channelPrefix;
    private final LockOptions options;
    private final ObjectMapper objectMapper;
    private final LockMetrics metrics;

    private PubSubConnection connection;

    public PubSubLockFactory(Supplier<? extends PubSubConnection> connectionSupplier, boolean sharedConnection,
            String channelPrefix, LockOptions options, ObjectMapper objectMapper, LockMetrics metrics) {
        this.connectionSupplier = connectionSupplier;
        this.sharedConnection = sharedConnection;
        this.channelPrefix = channelPrefix != null ? channelPrefix : "";
        this.options = options;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public PubSubLockFactory(Supplier<? extends PubSubConnection> connectionSupplier, LockOptions options) {
        this(connectionSupplier, true, "", options, new ObjectMapper(), LockMetrics.noOp());
    }

    /**
     * Creates a lock for a resource name. The channel is the configured prefix
     * followed by the name.
     */
    public PubSubLock create(String name) {
        PubSubLock.Builder builder = PubSubLock.builder(channelPrefix + name)
                .options(options)
                .objectMapper(objectMapper)
                .metrics(metrics);
        if (sharedConnection) {
            builder.connection(sharedConnection());
        } else {
            builder.connectionSupplier(connectionSupplier);
        }
        return builder.build();
    }

    public String getChannelPrefix() {
        return channelPrefix;
    }

    public LockOptions getOptions() {
        return options;
    }

    public boolean isSharedConnection() {
        return sharedConnection;
    }

    private synchronized PubSubConnection sharedConnection() {
        if (connection == null || !connection.isOpen()) {
            connection = connectionSupplier.get();
        }
        return connection;
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            log.info("Closing shared lock connection");
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close shared lock connection: {}", e.getMessage());
            }
            connection = null;
        }
    }
}
