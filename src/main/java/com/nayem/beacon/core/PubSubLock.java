package com.nayem.beacon.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.beacon.metrics.LockMetrics;
import com.nayem.beacon.pubsub.PubSubConnection;
import com.nayem.beacon.pubsub.PubSubException;
import com.nayem.beacon.pubsub.PubSubMessage;
import com.nayem.beacon.pubsub.PubSubSubscription;
import com.nayem.beacon.worker.KeepAliveWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Distributed lock based on pub/sub subscriber counts.
 * <p>
 * Holding the lock means holding a live subscription on the lock channel. An
 * attempt subscribes, checks that nothing other than its own subscribe
 * confirmation is pending, then publishes an {@code acquire} notification. The
 * broker answers a publish with the number of subscribers that received it;
 * exactly one receiver means the caller is the only party subscribed, and the
 * attempt succeeds. Any other count, or any pending message, is contention.
 * </p>
 * <p>
 * While held, a {@link KeepAliveWorker} drains the subscription and pings the
 * connection. If the holder's process or connection dies the broker drops the
 * subscription at once and the next attempt of a waiter sees a single
 * receiver, with no lease to expire.
 * </p>
 * <p>
 * The probe is not atomic with the subscribe: two parties that subscribe and
 * publish inside the same narrow window can observe a transient state. The
 * protocol has no second validation round for that window, and deployments
 * that need strict exclusion under such races should have it reviewed before
 * relying on it.
 * </p>
 * <p>
 * Instances are not reentrant. Acquisition attempts and release are serialized
 * per instance.
 * </p>
 */
public class PubSubLock extends LockBase {
    private static final Logger log = LoggerFactory.getLogger(PubSubLock.class);

    private final String channel;
    private final Supplier<? extends PubSubConnection> connectionSupplier;
    private final boolean ownsConnection;
    private final Duration threadSleepTime;
    private final Duration unavailableTimeout;
    private final Duration healthCheckInterval;
    private final String threadNamePrefix;
    private final ObjectMapper objectMapper;
    private final LockMetrics metrics;

    private final ReentrantLock stateLock = new ReentrantLock();
    private PubSubConnection connection;
    private volatile PubSubSubscription subscription;
    private volatile KeepAliveWorker keepAliveWorker;
    private long heldSince;

    private PubSubLock(Builder builder) {
        super(builder.timeout, builder.checkInterval, builder.failWhenLocked);
        this.channel = builder.channel;
        this.connection = builder.connection;
        this.connectionSupplier = builder.connectionSupplier;
        this.ownsConnection = builder.connection == null;
        this.threadSleepTime = builder.threadSleepTime;
        this.unavailableTimeout = builder.unavailableTimeout;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.threadNamePrefix = builder.threadNamePrefix;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.metrics = builder.metrics != null ? builder.metrics : LockMetrics.noOp();
    }

    @Override
    public LockHandle acquire(Duration timeout, Duration checkInterval, Boolean failWhenLocked) {
        Duration effectiveTimeout = timeout != null ? timeout : this.timeout;
        Duration interval = checkInterval != null ? checkInterval : this.checkInterval;
        boolean failFast = failWhenLocked != null ? failWhenLocked : this.failWhenLocked;

        long start = System.nanoTime();
        while (true) {
            KeepAliveWorker hold = attempt();
            if (hold != null) {
                Duration waited = Duration.ofNanos(System.nanoTime() - start);
                metrics.recordAcquired(waited);
                log.debug("Acquired lock on channel '{}' after {}ms", channel, waited.toMillis());
                return new LockHandle(this, hold);
            }

            if (failFast) {
                metrics.recordUnavailable();
                log.debug("Lock on channel '{}' unavailable, failing without retry", channel);
                throw new AlreadyLockedException(channel);
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (effectiveTimeout != null && elapsed.compareTo(effectiveTimeout) > 0) {
                metrics.recordTimeout();
                log.debug("Timed out acquiring lock on channel '{}' after {}ms", channel, elapsed.toMillis());
                throw new LockTimeoutException(channel, elapsed);
            }

            try {
                TimeUnit.NANOSECONDS.sleep(interval.toNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockException(channel, "Interrupted while acquiring lock on channel '" + channel + "'", e);
            }
        }
    }

    /**
     * Makes a single acquisition attempt.
     *
     * @return true if the lock is now held by this instance
     * @throws IllegalStateException if this instance already holds the lock
     */
    public boolean tryAcquire() {
        return attempt() != null;
    }

    /**
     * Returns the keep-alive worker of the new hold, which identifies it, or
     * {@code null} if the attempt failed.
     */
    private KeepAliveWorker attempt() {
        stateLock.lock();
        try {
            KeepAliveWorker worker = keepAliveWorker;
            if (worker != null) {
                if (worker.isRunning()) {
                    throw new IllegalStateException("Lock on channel '" + channel + "' is already held by this instance");
                }
                log.debug("Previous hold on channel '{}' was lost, cleaning up before retrying", channel);
                releaseHeldState();
            }

            PubSubConnection conn = ensureConnection();
            try {
                if (subscription == null) {
                    subscription = conn.openSubscription();
                }
                subscription.subscribe(channel);

                Optional<PubSubMessage> pending = subscription.nextMessage(unavailableTimeout);
                if (pending.isPresent() && !pending.get().isSubscribeConfirmation()) {
                    // Any other pending event counts as contention; its action is not inspected.
                    log.debug("Contention on channel '{}': pending {} event", channel, pending.get().type());
                    metrics.recordContention();
                    discardSubscription();
                    return null;
                }

                long receivers = conn.publish(channel, serialize(LockNotification.acquire()));
                if (receivers == 1) {
                    return startKeepAliveWorker();
                }

                log.debug("Contention on channel '{}': {} receivers", channel, receivers);
                metrics.recordContention();
                discardSubscription();
                return null;
            } catch (RuntimeException e) {
                try {
                    discardSubscription();
                } catch (RuntimeException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Releases the lock: stops the keep-alive worker, drops the subscription,
     * publishes a {@code release} notification and closes an owned connection.
     * Every step is guarded, so repeated or partial releases never fail.
     */
    @Override
    public void release() {
        stateLock.lock();
        try {
            boolean wasActive = keepAliveWorker != null || subscription != null;
            releaseHeldState();

            if (connection != null) {
                if (wasActive) {
                    try {
                        connection.publish(channel, serialize(LockNotification.release()));
                    } catch (RuntimeException e) {
                        log.warn("Failed to publish release notification on channel '{}': {}", channel,
                                e.getMessage());
                    }
                }
                if (ownsConnection) {
                    try {
                        connection.close();
                    } catch (RuntimeException e) {
                        log.warn("Failed to close connection for channel '{}': {}", channel, e.getMessage());
                    }
                    connection = null;
                }
            }
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    protected void release(Object hold) {
        stateLock.lock();
        try {
            if (hold == null || hold != keepAliveWorker) {
                log.debug("Ignoring release of a stale hold on channel '{}'", channel);
                return;
            }
            release();
        } finally {
            stateLock.unlock();
        }
    }

    private void releaseHeldState() {
        KeepAliveWorker worker = keepAliveWorker;
        if (worker != null) {
            worker.stop();
            keepAliveWorker = null;
            metrics.recordHeld(Duration.ofNanos(System.nanoTime() - heldSince));
            log.debug("Released lock on channel '{}'", channel);
        }
        if (subscription != null) {
            try {
                discardSubscription();
            } catch (RuntimeException e) {
                log.warn("Failed to unsubscribe from channel '{}': {}", channel, e.getMessage());
            }
        }
    }

    @Override
    public boolean isHeld() {
        KeepAliveWorker worker = keepAliveWorker;
        return worker != null && worker.isRunning();
    }

    @Override
    protected boolean isHeld(Object hold) {
        KeepAliveWorker worker = keepAliveWorker;
        return worker != null && worker == hold && worker.isRunning();
    }

    public boolean isSubscriptionActive() {
        return subscription != null;
    }

    @Override
    public String getName() {
        return channel;
    }

    public String getChannel() {
        return channel;
    }

    public boolean ownsConnection() {
        return ownsConnection;
    }

    public Duration getThreadSleepTime() {
        return threadSleepTime;
    }

    public Duration getUnavailableTimeout() {
        return unavailableTimeout;
    }

    private PubSubConnection ensureConnection() {
        if (connection != null && ownsConnection && !connection.isOpen()) {
            log.debug("Owned connection for channel '{}' is closed, opening a new one", channel);
            connection.close();
            connection = null;
        }
        if (connection == null) {
            connection = connectionSupplier.get();
        }
        return connection;
    }

    private KeepAliveWorker startKeepAliveWorker() {
        KeepAliveWorker worker = new KeepAliveWorker(channel, subscription, threadSleepTime, healthCheckInterval,
                threadNamePrefix, this::onHoldLost);
        worker.start();
        keepAliveWorker = worker;
        heldSince = System.nanoTime();
        return worker;
    }

    private void onHoldLost() {
        metrics.recordLost();
        log.warn("Lock on channel '{}' is no longer held: subscription connection lost", channel);
    }

    private void discardSubscription() {
        PubSubSubscription current = subscription;
        subscription = null;
        if (current == null) {
            return;
        }
        try {
            current.unsubscribe(channel);
        } finally {
            current.close();
        }
    }

    private String serialize(LockNotification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new PubSubException("Failed to serialize lock notification", e);
        }
    }

    public static Builder builder(String channel) {
        return new Builder(channel);
    }

    /**
     * Builder for {@link PubSubLock}.
     * <p>
     * Exactly one of {@link #connection(PubSubConnection)} (borrowed, never
     * closed by the lock) or {@link #connectionSupplier(Supplier)} (owned,
     * opened on first attempt and closed on release) is required.
     * </p>
     */
    public static class Builder {
        private final String channel;
        private PubSubConnection connection;
        private Supplier<? extends PubSubConnection> connectionSupplier;
        private Duration timeout = LockOptions.DEFAULT_TIMEOUT;
        private Duration checkInterval = LockOptions.DEFAULT_CHECK_INTERVAL;
        private boolean failWhenLocked = false;
        private Duration threadSleepTime = LockOptions.DEFAULT_THREAD_SLEEP_TIME;
        private Duration unavailableTimeout = LockOptions.DEFAULT_UNAVAILABLE_TIMEOUT;
        private Duration healthCheckInterval = LockOptions.DEFAULT_HEALTH_CHECK_INTERVAL;
        private String threadNamePrefix = LockOptions.DEFAULT_THREAD_NAME_PREFIX;
        private ObjectMapper objectMapper;
        private LockMetrics metrics;

        private Builder(String channel) {
            this.channel = channel;
        }

        /**
         * Uses a caller-owned connection. The lock never closes it.
         */
        public Builder connection(PubSubConnection connection) {
            this.connection = connection;
            return this;
        }

        /**
         * Opens connections on demand. The lock owns and closes them.
         */
        public Builder connectionSupplier(Supplier<? extends PubSubConnection> connectionSupplier) {
            this.connectionSupplier = connectionSupplier;
            return this;
        }

        /**
         * Copies every timing setting from a {@link LockOptions}.
         */
        public Builder options(LockOptions options) {
            this.timeout = options.timeout();
            this.checkInterval = options.checkInterval();
            this.failWhenLocked = options.failWhenLocked();
            this.threadSleepTime = options.threadSleepTime();
            this.unavailableTimeout = options.unavailableTimeout();
            this.healthCheckInterval = options.healthCheckInterval();
            this.threadNamePrefix = options.threadNamePrefix();
            return this;
        }

        /**
         * Maximum wait in {@code acquire()}. {@code null} waits forever.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        public Builder failWhenLocked(boolean failWhenLocked) {
            this.failWhenLocked = failWhenLocked;
            return this;
        }

        /**
         * Polling granularity of the keep-alive worker. Must be smaller than the
         * check interval.
         */
        public Builder threadSleepTime(Duration threadSleepTime) {
            this.threadSleepTime = threadSleepTime;
            return this;
        }

        /**
         * Maximum wait for a pub/sub response within one attempt. Paid on every
         * attempt, so keep it near the broker round trip.
         */
        public Builder unavailableTimeout(Duration unavailableTimeout) {
            this.unavailableTimeout = unavailableTimeout;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder metrics(LockMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the channel is blank or a timing
         *                                  setting is invalid
         * @throws IllegalStateException    if neither or both connection sources
         *                                  are set
         */
        public PubSubLock build() {
            if (channel == null || channel.isBlank()) {
                throw new IllegalArgumentException("channel must not be blank");
            }
            if ((connection == null) == (connectionSupplier == null)) {
                throw new IllegalStateException("Exactly one of connection or connectionSupplier is required.");
            }
            // Validates the timing settings as a whole.
            new LockOptions(timeout, checkInterval, failWhenLocked, threadSleepTime, unavailableTimeout,
                    healthCheckInterval, threadNamePrefix);
            return new PubSubLock(this);
        }
    }
}
