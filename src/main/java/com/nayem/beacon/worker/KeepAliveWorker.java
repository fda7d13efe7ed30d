package com.nayem.beacon.worker;

import com.nayem.beacon.pubsub.PubSubSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a held subscription alive in the background.
 * <p>
 * The worker drains every event arriving on the subscription without handling
 * it, and pings the connection once per health-check interval so a dead peer
 * is noticed on both sides. It owns a single daemon thread.
 * </p>
 * <p>
 * {@link #stop()} blocks until the loop has exited, so once it returns the
 * worker no longer touches the subscription.
 * </p>
 */
public class KeepAliveWorker {
    private static final Logger log = LoggerFactory.getLogger(KeepAliveWorker.class);

    private final String channel;
    private final PubSubSubscription subscription;
    private final Duration pollInterval;
    private final Duration healthCheckInterval;
    private final Runnable onLost;
    private final ExecutorService executor;
    private final Duration stopTimeout;

    private Future<?> task;
    private volatile boolean running;
    private volatile boolean lost;

    /**
     * @param channel             channel the subscription holds, used for logging
     *                            and the thread name
     * @param subscription        the held subscription
     * @param pollInterval        longest single wait for an event
     * @param healthCheckInterval time between pings, {@link Duration#ZERO} to
     *                            disable
     * @param threadNamePrefix    prefix of the worker thread name
     * @param onLost              invoked from the worker thread when the
     *                            subscription fails, may be {@code null}
     */
    public KeepAliveWorker(String channel, PubSubSubscription subscription, Duration pollInterval,
            Duration healthCheckInterval, String threadNamePrefix, Runnable onLost) {
        this.channel = channel;
        this.subscription = subscription;
        this.pollInterval = pollInterval;
        this.healthCheckInterval = healthCheckInterval;
        this.onLost = onLost;
        // A single poll plus one ping bounds how long the loop can take to notice the stop.
        this.stopTimeout = pollInterval.multipliedBy(2).plusSeconds(1);
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadNamePrefix + channel);
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (task != null) {
            throw new IllegalStateException("Keep-alive worker for channel '" + channel + "' already started");
        }
        running = true;
        task = executor.submit(this::runLoop);
    }

    private void runLoop() {
        long lastHealthCheck = System.nanoTime();
        while (running) {
            try {
                subscription.nextMessage(pollInterval)
                        .ifPresent(message -> log.trace("Drained {} event on channel '{}'", message.type(), channel));

                if (!healthCheckInterval.isZero()
                        && System.nanoTime() - lastHealthCheck >= healthCheckInterval.toNanos()) {
                    subscription.ping();
                    lastHealthCheck = System.nanoTime();
                }
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                lost = true;
                running = false;
                log.warn("Keep-alive for channel '{}' lost its subscription: {}", channel, e.getMessage());
                if (onLost != null) {
                    onLost.run();
                }
            }
        }
        log.debug("Keep-alive for channel '{}' stopped", channel);
    }

    /**
     * Stops the worker and waits for its loop to exit. Idempotent.
     */
    public void stop() {
        Future<?> current;
        synchronized (this) {
            current = task;
        }
        running = false;
        if (current == null) {
            executor.shutdown();
            return;
        }
        try {
            current.get();
        } catch (InterruptedException e) {
            current.cancel(true);
            awaitExit();
            Thread.currentThread().interrupt();
        } catch (CancellationException e) {
            log.debug("Keep-alive for channel '{}' was cancelled", channel);
        } catch (ExecutionException e) {
            log.warn("Keep-alive for channel '{}' failed", channel, e.getCause());
        } finally {
            executor.shutdown();
        }
    }

    private void awaitExit() {
        executor.shutdown();
        boolean exited = false;
        boolean interrupted = false;
        long deadline = System.nanoTime() + stopTimeout.toNanos();
        while (!exited) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                exited = executor.awaitTermination(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (!exited) {
            log.warn("Keep-alive for channel '{}' did not exit within {}ms", channel, stopTimeout.toMillis());
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns true while the loop runs and the subscription has not failed.
     */
    public boolean isRunning() {
        return running;
    }

    public boolean isLost() {
        return lost;
    }
}
