package com.nayem.beacon.core;

import java.time.Duration;

/**
 * Timing configuration shared by the locks a {@link PubSubLockFactory} builds.
 *
 * @param timeout             maximum wait in {@code acquire()}, {@code null} to
 *                            wait forever
 * @param checkInterval       sleep between acquisition attempts
 * @param failWhenLocked      fail on the first contended attempt instead of
 *                            retrying
 * @param threadSleepTime     polling granularity of the keep-alive worker, must
 *                            be smaller than {@code checkInterval}
 * @param unavailableTimeout  maximum wait for a pub/sub response in one attempt
 * @param healthCheckInterval ping period of the keep-alive worker, zero to
 *                            disable
 * @param threadNamePrefix    prefix of keep-alive thread names
 */
public record LockOptions(Duration timeout, Duration checkInterval, boolean failWhenLocked,
        Duration threadSleepTime, Duration unavailableTimeout, Duration healthCheckInterval,
        String threadNamePrefix) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMillis(250);
    public static final Duration DEFAULT_THREAD_SLEEP_TIME = Duration.ofMillis(100);
    public static final Duration DEFAULT_UNAVAILABLE_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(10);
    public static final String DEFAULT_THREAD_NAME_PREFIX = "beacon-keepalive-";

    public LockOptions {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        requirePositive(checkInterval, "checkInterval");
        requirePositive(threadSleepTime, "threadSleepTime");
        requirePositive(unavailableTimeout, "unavailableTimeout");
        if (healthCheckInterval == null || healthCheckInterval.isNegative()) {
            throw new IllegalArgumentException("healthCheckInterval must be >= 0");
        }
        if (threadSleepTime.compareTo(checkInterval) >= 0) {
            throw new IllegalArgumentException("threadSleepTime (" + threadSleepTime.toMillis()
                    + "ms) must be smaller than checkInterval (" + checkInterval.toMillis() + "ms)");
        }
        if (threadNamePrefix == null) {
            throw new IllegalArgumentException("threadNamePrefix must not be null");
        }
    }

    /**
     * Default options: 5s timeout, 250ms check interval, retrying, 100ms worker
     * polling, 1s unavailable timeout, 10s health checks.
     */
    public static LockOptions defaults() {
        return new LockOptions(DEFAULT_TIMEOUT, DEFAULT_CHECK_INTERVAL, false, DEFAULT_THREAD_SLEEP_TIME,
                DEFAULT_UNAVAILABLE_TIMEOUT, DEFAULT_HEALTH_CHECK_INTERVAL, DEFAULT_THREAD_NAME_PREFIX);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
