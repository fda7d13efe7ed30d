package com.nayem.beacon.spring;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the annotated method while holding a distributed lock.
 * <p>
 * The lock channel is the configured {@code beacon.channel-prefix} followed by
 * {@link #value()}. The lock is released when the method returns or throws.
 * </p>
 *
 * <h3>Usage Example</h3>
 *
 * <pre>{@code
 * @Service
 * public class ReportService {
 *
 *     @DistributedLocked("reports:nightly")
 *     public void rebuildNightlyReport() {
 *         // runs on one instance at a time across the cluster
 *     }
 * }
 * }</pre>
 *
 * Acquisition failures surface to the caller as
 * {@link com.nayem.beacon.core.AlreadyLockedException} or
 * {@link com.nayem.beacon.core.LockTimeoutException}; the method body does not
 * run.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLocked {

    /**
     * Lock name, appended to the channel prefix.
     */
    String value();

    /**
     * Fail immediately if the lock is held instead of waiting.
     */
    boolean failWhenLocked() default false;

    /**
     * Maximum wait in milliseconds. Negative uses {@code beacon.timeout}.
     */
    long timeoutMillis() default -1;
}
