package com.nayem.beacon.spring;

import com.nayem.beacon.core.LockHandle;
import com.nayem.beacon.core.PubSubLock;
import com.nayem.beacon.core.PubSubLockFactory;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

@Aspect
public class DistributedLockAspect {
    private static final Logger log = LoggerFactory.getLogger(DistributedLockAspect.class);

    private final PubSubLockFactory lockFactory;

    public DistributedLockAspect(PubSubLockFactory lockFactory) {
        this.lockFactory = lockFactory;
    }

    @Around(value = "@annotation(distributedLocked)", argNames = "joinPoint,distributedLocked")
    public Object handleLocked(ProceedingJoinPoint joinPoint, DistributedLocked distributedLocked) throws Throwable {
        Duration timeout = distributedLocked.timeoutMillis() < 0
                ? null
                : Duration.ofMillis(distributedLocked.timeoutMillis());

        try (PubSubLock lock = lockFactory.create(distributedLocked.value());
                LockHandle handle = lock.acquire(timeout, null, distributedLocked.failWhenLocked())) {
            log.info("Holding lock '{}' for {}", lock.getChannel(), joinPoint.getSignature().toShortString());
            return joinPoint.proceed();
        }
    }
}
