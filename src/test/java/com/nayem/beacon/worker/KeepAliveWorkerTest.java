package com.nayem.beacon.worker;

import com.nayem.beacon.pubsub.InMemoryPubSubBroker;
import com.nayem.beacon.pubsub.InMemoryPubSubConnection;
import com.nayem.beacon.pubsub.PubSubException;
import com.nayem.beacon.pubsub.PubSubMessage;
import com.nayem.beacon.pubsub.PubSubSubscription;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeepAliveWorker:
 * - draining held subscriptions
 * - synchronous stop
 * - health checks and loss detection
 */
public class KeepAliveWorkerTest {

    @Test
    void testDrainsMessagesWhileRunning() throws Exception {
        InMemoryPubSubBroker broker = new InMemoryPubSubBroker();
        InMemoryPubSubConnection connection = broker.connect();
        PubSubSubscription subscription = connection.openSubscription();
        subscription.subscribe("jobs:42");

        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", subscription, Duration.ofMillis(10),
                Duration.ZERO, "test-keepalive-", null);
        worker.start();
        connection.publish("jobs:42", "{\"action\":\"acquire\"}");
        Thread.sleep(100);

        assertTrue(worker.isRunning());
        assertEquals(Optional.empty(), subscription.nextMessage(Duration.ofMillis(1)));

        worker.stop();
        assertFalse(worker.isRunning());
        assertEquals(1, broker.subscriberCount("jobs:42"), "stopping the worker does not unsubscribe");
    }

    @Test
    void testStopBlocksUntilLoopExits() throws Exception {
        CountDownLatch polling = new CountDownLatch(1);
        AtomicBoolean pollInFlight = new AtomicBoolean(false);
        PubSubSubscription slowSubscription = new StubSubscription() {
            @Override
            public Optional<PubSubMessage> nextMessage(Duration timeout) {
                pollInFlight.set(true);
                polling.countDown();
                sleep(timeout);
                pollInFlight.set(false);
                return Optional.empty();
            }
        };

        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", slowSubscription, Duration.ofMillis(200),
                Duration.ZERO, "test-keepalive-", null);
        worker.start();
        assertTrue(polling.await(1, TimeUnit.SECONDS));

        worker.stop();

        assertFalse(pollInFlight.get(), "stop returned while the loop was still polling");
        assertFalse(worker.isRunning());
    }

    @Test
    void testInterruptedStopStillWaitsForLoopExit() throws Exception {
        CountDownLatch polling = new CountDownLatch(1);
        AtomicBoolean pollInFlight = new AtomicBoolean(false);
        PubSubSubscription stubbornSubscription = new StubSubscription() {
            @Override
            public Optional<PubSubMessage> nextMessage(Duration timeout) {
                pollInFlight.set(true);
                polling.countDown();
                long deadline = System.nanoTime() + Duration.ofMillis(300).toNanos();
                while (System.nanoTime() < deadline) {
                    Thread.onSpinWait();
                }
                pollInFlight.set(false);
                return Optional.empty();
            }
        };

        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", stubbornSubscription, Duration.ofMillis(300),
                Duration.ZERO, "test-keepalive-", null);
        worker.start();
        assertTrue(polling.await(1, TimeUnit.SECONDS));

        AtomicBoolean inFlightAfterStop = new AtomicBoolean(true);
        AtomicBoolean interruptRestored = new AtomicBoolean(false);
        Thread stopper = new Thread(() -> {
            Thread.currentThread().interrupt();
            worker.stop();
            inFlightAfterStop.set(pollInFlight.get());
            interruptRestored.set(Thread.currentThread().isInterrupted());
        });
        stopper.start();
        stopper.join(5000);

        assertFalse(stopper.isAlive());
        assertFalse(inFlightAfterStop.get(), "stop returned while the loop was still polling");
        assertTrue(interruptRestored.get());
        assertFalse(worker.isRunning());
    }

    @Test
    void testStopIsIdempotent() {
        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", new StubSubscription(), Duration.ofMillis(5),
                Duration.ZERO, "test-keepalive-", null);
        worker.start();

        worker.stop();
        assertDoesNotThrow(worker::stop);
    }

    @Test
    void testStopBeforeStart() {
        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", new StubSubscription(), Duration.ofMillis(5),
                Duration.ZERO, "test-keepalive-", null);

        assertDoesNotThrow(worker::stop);
    }

    @Test
    void testDoubleStartRejected() {
        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", new StubSubscription(), Duration.ofMillis(5),
                Duration.ZERO, "test-keepalive-", null);
        worker.start();
        try {
            assertThrows(IllegalStateException.class, worker::start);
        } finally {
            worker.stop();
        }
    }

    @Test
    void testPingsOnHealthCheckInterval() throws Exception {
        AtomicInteger pings = new AtomicInteger();
        PubSubSubscription subscription = new StubSubscription() {
            @Override
            public void ping() {
                pings.incrementAndGet();
            }
        };

        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", subscription, Duration.ofMillis(5),
                Duration.ofMillis(20), "test-keepalive-", null);
        worker.start();
        Thread.sleep(200);
        worker.stop();

        assertTrue(pings.get() >= 2, "expected periodic pings, got " + pings.get());
    }

    @Test
    void testSubscriptionFailureMarksLost() throws Exception {
        CountDownLatch lostSignal = new CountDownLatch(1);
        PubSubSubscription failing = new StubSubscription() {
            @Override
            public Optional<PubSubMessage> nextMessage(Duration timeout) {
                throw new PubSubException("Connection terminated");
            }
        };

        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", failing, Duration.ofMillis(5),
                Duration.ZERO, "test-keepalive-", lostSignal::countDown);
        worker.start();

        assertTrue(lostSignal.await(1, TimeUnit.SECONDS));
        worker.stop();
        assertTrue(worker.isLost());
        assertFalse(worker.isRunning());
    }

    @Test
    void testWorkerThreadIsNamedAndDaemon() throws Exception {
        AtomicBoolean daemon = new AtomicBoolean();
        CountDownLatch seen = new CountDownLatch(1);
        String[] name = new String[1];
        PubSubSubscription subscription = new StubSubscription() {
            @Override
            public Optional<PubSubMessage> nextMessage(Duration timeout) {
                name[0] = Thread.currentThread().getName();
                daemon.set(Thread.currentThread().isDaemon());
                seen.countDown();
                return super.nextMessage(timeout);
            }
        };

        KeepAliveWorker worker = new KeepAliveWorker("jobs:42", subscription, Duration.ofMillis(5),
                Duration.ZERO, "test-keepalive-", null);
        worker.start();
        assertTrue(seen.await(1, TimeUnit.SECONDS));
        worker.stop();

        assertEquals("test-keepalive-jobs:42", name[0]);
        assertTrue(daemon.get());
    }

    static class StubSubscription implements PubSubSubscription {
        @Override
        public void subscribe(String channel) {
        }

        @Override
        public void unsubscribe(String channel) {
        }

        @Override
        public Optional<PubSubMessage> nextMessage(Duration timeout) {
            sleep(timeout);
            return Optional.empty();
        }

        @Override
        public void ping() {
        }

        @Override
        public void close() {
        }

        static void sleep(Duration duration) {
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
