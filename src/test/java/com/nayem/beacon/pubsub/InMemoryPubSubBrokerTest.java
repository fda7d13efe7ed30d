package com.nayem.beacon.pubsub;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the broker semantics the lock protocol depends on.
 */
public class InMemoryPubSubBrokerTest {

    private static final Duration WAIT = Duration.ofMillis(50);

    private InMemoryPubSubBroker broker;

    @BeforeEach
    void setUp() {
        broker = new InMemoryPubSubBroker();
    }

    @Test
    void testSubscribeConfirmationPrecedesMessages() {
        InMemoryPubSubConnection connection = broker.connect();
        PubSubSubscription subscription = connection.openSubscription();

        subscription.subscribe("jobs:42");
        connection.publish("jobs:42", "hello");

        PubSubMessage first = subscription.nextMessage(WAIT).orElseThrow();
        PubSubMessage second = subscription.nextMessage(WAIT).orElseThrow();
        assertTrue(first.isSubscribeConfirmation());
        assertEquals("jobs:42", first.channel());
        assertEquals(PubSubMessage.message("jobs:42", "hello"), second);
    }

    @Test
    void testPublishReturnsReceiverCount() {
        InMemoryPubSubConnection publisher = broker.connect();
        assertEquals(0, publisher.publish("jobs:42", "x"));

        broker.connect().openSubscription().subscribe("jobs:42");
        assertEquals(1, publisher.publish("jobs:42", "x"));

        broker.connect().openSubscription().subscribe("jobs:42");
        assertEquals(2, publisher.publish("jobs:42", "x"));
        assertEquals(0, publisher.publish("jobs:other", "x"));
    }

    @Test
    void testUnsubscribeRemovesReceiver() {
        InMemoryPubSubConnection connection = broker.connect();
        PubSubSubscription subscription = connection.openSubscription();
        subscription.subscribe("jobs:42");

        subscription.unsubscribe("jobs:42");

        assertEquals(0, connection.publish("jobs:42", "x"));
        assertTrue(subscription.nextMessage(WAIT).orElseThrow().isSubscribeConfirmation());
        assertEquals(PubSubMessage.Type.UNSUBSCRIBE, subscription.nextMessage(WAIT).orElseThrow().type());
    }

    @Test
    void testTerminateDropsSubscriptionsAndFailsFurtherUse() {
        InMemoryPubSubConnection connection = broker.connect();
        PubSubSubscription subscription = connection.openSubscription();
        subscription.subscribe("jobs:42");

        connection.terminate();

        assertEquals(0, broker.subscriberCount("jobs:42"));
        assertFalse(connection.isOpen());
        assertThrows(PubSubException.class, () -> subscription.nextMessage(WAIT));
        assertThrows(PubSubException.class, subscription::ping);
        assertThrows(PubSubException.class, () -> connection.publish("jobs:42", "x"));
        assertDoesNotThrow(() -> subscription.unsubscribe("jobs:42"));
    }

    @Test
    void testCloseDropsSubscriptions() {
        InMemoryPubSubConnection connection = broker.connect();
        connection.openSubscription().subscribe("jobs:42");

        connection.close();

        assertEquals(0, broker.subscriberCount("jobs:42"));
        assertThrows(PubSubException.class, connection::openSubscription);
    }

    @Test
    void testNextMessageTimesOutEmpty() {
        PubSubSubscription subscription = broker.connect().openSubscription();

        assertEquals(Optional.empty(), subscription.nextMessage(Duration.ofMillis(10)));
    }
}
