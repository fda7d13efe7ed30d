package com.nayem.beacon.pubsub;

/**
 * An event read from a pub/sub subscription.
 *
 * @param type    the kind of event
 * @param channel the channel the event belongs to
 * @param payload the message body, {@code null} for subscription events
 */
public record PubSubMessage(Type type, String channel, String payload) {

    public enum Type {
        SUBSCRIBE,
        UNSUBSCRIBE,
        MESSAGE
    }

    public static PubSubMessage subscribed(String channel) {
        return new PubSubMessage(Type.SUBSCRIBE, channel, null);
    }

    public static PubSubMessage unsubscribed(String channel) {
        return new PubSubMessage(Type.UNSUBSCRIBE, channel, null);
    }

    public static PubSubMessage message(String channel, String payload) {
        return new PubSubMessage(Type.MESSAGE, channel, payload);
    }

    public boolean isSubscribeConfirmation() {
        return type == Type.SUBSCRIBE;
    }
}
