package com.agrigrid.core.events;

/**
 * An immutable message routed through the {@link MessageChannel}.
 *
 * @param topic     routing key, see {@link Topics}
 * @param senderId  id of the publishing agent
 * @param timestamp tick the message was created
 * @param payload   typed body for the topic
 */
public record ChannelMessage(
    String topic,
    String senderId,
    long timestamp,
    MessagePayload payload
) {

    /**
     * Returns the payload cast to the expected type, or null if it is of another type.
     */
    public <T extends MessagePayload> T payloadAs(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }
}
