package com.agrigrid.core.events;

/**
 * Marker for the typed body of a {@link ChannelMessage}. Each topic carries exactly one
 * payload type, see {@link Topics}.
 */
public interface MessagePayload {
}
