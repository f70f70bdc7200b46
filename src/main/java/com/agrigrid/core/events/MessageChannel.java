package com.agrigrid.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Topic-addressed pub/sub channel with deferred, synchronous delivery.
 * <p>
 * {@link #publish} only enqueues. {@link #flush} drains everything queued so far in FIFO
 * order and hands each message to the topic's handlers in subscription order. Messages
 * published by a handler while a flush is running wait for the next flush.
 * A failing handler is logged and skipped; delivery is best-effort, not transactional.
 */
public class MessageChannel {

    private static final Logger log = LoggerFactory.getLogger(MessageChannel.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ChannelMessage>>> subscribers =
            new ConcurrentHashMap<>();

    private final Queue<ChannelMessage> queue = new ConcurrentLinkedQueue<>();

    /**
     * Enqueue a message for the next flush. Never blocks and never delivers immediately.
     *
     * @param topic   routing key
     * @param message the message; its own {@code topic} is informational
     */
    public void publish(String topic, ChannelMessage message) {
        ChannelMessage routed = topic.equals(message.topic())
                ? message
                : new ChannelMessage(topic, message.senderId(), message.timestamp(), message.payload());
        queue.add(routed);
        log.debug("Queued {} from {}", topic, message.senderId());
    }

    /**
     * Convenience for {@code publish(topic, new ChannelMessage(topic, senderId, tick, payload))}.
     */
    public void publish(String topic, String senderId, long tick, MessagePayload payload) {
        publish(topic, new ChannelMessage(topic, senderId, tick, payload));
    }

    /**
     * Register a handler for a topic. Registering the same handler instance twice
     * for one topic has no effect.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String topic, Consumer<ChannelMessage> handler) {
        boolean added = subscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).addIfAbsent(handler);
        if (added) {
            log.debug("Subscribed handler to {}", topic);
        }
        return () -> {
            CopyOnWriteArrayList<Consumer<ChannelMessage>> handlers = subscribers.get(topic);
            if (handlers != null) {
                handlers.remove(handler);
            }
        };
    }

    /**
     * Deliver every message queued before this call.
     *
     * @return number of messages drained
     */
    public int flush() {
        List<ChannelMessage> batch = new ArrayList<>(queue.size());
        ChannelMessage next;
        while ((next = queue.poll()) != null) {
            batch.add(next);
        }

        for (ChannelMessage message : batch) {
            List<Consumer<ChannelMessage>> handlers = subscribers.get(message.topic());
            if (handlers == null) continue;
            for (Consumer<ChannelMessage> handler : handlers) {
                deliverSafely(handler, message);
            }
        }
        if (!batch.isEmpty()) {
            log.debug("Flushed {} message(s), {} deferred to next flush", batch.size(), queue.size());
        }
        return batch.size();
    }

    public int pendingCount() {
        return queue.size();
    }

    public int subscriberCount(String topic) {
        var handlers = subscribers.get(topic);
        return handlers != null ? handlers.size() : 0;
    }

    /**
     * Drop all subscribers and all queued messages.
     */
    public void clear() {
        subscribers.clear();
        queue.clear();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ChannelMessage> handler, ChannelMessage message) {
        try {
            handler.accept(message);
        } catch (Exception e) {
            log.warn("Handler threw exception processing {} from {}: {}",
                    message.topic(), message.senderId(), e.getMessage(), e);
        }
    }
}
