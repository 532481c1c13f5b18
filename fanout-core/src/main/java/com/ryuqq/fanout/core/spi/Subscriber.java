package com.ryuqq.fanout.core.spi;

/**
 * Subscribing side of the PubSub SPI.
 *
 * <p>There are no consumer groups: every call to {@link #subscribe(String)} creates an
 * independent subscriber that receives every message published on the topic.
 * There is no unsubscribe; subscribers live until the PubSub is closed.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MessageStream stream = subscriber.subscribe("orders");
 *
 * Message message;
 * while ((message = stream.take()) != null) {
 *     try {
 *         handle(message);
 *         message.ack();
 *     } catch (Exception e) {
 *         message.nack();   // redelivered as a fresh copy
 *     }
 * }
 * // take() returned null: the PubSub was closed
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public interface Subscriber {

    /**
     * Registers a new subscriber on the topic.
     *
     * <p>The call returns immediately; registration (and replay, for implementations that
     * retain history) completes asynchronously.</p>
     *
     * @param topic the topic to subscribe to
     * @return the stream of messages delivered to this subscriber
     * @throws IllegalArgumentException if topic is null or blank
     */
    MessageStream subscribe(String topic);
}
