package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.contract.Message;
import com.ryuqq.fanout.core.exception.SendTimeoutException;

/**
 * Publishing side of the PubSub SPI.
 *
 * <p><strong>Delivery Contract:</strong></p>
 * <ul>
 *   <li>Blocking: returns only after every subscriber registered at the time of the call
 *       has acknowledged each message, or was abandoned because the PubSub is closing</li>
 *   <li>Fan-out: every subscriber of the topic receives its own copy of each message</li>
 *   <li>Redelivery: a nacked copy is replaced by a fresh copy of the original message
 *       until it is acked</li>
 *   <li>Ordering: per topic and per subscriber, messages arrive in publish order</li>
 * </ul>
 *
 * <p><strong>Partial Failure:</strong> when an exception is thrown, messages already handed to
 * some subscribers are not rolled back and subsequent messages of the same call are not delivered.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public interface Publisher {

    /**
     * Publishes messages to every current subscriber of the topic.
     *
     * @param topic the topic to publish on
     * @param messages the messages to publish, delivered in the given order
     * @throws IllegalArgumentException if topic is blank or a message is null
     * @throws SendTimeoutException if a subscriber did not accept a copy within the send timeout
     * @throws com.ryuqq.fanout.core.exception.PubSubException if the calling thread is interrupted while waiting
     */
    void publish(String topic, Message... messages);
}
