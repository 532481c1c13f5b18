package com.ryuqq.fanout.core.spi;

/**
 * Combined publish/subscribe SPI.
 *
 * <p>An implementation has no global state: producers and consumers of one logical bus must
 * share the same instance, passed explicitly to whoever needs it.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish, subscribe and close may be called concurrently</li>
 *   <li>At-least-once delivery: nacked copies are redelivered</li>
 *   <li>No lost registration: a subscriber sees every message published after it is registered</li>
 *   <li>Idempotent close: repeated calls are no-ops</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public interface PubSub extends Publisher, Subscriber, AutoCloseable {

    /**
     * Publishing view of this instance.
     *
     * @return this instance as a {@link Publisher}
     */
    default Publisher publisher() {
        return this;
    }

    /**
     * Subscribing view of this instance.
     *
     * @return this instance as a {@link Subscriber}
     */
    default Subscriber subscriber() {
        return this;
    }

    /**
     * Stops delivery and closes every subscriber stream.
     *
     * <p>Blocked publishers are released; messages they were delivering are discarded.</p>
     */
    @Override
    void close();
}
