/**
 * In-process PubSub engine.
 *
 * <p>This package contains {@link com.ryuqq.fanout.adapter.inmemory.pubsub.InMemoryPubSub}, the
 * in-memory implementation of the {@link com.ryuqq.fanout.core.spi.PubSub} SPI, and its
 * package-private building blocks.</p>
 *
 * <h2>Architecture</h2>
 * <ul>
 *   <li><strong>SubscriberRegistry:</strong> topic → subscribers, one {@link java.util.concurrent.locks.ReentrantReadWriteLock}</li>
 *   <li><strong>SubscriberChannel:</strong> bounded per-subscriber channel, the consumer's {@link com.ryuqq.fanout.core.spi.MessageStream}</li>
 *   <li><strong>Subscription:</strong> subscriber id, topic, channel and live-start offset</li>
 *   <li><strong>InMemoryPubSubConfig:</strong> channel capacity, send timeout, persistent mode</li>
 * </ul>
 *
 * <h2>Message Lifecycle</h2>
 * <pre>
 * ┌─────────────┐
 * │   publish   │
 * └──────┬──────┘
 *        │  (persistent) append to RetentionStore
 *        ▼
 * ┌─────────────┐
 * │ copy → send │ ──► timeout ─────────────────────► [SendTimeoutException]
 * └──────┬──────┘
 *        │
 *        ├──► ack() ─────────────────────────────► [next subscriber]
 *        │
 *        ├──► nack() ────────────────────────────► [fresh copy, send again]
 *        │
 *        └──► close() ───────────────────────────► [discarded]
 * </pre>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li><strong>Single JVM:</strong> no cross-process delivery</li>
 *   <li><strong>No Unsubscribe:</strong> subscribers live until the PubSub is closed</li>
 *   <li><strong>Head-of-line Blocking:</strong> a subscriber that never acks stalls later subscribers of the same publish</li>
 * </ul>
 *
 * @see com.ryuqq.fanout.core.spi.PubSub
 * @author Fanout Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.adapter.inmemory.pubsub;
