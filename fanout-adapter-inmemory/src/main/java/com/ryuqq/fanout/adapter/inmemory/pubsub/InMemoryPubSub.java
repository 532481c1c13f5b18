package com.ryuqq.fanout.adapter.inmemory.pubsub;

import com.ryuqq.fanout.adapter.inmemory.store.RetentionStore;
import com.ryuqq.fanout.core.contract.AckState;
import com.ryuqq.fanout.core.contract.Message;
import com.ryuqq.fanout.core.exception.PubSubException;
import com.ryuqq.fanout.core.exception.SendTimeoutException;
import com.ryuqq.fanout.core.spi.MessageStream;
import com.ryuqq.fanout.core.spi.PubSub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;

/**
 * In-process implementation of the {@link PubSub} SPI.
 *
 * <p>Every subscriber of a topic receives its own copy of every message published on it.
 * There are no consumer groups and no global state: producers and consumers must share the
 * same instance.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Subscriber Registry:</strong> topic → subscribers in registration order, guarded by a read/write lock</li>
 *   <li><strong>Subscriber Channel:</strong> bounded channel per subscriber (capacity 0 = hand-off)</li>
 *   <li><strong>Retention Store:</strong> append-only per-topic log, persistent mode only</li>
 *   <li><strong>Shutdown Signal:</strong> {@link CompletableFuture} completed once by {@link #close()}</li>
 * </ul>
 *
 * <p><strong>Delivery Flow (per message, per subscriber, in registration order):</strong></p>
 * <pre>
 * loop:
 *   1. copy = original.copy()              (fresh ack state, derived context)
 *   2. channel.send(copy, sendTimeout)
 *        - timeout  → SendTimeoutException, publish aborts
 *        - closing  → discard, treated as delivered
 *   3. wait for ack / nack / closing
 *        - ack      → next subscriber
 *        - nack     → back to 1 with the original message
 *        - closing  → discard, treated as delivered
 *   4. cancel copy's context
 * </pre>
 *
 * <p>A subscriber that never acknowledges stalls delivery to the subscribers registered after it
 * for that publish call. Publish does not return until every subscriber present at the time of
 * the call has acked, been dropped by shutdown, or timed out.</p>
 *
 * <p><strong>Persistent Mode:</strong> published messages are appended to the
 * {@link RetentionStore} before delivery. A new subscriber first receives the retained history
 * and then live messages, with no duplicate and no gap, see {@link #registerSubscriber(Subscription)}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * PubSub pubSub = new InMemoryPubSub(InMemoryPubSubConfig.persistent(16, Duration.ofSeconds(5)));
 *
 * MessageStream stream = pubSub.subscribe("orders");
 * pubSub.publish("orders", Message.of("order-1", Payload.ofString("{}")));  // blocks until acked
 *
 * pubSub.close();
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class InMemoryPubSub implements PubSub {

    private static final AtomicInteger SUBSCRIBE_THREAD_SEQUENCE = new AtomicInteger();

    private final InMemoryPubSubConfig config;
    private final Logger log;

    private final SubscriberRegistry registry;
    private final RetentionStore retentionStore;
    private final ExecutorService subscribeExecutor;

    private final AtomicBoolean closed;
    private final CompletableFuture<Void> closing;

    /**
     * Creates a PubSub with default configuration (hand-off channels, no timeout, no retention).
     */
    public InMemoryPubSub() {
        this(new InMemoryPubSubConfig());
    }

    /**
     * Creates a PubSub.
     *
     * @param config engine configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryPubSub(InMemoryPubSubConfig config) {
        this(config, LoggerFactory.getLogger(InMemoryPubSub.class));
    }

    /**
     * Creates a PubSub that reports delivery events to the given logger.
     *
     * <p>The logger is a constructor collaborator rather than a {@code static final} field so
     * tests can verify delivery events against a mock.</p>
     *
     * @param config engine configuration
     * @param log logger receiving trace/debug delivery events
     * @throws IllegalArgumentException if config or log is null
     */
    public InMemoryPubSub(InMemoryPubSubConfig config, Logger log) {
        this(config, log, new RetentionStore());
    }

    /**
     * Full constructor. Package-private so tests can inject a mock logger together with a
     * spied or gated {@link RetentionStore}; production code goes through the public overloads.
     */
    InMemoryPubSub(InMemoryPubSubConfig config, Logger log, RetentionStore retentionStore) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (retentionStore == null) {
            throw new IllegalArgumentException("retentionStore cannot be null");
        }

        this.config = config;
        this.log = log;
        this.registry = new SubscriberRegistry();
        this.retentionStore = retentionStore;
        this.subscribeExecutor = Executors.newCachedThreadPool(subscribeThreadFactory());
        this.closed = new AtomicBoolean(false);
        this.closing = new CompletableFuture<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Persistent mode appends all messages first (retention write lock), then delivers</li>
     *   <li>Each message is delivered under the registry read lock</li>
     *   <li>Publishing after {@link #close()} delivers nothing and returns normally</li>
     * </ul>
     */
    @Override
    public void publish(String topic, Message... messages) {
        validateTopic(topic);
        if (messages == null) {
            throw new IllegalArgumentException("messages cannot be null");
        }
        for (Message message : messages) {
            if (message == null) {
                throw new IllegalArgumentException("message cannot be null");
            }
        }

        if (closed.get()) {
            log.debug("PubSub closed, discarding {} message(s) published on topic {}", messages.length, topic);
            return;
        }

        long firstOffset = Subscription.NOT_RETAINED;
        if (config.persistent()) {
            firstOffset = retentionStore.append(topic, List.of(messages));
        }

        for (int i = 0; i < messages.length; i++) {
            long offset = firstOffset == Subscription.NOT_RETAINED ? Subscription.NOT_RETAINED : firstOffset + i;
            sendMessage(topic, messages[i], offset);
        }
    }

    private void sendMessage(String topic, Message message, long offset) {
        Lock readLock = registry.readLock();
        readLock.lock();
        try {
            for (Subscription subscription : registry.snapshot(topic)) {
                if (!subscription.receivesLive(offset)) {
                    // already replayed to this subscriber
                    continue;
                }
                sendMessageToSubscriber(message, subscription, config.sendTimeout());
            }
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Delivers one message to one subscriber, resending fresh copies until acked.
     *
     * @return true if acked, false if abandoned because the PubSub is closing
     * @throws SendTimeoutException if the subscriber did not accept a copy in time
     */
    private boolean sendMessageToSubscriber(Message message, Subscription subscription, Duration sendTimeout) {
        long timeoutNanos = InMemoryPubSubConfig.NO_TIMEOUT.equals(sendTimeout) ? -1L : sendTimeout.toNanos();

        while (true) {
            Message copy = message.copy();
            try {
                SubscriberChannel.SendResult sendResult = subscription.channel().send(copy, timeoutNanos);
                if (sendResult == SubscriberChannel.SendResult.TIMED_OUT) {
                    throw new SendTimeoutException(copy.getUuid(), subscription.id(), sendTimeout);
                }
                if (sendResult == SubscriberChannel.SendResult.CLOSING) {
                    log.trace("Closing, message {} discarded for subscriber {}", copy.getUuid(), subscription.id());
                    return false;
                }
                log.trace("Sent message {} to subscriber {}", copy.getUuid(), subscription.id());

                AckState outcome = awaitOutcome(copy);
                if (outcome == AckState.ACKED) {
                    log.trace("Message {} acked by subscriber {}", copy.getUuid(), subscription.id());
                    return true;
                }
                if (outcome == AckState.PENDING || closing.isDone()) {
                    log.trace("Closing, message {} discarded for subscriber {}", copy.getUuid(), subscription.id());
                    return false;
                }
                log.trace("Nack received for message {} from subscriber {}, resending", copy.getUuid(), subscription.id());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PubSubException("Interrupted while delivering message " + message.getUuid()
                    + " to subscriber " + subscription.id(), e);
            } finally {
                copy.getContext().cancel();
            }
        }
    }

    /**
     * Waits until the copy is acked or nacked, or the PubSub starts closing.
     *
     * @return ACKED, NACKED, or PENDING if woken by the shutdown signal
     */
    private AckState awaitOutcome(Message copy) throws InterruptedException {
        CompletableFuture<Object> resolved = CompletableFuture.anyOf(
            copy.acked().toCompletableFuture(),
            copy.nacked().toCompletableFuture(),
            closing
        );
        try {
            resolved.get();
        } catch (ExecutionException e) {
            throw new PubSubException("Unexpected failure while waiting for acknowledgment of " + copy.getUuid(), e);
        }
        return copy.getAckState();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Returns immediately; replay and registration run on a subscribe task</li>
     *   <li>After {@link #close()} the returned stream is already closed</li>
     * </ul>
     */
    @Override
    public MessageStream subscribe(String topic) {
        validateTopic(topic);

        Subscription subscription = Subscription.create(topic, config.outputBufferCapacity(), closing);
        if (closed.get()) {
            subscription.channel().close();
            return subscription.channel();
        }

        try {
            subscribeExecutor.execute(() -> registerSubscriber(subscription));
        } catch (RejectedExecutionException e) {
            // close() shut the executor down between the check above and execute()
            log.debug("PubSub closed while subscribing {} to topic {}", subscription.id(), topic);
            subscription.channel().close();
        }
        return subscription.channel();
    }

    /**
     * Replays retained history (persistent mode) and adds the subscriber to the live set.
     *
     * <p><strong>Two-phase protocol:</strong></p>
     * <pre>
     * 1. acquire retention read lock      (appends are blocked from here)
     * 2. snapshot + replay the topic log  (start offset = snapshot length)
     * 3. acquire registry write lock, add subscriber
     * 4. release retention read lock
     * 5. release registry write lock
     * </pre>
     * <p>A publish racing this task either appended before step 1 (its message is in the
     * snapshot, and its live delivery skips this subscriber by offset) or appends after step 4
     * (this subscriber is registered before that publish can take the registry read lock).</p>
     */
    private void registerSubscriber(Subscription subscription) {
        if (!config.persistent()) {
            if (registry.register(subscription)) {
                log.debug("Subscriber {} registered on topic {}", subscription.id(), subscription.topic());
            }
            return;
        }

        Lock retentionReadLock = retentionStore.readLock();
        Lock registryWriteLock = registry.writeLock();

        retentionReadLock.lock();
        boolean retentionLocked = true;
        try {
            if (!replay(subscription)) {
                subscription.channel().close();
                return;
            }

            registryWriteLock.lock();
            try {
                boolean registered = registry.addLocked(subscription);
                retentionReadLock.unlock();
                retentionLocked = false;
                if (registered) {
                    log.debug("Subscriber {} registered on topic {} at offset {}",
                        subscription.id(), subscription.topic(), subscription.startOffset());
                }
            } finally {
                registryWriteLock.unlock();
            }
        } finally {
            if (retentionLocked) {
                retentionReadLock.unlock();
            }
        }
    }

    /**
     * Replays the topic log to a not yet registered subscriber. Caller holds the retention read lock.
     *
     * @return true if the whole history was acked, false if replay stopped
     */
    private boolean replay(Subscription subscription) {
        List<Message> history = retentionStore.replay(subscription.topic());
        subscription.startLiveAt(history.size());
        if (!history.isEmpty()) {
            log.debug("Replaying {} message(s) to subscriber {}", history.size(), subscription.id());
        }

        try {
            for (Message message : history) {
                if (!sendMessageToSubscriber(message, subscription, InMemoryPubSubConfig.NO_TIMEOUT)) {
                    log.debug("Replay to subscriber {} stopped, PubSub is closing", subscription.id());
                    return false;
                }
            }
            return true;
        } catch (PubSubException e) {
            log.error("Replay to subscriber {} on topic {} failed, closing its stream",
                subscription.id(), subscription.topic(), e);
            return false;
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>The first call completes the shutdown signal, which releases every blocked send and
     * acknowledgment wait, then closes every subscriber channel. Later calls do nothing.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        closing.complete(null);
        int closedChannels = registry.closeAll();
        subscribeExecutor.shutdown();

        log.debug("PubSub closed, {} subscriber stream(s) closed", closedChannels);
    }

    /**
     * Whether {@link #close()} has been called.
     */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Number of registered subscribers of the topic. Used for test assertions.
     *
     * @param topic the topic
     * @return registered subscriber count (subscribers still replaying are not counted)
     */
    public int subscriberCount(String topic) {
        return registry.subscriberCount(topic);
    }

    /**
     * Number of retained messages of the topic (always 0 unless persistent). Used for test assertions.
     *
     * @param topic the topic
     * @return retained message count
     */
    public int retainedMessageCount(String topic) {
        return retentionStore.size(topic);
    }

    public InMemoryPubSubConfig getConfig() {
        return config;
    }

    private static void validateTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
    }

    private static ThreadFactory subscribeThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "fanout-subscribe-" + SUBSCRIBE_THREAD_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
