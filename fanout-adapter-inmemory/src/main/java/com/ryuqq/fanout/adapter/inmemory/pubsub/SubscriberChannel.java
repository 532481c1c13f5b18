package com.ryuqq.fanout.adapter.inmemory.pubsub;

import com.ryuqq.fanout.core.contract.Message;
import com.ryuqq.fanout.core.spi.MessageStream;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, closeable message channel owned by one subscriber.
 *
 * <p><strong>Capacity Semantics:</strong></p>
 * <ul>
 *   <li>capacity &gt; 0: a send completes once the message is buffered</li>
 *   <li>capacity = 0: hand-off, a send completes only when the consumer takes the message</li>
 * </ul>
 *
 * <p>Senders race three events under the channel lock: room in the buffer (or, for hand-off,
 * the consumer taking the message), the send deadline, and the PubSub shutdown signal.
 * The shutdown signal is wired to {@link #wakeSenders()} so that a sender parked on a full
 * channel returns {@link SendResult#CLOSING} instead of blocking forever.</p>
 *
 * <p>Consumers read through the {@link MessageStream} view. After {@link #close()}, buffered
 * messages remain readable and reads then return {@code null}.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
final class SubscriberChannel implements MessageStream {

    /**
     * Result of a single send attempt.
     */
    enum SendResult {
        SENT,
        TIMED_OUT,
        CLOSING
    }

    private final String subscriberId;
    private final String topic;
    private final int capacity;
    private final CompletableFuture<Void> shutdownSignal;

    private final ReentrantLock lock;
    private final Condition notEmpty;
    private final Condition spaceOrTaken;
    private final ArrayDeque<Message> buffer;

    private long putCount;
    private long takeCount;
    private boolean closed;

    private SubscriberChannel(String subscriberId, String topic, int capacity, CompletableFuture<Void> shutdownSignal) {
        this.subscriberId = subscriberId;
        this.topic = topic;
        this.capacity = capacity;
        this.shutdownSignal = shutdownSignal;
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
        this.spaceOrTaken = lock.newCondition();
        this.buffer = new ArrayDeque<>(Math.max(capacity, 1));
    }

    /**
     * Opens a channel bound to the given shutdown signal.
     *
     * @param subscriberId owning subscriber
     * @param topic subscribed topic
     * @param capacity buffer capacity (0 for hand-off)
     * @param shutdownSignal completed when the PubSub starts closing
     * @return the new channel
     */
    static SubscriberChannel open(String subscriberId, String topic, int capacity, CompletableFuture<Void> shutdownSignal) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative, but was: " + capacity);
        }
        SubscriberChannel channel = new SubscriberChannel(subscriberId, topic, capacity, shutdownSignal);
        shutdownSignal.thenRun(channel::wakeSenders);
        return channel;
    }

    /**
     * Pushes a message into the channel.
     *
     * @param message the copy to deliver
     * @param timeoutNanos send deadline in nanoseconds, or a negative value for no deadline
     * @return SENT, TIMED_OUT or CLOSING
     * @throws InterruptedException if interrupted while waiting
     */
    SendResult send(Message message, long timeoutNanos) throws InterruptedException {
        boolean timed = timeoutNanos >= 0;
        long remaining = timeoutNanos;

        lock.lockInterruptibly();
        try {
            while (buffer.size() >= Math.max(capacity, 1)) {
                if (closed || shutdownSignal.isDone()) {
                    return SendResult.CLOSING;
                }
                if (timed) {
                    if (remaining <= 0) {
                        return SendResult.TIMED_OUT;
                    }
                    remaining = spaceOrTaken.awaitNanos(remaining);
                } else {
                    spaceOrTaken.await();
                }
            }
            if (closed || shutdownSignal.isDone()) {
                return SendResult.CLOSING;
            }

            buffer.addLast(message);
            long ticket = ++putCount;
            notEmpty.signal();

            if (capacity > 0) {
                return SendResult.SENT;
            }
            return awaitHandOff(message, ticket, timed, remaining);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private SendResult awaitHandOff(Message message, long ticket, boolean timed, long remaining) throws InterruptedException {
        try {
            while (takeCount < ticket) {
                if (shutdownSignal.isDone()) {
                    retract(message);
                    return SendResult.CLOSING;
                }
                if (timed) {
                    if (remaining <= 0) {
                        retract(message);
                        return SendResult.TIMED_OUT;
                    }
                    remaining = spaceOrTaken.awaitNanos(remaining);
                } else {
                    spaceOrTaken.await();
                }
            }
            return SendResult.SENT;
        } catch (InterruptedException e) {
            if (takeCount < ticket) {
                retract(message);
            }
            throw e;
        }
    }

    private void retract(Message message) {
        if (buffer.removeLastOccurrence(message)) {
            putCount--;
            spaceOrTaken.signalAll();
        }
    }

    @Override
    public Message take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed) {
                    return null;
                }
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Message poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed || remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    private Message dequeue() {
        Message message = buffer.pollFirst();
        takeCount++;
        spaceOrTaken.signalAll();
        return message;
    }

    /**
     * Closes the channel (idempotent).
     *
     * @return true if this call closed the channel, false if it was already closed
     */
    boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            spaceOrTaken.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void wakeSenders() {
        lock.lock();
        try {
            spaceOrTaken.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of buffered, not yet taken messages.
     */
    int buffered() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String subscriberId() {
        return subscriberId;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public String toString() {
        return "SubscriberChannel{subscriberId=" + subscriberId + ", topic=" + topic + ", capacity=" + capacity + '}';
    }
}
