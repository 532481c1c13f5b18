package com.ryuqq.fanout.adapter.inmemory.pubsub;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-topic set of live subscribers.
 *
 * <p><strong>Locking Discipline:</strong></p>
 * <ul>
 *   <li>Delivery holds the read lock for the whole fan-out of one message, so the
 *       subscriber list cannot change underneath it</li>
 *   <li>Registration and {@link #closeAll()} hold the write lock, so a subscriber is never
 *       observed half-added and no channel is closed while a delivery is iterating</li>
 * </ul>
 *
 * <p>Callers that need to hold the write lock across another lock (the persistent subscribe
 * protocol) use {@link #writeLock()} with {@link #addLocked(Subscription)}.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
final class SubscriberRegistry {

    private final ReentrantReadWriteLock lock;
    private final Map<String, List<Subscription>> subscriptions;
    private boolean closed;

    SubscriberRegistry() {
        this.lock = new ReentrantReadWriteLock();
        this.subscriptions = new HashMap<>();
    }

    Lock readLock() {
        return lock.readLock();
    }

    Lock writeLock() {
        return lock.writeLock();
    }

    /**
     * Registers a subscriber, acquiring the write lock.
     *
     * @return true if registered, false if the registry is closed (the channel is closed instead)
     */
    boolean register(Subscription subscription) {
        lock.writeLock().lock();
        try {
            return addLocked(subscription);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Registers a subscriber. The caller must hold the write lock.
     *
     * @return true if registered, false if the registry is closed (the channel is closed instead)
     */
    boolean addLocked(Subscription subscription) {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("write lock must be held to register a subscriber");
        }
        if (closed) {
            subscription.channel().close();
            return false;
        }
        subscriptions.computeIfAbsent(subscription.topic(), topic -> new ArrayList<>()).add(subscription);
        return true;
    }

    /**
     * Subscribers of the topic in registration order.
     *
     * <p>Delivery calls this while holding the read lock and iterates the returned copy.</p>
     */
    List<Subscription> snapshot(String topic) {
        lock.readLock().lock();
        try {
            List<Subscription> topicSubscriptions = subscriptions.get(topic);
            if (topicSubscriptions == null) {
                return List.of();
            }
            return List.copyOf(topicSubscriptions);
        } finally {
            lock.readLock().unlock();
        }
    }

    int subscriberCount(String topic) {
        return snapshot(topic).size();
    }

    /**
     * Disables registration and closes every subscriber channel.
     *
     * @return number of channels closed by this call
     */
    int closeAll() {
        lock.writeLock().lock();
        try {
            closed = true;
            int closedChannels = 0;
            for (List<Subscription> topicSubscriptions : subscriptions.values()) {
                for (Subscription subscription : topicSubscriptions) {
                    if (subscription.channel().close()) {
                        closedChannels++;
                    }
                }
            }
            return closedChannels;
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }
}
