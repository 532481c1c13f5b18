package com.ryuqq.fanout.adapter.inmemory.store;

import com.ryuqq.fanout.core.contract.Message;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, per-topic log of published messages used for replay.
 *
 * <p>Every appended message receives an offset: its position in the topic's log. Offsets
 * start at 0 and grow monotonically; entries are never pruned.</p>
 *
 * <p><strong>Locking:</strong></p>
 * <ul>
 *   <li>{@link #append(String, List)}: exclusive (write) lock</li>
 *   <li>{@link #replay(String)}, {@link #size(String)}: shared (read) lock</li>
 *   <li>{@link #readLock()}: exposed so a subscriber can hold the shared side across replay
 *       and registration, which keeps appends out of that window</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>In-memory only: history is lost when the process exits</li>
 *   <li>Unbounded: memory grows with every published message</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class RetentionStore {

    private final ReentrantReadWriteLock lock;
    private final Map<String, List<Message>> logs;

    /**
     * Creates an empty store.
     */
    public RetentionStore() {
        this.lock = new ReentrantReadWriteLock();
        this.logs = new HashMap<>();
    }

    /**
     * Appends messages to the topic's log.
     *
     * @param topic the topic
     * @param messages messages in publish order
     * @return offset assigned to the first message
     * @throws IllegalArgumentException if topic or messages is null
     */
    public long append(String topic, List<Message> messages) {
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }
        if (messages == null) {
            throw new IllegalArgumentException("messages cannot be null");
        }

        lock.writeLock().lock();
        try {
            List<Message> log = logs.computeIfAbsent(topic, t -> new ArrayList<>());
            long firstOffset = log.size();
            log.addAll(messages);
            return firstOffset;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Current contents of the topic's log.
     *
     * @param topic the topic
     * @return immutable snapshot in append order (empty if nothing was published)
     */
    public List<Message> replay(String topic) {
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }

        lock.readLock().lock();
        try {
            List<Message> log = logs.get(topic);
            return log == null ? List.of() : List.copyOf(log);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of retained messages for the topic. Used for test assertions.
     *
     * @param topic the topic
     * @return log length
     */
    public int size(String topic) {
        lock.readLock().lock();
        try {
            List<Message> log = logs.get(topic);
            return log == null ? 0 : log.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Shared side of the store's lock.
     *
     * @return the read lock
     */
    public Lock readLock() {
        return lock.readLock();
    }
}
