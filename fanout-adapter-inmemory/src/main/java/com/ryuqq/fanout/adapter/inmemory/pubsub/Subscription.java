package com.ryuqq.fanout.adapter.inmemory.pubsub;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * One registered subscriber: identifier, topic, channel and live-start offset.
 *
 * <p>In persistent mode {@code startOffset} is the retention log length at the moment the
 * subscriber's replay snapshot was taken. Messages below that offset already reached the
 * subscriber through replay, so live delivery skips them. Non-retained messages carry
 * {@link #NOT_RETAINED} and are always delivered.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
final class Subscription {

    static final long NOT_RETAINED = -1L;

    private final String id;
    private final String topic;
    private final SubscriberChannel channel;
    private volatile long startOffset;

    private Subscription(String id, String topic, SubscriberChannel channel) {
        this.id = id;
        this.topic = topic;
        this.channel = channel;
    }

    static Subscription create(String topic, int capacity, CompletableFuture<Void> shutdownSignal) {
        String id = UUID.randomUUID().toString();
        return new Subscription(id, topic, SubscriberChannel.open(id, topic, capacity, shutdownSignal));
    }

    /**
     * Whether a live delivery of the message at {@code offset} should reach this subscriber.
     */
    boolean receivesLive(long offset) {
        return offset == NOT_RETAINED || offset >= startOffset;
    }

    void startLiveAt(long offset) {
        this.startOffset = offset;
    }

    long startOffset() {
        return startOffset;
    }

    String id() {
        return id;
    }

    String topic() {
        return topic;
    }

    SubscriberChannel channel() {
        return channel;
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", topic=" + topic + ", startOffset=" + startOffset + '}';
    }
}
