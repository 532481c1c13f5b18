package com.ryuqq.fanout.testkit.contract;

import com.ryuqq.fanout.core.contract.Message;
import com.ryuqq.fanout.core.spi.MessageStream;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Background consumer that records every message read from a {@link MessageStream}.
 *
 * <p>Each received copy is acked, unless the consumer was created with
 * {@link #nackingFirst(MessageStream, int)}, in which case the first {@code n} copies of each
 * uuid are nacked and the next one acked. A consumer created with {@link #silent(MessageStream)}
 * records messages but never responds.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * try (RecordingConsumer consumer = RecordingConsumer.acking(pubSub.subscribe("orders"))) {
 *     pubSub.publish("orders", message);
 *     assertThat(consumer.awaitCount(1, Duration.ofSeconds(5))).isTrue();
 * }
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class RecordingConsumer implements AutoCloseable {

    private enum Policy {
        ACK,
        NACK_FIRST,
        SILENT
    }

    private final MessageStream stream;
    private final Policy policy;
    private final int nacksPerMessage;

    private final List<Message> received;
    private final Map<String, Integer> nacksSent;
    private final CountDownLatch endOfStream;
    private final Thread thread;

    private RecordingConsumer(MessageStream stream, Policy policy, int nacksPerMessage) {
        if (stream == null) {
            throw new IllegalArgumentException("stream cannot be null");
        }
        this.stream = stream;
        this.policy = policy;
        this.nacksPerMessage = nacksPerMessage;
        this.received = new ArrayList<>();
        this.nacksSent = new HashMap<>();
        this.endOfStream = new CountDownLatch(1);
        this.thread = new Thread(this::consume, "recording-consumer-" + stream.subscriberId());
        this.thread.setDaemon(true);
    }

    /**
     * Starts a consumer that acks every copy.
     */
    public static RecordingConsumer acking(MessageStream stream) {
        return start(new RecordingConsumer(stream, Policy.ACK, 0));
    }

    /**
     * Starts a consumer that nacks the first {@code nacks} copies of each message, then acks.
     */
    public static RecordingConsumer nackingFirst(MessageStream stream, int nacks) {
        if (nacks < 0) {
            throw new IllegalArgumentException("nacks must be non-negative, but was: " + nacks);
        }
        return start(new RecordingConsumer(stream, Policy.NACK_FIRST, nacks));
    }

    /**
     * Starts a consumer that records copies but never acks or nacks.
     */
    public static RecordingConsumer silent(MessageStream stream) {
        return start(new RecordingConsumer(stream, Policy.SILENT, 0));
    }

    private static RecordingConsumer start(RecordingConsumer consumer) {
        consumer.thread.start();
        return consumer;
    }

    private void consume() {
        try {
            Message message;
            while ((message = stream.take()) != null) {
                synchronized (received) {
                    received.add(message);
                    received.notifyAll();
                }
                respond(message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            endOfStream.countDown();
        }
    }

    private void respond(Message message) {
        switch (policy) {
            case ACK:
                message.ack();
                break;
            case NACK_FIRST:
                int nacks = nacksSent.getOrDefault(message.getUuid(), 0);
                if (nacks < nacksPerMessage) {
                    nacksSent.put(message.getUuid(), nacks + 1);
                    message.nack();
                } else {
                    message.ack();
                }
                break;
            case SILENT:
            default:
                break;
        }
    }

    /**
     * Waits until at least {@code count} copies were received.
     *
     * @return true if the count was reached in time
     */
    public boolean awaitCount(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (received) {
            while (received.size() < count) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    return false;
                }
                received.wait(remainingMillis);
            }
            return true;
        }
    }

    /**
     * Waits until the stream reported end-of-stream.
     *
     * @return true if the stream ended in time
     */
    public boolean awaitEndOfStream(Duration timeout) throws InterruptedException {
        return endOfStream.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Received copies, in arrival order.
     */
    public List<Message> received() {
        synchronized (received) {
            return List.copyOf(received);
        }
    }

    /**
     * Uuids of received copies, in arrival order.
     */
    public List<String> receivedUuids() {
        return received().stream().map(Message::getUuid).collect(Collectors.toList());
    }

    public int receivedCount() {
        synchronized (received) {
            return received.size();
        }
    }

    public MessageStream stream() {
        return stream;
    }

    @Override
    public void close() {
        thread.interrupt();
    }
}
