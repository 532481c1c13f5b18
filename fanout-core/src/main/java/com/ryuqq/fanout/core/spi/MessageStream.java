package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.contract.Message;

import java.util.concurrent.TimeUnit;

/**
 * Readable, eventually-closed stream of messages delivered to one subscriber.
 *
 * <p>The stream is closed by the PubSub on shutdown. Messages buffered before the close
 * can still be read; after that, reads return {@code null} (end-of-stream).</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public interface MessageStream {

    /**
     * Unique identifier of the subscriber that owns this stream.
     */
    String subscriberId();

    /**
     * Topic this stream is subscribed to.
     */
    String topic();

    /**
     * Waits for the next message.
     *
     * @return the next message, or {@code null} if the stream is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    Message take() throws InterruptedException;

    /**
     * Waits up to the given time for the next message.
     *
     * @param timeout how long to wait
     * @param unit unit of {@code timeout}
     * @return the next message, or {@code null} if the time elapsed or the stream is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    Message poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Whether the stream has been closed. Buffered messages may still be readable.
     */
    boolean isClosed();
}
