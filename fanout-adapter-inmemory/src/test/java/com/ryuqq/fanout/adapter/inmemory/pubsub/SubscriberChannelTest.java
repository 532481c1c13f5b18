package com.ryuqq.fanout.adapter.inmemory.pubsub;

import com.ryuqq.fanout.core.contract.Message;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.fanout.adapter.inmemory.pubsub.PubSubTestSupport.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SubscriberChannel 단위 테스트.
 */
class SubscriberChannelTest {

    private static final long NO_DEADLINE = -1L;

    private final CompletableFuture<Void> shutdown = new CompletableFuture<>();

    private SubscriberChannel open(int capacity) {
        return SubscriberChannel.open("sub-1", "topic", capacity, shutdown);
    }

    @Test
    void 음수_용량으로_열면_예외() {
        // When & Then
        assertThatThrownBy(() -> open(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity must be non-negative");
    }

    @Nested
    class Buffered {

        @Test
        void 버퍼에_여유가_있으면_즉시_SENT() throws Exception {
            // Given
            SubscriberChannel channel = open(2);

            // When & Then
            assertThat(channel.send(message("a"), NO_DEADLINE)).isEqualTo(SubscriberChannel.SendResult.SENT);
            assertThat(channel.send(message("b"), NO_DEADLINE)).isEqualTo(SubscriberChannel.SendResult.SENT);
            assertThat(channel.buffered()).isEqualTo(2);
        }

        @Test
        void take는_전송_순서대로_반환함() throws Exception {
            // Given
            SubscriberChannel channel = open(3);
            channel.send(message("a"), NO_DEADLINE);
            channel.send(message("b"), NO_DEADLINE);

            // When & Then
            assertThat(channel.take().getUuid()).isEqualTo("a");
            assertThat(channel.take().getUuid()).isEqualTo("b");
        }

        @Test
        @Timeout(5)
        void 가득_찬_채널은_기한_후_TIMED_OUT() throws Exception {
            // Given
            SubscriberChannel channel = open(1);
            channel.send(message("a"), NO_DEADLINE);

            // When
            long start = System.nanoTime();
            SubscriberChannel.SendResult result = channel.send(message("b"), TimeUnit.MILLISECONDS.toNanos(20));

            // Then
            assertThat(result).isEqualTo(SubscriberChannel.SendResult.TIMED_OUT);
            assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(20));
            assertThat(channel.buffered()).isEqualTo(1);
        }

        @Test
        @Timeout(5)
        void 가득_찬_채널은_Consumer가_꺼내면_전송이_풀림() throws Exception {
            // Given
            SubscriberChannel channel = open(1);
            channel.send(message("a"), NO_DEADLINE);

            // When
            CompletableFuture<SubscriberChannel.SendResult> blocked = CompletableFuture.supplyAsync(() -> sendQuietly(channel, message("b")));
            Thread.sleep(20);
            assertThat(blocked).isNotDone();

            // Then
            assertThat(channel.take().getUuid()).isEqualTo("a");
            assertThat(blocked.get(2, TimeUnit.SECONDS)).isEqualTo(SubscriberChannel.SendResult.SENT);
        }

        @Test
        @Timeout(5)
        void 가득_찬_채널에서_종료_신호가_오면_CLOSING() throws Exception {
            // Given
            SubscriberChannel channel = open(1);
            channel.send(message("a"), NO_DEADLINE);
            CompletableFuture<SubscriberChannel.SendResult> blocked = CompletableFuture.supplyAsync(() -> sendQuietly(channel, message("b")));
            Thread.sleep(20);

            // When
            shutdown.complete(null);

            // Then
            assertThat(blocked.get(2, TimeUnit.SECONDS)).isEqualTo(SubscriberChannel.SendResult.CLOSING);
        }

        @Test
        void 닫힌_뒤에도_버퍼의_메시지는_읽을_수_있음() throws Exception {
            // Given
            SubscriberChannel channel = open(2);
            channel.send(message("a"), NO_DEADLINE);

            // When
            assertThat(channel.close()).isTrue();
            assertThat(channel.close()).isFalse();

            // Then
            assertThat(channel.isClosed()).isTrue();
            assertThat(channel.take().getUuid()).isEqualTo("a");
            assertThat(channel.take()).isNull();
            assertThat(channel.poll(10, TimeUnit.MILLISECONDS)).isNull();
        }

        @Test
        void 닫힌_채널로의_전송은_CLOSING() throws Exception {
            // Given
            SubscriberChannel channel = open(1);
            channel.close();

            // When & Then
            assertThat(channel.send(message("a"), NO_DEADLINE)).isEqualTo(SubscriberChannel.SendResult.CLOSING);
            assertThat(channel.buffered()).isZero();
        }
    }

    @Nested
    class HandOff {

        @Test
        @Timeout(5)
        void 직접_전달은_Consumer가_꺼낼_때_완료됨() throws Exception {
            // Given
            SubscriberChannel channel = open(0);
            CompletableFuture<SubscriberChannel.SendResult> sending = CompletableFuture.supplyAsync(() -> sendQuietly(channel, message("h")));
            Thread.sleep(20);
            assertThat(sending).isNotDone();

            // When
            Message taken = channel.take();

            // Then
            assertThat(taken.getUuid()).isEqualTo("h");
            assertThat(sending.get(2, TimeUnit.SECONDS)).isEqualTo(SubscriberChannel.SendResult.SENT);
        }

        @Test
        @Timeout(5)
        void 아무도_꺼내지_않으면_TIMED_OUT과_함께_메시지를_회수함() throws Exception {
            // Given
            SubscriberChannel channel = open(0);

            // When
            SubscriberChannel.SendResult result = channel.send(message("h"), TimeUnit.MILLISECONDS.toNanos(10));

            // Then
            assertThat(result).isEqualTo(SubscriberChannel.SendResult.TIMED_OUT);
            assertThat(channel.buffered()).isZero();
            assertThat(channel.poll(10, TimeUnit.MILLISECONDS)).isNull();
        }

        @Test
        @Timeout(5)
        void 대기_중_종료_신호가_오면_메시지를_회수함() throws Exception {
            // Given
            SubscriberChannel channel = open(0);
            CompletableFuture<SubscriberChannel.SendResult> sending = CompletableFuture.supplyAsync(() -> sendQuietly(channel, message("h")));
            Thread.sleep(20);

            // When
            shutdown.complete(null);

            // Then
            assertThat(sending.get(2, TimeUnit.SECONDS)).isEqualTo(SubscriberChannel.SendResult.CLOSING);
            assertThat(channel.buffered()).isZero();
        }

        @Test
        @Timeout(5)
        void 대기_중_인터럽트되면_메시지를_회수하고_예외를_전파함() throws Exception {
            // Given
            SubscriberChannel channel = open(0);
            CompletableFuture<Throwable> failure = new CompletableFuture<>();
            Thread sender = new Thread(() -> {
                try {
                    channel.send(message("h"), NO_DEADLINE);
                    failure.complete(null);
                } catch (InterruptedException e) {
                    failure.complete(e);
                }
            });
            sender.start();
            Thread.sleep(20);

            // When
            sender.interrupt();

            // Then
            assertThat(failure.get(2, TimeUnit.SECONDS)).isInstanceOf(InterruptedException.class);
            assertThat(channel.buffered()).isZero();
        }
    }

    private static SubscriberChannel.SendResult sendQuietly(SubscriberChannel channel, Message message) {
        try {
            return channel.send(message, NO_DEADLINE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
