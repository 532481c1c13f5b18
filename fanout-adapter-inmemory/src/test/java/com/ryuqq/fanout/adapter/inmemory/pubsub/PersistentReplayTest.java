package com.ryuqq.fanout.adapter.inmemory.pubsub;

import com.ryuqq.fanout.adapter.inmemory.store.RetentionStore;
import com.ryuqq.fanout.core.contract.AckState;
import com.ryuqq.fanout.core.contract.Message;
import com.ryuqq.fanout.testkit.contract.RecordingConsumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.fanout.adapter.inmemory.pubsub.PubSubTestSupport.AWAIT;
import static com.ryuqq.fanout.adapter.inmemory.pubsub.PubSubTestSupport.awaitSubscribers;
import static com.ryuqq.fanout.adapter.inmemory.pubsub.PubSubTestSupport.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Persistent 모드 테스트: 이력 보관과 늦게 구독한 Consumer로의 재생.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class PersistentReplayTest {

    private final List<RecordingConsumer> consumers = new ArrayList<>();
    private InMemoryPubSub pubSub;

    @AfterEach
    void tearDown() {
        consumers.forEach(RecordingConsumer::close);
        if (pubSub != null) {
            pubSub.close();
        }
    }

    private RecordingConsumer track(RecordingConsumer consumer) {
        consumers.add(consumer);
        return consumer;
    }

    private static InMemoryPubSubConfig persistentConfig() {
        return InMemoryPubSubConfig.persistent(0, InMemoryPubSubConfig.NO_TIMEOUT);
    }

    @Test
    @Timeout(10)
    void 구독_전에_발행된_메시지는_발행_순서대로_재생됨() throws Exception {
        // Given: nobody listens yet
        pubSub = new InMemoryPubSub(persistentConfig());
        pubSub.publish("history", message("h1"), message("h2"));
        pubSub.publish("history", message("h3"));
        assertThat(pubSub.retainedMessageCount("history")).isEqualTo(3);

        // When
        RecordingConsumer consumer = track(RecordingConsumer.acking(pubSub.subscribe("history")));
        awaitSubscribers(pubSub, "history", 1);

        // Then: registration happens only after the whole history was acked
        assertThat(consumer.receivedUuids()).containsExactly("h1", "h2", "h3");
        assertThat(consumer.received()).extracting(Message::getAckState).containsOnly(AckState.ACKED);
    }

    @Test
    @Timeout(10)
    void 재생_이후_실시간_전달은_중복_없이_이어짐() throws Exception {
        // Given
        pubSub = new InMemoryPubSub(persistentConfig());
        pubSub.publish("mixed", message("old-1"), message("old-2"));
        RecordingConsumer consumer = track(RecordingConsumer.acking(pubSub.subscribe("mixed")));
        awaitSubscribers(pubSub, "mixed", 1);

        // When
        pubSub.publish("mixed", message("new-1"));

        // Then
        assertThat(consumer.receivedUuids()).containsExactly("old-1", "old-2", "new-1");
        assertThat(pubSub.retainedMessageCount("mixed")).isEqualTo(3);
    }

    @Test
    @Timeout(10)
    void 늦게_구독한_Consumer마다_전체_이력을_각자_재생받음() throws Exception {
        // Given
        pubSub = new InMemoryPubSub(persistentConfig());
        pubSub.publish("shared", message("s1"));
        RecordingConsumer first = track(RecordingConsumer.acking(pubSub.subscribe("shared")));
        awaitSubscribers(pubSub, "shared", 1);
        pubSub.publish("shared", message("s2"));

        // When
        RecordingConsumer second = track(RecordingConsumer.acking(pubSub.subscribe("shared")));
        awaitSubscribers(pubSub, "shared", 2);

        // Then
        assertThat(first.receivedUuids()).containsExactly("s1", "s2");
        assertThat(second.receivedUuids()).containsExactly("s1", "s2");
        assertThat(first.received().get(0)).isNotSameAs(second.received().get(0));
    }

    @Test
    @Timeout(10)
    void 재생_중_nack은_다음_메시지로_넘어가기_전에_새_사본을_재전송함() throws Exception {
        // Given
        pubSub = new InMemoryPubSub(persistentConfig());
        pubSub.publish("replay-nack", message("r1"), message("r2"));

        // When
        RecordingConsumer consumer = track(RecordingConsumer.nackingFirst(pubSub.subscribe("replay-nack"), 2));
        awaitSubscribers(pubSub, "replay-nack", 1);

        // Then
        assertThat(consumer.receivedUuids()).containsExactly("r1", "r1", "r1", "r2", "r2", "r2");
        assertThat(consumer.received()).extracting(Message::getAckState).containsExactly(
            AckState.NACKED, AckState.NACKED, AckState.ACKED,
            AckState.NACKED, AckState.NACKED, AckState.ACKED);
    }

    @Test
    @Timeout(10)
    void 발행은_보관소에_추가하고_구독은_보관소에서_재생함() throws Exception {
        // Given
        RetentionStore store = spy(new RetentionStore());
        pubSub = new InMemoryPubSub(persistentConfig(), LoggerFactory.getLogger(InMemoryPubSub.class), store);
        Message original = message("spied");

        // When
        pubSub.publish("spy", original);
        RecordingConsumer consumer = track(RecordingConsumer.acking(pubSub.subscribe("spy")));
        awaitSubscribers(pubSub, "spy", 1);

        // Then: the original is retained, the subscriber receives a copy
        verify(store).append(eq("spy"), eq(List.of(original)));
        verify(store, times(1)).replay("spy");
        assertThat(store.replay("spy")).containsExactly(original);
        assertThat(consumer.received()).singleElement().isNotSameAs(original);
    }

    @Test
    @Timeout(10)
    void 비영속_모드는_보관소를_사용하지_않음() throws Exception {
        // Given
        RetentionStore store = spy(new RetentionStore());
        pubSub = new InMemoryPubSub(InMemoryPubSubConfig.nonPersistent(1, InMemoryPubSubConfig.NO_TIMEOUT),
            LoggerFactory.getLogger(InMemoryPubSub.class), store);
        pubSub.publish("volatile", message("gone"));

        // When
        RecordingConsumer consumer = track(RecordingConsumer.acking(pubSub.subscribe("volatile")));
        awaitSubscribers(pubSub, "volatile", 1);

        // Then
        verify(store, never()).append(eq("volatile"), anyList());
        verify(store, never()).replay("volatile");
        assertThat(consumer.awaitCount(1, Duration.ofMillis(100))).isFalse();
        assertThat(pubSub.retainedMessageCount("volatile")).isZero();
    }

    @Test
    @Timeout(10)
    void 재생_중_종료되면_스트림이_끝나고_구독자는_등록되지_않음() throws Exception {
        // Given: history exists and the subscriber never acks
        pubSub = new InMemoryPubSub(persistentConfig());
        pubSub.publish("stuck-replay", message("x1"), message("x2"));
        RecordingConsumer silent = track(RecordingConsumer.silent(pubSub.subscribe("stuck-replay")));
        assertThat(silent.awaitCount(1, AWAIT)).isTrue();

        // When
        pubSub.close();

        // Then
        assertThat(silent.awaitEndOfStream(AWAIT)).isTrue();
        assertThat(silent.receivedUuids()).containsExactly("x1");
        assertThat(pubSub.subscriberCount("stuck-replay")).isZero();
    }

    @Test
    @Timeout(10)
    void 추가와_전달_사이에_등록된_구독자는_메시지를_한_번만_받음() throws Exception {
        // Given: 보관소 추가 직후 발행 스레드를 멈추는 보관소
        GatedRetentionStore store = new GatedRetentionStore();
        pubSub = new InMemoryPubSub(persistentConfig(), LoggerFactory.getLogger(InMemoryPubSub.class), store);
        CompletableFuture<Void> publishing = CompletableFuture.runAsync(() -> pubSub.publish("window", message("w1")));
        assertThat(store.appended.await(5, TimeUnit.SECONDS)).isTrue();

        // When: 발행이 전달 단계로 넘어가기 전에 구독자가 재생(w1 포함)과 등록을 마침
        RecordingConsumer consumer = track(RecordingConsumer.acking(pubSub.subscribe("window")));
        awaitSubscribers(pubSub, "window", 1);
        store.release.countDown();
        publishing.get(5, TimeUnit.SECONDS);

        // Then: 실시간 전달은 이미 재생된 오프셋을 건너뜀
        assertThat(consumer.receivedUuids()).containsExactly("w1");
        assertThat(pubSub.retainedMessageCount("window")).isEqualTo(1);
    }

    /**
     * append가 끝난 뒤 release 신호까지 호출자를 붙잡아 두는 보관소.
     */
    private static final class GatedRetentionStore extends RetentionStore {

        private final CountDownLatch appended = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public long append(String topic, List<Message> messages) {
            long firstOffset = super.append(topic, messages);
            appended.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("append was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return firstOffset;
        }
    }
}
