package com.ryuqq.fanout.adapter.inmemory.pubsub;

import java.time.Duration;

/**
 * InMemoryPubSub 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>outputBufferCapacity: 구독자별 채널 용량 (기본 0 = 직접 전달, Consumer가 꺼낼 때까지 대기)</li>
 *   <li>sendTimeout: 구독자 한 명에게 사본 하나를 넣는 최대 대기 시간 (기본 {@link #NO_TIMEOUT})</li>
 *   <li>persistent: 발행 이력을 보관하고 늦게 구독한 Consumer에게 재생할지 여부 (기본 false)</li>
 * </ul>
 *
 * <p><strong>sendTimeout 정규화:</strong> null 또는 음수 Duration은 {@link #NO_TIMEOUT}으로
 * 취급합니다. 0은 허용하지 않습니다.</p>
 *
 * <p><strong>주의:</strong> persistent 모드의 이력은 엔진이 닫힐 때까지 무제한으로 쌓입니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 * @param outputBufferCapacity 구독자별 채널 용량 (0 이상)
 * @param sendTimeout 전송 타임아웃 (양수 또는 NO_TIMEOUT)
 * @param persistent 이력 보관 및 재생 여부
 */
public record InMemoryPubSubConfig(
    int outputBufferCapacity,
    Duration sendTimeout,
    boolean persistent
) {

    /**
     * 타임아웃 없음을 나타내는 sentinel.
     */
    public static final Duration NO_TIMEOUT = Duration.ofNanos(-1);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: outputBufferCapacity=0, sendTimeout=NO_TIMEOUT, persistent=false</p>
     */
    public InMemoryPubSubConfig() {
        this(0, NO_TIMEOUT, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InMemoryPubSubConfig {
        if (outputBufferCapacity < 0) {
            throw new IllegalArgumentException(
                "outputBufferCapacity must be non-negative (current: " + outputBufferCapacity + ")"
            );
        }
        if (sendTimeout == null || sendTimeout.isNegative()) {
            sendTimeout = NO_TIMEOUT;
        } else if (sendTimeout.isZero()) {
            throw new IllegalArgumentException(
                "sendTimeout must be positive or NO_TIMEOUT (current: " + sendTimeout + ")"
            );
        }
    }

    /**
     * 이력을 보관하지 않는 설정.
     */
    public static InMemoryPubSubConfig nonPersistent(int outputBufferCapacity, Duration sendTimeout) {
        return new InMemoryPubSubConfig(outputBufferCapacity, sendTimeout, false);
    }

    /**
     * 이력을 보관하고 재생하는 설정.
     */
    public static InMemoryPubSubConfig persistent(int outputBufferCapacity, Duration sendTimeout) {
        return new InMemoryPubSubConfig(outputBufferCapacity, sendTimeout, true);
    }

    /**
     * 전송 타임아웃이 설정되어 있는지 확인.
     *
     * @return NO_TIMEOUT이 아니면 true
     */
    public boolean hasSendTimeout() {
        return !NO_TIMEOUT.equals(sendTimeout);
    }

    /**
     * outputBufferCapacity만 변경한 새 인스턴스 생성.
     */
    public InMemoryPubSubConfig withOutputBufferCapacity(int outputBufferCapacity) {
        return new InMemoryPubSubConfig(outputBufferCapacity, sendTimeout, persistent);
    }

    /**
     * sendTimeout만 변경한 새 인스턴스 생성.
     */
    public InMemoryPubSubConfig withSendTimeout(Duration sendTimeout) {
        return new InMemoryPubSubConfig(outputBufferCapacity, sendTimeout, persistent);
    }

    /**
     * persistent만 변경한 새 인스턴스 생성.
     */
    public InMemoryPubSubConfig withPersistent(boolean persistent) {
        return new InMemoryPubSubConfig(outputBufferCapacity, sendTimeout, persistent);
    }
}
