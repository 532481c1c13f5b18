package com.ryuqq.fanout.core.contract;

import com.ryuqq.fanout.core.model.Metadata;
import com.ryuqq.fanout.core.model.Payload;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Topic을 통해 전달되는 메시지 봉투 (Message Envelope).
 *
 * <p>Message는 Producer가 부여한 고유 식별자(uuid), 불변 Payload, 메타데이터,
 * 그리고 전달된 사본마다 독립적인 응답 상태와 실행 컨텍스트를 가집니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>uuid:</strong> 메시지 고유 식별자 (사본 간 동일, 로깅/추적용)</li>
 *   <li><strong>payload:</strong> 업무 데이터</li>
 *   <li><strong>metadata:</strong> 부가 정보 (사본마다 독립 복사)</li>
 *   <li><strong>ackState:</strong> PENDING → ACKED 또는 NACKED (한 번만)</li>
 *   <li><strong>context:</strong> 취소 가능한 실행 컨텍스트</li>
 * </ul>
 *
 * <p><strong>사본 규칙:</strong> 엔진은 구독자마다, 그리고 재전송마다 {@link #copy()}로
 * 새 사본을 만듭니다. 따라서 두 구독자가 같은 인스턴스를 공유하지 않으며,
 * 한 구독자의 nack가 다른 구독자의 응답 상태를 오염시키지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Message message = Message.of("order-123", Payload.ofString("{\"orderId\":123}"));
 * message.getMetadata().set("event_name", "OrderPlaced");
 *
 * // Consumer 측
 * Message received = stream.take();
 * try {
 *     handle(received);
 *     received.ack();
 * } catch (Exception e) {
 *     received.nack(); // 새 사본으로 재전송됨
 * }
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class Message {

    private final String uuid;
    private final Payload payload;
    private final Metadata metadata;

    private final AtomicReference<AckState> ackState;
    private final CompletableFuture<Void> acked;
    private final CompletableFuture<Void> nacked;

    private volatile MessageContext context;

    /**
     * Message 생성.
     *
     * @param uuid 메시지 고유 식별자
     * @param payload 업무 데이터
     * @param metadata 메타데이터 (이 인스턴스가 소유)
     * @throws IllegalArgumentException 필수 필드가 null이거나 uuid가 비어있는 경우
     */
    public Message(String uuid, Payload payload, Metadata metadata) {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        this.uuid = uuid;
        this.payload = payload;
        this.metadata = metadata;
        this.ackState = new AtomicReference<>(AckState.PENDING);
        this.acked = new CompletableFuture<>();
        this.nacked = new CompletableFuture<>();
        this.context = MessageContext.background();
    }

    /**
     * 빈 메타데이터로 Message 생성.
     *
     * @param uuid 메시지 고유 식별자
     * @param payload 업무 데이터
     * @return 생성된 Message
     * @throws IllegalArgumentException uuid가 비어있거나 payload가 null인 경우
     */
    public static Message of(String uuid, Payload payload) {
        return new Message(uuid, payload, new Metadata());
    }

    /**
     * 독립 사본 생성.
     *
     * <p>uuid와 payload는 공유하고, 메타데이터는 복사하며, 응답 상태는 PENDING으로
     * 새로 시작합니다. 컨텍스트는 원본 컨텍스트에서 파생된 자식입니다.</p>
     *
     * @return 새 사본
     */
    public Message copy() {
        Message copied = new Message(uuid, payload, metadata.copy());
        copied.context = context.withCancel();
        return copied;
    }

    /**
     * 처리 완료 응답.
     *
     * @return 이 호출이 상태를 전이시킨 경우 true, 이미 응답된 경우 false
     */
    public boolean ack() {
        if (ackState.compareAndSet(AckState.PENDING, AckState.ACKED)) {
            acked.complete(null);
            return true;
        }
        return false;
    }

    /**
     * 처리 실패 응답 (재전송 요청).
     *
     * @return 이 호출이 상태를 전이시킨 경우 true, 이미 응답된 경우 false
     */
    public boolean nack() {
        if (ackState.compareAndSet(AckState.PENDING, AckState.NACKED)) {
            nacked.complete(null);
            return true;
        }
        return false;
    }

    /**
     * ack 시 완료되는 stage.
     */
    public CompletionStage<Void> acked() {
        return acked.minimalCompletionStage();
    }

    /**
     * nack 시 완료되는 stage.
     */
    public CompletionStage<Void> nacked() {
        return nacked.minimalCompletionStage();
    }

    public AckState getAckState() {
        return ackState.get();
    }

    public String getUuid() {
        return uuid;
    }

    public Payload getPayload() {
        return payload;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public MessageContext getContext() {
        return context;
    }

    /**
     * 실행 컨텍스트 교체.
     *
     * @param context 새 컨텍스트
     * @throws IllegalArgumentException context가 null인 경우
     */
    public void setContext(MessageContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    /**
     * 내용 비교 (uuid, payload, metadata).
     *
     * <p>사본은 서로 다른 인스턴스이므로 {@code equals}(동일성)가 아닌 이 메서드로 비교합니다.</p>
     *
     * @param other 비교 대상
     * @return 내용이 같으면 true
     */
    public boolean contentEquals(Message other) {
        if (other == null) {
            return false;
        }
        return uuid.equals(other.uuid)
            && payload.equals(other.payload)
            && metadata.equals(other.metadata);
    }

    @Override
    public String toString() {
        return "Message{uuid=" + uuid + ", " + payload + ", ackState=" + ackState.get() + '}';
    }
}
