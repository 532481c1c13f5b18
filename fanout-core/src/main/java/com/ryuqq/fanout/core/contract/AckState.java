package com.ryuqq.fanout.core.contract;

/**
 * 전달된 Message 사본의 응답(ack/nack) 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → ACKED (처리 완료)</li>
 *   <li>PENDING → NACKED (처리 실패, 재전송 요청)</li>
 *   <li><strong>한 사본은 단 한 번만 전이 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ├─► ACKED
 *    │
 *    └─► NACKED
 *
 * 금지된 전이:
 * - ACKED ↔ NACKED ❌
 * - ACKED/NACKED → PENDING ❌
 * </pre>
 *
 * <p>재전송은 NACKED 사본을 되살리지 않고 원본에서 새 사본을 만들어 수행합니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public enum AckState {

    /**
     * 응답 대기 중.
     */
    PENDING,

    /**
     * 처리 완료.
     */
    ACKED,

    /**
     * 처리 실패 (재전송 대상).
     */
    NACKED;

    /**
     * 응답이 확정되었는지 확인.
     *
     * @return ACKED 또는 NACKED인 경우 true
     */
    public boolean isResolved() {
        return this != PENDING;
    }
}
