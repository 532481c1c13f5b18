package com.ryuqq.fanout.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Message에 실리는 업무 데이터의 직렬화된 바이트 표현.
 *
 * <p>직렬화 형식(JSON, Protobuf 등)은 Producer가 선택하며,
 * 엔진은 내용을 해석하지 않고 그대로 전달합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 방어적 복사를 수행합니다.</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 불가 (빈 Payload는 {@link #empty()} 사용)</li>
 *   <li>길이 제한 없음</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] value;

    private Payload(byte[] value) {
        this.value = value;
    }

    /**
     * 바이트 배열로 Payload 생성.
     *
     * @param value Payload 바이트 (복사되어 저장됨)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Payload of(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return new Payload(value.clone());
    }

    /**
     * UTF-8 문자열로 Payload 생성.
     *
     * @param value Payload 문자열
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Payload ofString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return new Payload(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * Payload 바이트 조회.
     *
     * @return Payload 바이트의 복사본
     */
    public byte[] getBytes() {
        return value.clone();
    }

    /**
     * Payload를 UTF-8 문자열로 해석.
     *
     * @return UTF-8 문자열
     */
    public String asString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    public int size() {
        return value.length;
    }

    public boolean isEmpty() {
        return value.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Arrays.equals(value, payload.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Payload{" + value.length + " bytes}";
    }
}
