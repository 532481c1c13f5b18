package com.ryuqq.fanout.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message에 첨부되는 문자열 key/value 메타데이터.
 *
 * <p>추적 ID, 이벤트 이름 등 Payload 밖에서 전달해야 하는 부가 정보를 담습니다.
 * Message 복사 시 메타데이터도 독립적으로 복사되므로, 한 구독자가 값을 바꿔도
 * 다른 구독자가 받은 사본에는 영향을 주지 않습니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 내부적으로 {@link ConcurrentHashMap}을 사용합니다.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class Metadata {

    private final ConcurrentHashMap<String, String> values;

    /**
     * 빈 메타데이터 생성.
     */
    public Metadata() {
        this.values = new ConcurrentHashMap<>();
    }

    private Metadata(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Map으로부터 메타데이터 생성.
     *
     * @param values 초기 값 (복사됨)
     * @return 메타데이터 인스턴스
     * @throws IllegalArgumentException values가 null이거나 null key/value를 포함하는 경우
     */
    public static Metadata of(Map<String, String> values) {
        if (values == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        Metadata metadata = new Metadata();
        values.forEach(metadata::set);
        return metadata;
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값, 없으면 빈 문자열
     */
    public String get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return values.getOrDefault(key, "");
    }

    /**
     * 값 설정 (기존 값 덮어쓰기).
     *
     * @param key 키
     * @param value 값
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public void set(String key, String value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        values.put(key, value);
    }

    public boolean contains(String key) {
        return key != null && values.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * 독립적인 사본 생성.
     *
     * @return 같은 내용을 가진 새 메타데이터
     */
    public Metadata copy() {
        return new Metadata(values);
    }

    /**
     * 읽기 전용 스냅샷.
     *
     * @return 현재 내용의 불변 Map
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Metadata metadata = (Metadata) o;
        return values.equals(metadata.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + values;
    }
}
