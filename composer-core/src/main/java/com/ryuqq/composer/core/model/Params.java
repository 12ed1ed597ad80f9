package com.ryuqq.composer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Unit 호출에 바인딩된 입력.
 *
 * <p>입력 순서를 유지하며, 값으로 {@code null}을 허용합니다.
 * 키가 존재하는지({@link #has(String)})와 값이 null인지는 구분됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 복사되며 이후 변경 불가</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class Params {

    private static final Params EMPTY = new Params(Map.of());

    private final Map<String, Object> values;

    private Params(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Params 생성.
     *
     * @param values 입력 값 (null이면 빈 Params)
     * @return Params 인스턴스
     * @throws IllegalArgumentException 키에 null이 포함된 경우
     */
    public static Params of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        if (values.containsKey(null)) {
            throw new IllegalArgumentException("param keys cannot be null");
        }
        return new Params(values);
    }

    /**
     * 빈 Params.
     *
     * @return 빈 Params 인스턴스
     */
    public static Params empty() {
        return EMPTY;
    }

    /**
     * 키 존재 여부.
     *
     * @param key 입력 키
     * @return 바인딩 여부 (값이 null이어도 true)
     */
    public boolean has(String key) {
        return values.containsKey(key);
    }

    /**
     * 값 조회.
     *
     * @param key 입력 키
     * @return 값 (없으면 null)
     */
    public Object get(String key) {
        return values.get(key);
    }

    /**
     * 타입을 지정한 값 조회.
     *
     * @param key 입력 키
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return 값 (없으면 null)
     * @throws ClassCastException 값이 기대 타입이 아닌 경우
     */
    public <T> T get(String key, Class<T> type) {
        return type.cast(values.get(key));
    }

    /**
     * 기본값을 가진 값 조회.
     *
     * @param key 입력 키
     * @param defaultValue 키가 없을 때 반환할 값
     * @return 값 또는 기본값
     */
    public Object getOrDefault(String key, Object defaultValue) {
        return values.containsKey(key) ? values.get(key) : defaultValue;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Params params = (Params) o;
        return values.equals(params.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Params" + values;
    }
}
