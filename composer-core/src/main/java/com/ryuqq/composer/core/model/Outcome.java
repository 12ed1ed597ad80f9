package com.ryuqq.composer.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unit 또는 합성기 호출 결과.
 *
 * <p>Outcome은 예외가 아닌 데이터로 성공/실패를 표현합니다.
 * 항상 두 개의 예약 키를 가집니다:</p>
 * <ul>
 *   <li>{@code successful} - 성공 여부 (boolean)</li>
 *   <li>{@code messages} - 순서가 보존되는 메시지 목록</li>
 * </ul>
 *
 * <p>나머지 키는 Unit의 선언된 결과, 또는 누적 합성기가 누적한 값입니다.
 * precondition에 의해 건너뛴 경우 {@code skipped=true}가 추가됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = unit.call(Map.of("userId", 42L));
 * if (outcome.isSuccessful()) {
 *     User user = outcome.get("user", User.class);
 * } else {
 *     log.warn("failed: {}", outcome.messages());
 * }
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class Outcome {

    public static final String SUCCESSFUL = "successful";
    public static final String MESSAGES = "messages";
    public static final String SKIPPED = "skipped";

    /** 예약 키 집합 (입력으로 사용할 수 없음). */
    public static final Set<String> RESERVED_KEYS = Set.of(SUCCESSFUL, MESSAGES);

    private static final Outcome SKIPPED_OUTCOME = new Outcome(skippedEntries());

    private final Map<String, Object> entries;
    private final boolean successful;
    private final List<String> messages;

    private Outcome(Map<String, Object> entries) {
        this.successful = Boolean.TRUE.equals(entries.get(SUCCESSFUL));
        this.messages = copyMessages(entries.get(MESSAGES));
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        copy.put(SUCCESSFUL, successful);
        copy.put(MESSAGES, messages);
        this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * 원시 맵으로부터 Outcome 생성.
     *
     * <p>{@code successful}이 없거나 Boolean이 아니면 실패로 간주합니다.
     * {@code messages}가 없으면 빈 목록입니다.</p>
     *
     * @param entries 결과 키/값
     * @return Outcome 인스턴스
     * @throws IllegalArgumentException entries가 null인 경우
     */
    public static Outcome of(Map<String, ?> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        return new Outcome(new LinkedHashMap<>(entries));
    }

    /**
     * 값 없는 성공 결과.
     *
     * @return {@code {successful=true, messages=[]}}
     */
    public static Outcome success() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(SUCCESSFUL, true);
        return new Outcome(entries);
    }

    /**
     * 합성기 precondition에 의해 건너뛴 결과.
     *
     * @return {@code {successful=true, skipped=true, messages=[]}}
     */
    public static Outcome skipped() {
        return SKIPPED_OUTCOME;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public List<String> messages() {
        return messages;
    }

    /**
     * precondition에 의해 본문이 실행되지 않았는지 확인.
     *
     * @return 건너뜀 여부
     */
    public boolean isSkipped() {
        return Boolean.TRUE.equals(entries.get(SKIPPED));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Object get(String key) {
        return entries.get(key);
    }

    /**
     * 타입을 지정한 값 조회.
     *
     * @param key 결과 키
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return 값 (없으면 null)
     * @throws ClassCastException 값이 기대 타입이 아닌 경우
     */
    public <T> T get(String key, Class<T> type) {
        return type.cast(entries.get(key));
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    /**
     * 예약 키를 제외한 값.
     *
     * @return 결과 값 (불변)
     */
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>(entries);
        values.keySet().removeAll(RESERVED_KEYS);
        return Collections.unmodifiableMap(values);
    }

    /**
     * 예약 키를 포함한 전체 결과.
     *
     * @return 전체 결과 (불변)
     */
    public Map<String, Object> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Outcome outcome = (Outcome) o;
        return entries.equals(outcome.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Outcome" + entries;
    }

    private static List<String> copyMessages(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Collection<?> collection)) {
            throw new IllegalArgumentException("messages must be a collection (current: " + raw.getClass().getName() + ")");
        }
        List<String> copy = new ArrayList<>(collection.size());
        for (Object message : collection) {
            copy.add(String.valueOf(message));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Map<String, Object> skippedEntries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(SUCCESSFUL, true);
        entries.put(SKIPPED, true);
        entries.put(MESSAGES, List.of());
        return entries;
    }
}
