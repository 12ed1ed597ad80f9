package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.contract.Precondition;
import com.ryuqq.composer.core.contract.Requirement;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 다음 정의에 적용될 Unit 선언 옵션.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>results: 없음 ({@code noResults})</li>
 *   <li>params: 없음 (record 컴포넌트가 없으면 {@code noParams})</li>
 *   <li>precondition: 없음, 이름은 {@value #DEFAULT_PRECONDITION_NAME}</li>
 * </ul>
 *
 * @param results 결과 키 (선언 순서)
 * @param params 입력 키 → 필수 여부 (선언 순서)
 * @param preconditionName 진단 로그에 표시될 precondition 이름
 * @param precondition precondition (없으면 null)
 * @author Composer Team
 * @since 1.0.0
 */
public record UnitOptions(
    List<String> results,
    Map<String, Requirement> params,
    String preconditionName,
    Precondition precondition
) {

    /** precondition 기본 이름 */
    public static final String DEFAULT_PRECONDITION_NAME = "passesPrecondition";

    /**
     * 기본 설정 생성자.
     */
    public UnitOptions() {
        this(List.of(), Map.of(), DEFAULT_PRECONDITION_NAME, null);
    }

    /**
     * Compact constructor (유효성 검증, 방어적 복사).
     *
     * @throws IllegalArgumentException results, params가 null이거나 preconditionName이 비어 있는 경우
     */
    public UnitOptions {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (preconditionName == null || preconditionName.isBlank()) {
            throw new IllegalArgumentException("preconditionName cannot be null or blank");
        }
        results = List.copyOf(results);
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * results만 변경한 새 인스턴스 생성.
     *
     * @param keys 결과 키
     * @return 새 UnitOptions 인스턴스
     */
    public UnitOptions withResults(String... keys) {
        return new UnitOptions(Arrays.asList(keys), params, preconditionName, precondition);
    }

    /**
     * params만 변경한 새 인스턴스 생성.
     *
     * @param declared 입력 키 → 필수 여부
     * @return 새 UnitOptions 인스턴스
     */
    public UnitOptions withParams(Map<String, Requirement> declared) {
        return new UnitOptions(results, declared, preconditionName, precondition);
    }

    /**
     * 입력 키 하나를 추가한 새 인스턴스 생성.
     *
     * @param key 입력 키
     * @param requirement 필수 여부
     * @return 새 UnitOptions 인스턴스
     */
    public UnitOptions withParam(String key, Requirement requirement) {
        Map<String, Requirement> extended = new LinkedHashMap<>(params);
        extended.put(key, requirement);
        return new UnitOptions(results, extended, preconditionName, precondition);
    }

    /**
     * 기본 이름의 precondition을 지정한 새 인스턴스 생성.
     *
     * @param gate precondition
     * @return 새 UnitOptions 인스턴스
     */
    public UnitOptions withPrecondition(Precondition gate) {
        return new UnitOptions(results, params, preconditionName, gate);
    }

    /**
     * 이름 있는 precondition을 지정한 새 인스턴스 생성.
     *
     * @param name precondition 이름
     * @param gate precondition
     * @return 새 UnitOptions 인스턴스
     */
    public UnitOptions withPrecondition(String name, Precondition gate) {
        return new UnitOptions(results, params, name, gate);
    }

    public boolean hasPrecondition() {
        return precondition != null;
    }
}
