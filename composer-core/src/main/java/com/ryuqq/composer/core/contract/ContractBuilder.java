package com.ryuqq.composer.core.contract;

import com.ryuqq.composer.core.error.ImplicitConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contract 선언 빌더.
 *
 * <p>선언은 누적됩니다. {@code params}/{@code results}를 여러 번 호출하면 키가 합쳐집니다.
 * 한 번 required로 선언된 입력 키는 optional로 다시 선언해도 required로 남습니다.</p>
 *
 * <p><strong>명시적 선언 규칙:</strong></p>
 * <ul>
 *   <li>입력: {@code params(...)} 또는 {@code noParams()} 중 최소 한 번</li>
 *   <li>결과: {@code results(...)} 또는 {@code noResults()} 중 최소 한 번</li>
 *   <li>둘 중 하나라도 빠지면 {@link #build(String)}가 {@link ImplicitConfigurationException} 발생</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * contract.params(Map.of("userId", Requirement.REQUIRED))
 *         .params("note")                       // 이름만 주면 optional
 *         .results("user")
 *         .precondition("isActive", ctx -&gt; ctx.params().has("userId"));
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class ContractBuilder {

    private Map<String, Requirement> params;
    private List<String> results;
    private String preconditionName;
    private Precondition precondition;

    ContractBuilder() {
    }

    /**
     * 이름만으로 입력 선언 (모두 optional).
     *
     * @param names 입력 키
     * @return this
     */
    public ContractBuilder params(String... names) {
        Map<String, Requirement> declared = new LinkedHashMap<>();
        for (String name : names) {
            declared.put(requireKey(name), Requirement.OPTIONAL);
        }
        return params(declared);
    }

    /**
     * requirement를 지정한 입력 선언.
     *
     * @param declared 키 → requirement (순서 있는 맵 권장)
     * @return this
     * @throws IllegalArgumentException declared가 null이거나 requirement가 null인 경우
     */
    public ContractBuilder params(Map<String, Requirement> declared) {
        if (declared == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (params == null) {
            params = new LinkedHashMap<>();
        }
        declared.forEach((key, requirement) -> {
            if (requirement == null) {
                throw new IllegalArgumentException("requirement of " + key + " cannot be null");
            }
            params.merge(requireKey(key), requirement,
                (previous, current) -> previous == Requirement.REQUIRED ? previous : current);
        });
        return this;
    }

    /**
     * 문자열 requirement로 입력 선언 ({@code "required"} / {@code "optional"}).
     *
     * @param declared 키 → requirement 문자열
     * @return this
     * @throws com.ryuqq.composer.core.error.UnknownRequirementException 알 수 없는 requirement인 경우
     */
    public ContractBuilder paramsByName(Map<String, String> declared) {
        if (declared == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        Map<String, Requirement> parsed = new LinkedHashMap<>();
        declared.forEach((key, value) -> parsed.put(key, Requirement.parse(value)));
        return params(parsed);
    }

    /**
     * 필수 입력 선언 단축형.
     *
     * @param names 필수 입력 키
     * @return this
     */
    public ContractBuilder requiredParams(String... names) {
        Map<String, Requirement> declared = new LinkedHashMap<>();
        for (String name : names) {
            declared.put(requireKey(name), Requirement.REQUIRED);
        }
        return params(declared);
    }

    /**
     * 입력이 없음을 명시.
     *
     * @return this
     */
    public ContractBuilder noParams() {
        if (params == null) {
            params = new LinkedHashMap<>();
        }
        return this;
    }

    /**
     * 결과 키 선언 (누적).
     *
     * @param names 결과 키
     * @return this
     */
    public ContractBuilder results(String... names) {
        if (results == null) {
            results = new ArrayList<>();
        }
        for (String name : names) {
            String key = requireKey(name);
            if (!results.contains(key)) {
                results.add(key);
            }
        }
        return this;
    }

    /**
     * 결과가 없음을 명시.
     *
     * @return this
     */
    public ContractBuilder noResults() {
        if (results == null) {
            results = new ArrayList<>();
        }
        return this;
    }

    /**
     * 이름 있는 precondition 선언 (마지막 선언이 적용됨).
     *
     * @param name 진단 로그에 표시될 이름
     * @param precondition precondition
     * @return this
     * @throws IllegalArgumentException name 또는 precondition이 null인 경우
     */
    public ContractBuilder precondition(String name, Precondition precondition) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("precondition name cannot be null or blank");
        }
        if (precondition == null) {
            throw new IllegalArgumentException("precondition cannot be null");
        }
        this.preconditionName = name;
        this.precondition = precondition;
        return this;
    }

    /**
     * 입력이 명시적으로 선언되었는지 확인.
     *
     * @return 선언 여부
     */
    public boolean hasParams() {
        return params != null;
    }

    /**
     * Contract 확정.
     *
     * @param unitName 오류 메시지에 사용할 Unit 이름
     * @return 불변 Contract
     * @throws ImplicitConfigurationException 입력 또는 결과가 선언되지 않은 경우
     */
    public Contract build(String unitName) {
        if (params == null || results == null) {
            throw new ImplicitConfigurationException(unitName);
        }
        return new Contract(params, results, preconditionName, precondition);
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        return key;
    }
}
