package com.ryuqq.composer.core.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unit의 입력/결과 계약.
 *
 * <p>선언 순서를 보존하는 입력 키(필수/선택)와 결과 키,
 * 그리고 선택적인 이름 있는 precondition으로 구성됩니다.</p>
 *
 * <p><strong>불변성:</strong> {@link ContractBuilder#build()} 이후 변경 불가.
 * 첫 호출 전에 한 번 확정되고 이후에는 읽기 전용입니다.</p>
 *
 * <p><strong>결과 키 규칙:</strong></p>
 * <ul>
 *   <li>선언된 결과 키는 모두 필수 (정상 종료 시 반드시 설정)</li>
 *   <li>선언되지 않은 키는 {@code successful}, {@code messages} 외에 설정 불가</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class Contract {

    private static final Contract EMPTY = new Contract(Map.of(), List.of(), null, null);

    private final Map<String, Requirement> params;
    private final List<String> results;
    private final String preconditionName;
    private final Precondition precondition;

    Contract(Map<String, Requirement> params,
             List<String> results,
             String preconditionName,
             Precondition precondition) {
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.results = List.copyOf(results);
        this.preconditionName = preconditionName;
        this.precondition = precondition;
    }

    /**
     * 입력도 결과도 없는 명시적 빈 계약.
     *
     * @return 빈 Contract
     */
    public static Contract empty() {
        return EMPTY;
    }

    /**
     * 새 ContractBuilder.
     *
     * @return ContractBuilder
     */
    public static ContractBuilder builder() {
        return new ContractBuilder();
    }

    /**
     * 선언된 전체 입력 (선언 순서).
     *
     * @return 키 → requirement
     */
    public Map<String, Requirement> params() {
        return params;
    }

    public Set<String> paramKeys() {
        return params.keySet();
    }

    /**
     * 필수 입력 키 (선언 순서).
     *
     * @return 필수 입력 키 목록
     */
    public List<String> requiredParams() {
        List<String> required = new ArrayList<>();
        params.forEach((key, requirement) -> {
            if (requirement == Requirement.REQUIRED) {
                required.add(key);
            }
        });
        return Collections.unmodifiableList(required);
    }

    public List<String> results() {
        return results;
    }

    public Optional<Precondition> precondition() {
        return Optional.ofNullable(precondition);
    }

    public String preconditionName() {
        return preconditionName;
    }

    @Override
    public String toString() {
        return "Contract{params=" + params + ", results=" + results
            + (preconditionName == null ? "" : ", precondition=" + preconditionName) + '}';
    }
}
