package com.ryuqq.composer.core.unit;

import com.ryuqq.composer.core.contract.Contract;
import com.ryuqq.composer.core.contract.ContractBuilder;
import com.ryuqq.composer.core.contract.Precondition;
import com.ryuqq.composer.core.diagnostics.Diagnostics;
import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.model.Params;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 계약이 선언된 단일 작업 단위.
 *
 * <p>하위 클래스는 {@link #configure(ContractBuilder)}에서 계약을 선언하고
 * {@link #perform(Execution)}에서 본문을 구현합니다. 계약은 첫 호출 시 한 번 확정되어
 * 이후 읽기 전용으로 공유됩니다.</p>
 *
 * <p><strong>호출 프로토콜:</strong></p>
 * <ol>
 *   <li>입력으로 {@link Execution} 생성 (누적기 = {@code {successful=true, messages=[]}})</li>
 *   <li>필수 입력 검증: 누락 키마다 {@code "<key> is required"} 메시지, 하나라도 누락이면 중단</li>
 *   <li>중단이면 precondition과 본문 모두 생략</li>
 *   <li>precondition 선언 시 평가: false면 {@code skipped=true}로 종료 (실패 아님)</li>
 *   <li>본문 실행 ({@code die}는 조기 반환)</li>
 *   <li>여전히 성공이면 결과 검증: 누락된 선언 결과, 선언되지 않은 결과 → 메시지 추가 후 실패</li>
 * </ol>
 *
 * <p>호출마다 진단 줄을 정확히 한 번 남깁니다 (성공 info, 실패 warn, precondition/본문 예외 error).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public final class FindUser extends Unit {
 *     protected void configure(ContractBuilder contract) {
 *         contract.requiredParams("userId").results("user");
 *     }
 *
 *     protected Completion perform(Execution execution) {
 *         execution.set("user", users.get(execution.param("userId")));
 *         return execution.done();
 *     }
 * }
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public abstract class Unit implements Invocable {

    private volatile Contract contract;

    /**
     * 계약 선언.
     *
     * <p>첫 호출 시 한 번 호출됩니다. 입력({@code params}/{@code noParams})과
     * 결과({@code results}/{@code noResults})를 모두 명시해야 합니다.</p>
     *
     * @param contract 선언 빌더
     */
    protected abstract void configure(ContractBuilder contract);

    /**
     * 본문.
     *
     * @param execution 실행 인스턴스
     * @return 종료 방식 ({@code execution.done()} 또는 {@code execution.die(...)})
     */
    protected abstract Completion perform(Execution execution);

    @Override
    public String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }

    @Override
    public final Contract contract() {
        Contract resolved = contract;
        if (resolved == null) {
            synchronized (this) {
                resolved = contract;
                if (resolved == null) {
                    ContractBuilder builder = Contract.builder();
                    configure(builder);
                    resolved = builder.build(name());
                    contract = resolved;
                }
            }
        }
        return resolved;
    }

    @Override
    public final Outcome call(Map<String, ?> inputs) {
        return call(Params.of(inputs));
    }

    /**
     * lenient 호출 (Params 입력).
     *
     * @param params 바인딩된 입력
     * @return 호출 결과
     * @throws com.ryuqq.composer.core.error.ImplicitConfigurationException 계약이 선언되지 않은 경우
     */
    public final Outcome call(Params params) {
        Contract resolved = contract();
        Execution execution = new Execution(name(), resolved, params);

        // 1. 필수 입력 검증 (precondition보다 먼저)
        List<String> missing = missingKeys(resolved.requiredParams(), params.keys());
        if (!missing.isEmpty()) {
            missing.forEach(key -> execution.addMessage(key + " is required"));
            execution.die();
            return report(execution, "was aborted with params: " + preview(params)
                + " : missing required params " + missing);
        }

        // 2. precondition 평가
        String dispatch;
        Optional<Precondition> precondition = resolved.precondition();
        if (precondition.isPresent()) {
            boolean passed;
            try {
                passed = precondition.get().test(execution.preconditionView());
            } catch (RuntimeException e) {
                Diagnostics.error("Unit " + name() + " was evaluating precondition '" + resolved.preconditionName()
                    + "' with params: " + preview(params) + " : raised " + e);
                throw e;
            }
            String evaluation = " : precondition '" + resolved.preconditionName() + "' evaluated to " + passed;
            if (!passed) {
                execution.markSkipped();
                return report(execution, "was skipped with params: " + preview(params) + evaluation);
            }
            dispatch = "was executed with params: " + preview(params) + evaluation;
        } else {
            dispatch = "was executed with params: " + preview(params) + " : no precondition defined";
        }

        // 3. 본문 실행
        Completion completion;
        try {
            completion = perform(execution);
        } catch (RuntimeException e) {
            Diagnostics.error("Unit " + name() + " " + dispatch + " : raised " + e);
            throw e;
        }
        if (completion == null) {
            throw new IllegalStateException("Unit " + name() + " returned no Completion from perform()");
        }

        // 4. 결과 계약 검증 (성공인 경우만, Completion과 무관)
        if (execution.isSuccessful()) {
            validateResults(resolved, execution);
        }
        return report(execution, dispatch);
    }

    private void validateResults(Contract resolved, Execution execution) {
        List<String> unset = missingKeys(resolved.results(), execution.resultKeys());
        unset.forEach(key -> execution.addMessage("Unit implementation did not set required result: " + key));

        List<String> undeclared = missingKeys(new ArrayList<>(execution.resultKeys()), resolved.results());
        undeclared.forEach(key -> execution.addMessage("Unit implementation set undeclared result: " + key));

        if (!unset.isEmpty() || !undeclared.isEmpty()) {
            execution.fail();
        }
    }

    private Outcome report(Execution execution, String dispatch) {
        Outcome outcome = execution.toOutcome();
        if (outcome.isSuccessful()) {
            Diagnostics.info("Unit " + name() + " " + dispatch);
        } else {
            Diagnostics.warn("Unit " + name() + " " + dispatch + " : failed with messages " + outcome.messages());
        }
        return outcome;
    }

    private static String preview(Params params) {
        return Diagnostics.preview(params.asMap()).toString();
    }

    private static List<String> missingKeys(Iterable<String> required, Collection<String> actual) {
        List<String> missing = new ArrayList<>();
        for (String key : required) {
            if (!actual.contains(key)) {
                missing.add(key);
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return "Unit{" + name() + '}';
    }
}
