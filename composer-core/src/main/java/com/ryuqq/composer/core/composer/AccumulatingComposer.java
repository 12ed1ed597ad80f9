package com.ryuqq.composer.core.composer;

import com.ryuqq.composer.core.error.FailureException;
import com.ryuqq.composer.core.error.ReservedParameterException;
import com.ryuqq.composer.core.error.UnproducedParameterException;
import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.unit.Invocable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 누적 합성기.
 *
 * <p>등록된 Unit을 순서대로 실행하며 상태를 이어받고 병합합니다. 첫 실패에서 멈춥니다.</p>
 *
 * <p><strong>call 동작:</strong></p>
 * <ol>
 *   <li>입력에 예약 키({@code successful}, {@code messages})가 있으면
 *       {@link ReservedParameterException} (어떤 Unit도 실행 전)</li>
 *   <li>정적 검증: 입력 키에서 시작해 각 Unit의 필수 입력이 이미 사용 가능한지 확인,
 *       통과하면 해당 Unit의 선언 결과를 사용 가능 키에 추가.
 *       실패 시 {@link UnproducedParameterException} (어떤 Unit도 실행 전)</li>
 *   <li>누적기 = 입력 + {@code {successful=true, messages=[]}}</li>
 *   <li>각 Unit을 누적기 값으로 호출하고 결과 병합
 *       (같은 키는 덮어쓰기, {@code messages}는 이어 붙임)</li>
 *   <li>병합 후 실패면 실패 콜백을 Unit 원본 결과로 호출하고 중단 (short-circuit)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AccumulatingComposer signup = AccumulatingComposer.create(b -&gt; b
 *     .add(new CreateUser())        // email → user
 *     .add(new CreateAccount())     // user → account
 *     .around(proceed -&gt; tx.run(proceed::proceed)));
 *
 * Outcome outcome = signup.call(Map.of("email", "a@b.c"));
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class AccumulatingComposer extends AbstractComposer {

    private AccumulatingComposer(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 블록으로 구성한 합성기 생성.
     *
     * @param configuration 구성 블록
     * @return AccumulatingComposer
     */
    public static AccumulatingComposer create(Consumer<Builder> configuration) {
        Builder builder = builder();
        if (configuration != null) {
            configuration.accept(builder);
        }
        return builder.build();
    }

    /**
     * lenient 호출.
     *
     * @param inputs 초기 입력
     * @return 누적된 최종 결과 (입력 값 포함)
     * @throws ReservedParameterException 입력에 예약 키가 있는 경우
     * @throws UnproducedParameterException 필수 입력을 충족할 수 없는 Unit이 있는 경우
     */
    public Outcome call(Map<String, ?> inputs) {
        Map<String, ?> initial = inputs == null ? Map.of() : inputs;
        ensureNoReservedKeys(initial);
        ensureParameterContinuity(initial);

        Map<String, Object> state = new LinkedHashMap<>(initial);
        List<String> messages = new ArrayList<>();
        state.put(Outcome.SUCCESSFUL, true);
        state.put(Outcome.MESSAGES, messages);

        runAround(() -> {
            for (Invocable unit : units()) {
                Outcome outcome = unit.call(withoutReservedKeys(state));
                state.putAll(outcome.asMap());
                messages.addAll(outcome.messages());
                state.put(Outcome.MESSAGES, messages);

                if (!Boolean.TRUE.equals(state.get(Outcome.SUCCESSFUL))) {
                    notifyFailure(outcome);
                    break;
                }
            }
        });
        return Outcome.of(state);
    }

    /**
     * strict 호출.
     *
     * @param inputs 초기 입력
     * @return 성공한 누적 결과
     * @throws FailureException 누적 결과가 실패인 경우 (누적 메시지 포함)
     */
    public Outcome callStrict(Map<String, ?> inputs) {
        Outcome outcome = call(inputs);
        if (!outcome.isSuccessful()) {
            throw new FailureException(name(), outcome.messages());
        }
        return outcome;
    }

    private void ensureNoReservedKeys(Map<String, ?> initial) {
        for (String reserved : List.of(Outcome.SUCCESSFUL, Outcome.MESSAGES)) {
            if (initial.containsKey(reserved)) {
                throw new ReservedParameterException(reserved);
            }
        }
    }

    private void ensureParameterContinuity(Map<String, ?> initial) {
        Set<String> available = new LinkedHashSet<>(initial.keySet());
        for (Invocable unit : units()) {
            List<String> unsatisfied = new ArrayList<>();
            for (String required : unit.contract().requiredParams()) {
                if (!available.contains(required)) {
                    unsatisfied.add(required);
                }
            }
            if (!unsatisfied.isEmpty()) {
                throw new UnproducedParameterException(unit.name(), name(), new ArrayList<>(available), unsatisfied);
            }
            available.addAll(unit.contract().results());
        }
    }

    private static Map<String, Object> withoutReservedKeys(Map<String, Object> state) {
        Map<String, Object> values = new LinkedHashMap<>(state);
        values.keySet().removeAll(Outcome.RESERVED_KEYS);
        return values;
    }

    /**
     * AccumulatingComposer 빌더.
     *
     * <p>등록 단위 precondition은 지원하지 않습니다 (Unit 자체 precondition 사용).</p>
     */
    public static final class Builder extends AbstractBuilder<AccumulatingComposer, Builder> {

        private Builder() {
        }

        /**
         * Unit 등록.
         *
         * @param unit Unit
         * @return this
         */
        public Builder add(Invocable unit) {
            return register(unit, Registration.ALWAYS);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public AccumulatingComposer build() {
            return new AccumulatingComposer(this);
        }
    }
}
