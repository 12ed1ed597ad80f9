package com.ryuqq.composer.core.composer;

import com.ryuqq.composer.core.diagnostics.Diagnostics;
import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.model.Params;
import com.ryuqq.composer.core.unit.Invocable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 독립 합성기.
 *
 * <p>등록된 Unit을 같은 입력으로 하나씩 독립 실행합니다. 실패해도 멈추지 않습니다.</p>
 *
 * <p><strong>call 동작:</strong></p>
 * <ol>
 *   <li>등록 순서대로 등록 단위 precondition 평가 (합성기 입력 기준)</li>
 *   <li>false → {@code {successful=true, skipped=true, messages=[]}} 기록, 다음으로</li>
 *   <li>true → Unit lenient 호출, 결과 기록, 실패면 실패 콜백 호출</li>
 *   <li>성공/실패와 관계없이 계속 (short-circuit 없음)</li>
 * </ol>
 *
 * <p>전체 반복은 {@link AroundScope} 안에서 한 번 실행되며, 결과는 등록 순서와 같은
 * 순서의 목록입니다. 범위가 진행하지 않은 경우 항목은 null입니다.</p>
 *
 * <p><strong>callStrict 동작:</strong> Unit strict 호출, 첫 실패에서
 * {@link com.ryuqq.composer.core.error.FailureException} 발생 후 나머지 Unit 실행 안 함.
 * 실패 콜백은 호출하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * IsolatedComposer notifications = IsolatedComposer.create(b -&gt; b
 *     .add(new SendEmail())
 *     .add(new SendSms(), params -&gt; params.has("phone"))
 *     .onFailure(outcome -&gt; alerts.record(outcome.messages())));
 *
 * List&lt;Outcome&gt; outcomes = notifications.call(Map.of("userId", 42L));
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class IsolatedComposer extends AbstractComposer {

    private IsolatedComposer(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 블록으로 구성한 합성기 생성.
     *
     * @param configuration 구성 블록
     * @return IsolatedComposer
     */
    public static IsolatedComposer create(Consumer<Builder> configuration) {
        Builder builder = builder();
        if (configuration != null) {
            configuration.accept(builder);
        }
        return builder.build();
    }

    /**
     * lenient 호출.
     *
     * @param inputs 모든 Unit에 같은 입력
     * @return 등록 순서와 같은 순서의 결과 목록
     */
    public List<Outcome> call(Map<String, ?> inputs) {
        Params params = Params.of(inputs);
        List<Registration> registrations = registrations();
        Outcome[] outcomes = new Outcome[registrations.size()];

        runAround(() -> {
            for (int i = 0; i < registrations.size(); i++) {
                Registration registration = registrations.get(i);
                Invocable unit = registration.unit();
                if (!registration.precondition().test(params)) {
                    reportSkipped(unit, params);
                    outcomes[i] = Outcome.skipped();
                    continue;
                }
                Outcome outcome = unit.call(params.asMap());
                outcomes[i] = outcome;
                if (!outcome.isSuccessful()) {
                    Diagnostics.warn("Unit " + unit.name() + " failed within composer " + name()
                        + ". Messages: " + outcome.messages());
                    notifyFailure(outcome);
                }
            }
        });
        return Collections.unmodifiableList(Arrays.asList(outcomes));
    }

    /**
     * strict 호출.
     *
     * @param inputs 모든 Unit에 같은 입력
     * @return 등록 순서와 같은 순서의 결과 목록
     * @throws com.ryuqq.composer.core.error.FailureException 첫 실패 Unit에서 (이후 Unit 실행 안 함)
     */
    public List<Outcome> callStrict(Map<String, ?> inputs) {
        Params params = Params.of(inputs);
        List<Registration> registrations = registrations();
        Outcome[] outcomes = new Outcome[registrations.size()];

        runAround(() -> {
            for (int i = 0; i < registrations.size(); i++) {
                Registration registration = registrations.get(i);
                if (!registration.precondition().test(params)) {
                    reportSkipped(registration.unit(), params);
                    outcomes[i] = Outcome.skipped();
                    continue;
                }
                outcomes[i] = registration.unit().callStrict(params.asMap());
            }
        });
        return Collections.unmodifiableList(Arrays.asList(outcomes));
    }

    private void reportSkipped(Invocable unit, Params params) {
        if (Diagnostics.config().logSkips()) {
            Diagnostics.info("Unit " + unit.name() + " was skipped by a composer precondition with params: "
                + Diagnostics.preview(params.asMap()) + " : precondition evaluated to false");
        }
    }

    /**
     * IsolatedComposer 빌더.
     */
    public static final class Builder extends AbstractBuilder<IsolatedComposer, Builder> {

        private Builder() {
        }

        /**
         * 항상 실행되는 Unit 등록.
         *
         * @param unit Unit
         * @return this
         */
        public Builder add(Invocable unit) {
            return register(unit, Registration.ALWAYS);
        }

        /**
         * 등록 단위 precondition과 함께 Unit 등록.
         *
         * @param unit Unit
         * @param precondition 합성기 입력에 대한 게이트
         * @return this
         */
        public Builder add(Invocable unit, Predicate<Params> precondition) {
            return register(unit, precondition);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public IsolatedComposer build() {
            return new IsolatedComposer(this);
        }
    }
}
