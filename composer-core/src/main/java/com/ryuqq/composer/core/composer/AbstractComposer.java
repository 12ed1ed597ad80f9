package com.ryuqq.composer.core.composer;

import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.model.Params;
import com.ryuqq.composer.core.unit.Invocable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 합성기 공통 기반: 등록 목록, 감싸는 범위, 실패 콜백.
 *
 * <p>등록 목록은 {@code build()} 시점에 고정되며 이후 변경할 수 없습니다.
 * 실행은 단일 스레드, 동기, 등록 순서대로입니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public abstract class AbstractComposer {

    private static final Logger log = LoggerFactory.getLogger(AbstractComposer.class);

    private final String name;
    private final List<Registration> registrations;
    private final AroundScope around;
    private final FailureHandler failureHandler;

    protected AbstractComposer(AbstractBuilder<?, ?> builder) {
        this.name = builder.name == null ? getClass().getSimpleName() : builder.name;
        this.registrations = List.copyOf(builder.registrations);
        this.around = builder.around == null ? AroundScope.identity() : builder.around;
        this.failureHandler = builder.failureHandler;
    }

    public String name() {
        return name;
    }

    public List<Registration> registrations() {
        return registrations;
    }

    /**
     * 등록된 Unit (등록 순서).
     *
     * @return Unit 목록
     */
    public List<Invocable> units() {
        List<Invocable> units = new ArrayList<>(registrations.size());
        for (Registration registration : registrations) {
            units.add(registration.unit());
        }
        return List.copyOf(units);
    }

    /**
     * 감싸는 범위 안에서 반복 실행.
     *
     * @param iteration 등록된 Unit 전체 반복
     * @throws IllegalStateException 범위가 continuation을 두 번 이상 호출한 경우
     */
    protected final void runAround(Continuation iteration) {
        int[] proceeded = {0};
        around.around(() -> {
            if (proceeded[0]++ > 0) {
                throw new IllegalStateException("around scope of " + name + " must proceed exactly once");
            }
            iteration.proceed();
        });
        if (proceeded[0] == 0) {
            log.warn("Around scope of composer {} did not proceed: no unit was invoked", name);
        }
    }

    /**
     * 실패 콜백 호출 (설정된 경우).
     *
     * @param outcome 실패한 Unit 결과
     */
    protected final void notifyFailure(Outcome outcome) {
        if (failureHandler != null) {
            failureHandler.onFailure(outcome);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", units=" + registrations.size() + '}';
    }

    /**
     * 합성기 빌더 공통 기반.
     *
     * @param <C> 합성기 타입
     * @param <B> 빌더 자기 타입
     */
    public abstract static class AbstractBuilder<C extends AbstractComposer, B extends AbstractBuilder<C, B>> {

        private String name;
        private final List<Registration> registrations = new ArrayList<>();
        private AroundScope around;
        private FailureHandler failureHandler;

        protected AbstractBuilder() {
        }

        /**
         * 진단/오류 메시지에 쓰일 이름.
         *
         * @param name 합성기 이름
         * @return this
         */
        public B named(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
            return self();
        }

        /**
         * 감싸는 범위 설정 (한 번만 가능).
         *
         * @param scope 범위
         * @return this
         * @throws IllegalArgumentException scope가 null인 경우
         * @throws IllegalStateException 이미 설정된 경우
         */
        public B around(AroundScope scope) {
            if (scope == null) {
                throw new IllegalArgumentException("scope cannot be null");
            }
            if (this.around != null) {
                throw new IllegalStateException("around scope is already set");
            }
            this.around = scope;
            return self();
        }

        /**
         * 실패 콜백 설정 (마지막 설정이 적용됨).
         *
         * @param handler 실패 콜백
         * @return this
         */
        public B onFailure(FailureHandler handler) {
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            this.failureHandler = handler;
            return self();
        }

        protected final B register(Invocable unit, Predicate<Params> precondition) {
            registrations.add(new Registration(unit, precondition));
            return self();
        }

        protected abstract B self();

        /**
         * 합성기 생성 (등록 목록 고정).
         *
         * @return 합성기
         */
        public abstract C build();
    }
}
