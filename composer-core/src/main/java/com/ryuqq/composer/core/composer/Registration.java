package com.ryuqq.composer.core.composer;

import com.ryuqq.composer.core.model.Params;
import com.ryuqq.composer.core.unit.Invocable;

import java.util.function.Predicate;

/**
 * 합성기 등록 항목 (Unit + 등록 단위 precondition).
 *
 * @author Composer Team
 * @since 1.0.0
 * @param unit 등록된 Unit
 * @param precondition 합성기 입력에 대한 게이트 (기본: 항상 true)
 */
public record Registration(Invocable unit, Predicate<Params> precondition) {

    /** 항상 통과하는 기본 precondition */
    public static final Predicate<Params> ALWAYS = params -> true;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException unit 또는 precondition이 null인 경우
     */
    public Registration {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (precondition == null) {
            throw new IllegalArgumentException("precondition cannot be null");
        }
    }

    /**
     * precondition 없는 등록.
     *
     * @param unit 등록할 Unit
     * @return Registration
     */
    public static Registration of(Invocable unit) {
        return new Registration(unit, ALWAYS);
    }
}
