package com.ryuqq.composer.core.contract;

/**
 * Unit 본문 실행 여부를 결정하는 호출 단위 게이트.
 *
 * <p>false이면 본문을 실행하지 않고 {@code {successful=true, skipped=true}}로 끝납니다.
 * 실패로 취급하지 않습니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Precondition {

    /**
     * precondition 평가.
     *
     * @param context 호출 정보
     * @return 본문 실행 여부
     */
    boolean test(PreconditionContext context);
}
