package com.ryuqq.composer.core.unit;

/**
 * Unit 본문의 종료 방식.
 *
 * <p>본문은 항상 Completion을 반환합니다. 중단은 예외가 아니라
 * {@code return execution.die(...)} 형태의 조기 반환입니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public enum Completion {

    /** 정상 종료 */
    DONE,

    /**
     * {@code die}로 중단.
     *
     * <p>결과 계약 검증은 {@code successful}로만 결정됩니다. {@code die} 없이 HALTED를 반환하면
     * 성공으로 취급되어 검증 대상이 됩니다.</p>
     */
    HALTED
}
