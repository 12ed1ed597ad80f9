package com.ryuqq.composer.core.composer;

/**
 * 합성기 전체 반복을 나타내는 연속 실행.
 *
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Continuation {

    /**
     * 등록된 Unit 전체 반복 실행.
     */
    void proceed();
}
