package com.ryuqq.composer.core.composer;

import com.ryuqq.composer.core.model.Outcome;

/**
 * 실패한 Unit마다 호출되는 콜백.
 *
 * <p>lenient {@code call}에서만 호출됩니다. 콜백에서 발생한 예외는
 * {@link AroundScope}를 그대로 통과해 호출자에게 전달됩니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureHandler {

    /**
     * 실패 처리.
     *
     * @param outcome 실패한 Unit의 결과 (병합 전 원본)
     */
    void onFailure(Outcome outcome);
}
