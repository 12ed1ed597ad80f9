package com.ryuqq.composer.core.composer;

/**
 * 합성기 호출 전체를 감싸는 범위 (예: 트랜잭션).
 *
 * <p>top-level {@code call}/{@code callStrict} 한 번에 정확히 한 번 실행됩니다.
 * 받은 {@link Continuation}을 반드시 정확히 한 번 호출해야 합니다.
 * Unit 단위가 아니라 등록된 Unit 전체 반복을 감쌉니다.</p>
 *
 * <p><strong>주의:</strong></p>
 * <ul>
 *   <li>호출하지 않으면 어떤 Unit도 실행되지 않습니다 (경고 로그만 남음)</li>
 *   <li>두 번 호출하면 {@link IllegalStateException}</li>
 *   <li>반복 중 발생한 예외는 이 범위를 그대로 통과합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * builder.around(proceed -&gt; transactionTemplate.executeWithoutResult(status -&gt; proceed.proceed()));
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AroundScope {

    /**
     * 범위 실행.
     *
     * @param continuation 등록된 Unit 전체 반복
     */
    void around(Continuation continuation);

    /**
     * 아무것도 하지 않고 즉시 진행하는 기본 범위.
     *
     * @return identity AroundScope
     */
    static AroundScope identity() {
        return Continuation::proceed;
    }
}
