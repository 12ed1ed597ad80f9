package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.unit.Completion;
import com.ryuqq.composer.core.unit.Execution;

/**
 * 바인딩된 입력 record를 받는 Unit 본문.
 *
 * @param <R> 입력 record 타입
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RecordUnitBody<R extends Record> {

    /**
     * 본문 실행.
     *
     * @param input 입력 값이 바인딩된 record
     * @param execution 결과/메시지 기록용 실행 인스턴스
     * @return 종료 방식
     */
    Completion perform(R input, Execution execution);
}
