package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.unit.Completion;
import com.ryuqq.composer.core.unit.Execution;

/**
 * 입력 record 없이 정의되는 Unit 본문.
 *
 * @author Composer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UnitBody {

    Completion perform(Execution execution);
}
