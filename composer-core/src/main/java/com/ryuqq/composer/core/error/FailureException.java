package com.ryuqq.composer.core.error;

import java.util.List;

/**
 * strict 호출({@code callStrict})에서 도메인 실패를 예외로 변환한 것.
 *
 * <p>lenient 호출은 이 예외를 던지지 않습니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class FailureException extends ComposerException {

    private final String unitName;
    private final List<String> messages;

    /**
     * 생성자.
     *
     * @param unitName 실패한 Unit 또는 합성기 이름
     * @param messages 실패 메시지 (null이면 빈 목록)
     */
    public FailureException(String unitName, List<String> messages) {
        super("Unit operation failed: " + String.join(", ", messages == null ? List.of() : messages));
        this.unitName = unitName;
        this.messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public String getUnitName() {
        return unitName;
    }

    public List<String> getMessages() {
        return messages;
    }
}
