package com.ryuqq.composer.core.error;

import java.util.List;

/**
 * 누적 합성기의 정적 검증 실패.
 *
 * <p>어떤 Unit의 필수 입력이 초기 입력에도 없고 선행 Unit의 선언된 결과에도 없는 경우
 * 실행 전에 발생합니다. 이 예외가 발생하면 어떤 Unit도 실행되지 않습니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class UnproducedParameterException extends ComposerException {

    private final String unitName;
    private final String composerName;
    private final List<String> availableKeys;
    private final List<String> unproducedKeys;

    /**
     * 생성자.
     *
     * @param unitName 입력을 충족하지 못한 Unit 이름
     * @param composerName 합성기 이름
     * @param availableKeys 해당 Unit 시점까지 누적된 사용 가능 키
     * @param unproducedKeys 충족되지 않은 필수 입력 키
     */
    public UnproducedParameterException(String unitName,
                                        String composerName,
                                        List<String> availableKeys,
                                        List<String> unproducedKeys) {
        super("Unit " + unitName + " included in composer " + composerName
            + " requires parameters that are never produced by a preceding unit. "
            + "Unproduced parameter(s): " + unproducedKeys
            + ". Available param keys: " + availableKeys);
        this.unitName = unitName;
        this.composerName = composerName;
        this.availableKeys = List.copyOf(availableKeys);
        this.unproducedKeys = List.copyOf(unproducedKeys);
    }

    public String getUnitName() {
        return unitName;
    }

    public String getComposerName() {
        return composerName;
    }

    public List<String> getAvailableKeys() {
        return availableKeys;
    }

    public List<String> getUnproducedKeys() {
        return unproducedKeys;
    }
}
