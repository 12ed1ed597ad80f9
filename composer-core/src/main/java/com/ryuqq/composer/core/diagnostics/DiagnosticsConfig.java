package com.ryuqq.composer.core.diagnostics;

/**
 * 진단 로그 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>previewLength: 입력 미리보기에서 값 하나당 최대 글자 수 (기본 50)</li>
 *   <li>logSkips: 합성기 precondition으로 건너뛴 Unit을 기록할지 여부 (기본 true)</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 * @param previewLength 값 미리보기 최대 길이 (양수여야 함)
 * @param logSkips 합성기 건너뜀 기록 여부
 */
public record DiagnosticsConfig(int previewLength, boolean logSkips) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: previewLength=50, logSkips=true</p>
     */
    public DiagnosticsConfig() {
        this(50, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException previewLength가 양수가 아닌 경우
     */
    public DiagnosticsConfig {
        if (previewLength <= 0) {
            throw new IllegalArgumentException(
                "previewLength must be positive (current: " + previewLength + ")"
            );
        }
    }

    /**
     * previewLength만 변경한 새 인스턴스 생성.
     *
     * @param previewLength 새 미리보기 길이
     * @return 새 DiagnosticsConfig 인스턴스
     */
    public DiagnosticsConfig withPreviewLength(int previewLength) {
        return new DiagnosticsConfig(previewLength, this.logSkips);
    }

    /**
     * logSkips만 변경한 새 인스턴스 생성.
     *
     * @param logSkips 새 건너뜀 기록 여부
     * @return 새 DiagnosticsConfig 인스턴스
     */
    public DiagnosticsConfig withLogSkips(boolean logSkips) {
        return new DiagnosticsConfig(this.previewLength, logSkips);
    }
}
