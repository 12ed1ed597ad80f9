package com.ryuqq.composer.core.diagnostics;

/**
 * 진단 로그 출력 대상.
 *
 * <p>세 가지 심각도 진입점을 가지며, 각각 미리 포맷된 한 줄을 받습니다.
 * 구현체는 {@link Diagnostics#install(DiagnosticSink)}로 교체할 수 있습니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link Slf4jDiagnosticSink} - 기본값, SLF4J로 전달</li>
 *   <li>{@link ConsoleDiagnosticSink} - 표준 에러에 직접 출력</li>
 *   <li>{@link NullDiagnosticSink} - 모두 버림 (억제/테스트용)</li>
 * </ul>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public interface DiagnosticSink {

    void info(String message);

    void warn(String message);

    void error(String message);
}
