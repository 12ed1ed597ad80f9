package com.ryuqq.composer.core.diagnostics;

import java.io.PrintStream;

/**
 * 심각도 접두사가 붙은 한 줄을 {@link PrintStream}에 직접 쓰는 DiagnosticSink.
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class ConsoleDiagnosticSink implements DiagnosticSink {

    private final PrintStream out;

    /**
     * 표준 에러로 출력.
     */
    public ConsoleDiagnosticSink() {
        this(System.err);
    }

    /**
     * 출력 스트림 지정 생성자.
     *
     * @param out 출력 스트림
     * @throws IllegalArgumentException out이 null인 경우
     */
    public ConsoleDiagnosticSink(PrintStream out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.out = out;
    }

    @Override
    public void info(String message) {
        out.println("INFO: " + message);
    }

    @Override
    public void warn(String message) {
        out.println("WARNING: " + message);
    }

    @Override
    public void error(String message) {
        out.println("ERROR: " + message);
    }
}
