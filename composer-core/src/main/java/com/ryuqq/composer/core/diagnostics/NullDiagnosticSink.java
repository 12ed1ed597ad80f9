package com.ryuqq.composer.core.diagnostics;

/**
 * DiagnosticSink NoOp 구현.
 *
 * <p>모든 진단 로그를 버립니다. {@link Diagnostics#silence(Runnable)}가 사용합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class NullDiagnosticSink implements DiagnosticSink {

    /** 공유 인스턴스 (상태 없음) */
    public static final NullDiagnosticSink INSTANCE = new NullDiagnosticSink();

    @Override
    public void info(String message) {
        // NoOp
    }

    @Override
    public void warn(String message) {
        // NoOp
    }

    @Override
    public void error(String message) {
        // NoOp
    }
}
