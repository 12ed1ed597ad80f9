package com.ryuqq.composer.core.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 기반 기본 DiagnosticSink.
 *
 * <p>모든 줄 앞에 심각도 접두사({@code INFO: }, {@code WARNING: }, {@code ERROR: })를 붙여
 * {@code com.ryuqq.composer} 로거로 전달합니다. 실제 출력 위치는 바인딩된
 * SLF4J 구현의 설정을 따릅니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {

    /** 기본 로거 이름 */
    public static final String LOGGER_NAME = "com.ryuqq.composer";

    private final Logger log;

    /**
     * 기본 로거 이름으로 생성.
     */
    public Slf4jDiagnosticSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    /**
     * 로거 지정 생성자.
     *
     * @param log 대상 로거
     * @throws IllegalArgumentException log가 null인 경우
     */
    public Slf4jDiagnosticSink(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void info(String message) {
        log.info("INFO: {}", message);
    }

    @Override
    public void warn(String message) {
        log.warn("WARNING: {}", message);
    }

    @Override
    public void error(String message) {
        log.error("ERROR: {}", message);
    }
}
