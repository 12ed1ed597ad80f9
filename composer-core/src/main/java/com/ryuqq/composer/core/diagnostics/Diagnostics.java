package com.ryuqq.composer.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 프로세스 전역 진단 로그 진입점.
 *
 * <p>하나의 교체 가능한 {@link DiagnosticSink}와 {@link DiagnosticsConfig}를 보관합니다.
 * Unit과 합성기는 호출마다 이 클래스를 통해 진단 줄을 남깁니다.</p>
 *
 * <p><strong>범위 교체:</strong></p>
 * <ul>
 *   <li>{@link #silence(Supplier)} - 블록 실행 동안 {@link NullDiagnosticSink}로 교체</li>
 *   <li>{@link #withSink(DiagnosticSink, Supplier)} - 블록 실행 동안 지정 sink로 교체</li>
 *   <li>두 경우 모두 예외가 발생해도 이전 sink를 복원 (finally)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> sink 참조는 volatile입니다. 범위 교체는 프로세스 전역이므로
 * 여러 스레드가 동시에 교체하면 서로의 출력에 영향을 줍니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class Diagnostics {

    private static volatile DiagnosticSink sink = new Slf4jDiagnosticSink();
    private static volatile DiagnosticsConfig config = new DiagnosticsConfig();

    // Utility class - prevent instantiation
    private Diagnostics() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static DiagnosticSink sink() {
        return sink;
    }

    /**
     * sink 교체.
     *
     * @param replacement 새 sink
     * @return 교체 전 sink
     * @throws IllegalArgumentException replacement가 null인 경우
     */
    public static synchronized DiagnosticSink install(DiagnosticSink replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        DiagnosticSink displaced = sink;
        sink = replacement;
        return displaced;
    }

    public static DiagnosticsConfig config() {
        return config;
    }

    /**
     * 설정 교체.
     *
     * @param replacement 새 설정
     * @return 교체 전 설정
     * @throws IllegalArgumentException replacement가 null인 경우
     */
    public static synchronized DiagnosticsConfig configure(DiagnosticsConfig replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        DiagnosticsConfig displaced = config;
        config = replacement;
        return displaced;
    }

    /**
     * 블록 실행 동안 지정 sink 사용.
     *
     * @param scoped 블록 동안 사용할 sink
     * @param block 실행할 블록
     * @param <T> 블록 결과 타입
     * @return 블록 결과
     */
    public static <T> T withSink(DiagnosticSink scoped, Supplier<T> block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        DiagnosticSink displaced = install(scoped);
        try {
            return block.get();
        } finally {
            install(displaced);
        }
    }

    /**
     * 블록 실행 동안 진단 로그 억제.
     *
     * @param block 실행할 블록
     * @param <T> 블록 결과 타입
     * @return 블록 결과
     */
    public static <T> T silence(Supplier<T> block) {
        return withSink(NullDiagnosticSink.INSTANCE, block);
    }

    /**
     * 블록 실행 동안 진단 로그 억제 (결과 없음).
     *
     * @param block 실행할 블록
     */
    public static void silence(Runnable block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        silence(() -> {
            block.run();
            return null;
        });
    }

    public static void info(String message) {
        sink.info(message);
    }

    public static void warn(String message) {
        sink.warn(message);
    }

    public static void error(String message) {
        sink.error(message);
    }

    /**
     * 진단 로그용 입력 미리보기.
     *
     * <p>값마다 {@code String.valueOf} 결과를 {@link DiagnosticsConfig#previewLength()}로 자릅니다.</p>
     *
     * @param values 입력 값
     * @return 키 → 잘린 문자열
     */
    public static Map<String, String> preview(Map<String, ?> values) {
        int limit = config.previewLength();
        Map<String, String> preview = new LinkedHashMap<>();
        if (values == null) {
            return preview;
        }
        values.forEach((key, value) -> {
            String text = String.valueOf(value);
            preview.put(key, text.length() > limit ? text.substring(0, limit) : text);
        });
        return preview;
    }
}
