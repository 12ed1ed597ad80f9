package com.ryuqq.composer.core.unit;

import com.ryuqq.composer.core.composer.AccumulatingComposer;
import com.ryuqq.composer.core.contract.Contract;
import com.ryuqq.composer.core.contract.PreconditionContext;
import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.model.Params;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Unit 호출 한 번의 실행 인스턴스.
 *
 * <p>바인딩된 입력과 가변 결과 누적기를 가집니다. 누적기는
 * {@code {successful=true, messages=[]}}로 시작하며 호출이 끝나면 버려집니다.</p>
 *
 * <p><strong>본문에서 사용하는 연산:</strong></p>
 * <ul>
 *   <li>{@link #set(String, Object)} - 결과 값 설정</li>
 *   <li>{@link #addMessage(String)} - 메시지 추가 ({@code successful} 유지)</li>
 *   <li>{@link #die(String)} - {@code successful=false}, 메시지 추가 후 {@link Completion#HALTED} 반환</li>
 *   <li>{@link #done()} - {@link Completion#DONE} 반환</li>
 *   <li>{@link #composeWith(Map, Consumer)} - 내부 누적 합성 실행 후 선언된 결과만 병합</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * protected Completion perform(Execution execution) {
 *     User user = repository.find(execution.param("userId", Long.class));
 *     if (user == null) {
 *         return execution.die("user not found");
 *     }
 *     execution.set("user", user);
 *     return execution.done();
 * }
 * </pre>
 *
 * <p><strong>동시성:</strong> 하나의 호출 스레드 안에서만 사용합니다 (thread-safe 아님).</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class Execution implements PreconditionContext {

    private final String unitName;
    private final Contract contract;
    private final Params params;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<String> messages = new ArrayList<>();
    private boolean successful = true;
    private boolean skipped;

    Execution(String unitName, Contract contract, Params params) {
        this.unitName = unitName;
        this.contract = contract;
        this.params = params;
    }

    public String unitName() {
        return unitName;
    }

    @Override
    public Params params() {
        return params;
    }

    public Object param(String key) {
        return params.get(key);
    }

    public <T> T param(String key, Class<T> type) {
        return params.get(key, type);
    }

    /**
     * 결과 값 설정.
     *
     * @param key 결과 키
     * @param value 값 (null 허용, 키는 설정된 것으로 간주)
     * @return this
     * @throws IllegalArgumentException 예약 키인 경우
     */
    public Execution set(String key, Object value) {
        if (key == null || Outcome.RESERVED_KEYS.contains(key)) {
            throw new IllegalArgumentException("result key not allowed: " + key);
        }
        values.put(key, value);
        return this;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean isSet(String key) {
        return values.containsKey(key);
    }

    @Override
    public void addMessage(String message) {
        messages.add(message);
    }

    public void addMessages(Collection<String> added) {
        if (added != null) {
            messages.addAll(added);
        }
    }

    public List<String> messages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * 메시지 없이 중단.
     *
     * @return {@link Completion#HALTED}
     */
    public Completion die() {
        successful = false;
        return Completion.HALTED;
    }

    /**
     * 메시지와 함께 중단.
     *
     * @param message 실패 메시지
     * @return {@link Completion#HALTED}
     */
    public Completion die(String message) {
        if (message != null) {
            messages.add(message);
        }
        return die();
    }

    /**
     * 여러 메시지와 함께 중단.
     *
     * @param failures 실패 메시지
     * @return {@link Completion#HALTED}
     */
    public Completion die(Collection<String> failures) {
        addMessages(failures);
        return die();
    }

    public Completion done() {
        return Completion.DONE;
    }

    /**
     * 내부 누적 합성 실행.
     *
     * <p>익명 {@link AccumulatingComposer}를 만들어 registrations로 Unit을 등록하고
     * inputs로 실행한 뒤:</p>
     * <ol>
     *   <li>하위 결과에서 이 Unit의 선언된 결과 키와 {@code successful}만 선택</li>
     *   <li>값이 null인 키는 제외</li>
     *   <li>선택한 값을 이 호출의 누적기에 덮어쓰기</li>
     *   <li>하위 결과의 메시지는 성공/실패와 관계없이 이 호출의 메시지에 추가</li>
     * </ol>
     *
     * @param inputs 하위 합성 입력
     * @param registrations Unit 등록 블록
     * @return 하위 합성 전체 결과
     * @throws com.ryuqq.composer.core.error.ComposerException 하위 합성이 구성 오류인 경우
     */
    public Outcome composeWith(Map<String, ?> inputs, Consumer<AccumulatingComposer.Builder> registrations) {
        if (registrations == null) {
            throw new IllegalArgumentException("registrations cannot be null");
        }
        AccumulatingComposer.Builder builder = AccumulatingComposer.builder()
            .named(unitName + "#composeWith");
        registrations.accept(builder);
        Outcome subOutcome = builder.build().call(inputs);

        for (String key : contract.results()) {
            Object value = subOutcome.get(key);
            if (value != null) {
                values.put(key, value);
            }
        }
        successful = subOutcome.isSuccessful();
        messages.addAll(subOutcome.messages());
        return subOutcome;
    }

    /**
     * precondition에 넘길 제한된 뷰 ({@code params}, {@code addMessage}만 노출).
     *
     * @return 이 실행에 위임하는 PreconditionContext
     */
    PreconditionContext preconditionView() {
        Execution target = this;
        return new PreconditionContext() {
            @Override
            public Params params() {
                return target.params();
            }

            @Override
            public void addMessage(String message) {
                target.addMessage(message);
            }
        };
    }

    void markSkipped() {
        skipped = true;
    }

    void fail() {
        successful = false;
    }

    Set<String> resultKeys() {
        return values.keySet();
    }

    Outcome toOutcome() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(Outcome.SUCCESSFUL, successful);
        entries.put(Outcome.MESSAGES, messages);
        entries.putAll(values);
        if (skipped) {
            entries.put(Outcome.SKIPPED, true);
        }
        return Outcome.of(entries);
    }
}
