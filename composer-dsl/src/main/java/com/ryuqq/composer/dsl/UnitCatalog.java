package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.contract.Precondition;
import com.ryuqq.composer.core.contract.Requirement;
import com.ryuqq.composer.core.unit.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 선언형 Unit 정의 카탈로그.
 *
 * <p>{@link #unit(UnitOptions)}로 다음 정의의 옵션을 표시하고, {@code define}으로 Unit을 만듭니다.
 * 하나의 표시는 정확히 하나의 정의에 소비됩니다.</p>
 *
 * <p><strong>입력 선언:</strong></p>
 * <ul>
 *   <li>record 입력: 컴포넌트 선언 순서대로 입력 키 도출,
 *       {@code Optional<T>} 컴포넌트는 선택, 나머지는 필수</li>
 *   <li>record 없음: {@link UnitOptions#params()}만 사용</li>
 *   <li>둘 다 지정: {@link DualParameterDefinitionException}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * record ChargeInput(String orderId, Optional&lt;String&gt; coupon) { }
 *
 * UnitCatalog billing = new UnitCatalog();
 * billing.unit(new UnitOptions().withResults("receipt"))
 *        .precondition("orderOpen", ctx -&gt; orders.isOpen(ctx.params().get("orderId")));
 * billing.define("Charge", ChargeInput.class, (input, execution) -&gt; {
 *     execution.set("receipt", payments.charge(input.orderId(), input.coupon()));
 *     return execution.done();
 * });
 *
 * Outcome outcome = billing.get("Charge").call(Map.of("orderId", "o-1"));
 * </pre>
 *
 * <p>카탈로그 자체는 스레드 안전하지 않습니다. 정의된 Unit은 일반 Unit과 같은 규칙을 따릅니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class UnitCatalog {

    private static final Logger log = LoggerFactory.getLogger(UnitCatalog.class);

    private final Map<String, Unit> units = new LinkedHashMap<>();
    private UnitOptions pending;

    /**
     * 기본 옵션으로 다음 정의 표시.
     *
     * @return this
     */
    public UnitCatalog unit() {
        return unit(new UnitOptions());
    }

    /**
     * 다음 정의 표시.
     *
     * <p>이미 표시가 있으면 새 옵션으로 대체합니다.</p>
     *
     * @param options Unit 옵션
     * @return this
     */
    public UnitCatalog unit(UnitOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.pending = options;
        return this;
    }

    /**
     * 표시된 다음 정의에 이름 있는 precondition 부착.
     *
     * @param name precondition 이름
     * @param precondition precondition
     * @return this
     * @throws DefinitionOrderException 표시가 없는 경우
     */
    public UnitCatalog precondition(String name, Precondition precondition) {
        if (pending == null) {
            throw new DefinitionOrderException("precondition");
        }
        if (precondition == null) {
            throw new IllegalArgumentException("precondition cannot be null");
        }
        this.pending = pending.withPrecondition(name, precondition);
        return this;
    }

    /**
     * 입력 record 없이 Unit 정의.
     *
     * @param name Unit 이름
     * @param body 본문
     * @return 정의된 Unit
     * @throws DefinitionOrderException 표시가 없는 경우
     */
    public Unit define(String name, UnitBody body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        UnitOptions options = consume(name);
        return register(new DefinedUnit(name, new LinkedHashMap<>(options.params()), options, body));
    }

    /**
     * 입력 record로 Unit 정의.
     *
     * @param name Unit 이름
     * @param inputType 입력 record 타입
     * @param body 본문
     * @param <R> 입력 record 타입
     * @return 정의된 Unit
     * @throws DefinitionOrderException 표시가 없는 경우
     * @throws DualParameterDefinitionException 옵션 입력 키와 record 컴포넌트가 모두 있는 경우
     */
    public <R extends Record> Unit define(String name, Class<R> inputType, RecordUnitBody<R> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        UnitOptions options = consume(name);
        RecordBinder<R> binder = new RecordBinder<>(inputType);

        Map<String, Requirement> params = new LinkedHashMap<>(options.params());
        if (binder.hasComponents()) {
            if (!params.isEmpty()) {
                throw new DualParameterDefinitionException(name);
            }
            params = binder.params();
        }

        UnitBody bound = execution -> {
            String mismatch = binder.mismatch(execution.params());
            if (mismatch != null) {
                return execution.die(mismatch);
            }
            return body.perform(binder.bind(execution.params()), execution);
        };
        return register(new DefinedUnit(name, params, options, bound));
    }

    /**
     * 이름으로 Unit 조회.
     *
     * @param name Unit 이름
     * @return 정의된 Unit
     * @throws IllegalArgumentException 정의되지 않은 이름인 경우
     */
    public Unit get(String name) {
        Unit unit = units.get(name);
        if (unit == null) {
            throw new IllegalArgumentException("Unknown unit: " + name + ". Defined units: " + units.keySet());
        }
        return unit;
    }

    public boolean contains(String name) {
        return units.containsKey(name);
    }

    /**
     * 정의된 Unit 이름 (정의 순서).
     *
     * @return 이름 목록
     */
    public List<String> names() {
        return List.copyOf(units.keySet());
    }

    private UnitOptions consume(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (units.containsKey(name)) {
            throw new IllegalArgumentException("Unit " + name + " is already defined");
        }
        if (pending == null) {
            throw new DefinitionOrderException("define");
        }
        UnitOptions options = pending;
        pending = null;
        return options;
    }

    private Unit register(DefinedUnit unit) {
        units.put(unit.name(), unit);
        log.debug("Defined unit {} with contract {}", unit.name(), unit.contract());
        return unit;
    }
}
