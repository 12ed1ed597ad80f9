package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.composer.AccumulatingComposer;
import com.ryuqq.composer.core.contract.Contract;
import com.ryuqq.composer.core.contract.Requirement;
import com.ryuqq.composer.core.model.Outcome;
import com.ryuqq.composer.core.unit.Unit;
import com.ryuqq.composer.testkit.contract.AbstractComposerTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UnitCatalog 유닛 테스트.
 *
 * @author Composer Team
 * @since 1.0.0
 */
class UnitCatalogTest extends AbstractComposerTest {

    record ChargeInput(String orderId, Optional<String> coupon) {
    }

    record CountInput(int count) {
    }

    record EmptyInput() {
    }

    private final UnitCatalog catalog = new UnitCatalog();

    // ========================================
    // 정의 순서
    // ========================================

    @Test
    void define_표시없이_호출하면_DefinitionOrderException() {
        assertThatThrownBy(() -> catalog.define("DoSomething", execution -> execution.done()))
            .isInstanceOf(DefinitionOrderException.class)
            .hasMessageContaining("`define`");
    }

    @Test
    void precondition_표시없이_호출하면_DefinitionOrderException() {
        assertThatThrownBy(() -> catalog.precondition("ready", context -> true))
            .isInstanceOf(DefinitionOrderException.class)
            .hasMessageContaining("`precondition`");
    }

    @Test
    void unit_표시는_하나의_정의에만_소비됨() {
        // given
        catalog.unit();
        catalog.define("DoSomething", execution -> execution.done());

        // when & then
        assertThatThrownBy(() -> catalog.define("SomethingElse", execution -> execution.done()))
            .isInstanceOf(DefinitionOrderException.class);
        assertThat(catalog.names()).containsExactly("DoSomething");
    }

    @Test
    void 카탈로그끼리_표시를_공유하지_않음() {
        // given
        new UnitCatalog().unit();
        UnitCatalog other = new UnitCatalog();

        // when & then
        assertThatThrownBy(() -> other.define("DoSomething", execution -> execution.done()))
            .isInstanceOf(DefinitionOrderException.class);
    }

    @Test
    void define_같은_이름_두번이면_예외() {
        catalog.unit().define("DoSomething", execution -> execution.done());
        catalog.unit();

        assertThatThrownBy(() -> catalog.define("DoSomething", execution -> execution.done()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already defined");
    }

    // ========================================
    // 계약 도출
    // ========================================

    @Test
    void define_옵션에서_결과와_입력_도출() {
        // given
        catalog.unit(new UnitOptions()
            .withResults("foo")
            .withParam("foo", Requirement.REQUIRED)
            .withParam("bar", Requirement.OPTIONAL));

        // when
        Unit unit = catalog.define("DoSomething", execution -> {
            execution.set("foo", execution.param("foo"));
            return execution.done();
        });

        // then
        Contract contract = unit.contract();
        assertThat(contract.paramKeys()).containsExactly("foo", "bar");
        assertThat(contract.requiredParams()).containsExactly("foo");
        assertThat(contract.results()).containsExactly("foo");
    }

    @Test
    void define_record_컴포넌트에서_입력_도출() {
        // given
        catalog.unit(new UnitOptions().withResults("receipt"));

        // when
        Unit unit = catalog.define("Charge", ChargeInput.class, (input, execution) -> {
            execution.set("receipt", input.orderId());
            return execution.done();
        });

        // then
        assertThat(unit.contract().paramKeys()).containsExactly("orderId", "coupon");
        assertThat(unit.contract().requiredParams()).containsExactly("orderId");
    }

    @Test
    void define_옵션_입력과_record_컴포넌트_동시_지정시_예외() {
        catalog.unit(new UnitOptions().withParam("orderId", Requirement.REQUIRED));

        assertThatThrownBy(() -> catalog.define("Charge", ChargeInput.class, (input, execution) -> execution.done()))
            .isInstanceOf(DualParameterDefinitionException.class)
            .hasMessageContaining("Definition for Charge attempts to define param keys both via");
    }

    @Test
    void define_빈_record면_옵션_입력_사용() {
        catalog.unit(new UnitOptions().withParam("orderId", Requirement.REQUIRED));

        Unit unit = catalog.define("Touch", EmptyInput.class, (input, execution) -> execution.done());

        assertThat(unit.contract().requiredParams()).containsExactly("orderId");
    }

    @Test
    void define_옵션이_비어있으면_noParams_noResults() {
        Unit unit = catalog.unit().define("Noop", execution -> execution.done());

        assertThat(unit.contract().paramKeys()).isEmpty();
        assertThat(unit.contract().results()).isEmpty();
        assertThat(unit.call(Map.of()).isSuccessful()).isTrue();
    }

    // ========================================
    // 실행
    // ========================================

    @Test
    void call_record로_입력_바인딩() {
        // given
        List<ChargeInput> seen = new ArrayList<>();
        catalog.unit(new UnitOptions().withResults("receipt"));
        Unit unit = catalog.define("Charge", ChargeInput.class, (input, execution) -> {
            seen.add(input);
            execution.set("receipt", "r-" + input.orderId() + input.coupon().map(c -> "-" + c).orElse(""));
            return execution.done();
        });

        // when
        Outcome withoutCoupon = unit.call(Map.of("orderId", "o-1"));
        Outcome withCoupon = unit.call(Map.of("orderId", "o-2", "coupon", "SALE"));

        // then
        assertThat(withoutCoupon.get("receipt")).isEqualTo("r-o-1");
        assertThat(withCoupon.get("receipt")).isEqualTo("r-o-2-SALE");
        assertThat(seen).containsExactly(
            new ChargeInput("o-1", Optional.empty()),
            new ChargeInput("o-2", Optional.of("SALE")));
    }

    @Test
    void call_primitive_컴포넌트는_박싱된_값으로_바인딩() {
        catalog.unit(new UnitOptions().withResults("next"));
        Unit unit = catalog.define("Increment", CountInput.class, (input, execution) -> {
            execution.set("next", input.count() + 1);
            return execution.done();
        });

        assertThat(unit.call(Map.of("count", 41)).get("next")).isEqualTo(42);
    }

    @Test
    void call_타입_불일치면_키를_포함한_메시지로_중단() {
        // given
        catalog.unit(new UnitOptions().withResults("next"));
        Unit unit = catalog.define("Increment", CountInput.class, (input, execution) -> {
            execution.set("next", input.count() + 1);
            return execution.done();
        });

        // when
        Outcome outcome = unit.call(Map.of("count", "many"));

        // then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.messages()).containsExactly("param count expected int but got String");
    }

    @Test
    void call_Optional_요소_타입_불일치도_중단() {
        catalog.unit(new UnitOptions().withResults("receipt"));
        Unit unit = catalog.define("Charge", ChargeInput.class, (input, execution) -> {
            execution.set("receipt", "r");
            return execution.done();
        });

        Outcome outcome = unit.call(Map.of("orderId", "o-1", "coupon", 10));

        assertThat(outcome.messages()).containsExactly("param coupon expected String but got Integer");
    }

    @Test
    void call_필수_record_입력_누락시_본문_실행안됨() {
        // given
        List<ChargeInput> seen = new ArrayList<>();
        catalog.unit(new UnitOptions().withResults("receipt"));
        Unit unit = catalog.define("Charge", ChargeInput.class, (input, execution) -> {
            seen.add(input);
            return execution.done();
        });

        // when
        Outcome outcome = unit.call(Map.of("coupon", "SALE"));

        // then
        assertThat(outcome.messages()).containsExactly("orderId is required");
        assertThat(seen).isEmpty();
    }

    @Test
    void call_이름있는_precondition이_false면_건너뜀() {
        // given
        catalog.unit(new UnitOptions().withResults("receipt"))
            .precondition("notFree", context -> !"FREE".equals(context.params().get("coupon")));
        Unit unit = catalog.define("Charge", ChargeInput.class, (input, execution) -> {
            execution.set("receipt", "r");
            return execution.done();
        });

        // when
        Outcome skipped = unit.call(Map.of("orderId", "o-1", "coupon", "FREE"));
        Outcome charged = unit.call(Map.of("orderId", "o-1"));

        // then
        assertThat(skipped.isSkipped()).isTrue();
        assertThat(skipped.isSuccessful()).isTrue();
        assertThat(charged.get("receipt")).isEqualTo("r");
        assertThat(diagnostics.infos().get(0)).contains("precondition 'notFree' evaluated to false");
    }

    @Test
    void call_옵션의_precondition은_기본_이름_사용() {
        catalog.unit(new UnitOptions().withPrecondition(context -> false));
        Unit unit = catalog.define("Never", execution -> execution.done());

        Outcome outcome = unit.call(Map.of());

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(diagnostics.infos()).singleElement().asString()
            .contains("precondition 'passesPrecondition' evaluated to false");
    }

    @Test
    void 정의된_Unit은_누적_합성기에서_사용가능() {
        // given
        catalog.unit(new UnitOptions().withResults("orderId"));
        catalog.define("OpenOrder", execution -> {
            execution.set("orderId", "o-9");
            return execution.done();
        });
        catalog.unit(new UnitOptions().withResults("receipt"));
        catalog.define("Charge", ChargeInput.class, (input, execution) -> {
            execution.set("receipt", "r-" + input.orderId());
            return execution.done();
        });

        // when
        Outcome outcome = AccumulatingComposer.create(b -> b
            .add(catalog.get("OpenOrder"))
            .add(catalog.get("Charge"))).call(Map.of());

        // then
        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.get("receipt")).isEqualTo("r-o-9");
    }

    @Test
    void get_정의되지_않은_이름이면_예외() {
        assertThatThrownBy(() -> catalog.get("Missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown unit: Missing");
    }
}
