package io.github.samzhu.pricing.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class RateTest {

    @Test
    void shouldComputeExactPerMillionCost() {
        Rate rate = Rate.perMillion("0.80");

        // 1200 * 0.80 / 1,000,000 = 0.00096，不做捨入
        assertThat(rate.costFor(1200)).isEqualByComparingTo("0.00096");
        assertThat(rate.costFor(1)).isEqualByComparingTo("0.0000008");
    }

    @Test
    void shouldComputePerUnitCost() {
        assertThat(Rate.perUnit("0.04").costFor(3)).isEqualByComparingTo("0.12");
        assertThat(Rate.perUnit("0.04").costFor(0)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void shouldKeepRawText() {
        assertThat(Rate.perMillion("3.20").raw()).isEqualTo("3.20");
        assertThat(Rate.of(RateKind.PER_UNIT, new BigDecimal("1.50")).raw()).isEqualTo("1.50");
        assertThat(new Rate(RateKind.PER_UNIT, new BigDecimal("2"), null).raw()).isEqualTo("2");
    }

    @Test
    void shouldRejectNegativeRate() {
        assertThatThrownBy(() -> Rate.perUnit("-0.01"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNonNumericRaw() {
        assertThatThrownBy(() -> Rate.perMillion("abc"))
            .isInstanceOf(NumberFormatException.class);
    }
}
