package io.github.samzhu.pricing.document;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.pricing.model.Rate;
import io.github.samzhu.pricing.model.RateKind;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 單一費率：{@code {"per_1m": 0.40}} 或 {@code {"per_unit": 0.02}}，兩者擇一。
 */
public record RateDocument(
    @JsonProperty("per_1m")
    @PositiveOrZero
    BigDecimal perMillion,

    @JsonProperty("per_unit")
    @PositiveOrZero
    BigDecimal perUnit
) {
    @JsonIgnore
    @AssertTrue(message = "exactly one of per_1m or per_unit must be provided")
    public boolean isSingleRate() {
        return (perMillion != null) != (perUnit != null);
    }

    /**
     * 轉換為 {@link Rate}，優先採用 {@code per_1m}。
     *
     * <p>raw 取自 JSON 原始數字文字（Jackson 以 BigDecimal 精確解析，保留小數位數）。
     */
    public Rate toRate() {
        if (perMillion != null) {
            return new Rate(RateKind.PER_MILLION, perMillion, perMillion.toPlainString());
        }
        return new Rate(RateKind.PER_UNIT, perUnit, perUnit.toPlainString());
    }
}
