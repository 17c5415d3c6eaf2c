package io.github.samzhu.pricing.dto.api;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.pricing.dto.EstimateCommand;
import io.github.samzhu.pricing.model.BillingDimension;
import io.github.samzhu.pricing.model.OverrideRatecard;
import io.github.samzhu.pricing.model.Rate;
import io.github.samzhu.pricing.model.RateKind;
import io.github.samzhu.pricing.model.Ratecard;
import io.github.samzhu.pricing.validation.SupportedDimension;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 單筆估價請求。
 *
 * <p>用於 POST /v1/estimate 端點，也是 POST /v1/estimate/batch 的項目格式。
 *
 * <pre>
 * {
 *   "provider": "openai",
 *   "model": "gpt-4.1-mini",
 *   "usage": { "input_tokens_uncached": 1200, "output_tokens": 350 },
 *   "options": { "mode": "lenient", "pricing_version": "latest" },
 *   "overrides": { "ratecard": { "currency": "USD", "billable": { "input_tokens_uncached": { "per_1m": "1.0" } } } }
 * }
 * </pre>
 */
public record EstimateRequest(
    @NotBlank(message = "provider is required")
    String provider,

    @NotBlank(message = "model is required")
    String model,

    @NotEmpty(message = "usage must not be empty")
    Map<@NotEmpty String,
        @NotNull @PositiveOrZero @Max(BillingDimension.MAX_QUANTITY) Long> usage,

    @Valid
    Options options,

    @Valid
    Overrides overrides
) {
    public EstimateRequest {
        if (options == null) {
            options = Options.defaults();
        }
        if (overrides == null) {
            overrides = new Overrides(null);
        }
    }

    /**
     * 轉換為引擎的估價輸入。
     */
    public EstimateCommand toCommand() {
        OverrideRatecard override = overrides.ratecard() != null ? overrides.ratecard().toOverride() : null;
        return new EstimateCommand(provider, model, usage, options.mode(), options.pricingVersion(), null, override);
    }

    /**
     * 估價選項。
     *
     * @param pricingVersion 定價版本，預設 {@code latest}
     * @param mode {@code strict}（預設）或 {@code lenient}
     * @param gatewayPricingMode gateway 定價模式，預設 {@code prefer_gateway}
     */
    public record Options(
        String pricingVersion,

        @Pattern(regexp = "strict|lenient", message = "mode must be strict or lenient")
        String mode,

        GatewayPricingMode gatewayPricingMode
    ) {
        public Options {
            if (pricingVersion == null) {
                pricingVersion = EstimateCommand.LATEST;
            }
            if (mode == null) {
                mode = "strict";
            }
            if (gatewayPricingMode == null) {
                gatewayPricingMode = GatewayPricingMode.PREFER_GATEWAY;
            }
        }

        public static Options defaults() {
            return new Options(null, null, null);
        }
    }

    /**
     * 覆寫設定。
     *
     * @param ratecard 呼叫端提供的費率，存在時略過 registry
     */
    public record Overrides(
        @Valid
        RatecardOverride ratecard
    ) {}

    /**
     * 呼叫端提供的費率表。
     *
     * @param currency 幣別，預設 USD
     * @param billable 維度 → 費率，不可為空
     */
    public record RatecardOverride(
        String currency,

        @NotEmpty(message = "Override ratecard billable map must not be empty")
        Map<@SupportedDimension(message = "unsupported billable dimension in overrides") String,
            @NotNull @Valid RateSpec> billable
    ) {
        public RatecardOverride {
            if (currency == null) {
                currency = "USD";
            }
        }

        public OverrideRatecard toOverride() {
            Map<String, Rate> rates = new LinkedHashMap<>();
            billable.forEach((dimension, spec) -> rates.put(dimension, spec.toRate()));
            return new OverrideRatecard(currency, Ratecard.of(rates));
        }
    }

    /**
     * 單一費率，{@code per_1m} 與 {@code per_unit} 擇一。
     */
    public record RateSpec(
        @JsonProperty("per_1m")
        @PositiveOrZero(message = "Rate values must be >= 0")
        BigDecimal perMillion,

        @JsonProperty("per_unit")
        @PositiveOrZero(message = "Rate values must be >= 0")
        BigDecimal perUnit
    ) {
        @JsonIgnore
        @AssertTrue(message = "Exactly one of per_1m or per_unit must be provided")
        public boolean isSingleRate() {
            return (perMillion != null) != (perUnit != null);
        }

        public Rate toRate() {
            return perMillion != null
                ? Rate.of(RateKind.PER_MILLION, perMillion)
                : Rate.of(RateKind.PER_UNIT, perUnit);
        }
    }
}
