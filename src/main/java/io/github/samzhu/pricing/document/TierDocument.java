package io.github.samzhu.pricing.document;

import java.util.LinkedHashMap;
import java.util.Map;

import io.github.samzhu.pricing.model.PricingTier;
import io.github.samzhu.pricing.model.Rate;
import io.github.samzhu.pricing.model.Ratecard;
import io.github.samzhu.pricing.model.TierCondition;
import io.github.samzhu.pricing.validation.SupportedDimension;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 模型的分級定價項目。
 *
 * <pre>
 * {
 *   "condition": { "dimension": "context_tokens", "gt": 200000 },
 *   "billable": { "input_tokens_uncached": { "per_1m": 2.50 } }
 * }
 * </pre>
 */
public record TierDocument(
    @NotNull
    @Valid
    Condition condition,

    @NotEmpty
    Map<@SupportedDimension String, @NotNull @Valid RateDocument> billable
) {
    /**
     * 分級條件：{@code dimension} 的用量大於 {@code gt} 時成立。
     */
    public record Condition(
        @NotBlank
        @SupportedDimension(allowContextTokens = true)
        String dimension,

        @NotNull
        @PositiveOrZero
        Long gt
    ) {}

    public PricingTier toTier() {
        Map<String, Rate> rates = new LinkedHashMap<>();
        billable.forEach((dimension, rate) -> rates.put(dimension, rate.toRate()));
        return new PricingTier(new TierCondition(condition.dimension(), condition.gt()), Ratecard.of(rates));
    }
}
