package io.github.samzhu.pricing.document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.pricing.model.ModelPricing;
import io.github.samzhu.pricing.model.Rate;
import io.github.samzhu.pricing.model.Ratecard;
import io.github.samzhu.pricing.validation.SupportedDimension;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * 供應商檔案中的單一模型項目。
 */
public record ModelDocument(
    @NotBlank
    String model,

    @JsonProperty("effective_from")
    @NotNull
    @Pattern(regexp = DocumentPatterns.ISO_DATE, message = "must start with an ISO date (YYYY-MM-DD)")
    String effectiveFrom,

    @NotEmpty
    Map<@SupportedDimension String, @NotNull @Valid RateDocument> billable,

    List<@NotBlank String> capabilities,

    Map<String, Object> metadata,

    @JsonProperty("pricing_tiers")
    List<@NotNull @Valid TierDocument> pricingTiers
) {
    public ModelPricing toModel() {
        Map<String, Rate> rates = new LinkedHashMap<>();
        billable.forEach((dimension, rate) -> rates.put(dimension, rate.toRate()));
        return new ModelPricing(
            model,
            effectiveFrom,
            Ratecard.of(rates),
            pricingTiers == null ? List.of() : pricingTiers.stream().map(TierDocument::toTier).toList(),
            capabilities,
            metadata
        );
    }
}
