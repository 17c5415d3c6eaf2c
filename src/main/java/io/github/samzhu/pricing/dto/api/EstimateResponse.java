package io.github.samzhu.pricing.dto.api;

import java.util.ArrayList;
import java.util.List;

import io.github.samzhu.pricing.dto.EstimateResult;

/**
 * 單筆估價回應。
 *
 * <pre>
 * {
 *   "pricing_version": "2026-02-22",
 *   "provider": "openai",
 *   "model": "gpt-4.1-mini",
 *   "breakdown": [ { "dimension": "input_tokens_uncached", "quantity": 1200, "rate": "0.80", "cost": "0.000960" } ],
 *   "total": { "currency": "USD", "cost": "0.000960" },
 *   "warnings": [],
 *   "meta": { "computed_at": "2026-02-23T01:02:03Z", "engine_version": "0.1.0" }
 * }
 * </pre>
 */
public record EstimateResponse(
    String pricingVersion,
    String provider,
    String model,
    List<BreakdownEntry> breakdown,
    TotalCost total,
    List<String> warnings,
    Meta meta
) {

    /**
     * 單一維度的成本明細。
     */
    public record BreakdownEntry(
        String dimension,
        long quantity,
        String rate,
        String cost
    ) {}

    /**
     * 總成本。
     */
    public record TotalCost(
        String currency,
        String cost
    ) {}

    /**
     * 計算資訊。
     */
    public record Meta(
        String computedAt,
        String engineVersion
    ) {}

    /**
     * 從估價結果建立回應，{@code extraWarnings} 附加在引擎警告之後。
     */
    public static EstimateResponse from(EstimateResult result, List<String> extraWarnings) {
        List<String> warnings = new ArrayList<>(result.warnings());
        warnings.addAll(extraWarnings);

        List<BreakdownEntry> breakdown = result.breakdown().stream()
            .map(item -> new BreakdownEntry(item.dimension(), item.quantity(), item.rate(), item.cost()))
            .toList();

        return new EstimateResponse(
            result.pricingVersion(),
            result.provider(),
            result.model(),
            breakdown,
            new TotalCost(result.currency(), result.totalCost()),
            warnings,
            new Meta(result.computedAt().toString(), result.engineVersion())
        );
    }
}
