package io.github.samzhu.pricing.model;

import java.util.Objects;

/**
 * 分級定價：條件成立時以 {@code ratecard} 取代模型的基本費率。
 *
 * @param condition 觸發條件
 * @param ratecard 該級距的費率
 */
public record PricingTier(
    TierCondition condition,
    Ratecard ratecard
) {
    public PricingTier {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(ratecard, "ratecard");
    }
}
