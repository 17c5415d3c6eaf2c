package io.github.samzhu.pricing.model;

import java.util.Objects;

/**
 * 由呼叫端提供的費率。存在時完全略過 registry 查詢與分級定價。
 *
 * @param currency 費率幣別，必須與 registry 幣別一致
 * @param ratecard 費率
 */
public record OverrideRatecard(
    String currency,
    Ratecard ratecard
) {
    public OverrideRatecard {
        Objects.requireNonNull(ratecard, "ratecard");
    }
}
