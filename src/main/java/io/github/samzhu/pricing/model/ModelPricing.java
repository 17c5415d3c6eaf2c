package io.github.samzhu.pricing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 單一模型的定價資料。
 *
 * @param id 正規化（非別名）的模型 ID
 * @param effectiveFrom 生效日期（ISO 格式字串）
 * @param ratecard 基本費率
 * @param tiers 分級定價，依檔案中的順序保存
 * @param capabilities 模型能力標籤，例如 {@code chat}、{@code vision}
 * @param metadata 其他描述資訊
 */
public record ModelPricing(
    String id,
    String effectiveFrom,
    Ratecard ratecard,
    List<PricingTier> tiers,
    List<String> capabilities,
    Map<String, Object> metadata
) {
    public ModelPricing {
        tiers = tiers == null ? List.of() : List.copyOf(tiers);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasTiers() {
        return !tiers.isEmpty();
    }
}
