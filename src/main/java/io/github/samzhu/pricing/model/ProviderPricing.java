package io.github.samzhu.pricing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 供應商及其所有模型的定價資料。
 *
 * @param id 正規化的供應商 ID
 * @param models 模型 ID 對應的定價，依模型 ID 排序
 * @param source 定價來源資訊（URL、擷取日期等），可為空
 */
public record ProviderPricing(
    String id,
    Map<String, ModelPricing> models,
    Map<String, Object> source
) {
    public ProviderPricing {
        models = models == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(models));
        source = source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
