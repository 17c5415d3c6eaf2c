package io.github.samzhu.pricing.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.github.samzhu.pricing.model.OverrideRatecard;

/**
 * 單筆估價的輸入。
 *
 * <p>未指定的欄位使用預設值：
 * <ul>
 *   <li>{@code mode} - {@code "strict"}</li>
 *   <li>{@code pricingVersion} - {@code "latest"}</li>
 *   <li>{@code currency} - null，表示使用 registry 幣別</li>
 *   <li>{@code overrideRatecard} - null，表示使用 registry 費率</li>
 * </ul>
 *
 * <p>mode 保留為字串，由引擎依固定順序驗證後才轉成列舉。
 *
 * @param provider 供應商 ID 或別名
 * @param model 模型 ID 或別名
 * @param usage 維度名稱 → 用量
 * @param mode {@code strict} 或 {@code lenient}
 * @param pricingVersion 要求的定價版本
 * @param currency 要求的幣別
 * @param overrideRatecard 呼叫端提供的費率
 */
public record EstimateCommand(
    String provider,
    String model,
    Map<String, Long> usage,
    String mode,
    String pricingVersion,
    String currency,
    OverrideRatecard overrideRatecard
) {
    public static final String LATEST = "latest";

    public EstimateCommand {
        // LinkedHashMap 允許 null key/value，交由引擎回報驗證錯誤
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
        if (mode == null) {
            mode = "strict";
        }
        if (pricingVersion == null) {
            pricingVersion = LATEST;
        }
    }

    /**
     * 以預設選項建立估價輸入。
     */
    public static EstimateCommand of(String provider, String model, Map<String, Long> usage) {
        return new EstimateCommand(provider, model, usage, null, null, null, null);
    }

    public EstimateCommand withMode(String mode) {
        return new EstimateCommand(provider, model, usage, mode, pricingVersion, currency, overrideRatecard);
    }

    public EstimateCommand withPricingVersion(String pricingVersion) {
        return new EstimateCommand(provider, model, usage, mode, pricingVersion, currency, overrideRatecard);
    }

    public EstimateCommand withCurrency(String currency) {
        return new EstimateCommand(provider, model, usage, mode, pricingVersion, currency, overrideRatecard);
    }

    public EstimateCommand withOverride(OverrideRatecard overrideRatecard) {
        return new EstimateCommand(provider, model, usage, mode, pricingVersion, currency, overrideRatecard);
    }
}
