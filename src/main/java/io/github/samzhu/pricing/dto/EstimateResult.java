package io.github.samzhu.pricing.dto;

import java.time.Instant;
import java.util.List;

/**
 * 單筆估價結果，建立後不可變。
 *
 * <p>成本皆為固定 6 位小數的字串（例如 {@code "0.002240"}）。
 *
 * @param pricingVersion 使用的定價版本
 * @param provider 呼叫端傳入的供應商字串（保留別名）
 * @param model 正規化模型 ID；使用 override 時為呼叫端傳入的字串
 * @param breakdown 各維度成本明細，依維度名稱排序
 * @param currency 幣別
 * @param totalCost 總成本
 * @param warnings 警告訊息（分級定價在前，略過的維度在後）
 * @param computedAt 計算時間 (UTC)
 * @param engineVersion 引擎版本
 */
public record EstimateResult(
    String pricingVersion,
    String provider,
    String model,
    List<BreakdownItem> breakdown,
    String currency,
    String totalCost,
    List<String> warnings,
    Instant computedAt,
    String engineVersion
) {
    public EstimateResult {
        breakdown = List.copyOf(breakdown);
        warnings = List.copyOf(warnings);
    }

    /**
     * 單一維度的成本明細。
     *
     * @param dimension 維度名稱
     * @param quantity 用量
     * @param rate 費率原始字串
     * @param cost 捨入至 6 位小數的成本
     */
    public record BreakdownItem(
        String dimension,
        long quantity,
        String rate,
        String cost
    ) {}
}
