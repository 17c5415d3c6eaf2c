package io.github.samzhu.pricing.dto.api;

import java.util.List;

/**
 * 批次估價回應：成功與失敗的項目分開列出。
 */
public record BatchEstimateResponse(
    String pricingVersion,
    List<EstimateResponse> results,
    List<BatchErrorItem> errors
) {

    /**
     * 失敗項目。
     *
     * @param index 項目在請求中的位置（從 0 開始）
     * @param error 錯誤內容
     */
    public record BatchErrorItem(
        int index,
        ErrorResponse.ErrorBody error
    ) {}
}
