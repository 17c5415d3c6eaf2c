package io.github.samzhu.pricing.dto.api;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * 批次估價請求。
 *
 * <p>用於 POST /v1/estimate/batch 端點，項目數上限由 {@code pricing.api.max-batch-size} 設定。
 */
public record BatchEstimateRequest(
    @NotEmpty(message = "items must not be empty")
    List<@NotNull @Valid EstimateRequest> items
) {}
