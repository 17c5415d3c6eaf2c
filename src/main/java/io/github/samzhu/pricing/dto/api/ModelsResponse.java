package io.github.samzhu.pricing.dto.api;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.github.samzhu.pricing.model.ModelPricing;
import io.github.samzhu.pricing.repository.PricingRepository;

/**
 * 模型列表回應。
 *
 * <p>用於 GET /v1/models?provider=&amp;include_rates= 端點。
 */
public record ModelsResponse(
    String pricingVersion,
    String provider,
    List<ModelSummary> models
) {

    /**
     * 模型摘要。
     *
     * @param model 模型 ID
     * @param effectiveFrom 生效日期
     * @param capabilities 能力標籤
     * @param metadata 描述資訊，沒有時不輸出
     * @param billable 費率（{@code include_rates=true} 時才提供）
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ModelSummary(
        String model,
        String effectiveFrom,
        List<String> capabilities,
        Map<String, Object> metadata,
        Map<String, Map<String, String>> billable
    ) {
        public static ModelSummary from(ModelPricing model, boolean includeRates) {
            return new ModelSummary(
                model.id(),
                model.effectiveFrom(),
                model.capabilities(),
                model.metadata().isEmpty() ? null : model.metadata(),
                includeRates ? PricingRepository.serializeRatecard(model.ratecard()) : null
            );
        }
    }
}
