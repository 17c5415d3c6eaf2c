package io.github.samzhu.pricing.dto.api;

import java.util.List;
import java.util.TreeSet;

import io.github.samzhu.pricing.model.ModelPricing;
import io.github.samzhu.pricing.model.ProviderPricing;

/**
 * 供應商列表回應。
 *
 * <p>用於 GET /v1/providers 端點。
 */
public record ProvidersResponse(
    String pricingVersion,
    List<ProviderSummary> providers
) {

    /**
     * 供應商摘要。
     *
     * @param provider 供應商 ID
     * @param modelCount 模型數量
     * @param capabilities 所有模型能力的聯集，依字母排序
     */
    public record ProviderSummary(
        String provider,
        int modelCount,
        List<String> capabilities
    ) {
        public static ProviderSummary from(ProviderPricing provider) {
            TreeSet<String> capabilities = new TreeSet<>();
            for (ModelPricing model : provider.models().values()) {
                capabilities.addAll(model.capabilities());
            }
            return new ProviderSummary(provider.id(), provider.models().size(), List.copyOf(capabilities));
        }
    }
}
