package io.github.samzhu.pricing.controller;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.pricing.dto.api.HealthResponse;
import io.github.samzhu.pricing.dto.api.ModelsResponse;
import io.github.samzhu.pricing.dto.api.ModelsResponse.ModelSummary;
import io.github.samzhu.pricing.dto.api.ProvidersResponse;
import io.github.samzhu.pricing.dto.api.ProvidersResponse.ProviderSummary;
import io.github.samzhu.pricing.dto.api.VersionResponse;
import io.github.samzhu.pricing.exception.ErrorCode;
import io.github.samzhu.pricing.exception.PricingException;
import io.github.samzhu.pricing.model.ProviderPricing;
import io.github.samzhu.pricing.repository.PricingRepository;
import io.github.samzhu.pricing.service.CostEstimationService;

/**
 * 定價 registry 查詢 API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /v1/providers} - 供應商列表</li>
 *   <li>{@code GET /v1/models?provider=} - 供應商的模型列表（支援別名）</li>
 *   <li>{@code GET /v1/versions} - 目前定價版本</li>
 *   <li>{@code GET /v1/healthz} - 存活檢查</li>
 * </ul>
 */
@RestController
@RequestMapping("/v1")
public class RegistryApiController {

    private static final Logger log = LoggerFactory.getLogger(RegistryApiController.class);

    private final PricingRepository repository;
    private final CostEstimationService estimationService;

    public RegistryApiController(PricingRepository repository, CostEstimationService estimationService) {
        this.repository = repository;
        this.estimationService = estimationService;
    }

    /**
     * 列出所有供應商及其模型數量與能力。
     */
    @GetMapping("/providers")
    public ResponseEntity<ProvidersResponse> listProviders() {
        log.info("API request: listProviders");

        List<ProviderSummary> providers = repository.listProviders().stream()
            .map(repository::getProvider)
            .flatMap(Optional::stream)
            .map(ProviderSummary::from)
            .toList();

        return ResponseEntity.ok(new ProvidersResponse(repository.pricingVersion(), providers));
    }

    /**
     * 列出供應商的模型。
     *
     * @param provider 供應商 ID 或別名
     * @param includeRates 是否附上費率
     * @return 模型列表；未知供應商回傳 {@code PROVIDER_NOT_SUPPORTED}
     */
    @GetMapping("/models")
    public ResponseEntity<ModelsResponse> listModels(
            @RequestParam String provider,
            @RequestParam(name = "include_rates", defaultValue = "false") boolean includeRates) {

        log.info("API request: listModels provider={}, includeRates={}", provider, includeRates);

        ProviderPricing data = repository.getProvider(provider)
            .orElseThrow(() -> new PricingException(ErrorCode.PROVIDER_NOT_SUPPORTED,
                "Provider not supported", Map.of("provider", provider)));

        List<ModelSummary> models = data.models().values().stream()
            .map(model -> ModelSummary.from(model, includeRates))
            .toList();

        return ResponseEntity.ok(new ModelsResponse(repository.pricingVersion(), provider, models));
    }

    @GetMapping("/versions")
    public ResponseEntity<VersionResponse> versions() {
        return ResponseEntity.ok(new VersionResponse(repository.pricingVersion()));
    }

    @GetMapping("/healthz")
    public ResponseEntity<HealthResponse> healthz() {
        return ResponseEntity.ok(new HealthResponse("ok", repository.pricingVersion(),
            estimationService.engineVersion()));
    }
}
