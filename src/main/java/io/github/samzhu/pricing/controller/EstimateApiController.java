package io.github.samzhu.pricing.controller;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.pricing.config.PricingProperties;
import io.github.samzhu.pricing.dto.EstimateCommand;
import io.github.samzhu.pricing.dto.EstimateResult;
import io.github.samzhu.pricing.dto.api.BatchEstimateRequest;
import io.github.samzhu.pricing.dto.api.BatchEstimateResponse;
import io.github.samzhu.pricing.dto.api.BatchEstimateResponse.BatchErrorItem;
import io.github.samzhu.pricing.dto.api.ErrorResponse.ErrorBody;
import io.github.samzhu.pricing.dto.api.EstimateRequest;
import io.github.samzhu.pricing.dto.api.EstimateResponse;
import io.github.samzhu.pricing.exception.ErrorCode;
import io.github.samzhu.pricing.exception.PricingException;
import io.github.samzhu.pricing.repository.PricingRepository;
import io.github.samzhu.pricing.service.BatchEstimationService;
import io.github.samzhu.pricing.service.BatchEstimationService.BatchOutcome;
import io.github.samzhu.pricing.service.CostEstimationService;

/**
 * 估價 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /v1/estimate} - 單筆估價</li>
 *   <li>{@code POST /v1/estimate/batch} - 批次估價（部分成功）</li>
 * </ul>
 */
@RestController
@RequestMapping("/v1/estimate")
public class EstimateApiController {

    private static final Logger log = LoggerFactory.getLogger(EstimateApiController.class);

    private final CostEstimationService estimationService;
    private final BatchEstimationService batchService;
    private final PricingRepository repository;
    private final int maxBatchSize;

    public EstimateApiController(CostEstimationService estimationService,
                                 BatchEstimationService batchService,
                                 PricingRepository repository,
                                 PricingProperties properties) {
        this.estimationService = estimationService;
        this.batchService = batchService;
        this.repository = repository;
        this.maxBatchSize = properties.api().maxBatchSize();
    }

    /**
     * 單筆估價。
     *
     * <p>端點：{@code POST /v1/estimate}
     *
     * @param request 估價請求
     * @return 估價回應；驗證或定價錯誤由 {@code GlobalExceptionHandler} 轉成錯誤回應
     */
    @PostMapping
    public ResponseEntity<EstimateResponse> estimate(@RequestBody @Validated EstimateRequest request) {
        log.info("API request: estimate provider={}, model={}", request.provider(), request.model());

        EstimateResult result = estimationService.estimate(request.toCommand());

        return ResponseEntity.ok(EstimateResponse.from(result,
            request.options().gatewayPricingMode().advisoryWarnings()));
    }

    /**
     * 批次估價。單一項目失敗不影響其他項目。
     *
     * <p>端點：{@code POST /v1/estimate/batch}
     *
     * @param request 批次請求
     * @return 成功結果與失敗項目
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchEstimateResponse> estimateBatch(@RequestBody @Validated BatchEstimateRequest request) {
        List<EstimateRequest> items = request.items();
        log.info("API request: estimateBatch items={}", items.size());

        if (items.size() > maxBatchSize) {
            throw new PricingException(ErrorCode.INVALID_REQUEST, "Batch size exceeds limit",
                Map.of("max_items", maxBatchSize, "items", items.size()));
        }

        List<EstimateCommand> commands = items.stream().map(EstimateRequest::toCommand).toList();
        List<BatchOutcome> outcomes = batchService.estimateAll(commands);

        List<EstimateResponse> results = new ArrayList<>();
        List<BatchErrorItem> errors = new ArrayList<>();
        for (BatchOutcome outcome : outcomes) {
            if (outcome.isFailure()) {
                errors.add(new BatchErrorItem(outcome.index(), ErrorBody.from(outcome.error())));
                continue;
            }
            EstimateRequest item = items.get(outcome.index());
            results.add(EstimateResponse.from(outcome.result(),
                item.options().gatewayPricingMode().advisoryWarnings()));
        }

        log.debug("estimateBatch response: {} results, {} errors", results.size(), errors.size());
        return ResponseEntity.ok(new BatchEstimateResponse(repository.pricingVersion(), results, errors));
    }
}
