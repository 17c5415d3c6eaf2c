package io.github.samzhu.pricing.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.pricing.config.PricingProperties;
import io.github.samzhu.pricing.dto.EstimateCommand;
import io.github.samzhu.pricing.dto.EstimateResult;
import io.github.samzhu.pricing.dto.EstimateResult.BreakdownItem;
import io.github.samzhu.pricing.exception.ErrorCode;
import io.github.samzhu.pricing.exception.PricingException;
import io.github.samzhu.pricing.model.BillingDimension;
import io.github.samzhu.pricing.model.EstimateMode;
import io.github.samzhu.pricing.model.ModelPricing;
import io.github.samzhu.pricing.model.OverrideRatecard;
import io.github.samzhu.pricing.model.PricingTier;
import io.github.samzhu.pricing.model.ProviderPricing;
import io.github.samzhu.pricing.model.Rate;
import io.github.samzhu.pricing.model.Ratecard;
import io.github.samzhu.pricing.repository.PricingRepository;

/**
 * LLM API 用量成本估算引擎。
 *
 * <p>處理流程：
 * <ol>
 *   <li>依序驗證定價版本、幣別、模式、用量（第一個錯誤即中止）</li>
 *   <li>決定費率：override ratecard，或 registry 查詢（別名解析 + 分級定價）</li>
 *   <li>依維度名稱排序逐一計算成本</li>
 * </ol>
 *
 * <p>計算公式：
 * <pre>
 * per_1m   成本 = quantity / 1,000,000 × rate
 * per_unit 成本 = quantity × rate
 * </pre>
 *
 * <p>捨入規則：全程使用 {@link BigDecimal} 精確運算。每一行明細各自以
 * HALF_UP 捨入到 6 位小數；總成本是「未捨入明細」的精確加總再捨入一次，
 * 因此總成本不一定等於明細的加總。
 *
 * <p>此服務無狀態，可同時被多個執行緒呼叫；所有錯誤皆以 {@link PricingException} 拋出。
 */
@Service
public class CostEstimationService {

    private static final Logger log = LoggerFactory.getLogger(CostEstimationService.class);

    private static final int COST_SCALE = 6;

    private final PricingRepository repository;
    private final String engineVersion;

    public CostEstimationService(PricingRepository repository, PricingProperties properties) {
        this.repository = repository;
        this.engineVersion = properties.engine().version();
        log.info("CostEstimationService initialized: engineVersion={}, pricingVersion={}",
            engineVersion, repository.pricingVersion());
    }

    public String engineVersion() {
        return engineVersion;
    }

    /**
     * 估算單筆用量的成本。
     *
     * @param command 估價輸入
     * @return 估價結果
     * @throws PricingException 驗證失敗、找不到供應商/模型，或 strict 模式下遇到沒有費率的維度
     */
    public EstimateResult estimate(EstimateCommand command) {
        validatePricingVersion(command.pricingVersion());
        validateCurrency(command.currency() != null ? command.currency() : repository.currency());
        EstimateMode mode = parseMode(command.mode());
        validateUsage(command.usage());

        ResolvedRates resolved = resolveRates(command);

        List<String> warnings = new ArrayList<>();
        resolved.tierWarning().ifPresent(warnings::add);

        List<BreakdownItem> breakdown = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (Map.Entry<String, Long> entry : new TreeMap<>(command.usage()).entrySet()) {
            String dimension = entry.getKey();
            long quantity = entry.getValue();
            if (quantity == 0) {
                continue;
            }

            Optional<Rate> rate = BillingDimension.isSupported(dimension)
                ? resolved.ratecard().rateFor(dimension)
                : Optional.empty();
            if (rate.isEmpty()) {
                handleUnratedDimension(mode, command.provider(), resolved.model(), dimension, warnings);
                continue;
            }

            BigDecimal cost = rate.get().costFor(quantity);
            total = total.add(cost);
            breakdown.add(new BreakdownItem(dimension, quantity, rate.get().raw(), toFixed6(cost)));
        }

        String totalCost = toFixed6(total);
        log.debug("Estimate computed: provider={}, model={}, dimensions={}, total={}, warnings={}",
            command.provider(), resolved.model(), breakdown.size(), totalCost, warnings.size());

        return new EstimateResult(
            repository.pricingVersion(),
            command.provider(),
            resolved.model(),
            breakdown,
            repository.currency(),
            totalCost,
            warnings,
            Instant.now(),
            engineVersion
        );
    }

    /**
     * 將精確成本以 HALF_UP 捨入為固定 6 位小數的字串。
     */
    static String toFixed6(BigDecimal value) {
        return value.setScale(COST_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    // ===== 費率決定 =====

    private ResolvedRates resolveRates(EstimateCommand command) {
        OverrideRatecard override = command.overrideRatecard();
        if (override != null) {
            if (!repository.currency().equals(override.currency())) {
                throw new PricingException(ErrorCode.INVALID_REQUEST,
                    "Override currency must be " + repository.currency(),
                    details("currency", override.currency()));
            }
            return new ResolvedRates(command.model(), override.ratecard(), Optional.empty());
        }

        ProviderPricing provider = repository.getProvider(command.provider())
            .orElseThrow(() -> new PricingException(ErrorCode.PROVIDER_NOT_SUPPORTED,
                "Provider not supported", details("provider", command.provider())));

        String resolvedModel = repository.resolveModel(command.provider(), command.model());
        ModelPricing model = provider.models().get(resolvedModel);
        if (model == null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("provider", command.provider());
            details.put("model", command.model());
            throw new PricingException(ErrorCode.MODEL_NOT_FOUND, "Model not found", details);
        }

        return selectTier(model, command.usage())
            .map(tier -> {
                long value = tier.condition().valueOf(command.usage());
                String warning = String.format("Pricing tier applied: %s %d > %d.",
                    tier.condition().dimension(), value, tier.condition().threshold());
                log.info("Pricing tier applied: provider={}, model={}, {}={} > {}",
                    provider.id(), resolvedModel, tier.condition().dimension(), value,
                    tier.condition().threshold());
                return new ResolvedRates(resolvedModel, tier.ratecard(), Optional.of(warning));
            })
            .orElseGet(() -> new ResolvedRates(resolvedModel, model.ratecard(), Optional.empty()));
    }

    /**
     * 依門檻由高到低檢查，回傳第一個條件成立（嚴格大於）的級距。
     */
    private Optional<PricingTier> selectTier(ModelPricing model, Map<String, Long> usage) {
        if (!model.hasTiers()) {
            return Optional.empty();
        }
        return model.tiers().stream()
            .sorted(Comparator.comparingLong((PricingTier t) -> t.condition().threshold()).reversed())
            .filter(tier -> tier.condition().isMetBy(tier.condition().valueOf(usage)))
            .findFirst();
    }

    private void handleUnratedDimension(EstimateMode mode, String provider, String model,
                                        String dimension, List<String> warnings) {
        switch (mode) {
            case STRICT -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("provider", provider);
                details.put("model", model);
                details.put("dimension", dimension);
                throw new PricingException(ErrorCode.UNSUPPORTED_DIMENSION, "Unsupported dimension", details);
            }
            case LENIENT -> warnings.add(String.format(
                "Ignored unsupported dimension '%s' for provider '%s' model '%s'", dimension, provider, model));
        }
    }

    // ===== 驗證 =====

    private void validatePricingVersion(String pricingVersion) {
        if (EstimateCommand.LATEST.equals(pricingVersion) || repository.pricingVersion().equals(pricingVersion)) {
            return;
        }
        throw new PricingException(ErrorCode.PRICING_VERSION_NOT_FOUND,
            "Pricing version not found", details("pricing_version", pricingVersion));
    }

    private void validateCurrency(String currency) {
        if (repository.currency().equals(currency)) {
            return;
        }
        throw new PricingException(ErrorCode.INVALID_REQUEST,
            "Currency must be " + repository.currency(), details("currency", currency));
    }

    private EstimateMode parseMode(String mode) {
        return EstimateMode.parse(mode)
            .orElseThrow(() -> new PricingException(ErrorCode.INVALID_REQUEST,
                "Mode must be strict or lenient", details("mode", mode)));
    }

    private void validateUsage(Map<String, Long> usage) {
        for (Map.Entry<String, Long> entry : usage.entrySet()) {
            String dimension = entry.getKey();
            Long quantity = entry.getValue();

            if (dimension == null || dimension.isEmpty()) {
                throw new PricingException(ErrorCode.INVALID_REQUEST,
                    "Usage dimensions must be non-empty strings", details("dimension", dimension));
            }
            if (quantity == null) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("dimension", dimension);
                details.put("quantity", null);
                throw new PricingException(ErrorCode.INVALID_REQUEST, "Usage quantities must be integers", details);
            }
            if (quantity < 0 || quantity > BillingDimension.MAX_QUANTITY) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("dimension", dimension);
                details.put("min", 0);
                details.put("max", BillingDimension.MAX_QUANTITY);
                details.put("quantity", quantity);
                throw new PricingException(ErrorCode.INVALID_REQUEST, "Usage quantity out of range", details);
            }
        }
    }

    private static Map<String, Object> details(String key, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(key, value);
        return details;
    }

    /**
     * 費率決定的結果。
     *
     * @param model 回傳給呼叫端的模型 ID
     * @param ratecard 實際使用的費率
     * @param tierWarning 套用分級定價時的警告
     */
    private record ResolvedRates(
        String model,
        Ratecard ratecard,
        Optional<String> tierWarning
    ) {}
}
