package io.github.samzhu.pricing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Pricing Service - LLM API 定價 Registry 與成本估算服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>從版本化的 JSON 檔案載入各供應商的模型費率</li>
 *   <li>解析供應商與模型別名</li>
 *   <li>依用量計算精確成本（含分級定價、strict/lenient 模式）</li>
 *   <li>提供 REST API 查詢供應商、模型與估價</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Client → /v1/estimate ─→ CostEstimationService ─→ PricingRepository
 *                                                        ↓
 *                                          pricing/registry_meta.json
 *                                          pricing/providers/*.json
 *                                          pricing/aliases/*.json
 * </pre>
 */
@SpringBootApplication
public class PricingApplication {

    private static final Logger log = LoggerFactory.getLogger(PricingApplication.class);

    public static void main(String[] args) {
        log.info("Starting Pricing Service - LLM Cost Estimation");
        SpringApplication.run(PricingApplication.class, args);
    }
}
