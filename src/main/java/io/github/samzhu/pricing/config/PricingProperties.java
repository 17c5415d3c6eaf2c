package io.github.samzhu.pricing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 定價服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link RegistryConfig} - 定價 registry 檔案位置與載入方式</li>
 *   <li>{@link EngineConfig} - 估價引擎版本</li>
 *   <li>{@link ApiConfig} - API 邊界限制（批次大小、請求大小）</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * pricing:
 *   registry:
 *     location: classpath:pricing/
 *     preload: true
 *   engine:
 *     version: 0.1.0
 *   api:
 *     max-batch-size: 100
 *     max-body-bytes: 1048576
 *     batch-threads: 4
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "pricing")
public record PricingProperties(
    RegistryConfig registry,
    EngineConfig engine,
    ApiConfig api
) {
    public PricingProperties {
        if (registry == null) {
            registry = RegistryConfig.defaults();
        }
        if (engine == null) {
            engine = EngineConfig.defaults();
        }
        if (api == null) {
            api = ApiConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的設定。
     */
    public static PricingProperties defaults() {
        return new PricingProperties(null, null, null);
    }

    /**
     * 定價 registry 設定。
     *
     * @param location registry 根目錄，Spring resource 位置，預設 {@code classpath:pricing/}
     * @param preload 是否在啟動時載入所有供應商檔案（格式錯誤會讓啟動失敗）
     */
    public record RegistryConfig(
        String location,
        boolean preload
    ) {
        public RegistryConfig {
            if (location == null || location.isBlank()) {
                location = "classpath:pricing/";
            }
        }

        public static RegistryConfig defaults() {
            return new RegistryConfig("classpath:pricing/", false);
        }
    }

    /**
     * 估價引擎設定。
     *
     * @param version 回應中 {@code engine_version} 的值
     */
    public record EngineConfig(
        String version
    ) {
        public EngineConfig {
            if (version == null || version.isBlank()) {
                version = "0.1.0";
            }
        }

        public static EngineConfig defaults() {
            return new EngineConfig("0.1.0");
        }
    }

    /**
     * API 邊界設定。
     *
     * @param maxBatchSize 批次估價最多項目數，預設 100
     * @param maxBodyBytes 請求 body 上限，預設 1 MiB
     * @param batchThreads 批次估價的平行執行緒數，預設 4
     */
    public record ApiConfig(
        int maxBatchSize,
        long maxBodyBytes,
        int batchThreads
    ) {
        public ApiConfig {
            if (maxBatchSize <= 0) {
                maxBatchSize = 100;
            }
            if (maxBodyBytes <= 0) {
                maxBodyBytes = 1_048_576;
            }
            if (batchThreads <= 0) {
                batchThreads = 4;
            }
        }

        public static ApiConfig defaults() {
            return new ApiConfig(100, 1_048_576, 4);
        }
    }
}
