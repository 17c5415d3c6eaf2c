package io.github.samzhu.pricing.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import io.github.samzhu.pricing.repository.PricingRepository;
import jakarta.validation.Validator;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link PricingProperties} 的型別安全配置綁定，並建立：
 * <ul>
 *   <li>{@link PricingRepository} - 依 {@code pricing.registry.location} 載入定價檔案</li>
 *   <li>{@code estimationExecutor} - 批次估價使用的執行緒池</li>
 * </ul>
 *
 * @see PricingProperties
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class AppConfig {

    /**
     * 定價 registry。中繼資料格式錯誤時建構即失敗，啟動中止。
     */
    @Bean
    public PricingRepository pricingRepository(ResourceLoader resourceLoader,
                                               Validator validator,
                                               PricingProperties properties) {
        PricingRepository repository = new PricingRepository(
            ResourcePatternUtils.getResourcePatternResolver(resourceLoader),
            properties.registry().location(), validator);
        if (properties.registry().preload()) {
            repository.preload();
        }
        return repository;
    }

    @Bean(name = "estimationExecutor")
    public ThreadPoolTaskExecutor estimationExecutor(PricingProperties properties) {
        int threads = properties.api().batchThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.api().maxBatchSize() * 10);
        executor.setThreadNamePrefix("estimate-");
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
