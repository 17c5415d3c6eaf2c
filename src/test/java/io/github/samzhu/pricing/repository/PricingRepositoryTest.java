package io.github.samzhu.pricing.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import io.github.samzhu.pricing.exception.RegistryLoadException;
import io.github.samzhu.pricing.model.ModelPricing;
import io.github.samzhu.pricing.model.ProviderPricing;
import io.github.samzhu.pricing.model.RateKind;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

class PricingRepositoryTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static PricingRepository repository(String location) {
        return new PricingRepository(new PathMatchingResourcePatternResolver(), location, VALIDATOR);
    }

    @Test
    void shouldLoadBundledRegistryMetadata() {
        PricingRepository repository = repository("classpath:pricing/");

        assertThat(repository.pricingVersion()).isEqualTo("2026-02-22");
        assertThat(repository.currency()).isEqualTo("USD");
        assertThat(repository.meta().schemaVersion()).isEqualTo(1);
    }

    @Test
    void shouldListBundledProvidersSorted() {
        PricingRepository repository = repository("classpath:pricing/");

        assertThat(repository.listProviders())
            .containsExactly("anthropic", "aws_bedrock", "deepseek", "google", "groq", "kimi",
                "mistral", "openai", "openrouter", "together", "xai");
    }

    @Test
    void shouldParseRatesKeepingRawText() {
        PricingRepository repository = repository("classpath:pricing/");

        // When
        ModelPricing model = repository.getModel("openai", "gpt-4.1-mini").orElseThrow();

        // Then: raw 保留檔案中的數字文字
        assertThat(model.ratecard().rateFor("input_tokens_uncached")).hasValueSatisfying(rate -> {
            assertThat(rate.kind()).isEqualTo(RateKind.PER_MILLION);
            assertThat(rate.raw()).isEqualTo("0.80");
        });
        assertThat(model.ratecard().rateFor("reasoning_tokens")).isEmpty();
        assertThat(model.capabilities()).contains("chat");
    }

    @Test
    void shouldResolveProviderAliases() {
        PricingRepository repository = repository("classpath:pricing/");

        assertThat(repository.resolveProvider("grok")).isEqualTo("xai");
        assertThat(repository.resolveProvider("bedrock")).isEqualTo("aws_bedrock");
        assertThat(repository.resolveProvider("openai")).isEqualTo("openai");
        assertThat(repository.resolveProvider("nobody")).isEqualTo("nobody");
        assertThat(repository.getProvider("grok")).map(ProviderPricing::id).hasValue("xai");
    }

    @Test
    void shouldResolveModelAliasesWithinProvider() {
        PricingRepository repository = repository("classpath:pricing/");

        assertThat(repository.resolveModel("openai", "gpt-5")).isEqualTo("gpt-5.2");
        assertThat(repository.resolveModel("openai", "gpt-4.1-mini")).isEqualTo("gpt-4.1-mini");
        // 模型別名只在所屬供應商範圍內有效
        assertThat(repository.resolveModel("anthropic", "gpt-5")).isEqualTo("gpt-5");
        assertThat(repository.getModel("openai", "gpt-5")).map(ModelPricing::id).hasValue("gpt-5.2");
    }

    @Test
    void shouldFollowProviderAliasChains() {
        PricingRepository repository = repository("classpath:registry/cyclic/");

        assertThat(repository.resolveProvider("first")).isEqualTo("alpha");
        assertThat(repository.resolveModel("first", "alpha-latest")).isEqualTo("alpha-1");
    }

    @Test
    void shouldReturnOriginalInputOnAliasCycle() {
        PricingRepository repository = repository("classpath:registry/cyclic/");

        assertThat(repository.resolveProvider("loop-a")).isEqualTo("loop-a");
        assertThat(repository.resolveProvider("loop-b")).isEqualTo("loop-b");
        assertThat(repository.getProvider("loop-a")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForUnknownProviderOrModel() {
        PricingRepository repository = repository("classpath:pricing/");

        assertThat(repository.getProvider("nonexistent")).isEmpty();
        assertThat(repository.getModel("nonexistent", "gpt-4.1-mini")).isEmpty();
        assertThat(repository.getModel("openai", "does-not-exist")).isEmpty();
        assertThat(repository.listModels("nonexistent")).isEmpty();
    }

    @Test
    void shouldListModelsSortedById() {
        PricingRepository repository = repository("classpath:pricing/");

        List<String> ids = repository.listModels("bedrock").stream().map(ModelPricing::id).toList();

        assertThat(ids).containsExactly(
            "anthropic/claude-sonnet-4-5@us-east-1",
            "moonshot/kimi-k2-thinking@us-east-1");
    }

    @Test
    void shouldParsePricingTiers() {
        PricingRepository repository = repository("classpath:registry/tiered/");

        ModelPricing model = repository.getModel("acme", "acme-latest").orElseThrow();

        assertThat(model.hasTiers()).isTrue();
        assertThat(model.tiers()).hasSize(2);
        assertThat(model.tiers().get(0).condition().dimension()).isEqualTo("context_tokens");
        assertThat(model.tiers().get(0).condition().threshold()).isEqualTo(100_000L);
    }

    @Test
    void shouldSerializeRatecardWithRateKindTags() {
        PricingRepository repository = repository("classpath:pricing/");
        ModelPricing model = repository.getModel("openai", "gpt-image-1").orElseThrow();

        Map<String, Map<String, String>> serialized = PricingRepository.serializeRatecard(model.ratecard());

        assertThat(serialized).containsOnlyKeys("image_count", "input_tokens_uncached");
        assertThat(serialized.get("image_count")).containsExactly(Map.entry("per_unit", "0.04"));
        assertThat(serialized.get("input_tokens_uncached")).containsExactly(Map.entry("per_1m", "5.00"));
        assertThat(serialized.keySet()).containsExactly("image_count", "input_tokens_uncached");
    }

    @Test
    void shouldLoadProviderFilesLazily() {
        // Given: 含有格式錯誤檔案的 registry，建構時只掃描檔名
        PricingRepository repository = repository("classpath:registry/invalid/");

        // Then
        assertThat(repository.listProviders()).containsExactly("badkey", "broken", "malformed", "unknown");
        assertThatThrownBy(repository::preload).isInstanceOf(RegistryLoadException.class);
    }

    @Test
    void shouldRejectDuplicateModels() {
        PricingRepository repository = repository("classpath:registry/duplicate/");

        assertThat(repository.getProvider("fine")).isPresent();
        assertThatThrownBy(() -> repository.getProvider("dup"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessage("Duplicate model 'same-model' in dup.json")
            .extracting("filename").isEqualTo("dup.json");
    }

    @Test
    void shouldReportSchemaViolationWithFileAndPath() {
        PricingRepository repository = repository("classpath:registry/invalid/");

        assertThatThrownBy(() -> repository.getProvider("broken"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessageStartingWith(
                "Schema validation failed for broken.json at 'models.0.billable.output_tokens.per_1m': ");
    }

    @Test
    void shouldReportMapKeyViolationByJsonPath() {
        PricingRepository repository = repository("classpath:registry/invalid/");

        assertThatThrownBy(() -> repository.getProvider("badkey"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessage("Schema validation failed for badkey.json at 'models.0.billable.input_tokens': "
                + "must be a supported billing dimension");
    }

    @Test
    void shouldReportFirstViolationInNumericIndexOrder() {
        // Given: models[2] 與 models[10] 都有錯誤，字串排序會把 models[10] 排在前面
        PricingRepository repository = repository("classpath:registry/ordering/");

        assertThatThrownBy(() -> repository.getProvider("many"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessageStartingWith(
                "Schema validation failed for many.json at 'models.2.billable.input_tokens_uncached.per_1m': ");
    }

    @Test
    void shouldTreatMissingAliasDirectoryAsNoAliases() {
        // Given: registry 沒有 aliases/ 目錄
        PricingRepository repository = repository("classpath:registry/duplicate/");

        // Then
        assertThat(repository.resolveProvider("fine")).isEqualTo("fine");
        assertThat(repository.resolveModel("fine", "fine-1")).isEqualTo("fine-1");
        assertThat(repository.getModel("fine", "fine-1")).map(ModelPricing::id).hasValue("fine-1");
    }

    @Test
    void shouldTreatMissingProviderDirectoryAsEmptyRegistry() {
        PricingRepository repository = repository("classpath:registry/empty/");

        assertThat(repository.listProviders()).isEmpty();
        assertThat(repository.getProvider("openai")).isEmpty();
    }

    @Test
    void shouldRejectUnknownProperties() {
        PricingRepository repository = repository("classpath:registry/invalid/");

        assertThatThrownBy(() -> repository.getProvider("unknown"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessageStartingWith("Schema validation failed for unknown.json")
            .hasMessageContaining("price_multiplier");
    }

    @Test
    void shouldRejectMalformedJson() {
        PricingRepository repository = repository("classpath:registry/invalid/");

        assertThatThrownBy(() -> repository.getProvider("malformed"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessageContaining("malformed.json");
    }

    @Test
    void shouldFailFastOnInvalidMetadata() {
        assertThatThrownBy(() -> repository("classpath:registry/bad-meta/"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessageStartingWith("Schema validation failed for registry_meta.json at 'currency'");
    }

    @Test
    void shouldFailWhenMetadataMissing() {
        assertThatThrownBy(() -> repository("classpath:registry/does-not-exist/"))
            .isInstanceOf(RegistryLoadException.class)
            .hasMessageContaining("registry_meta.json");
    }

    @Test
    void shouldShareSingleParsedProviderAcrossConcurrentFirstAccess() throws Exception {
        // Given
        PricingRepository repository = repository("classpath:pricing/");
        pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<ProviderPricing>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            String provider = i % 2 == 0 ? "xai" : "grok";
            futures.add(pool.submit(() -> {
                start.await();
                return repository.getProvider(provider).orElseThrow();
            }));
        }

        // When
        start.countDown();
        await().atMost(Duration.ofSeconds(5))
            .until(() -> futures.stream().allMatch(Future::isDone));

        // Then: 所有執行緒拿到同一個快取實例
        ProviderPricing first = futures.get(0).get();
        for (Future<ProviderPricing> future : futures) {
            assertThat(future.get()).isSameAs(first);
        }
    }
}
