package io.github.samzhu.pricing.repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.json.JsonMapper;

import io.github.samzhu.pricing.document.ModelDocument;
import io.github.samzhu.pricing.document.ProviderDocument;
import io.github.samzhu.pricing.document.RateDocument;
import io.github.samzhu.pricing.document.RegistryMetaDocument;
import io.github.samzhu.pricing.document.TierDocument;
import io.github.samzhu.pricing.exception.RegistryLoadException;
import io.github.samzhu.pricing.model.ModelPricing;
import io.github.samzhu.pricing.model.ProviderPricing;
import io.github.samzhu.pricing.model.Rate;
import io.github.samzhu.pricing.model.Ratecard;
import io.github.samzhu.pricing.model.RegistryMeta;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;

/**
 * 以檔案為來源的定價 Registry。
 *
 * <p>目錄結構（{@code location} 可為 {@code classpath:} 或 {@code file:} 路徑）：
 * <pre>
 * pricing/
 *   registry_meta.json        定價版本、幣別
 *   providers/&lt;provider&gt;.json  每個供應商一個檔案，檔名即供應商 ID
 *   aliases/*.json            模型別名與供應商別名
 * </pre>
 *
 * <p>載入策略：
 * <ul>
 *   <li>中繼資料在建構時載入並驗證，之後不變</li>
 *   <li>供應商檔案在建構時只掃描檔名，首次查詢時才解析並快取</li>
 *   <li>別名對照表在首次解析別名時載入一次</li>
 * </ul>
 *
 * <p>所有檔案在解析後以 Jakarta Bean Validation 驗證，任何違規皆為致命錯誤
 * （{@link RegistryLoadException}），依 JSON 路徑排序後回報第一筆（例如 {@code models.0.billable.output_tokens.per_1m}）。
 *
 * <p>執行緒安全：快取皆為「只寫入一次」，供應商快取使用
 * {@link ConcurrentHashMap#computeIfAbsent}，別名表在鎖內載入後以 volatile 發佈。
 */
public class PricingRepository {

    private static final Logger log = LoggerFactory.getLogger(PricingRepository.class);

    private static final String META_FILE = "registry_meta.json";
    private static final String JSON_SUFFIX = ".json";

    private static final List<Class<?>> DOCUMENT_TYPES = List.of(
        RegistryMetaDocument.class, ProviderDocument.class, ModelDocument.class,
        TierDocument.class, TierDocument.Condition.class, RateDocument.class);

    private static final Comparator<List<String>> PATH_ORDER = PricingRepository::comparePaths;

    private final ResourcePatternResolver resolver;
    private final String location;
    private final Validator validator;
    private final JsonMapper mapper;
    private final Map<String, String> jsonNames;

    private final RegistryMeta meta;
    private final Map<String, Resource> providerFiles;
    private final Map<String, ProviderPricing> providerCache = new ConcurrentHashMap<>();

    private final Object aliasLock = new Object();
    private volatile AliasIndex aliasIndex;

    public PricingRepository(ResourcePatternResolver resolver, String location, Validator validator) {
        this.resolver = resolver;
        this.location = location.endsWith("/") ? location : location + "/";
        this.validator = validator;
        this.mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();
        this.jsonNames = jsonPropertyNames(mapper);

        this.meta = loadMeta();
        this.providerFiles = discoverProviders();
        log.info("Pricing registry initialized: location={}, pricingVersion={}, currency={}, providers={}",
            this.location, meta.pricingVersion(), meta.currency(), providerFiles.keySet());
    }

    // ===== 中繼資料 =====

    public String pricingVersion() {
        return meta.pricingVersion();
    }

    public String currency() {
        return meta.currency();
    }

    public RegistryMeta meta() {
        return meta;
    }

    // ===== 查詢 =====

    /**
     * 列出所有供應商 ID（依字母排序）。
     */
    public List<String> listProviders() {
        return List.copyOf(providerFiles.keySet());
    }

    /**
     * 以供應商 ID 或別名取得定價資料。
     *
     * @param provider 供應商 ID 或別名
     * @return 供應商定價，若別名解析後仍找不到則為 empty
     * @throws RegistryLoadException 若供應商檔案格式錯誤
     */
    public Optional<ProviderPricing> getProvider(String provider) {
        String canonical = resolveProvider(provider);
        Resource file = providerFiles.get(canonical);
        if (file == null) {
            return Optional.empty();
        }
        return Optional.of(providerCache.computeIfAbsent(canonical, id -> loadProvider(file)));
    }

    /**
     * 沿著供應商別名鏈解析出正規化 ID。
     *
     * <p>若別名資料出現循環，回傳原始輸入而不是無限迴圈。
     *
     * @param provider 供應商 ID 或別名
     * @return 正規化 ID；沒有別名時回傳原值
     */
    public String resolveProvider(String provider) {
        Map<String, String> aliases = aliases().providerAliases();
        Set<String> visited = new HashSet<>();
        String resolved = provider;

        while (true) {
            if (!visited.add(resolved)) {
                log.warn("Provider alias cycle detected for '{}', visited={}", provider, visited);
                return provider;
            }
            String next = aliases.get(resolved);
            if (next == null) {
                return resolved;
            }
            resolved = next;
        }
    }

    /**
     * 在供應商範圍內解析模型別名（單層）。
     *
     * @param provider 供應商 ID 或別名
     * @param model 模型 ID 或別名
     * @return 正規化模型 ID；沒有別名時回傳原值
     */
    public String resolveModel(String provider, String model) {
        String canonicalProvider = resolveProvider(provider);
        return aliases().modelAliases()
            .getOrDefault(canonicalProvider, Map.of())
            .getOrDefault(model, model);
    }

    /**
     * 取得模型定價，供應商與模型皆支援別名。
     */
    public Optional<ModelPricing> getModel(String provider, String model) {
        return getProvider(provider)
            .map(data -> data.models().get(resolveModel(provider, model)));
    }

    /**
     * 列出供應商的所有模型（依模型 ID 排序）；未知供應商回傳空列表。
     */
    public List<ModelPricing> listModels(String provider) {
        return getProvider(provider)
            .map(data -> List.copyOf(data.models().values()))
            .orElse(List.of());
    }

    /**
     * 將 ratecard 轉為對外格式：{@code {dimension: {"per_1m": "0.40"}}}，依維度排序。
     */
    public static Map<String, Map<String, String>> serializeRatecard(Ratecard ratecard) {
        Map<String, Map<String, String>> serialized = new LinkedHashMap<>();
        for (Map.Entry<String, Rate> entry : ratecard.rates().entrySet()) {
            Rate rate = entry.getValue();
            serialized.put(entry.getKey(), Map.of(rate.kind().tag(), rate.raw()));
        }
        return serialized;
    }

    /**
     * 預先載入別名表與所有供應商檔案，讓格式錯誤在啟動時就失敗。
     */
    public void preload() {
        aliases();
        providerFiles.keySet().forEach(this::getProvider);
        log.info("Pricing registry preloaded: {} providers, {} models",
            providerCache.size(),
            providerCache.values().stream().mapToInt(p -> p.models().size()).sum());
    }

    // ===== 載入 =====

    private RegistryMeta loadMeta() {
        Resource file = resolver.getResource(location + META_FILE);
        if (!file.exists()) {
            throw new RegistryLoadException(META_FILE, "Registry metadata not found at " + location + META_FILE);
        }
        RegistryMetaDocument document = readDocument(file, RegistryMetaDocument.class);
        validate(document, META_FILE);
        return document.toMeta();
    }

    private Map<String, Resource> discoverProviders() {
        Map<String, Resource> result = new TreeMap<>();
        for (Resource file : listJson("providers")) {
            String filename = file.getFilename();
            result.put(filename.substring(0, filename.length() - JSON_SUFFIX.length()), file);
        }
        return result;
    }

    private ProviderPricing loadProvider(Resource file) {
        String filename = file.getFilename();
        ProviderDocument document = readDocument(file, ProviderDocument.class);
        validate(document, filename);

        Map<String, ModelPricing> models = new LinkedHashMap<>();
        for (ModelDocument entry : document.models()) {
            if (models.containsKey(entry.model())) {
                throw new RegistryLoadException(filename,
                    String.format("Duplicate model '%s' in %s", entry.model(), filename));
            }
            models.put(entry.model(), entry.toModel());
        }

        log.debug("Provider pricing loaded: provider={}, file={}, models={}",
            document.provider(), filename, models.size());
        return new ProviderPricing(document.provider(), models, document.source());
    }

    private AliasIndex aliases() {
        AliasIndex current = aliasIndex;
        if (current != null) {
            return current;
        }
        synchronized (aliasLock) {
            if (aliasIndex == null) {
                aliasIndex = loadAliases();
            }
            return aliasIndex;
        }
    }

    private AliasIndex loadAliases() {
        Map<String, String> providerAliases = new LinkedHashMap<>();
        Map<String, Map<String, String>> modelAliases = new LinkedHashMap<>();

        for (Resource file : listJson("aliases")) {
            JsonNode root = readTree(file);

            JsonNode provider = root.path("provider");
            JsonNode mapping = root.path("aliases");
            if (provider.isTextual() && mapping.isObject()) {
                Map<String, String> entries = new LinkedHashMap<>();
                mapping.fields().forEachRemaining(e -> entries.put(e.getKey(), e.getValue().asText()));
                modelAliases.put(provider.asText(), Map.copyOf(entries));
            }

            JsonNode providerMapping = root.path("provider_aliases");
            if (providerMapping.isObject()) {
                providerMapping.fields().forEachRemaining(e -> providerAliases.put(e.getKey(), e.getValue().asText()));
            }
        }

        log.info("Aliases loaded: {} provider aliases, {} providers with model aliases",
            providerAliases.size(), modelAliases.size());
        return new AliasIndex(Map.copyOf(providerAliases), Map.copyOf(modelAliases));
    }

    private List<Resource> listJson(String directory) {
        // 目錄可省略（例如沒有任何別名檔）
        if (!resolver.getResource(location + directory + "/").exists()) {
            log.debug("Registry directory not present: {}{}", location, directory);
            return List.of();
        }
        try {
            Resource[] resources = resolver.getResources(location + directory + "/*" + JSON_SUFFIX);
            return Arrays.stream(resources)
                .filter(r -> r.getFilename() != null)
                .sorted(Comparator.comparing(Resource::getFilename))
                .toList();
        } catch (IOException e) {
            throw new RegistryLoadException(directory, "Failed to scan " + location + directory, e);
        }
    }

    private <T> T readDocument(Resource file, Class<T> type) {
        String filename = file.getFilename();
        try (InputStream in = file.getInputStream()) {
            return mapper.readValue(in, type);
        } catch (JsonMappingException e) {
            String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                .collect(Collectors.joining("."));
            throw new RegistryLoadException(filename, formatFailure(filename, path, e.getOriginalMessage()), e);
        } catch (JsonProcessingException e) {
            throw new RegistryLoadException(filename,
                "Invalid JSON in " + filename + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RegistryLoadException(filename, "Failed to read " + filename, e);
        }
    }

    private JsonNode readTree(Resource file) {
        String filename = file.getFilename();
        try (InputStream in = file.getInputStream()) {
            return mapper.readTree(in);
        } catch (IOException e) {
            throw new RegistryLoadException(filename, "Failed to read alias file " + filename, e);
        }
    }

    private <T> void validate(T document, String filename) {
        Set<ConstraintViolation<T>> violations = validator.validate(document);
        if (violations.isEmpty()) {
            return;
        }
        ConstraintViolation<T> first = violations.stream()
            .min(Comparator.comparing((ConstraintViolation<T> v) -> jsonPath(v.getPropertyPath()), PATH_ORDER)
                .thenComparing(ConstraintViolation::getMessage))
            .orElseThrow();
        throw new RegistryLoadException(filename,
            formatFailure(filename, String.join(".", jsonPath(first.getPropertyPath())), first.getMessage()));
    }

    /**
     * 將 Bean Validation 的屬性路徑轉為 JSON 路徑片段，例如
     * {@code models[0].billable[output_tokens].perMillion} → {@code [models, 0, billable, output_tokens, per_1m]}。
     */
    private List<String> jsonPath(Path path) {
        List<String> parts = new ArrayList<>();
        for (Path.Node node : path) {
            if (node.isInIterable()) {
                if (node.getIndex() != null) {
                    parts.add(String.valueOf(node.getIndex()));
                } else if (node.getKey() != null) {
                    parts.add(String.valueOf(node.getKey()));
                }
            }
            String name = node.getName();
            // 容器元素節點（<list element>、<map key> 等）沒有對應的 JSON 欄位
            if (name != null && !name.startsWith("<")) {
                parts.add(jsonNames.getOrDefault(name, name));
            }
        }
        return parts;
    }

    /**
     * 逐段比較路徑，兩段皆為數字時依數值比較。
     */
    private static int comparePaths(List<String> left, List<String> right) {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            String a = left.get(i);
            String b = right.get(i);
            int result = isIndex(a) && isIndex(b)
                ? Long.compare(Long.parseLong(a), Long.parseLong(b))
                : a.compareTo(b);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static boolean isIndex(String part) {
        return !part.isEmpty() && part.length() < 19 && part.chars().allMatch(Character::isDigit);
    }

    /**
     * 文件 record 的 Java 屬性名稱 → JSON 欄位名稱，由 Jackson 的 bean 描述取得。
     */
    private static Map<String, String> jsonPropertyNames(JsonMapper mapper) {
        Map<String, String> names = new HashMap<>();
        for (Class<?> type : DOCUMENT_TYPES) {
            BeanDescription description = mapper.getSerializationConfig().introspect(mapper.constructType(type));
            for (BeanPropertyDefinition property : description.findProperties()) {
                names.putIfAbsent(property.getInternalName(), property.getName());
            }
        }
        return Map.copyOf(names);
    }

    private static String formatFailure(String filename, String path, String message) {
        String at = path == null || path.isEmpty() ? "" : " at '" + path + "'";
        return "Schema validation failed for " + filename + at + ": " + message;
    }

    /**
     * 別名對照表：供應商別名 → 供應商 ID；供應商 ID → (模型別名 → 模型 ID)。
     */
    private record AliasIndex(
        Map<String, String> providerAliases,
        Map<String, Map<String, String>> modelAliases
    ) {}
}
