package io.github.samzhu.pricing.model;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 支援計費的用量維度。
 *
 * <p>Ratecard 的 key 與請求中的 usage key 都必須落在此列舉之內；
 * 其他 key 在 strict 模式會被拒絕，lenient 模式則略過並產生警告。
 */
public enum BillingDimension {

    INPUT_TOKENS_UNCACHED("input_tokens_uncached"),
    INPUT_TOKENS_CACHED("input_tokens_cached"),
    OUTPUT_TOKENS("output_tokens"),
    REASONING_TOKENS("reasoning_tokens"),
    EMBEDDING_TOKENS("embedding_tokens"),
    TOOL_CALLS("tool_calls"),
    IMAGE_COUNT("image_count"),
    IMAGE_MEGAPIXELS("image_megapixels"),
    AUDIO_INPUT_SECONDS("audio_input_seconds"),
    AUDIO_OUTPUT_SECONDS("audio_output_seconds"),
    REQUESTS("requests");

    /** 單一維度允許的最大數量。 */
    public static final long MAX_QUANTITY = 10_000_000_000L;

    private static final Set<String> KEYS = Arrays.stream(values())
        .map(BillingDimension::key)
        .collect(Collectors.toUnmodifiableSet());

    private final String key;

    BillingDimension(String key) {
        this.key = key;
    }

    /** @return 維度在 JSON 與 usage map 中使用的名稱 */
    public String key() {
        return key;
    }

    /**
     * 判斷名稱是否為支援的計費維度。
     *
     * @param key 維度名稱，可為 null
     * @return 若為支援的維度則回傳 true
     */
    public static boolean isSupported(String key) {
        return key != null && KEYS.contains(key);
    }
}
