package io.github.samzhu.pricing.model;

import java.util.Map;

/**
 * 分級定價的觸發條件：當 {@code dimension} 的用量嚴格大於 {@code threshold} 時成立。
 *
 * <p>{@code dimension} 可以是一般的 usage key，或合成維度 {@value #CONTEXT_TOKENS}
 * （= {@code input_tokens_uncached + input_tokens_cached}）。
 *
 * @param dimension 條件維度
 * @param threshold 門檻值（不含）
 */
public record TierCondition(
    String dimension,
    long threshold
) {
    public static final String CONTEXT_TOKENS = "context_tokens";

    /**
     * 從 usage 取得此條件所對應的數值，缺少的維度視為 0。
     */
    public long valueOf(Map<String, Long> usage) {
        if (CONTEXT_TOKENS.equals(dimension)) {
            return quantity(usage, BillingDimension.INPUT_TOKENS_UNCACHED.key())
                + quantity(usage, BillingDimension.INPUT_TOKENS_CACHED.key());
        }
        return quantity(usage, dimension);
    }

    /**
     * 判斷條件是否成立。等於門檻時不成立。
     */
    public boolean isMetBy(long value) {
        return value > threshold;
    }

    private static long quantity(Map<String, Long> usage, String key) {
        Long value = usage.get(key);
        return value != null ? value : 0L;
    }
}
