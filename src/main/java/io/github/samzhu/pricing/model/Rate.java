package io.github.samzhu.pricing.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 單一計費維度的費率。
 *
 * <p>{@code raw} 保留輸入時的原始字串（例如 {@code "0.40"}），
 * 回應中一律輸出 raw，避免序列化時產生精度或格式漂移。
 *
 * @param kind 費率種類
 * @param value 費率數值，必須大於或等於 0
 * @param raw 原始數值字串
 */
public record Rate(
    RateKind kind,
    BigDecimal value,
    String raw
) {
    public Rate {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Rate value must be >= 0: " + value);
        }
        if (raw == null || raw.isBlank()) {
            raw = value.toPlainString();
        }
    }

    /**
     * 以 BigDecimal 建立費率，raw 使用 {@link BigDecimal#toPlainString()}。
     */
    public static Rate of(RateKind kind, BigDecimal value) {
        return new Rate(kind, value, value.toPlainString());
    }

    /**
     * 從原始字串建立費率。
     *
     * @throws NumberFormatException 若字串不是合法的十進位數字
     */
    public static Rate parse(RateKind kind, String raw) {
        return new Rate(kind, new BigDecimal(raw), raw);
    }

    /**
     * 計算指定數量的未捨入成本。
     *
     * <p>每百萬計價：{@code quantity / 1,000,000 × value}；
     * 每單位計價：{@code quantity × value}。結果為精確的十進位數，不做捨入。
     *
     * @param quantity 用量
     * @return 精確成本
     */
    public BigDecimal costFor(long quantity) {
        BigDecimal amount = BigDecimal.valueOf(quantity);
        return switch (kind) {
            // 除以 10^6 只移動小數點，結果永遠精確
            case PER_MILLION -> amount.movePointLeft(6).multiply(value);
            case PER_UNIT -> amount.multiply(value);
        };
    }

    /**
     * 建立每百萬單位計價的費率，供測試與 override 使用。
     */
    public static Rate perMillion(String raw) {
        return parse(RateKind.PER_MILLION, raw);
    }

    /**
     * 建立每單位計價的費率，供測試與 override 使用。
     */
    public static Rate perUnit(String raw) {
        return parse(RateKind.PER_UNIT, raw);
    }
}
