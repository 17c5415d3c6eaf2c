package io.github.samzhu.pricing.model;

/**
 * 費率種類。
 *
 * <p>{@link #PER_MILLION} 以每百萬單位計價（token 類維度），
 * {@link #PER_UNIT} 以每單位計價（圖片、請求次數、秒數等）。
 */
public enum RateKind {

    PER_MILLION("per_1m"),
    PER_UNIT("per_unit");

    private final String tag;

    RateKind(String tag) {
        this.tag = tag;
    }

    /** @return registry 檔案與 API 回應中使用的欄位名稱 */
    public String tag() {
        return tag;
    }
}
