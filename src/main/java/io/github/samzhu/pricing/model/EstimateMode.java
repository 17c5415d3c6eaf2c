package io.github.samzhu.pricing.model;

import java.util.Optional;

/**
 * 遇到沒有費率的維度時的處理方式。
 */
public enum EstimateMode {

    /** 拒絕整筆估價。 */
    STRICT("strict"),
    /** 略過該維度並加入警告。 */
    LENIENT("lenient");

    private final String value;

    EstimateMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 解析模式字串（區分大小寫）。
     *
     * @return 對應的模式；無法辨識時為 empty
     */
    public static Optional<EstimateMode> parse(String value) {
        for (EstimateMode mode : values()) {
            if (mode.value.equals(value)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
