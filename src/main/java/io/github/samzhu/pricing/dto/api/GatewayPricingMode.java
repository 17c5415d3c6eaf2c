package io.github.samzhu.pricing.dto.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Gateway 定價模式。
 *
 * <p>目前尚未實作 gateway 定價，所有請求一律使用 registry 費率；
 * 選擇 {@link #PREFER_GATEWAY} 以外的值時只會在回應中加入警告。
 */
public enum GatewayPricingMode {

    PREFER_GATEWAY("prefer_gateway"),
    PREFER_PROVIDER("prefer_provider"),
    REGISTRY_ONLY("registry_only");

    public static final String NOT_IMPLEMENTED_WARNING =
        "gateway_pricing_mode is not yet implemented; "
            + "all requests use registry pricing regardless of this setting";

    private final String value;

    GatewayPricingMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 非預設模式時回傳警告訊息。
     *
     * @return 警告列表，預設模式時為空
     */
    public List<String> advisoryWarnings() {
        return this == PREFER_GATEWAY ? List.of() : List.of(NOT_IMPLEMENTED_WARNING);
    }
}
