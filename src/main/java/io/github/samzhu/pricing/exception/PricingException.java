package io.github.samzhu.pricing.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 定價與估價流程的結構化領域錯誤。
 *
 * <p>包含穩定的錯誤代碼、可讀訊息與可直接對外揭露的 details。
 * 引擎本身不會攔截此異常，由呼叫端（API 層或批次服務）決定如何回應：
 * <ul>
 *   <li>單筆估價：由 {@code GlobalExceptionHandler} 轉成錯誤回應</li>
 *   <li>批次估價：記錄為該筆項目的錯誤，不影響其他項目</li>
 * </ul>
 */
public class PricingException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public PricingException(ErrorCode code, String message) {
        this(code, message, Map.of());
    }

    public PricingException(ErrorCode code, String message, Map<String, ?> details) {
        super(message);
        this.code = code;
        this.details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getCode() {
        return code;
    }

    public int getStatus() {
        return code.status();
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
