package io.github.samzhu.pricing.dto.api;

import java.util.Map;

import io.github.samzhu.pricing.exception.PricingException;

/**
 * 錯誤回應外層：{@code {"error": {"code", "message", "details"}}}。
 */
public record ErrorResponse(ErrorBody error) {

    /**
     * 錯誤內容。details 只包含可對外揭露的資訊。
     */
    public record ErrorBody(
        String code,
        String message,
        Map<String, Object> details
    ) {
        public ErrorBody {
            if (details == null) {
                details = Map.of();
            }
        }

        public static ErrorBody from(PricingException e) {
            return new ErrorBody(e.getCode().name(), e.getMessage(), e.getDetails());
        }
    }

    public static ErrorResponse of(String code, String message, Map<String, Object> details) {
        return new ErrorResponse(new ErrorBody(code, message, details));
    }

    public static ErrorResponse from(PricingException e) {
        return new ErrorResponse(ErrorBody.from(e));
    }
}
