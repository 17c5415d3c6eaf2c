package io.github.samzhu.pricing.exception;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import io.github.samzhu.pricing.dto.api.ErrorResponse;

/**
 * 將例外轉換為統一的錯誤回應 {@code {"error": {"code", "message", "details"}}}。
 *
 * <ul>
 *   <li>{@link PricingException} - 依錯誤代碼決定狀態碼，details 原樣輸出</li>
 *   <li>請求格式或 Bean Validation 錯誤 - 400 {@code INVALID_REQUEST}</li>
 *   <li>其他例外 - 500 {@code INTERNAL_ERROR}，只寫入日誌，不揭露細節</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_FAILED = "Request validation failed";

    @ExceptionHandler(PricingException.class)
    public ResponseEntity<ErrorResponse> handlePricing(PricingException ex) {
        log.info("Pricing error: code={}, status={}, message={}", ex.getCode(), ex.getStatus(), ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<Map<String, Object>> errors = new ArrayList<>();
        ex.getBindingResult().getFieldErrors().forEach(error -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("field", error.getField());
            item.put("message", error.getDefaultMessage());
            errors.add(item);
        });
        ex.getBindingResult().getGlobalErrors().forEach(error -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("field", error.getObjectName());
            item.put("message", error.getDefaultMessage());
            errors.add(item);
        });
        log.info("Validation error: {}", errors);
        return invalidRequest(Map.of("validation_errors", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.info("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return invalidRequest(Map.of("validation_errors",
            List.of(Map.of("message", "Malformed or unreadable JSON body"))));
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        log.info("Bad request: {}", ex.getMessage());
        return invalidRequest(Map.of("validation_errors", List.of(Map.of("message", ex.getMessage()))));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException ex) {
        return ResponseEntity.status(ex.getStatusCode())
            .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST.name(), "Not found",
                Map.of("path", "/" + ex.getResourcePath())));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(ex.getStatusCode())
            .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST.name(), "Method not allowed",
                Map.of("method", ex.getMethod())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(ErrorCode.INTERNAL_ERROR.status())
            .body(ErrorResponse.of(ErrorCode.INTERNAL_ERROR.name(), "Internal server error", Map.of()));
    }

    private static ResponseEntity<ErrorResponse> invalidRequest(Map<String, Object> details) {
        return ResponseEntity.status(ErrorCode.INVALID_REQUEST.status())
            .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST.name(), VALIDATION_FAILED, details));
    }
}
