package io.github.samzhu.pricing.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

/**
 * 驗證字串為支援的計費維度名稱。null 視為合法，需搭配 {@code @NotNull} / {@code @NotBlank}。
 *
 * <p>可標註在 Map key 上，例如 {@code Map<@SupportedDimension String, RateDocument>}。
 *
 * @see io.github.samzhu.pricing.model.BillingDimension
 */
@Documented
@Constraint(validatedBy = SupportedDimensionValidator.class)
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
public @interface SupportedDimension {

    String message() default "must be a supported billing dimension";

    /** 是否接受合成維度 {@code context_tokens}（分級定價條件使用）。 */
    boolean allowContextTokens() default false;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
