package io.github.samzhu.pricing.validation;

import io.github.samzhu.pricing.model.BillingDimension;
import io.github.samzhu.pricing.model.TierCondition;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * {@link SupportedDimension} 的驗證實作。
 */
public class SupportedDimensionValidator implements ConstraintValidator<SupportedDimension, String> {

    private boolean allowContextTokens;

    @Override
    public void initialize(SupportedDimension annotation) {
        this.allowContextTokens = annotation.allowContextTokens();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        if (allowContextTokens && TierCondition.CONTEXT_TOKENS.equals(value)) {
            return true;
        }
        return BillingDimension.isSupported(value);
    }
}
