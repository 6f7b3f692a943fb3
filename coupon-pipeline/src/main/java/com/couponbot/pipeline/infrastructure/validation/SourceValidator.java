package com.couponbot.pipeline.infrastructure.validation;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.validation.CouponValidator;
import com.couponbot.pipeline.domain.validation.ValidationOutcome;
import java.time.Clock;

/**
 * Validator bound to exactly one source label.
 */
public abstract class SourceValidator implements CouponValidator {

    private final CouponSource source;
    protected final Clock clock;

    protected SourceValidator(CouponSource source, Clock clock) {
        this.source = source;
        this.clock = clock;
    }

    @Override
    public boolean canValidate(String sourceLabel) {
        return source.matches(sourceLabel);
    }

    protected ValidationOutcome valid(String message) {
        return ValidationOutcome.valid(message, clock.instant());
    }

    protected ValidationOutcome invalid(String message) {
        return ValidationOutcome.invalid(message, clock.instant());
    }
}
