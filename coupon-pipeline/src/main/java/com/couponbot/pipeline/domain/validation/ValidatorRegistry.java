package com.couponbot.pipeline.domain.validation;

import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches a coupon to the first registered validator that accepts its source.
 * Expired coupons are rejected before any validator runs. Sources without a validator
 * are accepted (fail-open).
 */
@Slf4j
public class ValidatorRegistry {

    static final String EXPIRED_MESSAGE = "expired";
    static final String NO_VALIDATOR_MESSAGE = "no validator available for source ";

    private final List<CouponValidator> validators;
    private final PageFetcher fetcher;
    private final Clock clock;

    public ValidatorRegistry(List<CouponValidator> validators, PageFetcher fetcher, Clock clock) {
        this.validators = List.copyOf(validators);
        this.fetcher = fetcher;
        this.clock = clock;
    }

    public ValidationOutcome validate(Coupon coupon) {
        var now = clock.instant();
        if (coupon.isExpiredAt(now)) {
            return ValidationOutcome.invalid(EXPIRED_MESSAGE, now);
        }

        for (var validator : validators) {
            if (validator.canValidate(coupon.source())) {
                log.debug("Using {} for coupon {}", validator.name(), coupon.name());
                return validator.validate(coupon, fetcher);
            }
        }

        log.warn("No validator found for source: {}", coupon.source());
        return ValidationOutcome.valid(NO_VALIDATOR_MESSAGE + coupon.source(), now);
    }

    public List<String> validatorNames() {
        return validators.stream().map(CouponValidator::name).toList();
    }
}
