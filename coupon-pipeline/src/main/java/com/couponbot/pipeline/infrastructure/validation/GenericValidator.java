package com.couponbot.pipeline.infrastructure.validation;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.domain.validation.ValidationOutcome;
import java.time.Clock;

/**
 * The source page must still be reachable and still mention the code.
 */
public class GenericValidator extends SourceValidator {

    public GenericValidator(Clock clock) {
        super(CouponSource.GENERIC, clock);
    }

    @Override
    public String name() {
        return "Generic Validator";
    }

    @Override
    public ValidationOutcome validate(Coupon coupon, PageFetcher fetcher) {
        var page = fetcher.fetch(coupon.url());
        if (!page.isSuccess()) {
            return invalid("Source page returned status: " + page.status());
        }
        return page.contains(coupon.code())
                ? valid("Coupon code found on source page")
                : invalid("Coupon code not found on source page");
    }
}
