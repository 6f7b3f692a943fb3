package com.couponbot.pipeline.infrastructure.validation;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.domain.validation.ValidationOutcome;
import java.time.Clock;

public class GitHubValidator extends SourceValidator {

    public GitHubValidator(Clock clock) {
        super(CouponSource.GITHUB, clock);
    }

    @Override
    public String name() {
        return "GitHub Validator";
    }

    @Override
    public ValidationOutcome validate(Coupon coupon, PageFetcher fetcher) {
        var page = fetcher.fetch(coupon.url());
        if (!page.isSuccess()) {
            return invalid("GitHub Education page returned status: " + page.status());
        }
        return page.contains(coupon.name())
                ? valid("Offer found on GitHub Education page")
                : invalid("Offer not found on GitHub Education page");
    }
}
