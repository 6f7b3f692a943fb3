package com.couponbot.pipeline.infrastructure.validation;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.domain.validation.ValidationOutcome;
import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Student offers are checked against their page; promotion codes only by format.
 */
public class CursorAiValidator extends SourceValidator {

    private static final String STUDENT_CODE = "STUDENT";
    private static final Pattern CODE_FORMAT = Pattern.compile("[A-Za-z0-9-]{4,}");

    public CursorAiValidator(Clock clock) {
        super(CouponSource.CURSOR_AI, clock);
    }

    @Override
    public String name() {
        return "Cursor AI Validator";
    }

    @Override
    public ValidationOutcome validate(Coupon coupon, PageFetcher fetcher) {
        if (STUDENT_CODE.equals(coupon.code()) && coupon.url() != null && coupon.url().contains("/student")) {
            var page = fetcher.fetch(coupon.url());
            return page.isSuccess()
                    ? valid("Student program verified as active")
                    : invalid("Student program page returned status: " + page.status());
        }

        return coupon.code() != null && CODE_FORMAT.matcher(coupon.code()).matches()
                ? valid("Coupon code format is valid")
                : invalid("Invalid coupon code format");
    }
}
