package com.couponbot.pipeline.infrastructure.validation;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.domain.validation.ValidationOutcome;
import java.time.Clock;

/**
 * Program offers stay valid as long as their page answers 2xx.
 */
public class ProgramPageValidator extends SourceValidator {

    private final String name;
    private final String programLabel;

    public ProgramPageValidator(CouponSource source, Clock clock, String name, String programLabel) {
        super(source, clock);
        this.name = name;
        this.programLabel = programLabel;
    }

    public static ProgramPageValidator replit(Clock clock) {
        return new ProgramPageValidator(CouponSource.REPLIT, clock, "Replit Validator", "Education program");
    }

    public static ProgramPageValidator warp(Clock clock) {
        return new ProgramPageValidator(CouponSource.WARP, clock, "Warp Validator", "Student program");
    }

    public static ProgramPageValidator tabnine(Clock clock) {
        return new ProgramPageValidator(CouponSource.TABNINE, clock, "Tabnine Validator", "Student program");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ValidationOutcome validate(Coupon coupon, PageFetcher fetcher) {
        var page = fetcher.fetch(coupon.url());
        return page.isSuccess()
                ? valid(programLabel + " verified as active")
                : invalid(programLabel + " page returned status: " + page.status());
    }
}
