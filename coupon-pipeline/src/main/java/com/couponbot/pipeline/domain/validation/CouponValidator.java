package com.couponbot.pipeline.domain.validation;

import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.fetch.PageFetcher;

public interface CouponValidator {

    String name();

    boolean canValidate(String sourceLabel);

    ValidationOutcome validate(Coupon coupon, PageFetcher fetcher);
}
