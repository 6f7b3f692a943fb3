package com.couponbot.pipeline.domain.exceptions;

public class CouponNotFoundException extends RuntimeException {

    private CouponNotFoundException(String message) {
        super(message);
    }

    public static CouponNotFoundException of(long couponId) {
        return new CouponNotFoundException("Coupon not found: " + couponId);
    }
}
