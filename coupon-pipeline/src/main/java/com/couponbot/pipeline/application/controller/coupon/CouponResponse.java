package com.couponbot.pipeline.application.controller.coupon;

import java.time.Instant;

public record CouponResponse(
        Long id,
        String fingerprint,
        String name,
        String description,
        Double discountPercentage,
        String code,
        String url,
        String source,
        Instant expiry,
        Instant createdAt,
        Instant validatedAt,
        boolean valid,
        boolean posted) {}
