package com.couponbot.pipeline.domain.coupon;

import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record Coupon(
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
        boolean posted
) {

    public boolean isExpiredAt(Instant now) {
        return expiry != null && expiry.isBefore(now);
    }
}
