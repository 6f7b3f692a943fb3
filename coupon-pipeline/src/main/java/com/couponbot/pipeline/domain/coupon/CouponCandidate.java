package com.couponbot.pipeline.domain.coupon;

import com.couponbot.common.fingerprint.CouponFingerprint;
import java.time.Instant;
import lombok.Builder;

/**
 * Freshly collected offer, not yet deduplicated or persisted.
 */
@Builder(toBuilder = true)
public record CouponCandidate(
        String name,
        String description,
        Double discountPercentage,
        String code,
        String url,
        String source,
        Instant expiry
) {

    public String fingerprint() {
        return CouponFingerprint.of(name, code, url);
    }

    /**
     * Pending record for first insert: not validated, not posted.
     */
    public Coupon toPendingCoupon(Instant observedAt) {
        return Coupon.builder()
                .fingerprint(fingerprint())
                .name(name)
                .description(description)
                .discountPercentage(discountPercentage)
                .code(code)
                .url(url)
                .source(source)
                .expiry(expiry)
                .createdAt(observedAt)
                .valid(false)
                .posted(false)
                .build();
    }
}
