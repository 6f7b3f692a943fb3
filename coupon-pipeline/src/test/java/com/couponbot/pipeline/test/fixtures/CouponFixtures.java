package com.couponbot.pipeline.test.fixtures;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import java.time.Duration;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CouponFixtures {

    public static final Instant SOME_NOW = Instant.parse("2026-03-01T12:00:00Z");
    public static final String SOME_NAME = "X Pro";
    public static final String SOME_CODE = "ABC123";
    public static final String SOME_URL = "http://x.test/offer";

    public static CouponCandidate.CouponCandidateBuilder genericCandidateBuilder() {
        return CouponCandidate.builder()
                .name(SOME_NAME)
                .description("Use code ABC123 for 20% off")
                .discountPercentage(20.0)
                .code(SOME_CODE)
                .url(SOME_URL)
                .source(CouponSource.GENERIC.label())
                .expiry(SOME_NOW.plus(Duration.ofDays(30)));
    }

    public static CouponCandidate candidate(String name, String code, String source) {
        return genericCandidateBuilder()
                .name(name)
                .code(code)
                .url("http://" + code.toLowerCase() + ".test/offer")
                .source(source)
                .build();
    }

    public static Coupon.CouponBuilder pendingCouponBuilder() {
        return genericCandidateBuilder().build()
                .toPendingCoupon(SOME_NOW)
                .toBuilder()
                .id(1L);
    }

    public static Coupon.CouponBuilder validUnpostedCouponBuilder() {
        return pendingCouponBuilder()
                .valid(true)
                .validatedAt(SOME_NOW);
    }
}
