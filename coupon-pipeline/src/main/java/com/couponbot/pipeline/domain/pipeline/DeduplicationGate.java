package com.couponbot.pipeline.domain.pipeline;

import com.couponbot.pipeline.domain.coupon.CouponRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Fingerprint lookup against persisted records. Only safe because batches never overlap.
 */
@Component
@RequiredArgsConstructor
public class DeduplicationGate {

    private final CouponRepository couponRepository;

    public boolean isKnown(String fingerprint) {
        return couponRepository.existsByFingerprint(fingerprint);
    }
}
