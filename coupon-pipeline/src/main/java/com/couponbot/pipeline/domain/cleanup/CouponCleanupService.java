package com.couponbot.pipeline.domain.cleanup;

import com.couponbot.pipeline.domain.coupon.CouponRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CouponCleanupService {

    private final CouponRepository couponRepository;

    public int purgeExpired() {
        var deleted = couponRepository.deleteExpired();
        log.info("Cleanup complete: {} expired coupons deleted", deleted);
        return deleted;
    }
}
