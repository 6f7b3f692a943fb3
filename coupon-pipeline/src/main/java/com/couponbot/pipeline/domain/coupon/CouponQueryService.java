package com.couponbot.pipeline.domain.coupon;

import com.couponbot.pipeline.domain.exceptions.CouponNotFoundException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CouponQueryService {

    private final CouponRepository couponRepository;

    public Coupon getCoupon(long couponId) {
        return couponRepository.findById(couponId)
                .orElseThrow(() -> CouponNotFoundException.of(couponId));
    }

    public List<Coupon> listCoupons(String source) {
        if (source == null || source.isBlank()) {
            return couponRepository.findAll();
        }
        return couponRepository.findBySource(source);
    }
}
