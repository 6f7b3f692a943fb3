package com.couponbot.pipeline.application.controller.coupon;

import com.couponbot.pipeline.application.controller.coupon.mapper.CouponResponseMapper;
import com.couponbot.pipeline.domain.coupon.CouponQueryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/coupons")
@RequiredArgsConstructor
public class CouponController {

    private final CouponQueryService couponQueryService;
    private final CouponResponseMapper mapper;

    @GetMapping
    public List<CouponResponse> listCoupons(@RequestParam(required = false) String source) {
        return couponQueryService.listCoupons(source).stream()
                .map(mapper::toResponse)
                .toList();
    }

    @GetMapping("/{couponId}")
    public CouponResponse getCoupon(@PathVariable long couponId) {
        return mapper.toResponse(couponQueryService.getCoupon(couponId));
    }
}
