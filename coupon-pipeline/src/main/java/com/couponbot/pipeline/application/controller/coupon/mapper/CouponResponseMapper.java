package com.couponbot.pipeline.application.controller.coupon.mapper;

import com.couponbot.pipeline.application.controller.coupon.CouponResponse;
import com.couponbot.pipeline.domain.coupon.Coupon;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface CouponResponseMapper {

    CouponResponse toResponse(Coupon coupon);
}
