package com.couponbot.pipeline.infrastructure.db.mapper;

import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.infrastructure.db.CouponEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface CouponEntityMapper {

    CouponEntity toEntity(Coupon coupon);

    Coupon toDomain(CouponEntity entity);
}
