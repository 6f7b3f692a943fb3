package com.couponbot.pipeline.domain.notification;

import com.couponbot.pipeline.domain.coupon.Coupon;

/**
 * Delivers one message per validated coupon.
 * Throws {@link com.couponbot.pipeline.domain.exceptions.NotificationDeliveryException} when delivery fails.
 */
public interface CouponNotifier {

    void deliver(Coupon coupon);
}
