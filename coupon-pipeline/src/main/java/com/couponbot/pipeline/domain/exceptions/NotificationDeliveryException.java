package com.couponbot.pipeline.domain.exceptions;

public class NotificationDeliveryException extends RuntimeException {

    private NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NotificationDeliveryException of(String couponName, Throwable cause) {
        return new NotificationDeliveryException(
                "Failed to deliver notification for coupon '" + couponName + "': " + cause.getMessage(), cause);
    }
}
