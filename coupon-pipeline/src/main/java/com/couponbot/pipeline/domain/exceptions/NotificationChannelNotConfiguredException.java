package com.couponbot.pipeline.domain.exceptions;

public class NotificationChannelNotConfiguredException extends RuntimeException {

    private NotificationChannelNotConfiguredException(String message) {
        super(message);
    }

    public static NotificationChannelNotConfiguredException noChannel() {
        return new NotificationChannelNotConfiguredException(
                "No notification channel configured: set coupons.discord.webhook-url"
                        + " or coupons.discord.bot-token with coupons.discord.channel-id");
    }

    public static NotificationChannelNotConfiguredException missingChannelId() {
        return new NotificationChannelNotConfiguredException(
                "coupons.discord.channel-id must be set when using coupons.discord.bot-token");
    }
}
