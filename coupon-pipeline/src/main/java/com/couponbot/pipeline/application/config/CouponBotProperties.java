package com.couponbot.pipeline.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "coupons")
public record CouponBotProperties(
        @NotNull @Valid Scraping scraping,
        @NotNull @Valid Validation validation,
        @NotNull @Valid Discord discord) {

    public record Scraping(
            @Min(1) int intervalMinutes,
            @Min(1) int maxConcurrent,
            @NotBlank String userAgent,
            @NotNull Duration requestTimeout,
            @NotNull List<String> genericUrls) {}

    public record Validation(boolean enabled, @NotNull Duration timeout) {}

    /**
     * Exactly one channel is used: the webhook when set, otherwise the bot token with its channel id.
     */
    public record Discord(String webhookUrl, String botToken, String channelId, @NotBlank String username) {

        public boolean hasWebhook() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }

        public boolean hasBotToken() {
            return botToken != null && !botToken.isBlank();
        }

        public boolean hasChannelId() {
            return channelId != null && !channelId.isBlank();
        }
    }
}
