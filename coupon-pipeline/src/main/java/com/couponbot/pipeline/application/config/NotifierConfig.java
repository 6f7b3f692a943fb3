package com.couponbot.pipeline.application.config;

import com.couponbot.pipeline.domain.exceptions.NotificationChannelNotConfiguredException;
import com.couponbot.pipeline.domain.notification.CouponNotifier;
import com.couponbot.pipeline.infrastructure.discord.DiscordChannelNotifier;
import com.couponbot.pipeline.infrastructure.discord.DiscordEmbedFactory;
import com.couponbot.pipeline.infrastructure.discord.DiscordWebhookNotifier;
import java.net.URI;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Picks the Discord delivery mechanism at startup. A missing channel fails the context.
 */
@Slf4j
@Configuration
public class NotifierConfig {

    @Bean
    public DiscordEmbedFactory discordEmbedFactory(Clock clock) {
        return new DiscordEmbedFactory(clock);
    }

    @Bean
    public CouponNotifier couponNotifier(
            RestClient.Builder builder, CouponBotProperties properties, DiscordEmbedFactory embedFactory) {
        var discord = properties.discord();
        var restClient = builder.clone().build();

        if (discord.hasWebhook()) {
            log.info("Discord notifications via webhook");
            return new DiscordWebhookNotifier(
                    restClient, URI.create(discord.webhookUrl()), discord.username(), embedFactory);
        }
        if (discord.hasBotToken()) {
            if (!discord.hasChannelId()) {
                throw NotificationChannelNotConfiguredException.missingChannelId();
            }
            log.info("Discord notifications via bot token to channel {}", discord.channelId());
            return new DiscordChannelNotifier(restClient, discord.botToken(), discord.channelId(), embedFactory);
        }
        throw NotificationChannelNotConfiguredException.noChannel();
    }
}
