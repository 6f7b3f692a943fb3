package com.couponbot.pipeline.infrastructure.discord;

import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.exceptions.NotificationDeliveryException;
import com.couponbot.pipeline.domain.notification.CouponNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts to a channel through the Discord REST API using a bot token.
 */
@Slf4j
@RequiredArgsConstructor
public class DiscordChannelNotifier implements CouponNotifier {

    static final String API_BASE_URL = "https://discord.com/api/v10";

    private final RestClient restClient;
    private final String botToken;
    private final String channelId;
    private final DiscordEmbedFactory embedFactory;

    @Override
    public void deliver(Coupon coupon) {
        log.debug("Sending coupon {} to channel {}", coupon.name(), channelId);
        var message = embedFactory.create(coupon, null);
        try {
            restClient.post()
                    .uri(API_BASE_URL + "/channels/{channelId}/messages", channelId)
                    .header(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(message)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw NotificationDeliveryException.of(coupon.name(), e);
        }
    }
}
