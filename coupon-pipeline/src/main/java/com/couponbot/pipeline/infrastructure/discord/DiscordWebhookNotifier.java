package com.couponbot.pipeline.infrastructure.discord;

import com.couponbot.pipeline.domain.coupon.Coupon;
import com.couponbot.pipeline.domain.exceptions.NotificationDeliveryException;
import com.couponbot.pipeline.domain.notification.CouponNotifier;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
@RequiredArgsConstructor
public class DiscordWebhookNotifier implements CouponNotifier {

    private final RestClient restClient;
    private final URI webhookUrl;
    private final String username;
    private final DiscordEmbedFactory embedFactory;

    @Override
    public void deliver(Coupon coupon) {
        log.debug("Sending coupon {} via webhook", coupon.name());
        try {
            restClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(embedFactory.create(coupon, username))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw NotificationDeliveryException.of(coupon.name(), e);
        }
    }
}
