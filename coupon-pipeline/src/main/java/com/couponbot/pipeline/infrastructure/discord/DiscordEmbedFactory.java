package com.couponbot.pipeline.infrastructure.discord;

import com.couponbot.common.format.DiscountFormat;
import com.couponbot.pipeline.domain.coupon.Coupon;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;

/**
 * Renders a coupon as a Discord message with a single rich embed.
 */
@RequiredArgsConstructor
public class DiscordEmbedFactory {

    static final int EMBED_COLOR = 0x00c8ff;
    static final String FOOTER_TEXT = "Coupon Bot";

    private final Clock clock;

    public DiscordMessage create(Coupon coupon, String username) {
        return DiscordMessage.builder()
                .content(coupon.name())
                .username(username)
                .embeds(List.of(embed(coupon)))
                .build();
    }

    DiscordMessage.Embed embed(Coupon coupon) {
        var now = clock.instant();
        var fields = new ArrayList<DiscordMessage.Field>();
        if (coupon.discountPercentage() != null) {
            fields.add(new DiscordMessage.Field("Discount", DiscountFormat.of(coupon.discountPercentage()) + "%", true));
        }
        fields.add(new DiscordMessage.Field("Code", coupon.code(), true));
        fields.add(new DiscordMessage.Field("Source", coupon.source(), true));
        if (coupon.expiry() != null) {
            var daysLeft = Duration.between(now, coupon.expiry()).toDays();
            var expires = daysLeft > 0 ? "In " + daysLeft + " days" : "Today";
            fields.add(new DiscordMessage.Field("Expires", expires, true));
        }

        return DiscordMessage.Embed.builder()
                .title("✅ " + coupon.name() + " AI Coupon")
                .url(coupon.url())
                .description(coupon.description())
                .color(EMBED_COLOR)
                .timestamp(now.toString())
                .footer(new DiscordMessage.Footer(FOOTER_TEXT))
                .fields(List.copyOf(fields))
                .build();
    }
}
