package com.couponbot.pipeline.infrastructure.discord;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscordMessage(String content, String username, List<Embed> embeds) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Embed(
            String title,
            String url,
            String description,
            Integer color,
            String timestamp,
            Footer footer,
            List<Field> fields) {}

    public record Field(String name, String value, boolean inline) {}

    public record Footer(String text) {}
}
