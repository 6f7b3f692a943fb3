package com.couponbot.pipeline.application.config;

import com.couponbot.pipeline.domain.fetch.PageFetcher;
import com.couponbot.pipeline.infrastructure.http.RestClientPageFetcher;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

    @Bean
    public PageFetcher scrapingPageFetcher(RestClient.Builder builder, CouponBotProperties properties) {
        var scraping = properties.scraping();
        return new RestClientPageFetcher(client(builder, scraping.userAgent(), scraping.requestTimeout()));
    }

    @Bean
    public PageFetcher validationPageFetcher(RestClient.Builder builder, CouponBotProperties properties) {
        return new RestClientPageFetcher(
                client(builder, properties.scraping().userAgent(), properties.validation().timeout()));
    }

    static RestClient client(RestClient.Builder builder, String userAgent, Duration timeout) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return builder.clone()
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }
}
