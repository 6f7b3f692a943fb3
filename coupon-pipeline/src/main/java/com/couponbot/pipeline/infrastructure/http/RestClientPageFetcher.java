package com.couponbot.pipeline.infrastructure.http;

import com.couponbot.pipeline.domain.exceptions.PageFetchException;
import com.couponbot.pipeline.domain.fetch.FetchedPage;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
@RequiredArgsConstructor
public class RestClientPageFetcher implements PageFetcher {

    private final RestClient restClient;

    @Override
    public FetchedPage fetch(String url) {
        try {
            var page = restClient.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> new FetchedPage(
                            url,
                            response.getStatusCode().value(),
                            StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
            log.debug("Fetched {} -> {}", url, page.status());
            return page;
        } catch (RestClientException | IllegalArgumentException e) {
            throw PageFetchException.of(url, e);
        }
    }
}
