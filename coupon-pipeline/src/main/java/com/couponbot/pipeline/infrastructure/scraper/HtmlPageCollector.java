package com.couponbot.pipeline.infrastructure.scraper;

import com.couponbot.pipeline.domain.collect.CouponCollector;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * Base for collectors that read one or more fixed HTML pages.
 */
@Slf4j
public abstract class HtmlPageCollector implements CouponCollector {

    protected final Clock clock;

    protected HtmlPageCollector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Empty when the page answered with a non-2xx status. Transport failures propagate.
     */
    protected Optional<Document> fetchDocument(PageFetcher fetcher, String url) {
        var page = fetcher.fetch(url);
        if (!page.isSuccess()) {
            log.warn("{}: failed to fetch {}: HTTP {}", name(), url, page.status());
            return Optional.empty();
        }
        return Optional.of(Jsoup.parse(page.body() == null ? "" : page.body(), url));
    }

    protected Instant expiresIn(Duration validity) {
        return clock.instant().plus(validity);
    }
}
