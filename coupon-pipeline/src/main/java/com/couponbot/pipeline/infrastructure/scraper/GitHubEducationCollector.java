package com.couponbot.pipeline.infrastructure.scraper;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

/**
 * AI tool offers from the GitHub Student Developer Pack.
 */
@Slf4j
public class GitHubEducationCollector extends HtmlPageCollector {

    static final String PACK_URL = "https://education.github.com/pack";
    static final String PACK_CODE = "GITHUB-STUDENT";

    public GitHubEducationCollector(Clock clock) {
        super(clock);
    }

    @Override
    public String name() {
        return "GitHub";
    }

    @Override
    public String source() {
        return CouponSource.GITHUB.label();
    }

    @Override
    public List<CouponCandidate> collect(PageFetcher fetcher) {
        var candidates = fetchDocument(fetcher, PACK_URL)
                .map(document -> document.select("div.d-flex.flex-wrap.gutter").stream()
                        .map(this::offer)
                        .flatMap(Optional::stream)
                        .toList())
                .orElse(List.of());
        log.info("Found {} coupons from GitHub", candidates.size());
        return candidates;
    }

    private Optional<CouponCandidate> offer(Element element) {
        var title = textOf(element.selectFirst("h3"));
        // only AI tool offers
        if (title.isEmpty() || !title.toLowerCase(Locale.ROOT).contains("ai")) {
            return Optional.empty();
        }
        return Optional.of(CouponCandidate.builder()
                .name("GitHub Student Pack: " + title)
                .description(textOf(element.selectFirst("p")))
                .code(PACK_CODE)
                .url(PACK_URL + "#" + title.toLowerCase(Locale.ROOT).replace(' ', '-'))
                .source(source())
                .build());
    }

    private static String textOf(Element element) {
        return element == null ? "" : element.text();
    }
}
