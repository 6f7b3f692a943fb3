package com.couponbot.pipeline.infrastructure.scraper;

import com.couponbot.common.format.DiscountFormat;
import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import com.couponbot.pipeline.domain.exceptions.PageFetchException;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

/**
 * Scans deal aggregator pages for "code: XYZ" patterns. One unreachable URL does not stop the others.
 */
@Slf4j
public class GenericDealsCollector extends HtmlPageCollector {

    private static final Pattern CODE_PATTERN = Pattern.compile("(?i)code[:\\s]+([A-Z0-9-]+)");
    private static final Pattern DISCOUNT_PATTERN = Pattern.compile("(\\d+)%\\s+(?:off|discount)");
    private static final double DEFAULT_DISCOUNT = 10.0;
    private static final Duration DEAL_VALIDITY = Duration.ofDays(30);

    private final List<String> urls;

    public GenericDealsCollector(Clock clock, List<String> urls) {
        super(clock);
        this.urls = List.copyOf(urls);
    }

    @Override
    public String name() {
        return "Generic AI Tools";
    }

    @Override
    public String source() {
        return CouponSource.GENERIC.label();
    }

    @Override
    public List<CouponCandidate> collect(PageFetcher fetcher) {
        var candidates = new ArrayList<CouponCandidate>();
        for (var url : urls) {
            log.info("Scraping from URL: {}", url);
            try {
                fetchDocument(fetcher, url).ifPresent(document -> candidates.addAll(extract(document, url)));
            } catch (PageFetchException e) {
                log.warn("Failed to fetch {}: {}", url, e.getMessage());
            }
        }
        log.info("Found {} coupons from generic sources", candidates.size());
        return candidates;
    }

    List<CouponCandidate> extract(Document document, String url) {
        var text = document.text();
        var discount = discountIn(text);
        var percent = DiscountFormat.of(discount);
        var expiry = expiresIn(DEAL_VALIDITY);

        var candidates = new ArrayList<CouponCandidate>();
        var matcher = CODE_PATTERN.matcher(text);
        while (matcher.find()) {
            var code = matcher.group(1);
            candidates.add(CouponCandidate.builder()
                    .name("AI Tool Discount: " + percent + "% Off")
                    .description("Use code " + code + " for " + percent + "% off")
                    .discountPercentage(discount)
                    .code(code)
                    .url(url)
                    .source(source())
                    .expiry(expiry)
                    .build());
        }
        return candidates;
    }

    private static double discountIn(String text) {
        var matcher = DISCOUNT_PATTERN.matcher(text);
        if (matcher.find()) {
            try {
                return Double.parseDouble(matcher.group(1));
            } catch (NumberFormatException e) {
                return DEFAULT_DISCOUNT;
            }
        }
        return DEFAULT_DISCOUNT;
    }
}
