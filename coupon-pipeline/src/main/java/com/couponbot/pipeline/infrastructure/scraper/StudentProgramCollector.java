package com.couponbot.pipeline.infrastructure.scraper;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Emits a fixed offer while the program page answers 2xx. Page content is not inspected.
 */
@Slf4j
public class StudentProgramCollector extends HtmlPageCollector {

    private static final Duration PROGRAM_VALIDITY = Duration.ofDays(365);

    private final String name;
    private final String source;
    private final String pageUrl;
    private final String offerName;
    private final String offerDescription;
    private final String code;

    public StudentProgramCollector(
            Clock clock,
            String name,
            String source,
            String pageUrl,
            String offerName,
            String offerDescription,
            String code) {
        super(clock);
        this.name = name;
        this.source = source;
        this.pageUrl = pageUrl;
        this.offerName = offerName;
        this.offerDescription = offerDescription;
        this.code = code;
    }

    public static StudentProgramCollector warp(Clock clock) {
        return new StudentProgramCollector(
                clock,
                "Warp",
                CouponSource.WARP.label(),
                "https://www.warp.dev/students",
                "Warp Terminal Student Plan",
                "Free Warp Premium subscription for verified students",
                "AUTO-APPLIED");
    }

    public static StudentProgramCollector tabnine(Clock clock) {
        return new StudentProgramCollector(
                clock,
                "Tabnine",
                CouponSource.TABNINE.label(),
                "https://www.tabnine.com/students",
                "Tabnine Pro Student Plan",
                "Free Tabnine Pro for verified students",
                "STUDENT");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public List<CouponCandidate> collect(PageFetcher fetcher) {
        var page = fetcher.fetch(pageUrl);
        if (!page.isSuccess()) {
            log.warn("{}: failed to fetch {}: HTTP {}", name, pageUrl, page.status());
            return List.of();
        }
        log.info("Found 1 coupon from {}", name);
        return List.of(CouponCandidate.builder()
                .name(offerName)
                .description(offerDescription)
                .discountPercentage(100.0)
                .code(code)
                .url(pageUrl)
                .source(source)
                .expiry(expiresIn(PROGRAM_VALIDITY))
                .build());
    }
}
