package com.couponbot.pipeline.infrastructure.scraper;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ReplitEducationCollector extends HtmlPageCollector {

    static final String EDUCATION_URL = "https://replit.com/site/teams-for-education";

    public ReplitEducationCollector(Clock clock) {
        super(clock);
    }

    @Override
    public String name() {
        return "Replit";
    }

    @Override
    public String source() {
        return CouponSource.REPLIT.label();
    }

    @Override
    public List<CouponCandidate> collect(PageFetcher fetcher) {
        var candidates = fetchDocument(fetcher, EDUCATION_URL)
                .filter(document -> document.selectFirst("div.education-discount") != null)
                .map(document -> List.of(CouponCandidate.builder()
                        .name("Replit Teams for Education")
                        .description("Special pricing for educational institutions")
                        .discountPercentage(50.0)
                        .code("EDUCATION")
                        .url(EDUCATION_URL)
                        .source(source())
                        .build()))
                .orElse(List.of());
        log.info("Found {} coupons from Replit", candidates.size());
        return candidates;
    }
}
