package com.couponbot.pipeline.infrastructure.scraper;

import com.couponbot.common.source.CouponSource;
import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Student plan from the student page, promotion codes from the pricing page.
 */
@Slf4j
public class CursorAiCollector extends HtmlPageCollector {

    static final String STUDENT_URL = "https://cursor.sh/student";
    static final String PRICING_URL = "https://cursor.sh/pricing";

    private static final Duration STUDENT_VALIDITY = Duration.ofDays(365);
    private static final Duration PROMOTION_VALIDITY = Duration.ofDays(30);
    private static final String DEFAULT_PROMO_CODE = "PROMO";
    private static final String DEFAULT_DISCOUNT = "10";

    public CursorAiCollector(Clock clock) {
        super(clock);
    }

    @Override
    public String name() {
        return "Cursor AI";
    }

    @Override
    public String source() {
        return CouponSource.CURSOR_AI.label();
    }

    @Override
    public List<CouponCandidate> collect(PageFetcher fetcher) {
        var candidates = new ArrayList<CouponCandidate>();

        var studentPage = fetchDocument(fetcher, STUDENT_URL);
        if (studentPage.isEmpty()) {
            return candidates;
        }
        if (studentPage.get().selectFirst("div.student-discount") != null) {
            candidates.add(CouponCandidate.builder()
                    .name("Cursor AI Student Plan")
                    .description("Free Pro features for verified students")
                    .discountPercentage(100.0)
                    .code("STUDENT")
                    .url(STUDENT_URL)
                    .source(source())
                    .expiry(expiresIn(STUDENT_VALIDITY))
                    .build());
        }

        fetchDocument(fetcher, PRICING_URL)
                .ifPresent(pricing -> candidates.addAll(promotions(pricing)));

        log.info("Found {} coupons from Cursor AI", candidates.size());
        return candidates;
    }

    private List<CouponCandidate> promotions(Document pricing) {
        return pricing.select("div.promotion-code").stream()
                .map(this::promotion)
                .toList();
    }

    private CouponCandidate promotion(Element element) {
        var code = attributeOr(element, "data-code", DEFAULT_PROMO_CODE);
        var discount = attributeOr(element, "data-discount", DEFAULT_DISCOUNT);
        return CouponCandidate.builder()
                .name("Cursor AI Promotion: " + discount + "% Off")
                .description("Limited time promotion for Cursor AI Pro")
                .discountPercentage(parseDiscount(discount))
                .code(code)
                .url(PRICING_URL)
                .source(source())
                .expiry(expiresIn(PROMOTION_VALIDITY))
                .build();
    }

    private static String attributeOr(Element element, String attribute, String fallback) {
        return element.hasAttr(attribute) ? element.attr(attribute) : fallback;
    }

    private static double parseDiscount(String discount) {
        try {
            return Double.parseDouble(discount.trim());
        } catch (NumberFormatException e) {
            return Double.parseDouble(DEFAULT_DISCOUNT);
        }
    }
}
