package com.couponbot.pipeline.domain.collect;

import com.couponbot.pipeline.domain.coupon.CouponCandidate;
import com.couponbot.pipeline.domain.fetch.PageFetcher;
import java.util.List;

/**
 * One collector per source. A thrown exception only costs this collector's candidates for the batch.
 */
public interface CouponCollector {

    String name();

    String source();

    List<CouponCandidate> collect(PageFetcher fetcher);
}
