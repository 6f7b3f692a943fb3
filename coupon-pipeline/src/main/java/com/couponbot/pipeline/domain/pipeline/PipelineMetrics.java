package com.couponbot.pipeline.domain.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class PipelineMetrics {

    private final Counter collected;
    private final Counter deduplicated;
    private final Counter posted;
    private final Counter deliveryFailed;
    private final Counter collectorsFailed;

    public PipelineMetrics(MeterRegistry registry) {
        this.collected = Counter.builder("coupons.collected")
                .description("Candidates returned by collectors")
                .register(registry);
        this.deduplicated = Counter.builder("coupons.deduplicated")
                .description("Candidates dropped because their fingerprint was already stored")
                .register(registry);
        this.posted = Counter.builder("coupons.posted")
                .description("Coupons delivered and marked posted")
                .register(registry);
        this.deliveryFailed = Counter.builder("coupons.delivery.failed")
                .description("Notification attempts that failed")
                .register(registry);
        this.collectorsFailed = Counter.builder("collectors.failed")
                .description("Collector invocations that threw")
                .register(registry);
    }

    void collected(int count) {
        collected.increment(count);
    }

    void deduplicated() {
        deduplicated.increment();
    }

    void posted() {
        posted.increment();
    }

    void deliveryFailed() {
        deliveryFailed.increment();
    }

    void collectorFailed() {
        collectorsFailed.increment();
    }
}
