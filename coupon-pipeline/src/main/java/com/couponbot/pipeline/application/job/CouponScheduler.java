package com.couponbot.pipeline.application.job;

import com.couponbot.pipeline.domain.cleanup.CouponCleanupService;
import com.couponbot.pipeline.domain.pipeline.CouponPipeline;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic driver: one batch immediately at startup, then one every
 * {@code coupons.scraping.interval-minutes}; the expiry sweep piggybacks on a tick
 * once a day. Ad-hoc runs go through the same single-threaded task scheduler, so
 * batches never overlap.
 */
@Slf4j
@Component
public class CouponScheduler {

    static final Duration CLEANUP_INTERVAL = Duration.ofHours(24);

    private final CouponPipeline pipeline;
    private final CouponCleanupService cleanupService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final SchedulerState state;

    public CouponScheduler(
            CouponPipeline pipeline,
            CouponCleanupService cleanupService,
            TaskScheduler taskScheduler,
            Clock clock) {
        this.pipeline = pipeline;
        this.cleanupService = cleanupService;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.state = new SchedulerState(clock.instant());
    }

    @Scheduled(
            initialDelay = 0,
            fixedDelayString = "${coupons.scraping.interval-minutes}",
            timeUnit = TimeUnit.MINUTES)
    public void tick() {
        runScrapeCycle();
        runCleanupIfDue();
    }

    /**
     * Queues a batch on the scheduling thread; it starts once any running batch finishes.
     */
    public void triggerNow() {
        log.info("Ad-hoc batch requested");
        taskScheduler.schedule(this::runScrapeCycle, clock.instant());
    }

    public SchedulerStatus status() {
        return state.snapshot();
    }

    void runScrapeCycle() {
        try {
            var summary = pipeline.runBatch();
            state.recordScrape(clock.instant(), summary);
        } catch (RuntimeException e) {
            log.error("Scrape cycle failed", e);
        }
    }

    void runCleanupIfDue() {
        var now = clock.instant();
        if (!state.cleanupDue(now, CLEANUP_INTERVAL)) {
            return;
        }
        try {
            cleanupService.purgeExpired();
        } catch (RuntimeException e) {
            log.error("Cleanup failed", e);
        }
        // a failed sweep waits for the next interval as well
        state.recordCleanup(now);
    }
}
