package com.couponbot.pipeline.application.job;

import com.couponbot.pipeline.domain.pipeline.BatchSummary;
import java.time.Duration;
import java.time.Instant;

/**
 * Bookkeeping shared by the scheduling thread and status readers. The monitor is held
 * only for the field updates, never across a batch.
 */
class SchedulerState {

    private Instant lastScrapeAt;
    private Instant lastCleanupAt;
    private BatchSummary lastBatch;

    SchedulerState(Instant startedAt) {
        this.lastCleanupAt = startedAt;
    }

    synchronized void recordScrape(Instant at, BatchSummary summary) {
        this.lastScrapeAt = at;
        this.lastBatch = summary;
    }

    synchronized boolean cleanupDue(Instant now, Duration interval) {
        return !now.isBefore(lastCleanupAt.plus(interval));
    }

    synchronized void recordCleanup(Instant at) {
        this.lastCleanupAt = at;
    }

    synchronized SchedulerStatus snapshot() {
        return new SchedulerStatus(lastScrapeAt, lastCleanupAt, lastBatch);
    }
}
