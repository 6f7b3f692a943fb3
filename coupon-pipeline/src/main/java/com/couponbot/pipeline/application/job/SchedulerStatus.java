package com.couponbot.pipeline.application.job;

import com.couponbot.pipeline.domain.pipeline.BatchSummary;
import java.time.Instant;

public record SchedulerStatus(Instant lastScrapeAt, Instant lastCleanupAt, BatchSummary lastBatch) {}
