package com.couponbot.pipeline.domain.pipeline;

import java.time.Instant;
import lombok.Builder;

@Builder
public record BatchSummary(
        Instant startedAt,
        Instant finishedAt,
        int collected,
        int deduplicated,
        int invalid,
        int posted,
        int validUnposted,
        int failed,
        int failedCollectors,
        int retried,
        int retryPosted,
        int retryFailed,
        boolean interrupted
) {
}
