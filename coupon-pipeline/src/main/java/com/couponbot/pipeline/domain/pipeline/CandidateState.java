package com.couponbot.pipeline.domain.pipeline;

/**
 * Terminal state a candidate reaches within one batch.
 */
public enum CandidateState {
    DEDUPLICATED,
    INVALID,
    POSTED,
    VALID_UNPOSTED,
    FAILED
}
