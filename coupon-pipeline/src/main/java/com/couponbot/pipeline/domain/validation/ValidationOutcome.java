package com.couponbot.pipeline.domain.validation;

import java.time.Instant;

public record ValidationOutcome(boolean valid, String message, Instant validatedAt) {

    public static ValidationOutcome valid(String message, Instant validatedAt) {
        return new ValidationOutcome(true, message, validatedAt);
    }

    public static ValidationOutcome invalid(String message, Instant validatedAt) {
        return new ValidationOutcome(false, message, validatedAt);
    }
}
