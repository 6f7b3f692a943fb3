package com.couponbot.common.source;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of sources a coupon can come from. The label is what gets persisted
 * and what validators match on.
 */
public enum CouponSource {
    CURSOR_AI("Cursor AI"),
    GITHUB("GitHub"),
    REPLIT("Replit"),
    WARP("Warp"),
    TABNINE("Tabnine"),
    GENERIC("Generic");

    private final String label;

    CouponSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(String sourceLabel) {
        return label.equals(sourceLabel);
    }

    public static Optional<CouponSource> fromLabel(String sourceLabel) {
        return Arrays.stream(values())
                .filter(source -> source.matches(sourceLabel))
                .findFirst();
    }
}
