package com.couponbot.common.format;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Renders a discount percentage without a trailing ".0" for whole numbers ("100", "12.5").
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DiscountFormat {

    public static String of(double percentage) {
        if (!Double.isInfinite(percentage) && percentage == Math.rint(percentage)) {
            return Long.toString((long) percentage);
        }
        return Double.toString(percentage);
    }
}
