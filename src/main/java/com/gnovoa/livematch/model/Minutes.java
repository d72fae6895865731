package com.gnovoa.livematch.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Match-minute arithmetic. Minutes are stored with two decimal places (~0.6s resolution), so
 * values must be normalized before they are compared or used as keys.
 */
public final class Minutes {

    /** Smallest step used to nudge a colliding start minute forward. */
    public static final BigDecimal EPSILON = new BigDecimal("0.01");

    public static final BigDecimal ZERO = of(BigDecimal.ZERO);

    private static final BigDecimal MILLIS_PER_MINUTE = BigDecimal.valueOf(60_000);

    private Minutes() {}

    public static BigDecimal of(BigDecimal minute) {
        if (minute == null) return null;
        if (minute.signum() < 0) throw new IllegalArgumentException("Minute must not be negative: " + minute);
        return minute.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal of(double minute) {
        return of(BigDecimal.valueOf(minute));
    }

    public static long toClockMs(BigDecimal minute) {
        return minute.multiply(MILLIS_PER_MINUTE).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
