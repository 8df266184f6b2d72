package com.jay.mfses.layer2_scoring;

import java.math.BigDecimal;

/**
 * Bounds shared by every sub-score (1 – 20) plus the formatting used in audit brackets.
 */
public final class ScoreRange {

    public static final int MIN = 1;
    public static final int MAX = 20;
    public static final int MIDPOINT = 10;

    private ScoreRange() {}

    public static int clamp(long score) {
        return (int) Math.max(MIN, Math.min(MAX, score));
    }

    public static boolean contains(int score) {
        return score >= MIN && score <= MAX;
    }

    /** Half-up rounding onto the integer scale, then clamped. NaN maps to the midpoint. */
    public static int round(double value) {
        if (Double.isNaN(value)) return MIDPOINT;
        return clamp(Math.round(value));
    }

    /** Compact rendering for bracket labels: 2000000000000 → 2T, 0.30 → 0.3. */
    static String compact(double value) {
        if (value == Double.NEGATIVE_INFINITY) return "-∞";
        if (value == Double.POSITIVE_INFINITY) return "∞";
        double abs = Math.abs(value);
        if (abs >= 1e12) return plain(value / 1e12) + "T";
        if (abs >= 1e9)  return plain(value / 1e9) + "B";
        if (abs >= 1e6)  return plain(value / 1e6) + "M";
        return plain(value);
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
