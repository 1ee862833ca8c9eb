/* (C)2026 */
package com.ammann.imputation.enumeration;

/**
 * Duration class of a gap in an hourly series.
 *
 * <p>Thresholds are boundary-inclusive: a gap of exactly {@code shortMaxHours} is
 * {@link #SHORT}, a gap of exactly {@code mediumMaxHours} is {@link #MEDIUM}.
 */
public enum DurationClass
{
    /** 1 up to the short threshold (default 3 hours). */
    SHORT,
    /** Above the short threshold up to the medium threshold (default 24 hours). */
    MEDIUM,
    /** Longer than the medium threshold. Flagged only, never imputed. */
    LONG;

    /**
     * Classifies a gap length.
     *
     * @param hours number of missing hours, at least 1
     * @param shortMaxHours largest gap still considered short
     * @param mediumMaxHours largest gap still considered medium
     * @return the duration class
     */
    public static DurationClass fromHours(long hours, int shortMaxHours, int mediumMaxHours) {
        if (hours <= shortMaxHours) return SHORT;
        if (hours <= mediumMaxHours) return MEDIUM;
        return LONG;
    }

    public boolean isFillable() {
        return this != LONG;
    }
}
