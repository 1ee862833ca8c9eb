/* (C)2026 */
package com.ammann.imputation.enumeration;

/**
 * Kinds of suspicious readings reported by the anomaly detector.
 */
public enum AnomalyType {
    /** Value below zero for a non-negative parameter */
    NEGATIVE_VALUE,
    /** Value at least five times the previous hour */
    SPIKE,
    /** Hour-over-hour change above the parameter's rate threshold */
    RATE_OF_CHANGE,
    /** Same value repeated for too many consecutive hours */
    STUCK_VALUE,
    /** More than three standard deviations from the range mean */
    STATISTICAL;

    /**
     * Whether a reading flagged this way should be kept out of model input when gating is on.
     */
    public boolean isContextBlocking() {
        return this == NEGATIVE_VALUE || this == SPIKE;
    }
}
