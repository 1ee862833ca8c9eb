/* (C)2026 */
package com.ammann.imputation.enumeration;

/**
 * Outcome of a training run.
 */
public enum TrainingStatus {
    /** A new artifact version was published */
    TRAINED,
    /** Not enough contiguous, observed history; no artifact produced */
    INSUFFICIENT_HISTORY,
    /** Fit diverged or errored; the previous version stays active */
    FAILED
}
