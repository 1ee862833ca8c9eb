/* (C)2026 */
package com.ammann.imputation.enumeration;

/**
 * Outcome of a single-timestamp imputation request.
 */
public enum ImputationStatus {
    /** A value was written, or an identical imputation from the same model already existed */
    IMPUTED,
    /** The target holds a real observation and was left alone */
    ALREADY_OBSERVED,
    /** No usable model for the station and parameter */
    MODEL_UNAVAILABLE,
    /** No valid context window precedes the target */
    NO_CONTEXT,
    /** The target lies inside a gap longer than the medium threshold; such gaps are only flagged */
    LONG_GAP
}
