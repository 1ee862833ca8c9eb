/* (C)2026 */
package com.ammann.imputation.enumeration;

public enum ValidationOutcome {
    CERTIFIED,
    REJECTED,
    MODEL_UNAVAILABLE,
    INSUFFICIENT_DATA
}
