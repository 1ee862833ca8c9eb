/* (C)2026 */
package com.ammann.imputation.nn;

/**
 * Serializable weights of a {@link SequenceRegressor}. Stored as JSON beside the artifact row.
 */
public record NetworkState(
        int unitsFirst,
        int unitsSecond,
        double dropoutRate,
        double[] firstW,
        double[] firstU,
        double[] firstB,
        double[] secondW,
        double[] secondU,
        double[] secondB,
        double[] denseW,
        double denseB) {

    /** Total number of trainable weights. */
    public int parameterCount() {
        return firstW.length + firstU.length + firstB.length
                + secondW.length + secondU.length + secondB.length
                + denseW.length + 1;
    }
}
