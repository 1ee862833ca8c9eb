/* (C)2026 */
package com.ammann.imputation.enumeration;

/**
 * Estimation methods. Only {@link #LSTM} writes values; the other two are the validation baselines.
 */
public enum ImputationMethod {
    LSTM,
    LINEAR_INTERPOLATION,
    FORWARD_FILL
}
