/* (C)2026 */
package com.ammann.imputation.enumeration;

/**
 * Validator verdict on a model artifact.
 * <p>
 * Lifecycle: PENDING -> (CERTIFIED | REJECTED). A later validation run may move a model
 * between CERTIFIED and REJECTED.
 */
public enum CertificationStatus {
    /** Trained but not yet validated */
    PENDING,
    /** Beat the linear interpolation baseline and the R² cutoff */
    CERTIFIED,
    /** Failed validation, never used for new imputations */
    REJECTED;

    /**
     * Whether the predictor may use a model in this state.
     *
     * @param requireCertification true when only certified models may impute
     */
    public boolean isUsable(boolean requireCertification) {
        if (this == REJECTED) {
            return false;
        }
        return !requireCertification || this == CERTIFIED;
    }
}
