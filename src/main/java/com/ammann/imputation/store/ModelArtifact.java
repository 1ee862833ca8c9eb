/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.dto.ModelVersionDTO;
import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.nn.MinMaxScaler;
import com.ammann.imputation.nn.SequenceRegressor;
import java.time.Instant;

/**
 * Snapshot of a trained model version with its scaler.
 *
 * <p>The network is never modified after training. {@link #certification} and
 * {@link #active} reflect the store at load time; the validator invalidates cached
 * snapshots when it changes them.
 */
public record ModelArtifact(
        ModelKey key,
        int version,
        Instant trainedAt,
        int contextWindowSize,
        SequenceRegressor network,
        MinMaxScaler scaler,
        double trainRmse,
        double validationRmse,
        CertificationStatus certification,
        boolean active) {

    /**
     * Runs the model on raw values and returns the prediction in the parameter's unit, unclamped.
     */
    public double predict(double[] window) {
        if (window.length != contextWindowSize) {
            throw new IllegalArgumentException("Expected window of " + contextWindowSize
                    + " values, got " + window.length);
        }
        return scaler.inverseTransform(network.predict(scaler.transform(window)));
    }

    public String versionLabel() {
        return key.versionLabel(version);
    }

    public ModelVersionDTO toDTO() {
        return new ModelVersionDTO(key.stationId(), key.parameter(), version, trainedAt, certification,
                active, trainRmse, validationRmse);
    }
}
