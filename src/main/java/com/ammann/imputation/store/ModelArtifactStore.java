/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.dto.ModelVersionDTO;
import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.nn.MinMaxScaler;
import com.ammann.imputation.nn.SequenceRegressor;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned storage of trained models.
 *
 * <p>Versions per {@link ModelKey} are strictly increasing. Publishing writes the new version
 * completely before it becomes active, so readers only ever load a whole artifact.
 */
public interface ModelArtifactStore {

    /**
     * Stores a new version as PENDING and makes it the active one.
     *
     * @return the published artifact with its assigned version
     */
    ModelArtifact publish(ModelKey key,
                          Instant trainedAt,
                          int contextWindowSize,
                          SequenceRegressor network,
                          MinMaxScaler scaler,
                          double trainRmse,
                          double validationRmse);

    Optional<ModelArtifact> findActive(ModelKey key);

    Optional<ModelArtifact> findVersion(ModelKey key, int version);

    /** Retained versions, newest first. */
    List<ModelVersionDTO> listVersions(ModelKey key);

    /** Every key with at least one stored version. */
    List<ModelKey> listKeys();

    /**
     * Moves the active marker to an existing version.
     *
     * @return false if the version does not exist
     */
    boolean activate(ModelKey key, int version);

    void updateCertification(ModelKey key, int version, CertificationStatus certification);

    /**
     * Deletes inactive versions beyond the newest {@code keep}. The active version is never deleted.
     *
     * @return number of deleted versions
     */
    int prune(ModelKey key, int keep);
}
