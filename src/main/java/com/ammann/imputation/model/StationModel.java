/* (C)2026 */
package com.ammann.imputation.model;

import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.MeasuredParameter;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;

/**
 * Persisted model artifact: network weights and scaler for one station and parameter.
 * <p>
 * Rows are written once by training. Only {@link #active} and {@link #certification} change
 * afterwards. At most one row per station and parameter is active; retraining inserts a new
 * row before moving the active marker.
 */
@Entity
@Table(name = "model_artifacts",
        uniqueConstraints = @UniqueConstraint(name = "uk_model_version",
                columnNames = {"station_id", "parameter", "version"}))
public class StationModel extends PanacheEntity {

    @Column(name = "station_id", nullable = false, length = 32)
    public String stationId;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    public MeasuredParameter parameter;

    @Column(nullable = false)
    public Integer version;

    @Column(name = "trained_at", nullable = false)
    public Instant trainedAt;

    @Column(name = "context_window_size", nullable = false)
    public Integer contextWindowSize;

    @Column(name = "scaler_min", nullable = false)
    public Double scalerMin;

    @Column(name = "scaler_max", nullable = false)
    public Double scalerMax;

    /** Network weights as JSON. */
    @Column(name = "network_json", nullable = false, columnDefinition = "TEXT")
    public String networkJson;

    @Column(name = "train_rmse")
    public Double trainRmse;

    @Column(name = "validation_rmse")
    public Double validationRmse;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    public CertificationStatus certification = CertificationStatus.PENDING;

    @Column(nullable = false)
    public boolean active;

    // Finder methods

    public static StationModel findActive(String stationId, MeasuredParameter parameter) {
        return find("stationId = ?1 AND parameter = ?2 AND active = true", stationId, parameter)
                .firstResult();
    }

    public static StationModel findVersion(String stationId, MeasuredParameter parameter, int version) {
        return find("stationId = ?1 AND parameter = ?2 AND version = ?3", stationId, parameter, version)
                .firstResult();
    }

    /**
     * All versions of a station and parameter, newest first.
     */
    public static List<StationModel> findVersions(String stationId, MeasuredParameter parameter) {
        return list("stationId = ?1 AND parameter = ?2", Sort.descending("version"), stationId, parameter);
    }

    public static int latestVersion(String stationId, MeasuredParameter parameter) {
        StationModel latest = find("stationId = ?1 AND parameter = ?2",
                Sort.descending("version"), stationId, parameter).firstResult();
        return latest == null ? 0 : latest.version;
    }
}
