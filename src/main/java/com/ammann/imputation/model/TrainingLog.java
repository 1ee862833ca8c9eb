/* (C)2026 */
package com.ammann.imputation.model;

import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.enumeration.TrainingStatus;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;

/**
 * Append-only record of one training attempt, successful or not.
 */
@Entity
@Table(name = "training_log", indexes = @Index(name = "idx_training_station", columnList = "station_id, parameter"))
public class TrainingLog extends PanacheEntity {

    @Column(name = "station_id", nullable = false, length = 32)
    public String stationId;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    public MeasuredParameter parameter;

    /** Null when no artifact was produced. */
    @Column(name = "model_version")
    public Integer modelVersion;

    @Column(nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    public TrainingStatus status;

    @Column(name = "training_samples")
    public Integer trainingSamples;

    @Column(name = "validation_samples")
    public Integer validationSamples;

    @Column(name = "train_rmse")
    public Double trainRmse;

    @Column(name = "validation_rmse")
    public Double validationRmse;

    @Column(name = "validation_mae")
    public Double validationMae;

    @Column(name = "validation_r2")
    public Double validationR2;

    @Column(name = "epochs_completed")
    public Integer epochsCompleted;

    @Column(name = "duration_ms")
    public Long durationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    public String errorMessage;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt = Instant.now();

    public static List<TrainingLog> findForStation(String stationId, MeasuredParameter parameter) {
        return list("stationId = ?1 AND parameter = ?2", Sort.by("createdAt").and("id"), stationId, parameter);
    }
}
