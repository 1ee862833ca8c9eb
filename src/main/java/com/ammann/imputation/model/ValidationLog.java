/* (C)2026 */
package com.ammann.imputation.model;

import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.enumeration.ValidationOutcome;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;

/**
 * Append-only record of one validation run with model and baseline metrics.
 */
@Entity
@Table(name = "validation_log", indexes = @Index(name = "idx_validation_station", columnList = "station_id, parameter"))
public class ValidationLog extends PanacheEntity {

    @Column(name = "station_id", nullable = false, length = 32)
    public String stationId;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    public MeasuredParameter parameter;

    @Column(name = "model_version")
    public Integer modelVersion;

    @Column(nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    public ValidationOutcome outcome;

    @Column(name = "test_samples")
    public Integer testSamples;

    @Column(name = "excluded_samples")
    public Integer excludedSamples;

    @Column(name = "model_rmse")
    public Double modelRmse;

    @Column(name = "model_mae")
    public Double modelMae;

    @Column(name = "model_r2")
    public Double modelR2;

    @Column(name = "linear_rmse")
    public Double linearRmse;

    @Column(name = "linear_mae")
    public Double linearMae;

    @Column(name = "linear_r2")
    public Double linearR2;

    @Column(name = "forward_fill_rmse")
    public Double forwardFillRmse;

    @Column(name = "forward_fill_mae")
    public Double forwardFillMae;

    @Column(name = "forward_fill_r2")
    public Double forwardFillR2;

    @Column(name = "improvement_over_linear_pct")
    public Double improvementOverLinearPct;

    @Column(nullable = false)
    public boolean certified;

    @Column(name = "sample_fraction")
    public Double sampleFraction;

    @Column(name = "seed")
    public Long seed;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt = Instant.now();

    public static List<ValidationLog> findForStation(String stationId, MeasuredParameter parameter) {
        return list("stationId = ?1 AND parameter = ?2", Sort.by("createdAt").and("id"), stationId, parameter);
    }
}
