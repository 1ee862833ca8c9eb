/* (C)2026 */
package com.ammann.imputation.model;

import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.ImputationMethod;
import com.ammann.imputation.enumeration.LogState;
import com.ammann.imputation.enumeration.MeasuredParameter;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;

/**
 * Provenance of one imputed value.
 * <p>
 * Rows are never deleted. A rollback or re-imputation flips {@link #state} to SUPERSEDED,
 * so at most one ACTIVE row exists per station, timestamp and parameter.
 */
@Entity
@Table(name = "imputation_log", indexes = {
        @Index(name = "idx_imputation_target", columnList = "station_id, measured_at, parameter"),
        @Index(name = "idx_imputation_state", columnList = "state")
})
public class ImputationLog extends PanacheEntity {

    @Column(name = "station_id", nullable = false, length = 32)
    public String stationId;

    @Column(name = "measured_at", nullable = false)
    public Instant measuredAt;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    public MeasuredParameter parameter;

    @Column(name = "imputed_value", nullable = false)
    public Double imputedValue;

    /** Model output before clamping into the parameter's range. */
    @Column(name = "raw_prediction", nullable = false)
    public Double rawPrediction;

    @Column(nullable = false)
    public boolean clamped;

    @Column(nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    public ImputationMethod method;

    @Column(name = "input_window_start", nullable = false)
    public Instant inputWindowStart;

    @Column(name = "input_window_end", nullable = false)
    public Instant inputWindowEnd;

    @Column(name = "model_version", nullable = false)
    public Integer modelVersion;

    /** Validation RMSE of the model, in the parameter's unit. */
    @Column(name = "error_bound")
    public Double errorBound;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    public CertificationStatus certification;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    public LogState state = LogState.ACTIVE;

    @Column(name = "superseded_at")
    public Instant supersededAt;

    @Column(name = "supersede_reason", length = 64)
    public String supersedeReason;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt = Instant.now();

    public static ImputationLog findActive(String stationId, MeasuredParameter parameter, Instant measuredAt) {
        return find("stationId = ?1 AND parameter = ?2 AND measuredAt = ?3 AND state = ?4",
                stationId, parameter, measuredAt, LogState.ACTIVE).firstResult();
    }

    public static List<ImputationLog> findAllFor(String stationId, MeasuredParameter parameter, Instant measuredAt) {
        return list("stationId = ?1 AND parameter = ?2 AND measuredAt = ?3",
                Sort.by("createdAt").and("id"), stationId, parameter, measuredAt);
    }

    public static List<ImputationLog> findActiveInRange(String stationId, MeasuredParameter parameter,
                                                        Instant start, Instant end) {
        return list("stationId = ?1 AND parameter = ?2 AND measuredAt >= ?3 AND measuredAt <= ?4 AND state = ?5",
                Sort.by("measuredAt"), stationId, parameter, start, end, LogState.ACTIVE);
    }

    public static List<ImputationLog> findSupersededBy(String stationId, MeasuredParameter parameter, String reason) {
        return list("stationId = ?1 AND parameter = ?2 AND supersedeReason = ?3",
                Sort.by("measuredAt"), stationId, parameter, reason);
    }
}
