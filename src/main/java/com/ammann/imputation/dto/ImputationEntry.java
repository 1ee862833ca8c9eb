/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.ImputationMethod;
import com.ammann.imputation.enumeration.LogState;
import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;

/**
 * One imputation audit entry as read from or appended to the audit log.
 */
public record ImputationEntry(
        String stationId,
        MeasuredParameter parameter,
        Instant timestamp,
        double imputedValue,
        double rawPrediction,
        boolean clamped,
        ImputationMethod method,
        Instant windowStart,
        Instant windowEnd,
        int modelVersion,
        Double errorBound,
        CertificationStatus certification,
        LogState state,
        Instant supersededAt,
        String supersedeReason,
        Instant createdAt) {

    public boolean isActive() {
        return state == LogState.ACTIVE;
    }

    public ImputationEntry superseded(Instant at, String reason) {
        return new ImputationEntry(stationId, parameter, timestamp, imputedValue, rawPrediction, clamped,
                method, windowStart, windowEnd, modelVersion, errorBound, certification,
                LogState.SUPERSEDED, at, reason, createdAt);
    }
}
