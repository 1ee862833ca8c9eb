/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.ImputationStatus;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Outcome of imputing one hour.
 *
 * @param value written value, null unless IMPUTED
 * @param rawPrediction model output before clamping
 * @param clamped true when the prediction was pulled into the valid range
 * @param errorBound validation RMSE of the model used
 * @param reused true when an identical imputation from the same model already existed
 * @param message reason for a non-imputed outcome
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImputationResultDTO(
        String stationId,
        MeasuredParameter parameter,
        Instant timestamp,
        ImputationStatus status,
        Double value,
        Double rawPrediction,
        boolean clamped,
        Integer modelVersion,
        CertificationStatus certification,
        Instant windowStart,
        Instant windowEnd,
        Double errorBound,
        boolean reused,
        String message) {

    public static ImputationResultDTO imputed(ImputationEntry entry, boolean reused) {
        return new ImputationResultDTO(entry.stationId(), entry.parameter(), entry.timestamp(),
                ImputationStatus.IMPUTED, entry.imputedValue(), entry.rawPrediction(), entry.clamped(),
                entry.modelVersion(), entry.certification(), entry.windowStart(), entry.windowEnd(),
                entry.errorBound(), reused, null);
    }

    public static ImputationResultDTO alreadyObserved(String stationId, MeasuredParameter parameter,
                                                      Instant timestamp, double observed) {
        return new ImputationResultDTO(stationId, parameter, timestamp, ImputationStatus.ALREADY_OBSERVED,
                observed, null, false, null, null, null, null, null, false, "Value already observed");
    }

    public static ImputationResultDTO modelUnavailable(String stationId, MeasuredParameter parameter,
                                                       Instant timestamp, String reason) {
        return new ImputationResultDTO(stationId, parameter, timestamp, ImputationStatus.MODEL_UNAVAILABLE,
                null, null, false, null, null, null, null, null, false, reason);
    }

    public static ImputationResultDTO noContext(String stationId, MeasuredParameter parameter,
                                                Instant timestamp, Integer modelVersion) {
        return new ImputationResultDTO(stationId, parameter, timestamp, ImputationStatus.NO_CONTEXT,
                null, null, false, modelVersion, null, null, null, null, false,
                "No contiguous context window before target");
    }

    public static ImputationResultDTO longGap(String stationId, MeasuredParameter parameter,
                                              Instant timestamp, long gapHours) {
        return new ImputationResultDTO(stationId, parameter, timestamp, ImputationStatus.LONG_GAP,
                null, null, false, null, null, null, null, null, false,
                "Target lies in a gap of at least " + gapHours + " hours");
    }

    public boolean isImputed() {
        return status == ImputationStatus.IMPUTED;
    }
}
