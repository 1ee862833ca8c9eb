/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.enumeration.TrainingStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Result of a training attempt. Also the payload of a training log row.
 *
 * @param modelVersion new artifact version, null unless TRAINED
 * @param trainRmse RMSE on the training windows in original units
 * @param validation metrics on the chronological hold-out windows in original units
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingResultDTO(
        String stationId,
        MeasuredParameter parameter,
        TrainingStatus status,
        Integer modelVersion,
        int observedHours,
        int trainingSamples,
        int validationSamples,
        Double trainRmse,
        MetricsDTO validation,
        int epochsCompleted,
        long durationMs,
        String message,
        Instant createdAt) {

    /**
     * Creates a successful training result.
     */
    public static TrainingResultDTO trained(String stationId,
                                            MeasuredParameter parameter,
                                            int modelVersion,
                                            int observedHours,
                                            int trainingSamples,
                                            int validationSamples,
                                            double trainRmse,
                                            MetricsDTO validation,
                                            int epochsCompleted,
                                            long durationMs,
                                            Instant createdAt) {
        return new TrainingResultDTO(stationId, parameter, TrainingStatus.TRAINED, modelVersion,
                observedHours, trainingSamples, validationSamples, trainRmse, validation,
                epochsCompleted, durationMs, null, createdAt);
    }

    /**
     * Creates a result for a station without enough usable history.
     */
    public static TrainingResultDTO insufficientHistory(String stationId,
                                                        MeasuredParameter parameter,
                                                        int observedHours,
                                                        int windows,
                                                        String message,
                                                        Instant createdAt) {
        return new TrainingResultDTO(stationId, parameter, TrainingStatus.INSUFFICIENT_HISTORY, null,
                observedHours, windows, 0, null, null, 0, 0L, message, createdAt);
    }

    /**
     * Creates a failed training result.
     */
    public static TrainingResultDTO failed(String stationId,
                                           MeasuredParameter parameter,
                                           int observedHours,
                                           int trainingSamples,
                                           int validationSamples,
                                           long durationMs,
                                           String errorMessage,
                                           Instant createdAt) {
        return new TrainingResultDTO(stationId, parameter, TrainingStatus.FAILED, null,
                observedHours, trainingSamples, validationSamples, null, null, 0, durationMs,
                errorMessage, createdAt);
    }

    public boolean isTrained() {
        return status == TrainingStatus.TRAINED;
    }
}
