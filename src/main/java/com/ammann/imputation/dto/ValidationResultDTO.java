/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.enumeration.ValidationOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Held-out comparison of a model against linear interpolation and forward fill.
 *
 * @param testSamples sampled points that had a valid context window and were evaluated
 * @param excludedSamples sampled points skipped for lack of context
 * @param improvementOverLinearPct {@code (linear - model) / linear * 100} on RMSE
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResultDTO(
        String stationId,
        MeasuredParameter parameter,
        Integer modelVersion,
        ValidationOutcome outcome,
        boolean certified,
        int testSamples,
        int excludedSamples,
        MetricsDTO model,
        MetricsDTO linearInterpolation,
        MetricsDTO forwardFill,
        Double improvementOverLinearPct,
        double sampleFraction,
        long seed,
        String message,
        Instant createdAt) {

    public static ValidationResultDTO evaluated(String stationId,
                                                MeasuredParameter parameter,
                                                int modelVersion,
                                                boolean certified,
                                                int excludedSamples,
                                                MetricsDTO model,
                                                MetricsDTO linear,
                                                MetricsDTO forwardFill,
                                                double sampleFraction,
                                                long seed,
                                                Instant createdAt) {
        double improvement = linear.rmse() == 0.0
                ? 0.0
                : (linear.rmse() - model.rmse()) / linear.rmse() * 100.0;
        return new ValidationResultDTO(stationId, parameter, modelVersion,
                certified ? ValidationOutcome.CERTIFIED : ValidationOutcome.REJECTED, certified,
                model.samples(), excludedSamples, model, linear, forwardFill, improvement,
                sampleFraction, seed, null, createdAt);
    }

    public static ValidationResultDTO modelUnavailable(String stationId, MeasuredParameter parameter,
                                                       double sampleFraction, long seed, Instant createdAt) {
        return new ValidationResultDTO(stationId, parameter, null, ValidationOutcome.MODEL_UNAVAILABLE, false,
                0, 0, null, null, null, null, sampleFraction, seed, "No active model", createdAt);
    }

    public static ValidationResultDTO insufficientData(String stationId,
                                                       MeasuredParameter parameter,
                                                       int modelVersion,
                                                       int excludedSamples,
                                                       String message,
                                                       double sampleFraction,
                                                       long seed,
                                                       Instant createdAt) {
        return new ValidationResultDTO(stationId, parameter, modelVersion, ValidationOutcome.INSUFFICIENT_DATA,
                false, 0, excludedSamples, null, null, null, null, sampleFraction, seed, message, createdAt);
    }
}
