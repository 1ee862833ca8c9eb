/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.MeasuredParameter;

/**
 * Accuracy of past imputations whose hour later received a real observation.
 *
 * @param meanBias mean of {@code imputed - observed}
 */
public record ImputationQualityDTO(
        String stationId,
        MeasuredParameter parameter,
        MetricsDTO metrics,
        double meanBias) {
}
