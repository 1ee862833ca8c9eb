/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.AnomalyType;
import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;

/**
 * One suspicious reading.
 *
 * @param previousValue value of the hour before, when the rule compares two hours
 * @param severity {@code high} or {@code medium}
 */
public record AnomalyDTO(
        String stationId,
        MeasuredParameter parameter,
        Instant timestamp,
        AnomalyType type,
        double value,
        Double previousValue,
        String severity,
        String detail) {
}
