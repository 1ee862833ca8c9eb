/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.DurationClass;
import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Closed interval of consecutive missing hours for one station and parameter.
 *
 * @param stationId station the gap belongs to
 * @param parameter parameter that is missing
 * @param start first missing hour
 * @param end last missing hour
 * @param hours number of missing hours in the closed interval
 * @param durationClass SHORT, MEDIUM or LONG
 */
public record GapDTO(
        String stationId,
        MeasuredParameter parameter,
        Instant start,
        Instant end,
        long hours,
        DurationClass durationClass) {

    /**
     * Creates a gap DTO, deriving the inclusive length and its class from the bounds.
     */
    public static GapDTO of(String stationId,
                            MeasuredParameter parameter,
                            Instant start,
                            Instant end,
                            int shortMaxHours,
                            int mediumMaxHours) {
        long hours = Duration.between(start, end).toHours() + 1;
        return new GapDTO(stationId, parameter, start, end, hours,
                DurationClass.fromHours(hours, shortMaxHours, mediumMaxHours));
    }

    public boolean isFillable() {
        return durationClass.isFillable();
    }

    /** Every missing hour, oldest first. */
    public List<Instant> missingHours() {
        List<Instant> result = new ArrayList<>((int) hours);
        for (long i = 0; i < hours; i++) {
            result.add(start.plus(Duration.ofHours(i)));
        }
        return result;
    }
}
