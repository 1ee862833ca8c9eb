/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;
import java.util.List;

/**
 * Model input for one target hour: N values at consecutive hours ending one hour before
 * {@code target}. Only built through {@code ContextWindowService}, which guarantees the
 * one-hour spacing.
 */
public record ContextWindowDTO(
        String stationId,
        MeasuredParameter parameter,
        Instant target,
        List<Instant> timestamps,
        double[] values) {

    public ContextWindowDTO {
        timestamps = List.copyOf(timestamps);
        values = values.clone();
    }

    public Instant start() {
        return timestamps.get(0);
    }

    public Instant end() {
        return timestamps.get(timestamps.size() - 1);
    }

    public int size() {
        return values.length;
    }

    @Override
    public double[] values() {
        return values.clone();
    }
}
