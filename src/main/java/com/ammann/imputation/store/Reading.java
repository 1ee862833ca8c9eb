/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of one hourly row. Absent map entries and null values both mean missing.
 *
 * @param imputedParameters parameters whose value came from a model
 * @param modelVersion provenance label of the last imputation written to the row
 */
public record Reading(
        String stationId,
        Instant timestamp,
        Map<MeasuredParameter, Double> values,
        Set<MeasuredParameter> imputedParameters,
        String modelVersion,
        Instant createdAt) {

    public Reading {
        EnumMap<MeasuredParameter, Double> copy = new EnumMap<>(MeasuredParameter.class);
        values.forEach((parameter, value) -> {
            if (value != null) {
                copy.put(parameter, value);
            }
        });
        values = Collections.unmodifiableMap(copy);
        imputedParameters = imputedParameters.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(MeasuredParameter.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(imputedParameters));
    }

    public Double value(MeasuredParameter parameter) {
        return values.get(parameter);
    }

    public boolean hasValue(MeasuredParameter parameter) {
        return values.containsKey(parameter);
    }

    public boolean isImputed() {
        return !imputedParameters.isEmpty();
    }

    public boolean isImputed(MeasuredParameter parameter) {
        return imputedParameters.contains(parameter);
    }

    /**
     * The value if it is a real observation, otherwise null.
     */
    public Double observedValue(MeasuredParameter parameter) {
        return isImputed(parameter) ? null : values.get(parameter);
    }
}
