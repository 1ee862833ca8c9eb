/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.model.SensorReading;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Merge rules of {@link ReadingStore#upsertReading} applied to a {@link SensorReading} entity.
 *
 * <p>A real observation replaces an imputed value. An imputed value is dropped for any
 * parameter that already holds an observation.
 */
public final class ReadingMerger {

    private ReadingMerger() {}

    public static void merge(SensorReading row,
                             Map<MeasuredParameter, Double> values,
                             boolean isImputed,
                             String modelVersion)
    {
        Set<MeasuredParameter> imputed = row.getImputedParameters();
        values.forEach((parameter, value) -> {
            if (isImputed && isObserved(row, imputed, parameter)) {
                return;
            }
            row.setValue(parameter, value);
            if (value != null && isImputed) {
                imputed.add(parameter);
            } else {
                imputed.remove(parameter);
            }
        });
        if (isImputed && !imputed.isEmpty()) {
            row.modelVersion = modelVersion;
        }
        row.setImputedParameters(imputed);
    }

    private static boolean isObserved(SensorReading row, Set<MeasuredParameter> imputed, MeasuredParameter parameter) {
        return row.getValue(parameter) != null && !imputed.contains(parameter);
    }

    public static Reading toReading(SensorReading row) {
        Map<MeasuredParameter, Double> values = new EnumMap<>(MeasuredParameter.class);
        for (MeasuredParameter parameter : MeasuredParameter.values()) {
            Double value = row.getValue(parameter);
            if (value != null) {
                values.put(parameter, value);
            }
        }
        return new Reading(row.stationId, row.measuredAt, values, row.getImputedParameters(),
                row.modelVersion, row.createdAt);
    }
}
