/* (C)2026 */
package com.ammann.imputation.nn;

import com.ammann.imputation.exception.ValidationException;

/**
 * Min-max scaler mapping the fitted range onto [0, 1].
 *
 * <p>A constant series (zero range) maps with scale 1 so the transform stays invertible.
 *
 * @param dataMin smallest fitted value
 * @param dataMax largest fitted value
 */
public record MinMaxScaler(double dataMin, double dataMax) {

    public MinMaxScaler {
        if (!Double.isFinite(dataMin) || !Double.isFinite(dataMax) || dataMax < dataMin) {
            throw ValidationException.invalidParameter(
                    "scaler range", "[" + dataMin + ", " + dataMax + "]", "finite bounds with min <= max");
        }
    }

    /**
     * Fits the scaler over every value given.
     *
     * @throws ValidationException if {@code values} is empty
     */
    public static MinMaxScaler fit(double[] values) {
        if (values == null || values.length == 0) {
            throw ValidationException.insufficientData("scaler values", 1, 0);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return new MinMaxScaler(min, max);
    }

    public double scale() {
        double range = dataMax - dataMin;
        return range == 0.0 ? 1.0 : 1.0 / range;
    }

    public double transform(double value) {
        return (value - dataMin) * scale();
    }

    public double[] transform(double[] values) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = transform(values[i]);
        }
        return scaled;
    }

    public double inverseTransform(double scaled) {
        return scaled / scale() + dataMin;
    }
}
