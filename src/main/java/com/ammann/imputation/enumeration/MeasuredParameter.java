/* (C)2026 */
package com.ammann.imputation.enumeration;

import com.ammann.imputation.exception.ValidationException;
import java.util.Locale;

/**
 * Parameters tracked per hourly reading, with their physically valid range.
 *
 * <p>Predictions are clamped into {@code [min, max]}. The rate threshold is the largest
 * plausible change between two consecutive hours and feeds the rate-of-change anomaly rule.
 */
public enum MeasuredParameter
{
    PM25("pm25", "µg/m³", 0.0, 1000.0, 30.0),
    PM10("pm10", "µg/m³", 0.0, 1500.0, 50.0),
    O3("o3", "ppb", 0.0, 500.0, 40.0),
    CO("co", "ppm", 0.0, 50.0, 5.0),
    NO2("no2", "ppb", 0.0, 2000.0, 40.0),
    SO2("so2", "ppb", 0.0, 2000.0, 40.0),
    NOX("nox", "ppb", 0.0, 3000.0, 60.0),
    WS("ws", "m/s", 0.0, 75.0, 10.0),
    WD("wd", "degrees", 0.0, 360.0, 360.0),
    TEMP("temp", "°C", -60.0, 60.0, 8.0),
    RH("rh", "%", 0.0, 100.0, 30.0),
    BP("bp", "mmHg", 500.0, 800.0, 5.0),
    RAIN("rain", "mm", 0.0, 500.0, 100.0);

    private final String key;
    private final String unit;
    private final double min;
    private final double max;
    private final double rateThreshold;

    MeasuredParameter(String key, String unit, double min, double max, double rateThreshold) {
        this.key = key;
        this.unit = unit;
        this.min = min;
        this.max = max;
        this.rateThreshold = rateThreshold;
    }

    /**
     * Clamps a value into the valid range of this parameter.
     *
     * @param value raw value
     * @return value limited to {@code [min, max]}
     */
    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean isWithinRange(double value) {
        return value >= min && value <= max;
    }

    /**
     * Resolves a parameter from its enum name or lower-case key ({@code "pm25"}, {@code "PM25"}).
     *
     * @throws ValidationException if the name matches no parameter
     */
    public static MeasuredParameter fromName(String name) {
        if (name == null || name.isBlank()) {
            throw ValidationException.invalidParameter("parameter", name, "one of pm25, pm10, o3, co, no2, so2, nox, ws, wd, temp, rh, bp, rain");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MeasuredParameter parameter : values()) {
            if (parameter.key.equals(normalized)) {
                return parameter;
            }
        }
        throw ValidationException.invalidParameter("parameter", name, "one of pm25, pm10, o3, co, no2, so2, nox, ws, wd, temp, rh, bp, rain");
    }

    public String getKey() { return key; }

    public String getUnit() { return unit; }

    public double getMin() { return min; }

    public double getMax() { return max; }

    public double getRateThreshold() { return rateThreshold; }
}
