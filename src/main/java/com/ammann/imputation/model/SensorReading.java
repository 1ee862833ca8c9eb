/* (C)2026 */
package com.ammann.imputation.model;

import com.ammann.imputation.enumeration.MeasuredParameter;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One hourly row per station. A null parameter column means the value is missing.
 *
 * <p>{@link #imputedParameters} names the columns holding model output; {@link #isImputed}
 * is true whenever that set is non-empty.
 */
@Entity
@Table(name = SensorReading.TABLE_NAME,
        uniqueConstraints = @UniqueConstraint(name = "uk_reading_station_time", columnNames = {"station_id", "measured_at"}),
        indexes = {
                @Index(name = "idx_reading_station_time", columnList = "station_id, measured_at"),
                @Index(name = "idx_reading_imputed", columnList = "is_imputed")
        })
public class SensorReading extends PanacheEntity
{
    public static final String TABLE_NAME = "sensor_readings";

    @Column(name = "station_id", nullable = false, length = 32)
    @NotNull
    public String stationId;

    /** Hour-aligned UTC timestamp. */
    @Column(name = "measured_at", nullable = false)
    @NotNull
    public Instant measuredAt;

    @Column(name = "pm25")
    public Double pm25;

    @Column(name = "pm10")
    public Double pm10;

    @Column(name = "o3")
    public Double o3;

    @Column(name = "co")
    public Double co;

    @Column(name = "no2")
    public Double no2;

    @Column(name = "so2")
    public Double so2;

    @Column(name = "nox")
    public Double nox;

    @Column(name = "ws")
    public Double ws;

    @Column(name = "wd")
    public Double wd;

    @Column(name = "temp")
    public Double temp;

    @Column(name = "rh")
    public Double rh;

    @Column(name = "bp")
    public Double bp;

    @Column(name = "rain")
    public Double rain;

    @Column(name = "is_imputed", nullable = false)
    public boolean isImputed;

    /** Comma separated parameter keys whose value came from a model. */
    @Column(name = "imputed_parameters", length = 128)
    public String imputedParameters;

    @Column(name = "model_version", length = 96)
    public String modelVersion;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt = Instant.now();

    public SensorReading() {
    }

    public SensorReading(String stationId, Instant measuredAt) {
        this.stationId = stationId;
        this.measuredAt = measuredAt;
    }

    public Double getValue(MeasuredParameter parameter) {
        return switch (parameter) {
            case PM25 -> pm25;
            case PM10 -> pm10;
            case O3 -> o3;
            case CO -> co;
            case NO2 -> no2;
            case SO2 -> so2;
            case NOX -> nox;
            case WS -> ws;
            case WD -> wd;
            case TEMP -> temp;
            case RH -> rh;
            case BP -> bp;
            case RAIN -> rain;
        };
    }

    public void setValue(MeasuredParameter parameter, Double value) {
        switch (parameter) {
            case PM25 -> pm25 = value;
            case PM10 -> pm10 = value;
            case O3 -> o3 = value;
            case CO -> co = value;
            case NO2 -> no2 = value;
            case SO2 -> so2 = value;
            case NOX -> nox = value;
            case WS -> ws = value;
            case WD -> wd = value;
            case TEMP -> temp = value;
            case RH -> rh = value;
            case BP -> bp = value;
            case RAIN -> rain = value;
        }
    }

    public Set<MeasuredParameter> getImputedParameters() {
        if (imputedParameters == null || imputedParameters.isBlank()) {
            return EnumSet.noneOf(MeasuredParameter.class);
        }
        return Arrays.stream(imputedParameters.split(","))
                .map(MeasuredParameter::fromName)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(MeasuredParameter.class)));
    }

    public void setImputedParameters(Set<MeasuredParameter> parameters) {
        this.imputedParameters = parameters.isEmpty()
                ? null
                : parameters.stream().map(MeasuredParameter::getKey).collect(Collectors.joining(","));
        this.isImputed = !parameters.isEmpty();
        if (!isImputed) {
            this.modelVersion = null;
        }
    }

    // Finder methods

    /**
     * Readings of a station in the inclusive range, oldest first.
     */
    public static List<SensorReading> findInRange(String stationId, Instant start, Instant end) {
        return list("stationId = ?1 AND measuredAt >= ?2 AND measuredAt <= ?3",
                Sort.by("measuredAt"), stationId, start, end);
    }

    public static List<SensorReading> findAllForStation(String stationId) {
        return list("stationId", Sort.by("measuredAt"), stationId);
    }

    public static SensorReading findAt(String stationId, Instant measuredAt) {
        return find("stationId = ?1 AND measuredAt = ?2", stationId, measuredAt).firstResult();
    }
}
