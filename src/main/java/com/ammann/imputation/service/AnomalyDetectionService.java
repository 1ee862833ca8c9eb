/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.dto.AnomalyDTO;
import com.ammann.imputation.enumeration.AnomalyType;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.store.Reading;
import com.ammann.imputation.store.ReadingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Flags suspicious readings: negative values, five-fold spikes, implausible hourly changes,
 * stuck sensors and statistical outliers.
 *
 * <p>Reporting only. Context windows consult it when {@code imputation.context.reject-anomalies}
 * is enabled.
 */
@ApplicationScoped
public class AnomalyDetectionService {

    private static final Logger LOG = Logger.getLogger(AnomalyDetectionService.class);

    static final double SPIKE_FACTOR = 5.0;
    static final double SPIKE_BASE_FLOOR = 1.0;
    static final double Z_SCORE_THRESHOLD = 3.0;
    static final int STUCK_RUN_HOURS = 6;
    private static final Duration HOUR = Duration.ofHours(1);

    private final ReadingStore readingStore;

    @Inject
    public AnomalyDetectionService(ReadingStore readingStore) {
        this.readingStore = readingStore;
    }

    /**
     * Runs every rule over the observed and imputed values of a station in the inclusive range.
     */
    public List<AnomalyDTO> detectAnomalies(String stationId, MeasuredParameter parameter, Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw ValidationException.invalidParameter("end", end, "not before start " + start);
        }
        List<Instant> timestamps = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (Reading reading : readingStore.getReadings(stationId, start, end)) {
            Double value = reading.value(parameter);
            if (value != null) {
                timestamps.add(reading.timestamp());
                values.add(value);
            }
        }
        List<AnomalyDTO> anomalies = detect(stationId, parameter, timestamps, values);
        if (!anomalies.isEmpty()) {
            LOG.infof("Detected %d anomalies for %s/%s between %s and %s",
                    anomalies.size(), stationId, parameter.getKey(), start, end);
        }
        return anomalies;
    }

    /**
     * Pure rule evaluation over an ordered series. Rules comparing two values only fire for
     * timestamps exactly one hour apart.
     */
    public List<AnomalyDTO> detect(String stationId, MeasuredParameter parameter, List<Instant> timestamps, List<Double> values) {
        List<AnomalyDTO> anomalies = new ArrayList<>();
        int n = values.size();
        if (n == 0) {
            return anomalies;
        }

        for (int i = 0; i < n; i++) {
            double value = values.get(i);
            Instant at = timestamps.get(i);
            if (value < 0.0 && parameter.getMin() >= 0.0) {
                anomalies.add(new AnomalyDTO(stationId, parameter, at, AnomalyType.NEGATIVE_VALUE, value, null,
                        "high", "Negative value for a non-negative parameter"));
            }
            if (i == 0 || !timestamps.get(i - 1).plus(HOUR).equals(at)) {
                continue;
            }
            double previous = values.get(i - 1);
            double base = Math.max(previous, SPIKE_BASE_FLOOR);
            if (value >= base * SPIKE_FACTOR) {
                anomalies.add(new AnomalyDTO(stationId, parameter, at, AnomalyType.SPIKE, value, previous,
                        "high", String.format("Value jumped %.1fx from %.2f", value / base, previous)));
            }
            double rate = Math.abs(value - previous);
            if (rate > parameter.getRateThreshold()) {
                String direction = value > previous ? "rise" : "drop";
                anomalies.add(new AnomalyDTO(stationId, parameter, at, AnomalyType.RATE_OF_CHANGE, value, previous,
                        rate > parameter.getRateThreshold() * 2 ? "high" : "medium",
                        String.format("Sudden %s of %.2f %s/h", direction, rate, parameter.getUnit())));
            }
        }

        anomalies.addAll(detectStuckValues(stationId, parameter, timestamps, values));
        anomalies.addAll(detectOutliers(stationId, parameter, timestamps, values));
        anomalies.sort(Comparator.comparing(AnomalyDTO::timestamp));
        return anomalies;
    }

    private List<AnomalyDTO> detectStuckValues(String stationId, MeasuredParameter parameter,
                                               List<Instant> timestamps, List<Double> values) {
        List<AnomalyDTO> stuck = new ArrayList<>();
        int runStart = 0;
        for (int i = 1; i <= values.size(); i++) {
            boolean continues = i < values.size()
                    && values.get(i).equals(values.get(runStart))
                    && timestamps.get(i - 1).plus(HOUR).equals(timestamps.get(i));
            if (continues) {
                continue;
            }
            int length = i - runStart;
            if (length >= STUCK_RUN_HOURS) {
                stuck.add(new AnomalyDTO(stationId, parameter, timestamps.get(runStart), AnomalyType.STUCK_VALUE,
                        values.get(runStart), null, "medium",
                        String.format("Same value for %d consecutive hours", length)));
            }
            runStart = i;
        }
        return stuck;
    }

    private List<AnomalyDTO> detectOutliers(String stationId, MeasuredParameter parameter,
                                            List<Instant> timestamps, List<Double> values) {
        List<AnomalyDTO> outliers = new ArrayList<>();
        int n = values.size();
        if (n < 3) {
            return outliers;
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / n;
        double std = Math.sqrt(variance);
        if (std == 0.0) {
            return outliers;
        }
        for (int i = 0; i < n; i++) {
            double z = (values.get(i) - mean) / std;
            if (Math.abs(z) > Z_SCORE_THRESHOLD) {
                outliers.add(new AnomalyDTO(stationId, parameter, timestamps.get(i), AnomalyType.STATISTICAL,
                        values.get(i), null, Math.abs(z) > Z_SCORE_THRESHOLD * 1.5 ? "high" : "medium",
                        String.format("z-score %.2f", z)));
            }
        }
        return outliers;
    }
}
