/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.ContextWindowDTO;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.store.Reading;
import com.ammann.imputation.store.ReadingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Builds the model input for a target hour: the N values at {@code target - N h} through
 * {@code target - 1 h}.
 *
 * <p>Returns empty whenever any of those hours is missing. A partial or stretched window is
 * never returned. Imputed values are accepted so a gap can be filled hour by hour.
 */
@ApplicationScoped
public class ContextWindowService {

    private static final Logger LOG = Logger.getLogger(ContextWindowService.class);
    private static final Duration HOUR = Duration.ofHours(1);

    private final ReadingStore readingStore;
    private final AnomalyDetectionService anomalyDetectionService;
    private final ImputationSettings settings;

    @Inject
    public ContextWindowService(ReadingStore readingStore,
                                AnomalyDetectionService anomalyDetectionService,
                                ImputationSettings settings)
    {
        this.readingStore = readingStore;
        this.anomalyDetectionService = anomalyDetectionService;
        this.settings = settings;
    }

    public Optional<ContextWindowDTO> build(String stationId, MeasuredParameter parameter, Instant target) {
        int size = settings.contextWindowSize();
        Instant start = target.minus(HOUR.multipliedBy(size));
        Instant end = target.minus(HOUR);

        List<Instant> timestamps = new ArrayList<>(size);
        List<Double> values = new ArrayList<>(size);
        for (Reading reading : readingStore.getReadings(stationId, start, end)) {
            Double value = reading.value(parameter);
            if (value != null) {
                timestamps.add(reading.timestamp());
                values.add(value);
            }
        }

        Optional<ContextWindowDTO> window = assemble(stationId, parameter, target, timestamps, values, size);
        if (window.isEmpty()) {
            LOG.debugf("No context for %s/%s at %s: %d of %d hours present",
                    stationId, parameter.getKey(), target, values.size(), size);
            return window;
        }
        if (settings.rejectAnomalousContext() && containsBlockingAnomaly(window.get())) {
            LOG.infof("Context for %s/%s at %s rejected: contains spike or negative value",
                    stationId, parameter.getKey(), target);
            return Optional.empty();
        }
        return window;
    }

    /**
     * Validates an ordered series as a context window for {@code target}: exactly {@code size}
     * finite values, the last one hour before {@code target}, consecutive timestamps one hour apart.
     */
    public static Optional<ContextWindowDTO> assemble(String stationId,
                                                      MeasuredParameter parameter,
                                                      Instant target,
                                                      List<Instant> timestamps,
                                                      List<Double> values,
                                                      int size)
    {
        if (timestamps.size() != size || values.size() != size) {
            return Optional.empty();
        }
        Instant expected = target.minus(HOUR.multipliedBy(size));
        double[] window = new double[size];
        for (int i = 0; i < size; i++) {
            Double value = values.get(i);
            if (!timestamps.get(i).equals(expected) || value == null || !Double.isFinite(value)) {
                return Optional.empty();
            }
            window[i] = value;
            expected = expected.plus(HOUR);
        }
        return Optional.of(new ContextWindowDTO(stationId, parameter, target, timestamps, window));
    }

    /**
     * Builds a window from an in-memory hourly series keyed by timestamp.
     */
    public static Optional<ContextWindowDTO> fromSeries(String stationId,
                                                        MeasuredParameter parameter,
                                                        Instant target,
                                                        Map<Instant, Double> series,
                                                        int size)
    {
        List<Instant> timestamps = new ArrayList<>(size);
        List<Double> values = new ArrayList<>(size);
        for (int k = size; k >= 1; k--) {
            Instant at = target.minus(HOUR.multipliedBy(k));
            Double value = series.get(at);
            if (value == null) {
                return Optional.empty();
            }
            timestamps.add(at);
            values.add(value);
        }
        return assemble(stationId, parameter, target, timestamps, values, size);
    }

    private boolean containsBlockingAnomaly(ContextWindowDTO window) {
        List<Double> values = new ArrayList<>(window.size());
        for (double value : window.values()) {
            values.add(value);
        }
        return anomalyDetectionService.detect(window.stationId(), window.parameter(), window.timestamps(), values)
                .stream()
                .anyMatch(anomaly -> anomaly.type().isContextBlocking());
    }
}
