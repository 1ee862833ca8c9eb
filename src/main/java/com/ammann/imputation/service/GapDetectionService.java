/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.store.Reading;
import com.ammann.imputation.store.ReadingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Finds and classifies missing hours in a station's series.
 *
 * <p>A missing row and a row with a null value are the same thing here. Imputed values count
 * as present, so a filled gap is not reported again.
 */
@ApplicationScoped
public class GapDetectionService {

    private static final Logger LOG = Logger.getLogger(GapDetectionService.class);

    private final ReadingStore readingStore;
    private final ImputationSettings settings;

    @Inject
    public GapDetectionService(ReadingStore readingStore, ImputationSettings settings) {
        this.readingStore = readingStore;
        this.settings = settings;
    }

    public GapScan detectGaps(String stationId, Instant start, Instant end) {
        return detectGaps(stationId, settings.defaultParameter(), start, end);
    }

    /**
     * Scans the inclusive hourly range {@code [start, end]}, both truncated to the hour.
     *
     * <p>The range is read once before the scan is returned, so a store failure surfaces
     * here as {@link com.ammann.imputation.exception.StoreUnavailableException} and never
     * halfway through iteration.
     *
     * @throws ValidationException if {@code end} precedes {@code start} or the station is unknown
     */
    public GapScan detectGaps(String stationId, MeasuredParameter parameter, Instant start, Instant end) {
        if (start == null || end == null) {
            throw ValidationException.invalidParameter("range", start + ".." + end, "both bounds set");
        }
        Instant from = start.truncatedTo(ChronoUnit.HOURS);
        Instant to = end.truncatedTo(ChronoUnit.HOURS);
        if (to.isBefore(from)) {
            throw ValidationException.invalidParameter("end", end, "not before start " + start);
        }
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }

        List<Reading> readings = readingStore.getReadings(stationId, from, to);
        Set<Instant> present = new HashSet<>();
        for (Reading reading : readings) {
            if (reading.hasValue(parameter)) {
                present.add(reading.timestamp());
            }
        }

        LOG.debugf("Gap scan %s/%s %s..%s: %d of %d hours present",
                stationId, parameter.getKey(), from, to, present.size(),
                ChronoUnit.HOURS.between(from, to) + 1);
        return new GapScan(stationId, parameter, from, to, present,
                settings.shortGapMaxHours(), settings.mediumGapMaxHours());
    }
}
