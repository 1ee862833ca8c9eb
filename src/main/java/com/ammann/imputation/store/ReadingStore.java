/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access to hourly readings, fed by the ingestion side.
 *
 * <p>Writes are durable and immediately visible to later reads of the same station. Every
 * method throws {@link com.ammann.imputation.exception.StoreUnavailableException} when the
 * backing store cannot be reached.
 */
public interface ReadingStore {

    /**
     * Readings in the inclusive range, ordered by timestamp. Hours without a row are absent.
     */
    List<Reading> getReadings(String stationId, Instant start, Instant end);

    /** Every reading of the station, ordered by timestamp. */
    List<Reading> getHistory(String stationId);

    Optional<Reading> findReading(String stationId, Instant timestamp);

    /**
     * Inserts or merges one row.
     *
     * <p>Parameters present in {@code values} are overwritten; a null entry clears the value.
     * Written parameters are marked imputed when {@code isImputed} is true and observed
     * otherwise; cleared parameters lose their imputed mark. {@code modelVersion} replaces
     * the row's provenance label when imputing and is dropped once no imputed parameter remains.
     *
     * @return the row after the write
     */
    Reading upsertReading(String stationId,
                          Instant timestamp,
                          Map<MeasuredParameter, Double> values,
                          boolean isImputed,
                          String modelVersion);

    boolean stationExists(String stationId);

    List<String> listStations();
}
