/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.StoreUnavailableException;
import com.ammann.imputation.model.SensorReading;
import com.ammann.imputation.model.Station;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * {@link ReadingStore} backed by the {@code sensor_readings} table.
 *
 * <p>Each write runs in its own short transaction ({@link QuarkusTransaction#requiringNew()}),
 * so a row update is atomic on its own and never waits on a caller's transaction.
 */
@ApplicationScoped
public class PanacheReadingStore implements ReadingStore {

    private static final Logger LOG = Logger.getLogger(PanacheReadingStore.class);

    @Override
    public List<Reading> getReadings(String stationId, Instant start, Instant end) {
        return read("getReadings", stationId, () -> SensorReading.findInRange(stationId, start, end).stream()
                .map(ReadingMerger::toReading)
                .toList());
    }

    @Override
    public List<Reading> getHistory(String stationId) {
        return read("getHistory", stationId, () -> SensorReading.findAllForStation(stationId).stream()
                .map(ReadingMerger::toReading)
                .toList());
    }

    @Override
    public Optional<Reading> findReading(String stationId, Instant timestamp) {
        return read("findReading", stationId, () -> Optional.ofNullable(SensorReading.findAt(stationId, timestamp))
                .map(ReadingMerger::toReading));
    }

    @Override
    public Reading upsertReading(String stationId,
                                 Instant timestamp,
                                 Map<MeasuredParameter, Double> values,
                                 boolean isImputed,
                                 String modelVersion)
    {
        try {
            return QuarkusTransaction.requiringNew().call(() -> {
                SensorReading row = SensorReading.findAt(stationId, timestamp);
                if (row == null) {
                    row = new SensorReading(stationId, timestamp);
                    ReadingMerger.merge(row, values, isImputed, modelVersion);
                    row.persist();
                } else {
                    ReadingMerger.merge(row, values, isImputed, modelVersion);
                }
                LOG.debugf("Upserted reading %s@%s (imputed=%b, version=%s)",
                        stationId, timestamp, row.isImputed, row.modelVersion);
                return ReadingMerger.toReading(row);
            });
        } catch (PersistenceException | QuarkusTransactionException e) {
            throw StoreUnavailableException.during("upsertReading", stationId, e);
        }
    }

    @Override
    public boolean stationExists(String stationId) {
        return read("stationExists", stationId, () -> Station.exists(stationId));
    }

    @Override
    public List<String> listStations() {
        return read("listStations", "*", Station::listIds);
    }

    private <T> T read(String operation, String stationId, Supplier<T> query) {
        try {
            return QuarkusTransaction.joiningExisting().call(query::get);
        } catch (PersistenceException | QuarkusTransactionException e) {
            throw StoreUnavailableException.during(operation, stationId, e);
        }
    }
}
