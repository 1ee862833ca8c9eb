/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.dto.ImputationEntry;
import com.ammann.imputation.dto.ImputationQualityDTO;
import com.ammann.imputation.dto.MetricsDTO;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.store.AuditLog;
import com.ammann.imputation.store.Reading;
import com.ammann.imputation.store.ReadingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Compares past imputations with the real observations that later replaced them.
 */
@ApplicationScoped
public class ImputationQualityService {

    private static final Logger LOG = Logger.getLogger(ImputationQualityService.class);

    private final ReadingStore readingStore;
    private final AuditLog auditLog;

    @Inject
    public ImputationQualityService(ReadingStore readingStore, AuditLog auditLog) {
        this.readingStore = readingStore;
        this.auditLog = auditLog;
    }

    /**
     * Error metrics over every imputation superseded by an observation. Metrics are NaN when
     * no such pair exists yet.
     */
    public ImputationQualityDTO compare(String stationId, MeasuredParameter parameter) {
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }
        List<Double> imputed = new ArrayList<>();
        List<Double> observed = new ArrayList<>();
        for (ImputationEntry entry : auditLog.supersededImputations(stationId, parameter, ImputationService.REASON_OBSERVED)) {
            Optional<Reading> reading = readingStore.findReading(stationId, entry.timestamp());
            Double actual = reading.map(r -> r.observedValue(parameter)).orElse(null);
            if (actual != null) {
                imputed.add(entry.imputedValue());
                observed.add(actual);
            }
        }

        double[] actualValues = new double[observed.size()];
        double[] imputedValues = new double[imputed.size()];
        double bias = 0.0;
        for (int i = 0; i < actualValues.length; i++) {
            actualValues[i] = observed.get(i);
            imputedValues[i] = imputed.get(i);
            bias += imputedValues[i] - actualValues[i];
        }
        bias = actualValues.length == 0 ? Double.NaN : bias / actualValues.length;

        MetricsDTO metrics = MetricsDTO.compute(actualValues, imputedValues);
        LOG.debugf("Imputation quality %s/%s: %d pairs, rmse=%.4f, bias=%.4f",
                stationId, parameter.getKey(), metrics.samples(), metrics.rmse(), bias);
        return new ImputationQualityDTO(stationId, parameter, metrics, bias);
    }
}
