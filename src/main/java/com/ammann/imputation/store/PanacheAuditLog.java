/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.dto.ImputationEntry;
import com.ammann.imputation.dto.MetricsDTO;
import com.ammann.imputation.dto.TrainingResultDTO;
import com.ammann.imputation.dto.ValidationResultDTO;
import com.ammann.imputation.enumeration.LogState;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.StoreUnavailableException;
import com.ammann.imputation.model.ImputationLog;
import com.ammann.imputation.model.TrainingLog;
import com.ammann.imputation.model.ValidationLog;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * {@link AuditLog} over the {@code training_log}, {@code imputation_log} and
 * {@code validation_log} tables. Every append is its own transaction.
 */
@ApplicationScoped
public class PanacheAuditLog implements AuditLog {

    @Override
    public void appendTraining(TrainingResultDTO result) {
        write("appendTraining", result.stationId(), () -> {
            TrainingLog row = new TrainingLog();
            row.stationId = result.stationId();
            row.parameter = result.parameter();
            row.modelVersion = result.modelVersion();
            row.status = result.status();
            row.trainingSamples = result.trainingSamples();
            row.validationSamples = result.validationSamples();
            row.trainRmse = result.trainRmse();
            if (result.validation() != null) {
                row.validationRmse = result.validation().rmse();
                row.validationMae = result.validation().mae();
                row.validationR2 = result.validation().r2();
            }
            row.epochsCompleted = result.epochsCompleted();
            row.durationMs = result.durationMs();
            row.errorMessage = result.message();
            row.createdAt = result.createdAt();
            row.persist();
            return null;
        });
    }

    @Override
    public void appendValidation(ValidationResultDTO result) {
        write("appendValidation", result.stationId(), () -> {
            ValidationLog row = new ValidationLog();
            row.stationId = result.stationId();
            row.parameter = result.parameter();
            row.modelVersion = result.modelVersion();
            row.outcome = result.outcome();
            row.testSamples = result.testSamples();
            row.excludedSamples = result.excludedSamples();
            if (result.model() != null) {
                row.modelRmse = result.model().rmse();
                row.modelMae = result.model().mae();
                row.modelR2 = result.model().r2();
            }
            if (result.linearInterpolation() != null) {
                row.linearRmse = result.linearInterpolation().rmse();
                row.linearMae = result.linearInterpolation().mae();
                row.linearR2 = result.linearInterpolation().r2();
            }
            if (result.forwardFill() != null) {
                row.forwardFillRmse = result.forwardFill().rmse();
                row.forwardFillMae = result.forwardFill().mae();
                row.forwardFillR2 = result.forwardFill().r2();
            }
            row.improvementOverLinearPct = result.improvementOverLinearPct();
            row.certified = result.certified();
            row.sampleFraction = result.sampleFraction();
            row.seed = result.seed();
            row.createdAt = result.createdAt();
            row.persist();
            return null;
        });
    }

    @Override
    public void appendImputation(ImputationEntry entry) {
        write("appendImputation", entry.stationId(), () -> {
            ImputationLog row = new ImputationLog();
            row.stationId = entry.stationId();
            row.parameter = entry.parameter();
            row.measuredAt = entry.timestamp();
            row.imputedValue = entry.imputedValue();
            row.rawPrediction = entry.rawPrediction();
            row.clamped = entry.clamped();
            row.method = entry.method();
            row.inputWindowStart = entry.windowStart();
            row.inputWindowEnd = entry.windowEnd();
            row.modelVersion = entry.modelVersion();
            row.errorBound = entry.errorBound();
            row.certification = entry.certification();
            row.state = entry.state();
            row.supersededAt = entry.supersededAt();
            row.supersedeReason = entry.supersedeReason();
            row.createdAt = entry.createdAt();
            row.persist();
            return null;
        });
    }

    @Override
    public Optional<ImputationEntry> findActiveImputation(String stationId, MeasuredParameter parameter, Instant timestamp) {
        return read("findActiveImputation", stationId,
                () -> Optional.ofNullable(ImputationLog.findActive(stationId, parameter, timestamp)).map(PanacheAuditLog::toEntry));
    }

    @Override
    public Optional<ImputationEntry> supersedeImputation(String stationId,
                                                         MeasuredParameter parameter,
                                                         Instant timestamp,
                                                         String reason,
                                                         Instant supersededAt)
    {
        return write("supersedeImputation", stationId, () -> {
            ImputationLog row = ImputationLog.findActive(stationId, parameter, timestamp);
            if (row == null) {
                return Optional.empty();
            }
            row.state = LogState.SUPERSEDED;
            row.supersededAt = supersededAt;
            row.supersedeReason = reason;
            return Optional.of(toEntry(row));
        });
    }

    @Override
    public List<ImputationEntry> imputationHistory(String stationId, MeasuredParameter parameter, Instant timestamp) {
        return read("imputationHistory", stationId, () -> ImputationLog.findAllFor(stationId, parameter, timestamp).stream()
                .map(PanacheAuditLog::toEntry)
                .toList());
    }

    @Override
    public List<ImputationEntry> activeImputations(String stationId, MeasuredParameter parameter, Instant start, Instant end) {
        return read("activeImputations", stationId, () -> ImputationLog.findActiveInRange(stationId, parameter, start, end).stream()
                .map(PanacheAuditLog::toEntry)
                .toList());
    }

    @Override
    public List<ImputationEntry> supersededImputations(String stationId, MeasuredParameter parameter, String reason) {
        return read("supersededImputations", stationId, () -> ImputationLog.findSupersededBy(stationId, parameter, reason).stream()
                .map(PanacheAuditLog::toEntry)
                .toList());
    }

    @Override
    public List<TrainingResultDTO> trainingHistory(ModelKey key) {
        return read("trainingHistory", key.stationId(), () -> TrainingLog.findForStation(key.stationId(), key.parameter()).stream()
                .map(row -> new TrainingResultDTO(row.stationId, row.parameter, row.status, row.modelVersion,
                        0,
                        row.trainingSamples == null ? 0 : row.trainingSamples,
                        row.validationSamples == null ? 0 : row.validationSamples,
                        row.trainRmse,
                        row.validationRmse == null ? null
                                : new MetricsDTO(row.validationSamples == null ? 0 : row.validationSamples,
                                        row.validationRmse, row.validationMae, row.validationR2),
                        row.epochsCompleted == null ? 0 : row.epochsCompleted,
                        row.durationMs == null ? 0L : row.durationMs,
                        row.errorMessage,
                        row.createdAt))
                .toList());
    }

    @Override
    public List<ValidationResultDTO> validationHistory(ModelKey key) {
        return read("validationHistory", key.stationId(), () -> ValidationLog.findForStation(key.stationId(), key.parameter()).stream()
                .map(row -> new ValidationResultDTO(row.stationId, row.parameter, row.modelVersion, row.outcome,
                        row.certified,
                        row.testSamples == null ? 0 : row.testSamples,
                        row.excludedSamples == null ? 0 : row.excludedSamples,
                        metrics(row.testSamples, row.modelRmse, row.modelMae, row.modelR2),
                        metrics(row.testSamples, row.linearRmse, row.linearMae, row.linearR2),
                        metrics(row.testSamples, row.forwardFillRmse, row.forwardFillMae, row.forwardFillR2),
                        row.improvementOverLinearPct,
                        row.sampleFraction == null ? 0.0 : row.sampleFraction,
                        row.seed == null ? 0L : row.seed,
                        null,
                        row.createdAt))
                .toList());
    }

    private static MetricsDTO metrics(Integer samples, Double rmse, Double mae, Double r2) {
        if (rmse == null) {
            return null;
        }
        return new MetricsDTO(samples == null ? 0 : samples, rmse, mae, r2);
    }

    static ImputationEntry toEntry(ImputationLog row) {
        return new ImputationEntry(row.stationId, row.parameter, row.measuredAt, row.imputedValue,
                row.rawPrediction, row.clamped, row.method, row.inputWindowStart, row.inputWindowEnd,
                row.modelVersion, row.errorBound, row.certification, row.state, row.supersededAt,
                row.supersedeReason, row.createdAt);
    }

    private <T> T read(String operation, String stationId, Callable<T> query) {
        try {
            return QuarkusTransaction.joiningExisting().call(query);
        } catch (PersistenceException | QuarkusTransactionException e) {
            throw StoreUnavailableException.during(operation, stationId, e);
        }
    }

    private <T> T write(String operation, String stationId, Callable<T> work) {
        try {
            return QuarkusTransaction.requiringNew().call(work);
        } catch (PersistenceException | QuarkusTransactionException e) {
            throw StoreUnavailableException.during(operation, stationId, e);
        }
    }
}
