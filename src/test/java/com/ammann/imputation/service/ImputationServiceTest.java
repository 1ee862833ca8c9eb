/* (C)2026 */
package com.ammann.imputation.service;

import static com.ammann.imputation.support.TestDataFactory.STATION;
import static com.ammann.imputation.support.TestDataFactory.hour;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.GapFillReportDTO;
import com.ammann.imputation.dto.ImputationEntry;
import com.ammann.imputation.dto.ImputationResultDTO;
import com.ammann.imputation.dto.TrainingResultDTO;
import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.ImputationStatus;
import com.ammann.imputation.enumeration.LogState;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.enumeration.TrainingStatus;
import com.ammann.imputation.exception.StoreUnavailableException;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.nn.MinMaxScaler;
import com.ammann.imputation.nn.SequenceRegressor;
import com.ammann.imputation.store.ModelKey;
import com.ammann.imputation.store.Reading;
import com.ammann.imputation.support.InMemoryAuditLog;
import com.ammann.imputation.support.InMemoryModelArtifactStore;
import com.ammann.imputation.support.InMemoryReadingStore;
import com.ammann.imputation.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ImputationService} over in-memory stores.
 */
class ImputationServiceTest {

    private static final ModelKey KEY = new ModelKey(STATION, MeasuredParameter.PM25);

    private final Clock clock = TestDataFactory.fixedClock();

    private InMemoryReadingStore store;
    private InMemoryModelArtifactStore artifacts;
    private InMemoryAuditLog auditLog;
    private TtlModelCache cache;
    private SimpleMeterRegistry registry;
    private ImputationSettings settings;
    private Map<Instant, Double> series;

    @BeforeEach
    void setUp() {
        store = new InMemoryReadingStore();
        artifacts = new InMemoryModelArtifactStore();
        auditLog = new InMemoryAuditLog();
        cache = new TtlModelCache(Duration.ofHours(1), clock);
        registry = new SimpleMeterRegistry();
        settings = TestDataFactory.fastSettings().build();
        series = TestDataFactory.withGap(TestDataFactory.noisyConstant(200, 50.0, 1.0, 11L), 150, 6);
        store.addSeries(STATION, MeasuredParameter.PM25, series);
    }

    private ImputationService newService(ImputationSettings config) {
        return new ImputationService(store, artifacts, auditLog, cache,
                new ContextWindowService(store, new AnomalyDetectionService(store), config),
                new GapDetectionService(store, config), config, clock, registry);
    }

    private TrainingResultDTO trainModel() {
        TrainingResultDTO result = new ModelTrainingService(store, artifacts, auditLog, cache, settings, clock, registry)
                .train(STATION);
        assertThat(result.status()).isEqualTo(TrainingStatus.TRAINED);
        return result;
    }

    private Double valueAt(int offset) {
        return store.findReading(STATION, hour(offset)).map(r -> r.value(MeasuredParameter.PM25)).orElse(null);
    }

    @Test
    void fillsMediumGapWithPlausibleValues() {
        TrainingResultDTO training = trainModel();
        ImputationService service = newService(settings);

        GapFillReportDTO report = service.fillGaps(STATION, hour(0), hour(199));

        assertThat(report.gapsFound()).isEqualTo(1);
        assertThat(report.imputedHours()).isEqualTo(6);
        assertThat(report.longGaps()).isEmpty();
        assertThat(report.skippedHours()).isZero();

        double tolerance = 3 * training.trainRmse();
        double before = series.get(hour(149));
        double after = series.get(hour(156));
        for (int offset = 150; offset <= 155; offset++) {
            Reading reading = store.findReading(STATION, hour(offset)).orElseThrow();
            double value = reading.value(MeasuredParameter.PM25);
            assertThat(MeasuredParameter.PM25.isWithinRange(value)).isTrue();
            assertThat(Math.min(Math.abs(value - before), Math.abs(value - after))).isLessThanOrEqualTo(tolerance);
            assertThat(reading.isImputed(MeasuredParameter.PM25)).isTrue();
            assertThat(reading.modelVersion()).isEqualTo("st-001/pm25/v1");
        }
        assertThat(auditLog.activeImputations(STATION, MeasuredParameter.PM25, hour(0), hour(199))).hasSize(6);
        assertThat(registry.counter("imputation_values_total", "outcome", "IMPUTED").count()).isEqualTo(6.0);
    }

    @Test
    void imputedEntryRecordsProvenance() {
        trainModel();

        ImputationResultDTO result = newService(settings).impute(STATION, hour(150).plusSeconds(1234));

        assertThat(result.status()).isEqualTo(ImputationStatus.IMPUTED);
        assertThat(result.timestamp()).isEqualTo(hour(150));
        assertThat(result.windowStart()).isEqualTo(hour(126));
        assertThat(result.windowEnd()).isEqualTo(hour(149));
        assertThat(result.modelVersion()).isEqualTo(1);
        assertThat(result.certification()).isEqualTo(CertificationStatus.PENDING);
        assertThat(result.errorBound()).isNotNull().isPositive();
        assertThat(result.reused()).isFalse();

        ImputationEntry entry = auditLog.findActiveImputation(STATION, MeasuredParameter.PM25, hour(150)).orElseThrow();
        assertThat(entry.imputedValue()).isEqualTo(result.value());
        assertThat(entry.createdAt()).isEqualTo(TestDataFactory.NOW);
    }

    @Test
    void failedAuditAppendLeavesNoUnloggedImputedValue() {
        trainModel();
        InMemoryAuditLog failingLog = spy(auditLog);
        doThrow(new StoreUnavailableException("audit store down"))
                .when(failingLog).appendImputation(any(ImputationEntry.class));
        ImputationService failing = new ImputationService(store, artifacts, failingLog, cache,
                new ContextWindowService(store, new AnomalyDetectionService(store), settings),
                new GapDetectionService(store, settings), settings, clock, registry);

        assertThatThrownBy(() -> failing.impute(STATION, hour(150)))
                .isInstanceOf(StoreUnavailableException.class);

        assertThat(valueAt(150)).isNull();
        assertThat(store.findReading(STATION, hour(150)))
                .hasValueSatisfying(reading -> assertThat(reading.isImputed(MeasuredParameter.PM25)).isFalse());
        assertThat(auditLog.findActiveImputation(STATION, MeasuredParameter.PM25, hour(150))).isEmpty();

        ImputationResultDTO retried = newService(settings).impute(STATION, hour(150));

        assertThat(retried.status()).isEqualTo(ImputationStatus.IMPUTED);
        assertThat(retried.reused()).isFalse();
        assertThat(store.findReading(STATION, hour(150)).orElseThrow().isImputed(MeasuredParameter.PM25)).isTrue();
        assertThat(auditLog.imputationHistory(STATION, MeasuredParameter.PM25, hour(150))).hasSize(1);
    }

    @Test
    void imputingTwiceWithSameModelIsIdempotent() {
        trainModel();
        ImputationService service = newService(settings);

        ImputationResultDTO first = service.impute(STATION, hour(150));
        int writes = store.upsertCount();
        ImputationResultDTO second = service.impute(STATION, hour(150));

        assertThat(second.status()).isEqualTo(ImputationStatus.IMPUTED);
        assertThat(second.value()).isEqualTo(first.value());
        assertThat(second.reused()).isTrue();
        assertThat(store.upsertCount()).isEqualTo(writes);
        assertThat(auditLog.imputationHistory(STATION, MeasuredParameter.PM25, hour(150))).hasSize(1);
    }

    @Test
    void rollbackThenImputeReproducesTheValue() {
        trainModel();
        ImputationService service = newService(settings);
        double original = service.impute(STATION, hour(150)).value();

        assertThat(service.rollbackImputation(STATION, hour(150))).isTrue();

        assertThat(valueAt(150)).isNull();
        assertThat(store.findReading(STATION, hour(150)).orElseThrow().isImputed()).isFalse();
        assertThat(auditLog.findActiveImputation(STATION, MeasuredParameter.PM25, hour(150))).isEmpty();
        assertThat(auditLog.imputationHistory(STATION, MeasuredParameter.PM25, hour(150)))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.state()).isEqualTo(LogState.SUPERSEDED);
                    assertThat(entry.supersedeReason()).isEqualTo("rollback");
                });

        ImputationResultDTO again = service.impute(STATION, hour(150));

        assertThat(again.value()).isEqualTo(original);
        assertThat(again.reused()).isFalse();
        assertThat(auditLog.imputationHistory(STATION, MeasuredParameter.PM25, hour(150))).hasSize(2);
    }

    @Test
    void rollbackNeverTouchesObservedValues() {
        ImputationService service = newService(settings);

        assertThat(service.rollbackImputation(STATION, hour(100))).isFalse();
        assertThat(valueAt(100)).isEqualTo(series.get(hour(100)));
    }

    @Test
    void rollbackRangeRevertsEveryImputedHour() {
        trainModel();
        ImputationService service = newService(settings);
        service.fillGaps(STATION, hour(0), hour(199));

        int reverted = service.rollbackRange(STATION, MeasuredParameter.PM25, hour(140), hour(160));

        assertThat(reverted).isEqualTo(6);
        assertThat(new GapDetectionService(store, settings).detectGaps(STATION, hour(0), hour(199))).hasSize(1);
        assertThat(auditLog.supersededImputations(STATION, MeasuredParameter.PM25, "rollback")).hasSize(6);
    }

    @Test
    void observedTargetIsNotOverwritten() {
        trainModel();

        ImputationResultDTO result = newService(settings).impute(STATION, hour(100));

        assertThat(result.status()).isEqualTo(ImputationStatus.ALREADY_OBSERVED);
        assertThat(result.value()).isEqualTo(series.get(hour(100)));
        assertThat(auditLog.allImputations()).isEmpty();
    }

    @Test
    void targetWithoutContextIsLeftEmpty() {
        trainModel();
        store.removeHour(STATION, hour(10));

        ImputationResultDTO result = newService(settings).impute(STATION, hour(10));

        assertThat(result.status()).isEqualTo(ImputationStatus.NO_CONTEXT);
        assertThat(result.modelVersion()).isEqualTo(1);
        assertThat(valueAt(10)).isNull();
        assertThat(auditLog.allImputations()).isEmpty();
    }

    @Test
    void longGapIsFlaggedNotImputed() {
        store.addSeries("st-002", MeasuredParameter.PM25,
                TestDataFactory.withGap(TestDataFactory.noisyConstant(200, 50.0, 1.0, 3L), 100, 30));
        ImputationService service = newService(settings);

        ImputationResultDTO result = service.impute("st-002", hour(110));
        GapFillReportDTO report = service.fillGaps("st-002", hour(0), hour(199));

        assertThat(result.status()).isEqualTo(ImputationStatus.LONG_GAP);
        assertThat(report.gapsFound()).isEqualTo(1);
        assertThat(report.longGaps()).singleElement().satisfies(gap -> assertThat(gap.hours()).isEqualTo(30));
        assertThat(report.longGapHours()).isEqualTo(30);
        assertThat(report.imputedHours()).isZero();
        assertThat(auditLog.allImputations()).isEmpty();
    }

    @Test
    void futureTimestampIsRejected() {
        ImputationService service = newService(settings);

        assertThatThrownBy(() -> service.impute(STATION, TestDataFactory.NOW.plus(Duration.ofHours(2))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("future");
    }

    @Test
    void unknownStationIsRejected() {
        ImputationService service = newService(settings);

        assertThatThrownBy(() -> service.impute("missing", hour(5))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.rollbackImputation("missing", hour(5))).isInstanceOf(ValidationException.class);
    }

    @Test
    void predictionOutsideValidRangeIsClamped() {
        // inverse scaling maps any network output far below zero
        artifacts.publish(KEY, TestDataFactory.NOW, 24, SequenceRegressor.initialize(4, 2, 0.0, 1L),
                new MinMaxScaler(-10000.0, -9999.0), 1.0, 1.0);

        ImputationResultDTO result = newService(settings).impute(STATION, hour(150));

        assertThat(result.status()).isEqualTo(ImputationStatus.IMPUTED);
        assertThat(result.clamped()).isTrue();
        assertThat(result.value()).isEqualTo(MeasuredParameter.PM25.getMin());
        assertThat(result.rawPrediction()).isLessThan(0.0);
        assertThat(valueAt(150)).isEqualTo(0.0);
        assertThat(registry.counter("imputation_clamped_total").count()).isEqualTo(1.0);
    }

    @Test
    void newerModelSupersedesOlderImputation() {
        trainModel();
        ImputationService service = newService(settings);
        service.impute(STATION, hour(150));

        trainModel();
        ImputationResultDTO result = service.impute(STATION, hour(150));

        assertThat(result.modelVersion()).isEqualTo(2);
        List<ImputationEntry> history = auditLog.imputationHistory(STATION, MeasuredParameter.PM25, hour(150));
        assertThat(history).extracting(ImputationEntry::state).containsExactly(LogState.SUPERSEDED, LogState.ACTIVE);
        assertThat(history.get(0).supersedeReason()).isEqualTo("reimputed");
        assertThat(store.findReading(STATION, hour(150)).orElseThrow().modelVersion()).isEqualTo("st-001/pm25/v2");
    }

    @Test
    void concurrentCallsForTheSameHourWriteOneEntry() throws Exception {
        trainModel();
        ImputationService service = newService(settings);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<ImputationResultDTO>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                calls.add(() -> service.impute(STATION, hour(150)));
            }
            List<Double> values = new ArrayList<>();
            for (Future<ImputationResultDTO> future : pool.invokeAll(calls)) {
                values.add(future.get().value());
            }
            assertThat(values).doesNotContainNull().containsOnly(values.get(0));
        } finally {
            pool.shutdownNow();
        }
        assertThat(auditLog.imputationHistory(STATION, MeasuredParameter.PM25, hour(150))).hasSize(1);
    }

    @Nested
    @DisplayName("Model usability")
    class ModelUsability {

        @Test
        void noModelMeansModelUnavailable() {
            ImputationResultDTO result = newService(settings).impute(STATION, hour(150));

            assertThat(result.status()).isEqualTo(ImputationStatus.MODEL_UNAVAILABLE);
            assertThat(valueAt(150)).isNull();
            assertThat(auditLog.allImputations()).isEmpty();
        }

        @Test
        void insufficientHistoryLeavesGapsEmpty() {
            store.addSeries("st-050", MeasuredParameter.PM25,
                    TestDataFactory.withGap(TestDataFactory.noisyConstant(50, 30.0, 1.0, 9L), 30, 2));
            TrainingResultDTO training = new ModelTrainingService(store, artifacts, auditLog, cache, settings, clock, null)
                    .train("st-050");

            ImputationResultDTO result = newService(settings).impute("st-050", hour(30));

            assertThat(training.status()).isEqualTo(TrainingStatus.INSUFFICIENT_HISTORY);
            assertThat(result.status()).isEqualTo(ImputationStatus.MODEL_UNAVAILABLE);
            assertThat(store.findReading("st-050", hour(30))).isEmpty();
        }

        @Test
        void rejectedModelIsNeverUsed() {
            trainModel();
            artifacts.updateCertification(KEY, 1, CertificationStatus.REJECTED);

            ImputationResultDTO result = newService(settings).impute(STATION, hour(150));

            assertThat(result.status()).isEqualTo(ImputationStatus.MODEL_UNAVAILABLE);
            assertThat(result.message()).contains("REJECTED");
            assertThat(valueAt(150)).isNull();
        }

        @Test
        void pendingModelIsRefusedWhenCertificationIsRequired() {
            trainModel();
            ImputationSettings strict = settings.toBuilder().requireCertification(true).build();

            assertThat(newService(strict).impute(STATION, hour(150)).status())
                    .isEqualTo(ImputationStatus.MODEL_UNAVAILABLE);

            artifacts.updateCertification(KEY, 1, CertificationStatus.CERTIFIED);
            cache.invalidate(KEY);

            assertThat(newService(strict).impute(STATION, hour(150)).status()).isEqualTo(ImputationStatus.IMPUTED);
        }
    }
}
