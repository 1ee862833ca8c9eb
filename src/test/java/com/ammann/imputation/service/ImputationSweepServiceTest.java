/* (C)2026 */
package com.ammann.imputation.service;

import static com.ammann.imputation.support.TestDataFactory.NOW;
import static com.ammann.imputation.support.TestDataFactory.hour;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.GapFillReportDTO;
import com.ammann.imputation.dto.MetricsDTO;
import com.ammann.imputation.dto.SweepSummaryDTO;
import com.ammann.imputation.dto.TrainingResultDTO;
import com.ammann.imputation.dto.ValidationResultDTO;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.StoreUnavailableException;
import com.ammann.imputation.support.InMemoryReadingStore;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImputationSweepServiceTest {

    private static final MeasuredParameter PM25 = MeasuredParameter.PM25;

    private InMemoryReadingStore store;
    private ModelTrainingService trainingService;
    private ModelValidationService validationService;
    private ImputationService imputationService;
    private ExecutorService executor;
    private ImputationSweepService sweepService;

    @BeforeEach
    void setUp() {
        store = new InMemoryReadingStore().addStation("st-a").addStation("st-b").addStation("st-c");
        trainingService = mock(ModelTrainingService.class);
        validationService = mock(ModelValidationService.class);
        imputationService = mock(ImputationService.class);
        executor = Executors.newFixedThreadPool(2);
        sweepService = newSweep(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ImputationSweepService newSweep(ExecutorService pool) {
        return new ImputationSweepService(store, trainingService, validationService, imputationService,
                ImputationSettings.defaults(), pool);
    }

    private static TrainingResultDTO trained(String stationId) {
        return TrainingResultDTO.trained(stationId, PM25, 1, 500, 380, 96, 0.4,
                new MetricsDTO(96, 0.5, 0.4, 0.8), 12, 100L, NOW);
    }

    @Test
    void failingStationDoesNotAbortTheOthers() {
        when(trainingService.train("st-a", PM25)).thenReturn(trained("st-a"));
        when(trainingService.train("st-b", PM25))
                .thenReturn(TrainingResultDTO.insufficientHistory("st-b", PM25, 40, 0, "too short", NOW));
        when(trainingService.train("st-c", PM25))
                .thenThrow(StoreUnavailableException.during("getHistory", "st-c", new RuntimeException("down")));

        SweepSummaryDTO summary = sweepService.trainAll();

        assertThat(summary.operation()).isEqualTo("train");
        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.failedStations()).containsExactly("st-c");
    }

    @Test
    void validationSweepCountsOnlyCertifiedAsSucceeded() {
        when(validationService.validate(any(), eq(PM25)))
                .thenAnswer(call -> ValidationResultDTO.modelUnavailable(call.getArgument(0), PM25, 0.1, 42L, NOW));
        when(validationService.validate("st-b", PM25)).thenReturn(ValidationResultDTO.evaluated("st-b", PM25, 1,
                true, 0, new MetricsDTO(50, 0.5, 0.4, 0.7), new MetricsDTO(50, 0.8, 0.6, 0.5),
                new MetricsDTO(50, 0.9, 0.7, 0.4), 0.1, 42L, NOW));

        SweepSummaryDTO summary = sweepService.validateAll();

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(2);
        assertThat(summary.failed()).isZero();
    }

    @Test
    void gapFillSweepTreatsStationsWithoutGapsAsSucceeded() {
        when(imputationService.fillGaps(any(), eq(PM25), eq(hour(0)), eq(hour(99))))
                .thenAnswer(call -> new GapFillReportDTO(call.getArgument(0), PM25, hour(0), hour(99), 0, List.of(),
                        0, 0, 0, 0L));
        when(imputationService.fillGaps("st-c", PM25, hour(0), hour(99)))
                .thenReturn(new GapFillReportDTO("st-c", PM25, hour(0), hour(99), 1, List.of(), 0, 2, 0, 0L));

        SweepSummaryDTO summary = sweepService.fillGapsAll(hour(0), hour(99));

        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.skipped()).isEqualTo(1);
    }

    @Test
    void cancelStopsStationsThatHaveNotStarted() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            ImputationSweepService sequential = newSweep(single);
            when(trainingService.train("st-a", PM25)).thenAnswer(call -> {
                sequential.cancel();
                return trained("st-a");
            });

            SweepSummaryDTO summary = sequential.trainAll();

            assertThat(summary.succeeded()).isEqualTo(1);
            assertThat(summary.cancelled()).isEqualTo(2);
            assertThat(sequential.isCancelRequested()).isTrue();
            verify(trainingService, never()).train("st-b", PM25);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void nextSweepClearsEarlierCancellation() {
        when(trainingService.train(any(), eq(PM25))).thenAnswer(call -> trained(call.getArgument(0)));
        sweepService.cancel();

        SweepSummaryDTO summary = sweepService.trainAll();

        assertThat(summary.succeeded()).isEqualTo(3);
        assertThat(summary.cancelled()).isZero();
    }

    @Test
    void saturatedExecutorRunsStationsOnTheCaller() {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        when(trainingService.train(any(), eq(PM25))).thenAnswer(call -> trained(call.getArgument(0)));

        SweepSummaryDTO summary = newSweep(closed).trainAll();

        assertThat(summary.succeeded()).isEqualTo(3);
    }
}
