/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.GapFillReportDTO;
import com.ammann.imputation.dto.SweepSummaryDTO;
import com.ammann.imputation.dto.TrainingResultDTO;
import com.ammann.imputation.dto.ValidationResultDTO;
import com.ammann.imputation.enumeration.TrainingStatus;
import com.ammann.imputation.enumeration.ValidationOutcome;
import com.ammann.imputation.store.ReadingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Runs training, validation or gap filling for every station, one task per station.
 *
 * <p>A failing station is logged and counted; it never aborts the others. {@link #cancel()}
 * stops stations that have not started yet, while running stations finish.
 */
@ApplicationScoped
public class ImputationSweepService {

    private static final Logger LOG = Logger.getLogger(ImputationSweepService.class);

    private final ReadingStore readingStore;
    private final ModelTrainingService trainingService;
    private final ModelValidationService validationService;
    private final ImputationService imputationService;
    private final ImputationSettings settings;
    private final ExecutorService executor;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    @Inject
    public ImputationSweepService(ReadingStore readingStore,
                                  ModelTrainingService trainingService,
                                  ModelValidationService validationService,
                                  ImputationService imputationService,
                                  ImputationSettings settings,
                                  @Named("imputation-sweep-executor") ManagedExecutor executor)
    {
        this(readingStore, trainingService, validationService, imputationService, settings, (ExecutorService) executor);
    }

    ImputationSweepService(ReadingStore readingStore,
                           ModelTrainingService trainingService,
                           ModelValidationService validationService,
                           ImputationService imputationService,
                           ImputationSettings settings,
                           ExecutorService executor)
    {
        this.readingStore = readingStore;
        this.trainingService = trainingService;
        this.validationService = validationService;
        this.imputationService = imputationService;
        this.settings = settings;
        this.executor = executor;
    }

    public SweepSummaryDTO trainAll() {
        return sweep("train", stationId -> {
            TrainingResultDTO result = trainingService.train(stationId, settings.defaultParameter());
            if (result.status() == TrainingStatus.TRAINED) {
                return Outcome.SUCCEEDED;
            }
            return result.status() == TrainingStatus.FAILED ? Outcome.FAILED : Outcome.SKIPPED;
        });
    }

    public SweepSummaryDTO validateAll() {
        return sweep("validate", stationId -> {
            ValidationResultDTO result = validationService.validate(stationId, settings.defaultParameter());
            return result.outcome() == ValidationOutcome.CERTIFIED ? Outcome.SUCCEEDED : Outcome.SKIPPED;
        });
    }

    public SweepSummaryDTO fillGapsAll(Instant start, Instant end) {
        return sweep("fill-gaps", stationId -> {
            GapFillReportDTO report = imputationService.fillGaps(stationId, settings.defaultParameter(), start, end);
            return report.imputedHours() > 0 || report.gapsFound() == 0 ? Outcome.SUCCEEDED : Outcome.SKIPPED;
        });
    }

    /**
     * Requests cancellation of the running sweep. Takes effect at the next station boundary.
     */
    public void cancel() {
        if (!cancelRequested.getAndSet(true)) {
            LOG.info("Sweep cancellation requested");
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    private SweepSummaryDTO sweep(String operation, Function<String, Outcome> work) {
        long startNanos = System.nanoTime();
        cancelRequested.set(false);
        List<String> stations = readingStore.listStations();
        LOG.infof("Starting %s sweep over %d stations", operation, stations.size());

        List<Future<Outcome>> futures = new ArrayList<>(stations.size());
        for (String stationId : stations) {
            Callable<Outcome> task = () -> runStation(operation, stationId, work);
            try {
                futures.add(executor.submit(task));
            } catch (RejectedExecutionException e) {
                LOG.debugf("Executor saturated, running %s for %s on the caller", operation, stationId);
                futures.add(CompletableFuture.completedFuture(
                        runStation(operation, stationId, work)));
            }
        }

        int succeeded = 0;
        int skipped = 0;
        int failed = 0;
        int cancelled = 0;
        List<String> failedStations = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Outcome outcome = await(futures.get(i), operation, stations.get(i));
            switch (outcome) {
                case SUCCEEDED -> succeeded++;
                case SKIPPED -> skipped++;
                case CANCELLED -> cancelled++;
                case FAILED -> {
                    failed++;
                    failedStations.add(stations.get(i));
                }
            }
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        SweepSummaryDTO summary = new SweepSummaryDTO(operation, stations.size(), succeeded, skipped, failed,
                cancelled, durationMs, List.copyOf(failedStations));
        if (failed > 0) {
            LOG.warnf("Sweep %s finished in %dms: %d ok, %d skipped, %d failed %s, %d cancelled",
                    operation, durationMs, succeeded, skipped, failed, failedStations, cancelled);
        } else {
            LOG.infof("Sweep %s finished in %dms: %d ok, %d skipped, %d cancelled",
                    operation, durationMs, succeeded, skipped, cancelled);
        }
        return summary;
    }

    private Outcome runStation(String operation, String stationId, Function<String, Outcome> work) {
        if (cancelRequested.get()) {
            LOG.debugf("Sweep %s cancelled before station %s", operation, stationId);
            return Outcome.CANCELLED;
        }
        try {
            return work.apply(stationId);
        } catch (Exception e) {
            LOG.errorf(e, "Sweep %s failed for station %s", operation, stationId);
            return Outcome.FAILED;
        }
    }

    private Outcome await(Future<Outcome> future, String operation, String stationId) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            LOG.warnf("Interrupted while waiting for %s of station %s", operation, stationId);
            return Outcome.CANCELLED;
        } catch (ExecutionException e) {
            LOG.errorf(e.getCause(), "Sweep %s task for station %s aborted", operation, stationId);
            return Outcome.FAILED;
        }
    }

    enum Outcome {
        SUCCEEDED,
        SKIPPED,
        FAILED,
        CANCELLED
    }
}
