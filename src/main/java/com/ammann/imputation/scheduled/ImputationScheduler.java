/* (C)2026 */
package com.ammann.imputation.scheduled;

import com.ammann.imputation.dto.SweepSummaryDTO;
import com.ammann.imputation.service.ImputationSweepService;
import com.ammann.imputation.service.ModelRegistryService;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Cron triggers for the station sweeps.
 * <p>
 * Every job only picks its time arguments and delegates; the sweeps themselves take explicit
 * arguments and can be run by hand. Crons come from {@code imputation.schedule.*}, where
 * {@code off} disables a job. Overlapping executions are skipped.
 */
@ApplicationScoped
public class ImputationScheduler {

    private static final Logger LOG = Logger.getLogger(ImputationScheduler.class);

    private final ImputationSweepService sweepService;
    private final ModelRegistryService registryService;
    private final Clock clock;

    @ConfigProperty(name = "imputation.schedule.gap-fill-lookback-hours", defaultValue = "48")
    int gapFillLookbackHours;

    @Inject
    public ImputationScheduler(ImputationSweepService sweepService, ModelRegistryService registryService, Clock clock) {
        this.sweepService = sweepService;
        this.registryService = registryService;
        this.clock = clock;
    }

    /**
     * Fills SHORT and MEDIUM gaps of the last {@code gap-fill-lookback-hours} for every station.
     */
    @Scheduled(
            cron = "{imputation.schedule.gap-fill}",
            identity = "imputation-gap-fill",
            concurrentExecution = ConcurrentExecution.SKIP)
    @ActivateRequestContext
    public void fillRecentGaps() {
        Instant end = clock.instant().truncatedTo(ChronoUnit.HOURS);
        Instant start = end.minus(Duration.ofHours(gapFillLookbackHours));
        SweepSummaryDTO summary = sweepService.fillGapsAll(start, end);
        LOG.infof("Scheduled gap fill %s..%s: %d/%d stations ok", start, end, summary.succeeded(), summary.total());
    }

    @Scheduled(
            cron = "{imputation.schedule.training}",
            identity = "imputation-training",
            concurrentExecution = ConcurrentExecution.SKIP)
    @ActivateRequestContext
    public void retrainModels() {
        SweepSummaryDTO summary = sweepService.trainAll();
        LOG.infof("Scheduled training: %d trained, %d skipped, %d failed",
                summary.succeeded(), summary.skipped(), summary.failed());
    }

    @Scheduled(
            cron = "{imputation.schedule.validation}",
            identity = "imputation-validation",
            concurrentExecution = ConcurrentExecution.SKIP)
    @ActivateRequestContext
    public void validateModels() {
        SweepSummaryDTO summary = sweepService.validateAll();
        LOG.infof("Scheduled validation: %d certified, %d not certified, %d failed",
                summary.succeeded(), summary.skipped(), summary.failed());
    }

    /**
     * Weekly cleanup of old inactive model versions.
     */
    @Scheduled(
            cron = "{imputation.schedule.model-prune}",
            identity = "imputation-model-prune",
            concurrentExecution = ConcurrentExecution.SKIP)
    @ActivateRequestContext
    public void pruneModels() {
        int deleted = registryService.pruneAll();
        if (deleted == 0) {
            LOG.debug("Model prune: nothing to delete");
        }
    }
}
