/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.ContextWindowDTO;
import com.ammann.imputation.dto.GapDTO;
import com.ammann.imputation.dto.GapFillReportDTO;
import com.ammann.imputation.dto.ImputationEntry;
import com.ammann.imputation.dto.ImputationResultDTO;
import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.DurationClass;
import com.ammann.imputation.enumeration.ImputationMethod;
import com.ammann.imputation.enumeration.ImputationStatus;
import com.ammann.imputation.enumeration.LogState;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.store.AuditLog;
import com.ammann.imputation.store.ModelArtifact;
import com.ammann.imputation.store.ModelArtifactStore;
import com.ammann.imputation.store.ModelKey;
import com.ammann.imputation.store.Reading;
import com.ammann.imputation.store.ReadingStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Fills single missing hours with model predictions and reverts them.
 *
 * <p>Every written value carries provenance: the reading is flagged imputed with the model's
 * version label, and exactly one ACTIVE imputation log entry describes it. Re-imputing with
 * a newer model or rolling back supersedes that entry instead of deleting it.
 *
 * <p>Writes for one station are serialised so the check-then-write sequence of
 * {@link #impute} stays idempotent under concurrent callers.
 */
@ApplicationScoped
public class ImputationService {

    private static final Logger LOG = Logger.getLogger(ImputationService.class);
    private static final Duration HOUR = Duration.ofHours(1);

    static final String REASON_ROLLBACK = "rollback";
    static final String REASON_REIMPUTED = "reimputed";
    static final String REASON_OBSERVED = "observed";

    private final ReadingStore readingStore;
    private final ModelArtifactStore artifactStore;
    private final AuditLog auditLog;
    private final ModelCache modelCache;
    private final ContextWindowService contextWindowService;
    private final GapDetectionService gapDetectionService;
    private final ImputationSettings settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final StationLocks writeLocks = new StationLocks();

    private Counter clampedCounter;

    @Inject
    public ImputationService(ReadingStore readingStore,
                             ModelArtifactStore artifactStore,
                             AuditLog auditLog,
                             ModelCache modelCache,
                             ContextWindowService contextWindowService,
                             GapDetectionService gapDetectionService,
                             ImputationSettings settings,
                             Clock clock,
                             MeterRegistry meterRegistry)
    {
        this.readingStore = readingStore;
        this.artifactStore = artifactStore;
        this.auditLog = auditLog;
        this.modelCache = modelCache;
        this.contextWindowService = contextWindowService;
        this.gapDetectionService = gapDetectionService;
        this.settings = settings;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    void initMetrics()
    {
        if (meterRegistry != null && clampedCounter == null) {
            clampedCounter = Counter.builder("imputation_clamped_total")
                    .description("Predictions pulled into the parameter's valid range")
                    .register(meterRegistry);
        }
    }

    public ImputationResultDTO impute(String stationId, Instant timestamp) {
        return impute(stationId, settings.defaultParameter(), timestamp);
    }

    /**
     * Imputes one hour.
     *
     * <p>Calling this twice with the same active model returns the stored value the second
     * time without writing a second log entry.
     *
     * @throws ValidationException if the station is unknown or the timestamp lies in the future
     */
    public ImputationResultDTO impute(String stationId, MeasuredParameter parameter, Instant timestamp) {
        initMetrics();
        Instant target = requireTarget(stationId, timestamp);
        ImputationResultDTO result = writeLocks.withLock(stationId,
                () -> imputeLocked(new ModelKey(stationId, parameter), target));
        recordOutcome(result.status());
        return result;
    }

    private ImputationResultDTO imputeLocked(ModelKey key, Instant target) {
        String stationId = key.stationId();
        MeasuredParameter parameter = key.parameter();

        Optional<Reading> existing = readingStore.findReading(stationId, target);
        if (existing.isPresent() && existing.get().observedValue(parameter) != null) {
            return ImputationResultDTO.alreadyObserved(stationId, parameter, target,
                    existing.get().observedValue(parameter));
        }

        long gapHours = gapLengthAround(key, target);
        if (DurationClass.fromHours(gapHours, settings.shortGapMaxHours(), settings.mediumGapMaxHours()) == DurationClass.LONG) {
            LOG.warnf("Not imputing %s at %s: inside a gap of at least %d hours", key, target, gapHours);
            return ImputationResultDTO.longGap(stationId, parameter, target, gapHours);
        }

        Optional<ModelArtifact> loaded = modelCache.getOrLoad(key, artifactStore::findActive);
        if (loaded.isEmpty()) {
            LOG.warnf("No trained model for %s, leaving %s empty", key, target);
            return ImputationResultDTO.modelUnavailable(stationId, parameter, target, "No trained model");
        }
        ModelArtifact artifact = loaded.get();
        if (!artifact.certification().isUsable(settings.requireCertification())) {
            LOG.warnf("Model %s is %s, leaving %s empty", artifact.versionLabel(), artifact.certification(), target);
            return ImputationResultDTO.modelUnavailable(stationId, parameter, target,
                    "Model v" + artifact.version() + " is " + artifact.certification());
        }

        Optional<ImputationEntry> active = auditLog.findActiveImputation(stationId, parameter, target);
        if (active.isPresent()
                && active.get().modelVersion() == artifact.version()
                && existing.isPresent()
                && existing.get().isImputed(parameter)) {
            LOG.debugf("%s at %s already imputed by %s", key, target, artifact.versionLabel());
            return ImputationResultDTO.imputed(active.get(), true);
        }

        Optional<ContextWindowDTO> window = contextWindowService.build(stationId, parameter, target);
        if (window.isEmpty()) {
            return ImputationResultDTO.noContext(stationId, parameter, target, artifact.version());
        }

        double raw = artifact.predict(window.get().values());
        if (!Double.isFinite(raw)) {
            LOG.errorf("Model %s produced %s for %s, leaving it empty", artifact.versionLabel(), raw, target);
            return ImputationResultDTO.modelUnavailable(stationId, parameter, target,
                    "Model v" + artifact.version() + " produced a non-finite prediction");
        }
        double value = parameter.clamp(raw);
        boolean clamped = value != raw;
        if (clamped) {
            LOG.infof("Clamped prediction for %s at %s from %.3f to %.3f", key, target, raw, value);
            if (clampedCounter != null) {
                clampedCounter.increment();
            }
        }

        Instant now = clock.instant();
        ImputationEntry entry = new ImputationEntry(stationId, parameter, target, value, raw, clamped,
                ImputationMethod.LSTM, window.get().start(), window.get().end(), artifact.version(),
                artifact.validationRmse(), artifact.certification(), LogState.ACTIVE, null, null, now);
        readingStore.upsertReading(stationId, target, Collections.singletonMap(parameter, value), true,
                artifact.versionLabel());
        try {
            if (active.isPresent()) {
                auditLog.supersedeImputation(stationId, parameter, target, REASON_REIMPUTED, now);
            }
            auditLog.appendImputation(entry);
        } catch (RuntimeException e) {
            revertUnloggedValue(key, target, e);
            throw e;
        }

        if (artifact.certification() == CertificationStatus.PENDING) {
            LOG.warnf("Imputed %s at %s with %s, which has not been validated yet",
                    key, target, artifact.versionLabel());
        }
        LOG.debugf("Imputed %s at %s = %.3f with %s", key, target, value, artifact.versionLabel());
        return ImputationResultDTO.imputed(entry, false);
    }

    /**
     * Clears a value whose log entry could not be written, so no imputed reading is left
     * without provenance. The hour is empty afterwards and a retry imputes it again.
     */
    private void revertUnloggedValue(ModelKey key, Instant target, RuntimeException cause) {
        LOG.errorf(cause, "Audit append failed for %s at %s, clearing the written value", key, target);
        try {
            readingStore.upsertReading(key.stationId(), target,
                    Collections.singletonMap(key.parameter(), null), false, null);
        } catch (RuntimeException revertFailure) {
            cause.addSuppressed(revertFailure);
        }
    }

    public boolean rollbackImputation(String stationId, Instant timestamp) {
        return rollbackImputation(stationId, settings.defaultParameter(), timestamp);
    }

    /**
     * Clears an imputed value and supersedes its log entry. Observed values are never touched.
     *
     * @return true if an imputed value or an active log entry was reverted
     */
    public boolean rollbackImputation(String stationId, MeasuredParameter parameter, Instant timestamp) {
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }
        Instant target = timestamp.truncatedTo(ChronoUnit.HOURS);
        return writeLocks.withLock(stationId, () -> rollbackLocked(stationId, parameter, target));
    }

    private boolean rollbackLocked(String stationId, MeasuredParameter parameter, Instant target) {
        Optional<Reading> reading = readingStore.findReading(stationId, target);
        boolean imputedValue = reading.isPresent() && reading.get().isImputed(parameter);

        Optional<ImputationEntry> superseded = auditLog.supersedeImputation(
                stationId, parameter, target, REASON_ROLLBACK, clock.instant());
        if (imputedValue) {
            readingStore.upsertReading(stationId, target, Collections.singletonMap(parameter, null), false, null);
        }

        if (imputedValue || superseded.isPresent()) {
            LOG.infof("Rolled back imputation %s/%s at %s (version %s)", stationId, parameter.getKey(), target,
                    superseded.map(entry -> String.valueOf(entry.modelVersion())).orElse("unknown"));
            return true;
        }
        return false;
    }

    /**
     * Rolls back every imputed hour in the inclusive range.
     *
     * @return number of hours reverted
     */
    public int rollbackRange(String stationId, MeasuredParameter parameter, Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw ValidationException.invalidParameter("end", end, "not before start " + start);
        }
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }
        Set<Instant> targets = new TreeSet<>();
        for (Reading reading : readingStore.getReadings(stationId, start, end)) {
            if (reading.isImputed(parameter)) {
                targets.add(reading.timestamp());
            }
        }
        for (ImputationEntry entry : auditLog.activeImputations(stationId, parameter, start, end)) {
            targets.add(entry.timestamp());
        }

        int reverted = 0;
        for (Instant target : targets) {
            if (rollbackImputation(stationId, parameter, target)) {
                reverted++;
            }
        }
        LOG.infof("Rolled back %d imputed hours for %s/%s between %s and %s",
                reverted, stationId, parameter.getKey(), start, end);
        return reverted;
    }

    public GapFillReportDTO fillGaps(String stationId, Instant start, Instant end) {
        return fillGaps(stationId, settings.defaultParameter(), start, end);
    }

    /**
     * Imputes every hour of the SHORT and MEDIUM gaps in the range, oldest first, so each
     * hour can use the previous imputed hour as context. LONG gaps are reported only.
     */
    public GapFillReportDTO fillGaps(String stationId, MeasuredParameter parameter, Instant start, Instant end) {
        GapScan scan = gapDetectionService.detectGaps(stationId, parameter, start, end);

        int gapsFound = 0;
        List<GapDTO> longGaps = new ArrayList<>();
        int imputed = 0;
        int noContext = 0;
        int unavailable = 0;
        long longGapHours = 0;

        for (GapDTO gap : scan) {
            gapsFound++;
            if (!gap.isFillable()) {
                longGaps.add(gap);
                longGapHours += gap.hours();
                LOG.warnf("Flagged %s gap %s..%s (%dh) for %s/%s, not imputing",
                        gap.durationClass(), gap.start(), gap.end(), gap.hours(), stationId, parameter.getKey());
                continue;
            }
            for (Instant hour : gap.missingHours()) {
                ImputationStatus status = impute(stationId, parameter, hour).status();
                switch (status) {
                    case IMPUTED -> imputed++;
                    case NO_CONTEXT -> noContext++;
                    case MODEL_UNAVAILABLE -> unavailable++;
                    case LONG_GAP -> longGapHours++;
                    case ALREADY_OBSERVED -> LOG.debugf("%s observed while filling, skipped", hour);
                }
            }
        }

        LOG.infof("Gap fill %s/%s %s..%s: %d gaps (%d long), %d imputed, %d without context, %d without model",
                stationId, parameter.getKey(), scan.start(), scan.end(), gapsFound, longGaps.size(),
                imputed, noContext, unavailable);
        return new GapFillReportDTO(stationId, parameter, scan.start(), scan.end(), gapsFound,
                List.copyOf(longGaps), imputed, noContext, unavailable, longGapHours);
    }

    /**
     * Writes a late real observation. An imputation at that hour is superseded so its
     * accuracy can later be compared with the observed value.
     */
    public void recordObservation(String stationId, MeasuredParameter parameter, Instant timestamp, double value) {
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }
        Instant target = timestamp.truncatedTo(ChronoUnit.HOURS);
        writeLocks.withLock(stationId, () -> {
            auditLog.supersedeImputation(stationId, parameter, target, REASON_OBSERVED, clock.instant())
                    .ifPresent(entry -> LOG.debugf("Observation replaced imputed %s/%s at %s",
                            stationId, parameter.getKey(), target));
            readingStore.upsertReading(stationId, target, Collections.singletonMap(parameter, value), false, null);
            return null;
        });
    }

    /**
     * Length of the missing run containing {@code target}, looking at most one hour past the
     * medium threshold each way and never past the current hour.
     */
    private long gapLengthAround(ModelKey key, Instant target) {
        long reach = settings.mediumGapMaxHours() + 1L;
        Instant now = clock.instant().truncatedTo(ChronoUnit.HOURS);
        Instant from = target.minus(HOUR.multipliedBy(reach));
        Instant to = target.plus(HOUR.multipliedBy(reach));
        if (to.isAfter(now)) {
            to = now;
        }

        Set<Instant> present = new HashSet<>();
        for (Reading reading : readingStore.getReadings(key.stationId(), from, to)) {
            if (reading.hasValue(key.parameter()) && !reading.timestamp().equals(target)) {
                present.add(reading.timestamp());
            }
        }

        long length = 1;
        for (Instant t = target.minus(HOUR); !t.isBefore(from) && !present.contains(t); t = t.minus(HOUR)) {
            length++;
        }
        for (Instant t = target.plus(HOUR); !t.isAfter(to) && !present.contains(t); t = t.plus(HOUR)) {
            length++;
        }
        return length;
    }

    private Instant requireTarget(String stationId, Instant timestamp) {
        if (timestamp == null) {
            throw ValidationException.invalidParameter("timestamp", null, "an hour-aligned instant");
        }
        Instant target = timestamp.truncatedTo(ChronoUnit.HOURS);
        if (target.isAfter(clock.instant())) {
            throw ValidationException.invalidParameter("timestamp", timestamp, "not in the future");
        }
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }
        return target;
    }

    private void recordOutcome(ImputationStatus status) {
        if (meterRegistry != null) {
            Counter.builder("imputation_values_total")
                    .description("Imputation requests by outcome")
                    .tag("outcome", status.name())
                    .register(meterRegistry)
                    .increment();
        }
    }
}
