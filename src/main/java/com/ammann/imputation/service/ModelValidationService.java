/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.ContextWindowDTO;
import com.ammann.imputation.dto.MetricsDTO;
import com.ammann.imputation.dto.ValidationResultDTO;
import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.enumeration.ValidationOutcome;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Certifies or rejects the active model of a station by hold-out comparison against naive
 * baselines.
 *
 * <p>A seeded sample of known-good hours is masked. The model predicts each masked hour from
 * a context window of true values, while linear interpolation and forward fill see the series
 * with every sampled hour removed. The model is certified only when it beats linear
 * interpolation on RMSE and its R² exceeds the configured minimum.
 */
@ApplicationScoped
public class ModelValidationService {

    private static final Logger LOG = Logger.getLogger(ModelValidationService.class);

    private final ReadingStore readingStore;
    private final ModelArtifactStore artifactStore;
    private final AuditLog auditLog;
    private final ModelCache modelCache;
    private final ImputationSettings settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Inject
    public ModelValidationService(ReadingStore readingStore,
                                  ModelArtifactStore artifactStore,
                                  AuditLog auditLog,
                                  ModelCache modelCache,
                                  ImputationSettings settings,
                                  Clock clock,
                                  MeterRegistry meterRegistry)
    {
        this.readingStore = readingStore;
        this.artifactStore = artifactStore;
        this.auditLog = auditLog;
        this.modelCache = modelCache;
        this.settings = settings;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public ValidationResultDTO validate(String stationId) {
        return validate(stationId, settings.defaultParameter());
    }

    /**
     * Validates the active model version.
     *
     * @throws ValidationException if the station does not exist
     */
    public ValidationResultDTO validate(String stationId, MeasuredParameter parameter) {
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }
        ModelKey key = new ModelKey(stationId, parameter);
        double fraction = settings.validationSampleFraction();
        long seed = settings.validationSeed();

        Optional<ModelArtifact> active = artifactStore.findActive(key);
        if (active.isEmpty()) {
            LOG.warnf("Cannot validate %s: no active model", key);
            ValidationResultDTO result = ValidationResultDTO.modelUnavailable(
                    stationId, parameter, fraction, seed, clock.instant());
            recordOutcome(result.outcome());
            return result;
        }
        ModelArtifact artifact = active.get();
        int size = artifact.contextWindowSize();

        Map<Instant, Double> knownGood = new LinkedHashMap<>();
        for (Reading reading : readingStore.getHistory(stationId)) {
            Double value = reading.observedValue(parameter);
            if (value != null && Double.isFinite(value)) {
                knownGood.put(reading.timestamp(), value);
            }
        }

        if (knownGood.size() < 2 * size) {
            return insufficient(artifact, 0, String.format(
                    "Need at least %d known-good values, found %d", 2 * size, knownGood.size()));
        }

        List<Instant> sample = sample(new ArrayList<>(knownGood.keySet()), fraction, seed);
        Set<Instant> masked = new HashSet<>(sample);

        List<Instant> evaluated = new ArrayList<>();
        List<Double> actual = new ArrayList<>();
        List<Double> predicted = new ArrayList<>();
        int excluded = 0;
        for (Instant target : sample) {
            Optional<ContextWindowDTO> window =
                    ContextWindowService.fromSeries(stationId, parameter, target, knownGood, size);
            if (window.isEmpty()) {
                excluded++;
                continue;
            }
            double prediction = parameter.clamp(artifact.predict(window.get().values()));
            evaluated.add(target);
            actual.add(knownGood.get(target));
            predicted.add(prediction);
        }

        if (evaluated.isEmpty()) {
            return insufficient(artifact, excluded, String.format(
                    "None of %d sampled hours has a complete %d-hour context", sample.size(), size));
        }

        List<Instant> timeline = new ArrayList<>(knownGood.keySet());
        Collections.sort(timeline);
        double[] actualValues = toArray(actual);
        double[] linear = new double[evaluated.size()];
        double[] forward = new double[evaluated.size()];
        for (int i = 0; i < evaluated.size(); i++) {
            Instant target = evaluated.get(i);
            Instant before = neighbour(timeline, masked, target, -1);
            Instant after = neighbour(timeline, masked, target, 1);
            linear[i] = linearInterpolation(target, before, after, knownGood);
            forward[i] = forwardFill(before, after, knownGood);
        }

        MetricsDTO modelMetrics = MetricsDTO.compute(actualValues, toArray(predicted));
        MetricsDTO linearMetrics = MetricsDTO.compute(actualValues, linear);
        MetricsDTO forwardMetrics = MetricsDTO.compute(actualValues, forward);

        boolean certified = modelMetrics.rmse() < linearMetrics.rmse() && modelMetrics.r2() > settings.minR2();
        CertificationStatus status = certified ? CertificationStatus.CERTIFIED : CertificationStatus.REJECTED;
        artifactStore.updateCertification(artifact.key(), artifact.version(), status);
        modelCache.invalidate(artifact.key());

        ValidationResultDTO result = ValidationResultDTO.evaluated(stationId, parameter, artifact.version(),
                certified, excluded, modelMetrics, linearMetrics, forwardMetrics, fraction, seed, clock.instant());
        auditLog.appendValidation(result);
        recordOutcome(result.outcome());

        if (certified) {
            LOG.infof("Certified %s: rmse=%.4f (linear %.4f, ffill %.4f), r2=%.4f, %d samples, %d excluded",
                    artifact.versionLabel(), modelMetrics.rmse(), linearMetrics.rmse(), forwardMetrics.rmse(),
                    modelMetrics.r2(), modelMetrics.samples(), excluded);
        } else {
            LOG.warnf("Rejected %s: rmse=%.4f (linear %.4f, ffill %.4f), r2=%.4f (min %.2f), %d samples",
                    artifact.versionLabel(), modelMetrics.rmse(), linearMetrics.rmse(), forwardMetrics.rmse(),
                    modelMetrics.r2(), settings.minR2(), modelMetrics.samples());
        }
        return result;
    }

    private ValidationResultDTO insufficient(ModelArtifact artifact, int excluded, String message) {
        LOG.warnf("Validation of %s inconclusive: %s", artifact.versionLabel(), message);
        ValidationResultDTO result = ValidationResultDTO.insufficientData(artifact.key().stationId(),
                artifact.key().parameter(), artifact.version(), excluded, message,
                settings.validationSampleFraction(), settings.validationSeed(), clock.instant());
        auditLog.appendValidation(result);
        recordOutcome(result.outcome());
        return result;
    }

    /**
     * Uniform sample without replacement of {@code max(1, round(fraction * n))} timestamps.
     */
    static List<Instant> sample(List<Instant> candidates, double fraction, long seed) {
        int count = (int) Math.max(1, Math.round(fraction * candidates.size()));
        List<Instant> shuffled = new ArrayList<>(candidates);
        Collections.sort(shuffled);
        Collections.shuffle(shuffled, new Random(seed));
        List<Instant> sample = new ArrayList<>(shuffled.subList(0, Math.min(count, shuffled.size())));
        Collections.sort(sample);
        return sample;
    }

    /**
     * Nearest unmasked known timestamp before ({@code direction < 0}) or after the target, or null.
     */
    static Instant neighbour(List<Instant> timeline, Set<Instant> masked, Instant target, int direction) {
        int index = Collections.binarySearch(timeline, target);
        if (index < 0) {
            index = direction < 0 ? -index - 2 : -index - 1;
        } else {
            index += direction < 0 ? -1 : 1;
        }
        while (index >= 0 && index < timeline.size()) {
            Instant candidate = timeline.get(index);
            if (!masked.contains(candidate)) {
                return candidate;
            }
            index += direction < 0 ? -1 : 1;
        }
        return null;
    }

    /**
     * Time-weighted interpolation between the neighbours; the single available neighbour when
     * only one side exists.
     */
    static double linearInterpolation(Instant target, Instant before, Instant after, Map<Instant, Double> values) {
        if (before == null && after == null) {
            return Double.NaN;
        }
        if (before == null) {
            return values.get(after);
        }
        if (after == null) {
            return values.get(before);
        }
        double span = after.getEpochSecond() - before.getEpochSecond();
        double offset = target.getEpochSecond() - before.getEpochSecond();
        double left = values.get(before);
        double right = values.get(after);
        return left + (right - left) * (offset / span);
    }

    static double forwardFill(Instant before, Instant after, Map<Instant, Double> values) {
        if (before != null) {
            return values.get(before);
        }
        return after != null ? values.get(after) : Double.NaN;
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    private void recordOutcome(ValidationOutcome outcome) {
        if (meterRegistry != null) {
            Counter.builder("imputation_validations_total")
                    .description("Validation runs by outcome")
                    .tag("outcome", outcome.name())
                    .register(meterRegistry)
                    .increment();
        }
    }
}
