/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.MetricsDTO;
import com.ammann.imputation.dto.TrainingResultDTO;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.enumeration.TrainingStatus;
import com.ammann.imputation.exception.TrainingFailedException;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.nn.FitHistory;
import com.ammann.imputation.nn.FitOptions;
import com.ammann.imputation.nn.MinMaxScaler;
import com.ammann.imputation.nn.SequenceRegressor;
import com.ammann.imputation.store.AuditLog;
import com.ammann.imputation.store.ModelArtifact;
import com.ammann.imputation.store.ModelArtifactStore;
import com.ammann.imputation.store.ModelKey;
import com.ammann.imputation.store.Reading;
import com.ammann.imputation.store.ReadingStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Fits the per-station sequence model from observed history.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Keep observed (non-imputed) values only and require {@code minHistoryHours} of them</li>
 *   <li>Split the history into maximal runs of consecutive hours</li>
 *   <li>Slide N-hour windows inside each run, predicting the following hour</li>
 *   <li>Split windows chronologically, fit the scaler on the training part only</li>
 *   <li>Train with early stopping, publish a new artifact version, append a training log row</li>
 * </ol>
 * Windows never cross a gap because they are built per run.
 *
 * <p>Training of one station is serialised; it holds no lock that other stations or the
 * predictor wait on.
 */
@ApplicationScoped
public class ModelTrainingService {

    private static final Logger LOG = Logger.getLogger(ModelTrainingService.class);
    private static final Duration HOUR = Duration.ofHours(1);

    private final ReadingStore readingStore;
    private final ModelArtifactStore artifactStore;
    private final AuditLog auditLog;
    private final ModelCache modelCache;
    private final ImputationSettings settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final StationLocks trainingLocks = new StationLocks();

    private Timer trainingTimer;

    @Inject
    public ModelTrainingService(ReadingStore readingStore,
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

    void initMetrics()
    {
        if (meterRegistry != null && trainingTimer == null) {
            trainingTimer = Timer.builder("imputation_training_duration")
                    .description("Wall time of successful model training runs")
                    .register(meterRegistry);
        }
    }

    public TrainingResultDTO train(String stationId) {
        return train(stationId, settings.defaultParameter());
    }

    /**
     * Trains a new model version for a station and parameter.
     *
     * @return TRAINED with the new version, INSUFFICIENT_HISTORY, or FAILED (previous version stays active)
     * @throws ValidationException if the station does not exist
     */
    public TrainingResultDTO train(String stationId, MeasuredParameter parameter) {
        initMetrics();
        if (!readingStore.stationExists(stationId)) {
            throw ValidationException.unknownStation(stationId);
        }
        return trainingLocks.withLock(stationId, () -> trainLocked(new ModelKey(stationId, parameter)));
    }

    private TrainingResultDTO trainLocked(ModelKey key) {
        long startNanos = System.nanoTime();
        String stationId = key.stationId();
        MeasuredParameter parameter = key.parameter();
        int size = settings.contextWindowSize();

        List<Instant> timestamps = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (Reading reading : readingStore.getHistory(stationId)) {
            Double value = reading.observedValue(parameter);
            if (value != null && Double.isFinite(value)) {
                timestamps.add(reading.timestamp());
                values.add(value);
            }
        }

        if (values.size() < settings.minHistoryHours()) {
            return insufficient(key, values.size(), 0, String.format(
                    "Need at least %d observed hours, found %d", settings.minHistoryHours(), values.size()));
        }

        List<TrainingWindow> windows = new ArrayList<>();
        List<int[]> runs = contiguousRuns(timestamps);
        for (int[] run : runs) {
            windows.addAll(slidingWindows(timestamps, values, run[0], run[1], size));
        }
        if (windows.size() < 2) {
            return insufficient(key, values.size(), windows.size(), String.format(
                    "No run of %d consecutive hours in %d runs", size + 1, runs.size()));
        }

        int trainCount = (int) Math.floor(windows.size() * settings.trainSplit());
        trainCount = Math.max(1, Math.min(windows.size() - 1, trainCount));
        List<TrainingWindow> trainWindows = windows.subList(0, trainCount);
        List<TrainingWindow> validationWindows = windows.subList(trainCount, windows.size());

        MinMaxScaler scaler = MinMaxScaler.fit(collectValues(trainWindows));
        List<double[]> trainInputs = scaleInputs(trainWindows, scaler);
        double[] trainTargets = scaleTargets(trainWindows, scaler);
        List<double[]> validationInputs = scaleInputs(validationWindows, scaler);
        double[] validationTargets = scaleTargets(validationWindows, scaler);

        LOG.infof("Training %s: %d observed hours, %d runs, %d train / %d validation windows",
                key, values.size(), runs.size(), trainWindows.size(), validationWindows.size());

        SequenceRegressor network = SequenceRegressor.initialize(
                settings.lstmUnitsFirst(), settings.lstmUnitsSecond(), settings.dropoutRate(), settings.trainingSeed());
        FitOptions options = new FitOptions(settings.maxEpochs(), settings.batchSize(),
                settings.learningRate(), settings.patience(), settings.trainingSeed());

        FitHistory history;
        MetricsDTO trainMetrics;
        MetricsDTO validationMetrics;
        try {
            history = network.fit(trainInputs, trainTargets, validationInputs, validationTargets, options);
            trainMetrics = evaluate(network, scaler, trainInputs, trainWindows);
            validationMetrics = evaluate(network, scaler, validationInputs, validationWindows);
            if (!Double.isFinite(trainMetrics.rmse()) || !Double.isFinite(validationMetrics.rmse())) {
                throw new TrainingFailedException("Non-finite RMSE after training");
            }
        } catch (TrainingFailedException e) {
            long durationMs = elapsedMs(startNanos);
            LOG.errorf(e, "Training failed for %s, keeping previous model", key);
            TrainingResultDTO failed = TrainingResultDTO.failed(stationId, parameter, values.size(),
                    trainWindows.size(), validationWindows.size(), durationMs, e.getMessage(), clock.instant());
            auditLog.appendTraining(failed);
            recordRun(TrainingStatus.FAILED);
            return failed;
        }

        ModelArtifact artifact = artifactStore.publish(key, clock.instant(), size, network, scaler,
                trainMetrics.rmse(), validationMetrics.rmse());
        modelCache.invalidate(key);

        long durationMs = elapsedMs(startNanos);
        TrainingResultDTO result = TrainingResultDTO.trained(stationId, parameter, artifact.version(), values.size(),
                trainWindows.size(), validationWindows.size(), trainMetrics.rmse(), validationMetrics,
                history.epochsCompleted(), durationMs, clock.instant());
        auditLog.appendTraining(result);
        recordRun(TrainingStatus.TRAINED);
        if (trainingTimer != null) {
            trainingTimer.record(Duration.ofMillis(durationMs));
        }

        LOG.infof("Trained %s in %dms: epochs=%d (best %d), trainRmse=%.4f, valRmse=%.4f, valMae=%.4f, valR2=%.4f",
                artifact.versionLabel(), durationMs, history.epochsCompleted(), history.bestEpoch(),
                trainMetrics.rmse(), validationMetrics.rmse(), validationMetrics.mae(), validationMetrics.r2());
        return result;
    }

    private TrainingResultDTO insufficient(ModelKey key, int observed, int windows, String message) {
        LOG.warnf("Skipping training for %s: %s", key, message);
        TrainingResultDTO result = TrainingResultDTO.insufficientHistory(
                key.stationId(), key.parameter(), observed, windows, message, clock.instant());
        auditLog.appendTraining(result);
        recordRun(TrainingStatus.INSUFFICIENT_HISTORY);
        return result;
    }

    /**
     * Index ranges {@code [from, to)} of maximal runs of timestamps exactly one hour apart.
     */
    static List<int[]> contiguousRuns(List<Instant> timestamps) {
        List<int[]> runs = new ArrayList<>();
        if (timestamps.isEmpty()) {
            return runs;
        }
        int runStart = 0;
        for (int i = 1; i < timestamps.size(); i++) {
            if (!timestamps.get(i - 1).plus(HOUR).equals(timestamps.get(i))) {
                runs.add(new int[] {runStart, i});
                runStart = i;
            }
        }
        runs.add(new int[] {runStart, timestamps.size()});
        return runs;
    }

    /**
     * Sliding windows inside one run; empty when the run is shorter than {@code size + 1}.
     */
    static List<TrainingWindow> slidingWindows(List<Instant> timestamps, List<Double> values, int from, int to, int size) {
        List<TrainingWindow> windows = new ArrayList<>();
        for (int targetIndex = from + size; targetIndex < to; targetIndex++) {
            double[] inputs = new double[size];
            for (int k = 0; k < size; k++) {
                inputs[k] = values.get(targetIndex - size + k);
            }
            windows.add(new TrainingWindow(timestamps.get(targetIndex), inputs, values.get(targetIndex)));
        }
        return windows;
    }

    private MetricsDTO evaluate(SequenceRegressor network, MinMaxScaler scaler,
                                List<double[]> scaledInputs, List<TrainingWindow> windows) {
        double[] actual = new double[windows.size()];
        double[] predicted = new double[windows.size()];
        for (int i = 0; i < windows.size(); i++) {
            actual[i] = windows.get(i).target();
            predicted[i] = scaler.inverseTransform(network.predict(scaledInputs.get(i)));
        }
        return MetricsDTO.compute(actual, predicted);
    }

    private static double[] collectValues(List<TrainingWindow> windows) {
        int size = windows.get(0).inputs().length + 1;
        double[] all = new double[windows.size() * size];
        int i = 0;
        for (TrainingWindow window : windows) {
            for (double value : window.inputs()) {
                all[i++] = value;
            }
            all[i++] = window.target();
        }
        return all;
    }

    private static List<double[]> scaleInputs(List<TrainingWindow> windows, MinMaxScaler scaler) {
        List<double[]> scaled = new ArrayList<>(windows.size());
        for (TrainingWindow window : windows) {
            scaled.add(scaler.transform(window.inputs()));
        }
        return scaled;
    }

    private static double[] scaleTargets(List<TrainingWindow> windows, MinMaxScaler scaler) {
        double[] targets = new double[windows.size()];
        for (int i = 0; i < windows.size(); i++) {
            targets[i] = scaler.transform(windows.get(i).target());
        }
        return targets;
    }

    private void recordRun(TrainingStatus status) {
        if (meterRegistry != null) {
            Counter.builder("imputation_training_runs_total")
                    .description("Training attempts by outcome")
                    .tag("status", status.name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /** One training sample: N inputs and the value of the following hour. */
    record TrainingWindow(Instant targetTime, double[] inputs, double target) {}
}
