/* (C)2026 */
package com.ammann.imputation.config;

import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ValidationException;
import java.time.Duration;

/**
 * Immutable tuning knobs of the imputation engine.
 *
 * <p>Produced from {@code imputation.*} configuration by {@link SettingsProducer}; unit tests
 * build variants with {@link #builder()}.
 *
 * @param contextWindowSize number of consecutive hourly values fed to the model (N)
 * @param shortGapMaxHours largest gap classified as SHORT
 * @param mediumGapMaxHours largest gap classified as MEDIUM
 * @param validationSampleFraction fraction of known-good values held out by the validator
 * @param minR2 R² the model has to exceed to be certified
 * @param patience epochs without validation improvement before training stops
 * @param lstmUnitsFirst hidden units of the first recurrent layer
 * @param lstmUnitsSecond hidden units of the second recurrent layer
 * @param dropoutRate dropout applied after each recurrent layer while training
 * @param maxEpochs upper bound on training epochs
 * @param batchSize mini-batch size
 * @param learningRate Adam learning rate
 * @param minHistoryHours observed hours required before training is attempted
 * @param trainSplit chronological share of windows used for fitting
 * @param trainingSeed seed for weight init, shuffling and dropout
 * @param validationSeed seed for held-out sampling
 * @param cacheTtl time a loaded model stays cached
 * @param requireCertification when true only CERTIFIED models impute
 * @param rejectAnomalousContext when true context windows containing spikes or negative values are refused
 * @param keepModelVersions artifact versions retained per station and parameter when pruning
 * @param defaultParameter parameter used by the parameterless operation overloads
 */
public record ImputationSettings(
        int contextWindowSize,
        int shortGapMaxHours,
        int mediumGapMaxHours,
        double validationSampleFraction,
        double minR2,
        int patience,
        int lstmUnitsFirst,
        int lstmUnitsSecond,
        double dropoutRate,
        int maxEpochs,
        int batchSize,
        double learningRate,
        int minHistoryHours,
        double trainSplit,
        long trainingSeed,
        long validationSeed,
        Duration cacheTtl,
        boolean requireCertification,
        boolean rejectAnomalousContext,
        int keepModelVersions,
        MeasuredParameter defaultParameter) {

    public ImputationSettings {
        requirePositive("contextWindowSize", contextWindowSize);
        requirePositive("shortGapMaxHours", shortGapMaxHours);
        if (mediumGapMaxHours < shortGapMaxHours) {
            throw ValidationException.invalidParameter(
                    "mediumGapMaxHours", mediumGapMaxHours, ">= shortGapMaxHours (" + shortGapMaxHours + ")");
        }
        if (validationSampleFraction <= 0.0 || validationSampleFraction > 1.0) {
            throw ValidationException.invalidParameter(
                    "validationSampleFraction", validationSampleFraction, "a value in (0, 1]");
        }
        requirePositive("patience", patience);
        requirePositive("lstmUnitsFirst", lstmUnitsFirst);
        requirePositive("lstmUnitsSecond", lstmUnitsSecond);
        if (dropoutRate < 0.0 || dropoutRate >= 1.0) {
            throw ValidationException.invalidParameter("dropoutRate", dropoutRate, "a value in [0, 1)");
        }
        requirePositive("maxEpochs", maxEpochs);
        requirePositive("batchSize", batchSize);
        if (learningRate <= 0.0) {
            throw ValidationException.invalidParameter("learningRate", learningRate, "a positive value");
        }
        requirePositive("minHistoryHours", minHistoryHours);
        if (trainSplit <= 0.0 || trainSplit >= 1.0) {
            throw ValidationException.invalidParameter("trainSplit", trainSplit, "a value in (0, 1)");
        }
        if (cacheTtl == null || cacheTtl.isNegative()) {
            throw ValidationException.invalidParameter("cacheTtl", cacheTtl, "a non-negative duration");
        }
        requirePositive("keepModelVersions", keepModelVersions);
        if (defaultParameter == null) {
            throw ValidationException.invalidParameter("defaultParameter", null, "a measured parameter");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw ValidationException.invalidParameter(name, value, "a positive integer");
        }
    }

    public static ImputationSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .contextWindowSize(contextWindowSize)
                .shortGapMaxHours(shortGapMaxHours)
                .mediumGapMaxHours(mediumGapMaxHours)
                .validationSampleFraction(validationSampleFraction)
                .minR2(minR2)
                .patience(patience)
                .lstmUnitsFirst(lstmUnitsFirst)
                .lstmUnitsSecond(lstmUnitsSecond)
                .dropoutRate(dropoutRate)
                .maxEpochs(maxEpochs)
                .batchSize(batchSize)
                .learningRate(learningRate)
                .minHistoryHours(minHistoryHours)
                .trainSplit(trainSplit)
                .trainingSeed(trainingSeed)
                .validationSeed(validationSeed)
                .cacheTtl(cacheTtl)
                .requireCertification(requireCertification)
                .rejectAnomalousContext(rejectAnomalousContext)
                .keepModelVersions(keepModelVersions)
                .defaultParameter(defaultParameter);
    }

    public static final class Builder {
        private int contextWindowSize = 24;
        private int shortGapMaxHours = 3;
        private int mediumGapMaxHours = 24;
        private double validationSampleFraction = 0.1;
        private double minR2 = 0.5;
        private int patience = 10;
        private int lstmUnitsFirst = 64;
        private int lstmUnitsSecond = 32;
        private double dropoutRate = 0.2;
        private int maxEpochs = 100;
        private int batchSize = 32;
        private double learningRate = 0.001;
        private int minHistoryHours = 168;
        private double trainSplit = 0.8;
        private long trainingSeed = 42L;
        private long validationSeed = 42L;
        private Duration cacheTtl = Duration.ofHours(1);
        private boolean requireCertification = false;
        private boolean rejectAnomalousContext = false;
        private int keepModelVersions = 5;
        private MeasuredParameter defaultParameter = MeasuredParameter.PM25;

        private Builder() {}

        public Builder contextWindowSize(int value) { this.contextWindowSize = value; return this; }

        public Builder shortGapMaxHours(int value) { this.shortGapMaxHours = value; return this; }

        public Builder mediumGapMaxHours(int value) { this.mediumGapMaxHours = value; return this; }

        public Builder validationSampleFraction(double value) { this.validationSampleFraction = value; return this; }

        public Builder minR2(double value) { this.minR2 = value; return this; }

        public Builder patience(int value) { this.patience = value; return this; }

        public Builder lstmUnitsFirst(int value) { this.lstmUnitsFirst = value; return this; }

        public Builder lstmUnitsSecond(int value) { this.lstmUnitsSecond = value; return this; }

        public Builder dropoutRate(double value) { this.dropoutRate = value; return this; }

        public Builder maxEpochs(int value) { this.maxEpochs = value; return this; }

        public Builder batchSize(int value) { this.batchSize = value; return this; }

        public Builder learningRate(double value) { this.learningRate = value; return this; }

        public Builder minHistoryHours(int value) { this.minHistoryHours = value; return this; }

        public Builder trainSplit(double value) { this.trainSplit = value; return this; }

        public Builder trainingSeed(long value) { this.trainingSeed = value; return this; }

        public Builder validationSeed(long value) { this.validationSeed = value; return this; }

        public Builder cacheTtl(Duration value) { this.cacheTtl = value; return this; }

        public Builder requireCertification(boolean value) { this.requireCertification = value; return this; }

        public Builder rejectAnomalousContext(boolean value) { this.rejectAnomalousContext = value; return this; }

        public Builder keepModelVersions(int value) { this.keepModelVersions = value; return this; }

        public Builder defaultParameter(MeasuredParameter value) { this.defaultParameter = value; return this; }

        public ImputationSettings build() {
            return new ImputationSettings(
                    contextWindowSize,
                    shortGapMaxHours,
                    mediumGapMaxHours,
                    validationSampleFraction,
                    minR2,
                    patience,
                    lstmUnitsFirst,
                    lstmUnitsSecond,
                    dropoutRate,
                    maxEpochs,
                    batchSize,
                    learningRate,
                    minHistoryHours,
                    trainSplit,
                    trainingSeed,
                    validationSeed,
                    cacheTtl,
                    requireCertification,
                    rejectAnomalousContext,
                    keepModelVersions,
                    defaultParameter);
        }
    }
}
