/* (C)2026 */
package com.ammann.imputation.config;

import com.ammann.imputation.enumeration.MeasuredParameter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer turning {@code imputation.*} configuration into an {@link ImputationSettings}
 * record and exposing the UTC clock used for cache expiry and audit timestamps.
 */
@ApplicationScoped
public class SettingsProducer {

    private static final Logger LOG = Logger.getLogger(SettingsProducer.class);

    @ConfigProperty(name = "imputation.context-window-size", defaultValue = "24")
    int contextWindowSize;

    @ConfigProperty(name = "imputation.gap.short-max-hours", defaultValue = "3")
    int shortGapMaxHours;

    @ConfigProperty(name = "imputation.gap.medium-max-hours", defaultValue = "24")
    int mediumGapMaxHours;

    @ConfigProperty(name = "imputation.validation.sample-fraction", defaultValue = "0.1")
    double validationSampleFraction;

    @ConfigProperty(name = "imputation.validation.min-r2", defaultValue = "0.5")
    double minR2;

    @ConfigProperty(name = "imputation.validation.seed", defaultValue = "42")
    long validationSeed;

    @ConfigProperty(name = "imputation.training.patience", defaultValue = "10")
    int patience;

    @ConfigProperty(name = "imputation.training.lstm-units-first", defaultValue = "64")
    int lstmUnitsFirst;

    @ConfigProperty(name = "imputation.training.lstm-units-second", defaultValue = "32")
    int lstmUnitsSecond;

    @ConfigProperty(name = "imputation.training.dropout", defaultValue = "0.2")
    double dropoutRate;

    @ConfigProperty(name = "imputation.training.max-epochs", defaultValue = "100")
    int maxEpochs;

    @ConfigProperty(name = "imputation.training.batch-size", defaultValue = "32")
    int batchSize;

    @ConfigProperty(name = "imputation.training.learning-rate", defaultValue = "0.001")
    double learningRate;

    @ConfigProperty(name = "imputation.training.min-history-hours", defaultValue = "168")
    int minHistoryHours;

    @ConfigProperty(name = "imputation.training.train-split", defaultValue = "0.8")
    double trainSplit;

    @ConfigProperty(name = "imputation.training.seed", defaultValue = "42")
    long trainingSeed;

    @ConfigProperty(name = "imputation.model-cache.ttl", defaultValue = "PT1H")
    Duration cacheTtl;

    @ConfigProperty(name = "imputation.require-certification", defaultValue = "false")
    boolean requireCertification;

    @ConfigProperty(name = "imputation.context.reject-anomalies", defaultValue = "false")
    boolean rejectAnomalousContext;

    @ConfigProperty(name = "imputation.models.keep-versions", defaultValue = "5")
    int keepModelVersions;

    @ConfigProperty(name = "imputation.default-parameter", defaultValue = "PM25")
    String defaultParameter;

    @Produces
    @Singleton
    public ImputationSettings imputationSettings() {
        ImputationSettings settings = ImputationSettings.builder()
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
                .defaultParameter(MeasuredParameter.fromName(defaultParameter))
                .build();

        LOG.infof("Imputation settings: window=%d, gaps short<=%dh medium<=%dh, sample=%.2f, minR2=%.2f, "
                        + "units=%d/%d, epochs=%d, patience=%d, requireCertification=%b",
                settings.contextWindowSize(), settings.shortGapMaxHours(), settings.mediumGapMaxHours(),
                settings.validationSampleFraction(), settings.minR2(), settings.lstmUnitsFirst(),
                settings.lstmUnitsSecond(), settings.maxEpochs(), settings.patience(),
                settings.requireCertification());
        return settings;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
