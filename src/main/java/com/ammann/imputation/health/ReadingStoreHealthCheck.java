/* (C)2026 */
package com.ammann.imputation.health;

import com.ammann.imputation.store.ModelArtifactStore;
import com.ammann.imputation.store.ReadingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness health check that verifies the reading and model stores answer queries quickly.
 *
 * <p>Reports DOWN if listing stations and model keys takes longer than 1 second or throws.
 */
@Readiness
@ApplicationScoped
public class ReadingStoreHealthCheck implements HealthCheck {

    static final String NAME = "reading-store-health";
    private static final long MAX_QUERY_MILLIS = 1000;

    private final ReadingStore readingStore;
    private final ModelArtifactStore artifactStore;

    @Inject
    public ReadingStoreHealthCheck(ReadingStore readingStore, ModelArtifactStore artifactStore) {
        this.readingStore = readingStore;
        this.artifactStore = artifactStore;
    }

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            int stations = readingStore.listStations().size();
            int models = artifactStore.listKeys().size();

            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < MAX_QUERY_MILLIS;

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("stations", stations)
                    .withData("trained-models", models)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("store-accessible", false)
                    .build();
        }
    }
}
