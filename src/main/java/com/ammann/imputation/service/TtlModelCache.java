/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.store.ModelArtifact;
import com.ammann.imputation.store.ModelKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * {@link ModelCache} on a Caffeine cache whose entries expire a fixed time after loading.
 *
 * <p>A miss loads through {@code Cache.get}, so concurrent callers for one key share a single
 * load. {@link #invalidate} waits for a running load of that key and then removes its result.
 */
@ApplicationScoped
public class TtlModelCache implements ModelCache {

    private static final Logger LOG = Logger.getLogger(TtlModelCache.class);

    private final Cache<ModelKey, ModelArtifact> entries;

    @Inject
    public TtlModelCache(ImputationSettings settings, Clock clock) {
        this(settings.cacheTtl(), clock);
    }

    public TtlModelCache(Duration ttl, Clock clock) {
        this(ttl, clockTicker(clock));
    }

    public TtlModelCache(Duration ttl, Ticker ticker) {
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /** Nanoseconds elapsed on {@code clock} since the cache was built. */
    private static Ticker clockTicker(Clock clock) {
        Instant origin = clock.instant();
        return () -> Duration.between(origin, clock.instant()).toNanos();
    }

    @Override
    public Optional<ModelArtifact> getOrLoad(ModelKey key, Function<ModelKey, Optional<ModelArtifact>> loader) {
        return Optional.ofNullable(entries.get(key, missing -> {
            ModelArtifact loaded = loader.apply(missing).orElse(null);
            if (loaded != null) {
                LOG.debugf("Cached model %s", loaded.versionLabel());
            }
            return loaded;
        }));
    }

    @Override
    public void invalidate(ModelKey key) {
        entries.invalidate(key);
        LOG.debugf("Invalidated cached model for %s", key);
    }

    @Override
    public void invalidateAll() {
        entries.invalidateAll();
    }

    @Override
    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }
}
