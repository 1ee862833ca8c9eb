/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.store.ModelArtifact;
import com.ammann.imputation.store.ModelKey;
import java.util.Optional;
import java.util.function.Function;

/**
 * Shared read-mostly cache of active model artifacts.
 *
 * <p>Implementations must be safe for concurrent use. Concurrent misses for one key share a
 * single load, and an invalidation issued while that load runs discards its result.
 */
public interface ModelCache {

    /**
     * Returns the cached artifact, loading it when absent or expired. Empty loader results
     * are not cached.
     */
    Optional<ModelArtifact> getOrLoad(ModelKey key, Function<ModelKey, Optional<ModelArtifact>> loader);

    void invalidate(ModelKey key);

    void invalidateAll();

    int size();
}
