/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.ModelVersionDTO;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.store.ModelArtifactStore;
import com.ammann.imputation.store.ModelKey;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Housekeeping over stored model versions: listing, re-activating an older version after a
 * bad retraining, and pruning old inactive versions.
 */
@ApplicationScoped
public class ModelRegistryService {

    private static final Logger LOG = Logger.getLogger(ModelRegistryService.class);

    private final ModelArtifactStore artifactStore;
    private final ModelCache modelCache;
    private final ImputationSettings settings;

    @Inject
    public ModelRegistryService(ModelArtifactStore artifactStore, ModelCache modelCache, ImputationSettings settings) {
        this.artifactStore = artifactStore;
        this.modelCache = modelCache;
        this.settings = settings;
    }

    public List<ModelVersionDTO> listVersions(String stationId, MeasuredParameter parameter) {
        return artifactStore.listVersions(new ModelKey(stationId, parameter));
    }

    /**
     * Makes a retained version the active one. Cached snapshots of the key are dropped so the
     * next imputation loads it.
     *
     * @throws ValidationException if the version is not stored
     */
    public ModelVersionDTO activate(String stationId, MeasuredParameter parameter, int version) {
        ModelKey key = new ModelKey(stationId, parameter);
        if (!artifactStore.activate(key, version)) {
            throw ValidationException.invalidParameter("version", version, "a retained version of " + key);
        }
        modelCache.invalidate(key);
        LOG.infof("Activated %s", key.versionLabel(version));
        return artifactStore.findVersion(key, version)
                .orElseThrow(() -> ValidationException.invalidParameter("version", version, "a retained version of " + key))
                .toDTO();
    }

    public int prune(String stationId, MeasuredParameter parameter) {
        return prune(new ModelKey(stationId, parameter), settings.keepModelVersions());
    }

    private int prune(ModelKey key, int keep) {
        int deleted = artifactStore.prune(key, keep);
        if (deleted > 0) {
            LOG.infof("Pruned %d old versions of %s, keeping %d", deleted, key, keep);
        }
        return deleted;
    }

    /**
     * Prunes every stored key.
     *
     * @return total number of deleted versions
     */
    public int pruneAll() {
        int total = 0;
        for (ModelKey key : artifactStore.listKeys()) {
            total += prune(key, settings.keepModelVersions());
        }
        LOG.infof("Model prune finished: %d versions deleted", total);
        return total;
    }
}
