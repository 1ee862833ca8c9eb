/* (C)2026 */
package com.ammann.imputation.support;

import com.ammann.imputation.dto.ModelVersionDTO;
import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.nn.MinMaxScaler;
import com.ammann.imputation.nn.SequenceRegressor;
import com.ammann.imputation.store.ModelArtifact;
import com.ammann.imputation.store.ModelArtifactStore;
import com.ammann.imputation.store.ModelKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link ModelArtifactStore} keeping artifacts in memory. Networks are shared, not copied.
 */
public class InMemoryModelArtifactStore implements ModelArtifactStore {

    private final Map<ModelKey, TreeMap<Integer, ModelArtifact>> versions = new HashMap<>();
    private int loads;

    @Override
    public synchronized ModelArtifact publish(ModelKey key,
                                              Instant trainedAt,
                                              int contextWindowSize,
                                              SequenceRegressor network,
                                              MinMaxScaler scaler,
                                              double trainRmse,
                                              double validationRmse)
    {
        TreeMap<Integer, ModelArtifact> stored = versions.computeIfAbsent(key, k -> new TreeMap<>());
        int version = stored.isEmpty() ? 1 : stored.lastKey() + 1;
        stored.replaceAll((v, artifact) -> withActive(artifact, false));
        ModelArtifact artifact = new ModelArtifact(key, version, trainedAt, contextWindowSize, network, scaler,
                trainRmse, validationRmse, CertificationStatus.PENDING, true);
        stored.put(version, artifact);
        return artifact;
    }

    @Override
    public synchronized Optional<ModelArtifact> findActive(ModelKey key) {
        loads++;
        return versions.getOrDefault(key, new TreeMap<>()).values().stream()
                .filter(ModelArtifact::active)
                .findFirst();
    }

    @Override
    public synchronized Optional<ModelArtifact> findVersion(ModelKey key, int version) {
        return Optional.ofNullable(versions.getOrDefault(key, new TreeMap<>()).get(version));
    }

    @Override
    public synchronized List<ModelVersionDTO> listVersions(ModelKey key) {
        return versions.getOrDefault(key, new TreeMap<>()).descendingMap().values().stream()
                .map(ModelArtifact::toDTO)
                .toList();
    }

    @Override
    public synchronized List<ModelKey> listKeys() {
        List<ModelKey> keys = new ArrayList<>(versions.keySet());
        keys.sort(Comparator.comparing(ModelKey::toString));
        return keys;
    }

    @Override
    public synchronized boolean activate(ModelKey key, int version) {
        TreeMap<Integer, ModelArtifact> stored = versions.get(key);
        if (stored == null || !stored.containsKey(version)) {
            return false;
        }
        stored.replaceAll((v, artifact) -> withActive(artifact, v == version));
        return true;
    }

    @Override
    public synchronized void updateCertification(ModelKey key, int version, CertificationStatus certification) {
        TreeMap<Integer, ModelArtifact> stored = versions.get(key);
        if (stored != null) {
            stored.computeIfPresent(version, (v, a) -> new ModelArtifact(a.key(), a.version(), a.trainedAt(),
                    a.contextWindowSize(), a.network(), a.scaler(), a.trainRmse(), a.validationRmse(),
                    certification, a.active()));
        }
    }

    @Override
    public synchronized int prune(ModelKey key, int keep) {
        TreeMap<Integer, ModelArtifact> stored = versions.get(key);
        if (stored == null) {
            return 0;
        }
        List<Integer> newestFirst = new ArrayList<>(stored.descendingKeySet());
        int deleted = 0;
        for (int i = keep; i < newestFirst.size(); i++) {
            if (!stored.get(newestFirst.get(i)).active()) {
                stored.remove(newestFirst.get(i));
                deleted++;
            }
        }
        return deleted;
    }

    /** Number of {@link #findActive} calls, used to observe cache hits. */
    public synchronized int activeLoads() {
        return loads;
    }

    private static ModelArtifact withActive(ModelArtifact a, boolean active) {
        return new ModelArtifact(a.key(), a.version(), a.trainedAt(), a.contextWindowSize(), a.network(),
                a.scaler(), a.trainRmse(), a.validationRmse(), a.certification(), active);
    }
}
