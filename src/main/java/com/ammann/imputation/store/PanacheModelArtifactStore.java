/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.dto.ModelVersionDTO;
import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ImputationException;
import com.ammann.imputation.exception.StoreUnavailableException;
import com.ammann.imputation.model.StationModel;
import com.ammann.imputation.nn.MinMaxScaler;
import com.ammann.imputation.nn.NetworkState;
import com.ammann.imputation.nn.SequenceRegressor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.jboss.logging.Logger;

/**
 * {@link ModelArtifactStore} backed by the {@code model_artifacts} table, with network
 * weights serialised as JSON.
 */
@ApplicationScoped
public class PanacheModelArtifactStore implements ModelArtifactStore {

    private static final Logger LOG = Logger.getLogger(PanacheModelArtifactStore.class);

    private final ObjectMapper objectMapper;

    @Inject
    public PanacheModelArtifactStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ModelArtifact publish(ModelKey key,
                                 Instant trainedAt,
                                 int contextWindowSize,
                                 SequenceRegressor network,
                                 MinMaxScaler scaler,
                                 double trainRmse,
                                 double validationRmse)
    {
        String networkJson = serialize(network.toState());

        // Write the complete row first, then swap the active marker in a second transaction.
        Integer version = inTransaction("publish", key, () -> {
            StationModel row = new StationModel();
            row.stationId = key.stationId();
            row.parameter = key.parameter();
            row.version = StationModel.latestVersion(key.stationId(), key.parameter()) + 1;
            row.trainedAt = trainedAt;
            row.contextWindowSize = contextWindowSize;
            row.scalerMin = scaler.dataMin();
            row.scalerMax = scaler.dataMax();
            row.networkJson = networkJson;
            row.trainRmse = trainRmse;
            row.validationRmse = validationRmse;
            row.certification = CertificationStatus.PENDING;
            row.active = false;
            row.persist();
            return row.version;
        });

        activate(key, version);
        LOG.infof("Published model %s (trainRmse=%.4f, valRmse=%.4f)", key.versionLabel(version), trainRmse, validationRmse);
        return new ModelArtifact(key, version, trainedAt, contextWindowSize, network, scaler,
                trainRmse, validationRmse, CertificationStatus.PENDING, true);
    }

    @Override
    public Optional<ModelArtifact> findActive(ModelKey key) {
        return read("findActive", key, () -> Optional.ofNullable(StationModel.findActive(key.stationId(), key.parameter()))
                .map(this::toArtifact));
    }

    @Override
    public Optional<ModelArtifact> findVersion(ModelKey key, int version) {
        return read("findVersion", key, () -> Optional.ofNullable(StationModel.findVersion(key.stationId(), key.parameter(), version))
                .map(this::toArtifact));
    }

    @Override
    public List<ModelVersionDTO> listVersions(ModelKey key) {
        return read("listVersions", key, () -> StationModel.findVersions(key.stationId(), key.parameter()).stream()
                .map(row -> new ModelVersionDTO(row.stationId, row.parameter, row.version, row.trainedAt,
                        row.certification, row.active, row.trainRmse, row.validationRmse))
                .toList());
    }

    @Override
    public List<ModelKey> listKeys() {
        return read("listKeys", null, () -> StationModel.getEntityManager()
                .createQuery("SELECT DISTINCT m.stationId, m.parameter FROM StationModel m", Object[].class)
                .getResultList().stream()
                .map(row -> new ModelKey((String) row[0], (MeasuredParameter) row[1]))
                .toList());
    }

    @Override
    public boolean activate(ModelKey key, int version) {
        return inTransaction("activate", key, () -> {
            List<StationModel> versions = StationModel.findVersions(key.stationId(), key.parameter());
            if (versions.stream().noneMatch(row -> row.version == version)) {
                return false;
            }
            for (StationModel row : versions) {
                row.active = row.version == version;
            }
            return true;
        });
    }

    @Override
    public void updateCertification(ModelKey key, int version, CertificationStatus certification) {
        inTransaction("updateCertification", key, () -> {
            StationModel row = StationModel.findVersion(key.stationId(), key.parameter(), version);
            if (row != null) {
                row.certification = certification;
            }
            return null;
        });
    }

    @Override
    public int prune(ModelKey key, int keep) {
        return inTransaction("prune", key, () -> {
            List<StationModel> versions = StationModel.findVersions(key.stationId(), key.parameter());
            int deleted = 0;
            for (int i = keep; i < versions.size(); i++) {
                StationModel row = versions.get(i);
                if (!row.active) {
                    row.delete();
                    deleted++;
                }
            }
            return deleted;
        });
    }

    private ModelArtifact toArtifact(StationModel row) {
        NetworkState state = deserialize(row.networkJson);
        return new ModelArtifact(
                new ModelKey(row.stationId, row.parameter),
                row.version,
                row.trainedAt,
                row.contextWindowSize,
                SequenceRegressor.fromState(state),
                new MinMaxScaler(row.scalerMin, row.scalerMax),
                row.trainRmse == null ? Double.NaN : row.trainRmse,
                row.validationRmse == null ? Double.NaN : row.validationRmse,
                row.certification,
                row.active);
    }

    private String serialize(NetworkState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new ImputationException("Failed to serialise network weights", e);
        }
    }

    private NetworkState deserialize(String json) {
        try {
            return objectMapper.readValue(json, NetworkState.class);
        } catch (JsonProcessingException e) {
            throw new ImputationException("Stored network weights are not readable", e);
        }
    }

    private <T> T read(String operation, ModelKey key, Callable<T> query) {
        try {
            return QuarkusTransaction.joiningExisting().call(query);
        } catch (PersistenceException | QuarkusTransactionException e) {
            throw StoreUnavailableException.during(operation, key == null ? "*" : key.toString(), e);
        }
    }

    private <T> T inTransaction(String operation, ModelKey key, Callable<T> work) {
        try {
            return QuarkusTransaction.requiringNew().call(work);
        } catch (PersistenceException | QuarkusTransactionException e) {
            throw StoreUnavailableException.during(operation, key.toString(), e);
        }
    }
}
