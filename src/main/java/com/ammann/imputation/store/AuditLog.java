/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.dto.ImputationEntry;
import com.ammann.imputation.dto.TrainingResultDTO;
import com.ammann.imputation.dto.ValidationResultDTO;
import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only audit trail of training, imputation and validation events.
 *
 * <p>Entries are never deleted. The only mutation is superseding an ACTIVE imputation entry.
 */
public interface AuditLog {

    void appendTraining(TrainingResultDTO result);

    void appendValidation(ValidationResultDTO result);

    void appendImputation(ImputationEntry entry);

    Optional<ImputationEntry> findActiveImputation(String stationId, MeasuredParameter parameter, Instant timestamp);

    /**
     * Marks the ACTIVE entry of a target as SUPERSEDED.
     *
     * @return the superseded entry, empty if there was no active entry
     */
    Optional<ImputationEntry> supersedeImputation(String stationId,
                                                  MeasuredParameter parameter,
                                                  Instant timestamp,
                                                  String reason,
                                                  Instant supersededAt);

    /** Every entry ever written for a target, oldest first. */
    List<ImputationEntry> imputationHistory(String stationId, MeasuredParameter parameter, Instant timestamp);

    /** ACTIVE entries in the inclusive range, oldest first. */
    List<ImputationEntry> activeImputations(String stationId, MeasuredParameter parameter, Instant start, Instant end);

    /** Entries superseded with the given reason, oldest first. */
    List<ImputationEntry> supersededImputations(String stationId, MeasuredParameter parameter, String reason);

    List<TrainingResultDTO> trainingHistory(ModelKey key);

    List<ValidationResultDTO> validationHistory(ModelKey key);
}
