/* (C)2026 */
package com.ammann.imputation.dto;

import java.util.List;

/**
 * Aggregate outcome of running one operation over many stations.
 *
 * @param operation operation name (train, validate, fill-gaps)
 * @param succeeded stations whose operation produced its intended result
 * @param skipped stations that ended in an expected non-fatal outcome
 * @param failed stations whose task threw
 * @param cancelled stations never started because the sweep was cancelled
 * @param failedStations ids of the failed stations
 */
public record SweepSummaryDTO(
        String operation,
        int total,
        int succeeded,
        int skipped,
        int failed,
        int cancelled,
        long durationMs,
        List<String> failedStations) {
}
