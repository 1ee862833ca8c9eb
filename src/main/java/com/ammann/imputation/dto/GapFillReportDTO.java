/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;
import java.util.List;

/**
 * Summary of filling every fillable gap of one station in a range.
 *
 * @param gapsFound gaps of any class in the range
 * @param longGaps LONG gaps that were flagged and left empty
 * @param imputedHours hours that now hold an imputed value
 * @param noContextHours hours skipped because no context window existed
 * @param modelUnavailableHours hours skipped because no usable model existed
 * @param longGapHours hours left empty because their gap is LONG
 */
public record GapFillReportDTO(
        String stationId,
        MeasuredParameter parameter,
        Instant start,
        Instant end,
        int gapsFound,
        List<GapDTO> longGaps,
        int imputedHours,
        int noContextHours,
        int modelUnavailableHours,
        long longGapHours) {

    public long skippedHours() {
        return noContextHours + modelUnavailableHours + longGapHours;
    }
}
