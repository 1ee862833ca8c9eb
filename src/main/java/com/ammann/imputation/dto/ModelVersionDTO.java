/* (C)2026 */
package com.ammann.imputation.dto;

import com.ammann.imputation.enumeration.CertificationStatus;
import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Instant;

/** Summary of one retained model artifact version. */
public record ModelVersionDTO(
        String stationId,
        MeasuredParameter parameter,
        int version,
        Instant trainedAt,
        CertificationStatus certification,
        boolean active,
        Double trainRmse,
        Double validationRmse) {
}
