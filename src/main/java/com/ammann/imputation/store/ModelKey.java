/* (C)2026 */
package com.ammann.imputation.store;

import com.ammann.imputation.enumeration.MeasuredParameter;

/**
 * Identity of a model lineage: one station and one parameter.
 */
public record ModelKey(String stationId, MeasuredParameter parameter) {

    public String versionLabel(int version) {
        return stationId + "/" + parameter.getKey() + "/v" + version;
    }

    @Override
    public String toString() {
        return stationId + "/" + parameter.getKey();
    }
}
