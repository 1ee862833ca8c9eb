/* (C)2026 */
package com.ammann.imputation.exception;

/**
 * Transient failure of the reading, artifact or audit store.
 *
 * <p>Operations fail before producing partial output; callers retry the whole operation.
 */
public class StoreUnavailableException extends ImputationException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreUnavailableException(String message) {
        super(message);
    }

    /**
     * Wraps a persistence failure raised while running {@code operation} for a station.
     */
    public static StoreUnavailableException during(String operation, String stationId, Throwable cause) {
        return new StoreUnavailableException(
                String.format("Store unavailable during %s for station '%s': %s",
                        operation, stationId, cause.getMessage()),
                cause);
    }
}
