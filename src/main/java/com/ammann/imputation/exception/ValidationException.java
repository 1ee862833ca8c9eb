/* (C)2026 */
package com.ammann.imputation.exception;

/**
 * Exception indicating that a caller-supplied argument does not meet the constraints of
 * the requested operation (unknown station, reversed time range, out-of-range setting).
 */
public class ValidationException extends ImputationException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a station that does not exist in the store.
     */
    public static ValidationException unknownStation(String stationId) {
        return new ValidationException(String.format("Unknown station '%s'", stationId));
    }
}
