/* (C)2026 */
package com.ammann.imputation.exception;

/**
 * Numerical failure while fitting a model (non-finite loss or weights).
 *
 * <p>Caught by the trainer and converted into a FAILED training result; the previously
 * active model version stays in place.
 */
public class TrainingFailedException extends ImputationException {

    public TrainingFailedException(String message) {
        super(message);
    }

    public TrainingFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TrainingFailedException diverged(int epoch, double loss) {
        return new TrainingFailedException(
                String.format("Training diverged at epoch %d (loss=%s)", epoch, loss));
    }
}
