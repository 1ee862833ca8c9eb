/* (C)2026 */
package com.ammann.imputation.nn;

import java.util.List;

/**
 * Loss curve of a fit. Losses are MSE on scaled values.
 *
 * @param trainLoss mean training loss per epoch
 * @param validationLoss validation loss per epoch
 * @param bestEpoch 1-based epoch whose weights were restored
 * @param stoppedEarly true when patience ran out before {@code maxEpochs}
 */
public record FitHistory(
        List<Double> trainLoss, List<Double> validationLoss, int bestEpoch, boolean stoppedEarly) {

    public int epochsCompleted() {
        return trainLoss.size();
    }

    public double bestValidationLoss() {
        return validationLoss.get(bestEpoch - 1);
    }
}
