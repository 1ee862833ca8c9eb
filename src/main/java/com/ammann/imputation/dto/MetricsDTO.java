/* (C)2026 */
package com.ammann.imputation.dto;

/**
 * Accuracy metrics of a set of estimates against true values, in the parameter's unit.
 *
 * @param samples number of compared points
 * @param rmse root mean squared error
 * @param mae mean absolute error
 * @param r2 coefficient of determination
 */
public record MetricsDTO(int samples, double rmse, double mae, double r2) {

    /**
     * Computes RMSE, MAE and R².
     *
     * <p>R² is 1 for a perfect fit and 0 otherwise when the true values have zero variance.
     */
    public static MetricsDTO compute(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("actual and predicted differ in length: "
                    + actual.length + " vs " + predicted.length);
        }
        int n = actual.length;
        if (n == 0) {
            return new MetricsDTO(0, Double.NaN, Double.NaN, Double.NaN);
        }
        double mean = 0.0;
        for (double value : actual) {
            mean += value;
        }
        mean /= n;

        double squared = 0.0;
        double absolute = 0.0;
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            double error = actual[i] - predicted[i];
            squared += error * error;
            absolute += Math.abs(error);
            total += (actual[i] - mean) * (actual[i] - mean);
        }

        double r2;
        if (total == 0.0) {
            r2 = squared == 0.0 ? 1.0 : 0.0;
        } else {
            r2 = 1.0 - squared / total;
        }
        return new MetricsDTO(n, Math.sqrt(squared / n), absolute / n, r2);
    }
}
