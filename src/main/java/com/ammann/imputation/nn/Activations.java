/* (C)2026 */
package com.ammann.imputation.nn;

final class Activations {

    private Activations() {}

    static double sigmoid(double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
        double e = Math.exp(x);
        return e / (1.0 + e);
    }

    static double tanh(double x) {
        return Math.tanh(x);
    }

    /**
     * Glorot uniform initialisation into {@code target}.
     */
    static void glorotUniform(double[] target, int fanIn, int fanOut, java.util.Random random) {
        double limit = Math.sqrt(6.0 / (fanIn + fanOut));
        for (int i = 0; i < target.length; i++) {
            target[i] = (random.nextDouble() * 2.0 - 1.0) * limit;
        }
    }
}
