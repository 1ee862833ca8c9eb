/* (C)2026 */
package com.ammann.imputation.nn;

import java.util.Arrays;
import java.util.Random;

/** Fully connected layer with a single linear output. */
final class DenseLayer {

    final double[] w;
    final double[] b;
    final double[] gradW;
    final double[] gradB;

    private DenseLayer(double[] w, double[] b) {
        this.w = w;
        this.b = b;
        this.gradW = new double[w.length];
        this.gradB = new double[1];
    }

    static DenseLayer initialize(int inputSize, Random random) {
        double[] w = new double[inputSize];
        Activations.glorotUniform(w, inputSize, 1, random);
        return new DenseLayer(w, new double[1]);
    }

    static DenseLayer of(double[] w, double bias) {
        return new DenseLayer(w.clone(), new double[] {bias});
    }

    double forward(double[] input) {
        double sum = b[0];
        for (int k = 0; k < w.length; k++) {
            sum += w[k] * input[k];
        }
        return sum;
    }

    double[] backward(double[] input, double dOut) {
        double[] dInput = new double[w.length];
        gradB[0] += dOut;
        for (int k = 0; k < w.length; k++) {
            gradW[k] += dOut * input[k];
            dInput[k] = w[k] * dOut;
        }
        return dInput;
    }

    void zeroGradients() {
        Arrays.fill(gradW, 0.0);
        gradB[0] = 0.0;
    }
}
