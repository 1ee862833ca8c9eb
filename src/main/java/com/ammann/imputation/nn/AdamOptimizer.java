/* (C)2026 */
package com.ammann.imputation.nn;

import java.util.ArrayList;
import java.util.List;

/**
 * Adam optimizer (beta1 0.9, beta2 0.999, epsilon 1e-7) updating parameter arrays in place.
 */
final class AdamOptimizer {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double EPSILON = 1e-7;

    private final double learningRate;
    private final List<double[]> firstMoments = new ArrayList<>();
    private final List<double[]> secondMoments = new ArrayList<>();
    private int step;

    AdamOptimizer(double learningRate, List<double[]> parameters) {
        this.learningRate = learningRate;
        for (double[] parameter : parameters) {
            firstMoments.add(new double[parameter.length]);
            secondMoments.add(new double[parameter.length]);
        }
    }

    void apply(List<double[]> parameters, List<double[]> gradients) {
        step++;
        double correction1 = 1.0 - Math.pow(BETA1, step);
        double correction2 = 1.0 - Math.pow(BETA2, step);
        for (int p = 0; p < parameters.size(); p++) {
            double[] param = parameters.get(p);
            double[] grad = gradients.get(p);
            double[] m = firstMoments.get(p);
            double[] v = secondMoments.get(p);
            for (int i = 0; i < param.length; i++) {
                m[i] = BETA1 * m[i] + (1.0 - BETA1) * grad[i];
                v[i] = BETA2 * v[i] + (1.0 - BETA2) * grad[i] * grad[i];
                double mHat = m[i] / correction1;
                double vHat = v[i] / correction2;
                param[i] -= learningRate * mHat / (Math.sqrt(vHat) + EPSILON);
            }
        }
    }

    int step() {
        return step;
    }
}
