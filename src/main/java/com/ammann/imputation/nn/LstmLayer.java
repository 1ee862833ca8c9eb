/* (C)2026 */
package com.ammann.imputation.nn;

import java.util.Arrays;
import java.util.Random;

/**
 * Single LSTM layer with full backpropagation through time.
 *
 * <p>Gate rows are laid out as input, forget, cell candidate, output (4 blocks of
 * {@code hiddenSize}). Weights are stored row-major: {@code w} is {@code 4H x inputSize},
 * {@code u} is {@code 4H x H}. The forget gate bias starts at 1.
 *
 * <p>Forward passes keep no state on the layer, so inference is safe from several threads.
 * Gradients accumulate on the layer and are only touched while training.
 */
final class LstmLayer {

    final int inputSize;
    final int hiddenSize;
    final double[] w;
    final double[] u;
    final double[] b;
    final double[] gradW;
    final double[] gradU;
    final double[] gradB;

    private LstmLayer(int inputSize, int hiddenSize, double[] w, double[] u, double[] b) {
        this.inputSize = inputSize;
        this.hiddenSize = hiddenSize;
        this.w = w;
        this.u = u;
        this.b = b;
        this.gradW = new double[w.length];
        this.gradU = new double[u.length];
        this.gradB = new double[b.length];
    }

    static LstmLayer initialize(int inputSize, int hiddenSize, Random random) {
        int rows = 4 * hiddenSize;
        double[] w = new double[rows * inputSize];
        double[] u = new double[rows * hiddenSize];
        double[] b = new double[rows];
        Activations.glorotUniform(w, inputSize, rows, random);
        Activations.glorotUniform(u, hiddenSize, rows, random);
        for (int j = 0; j < hiddenSize; j++) {
            b[hiddenSize + j] = 1.0;
        }
        return new LstmLayer(inputSize, hiddenSize, w, u, b);
    }

    static LstmLayer of(int inputSize, int hiddenSize, double[] w, double[] u, double[] b) {
        int rows = 4 * hiddenSize;
        if (w.length != rows * inputSize || u.length != rows * hiddenSize || b.length != rows) {
            throw new IllegalArgumentException("LSTM weight shapes do not match " + inputSize + "x" + hiddenSize);
        }
        return new LstmLayer(inputSize, hiddenSize, w.clone(), u.clone(), b.clone());
    }

    Trace forward(double[][] xs) {
        int steps = xs.length;
        int h = hiddenSize;
        Trace trace = new Trace(steps);
        double[] hPrev = new double[h];
        double[] cPrev = new double[h];

        for (int t = 0; t < steps; t++) {
            double[] x = xs[t];
            double[] z = new double[4 * h];
            for (int r = 0; r < 4 * h; r++) {
                double sum = b[r];
                int offW = r * inputSize;
                for (int k = 0; k < inputSize; k++) {
                    sum += w[offW + k] * x[k];
                }
                int offU = r * h;
                for (int k = 0; k < h; k++) {
                    sum += u[offU + k] * hPrev[k];
                }
                z[r] = sum;
            }

            double[] in = new double[h];
            double[] forget = new double[h];
            double[] cand = new double[h];
            double[] out = new double[h];
            double[] c = new double[h];
            double[] tanhC = new double[h];
            double[] hidden = new double[h];
            for (int j = 0; j < h; j++) {
                in[j] = Activations.sigmoid(z[j]);
                forget[j] = Activations.sigmoid(z[h + j]);
                cand[j] = Activations.tanh(z[2 * h + j]);
                out[j] = Activations.sigmoid(z[3 * h + j]);
                c[j] = forget[j] * cPrev[j] + in[j] * cand[j];
                tanhC[j] = Activations.tanh(c[j]);
                hidden[j] = out[j] * tanhC[j];
            }

            trace.x[t] = x;
            trace.hPrev[t] = hPrev;
            trace.cPrev[t] = cPrev;
            trace.in[t] = in;
            trace.forget[t] = forget;
            trace.cand[t] = cand;
            trace.out[t] = out;
            trace.tanhC[t] = tanhC;
            trace.hidden[t] = hidden;

            hPrev = hidden;
            cPrev = c;
        }
        return trace;
    }

    /**
     * Backpropagates through time and accumulates weight gradients.
     *
     * @param trace forward trace of the same sequence
     * @param dHidden loss gradient per step w.r.t. the layer output; null entries mean zero
     * @return gradient w.r.t. the layer input at every step
     */
    double[][] backward(Trace trace, double[][] dHidden) {
        int steps = trace.x.length;
        int h = hiddenSize;
        double[][] dInputs = new double[steps][inputSize];
        double[] dhNext = new double[h];
        double[] dcNext = new double[h];

        for (int t = steps - 1; t >= 0; t--) {
            double[] dz = new double[4 * h];
            double[] dcPrev = new double[h];
            double[] upstream = dHidden[t];
            for (int j = 0; j < h; j++) {
                double dh = dhNext[j] + (upstream != null ? upstream[j] : 0.0);
                double i = trace.in[t][j];
                double f = trace.forget[t][j];
                double g = trace.cand[t][j];
                double o = trace.out[t][j];
                double tc = trace.tanhC[t][j];

                double dc = dh * o * (1.0 - tc * tc) + dcNext[j];
                dz[j] = dc * g * i * (1.0 - i);
                dz[h + j] = dc * trace.cPrev[t][j] * f * (1.0 - f);
                dz[2 * h + j] = dc * i * (1.0 - g * g);
                dz[3 * h + j] = dh * tc * o * (1.0 - o);
                dcPrev[j] = dc * f;
            }

            double[] x = trace.x[t];
            double[] hPrev = trace.hPrev[t];
            double[] dx = dInputs[t];
            double[] dhPrev = new double[h];
            for (int r = 0; r < 4 * h; r++) {
                double d = dz[r];
                if (d == 0.0) {
                    continue;
                }
                gradB[r] += d;
                int offW = r * inputSize;
                for (int k = 0; k < inputSize; k++) {
                    gradW[offW + k] += d * x[k];
                    dx[k] += w[offW + k] * d;
                }
                int offU = r * h;
                for (int k = 0; k < h; k++) {
                    gradU[offU + k] += d * hPrev[k];
                    dhPrev[k] += u[offU + k] * d;
                }
            }
            dhNext = dhPrev;
            dcNext = dcPrev;
        }
        return dInputs;
    }

    void zeroGradients() {
        Arrays.fill(gradW, 0.0);
        Arrays.fill(gradU, 0.0);
        Arrays.fill(gradB, 0.0);
    }

    /** Per-step activations of one forward pass. */
    static final class Trace {
        final double[][] x;
        final double[][] hPrev;
        final double[][] cPrev;
        final double[][] in;
        final double[][] forget;
        final double[][] cand;
        final double[][] out;
        final double[][] tanhC;
        final double[][] hidden;

        Trace(int steps) {
            x = new double[steps][];
            hPrev = new double[steps][];
            cPrev = new double[steps][];
            in = new double[steps][];
            forget = new double[steps][];
            cand = new double[steps][];
            out = new double[steps][];
            tanhC = new double[steps][];
            hidden = new double[steps][];
        }

        double[] last() {
            return hidden[hidden.length - 1];
        }
    }
}
