/* (C)2026 */
package com.ammann.imputation.nn;

import com.ammann.imputation.exception.TrainingFailedException;
import com.ammann.imputation.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.jboss.logging.Logger;

/**
 * Two stacked LSTM layers with dropout after each, followed by a single linear output.
 *
 * <p>The first layer returns its full output sequence, the second only its last step.
 * Inputs are univariate windows of scaled values; the output is the scaled next value.
 * Inference ({@link #predict}) keeps no mutable state and may be called concurrently once
 * training has finished.
 */
public final class SequenceRegressor {

    private static final Logger LOG = Logger.getLogger(SequenceRegressor.class);

    /** Global L2 norm gradients are clipped to before each update. */
    private static final double MAX_GRADIENT_NORM = 5.0;

    private final LstmLayer first;
    private final LstmLayer second;
    private final DenseLayer output;
    private final double dropoutRate;

    private SequenceRegressor(LstmLayer first, LstmLayer second, DenseLayer output, double dropoutRate) {
        this.first = first;
        this.second = second;
        this.output = output;
        this.dropoutRate = dropoutRate;
    }

    /**
     * Creates a freshly initialised network (Glorot uniform weights, forget bias 1).
     */
    public static SequenceRegressor initialize(int unitsFirst, int unitsSecond, double dropoutRate, long seed) {
        Random random = new Random(seed);
        return new SequenceRegressor(
                LstmLayer.initialize(1, unitsFirst, random),
                LstmLayer.initialize(unitsFirst, unitsSecond, random),
                DenseLayer.initialize(unitsSecond, random),
                dropoutRate);
    }

    public static SequenceRegressor fromState(NetworkState state) {
        return new SequenceRegressor(
                LstmLayer.of(1, state.unitsFirst(), state.firstW(), state.firstU(), state.firstB()),
                LstmLayer.of(state.unitsFirst(), state.unitsSecond(), state.secondW(), state.secondU(), state.secondB()),
                DenseLayer.of(state.denseW(), state.denseB()),
                state.dropoutRate());
    }

    public NetworkState toState() {
        return new NetworkState(
                first.hiddenSize,
                second.hiddenSize,
                dropoutRate,
                first.w.clone(),
                first.u.clone(),
                first.b.clone(),
                second.w.clone(),
                second.u.clone(),
                second.b.clone(),
                output.w.clone(),
                output.b[0]);
    }

    /**
     * Predicts the next scaled value after {@code window}.
     */
    public double predict(double[] window) {
        LstmLayer.Trace firstTrace = first.forward(asSequence(window));
        LstmLayer.Trace secondTrace = second.forward(firstTrace.hidden);
        return output.forward(secondTrace.last());
    }

    /**
     * Mean squared error over the given windows without dropout.
     */
    public double evaluate(List<double[]> inputs, double[] targets) {
        double sum = 0.0;
        for (int i = 0; i < inputs.size(); i++) {
            double error = predict(inputs.get(i)) - targets[i];
            sum += error * error;
        }
        return inputs.isEmpty() ? 0.0 : sum / inputs.size();
    }

    /**
     * Trains with Adam on mini-batches, early stopping on validation loss and restoring
     * the best weights seen.
     *
     * @throws TrainingFailedException if a loss or weight becomes non-finite
     */
    public FitHistory fit(List<double[]> trainInputs,
                          double[] trainTargets,
                          List<double[]> validationInputs,
                          double[] validationTargets,
                          FitOptions options)
    {
        if (trainInputs.isEmpty() || validationInputs.isEmpty()) {
            throw ValidationException.insufficientData("training windows", 2, trainInputs.size() + validationInputs.size());
        }

        double meanTarget = 0.0;
        for (double target : trainTargets) {
            meanTarget += target;
        }
        output.b[0] = meanTarget / trainTargets.length;

        Random shuffleRandom = new Random(options.seed());
        Random dropoutRandom = new Random(options.seed() * 31 + 7);
        AdamOptimizer optimizer = new AdamOptimizer(options.learningRate(), parameters());

        List<Double> trainLosses = new ArrayList<>();
        List<Double> validationLosses = new ArrayList<>();
        NetworkState best = toState();
        double bestLoss = Double.POSITIVE_INFINITY;
        int bestEpoch = 0;
        int wait = 0;
        boolean stoppedEarly = false;

        int[] order = new int[trainInputs.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }

        for (int epoch = 1; epoch <= options.maxEpochs(); epoch++) {
            shuffle(order, shuffleRandom);
            double epochLoss = 0.0;
            for (int start = 0; start < order.length; start += options.batchSize()) {
                int end = Math.min(order.length, start + options.batchSize());
                double batchLoss = trainBatch(trainInputs, trainTargets, order, start, end, dropoutRandom);
                if (!Double.isFinite(batchLoss)) {
                    throw TrainingFailedException.diverged(epoch, batchLoss);
                }
                clipGradients();
                optimizer.apply(parameters(), gradients());
                epochLoss += batchLoss * (end - start);
            }
            epochLoss /= order.length;

            double validationLoss = evaluate(validationInputs, validationTargets);
            if (!Double.isFinite(validationLoss)) {
                throw TrainingFailedException.diverged(epoch, validationLoss);
            }
            trainLosses.add(epochLoss);
            validationLosses.add(validationLoss);
            LOG.debugf("Epoch %d: loss=%.6f val_loss=%.6f", Integer.valueOf(epoch), Double.valueOf(epochLoss), Double.valueOf(validationLoss));

            if (validationLoss < bestLoss) {
                bestLoss = validationLoss;
                bestEpoch = epoch;
                best = toState();
                wait = 0;
            } else if (++wait >= options.patience()) {
                stoppedEarly = true;
                LOG.debugf("Early stopping after epoch %d, restoring epoch %d", epoch, bestEpoch);
                break;
            }
        }

        restore(best);
        return new FitHistory(List.copyOf(trainLosses), List.copyOf(validationLosses), bestEpoch, stoppedEarly);
    }

    private double trainBatch(List<double[]> inputs,
                              double[] targets,
                              int[] order,
                              int start,
                              int end,
                              Random dropoutRandom)
    {
        zeroGradients();
        int batch = end - start;
        double loss = 0.0;

        for (int n = start; n < end; n++) {
            int index = order[n];
            double[][] sequence = asSequence(inputs.get(index));

            LstmLayer.Trace firstTrace = first.forward(sequence);
            double[][] firstMask = new double[sequence.length][];
            double[][] dropped = new double[sequence.length][];
            for (int t = 0; t < sequence.length; t++) {
                firstMask[t] = dropoutMask(first.hiddenSize, dropoutRandom);
                dropped[t] = multiply(firstTrace.hidden[t], firstMask[t]);
            }

            LstmLayer.Trace secondTrace = second.forward(dropped);
            double[] secondMask = dropoutMask(second.hiddenSize, dropoutRandom);
            double[] last = multiply(secondTrace.last(), secondMask);
            double prediction = output.forward(last);

            double error = prediction - targets[index];
            loss += error * error;

            double[] dLast = multiply(output.backward(last, 2.0 * error / batch), secondMask);
            double[][] dSecond = new double[sequence.length][];
            dSecond[sequence.length - 1] = dLast;
            double[][] dDropped = second.backward(secondTrace, dSecond);
            for (int t = 0; t < sequence.length; t++) {
                dDropped[t] = multiply(dDropped[t], firstMask[t]);
            }
            first.backward(firstTrace, dDropped);
        }
        return loss / batch;
    }

    private double[] dropoutMask(int size, Random random) {
        double[] mask = new double[size];
        double keep = 1.0 - dropoutRate;
        for (int i = 0; i < size; i++) {
            mask[i] = dropoutRate == 0.0 || random.nextDouble() >= dropoutRate ? 1.0 / keep : 0.0;
        }
        return mask;
    }

    private void clipGradients() {
        double squared = 0.0;
        for (double[] gradient : gradients()) {
            for (double g : gradient) {
                squared += g * g;
            }
        }
        double norm = Math.sqrt(squared);
        if (norm > MAX_GRADIENT_NORM) {
            double factor = MAX_GRADIENT_NORM / norm;
            for (double[] gradient : gradients()) {
                for (int i = 0; i < gradient.length; i++) {
                    gradient[i] *= factor;
                }
            }
        }
    }

    private void restore(NetworkState state) {
        System.arraycopy(state.firstW(), 0, first.w, 0, first.w.length);
        System.arraycopy(state.firstU(), 0, first.u, 0, first.u.length);
        System.arraycopy(state.firstB(), 0, first.b, 0, first.b.length);
        System.arraycopy(state.secondW(), 0, second.w, 0, second.w.length);
        System.arraycopy(state.secondU(), 0, second.u, 0, second.u.length);
        System.arraycopy(state.secondB(), 0, second.b, 0, second.b.length);
        System.arraycopy(state.denseW(), 0, output.w, 0, output.w.length);
        output.b[0] = state.denseB();
    }

    private void zeroGradients() {
        first.zeroGradients();
        second.zeroGradients();
        output.zeroGradients();
    }

    private List<double[]> parameters() {
        return List.of(first.w, first.u, first.b, second.w, second.u, second.b, output.w, output.b);
    }

    private List<double[]> gradients() {
        return List.of(first.gradW, first.gradU, first.gradB,
                second.gradW, second.gradU, second.gradB,
                output.gradW, output.gradB);
    }

    private static double[][] asSequence(double[] window) {
        double[][] sequence = new double[window.length][1];
        for (int t = 0; t < window.length; t++) {
            sequence[t][0] = window[t];
        }
        return sequence;
    }

    private static double[] multiply(double[] values, double[] mask) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] * mask[i];
        }
        return result;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    public int unitsFirst() {
        return first.hiddenSize;
    }

    public int unitsSecond() {
        return second.hiddenSize;
    }
}
