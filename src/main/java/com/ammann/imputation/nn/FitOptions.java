/* (C)2026 */
package com.ammann.imputation.nn;

/**
 * Options for {@link SequenceRegressor#fit}.
 *
 * @param maxEpochs upper bound on passes over the training windows
 * @param batchSize mini-batch size
 * @param learningRate Adam learning rate
 * @param patience epochs without validation improvement before stopping
 * @param seed seed for batch shuffling and dropout masks
 */
public record FitOptions(int maxEpochs, int batchSize, double learningRate, int patience, long seed) {}
