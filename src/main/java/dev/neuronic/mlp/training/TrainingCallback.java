package dev.neuronic.mlp.training;

import dev.neuronic.mlp.NeuralNetwork;

/**
 * Interface for training callbacks that can monitor the training process.
 *
 * Callbacks provide hooks at various points during a trainer call:
 * - Training start/end
 * - After every training step
 * - After every full sweep over the stored examples (retrain only)
 *
 * Use cases:
 * - Progress monitoring and logging
 * - Collecting error curves in tests
 * - Adjusting the learning rate between sweeps
 */
public interface TrainingCallback {

    /**
     * Called before the first training step.
     *
     * @param network the network being trained
     * @param maxIterations iteration budget of this call
     */
    default void onTrainingStart(NeuralNetwork network, int maxIterations) {}

    /**
     * Called after each training step.
     *
     * @param iteration number of steps performed so far in this call (1-based)
     * @param error max absolute output error of this step, or NaN when the call
     *              does not measure it (predicate-driven training)
     */
    default void onIterationEnd(int iteration, double error) {}

    /**
     * Called after each complete sweep over the stored examples.
     *
     * @param sweep sweep number (0-based)
     * @param worstError largest error seen during the sweep
     */
    default void onSweepEnd(int sweep, double worstError) {}

    /**
     * Called when the call finishes.
     *
     * @param network the trained network
     * @param state terminal state of the call
     * @param iterations number of steps performed
     */
    default void onTrainingEnd(NeuralNetwork network, TrainingState state, int iterations) {}
}
