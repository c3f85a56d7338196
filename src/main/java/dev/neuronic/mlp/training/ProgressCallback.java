package dev.neuronic.mlp.training;

import dev.neuronic.mlp.NeuralNetwork;

/**
 * Progress reporting callback that prints training progress to console.
 *
 * Supports two modes:
 * - Simple: one line per sweep plus a summary at the end
 * - Detailed: additionally prints the error every {@code interval} steps
 */
public class ProgressCallback implements TrainingCallback {

    private final boolean detailed;
    private final int interval;
    private long trainingStartTime;

    public ProgressCallback(boolean detailed) {
        this(detailed, 1000);
    }

    public ProgressCallback(boolean detailed, int interval) {
        if (interval <= 0)
            throw new IllegalArgumentException("Progress interval must be positive: " + interval);
        this.detailed = detailed;
        this.interval = interval;
    }

    @Override
    public void onTrainingStart(NeuralNetwork network, int maxIterations) {
        trainingStartTime = System.currentTimeMillis();
        System.out.printf("Training started: %s, budget %d iterations%n", network, maxIterations);
    }

    @Override
    public void onIterationEnd(int iteration, double error) {
        if (!detailed || iteration % interval != 0) return;

        if (Double.isNaN(error))
            System.out.printf("Iteration %6d%n", iteration);
        else
            System.out.printf("Iteration %6d - error: %.6f%n", iteration, error);
    }

    @Override
    public void onSweepEnd(int sweep, double worstError) {
        System.out.printf("Sweep %4d - worst error: %.6f%n", sweep + 1, worstError);
    }

    @Override
    public void onTrainingEnd(NeuralNetwork network, TrainingState state, int iterations) {
        long totalTime = System.currentTimeMillis() - trainingStartTime;
        System.out.printf("Training %s after %d iterations (%s)%n",
                state == TrainingState.CONVERGED ? "converged" : "exhausted its budget",
                iterations, formatTime(totalTime));
    }

    private static String formatTime(long millis) {
        if (millis < 1000)
            return millis + "ms";
        return String.format("%.1fs", millis / 1000.0);
    }
}
