package dev.neuronic.mlp.training;

import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.math.NetMath;
import dev.neuronic.mlp.optimizers.TrainingAlgorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Keyed collection of training examples plus the loops that drive a {@link TrainingAlgorithm}.
 *
 * <p>Three stopping policies are supported:
 * <ul>
 *   <li>{@link #train} - one example until its error is within tolerance</li>
 *   <li>{@link #retrain} - whole-set sweeps in insertion order until a complete sweep is
 *       within tolerance, with one iteration budget shared by every step</li>
 *   <li>{@link #trainUntil} - one example until a caller predicate holds</li>
 * </ul>
 *
 * <p>The error of a step is {@code max |output - target|} over the outputs produced by
 * that step's forward pass, before its parameter update.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Trainer<String> trainer = new Trainer<>(new Backpropagation(0.2, 0.1));
 * trainer.addOrUpdateData("00", new TrainingData(new double[]{0, 0}, 0));
 * trainer.addOrUpdateData("01", new TrainingData(new double[]{0, 1}, 1));
 * boolean converged = trainer.retrain(network, 0.05, 10_000);
 * }</pre>
 *
 * @param <K> key type identifying stored examples
 */
public class Trainer<K> {

    private final Map<K, TrainingData> trainingData;
    private final TrainingAlgorithm algorithm;
    private final Config config;
    private final List<TrainingCallback> callbacks = new ArrayList<>();

    private TrainingState state = TrainingState.TRAINING;
    private int lastIterationCount;

    public Trainer(TrainingAlgorithm algorithm) {
        this(new LinkedHashMap<>(), algorithm, Config.DEFAULT);
    }

    public Trainer(TrainingAlgorithm algorithm, Config config) {
        this(new LinkedHashMap<>(), algorithm, config);
    }

    /**
     * @param initialData examples copied into the trainer in the map's iteration order
     */
    public Trainer(Map<K, TrainingData> initialData, TrainingAlgorithm algorithm) {
        this(initialData, algorithm, Config.DEFAULT);
    }

    public Trainer(Map<K, TrainingData> initialData, TrainingAlgorithm algorithm, Config config) {
        if (initialData == null)
            throw new IllegalArgumentException("Initial data must not be null");
        if (algorithm == null)
            throw new IllegalArgumentException("Training algorithm must not be null");
        if (config == null)
            throw new IllegalArgumentException("Config must not be null");

        this.trainingData = new LinkedHashMap<>(initialData);
        this.algorithm = algorithm;
        this.config = config;

        if (config.verbosity > 0)
            callbacks.add(new ProgressCallback(config.verbosity == 2, config.progressInterval));
    }

    public Trainer<K> withCallback(TrainingCallback callback) {
        if (callback == null)
            throw new IllegalArgumentException("Callback must not be null");
        callbacks.add(callback);
        return this;
    }

    /**
     * Insert an example, or replace the one stored under {@code key} in place
     * (a replaced key keeps its original sweep position).
     */
    public void addOrUpdateData(K key, TrainingData data) {
        if (data == null)
            throw new IllegalArgumentException("Training data must not be null");
        trainingData.put(key, data);
    }

    /**
     * @return true if an example was stored under {@code key}
     */
    public boolean removeData(K key) {
        return trainingData.remove(key) != null;
    }

    public TrainingData getData(K key) {
        return trainingData.get(key);
    }

    /**
     * @return read-only view in sweep order
     */
    public Map<K, TrainingData> getTrainingData() {
        return Collections.unmodifiableMap(trainingData);
    }

    public int size() {
        return trainingData.size();
    }

    public TrainingAlgorithm getAlgorithm() {
        return algorithm;
    }

    public Config getConfig() {
        return config;
    }

    /**
     * State at the end of the last call, or {@link TrainingState#TRAINING} before any call.
     */
    public TrainingState getState() {
        return state;
    }

    /**
     * Training steps performed by the last call.
     */
    public int getLastIterationCount() {
        return lastIterationCount;
    }

    /**
     * Train on one example until a single step's error is within {@code tolerance}.
     *
     * @return true if converged within {@code maxIterations} steps
     */
    public boolean train(NeuralNetwork network, double tolerance, int maxIterations, TrainingData data) {
        checkArguments(network, maxIterations);
        checkTolerance(tolerance);
        if (data == null)
            throw new IllegalArgumentException("Training data must not be null");

        begin(network, maxIterations);

        int iteration = 0;
        while (iteration < maxIterations) {
            double error = step(network, data);
            iteration++;
            notifyIteration(iteration, error);

            if (error <= tolerance)
                return finish(network, TrainingState.CONVERGED, iteration);
        }

        return finish(network, TrainingState.EXHAUSTED, iteration);
    }

    /**
     * Sweep over every stored example in insertion order until one complete sweep has
     * its worst error within {@code tolerance}. Every step counts against
     * {@code maxIterations}, so the budget may end a sweep midway.
     *
     * @return true if a complete sweep converged; true without training when no examples are stored
     */
    public boolean retrain(NeuralNetwork network, double tolerance, int maxIterations) {
        checkArguments(network, maxIterations);
        checkTolerance(tolerance);

        if (trainingData.isEmpty()) {
            if (config.verbosity > 0)
                System.err.println("Warning: retrain called with no training data");
            state = TrainingState.CONVERGED;
            lastIterationCount = 0;
            return true;
        }

        begin(network, maxIterations);

        List<TrainingData> examples = new ArrayList<>(trainingData.values());
        int iteration = 0;
        int sweep = 0;
        while (iteration < maxIterations) {
            double worstError = 0.0;
            boolean complete = true;

            for (TrainingData data : examples) {
                if (iteration >= maxIterations) {
                    complete = false;
                    break;
                }
                double error = step(network, data);
                iteration++;
                notifyIteration(iteration, error);

                // NaN sticks, so a diverged sweep can never pass
                if (!Double.isNaN(worstError) && !(error <= worstError))
                    worstError = error;
            }

            if (!complete)
                break;

            notifySweep(sweep++, worstError);

            if (worstError <= tolerance)
                return finish(network, TrainingState.CONVERGED, iteration);
        }

        return finish(network, TrainingState.EXHAUSTED, iteration);
    }

    /**
     * Train on one example, checking {@code stopCondition} after every step.
     *
     * @return true if the predicate held within {@code maxIterations} steps
     */
    public boolean trainUntil(NeuralNetwork network, int maxIterations, TrainingData data,
                              Predicate<NeuralNetwork> stopCondition) {
        checkArguments(network, maxIterations);
        if (data == null)
            throw new IllegalArgumentException("Training data must not be null");
        if (stopCondition == null)
            throw new IllegalArgumentException("Stop condition must not be null");

        begin(network, maxIterations);

        int iteration = 0;
        while (iteration < maxIterations) {
            algorithm.train(network, data.inputsView(), data.rewardOrDefault(), data.outputsView());
            iteration++;
            notifyIteration(iteration, Double.NaN);

            if (stopCondition.test(network))
                return finish(network, TrainingState.CONVERGED, iteration);
        }

        return finish(network, TrainingState.EXHAUSTED, iteration);
    }

    /**
     * Mean squared output error over every stored example, without training.
     * Fires the network once per example.
     *
     * @return the average of the per-example mean squared errors, or 0 when no examples are stored
     */
    public double meanSquaredError(NeuralNetwork network) {
        if (network == null)
            throw new IllegalArgumentException("Network must not be null");
        if (trainingData.isEmpty())
            return 0.0;

        double sum = 0.0;
        for (TrainingData data : trainingData.values())
            sum += NetMath.errorMeanSquared(network.predict(data.inputsView()), data.outputsView());
        return sum / trainingData.size();
    }

    private double step(NeuralNetwork network, TrainingData data) {
        double[] targets = data.outputsView();
        algorithm.train(network, data.inputsView(), data.rewardOrDefault(), targets);
        // Output values are untouched by the backward pass
        return NetMath.errorMaxAbsolute(network.outputValues(), targets);
    }

    private void begin(NeuralNetwork network, int maxIterations) {
        state = TrainingState.TRAINING;
        lastIterationCount = 0;
        for (TrainingCallback callback : callbacks)
            callback.onTrainingStart(network, maxIterations);
    }

    private boolean finish(NeuralNetwork network, TrainingState finalState, int iterations) {
        state = finalState;
        lastIterationCount = iterations;
        for (TrainingCallback callback : callbacks)
            callback.onTrainingEnd(network, finalState, iterations);
        return finalState == TrainingState.CONVERGED;
    }

    private void notifyIteration(int iteration, double error) {
        for (TrainingCallback callback : callbacks)
            callback.onIterationEnd(iteration, error);
    }

    private void notifySweep(int sweep, double worstError) {
        for (TrainingCallback callback : callbacks)
            callback.onSweepEnd(sweep, worstError);
    }

    private static void checkArguments(NeuralNetwork network, int maxIterations) {
        if (network == null)
            throw new IllegalArgumentException("Network must not be null");
        if (maxIterations < 0)
            throw new IllegalArgumentException("Max iterations must be non-negative: " + maxIterations);
    }

    private static void checkTolerance(double tolerance) {
        if (!(tolerance >= 0))
            throw new IllegalArgumentException("Tolerance must be non-negative: " + tolerance);
    }

    /**
     * Reporting options for a trainer.
     */
    public static class Config {
        public static final Config DEFAULT = new Builder().build();

        public final int verbosity; // 0=silent, 1=progress, 2=detailed
        public final int progressInterval;

        private Config(Builder builder) {
            this.verbosity = builder.verbosity;
            this.progressInterval = builder.progressInterval;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private int verbosity = 0;
            private int progressInterval = 1000;

            public Builder verbosity(int level) {
                if (level < 0 || level > 2)
                    throw new IllegalArgumentException("Verbosity must be 0, 1, or 2");
                this.verbosity = level;
                return this;
            }

            public Builder progressInterval(int iterations) {
                if (iterations <= 0)
                    throw new IllegalArgumentException("Progress interval must be positive: " + iterations);
                this.progressInterval = iterations;
                return this;
            }

            public Config build() {
                return new Config(this);
            }
        }
    }
}
