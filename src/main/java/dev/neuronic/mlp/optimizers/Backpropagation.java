package dev.neuronic.mlp.optimizers;

import dev.neuronic.mlp.Connection;
import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.Neuron;
import dev.neuronic.mlp.ShapeMismatchException;
import dev.neuronic.mlp.math.NetMath;

import java.util.List;

/**
 * Stochastic gradient descent by backpropagation, with classic momentum and an
 * optional adaptive learning rate.
 *
 * <p>One backward pass runs, in order:
 * <ol>
 *   <li>Output gradients: {@code g = f'(o) * (t - o) * reward}</li>
 *   <li>Hidden gradients, output-side layer first:
 *       {@code g = f'(h) * sum(next.g * w)} over the outgoing connections</li>
 *   <li>Weights, over {@link NeuralNetwork#allConnections()}:
 *       {@code delta = rate * out.g * in.value; w += delta + momentum * previousDelta}</li>
 *   <li>Biases, hidden layers in forward order then outputs:
 *       {@code delta = rate * g; b += delta + momentum * previousBiasDelta}</li>
 * </ol>
 * Momentum reads the previous delta before it is replaced (not Nesterov). Input-layer
 * biases are never touched.
 *
 * <p><b>Adaptive learning rate:</b> when enabled, the rate for a pass is
 * {@code learningRate * (1 + tanh(rms(outputGradients)))}. It grows with the output error,
 * stays strictly positive, and never exceeds twice the configured rate. When disabled the
 * configured rate is used verbatim.
 *
 * <p>NaN and infinite values are not intercepted; they propagate into the parameters.
 */
public class Backpropagation implements TrainingAlgorithm {

    public static final double DEFAULT_LEARNING_RATE = 0.1;
    public static final double DEFAULT_MOMENTUM = 0.0;

    private double learningRate;
    private double momentum;
    private boolean adaptiveLearningRate;

    /**
     * Create backpropagation with the default learning rate and no momentum.
     */
    public Backpropagation() {
        this(DEFAULT_LEARNING_RATE, DEFAULT_MOMENTUM);
    }

    /**
     * @param learningRate step size (typically 0.01 to 1.0)
     * @param momentum fraction of the previous delta carried into each update (typically 0 to 0.9)
     */
    public Backpropagation(double learningRate, double momentum) {
        this(learningRate, momentum, false);
    }

    public Backpropagation(double learningRate, double momentum, boolean adaptiveLearningRate) {
        setLearningRate(learningRate);
        setMomentum(momentum);
        this.adaptiveLearningRate = adaptiveLearningRate;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void train(NeuralNetwork network, double[] inputValues, double reward, double[] expectedOutputValues) {
        checkTargets(network, expectedOutputValues);

        network.fire(inputValues);

        backpropagate(network, reward, expectedOutputValues);
    }

    @Override
    public void backpropagate(NeuralNetwork network, double reward, double[] expectedOutputValues) {
        checkTargets(network, expectedOutputValues);

        updateOutputGradients(network, reward, expectedOutputValues);

        updateHiddenLayerGradients(network);

        double rate = effectiveLearningRate(network);

        updateWeights(network, rate);

        updateHiddenLayerBiases(network, rate);

        updateOutputBiases(network, rate);
    }

    /**
     * The rate a backward pass would use given the output gradients currently stored on
     * {@code network}.
     */
    public double effectiveLearningRate(NeuralNetwork network) {
        if (!adaptiveLearningRate)
            return learningRate;

        double[] gradients = new double[network.getOutputCount()];
        for (int o = 0; o < gradients.length; o++)
            gradients[o] = network.output(o).getGradient();

        return learningRate * (1.0 + Math.tanh(NetMath.normRms(gradients)));
    }

    private static void checkTargets(NeuralNetwork network, double[] expectedOutputValues) {
        if (expectedOutputValues == null)
            throw new IllegalArgumentException("Expected output values must not be null");
        if (expectedOutputValues.length != network.getOutputCount())
            throw new ShapeMismatchException("Expected output", network.getOutputCount(), expectedOutputValues.length);
    }

    private static void updateOutputGradients(NeuralNetwork network, double reward, double[] expectedOutputValues) {
        for (int o = 0; o < expectedOutputValues.length; o++) {
            Neuron output = network.output(o);
            output.setGradient(output.derivative() * (expectedOutputValues[o] - output.getValue()) * reward);
        }
    }

    /**
     * Reverse layer order so every downstream gradient is final before it is read.
     */
    private static void updateHiddenLayerGradients(NeuralNetwork network) {
        for (int l = network.getHiddenLayerCount() - 1; l >= 0; l--) {
            int size = network.getHiddenLayerSize(l);
            for (int n = 0; n < size; n++) {
                Neuron hiddenNode = network.hidden(l, n);
                hiddenNode.setGradient(hiddenNode.derivative() * downstreamError(hiddenNode));
            }
        }
    }

    private static double downstreamError(Neuron node) {
        double sum = 0.0;
        int count = node.getOutputCount();
        for (int i = 0; i < count; i++) {
            Connection connection = node.output(i);
            sum += connection.getOutputNode().getGradient() * connection.getWeight();
        }
        return sum;
    }

    private void updateWeights(NeuralNetwork network, double rate) {
        List<Connection> connections = network.allConnections();
        for (int i = 0, n = connections.size(); i < n; i++)
            updateWeight(connections.get(i), rate);
    }

    private void updateWeight(Connection connection, double rate) {
        double delta = rate * connection.getOutputNode().getGradient() * connection.getInputNode().getValue();
        connection.setWeight(connection.getWeight() + delta + momentum * connection.getPreviousWeightDelta());
        connection.setPreviousWeightDelta(delta);
    }

    private void updateHiddenLayerBiases(NeuralNetwork network, double rate) {
        for (int l = 0; l < network.getHiddenLayerCount(); l++) {
            int size = network.getHiddenLayerSize(l);
            for (int n = 0; n < size; n++)
                updateBias(network.hidden(l, n), rate);
        }
    }

    private void updateOutputBiases(NeuralNetwork network, double rate) {
        for (int o = 0; o < network.getOutputCount(); o++)
            updateBias(network.output(o), rate);
    }

    private void updateBias(Neuron node, double rate) {
        double delta = rate * node.getGradient();
        node.setBias(node.getBias() + delta + momentum * node.getPreviousBiasDelta());
        node.setPreviousBiasDelta(delta);
    }

    public double getLearningRate() {
        return learningRate;
    }

    /**
     * Change the learning rate between calls, e.g. for a decay schedule.
     */
    public void setLearningRate(double learningRate) {
        if (!(learningRate > 0) || !Double.isFinite(learningRate))
            throw new IllegalArgumentException("Learning rate must be positive and finite: " + learningRate);
        this.learningRate = learningRate;
    }

    public double getMomentum() {
        return momentum;
    }

    public void setMomentum(double momentum) {
        if (!(momentum >= 0) || !Double.isFinite(momentum))
            throw new IllegalArgumentException("Momentum must be non-negative and finite: " + momentum);
        this.momentum = momentum;
    }

    public boolean isAdaptiveLearningRate() {
        return adaptiveLearningRate;
    }

    public void setAdaptiveLearningRate(boolean adaptiveLearningRate) {
        this.adaptiveLearningRate = adaptiveLearningRate;
    }

    @Override
    public String toString() {
        return String.format("Backpropagation{learningRate=%s, momentum=%s, adaptive=%s}",
                learningRate, momentum, adaptiveLearningRate);
    }

    public static class Builder {
        private double learningRate = DEFAULT_LEARNING_RATE;
        private double momentum = DEFAULT_MOMENTUM;
        private boolean adaptiveLearningRate = false;

        public Builder learningRate(double learningRate) {
            if (!(learningRate > 0) || !Double.isFinite(learningRate))
                throw new IllegalArgumentException("Learning rate must be positive and finite: " + learningRate);
            this.learningRate = learningRate;
            return this;
        }

        public Builder momentum(double momentum) {
            if (!(momentum >= 0) || !Double.isFinite(momentum))
                throw new IllegalArgumentException("Momentum must be non-negative and finite: " + momentum);
            this.momentum = momentum;
            return this;
        }

        public Builder adaptiveLearningRate(boolean enabled) {
            this.adaptiveLearningRate = enabled;
            return this;
        }

        public Backpropagation build() {
            return new Backpropagation(learningRate, momentum, adaptiveLearningRate);
        }
    }
}
