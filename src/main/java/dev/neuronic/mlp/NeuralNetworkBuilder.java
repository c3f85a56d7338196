package dev.neuronic.mlp;

import dev.neuronic.mlp.activators.Activator;
import dev.neuronic.mlp.activators.SigmoidActivator;
import dev.neuronic.mlp.activators.TanhActivator;
import dev.neuronic.mlp.initializers.WeightInitializer;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for fully connected feed-forward networks.
 *
 * Defaults: tanh on the input and hidden layers, sigmoid on the outputs, Xavier normal
 * weights, bias 0.01 on every neuron.
 *
 * Example usage:
 * <pre>{@code
 * // 2-3-1 network for XOR with reproducible weights
 * NeuralNetwork net = NeuralNetwork.newBuilder()
 *     .inputs(2)
 *     .hidden(3)
 *     .outputs(1)
 *     .withSeed(42)
 *     .build();
 *
 * // Direct input -> output wiring with ReLU on the inputs and narrow weights
 * NeuralNetwork linear = NeuralNetwork.newBuilder()
 *     .inputs(4)
 *     .outputs(2)
 *     .activator(ReluActivator.INSTANCE)
 *     .weightInit(WeightInitStrategy.NARROW_RANDOM)
 *     .build();
 * }</pre>
 */
public class NeuralNetworkBuilder {

    public static final double DEFAULT_INITIAL_BIAS = 0.01;

    private int inputCount;
    private int outputCount;
    private final List<Integer> hiddenLayerSizes = new ArrayList<>();
    private Activator activator = TanhActivator.INSTANCE;
    private Activator outputActivator = SigmoidActivator.INSTANCE;
    private WeightInitStrategy strategy = WeightInitStrategy.XAVIER_NORMAL;
    private WeightInitializer initializer = null; // explicit instance wins over strategy
    private Long seed = null;
    private double initialBias = DEFAULT_INITIAL_BIAS;

    /**
     * Build a network the way the positional factory signature describes it.
     * Null arguments fall back to the defaults.
     *
     * @param inputCount number of input neurons
     * @param outputCount number of output neurons
     * @param hiddenLayerCounts hidden layer sizes in forward order; empty for direct wiring
     * @param activator activator for input and hidden neurons, or null for tanh
     * @param outputActivator activator for output neurons, or null for sigmoid
     * @param initializer weight initializer, or null for shared Xavier normal
     */
    public static NeuralNetwork build(int inputCount, int outputCount, int[] hiddenLayerCounts,
                                      Activator activator, Activator outputActivator,
                                      WeightInitializer initializer) {
        NeuralNetworkBuilder builder = new NeuralNetworkBuilder()
                .inputs(inputCount)
                .outputs(outputCount)
                .hiddenLayers(hiddenLayerCounts == null ? new int[0] : hiddenLayerCounts);
        if (activator != null)
            builder.activator(activator);
        if (outputActivator != null)
            builder.outputActivator(outputActivator);
        if (initializer != null)
            builder.weightInit(initializer);
        return builder.build();
    }

    /**
     * Build with all defaults.
     */
    public static NeuralNetwork build(int inputCount, int outputCount, int... hiddenLayerCounts) {
        return build(inputCount, outputCount, hiddenLayerCounts, null, null, null);
    }

    public NeuralNetworkBuilder inputs(int count) {
        if (count <= 0)
            throw new IllegalArgumentException("Input count must be positive: " + count);
        this.inputCount = count;
        return this;
    }

    public NeuralNetworkBuilder outputs(int count) {
        if (count <= 0)
            throw new IllegalArgumentException("Output count must be positive: " + count);
        this.outputCount = count;
        return this;
    }

    /**
     * Append one hidden layer after those already added.
     */
    public NeuralNetworkBuilder hidden(int size) {
        if (size <= 0)
            throw new IllegalArgumentException("Hidden layer size must be positive: " + size);
        hiddenLayerSizes.add(size);
        return this;
    }

    /**
     * Replace all hidden layers. An empty argument list wires inputs straight to outputs.
     */
    public NeuralNetworkBuilder hiddenLayers(int... sizes) {
        hiddenLayerSizes.clear();
        for (int size : sizes)
            hidden(size);
        return this;
    }

    /**
     * Activator for input and hidden neurons. Input neurons never apply it.
     */
    public NeuralNetworkBuilder activator(Activator activator) {
        if (activator == null)
            throw new IllegalArgumentException("Activator must not be null");
        this.activator = activator;
        return this;
    }

    public NeuralNetworkBuilder outputActivator(Activator activator) {
        if (activator == null)
            throw new IllegalArgumentException("Output activator must not be null");
        this.outputActivator = activator;
        return this;
    }

    /**
     * Use a specific initializer instance. Takes precedence over {@link #weightInit(WeightInitStrategy)}
     * and {@link #withSeed(long)}.
     */
    public NeuralNetworkBuilder weightInit(WeightInitializer initializer) {
        if (initializer == null)
            throw new IllegalArgumentException("Weight initializer must not be null");
        this.initializer = initializer;
        return this;
    }

    public NeuralNetworkBuilder weightInit(WeightInitStrategy strategy) {
        if (strategy == null)
            throw new IllegalArgumentException("Weight init strategy must not be null");
        this.strategy = strategy;
        this.initializer = null;
        return this;
    }

    /**
     * Seed the selected strategy so the initial weights are reproducible.
     * Ignored when an explicit initializer instance is set.
     */
    public NeuralNetworkBuilder withSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public NeuralNetworkBuilder initialBias(double bias) {
        if (!Double.isFinite(bias))
            throw new IllegalArgumentException("Initial bias must be finite: " + bias);
        this.initialBias = bias;
        return this;
    }

    public NeuralNetwork build() {
        if (inputCount <= 0)
            throw new IllegalStateException("Input count not set; call inputs(int) before build()");
        if (outputCount <= 0)
            throw new IllegalStateException("Output count not set; call outputs(int) before build()");

        WeightInitializer weights = resolveInitializer();

        Neuron[] inputs = createNeurons(inputCount, activator);

        Neuron[][] hiddenLayers = new Neuron[hiddenLayerSizes.size()][];
        Neuron[] previousLayer = inputs;
        for (int l = 0; l < hiddenLayers.length; l++) {
            hiddenLayers[l] = createAndConnectLayer(hiddenLayerSizes.get(l), previousLayer, activator, weights);
            previousLayer = hiddenLayers[l];
        }

        Neuron[] outputs = createAndConnectLayer(outputCount, previousLayer, outputActivator, weights);

        return new NeuralNetwork(inputs, hiddenLayers, outputs);
    }

    private WeightInitializer resolveInitializer() {
        if (initializer != null)
            return initializer;
        return seed != null ? strategy.initializer(seed) : strategy.initializer();
    }

    private Neuron[] createAndConnectLayer(int size, Neuron[] previousLayer, Activator layerActivator,
                                           WeightInitializer weights) {
        Neuron[] layer = createNeurons(size, layerActivator);
        connect(previousLayer, layer, weights);
        return layer;
    }

    private Neuron[] createNeurons(int count, Activator layerActivator) {
        Neuron[] neurons = new Neuron[count];
        for (int i = 0; i < count; i++)
            neurons[i] = new Neuron(layerActivator, initialBias);
        return neurons;
    }

    /**
     * Fully connect {@code source} to {@code target}. The connection from source position
     * {@code i} to target position {@code j} lands at {@code source[i].outputs[j]} and
     * {@code target[j].inputs[i]}.
     */
    private static void connect(Neuron[] source, Neuron[] target, WeightInitializer weights) {
        for (int i = 0; i < source.length; i++) {
            Neuron node = source[i];
            Connection[] outgoing = new Connection[target.length];

            for (int j = 0; j < target.length; j++) {
                double weight = weights.initialWeight(source.length, target.length);
                Connection connection = new Connection(node, weight, target[j]);
                target[j].connectInput(i, source.length, connection);
                outgoing[j] = connection;
            }

            node.setOutputs(outgoing);
        }
    }
}
