package dev.neuronic.mlp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Fully connected feed-forward network made of an input layer, zero or more hidden
 * layers and an output layer.
 * <p>
 * The topology is fixed by {@link NeuralNetworkBuilder}; training only changes weights,
 * biases, their previous deltas, and the per-neuron value and gradient.
 * <p>
 * Usage:
 * NeuralNetwork net = NeuralNetwork.newBuilder()
 * .inputs(2)
 * .hidden(3)
 * .outputs(1)
 * .build();
 * net.fire(0.0, 1.0);
 * double y = net.output(0).getValue();
 * <p>
 * Instances are not thread-safe. Give each worker its own network or guard access
 * externally.
 */
public class NeuralNetwork {

    public static NeuralNetworkBuilder newBuilder() {
        return new NeuralNetworkBuilder();
    }

    private final Neuron[] inputs;
    private final Neuron[][] hiddenLayers;
    private final Neuron[] outputs;

    // Flat traversal views, fixed at construction
    private final List<Neuron> allNeurons;
    private final List<Connection> allConnections;

    NeuralNetwork(Neuron[] inputs, Neuron[][] hiddenLayers, Neuron[] outputs) {
        this.inputs = inputs;
        this.hiddenLayers = hiddenLayers;
        this.outputs = outputs;
        this.allNeurons = Collections.unmodifiableList(collectNeurons());
        this.allConnections = Collections.unmodifiableList(collectConnections());
    }

    /**
     * Assign {@code inputValues} to the input neurons and propagate them to the outputs.
     * Input values are used as-is; the input layer's activator is not applied.
     *
     * @param inputValues one value per input neuron
     * @throws ShapeMismatchException if the length differs from {@link #getInputCount()}
     */
    public void fire(double... inputValues) {
        ShapeMismatchException.check("Input", inputs.length, inputValues);

        for (int i = 0; i < inputValues.length; i++) {
            Neuron input = inputs[i];
            input.setValue(inputValues[i]);
            input.fire();
        }

        feedForward();
    }

    /**
     * Recompute every hidden neuron, layer by layer from the inputs outward, then every
     * output neuron. Assumes the input neurons already hold their values.
     */
    public void feedForward() {
        for (Neuron[] hiddenLayer : hiddenLayers) {
            for (Neuron node : hiddenLayer)
                node.fire();
        }

        for (Neuron output : outputs)
            output.fire();
    }

    /**
     * Convenience: fire and return a copy of the output values.
     */
    public double[] predict(double... inputValues) {
        fire(inputValues);
        return outputValues();
    }

    /**
     * @return a copy of the current output neuron values
     */
    public double[] outputValues() {
        double[] values = new double[outputs.length];
        for (int i = 0; i < outputs.length; i++)
            values[i] = outputs[i].getValue();
        return values;
    }

    public int getInputCount() {
        return inputs.length;
    }

    public int getOutputCount() {
        return outputs.length;
    }

    public int getHiddenLayerCount() {
        return hiddenLayers.length;
    }

    /**
     * @return sizes of the hidden layers, nearest the inputs first
     */
    public int[] getHiddenLayerSizes() {
        int[] sizes = new int[hiddenLayers.length];
        for (int i = 0; i < hiddenLayers.length; i++)
            sizes[i] = hiddenLayers[i].length;
        return sizes;
    }

    public int getHiddenLayerSize(int layer) {
        return hiddenLayers[layer].length;
    }

    public Neuron input(int index) {
        return inputs[index];
    }

    public Neuron output(int index) {
        return outputs[index];
    }

    public Neuron hidden(int layer, int index) {
        return hiddenLayers[layer][index];
    }

    /**
     * @return a copy of the input layer array
     */
    public Neuron[] getInputs() {
        return Arrays.copyOf(inputs, inputs.length);
    }

    /**
     * @return a copy of the output layer array
     */
    public Neuron[] getOutputs() {
        return Arrays.copyOf(outputs, outputs.length);
    }

    /**
     * @return a copy of the hidden layers, nearest the inputs first
     */
    public Neuron[][] getHiddenLayers() {
        Neuron[][] copy = new Neuron[hiddenLayers.length][];
        for (int i = 0; i < hiddenLayers.length; i++)
            copy[i] = Arrays.copyOf(hiddenLayers[i], hiddenLayers[i].length);
        return copy;
    }

    /**
     * Every neuron in the stable serialization order: inputs, hidden layers in forward
     * order, outputs. Within a layer neurons keep their layer position.
     */
    public List<Neuron> allNeurons() {
        return allNeurons;
    }

    /**
     * Every connection in the stable serialization order: the outgoing connections of each
     * input neuron, then of each hidden neuron layer by layer. Each neuron contributes its
     * outgoing connections in target order.
     */
    public List<Connection> allConnections() {
        return allConnections;
    }

    public int getNeuronCount() {
        return allNeurons.size();
    }

    public int getConnectionCount() {
        return allConnections.size();
    }

    private List<Neuron> collectNeurons() {
        List<Neuron> neurons = new ArrayList<>();
        neurons.addAll(Arrays.asList(inputs));
        for (Neuron[] layer : hiddenLayers)
            neurons.addAll(Arrays.asList(layer));
        neurons.addAll(Arrays.asList(outputs));
        return neurons;
    }

    private List<Connection> collectConnections() {
        List<Connection> connections = new ArrayList<>();
        addOutgoing(inputs, connections);
        for (Neuron[] layer : hiddenLayers)
            addOutgoing(layer, connections);
        return connections;
    }

    private static void addOutgoing(Neuron[] layer, List<Connection> connections) {
        for (Neuron neuron : layer) {
            Connection[] outgoing = neuron.outputs();
            if (outgoing != null)
                connections.addAll(Arrays.asList(outgoing));
        }
    }

    @Override
    public String toString() {
        return "NeuralNetwork{inputs=" + inputs.length
                + ", hidden=" + Arrays.toString(getHiddenLayerSizes())
                + ", outputs=" + outputs.length
                + ", connections=" + allConnections.size() + '}';
    }
}
