package dev.neuronic.mlp;

import dev.neuronic.mlp.activators.Activator;

/**
 * Single unit of a feed-forward network.
 *
 * <p>Input-layer neurons have no incoming connections: their value is assigned by
 * {@link NeuralNetwork#fire(double...)} and passed through unchanged, even though an
 * activator is attached for uniformity. Output-layer neurons have no outgoing connections.
 *
 * <p>Connection arrays are assigned once by {@link NeuralNetworkBuilder}; afterwards only
 * value, gradient, bias and bias delta change.
 */
public final class Neuron {

    private final Activator activator;
    private double bias;
    private double previousBiasDelta;
    private double value;
    private double gradient;
    private Connection[] inputs;
    private Connection[] outputs;

    public Neuron(Activator activator, double initialBias) {
        if (activator == null)
            throw new IllegalArgumentException("Activator must not be null");
        this.activator = activator;
        this.bias = initialBias;
    }

    /**
     * Recompute {@link #getValue()} from the incoming connections and bias.
     * Does nothing for input neurons.
     */
    public void fire() {
        if (inputs == null)
            return;

        double sum = 0.0;
        for (Connection input : inputs)
            sum += input.weightedInput();

        value = activator.activate(sum + bias);
    }

    /**
     * @return the activator's derivative at the current value
     */
    public double derivative() {
        return activator.derivative(value);
    }

    public Activator getActivator() {
        return activator;
    }

    public double getBias() {
        return bias;
    }

    public void setBias(double bias) {
        this.bias = bias;
    }

    public double getPreviousBiasDelta() {
        return previousBiasDelta;
    }

    public void setPreviousBiasDelta(double previousBiasDelta) {
        this.previousBiasDelta = previousBiasDelta;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public double getGradient() {
        return gradient;
    }

    public void setGradient(double gradient) {
        this.gradient = gradient;
    }

    public boolean isInput() {
        return inputs == null;
    }

    public boolean isOutput() {
        return outputs == null;
    }

    /**
     * @return number of incoming connections, 0 for input neurons
     */
    public int getInputCount() {
        return inputs == null ? 0 : inputs.length;
    }

    /**
     * @return number of outgoing connections, 0 for output neurons
     */
    public int getOutputCount() {
        return outputs == null ? 0 : outputs.length;
    }

    /**
     * @param index position of the source neuron in the preceding layer
     */
    public Connection input(int index) {
        if (inputs == null)
            throw new IllegalStateException("Input-layer neuron has no incoming connections");
        return inputs[index];
    }

    /**
     * @param index position of the target neuron in the following layer
     */
    public Connection output(int index) {
        if (outputs == null)
            throw new IllegalStateException("Output-layer neuron has no outgoing connections");
        return outputs[index];
    }

    /**
     * @return the outgoing connections (live array, indexed by target position), or null for output neurons
     */
    Connection[] outputs() {
        return outputs;
    }

    void connectInput(int sourceIndex, int sourceLayerSize, Connection connection) {
        if (inputs == null)
            inputs = new Connection[sourceLayerSize];
        inputs[sourceIndex] = connection;
    }

    void setOutputs(Connection[] outputs) {
        this.outputs = outputs;
    }

    @Override
    public String toString() {
        return "Neuron{" + activator.name() + ", value=" + value + ", bias=" + bias + ", gradient=" + gradient + '}';
    }
}
