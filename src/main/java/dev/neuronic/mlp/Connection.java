package dev.neuronic.mlp;

/**
 * Directed, weighted edge between a neuron and one neuron of the following layer.
 *
 * <p>Each connection is referenced twice: from {@code inputNode.output(i)} at the target's
 * position in its layer, and from {@code outputNode.input(i)} at the source's position in
 * its layer. The builder is the only place that creates connections, so both indices
 * always agree with the forward topology.
 */
public final class Connection {

    private final Neuron inputNode;
    private final Neuron outputNode;
    private double weight;
    private double previousWeightDelta;

    public Connection(Neuron inputNode, double weight, Neuron outputNode) {
        if (inputNode == null || outputNode == null)
            throw new IllegalArgumentException("Connection endpoints must not be null");
        this.inputNode = inputNode;
        this.weight = weight;
        this.outputNode = outputNode;
    }

    public Neuron getInputNode() {
        return inputNode;
    }

    public Neuron getOutputNode() {
        return outputNode;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    /**
     * @return the delta applied on the last update, read by momentum before being replaced
     */
    public double getPreviousWeightDelta() {
        return previousWeightDelta;
    }

    public void setPreviousWeightDelta(double previousWeightDelta) {
        this.previousWeightDelta = previousWeightDelta;
    }

    /**
     * @return weight times the current value of the source neuron
     */
    double weightedInput() {
        return weight * inputNode.getValue();
    }

    @Override
    public String toString() {
        return "Connection{weight=" + weight + ", previousWeightDelta=" + previousWeightDelta + '}';
    }
}
