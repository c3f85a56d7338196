package dev.neuronic.mlp.training;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * One labeled example: an input vector, the expected outputs, and an optional reward.
 *
 * <p>The vectors are copied on construction and on read, so an example can be shared
 * between trainers. The reward is mutable; a trainer reads it on every step, which lets
 * callers re-weight an example between training runs.
 */
public final class TrainingData {

    private final double[] inputs;
    private final double[] outputs;
    private Double reward;

    public TrainingData(double[] inputs, double... outputs) {
        this(inputs, outputs, null);
    }

    /**
     * @param reward scale applied to the output error, or null for plain training
     */
    public TrainingData(double[] inputs, double[] outputs, Double reward) {
        if (inputs == null || outputs == null)
            throw new IllegalArgumentException("Inputs and outputs must not be null");
        this.inputs = inputs.clone();
        this.outputs = outputs.clone();
        this.reward = reward;
    }

    public double[] getInputs() {
        return inputs.clone();
    }

    public double[] getOutputs() {
        return outputs.clone();
    }

    public int getInputCount() {
        return inputs.length;
    }

    public int getOutputCount() {
        return outputs.length;
    }

    public double getInput(int index) {
        return inputs[index];
    }

    public double getOutput(int index) {
        return outputs[index];
    }

    public OptionalDouble getReward() {
        return reward == null ? OptionalDouble.empty() : OptionalDouble.of(reward);
    }

    public boolean hasReward() {
        return reward != null;
    }

    /**
     * @return the reward, or 1.0 when none is set
     */
    public double rewardOrDefault() {
        return reward == null ? 1.0 : reward;
    }

    /**
     * @param reward new reward, or null to clear it
     */
    public void setReward(Double reward) {
        this.reward = reward;
    }

    // Package-private views without copying, for the trainer's inner loop
    double[] inputsView() {
        return inputs;
    }

    double[] outputsView() {
        return outputs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrainingData)) return false;
        TrainingData other = (TrainingData) o;
        return Arrays.equals(inputs, other.inputs)
                && Arrays.equals(outputs, other.outputs)
                && (reward == null ? other.reward == null : reward.equals(other.reward));
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(inputs);
        result = 31 * result + Arrays.hashCode(outputs);
        result = 31 * result + (reward == null ? 0 : reward.hashCode());
        return result;
    }

    @Override
    public String toString() {
        return "TrainingData{inputs=" + Arrays.toString(inputs)
                + ", outputs=" + Arrays.toString(outputs)
                + (reward == null ? "" : ", reward=" + reward) + '}';
    }
}
