package dev.neuronic.mlp.optimizers;

import dev.neuronic.mlp.NeuralNetwork;

/**
 * Algorithm that adjusts a network's weights and biases from one labeled example.
 *
 * <h3>Reward scaling</h3>
 * The {@code reward} overloads multiply the output error by a scalar before it is
 * propagated. A reward of 1 is plain supervised training, a larger reward takes a
 * proportionally larger step, 0 leaves every parameter untouched, and a negative reward
 * pushes the network away from the given target.
 *
 * <h3>Thread Safety</h3>
 * Networks are not thread-safe, so an algorithm must not be applied to the same network
 * from several threads at once. One algorithm instance may train several networks
 * sequentially.
 */
public interface TrainingAlgorithm {

    /**
     * Forward pass with {@code inputValues}, then a backward pass towards
     * {@code expectedOutputValues} with reward 1.
     */
    default void train(NeuralNetwork network, double[] inputValues, double[] expectedOutputValues) {
        train(network, inputValues, 1.0, expectedOutputValues);
    }

    /**
     * Forward pass with {@code inputValues}, then a reward-scaled backward pass.
     *
     * @throws dev.neuronic.mlp.ShapeMismatchException if either vector does not match its layer
     */
    void train(NeuralNetwork network, double[] inputValues, double reward, double[] expectedOutputValues);

    /**
     * Backward pass only; the caller must have fired the network with the matching inputs.
     */
    default void backpropagate(NeuralNetwork network, double[] expectedOutputValues) {
        backpropagate(network, 1.0, expectedOutputValues);
    }

    /**
     * Reward-scaled backward pass only; the caller must have fired the network.
     *
     * @throws dev.neuronic.mlp.ShapeMismatchException if the targets do not match the output layer
     */
    void backpropagate(NeuralNetwork network, double reward, double[] expectedOutputValues);
}
