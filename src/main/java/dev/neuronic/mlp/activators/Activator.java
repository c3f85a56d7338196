package dev.neuronic.mlp.activators;

/**
 * Scalar activation function applied by every neuron.
 *
 * <p>{@link #derivative(double)} takes the activation <em>output</em> {@code y = activate(x)},
 * not the pre-activation sum, so backpropagation can reuse the value already stored
 * on the neuron instead of recomputing {@code x}.
 *
 * <p>Implementations are stateless singletons and may be shared freely.
 */
public interface Activator {

    double activate(double x);

    /**
     * @param output a value previously returned by {@link #activate(double)}
     * @return the derivative of the function at the input that produced {@code output}
     */
    double derivative(double output);

    /**
     * Stable short name, used in diagnostics and progress output.
     */
    String name();
}
