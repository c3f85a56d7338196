package dev.neuronic.mlp.activators;

/**
 * Rectified Linear Unit (ReLU) activation function.
 *
 * <p>ReLU(x) = max(0, x)
 *
 * <p>Derivative: 1 if the output is positive, else 0. Since ReLU(x) &gt; 0 exactly
 * when x &gt; 0, testing the output is equivalent to testing the input.
 */
public final class ReluActivator implements Activator {

    public static final ReluActivator INSTANCE = new ReluActivator();

    private ReluActivator() {} // Private constructor for singleton

    @Override
    public double activate(double x) {
        return Math.max(0.0, x);
    }

    @Override
    public double derivative(double output) {
        return output > 0.0 ? 1.0 : 0.0;
    }

    @Override
    public String name() {
        return "relu";
    }

    @Override
    public String toString() {
        return name();
    }
}
