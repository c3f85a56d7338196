package dev.neuronic.mlp.activators;

/**
 * Sigmoid activation function: f(x) = 1 / (1 + e^(-x))
 *
 * Properties:
 * - Output range: (0, 1)
 * - S-shaped curve
 * - Derivative: f'(x) = f(x) * (1 - f(x))
 *
 * Use for:
 * - Output layers producing probability-like values (the builder default)
 * - Binary targets such as XOR
 *
 * Note: Saturates for large |x|, so gradients shrink quickly in deep stacks.
 */
public final class SigmoidActivator implements Activator {

    public static final SigmoidActivator INSTANCE = new SigmoidActivator();

    private SigmoidActivator() {} // Singleton pattern

    @Override
    public double activate(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    @Override
    public double derivative(double sigmoidOutput) {
        return sigmoidOutput * (1.0 - sigmoidOutput);
    }

    @Override
    public String name() {
        return "sigmoid";
    }

    @Override
    public String toString() {
        return name();
    }
}
