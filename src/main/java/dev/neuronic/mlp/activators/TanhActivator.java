package dev.neuronic.mlp.activators;

/**
 * Hyperbolic tangent activation function: f(x) = tanh(x) = (e^x - e^-x) / (e^x + e^-x)
 *
 * Properties:
 * - Output range: (-1, 1)
 * - Zero-centered (unlike sigmoid)
 * - Derivative: f'(x) = 1 - tanh²(x), evaluated here as (1 - y)(1 + y)
 *
 * Use for:
 * - Hidden layers in small multilayer perceptrons (the builder default)
 * - When you need zero-centered activations
 */
public final class TanhActivator implements Activator {

    public static final TanhActivator INSTANCE = new TanhActivator();

    private TanhActivator() {} // Singleton pattern

    @Override
    public double activate(double x) {
        return Math.tanh(x);
    }

    @Override
    public double derivative(double tanhOutput) {
        return (1.0 - tanhOutput) * (1.0 + tanhOutput);
    }

    @Override
    public String name() {
        return "tanh";
    }

    @Override
    public String toString() {
        return name();
    }
}
