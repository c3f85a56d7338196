package dev.neuronic.mlp;

import dev.neuronic.mlp.initializers.NarrowRandomInitializer;
import dev.neuronic.mlp.initializers.WeightInitializer;
import dev.neuronic.mlp.initializers.XavierNormalInitializer;
import dev.neuronic.mlp.initializers.XavierUniformInitializer;
import dev.neuronic.mlp.math.FastRandom;

import java.util.random.RandomGenerator;

/**
 * Weight initialization strategies for neural network layers.
 *
 * <p>The choice of initialization strategy significantly affects training performance
 * and convergence. Each constant can hand out the shared, non-reproducible instance
 * or a fresh instance with its own generator.
 */
public enum WeightInitStrategy {

    /**
     * Uniform in [0.49, 0.51), independent of layer sizes.
     *
     * <p><strong>When to use:</strong>
     * <ul>
     *   <li>Worked examples and tests where weights should be predictable</li>
     *   <li>Very small networks where symmetry is not a concern</li>
     * </ul>
     */
    NARROW_RANDOM,

    /**
     * Xavier/Glorot normal initialization: N(0, 2 / (fanIn + fanOut)).
     *
     * <p><strong>When to use:</strong>
     * <ul>
     *   <li>With tanh hidden layers and sigmoid outputs (recommended default)</li>
     *   <li>When weights should be zero-centered with fan-scaled variance</li>
     * </ul>
     */
    XAVIER_NORMAL,

    /**
     * Xavier/Glorot uniform initialization: U(-limit, +limit), limit = sqrt(6 / (fanIn + fanOut)).
     *
     * <p>Same variance as {@link #XAVIER_NORMAL} but bounded, which avoids the rare large
     * weight a normal draw can produce.
     */
    XAVIER_UNIFORM;

    /**
     * @return the shared instance for this strategy, drawing from the thread-local generator
     */
    public WeightInitializer initializer() {
        switch (this) {
            case NARROW_RANDOM:
                return NarrowRandomInitializer.INSTANCE;
            case XAVIER_UNIFORM:
                return XavierUniformInitializer.INSTANCE;
            case XAVIER_NORMAL:
            default:
                return XavierNormalInitializer.INSTANCE;
        }
    }

    /**
     * @return a new initializer whose sequence is fully determined by {@code seed}
     */
    public WeightInitializer initializer(long seed) {
        return initializer(FastRandom.seeded(seed));
    }

    /**
     * @param random generator the returned initializer will own
     * @return a new initializer drawing from {@code random}
     */
    public WeightInitializer initializer(RandomGenerator random) {
        if (random == null)
            throw new IllegalArgumentException("random must not be null; use initializer() for the shared instance");

        switch (this) {
            case NARROW_RANDOM:
                return new NarrowRandomInitializer(random);
            case XAVIER_UNIFORM:
                return new XavierUniformInitializer(random);
            case XAVIER_NORMAL:
            default:
                return new XavierNormalInitializer(random);
        }
    }
}
