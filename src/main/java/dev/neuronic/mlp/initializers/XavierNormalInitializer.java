package dev.neuronic.mlp.initializers;

import dev.neuronic.mlp.math.FastRandom;

import java.util.random.RandomGenerator;

/**
 * Xavier/Glorot normal weight initialization - the default for tanh hidden layers
 * feeding a sigmoid output.
 *
 * <p><strong>What it does:</strong>
 * Draws weights from N(0, stdDev²) where stdDev = sqrt(2 / (fanIn + fanOut)).
 * The standard normal sample comes from the Box-Muller transform over two uniforms
 * taken from (0, 1], which keeps {@code log} away from zero.
 *
 * <p><strong>Why it works:</strong>
 * Keeps the variance of activations and back-propagated gradients roughly equal
 * across layers by accounting for both the incoming and outgoing connection counts.
 */
public final class XavierNormalInitializer implements WeightInitializer {

    /**
     * Shared instance drawing from the thread-local generator. Not reproducible.
     */
    public static final XavierNormalInitializer INSTANCE = new XavierNormalInitializer(null);

    private final RandomGenerator random;

    /**
     * @param random generator owned by this initializer, or null to use the thread-local default
     */
    public XavierNormalInitializer(RandomGenerator random) {
        this.random = random;
    }

    public static XavierNormalInitializer seeded(long seed) {
        return new XavierNormalInitializer(FastRandom.seeded(seed));
    }

    @Override
    public double initialWeight(int fanIn, int fanOut) {
        WeightInitializer.checkFans(fanIn, fanOut);

        RandomGenerator rnd = random != null ? random : FastRandom.get();
        double stdDev = Math.sqrt(2.0 / (fanIn + fanOut));

        // Box-Muller transform
        double u1 = 1.0 - rnd.nextDouble();
        double u2 = 1.0 - rnd.nextDouble();
        double standardNormal = Math.sqrt(-2.0 * Math.log(u1)) * Math.sin(2.0 * Math.PI * u2);

        return standardNormal * stdDev;
    }
}
