package dev.neuronic.mlp.initializers;

import dev.neuronic.mlp.math.FastRandom;

import java.util.random.RandomGenerator;

/**
 * Xavier/Glorot uniform weight initialization.
 *
 * <p>Initializes weights uniformly in the range [-limit, +limit) where
 * limit = sqrt(6 / (fanIn + fanOut)). The factor 6 (not 2) gives the uniform
 * distribution the same variance as {@link XavierNormalInitializer}.
 */
public final class XavierUniformInitializer implements WeightInitializer {

    public static final XavierUniformInitializer INSTANCE = new XavierUniformInitializer(null);

    private final RandomGenerator random;

    public XavierUniformInitializer(RandomGenerator random) {
        this.random = random;
    }

    public static XavierUniformInitializer seeded(long seed) {
        return new XavierUniformInitializer(FastRandom.seeded(seed));
    }

    @Override
    public double initialWeight(int fanIn, int fanOut) {
        WeightInitializer.checkFans(fanIn, fanOut);

        RandomGenerator rnd = random != null ? random : FastRandom.get();
        double limit = Math.sqrt(6.0 / (fanIn + fanOut));

        return rnd.nextDouble() * 2.0 * limit - limit;
    }
}
