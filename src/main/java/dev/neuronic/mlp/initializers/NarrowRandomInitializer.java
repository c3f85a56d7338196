package dev.neuronic.mlp.initializers;

import dev.neuronic.mlp.math.FastRandom;

import java.util.random.RandomGenerator;

/**
 * Fixed narrow-band initialization: weights uniform in [0.49, 0.51).
 *
 * <p>Ignores fan-in and fan-out. Every connection starts almost identical, which
 * makes hand-computed examples easy to follow but leaves hidden units nearly
 * symmetric, so prefer the Xavier variants for real training.
 */
public final class NarrowRandomInitializer implements WeightInitializer {

    public static final NarrowRandomInitializer INSTANCE = new NarrowRandomInitializer(null);

    private static final double CENTER_OFFSET = 0.49;
    private static final double WIDTH = 0.02;

    private final RandomGenerator random;

    public NarrowRandomInitializer(RandomGenerator random) {
        this.random = random;
    }

    public static NarrowRandomInitializer seeded(long seed) {
        return new NarrowRandomInitializer(FastRandom.seeded(seed));
    }

    @Override
    public double initialWeight(int fanIn, int fanOut) {
        WeightInitializer.checkFans(fanIn, fanOut);

        RandomGenerator rnd = random != null ? random : FastRandom.get();
        return CENTER_OFFSET + rnd.nextDouble() * WIDTH;
    }
}
