package dev.neuronic.mlp.math;

import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Source of random generators for weight initialization.
 *
 * <p>Two flavours are available:
 * <ul>
 *   <li>{@link #get()} - a thread-local Xoroshiro128++ instance, seeded from entropy.
 *       Convenient for the shared default initializers, never reproducible.</li>
 *   <li>{@link #seeded(long)} - a fresh Xoroshiro128++ instance owned by the caller.
 *       The same seed always yields the same sequence.</li>
 * </ul>
 */
public final class FastRandom {
    private FastRandom() {}

    private static final String ALGORITHM = "Xoroshiro128PlusPlus";

    private static final RandomGeneratorFactory<RandomGenerator> FACTORY = RandomGeneratorFactory.of(ALGORITHM);

    // thread-local Xoroshiro128++ instance
    private static final ThreadLocal<RandomGenerator> RNG = ThreadLocal.withInitial(FACTORY::create);

    /** Grab the thread-local PRNG if you need it directly. */
    public static RandomGenerator get() {
        return RNG.get();
    }

    /**
     * Create a new generator with a deterministic sequence for {@code seed}.
     * The returned instance is not thread-safe; keep it confined to one initializer.
     */
    public static RandomGenerator seeded(long seed) {
        return FACTORY.create(seed);
    }
}
