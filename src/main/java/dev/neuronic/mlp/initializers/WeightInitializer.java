package dev.neuronic.mlp.initializers;

/**
 * Produces the initial weight of a single connection.
 *
 * <p>Called once per connection while the builder wires two consecutive layers.
 * {@code fanIn} is the size of the source layer and {@code fanOut} the size of the
 * target layer, so every connection between the same pair of layers sees the
 * same scale.
 *
 * <p>Implementations own their random generator. An instance is not required to be
 * thread-safe; build networks from one thread per initializer.
 */
@FunctionalInterface
public interface WeightInitializer {

    /**
     * @param fanIn number of neurons in the preceding layer
     * @param fanOut number of neurons in the following layer
     * @return the initial weight
     */
    double initialWeight(int fanIn, int fanOut);

    static void checkFans(int fanIn, int fanOut) {
        if (fanIn <= 0 || fanOut <= 0)
            throw new IllegalArgumentException("fanIn and fanOut must be positive, got: " + fanIn + ", " + fanOut);
    }
}
