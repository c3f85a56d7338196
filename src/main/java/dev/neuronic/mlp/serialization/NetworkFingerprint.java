package dev.neuronic.mlp.serialization;

import dev.neuronic.mlp.Connection;
import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.Neuron;
import net.openhft.hashing.LongHashFunction;

import java.util.List;

/**
 * 64-bit XXH3 fingerprint of a network's topology and parameters.
 *
 * <p>Covers the layer sizes plus every bias, previous bias delta, weight and previous
 * weight delta in traversal order, compared by their raw bits. Two networks with the
 * same fingerprint are, for practical purposes, identical; useful for checking round
 * trips and seeded reproducibility without comparing every value.
 */
public final class NetworkFingerprint {

    private NetworkFingerprint() {} // Utility class

    // Shared high-quality hash function
    private static final LongHashFunction HASH_FUNCTION = LongHashFunction.xx3();

    public static long of(NeuralNetwork network) {
        if (network == null)
            throw new IllegalArgumentException("Network must not be null");

        int[] hiddenSizes = network.getHiddenLayerSizes();
        List<Neuron> neurons = network.allNeurons();
        List<Connection> connections = network.allConnections();

        long[] words = new long[3 + hiddenSizes.length + 2 * neurons.size() + 2 * connections.size()];
        int pos = 0;
        words[pos++] = network.getInputCount();
        words[pos++] = network.getOutputCount();
        words[pos++] = hiddenSizes.length;
        for (int size : hiddenSizes)
            words[pos++] = size;
        for (Neuron neuron : neurons) {
            words[pos++] = Double.doubleToLongBits(neuron.getBias());
            words[pos++] = Double.doubleToLongBits(neuron.getPreviousBiasDelta());
        }
        for (Connection connection : connections) {
            words[pos++] = Double.doubleToLongBits(connection.getWeight());
            words[pos++] = Double.doubleToLongBits(connection.getPreviousWeightDelta());
        }

        return HASH_FUNCTION.hashLongs(words);
    }

    /**
     * Fingerprint as a fixed-width hex string, e.g. for logging.
     */
    public static String toHex(NeuralNetwork network) {
        return String.format("%016x", of(network));
    }
}
