package dev.neuronic.mlp.serialization;

import dev.neuronic.mlp.Connection;
import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.Neuron;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.ToDoubleFunction;

import static dev.neuronic.mlp.serialization.SerializationConstants.LINE_SEPARATOR;
import static dev.neuronic.mlp.serialization.SerializationConstants.VALUE_DELIMITER;

/**
 * Writes a network's topology and parameters as six lines of text:
 * <ol>
 *   <li>{@code inputCount,outputCount}</li>
 *   <li>hidden layer sizes, empty when there are none</li>
 *   <li>biases in {@link NeuralNetwork#allNeurons()} order</li>
 *   <li>previous bias deltas, same order</li>
 *   <li>weights in {@link NeuralNetwork#allConnections()} order</li>
 *   <li>previous weight deltas, same order</li>
 * </ol>
 * Numbers use {@link Double#toString(double)}, so the output is locale independent and
 * reads back bit-exact. Activators are not recorded.
 */
public final class NeuralNetworkSerializer {

    private NeuralNetworkSerializer() {}

    public static void serialize(NeuralNetwork network, Writer writer) throws IOException {
        if (network == null)
            throw new IllegalArgumentException("Network must not be null");

        writer.write(network.getInputCount() + VALUE_DELIMITER + network.getOutputCount());
        writer.write(LINE_SEPARATOR);

        int[] hiddenSizes = network.getHiddenLayerSizes();
        for (int i = 0; i < hiddenSizes.length; i++) {
            if (i > 0) writer.write(VALUE_DELIMITER);
            writer.write(Integer.toString(hiddenSizes[i]));
        }
        writer.write(LINE_SEPARATOR);

        List<Neuron> neurons = network.allNeurons();
        writeLine(writer, neurons, Neuron::getBias);
        writeLine(writer, neurons, Neuron::getPreviousBiasDelta);

        List<Connection> connections = network.allConnections();
        writeLine(writer, connections, Connection::getWeight);
        writeLine(writer, connections, Connection::getPreviousWeightDelta);

        writer.flush();
    }

    /**
     * Write UTF-8 text to {@code out}. The stream is flushed but left open.
     */
    public static void serialize(NeuralNetwork network, OutputStream out) throws IOException {
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        serialize(network, writer);
    }

    public static void serialize(NeuralNetwork network, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            serialize(network, writer);
        }
    }

    public static String serializeToString(NeuralNetwork network) {
        StringWriter writer = new StringWriter();
        try {
            serialize(network, writer);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new IllegalStateException(e);
        }
        return writer.toString();
    }

    private static <T> void writeLine(Writer writer, List<T> items, ToDoubleFunction<T> value) throws IOException {
        for (int i = 0, n = items.size(); i < n; i++) {
            if (i > 0) writer.write(VALUE_DELIMITER);
            writer.write(Double.toString(value.applyAsDouble(items.get(i))));
        }
        writer.write(LINE_SEPARATOR);
    }
}
