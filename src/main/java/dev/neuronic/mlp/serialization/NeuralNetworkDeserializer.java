package dev.neuronic.mlp.serialization;

import dev.neuronic.mlp.Connection;
import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.NeuralNetworkBuilder;
import dev.neuronic.mlp.Neuron;
import dev.neuronic.mlp.WeightInitStrategy;
import dev.neuronic.mlp.activators.Activator;
import dev.neuronic.mlp.activators.SigmoidActivator;
import dev.neuronic.mlp.activators.TanhActivator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dev.neuronic.mlp.serialization.SerializationConstants.NETWORK_LINE_COUNT;
import static dev.neuronic.mlp.serialization.SerializationConstants.VALUE_DELIMITER;

/**
 * Reads the text written by {@link NeuralNetworkSerializer}.
 *
 * <p>The topology is rebuilt first and the stored parameters are then assigned in
 * traversal order. Since activators are not part of the format, callers pass the ones the
 * network was trained with; the no-activator overloads use the builder defaults
 * (tanh hidden, sigmoid output).
 *
 * <p>Malformed numbers, missing lines, invalid topologies and value counts that do not
 * match the rebuilt topology all raise {@link IOException}.
 */
public final class NeuralNetworkDeserializer {

    private NeuralNetworkDeserializer() {}

    public static NeuralNetwork deserialize(Reader reader) throws IOException {
        return deserialize(reader, TanhActivator.INSTANCE, SigmoidActivator.INSTANCE);
    }

    public static NeuralNetwork deserialize(Reader reader, Activator activator, Activator outputActivator)
            throws IOException {
        if (activator == null || outputActivator == null)
            throw new IllegalArgumentException("Activators must not be null");

        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        String[] lines = new String[NETWORK_LINE_COUNT];
        for (int i = 0; i < NETWORK_LINE_COUNT; i++) {
            lines[i] = in.readLine();
            if (lines[i] == null)
                throw new IOException("Invalid file format: expected " + NETWORK_LINE_COUNT + " lines, got " + i);
        }

        int[] counts = parseInts(lines[0], "counts");
        if (counts.length != 2)
            throw new IOException("Invalid file format: expected input and output counts, got " + counts.length + " values");
        int[] hiddenSizes = parseInts(lines[1], "hidden layer sizes");

        NeuralNetwork network;
        try {
            network = new NeuralNetworkBuilder()
                    .inputs(counts[0])
                    .outputs(counts[1])
                    .hiddenLayers(hiddenSizes)
                    .activator(activator)
                    .outputActivator(outputActivator)
                    .weightInit(WeightInitStrategy.NARROW_RANDOM)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid network topology: " + e.getMessage(), e);
        }

        double[] biases = parseDoubles(lines[2], "biases", network.getNeuronCount());
        double[] biasDeltas = parseDoubles(lines[3], "previous bias deltas", network.getNeuronCount());
        double[] weights = parseDoubles(lines[4], "weights", network.getConnectionCount());
        double[] weightDeltas = parseDoubles(lines[5], "previous weight deltas", network.getConnectionCount());

        List<Neuron> neurons = network.allNeurons();
        for (int i = 0; i < biases.length; i++) {
            Neuron neuron = neurons.get(i);
            neuron.setBias(biases[i]);
            neuron.setPreviousBiasDelta(biasDeltas[i]);
        }

        List<Connection> connections = network.allConnections();
        for (int i = 0; i < weights.length; i++) {
            Connection connection = connections.get(i);
            connection.setWeight(weights[i]);
            connection.setPreviousWeightDelta(weightDeltas[i]);
        }

        return network;
    }

    public static NeuralNetwork deserialize(InputStream in) throws IOException {
        return deserialize(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public static NeuralNetwork deserialize(InputStream in, Activator activator, Activator outputActivator)
            throws IOException {
        return deserialize(new InputStreamReader(in, StandardCharsets.UTF_8), activator, outputActivator);
    }

    public static NeuralNetwork deserialize(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return deserialize(reader);
        }
    }

    public static NeuralNetwork deserialize(Path path, Activator activator, Activator outputActivator)
            throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return deserialize(reader, activator, outputActivator);
        }
    }

    public static NeuralNetwork fromString(String text) throws IOException {
        return deserialize(new StringReader(text));
    }

    private static int[] parseInts(String line, String field) throws IOException {
        String trimmed = line.trim();
        if (trimmed.isEmpty())
            return new int[0];

        String[] parts = trimmed.split(VALUE_DELIMITER, -1);
        int[] values = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid integer value for " + field + ": " + parts[i], e);
            }
        }
        return values;
    }

    private static double[] parseDoubles(String line, String field, int expectedCount) throws IOException {
        String trimmed = line.trim();
        String[] parts = trimmed.isEmpty() ? new String[0] : trimmed.split(VALUE_DELIMITER, -1);
        if (parts.length != expectedCount)
            throw new IOException("Invalid value count for " + field + ": expected " + expectedCount + ", got " + parts.length);

        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid double value for " + field + ": " + parts[i], e);
            }
        }
        return values;
    }
}
