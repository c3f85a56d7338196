package dev.neuronic.mlp.serialization;

import dev.neuronic.mlp.training.TrainingData;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static dev.neuronic.mlp.serialization.SerializationConstants.FIELD_DELIMITER;
import static dev.neuronic.mlp.serialization.SerializationConstants.LINE_SEPARATOR;
import static dev.neuronic.mlp.serialization.SerializationConstants.VALUE_DELIMITER;

/**
 * Writes training examples one per line as {@code in1,in2;out1[;reward]}.
 * The reward field is present only when the example carries one.
 */
public final class TrainingDataSerializer {

    private TrainingDataSerializer() {}

    public static void serialize(Iterable<TrainingData> examples, Writer writer) throws IOException {
        if (examples == null)
            throw new IllegalArgumentException("Training data must not be null");

        for (TrainingData example : examples) {
            writer.write(toLine(example));
            writer.write(LINE_SEPARATOR);
        }
        writer.flush();
    }

    /**
     * Write UTF-8 text to {@code out}. The stream is flushed but left open.
     */
    public static void serialize(Iterable<TrainingData> examples, OutputStream out) throws IOException {
        serialize(examples, new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
    }

    /**
     * Write to {@code path}, replacing any existing file.
     */
    public static void serialize(Iterable<TrainingData> examples, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            serialize(examples, writer);
        }
    }

    public static String toLine(TrainingData example) {
        StringBuilder line = new StringBuilder();
        appendValues(line, example.getInputs());
        line.append(FIELD_DELIMITER);
        appendValues(line, example.getOutputs());
        if (example.hasReward())
            line.append(FIELD_DELIMITER).append(example.rewardOrDefault());
        return line.toString();
    }

    private static void appendValues(StringBuilder line, double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (i > 0) line.append(VALUE_DELIMITER);
            line.append(values[i]);
        }
    }
}
