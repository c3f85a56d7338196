package dev.neuronic.mlp.serialization;

import dev.neuronic.mlp.training.TrainingData;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static dev.neuronic.mlp.serialization.SerializationConstants.FIELD_DELIMITER;
import static dev.neuronic.mlp.serialization.SerializationConstants.VALUE_DELIMITER;

/**
 * Reads training examples written by {@link TrainingDataSerializer}.
 *
 * <p>Blank lines and lines without a {@code ;} are skipped. A third field is read as the
 * reward. Unparseable numbers raise {@link IOException} naming the field and line.
 */
public final class TrainingDataDeserializer {

    private TrainingDataDeserializer() {}

    public static List<TrainingData> deserialize(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        List<TrainingData> examples = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.isBlank())
                continue;

            String[] fields = line.split(FIELD_DELIMITER, -1);
            if (fields.length < 2)
                continue;

            double[] inputs = parseValues(fields[0], "input", lineNumber);
            double[] outputs = parseValues(fields[1], "output", lineNumber);
            Double reward = fields.length > 2 ? parseValue(fields[2], "reward", lineNumber) : null;

            examples.add(new TrainingData(inputs, outputs, reward));
        }
        return examples;
    }

    public static List<TrainingData> deserialize(InputStream in) throws IOException {
        return deserialize(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /**
     * @return the examples in file order, or an empty list when the file does not exist
     */
    public static List<TrainingData> deserialize(Path path) throws IOException {
        if (!Files.exists(path))
            return new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return deserialize(reader);
        }
    }

    private static double[] parseValues(String field, String name, int lineNumber) throws IOException {
        String[] parts = field.split(VALUE_DELIMITER, -1);
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++)
            values[i] = parseValue(parts[i], name, lineNumber);
        return values;
    }

    private static double parseValue(String text, String name, int lineNumber) throws IOException {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IOException("Invalid double value for " + name + " on line " + lineNumber + ": " + text, e);
        }
    }
}
