package dev.neuronic.mlp.serialization;

/**
 * Constants for the text network and training data formats.
 */
public final class SerializationConstants {

    // Network text format: one field per line, values separated by VALUE_DELIMITER
    public static final int NETWORK_LINE_COUNT = 6;
    public static final String VALUE_DELIMITER = ",";
    public static final String LINE_SEPARATOR = "\n";

    // Training data format: inputs;outputs[;reward]
    public static final String FIELD_DELIMITER = ";";

    // Model files whose name ends with this suffix are Zstandard-compressed
    public static final String COMPRESSED_SUFFIX = ".zst";

    // Compression level: 1=fast, 22=max compression, 3=good balance
    public static final int COMPRESSION_LEVEL = 3;

    private SerializationConstants() {} // Prevent instantiation
}
