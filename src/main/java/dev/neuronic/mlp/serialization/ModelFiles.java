package dev.neuronic.mlp.serialization;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.activators.Activator;
import dev.neuronic.mlp.activators.SigmoidActivator;
import dev.neuronic.mlp.activators.TanhActivator;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

import static dev.neuronic.mlp.serialization.SerializationConstants.COMPRESSED_SUFFIX;
import static dev.neuronic.mlp.serialization.SerializationConstants.COMPRESSION_LEVEL;

/**
 * Saves and loads networks as files in the text format of {@link NeuralNetworkSerializer}.
 *
 * Features:
 * - Files named {@code *.zst} are Zstandard-compressed
 * - Streaming I/O with 64 KiB buffers
 * - Any other name is written as plain UTF-8 text
 */
public final class ModelFiles {

    private static final int BUFFER_SIZE = 64 * 1024;

    private ModelFiles() {}

    /**
     * Save a network, compressing when the file name ends with {@code .zst}.
     *
     * @param network the network to save
     * @param filePath path to save the network to; an existing file is replaced
     * @throws IOException if saving fails
     */
    public static void save(NeuralNetwork network, Path filePath) throws IOException {
        try (FileOutputStream fileOut = new FileOutputStream(filePath.toFile());
             BufferedOutputStream buffered = new BufferedOutputStream(fileOut, BUFFER_SIZE);
             OutputStream out = isCompressed(filePath) ? new ZstdOutputStream(buffered, COMPRESSION_LEVEL) : buffered) {

            NeuralNetworkSerializer.serialize(network, out);
        }
    }

    /**
     * Load a network saved with tanh hidden and sigmoid output activators.
     */
    public static NeuralNetwork load(Path filePath) throws IOException {
        return load(filePath, TanhActivator.INSTANCE, SigmoidActivator.INSTANCE);
    }

    /**
     * Load a network, decompressing when the file name ends with {@code .zst}.
     *
     * @throws IOException if the file cannot be read or is not a valid network
     */
    public static NeuralNetwork load(Path filePath, Activator activator, Activator outputActivator) throws IOException {
        try (FileInputStream fileIn = new FileInputStream(filePath.toFile());
             BufferedInputStream buffered = new BufferedInputStream(fileIn, BUFFER_SIZE);
             InputStream in = isCompressed(filePath) ? new ZstdInputStream(buffered) : buffered) {

            return NeuralNetworkDeserializer.deserialize(in, activator, outputActivator);
        }
    }

    public static boolean isCompressed(Path filePath) {
        Path name = filePath.getFileName();
        return name != null && name.toString().endsWith(COMPRESSED_SUFFIX);
    }
}
