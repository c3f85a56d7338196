package dev.neuronic.mlp.serialization;

import dev.neuronic.mlp.training.TrainingData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingDataSerializerTest {

    @TempDir
    Path tempDir;

    @Test
    void testLineFormat() {
        assertEquals("0.1,0.2;1.0", TrainingDataSerializer.toLine(new TrainingData(new double[]{ 0.1, 0.2 }, 1.0)));
        assertEquals("0.0;1.0,0.0;-2.5",
                TrainingDataSerializer.toLine(new TrainingData(new double[]{ 0 }, new double[]{ 1, 0 }, -2.5)));
    }

    @Test
    void testRoundTripWithAndWithoutReward() throws IOException {
        List<TrainingData> examples = List.of(
                new TrainingData(new double[]{ 0.1, 0.2 }, 1.0),
                new TrainingData(new double[]{ 0.3, 0.4 }, new double[]{ 0.0, 0.5 }, 2.0));

        StringWriter writer = new StringWriter();
        TrainingDataSerializer.serialize(examples, writer);
        List<TrainingData> restored = TrainingDataDeserializer.deserialize(new StringReader(writer.toString()));

        assertEquals(examples, restored);
        assertFalse(restored.get(0).hasReward());
        assertEquals(2.0, restored.get(1).rewardOrDefault());
    }

    @Test
    void testFileRoundTrip() throws IOException {
        List<TrainingData> examples = List.of(new TrainingData(new double[]{ 1, 1 }, 0));
        Path file = tempDir.resolve("data.txt");

        TrainingDataSerializer.serialize(examples, file);

        assertEquals(examples, TrainingDataDeserializer.deserialize(file));
    }

    @Test
    void testStreamRoundTrip() throws IOException {
        List<TrainingData> examples = List.of(new TrainingData(new double[]{ 0.25 }, new double[]{ 0.75 }, 0.5));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TrainingDataSerializer.serialize(examples, out);

        assertEquals(examples, TrainingDataDeserializer.deserialize(new ByteArrayInputStream(out.toByteArray())));
    }

    @Test
    void testSkipsBlankAndIncompleteLines() throws IOException {
        String text = "\n0,1;1\n   \njust-a-comment\n1,1;0;3\n";

        List<TrainingData> examples = TrainingDataDeserializer.deserialize(
                new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, examples.size());
        assertArrayEquals(new double[]{ 0, 1 }, examples.get(0).getInputs());
        assertEquals(3.0, examples.get(1).rewardOrDefault());
    }

    @Test
    void testMissingFileGivesEmptyList() throws IOException {
        assertTrue(TrainingDataDeserializer.deserialize(tempDir.resolve("missing.txt")).isEmpty());
    }

    @Test
    void testMalformedNumber() {
        IOException e = assertThrows(IOException.class,
                () -> TrainingDataDeserializer.deserialize(new StringReader("0,1;1\n0,x;1\n")));
        assertTrue(e.getMessage().contains("input"), e.getMessage());
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());

        assertThrows(IOException.class, () -> TrainingDataDeserializer.deserialize(new StringReader("0;1;big")));
    }
}
