package dev.neuronic.mlp.training;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrainingDataTest {

    @Test
    void testVectorsAreCopied() {
        double[] inputs = { 1, 2 };
        double[] outputs = { 3 };
        TrainingData data = new TrainingData(inputs, outputs);

        inputs[0] = 99;
        outputs[0] = 99;
        assertArrayEquals(new double[]{ 1, 2 }, data.getInputs());
        assertArrayEquals(new double[]{ 3 }, data.getOutputs());

        data.getInputs()[1] = 42;
        assertEquals(2.0, data.getInput(1));
    }

    @Test
    void testRewardDefaultsToOne() {
        TrainingData data = new TrainingData(new double[]{ 0 }, 1);

        assertFalse(data.hasReward());
        assertTrue(data.getReward().isEmpty());
        assertEquals(1.0, data.rewardOrDefault());
    }

    @Test
    void testRewardIsMutable() {
        TrainingData data = new TrainingData(new double[]{ 0 }, new double[]{ 1 }, -0.5);
        assertTrue(data.hasReward());
        assertEquals(-0.5, data.rewardOrDefault());

        data.setReward(3.0);
        assertEquals(3.0, data.getReward().getAsDouble());

        data.setReward(null);
        assertFalse(data.hasReward());
        assertEquals(1.0, data.rewardOrDefault());
    }

    @Test
    void testEqualsAndHashCode() {
        TrainingData a = new TrainingData(new double[]{ 1, 2 }, new double[]{ 3 }, 0.5);
        TrainingData b = new TrainingData(new double[]{ 1, 2 }, new double[]{ 3 }, 0.5);
        TrainingData noReward = new TrainingData(new double[]{ 1, 2 }, 3);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, noReward);
    }

    @Test
    void testRejectsNullVectors() {
        assertThrows(IllegalArgumentException.class, () -> new TrainingData(null, 1));
        assertThrows(IllegalArgumentException.class, () -> new TrainingData(new double[]{ 1 }, (double[]) null));
    }
}
