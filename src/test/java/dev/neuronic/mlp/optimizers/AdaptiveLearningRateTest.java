package dev.neuronic.mlp.optimizers;

import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.serialization.NetworkFingerprint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveLearningRateTest {

    private static NeuralNetwork network() {
        return NeuralNetwork.newBuilder().inputs(2).hidden(3).outputs(2).withSeed(21).build();
    }

    @Test
    void testDisabledMatchesFixedRateExactly() {
        NeuralNetwork fixed = network();
        NeuralNetwork adaptiveOff = network();
        Backpropagation plain = new Backpropagation(0.3, 0.2);
        Backpropagation off = new Backpropagation(0.3, 0.2, false);

        for (int i = 0; i < 25; i++) {
            plain.train(fixed, new double[]{ 0.1, 0.9 }, new double[]{ 1.0, 0.0 });
            off.train(adaptiveOff, new double[]{ 0.1, 0.9 }, new double[]{ 1.0, 0.0 });
        }

        assertEquals(NetworkFingerprint.of(fixed), NetworkFingerprint.of(adaptiveOff));
        assertEquals(0.3, off.effectiveLearningRate(adaptiveOff));
    }

    @Test
    void testEnabledTakesLargerSteps() {
        NeuralNetwork fixed = network();
        NeuralNetwork adaptive = network();

        new Backpropagation(0.3, 0.0, false).train(fixed, new double[]{ 0.1, 0.9 }, new double[]{ 1.0, 0.0 });
        new Backpropagation(0.3, 0.0, true).train(adaptive, new double[]{ 0.1, 0.9 }, new double[]{ 1.0, 0.0 });

        // Same forward pass, so the gradients match and only the rate differs
        assertEquals(fixed.output(0).getGradient(), adaptive.output(0).getGradient(), 1e-15);
        double fixedDelta = fixed.input(0).output(0).getPreviousWeightDelta();
        double adaptiveDelta = adaptive.input(0).output(0).getPreviousWeightDelta();
        assertNotEquals(0.0, fixedDelta);
        assertTrue(Math.abs(adaptiveDelta) > Math.abs(fixedDelta));
        assertEquals(Math.signum(fixedDelta), Math.signum(adaptiveDelta));
    }

    @Test
    void testRateIsBoundedAndFollowsFormula() {
        NeuralNetwork net = network();
        Backpropagation bp = new Backpropagation(0.4, 0.0, true);

        net.output(0).setGradient(0.3);
        net.output(1).setGradient(-0.4);
        double rms = Math.sqrt((0.09 + 0.16) / 2);
        assertEquals(0.4 * (1 + Math.tanh(rms)), bp.effectiveLearningRate(net), 1e-15);

        net.output(0).setGradient(1e6);
        double rate = bp.effectiveLearningRate(net);
        assertTrue(rate > 0.4 && rate <= 0.8, "Rate should stay in (lr, 2 * lr]: " + rate);

        net.output(0).setGradient(0.0);
        net.output(1).setGradient(0.0);
        assertEquals(0.4, bp.effectiveLearningRate(net), "Zero error leaves the base rate");
    }

    @Test
    void testToggleAtRuntime() {
        Backpropagation bp = new Backpropagation(0.1, 0.0);
        assertFalse(bp.isAdaptiveLearningRate());
        bp.setAdaptiveLearningRate(true);
        assertTrue(bp.isAdaptiveLearningRate());
    }
}
