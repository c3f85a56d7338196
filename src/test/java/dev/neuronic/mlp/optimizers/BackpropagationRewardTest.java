package dev.neuronic.mlp.optimizers;

import dev.neuronic.mlp.Connection;
import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.activators.Activator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackpropagationRewardTest {

    private static final double LEARNING_RATE = 0.1;
    private static final double INITIAL_WEIGHT = 0.5;

    /** Output is pinned at 0.6 with derivative 0.5, so the unscaled gradient is 0.5 * (1.0 - 0.6) = 0.2. */
    private static final Activator FIXED = new Activator() {
        @Override
        public double activate(double x) {
            return 0.6;
        }

        @Override
        public double derivative(double output) {
            return 0.5;
        }

        @Override
        public String name() {
            return "fixed";
        }
    };

    private NeuralNetwork net;
    private Connection connection;

    private void backpropagate(double reward) {
        net = NeuralNetwork.newBuilder()
                .inputs(1)
                .outputs(1)
                .outputActivator(FIXED)
                .weightInit((fanIn, fanOut) -> INITIAL_WEIGHT)
                .build();
        connection = net.input(0).output(0);

        net.fire(1.0);
        new Backpropagation(LEARNING_RATE, 0.0).backpropagate(net, reward, new double[]{ 1.0 });
    }

    @Test
    void testStandardReward() {
        backpropagate(1.0);
        assertEquals(0.2, net.output(0).getGradient(), 1e-12);
        assertEquals(0.02, connection.getPreviousWeightDelta(), 1e-12);
        assertEquals(INITIAL_WEIGHT + 0.02, connection.getWeight(), 1e-12);
    }

    @Test
    void testPositiveRewardScalesGradient() {
        backpropagate(5.0);
        assertEquals(1.0, net.output(0).getGradient(), 1e-12);
        assertEquals(0.1, connection.getPreviousWeightDelta(), 1e-12);
        assertEquals(INITIAL_WEIGHT + 0.1, connection.getWeight(), 1e-12);
    }

    @Test
    void testNegativeRewardInvertsUpdate() {
        backpropagate(-2.0);
        assertEquals(-0.4, net.output(0).getGradient(), 1e-12);
        assertEquals(-0.04, connection.getPreviousWeightDelta(), 1e-12);
        assertEquals(INITIAL_WEIGHT - 0.04, connection.getWeight(), 1e-12);
    }

    @Test
    void testZeroRewardLeavesParametersUnchanged() {
        backpropagate(0.0);
        assertEquals(0.0, net.output(0).getGradient());
        assertEquals(INITIAL_WEIGHT, connection.getWeight());
        assertEquals(0.01, net.output(0).getBias());
    }

    @Test
    void testNegativeRewardInvertsEveryDelta() {
        NeuralNetwork positive = NeuralNetwork.newBuilder().inputs(2).hidden(3).outputs(2).withSeed(13).build();
        NeuralNetwork negative = NeuralNetwork.newBuilder().inputs(2).hidden(3).outputs(2).withSeed(13).build();
        Backpropagation bp = new Backpropagation(0.2, 0.0);

        bp.train(positive, new double[]{ 0.4, -0.6 }, 1.0, new double[]{ 1.0, 0.2 });
        bp.train(negative, new double[]{ 0.4, -0.6 }, -1.0, new double[]{ 1.0, 0.2 });

        for (int i = 0; i < positive.getConnectionCount(); i++) {
            double delta = positive.allConnections().get(i).getPreviousWeightDelta();
            assertEquals(-delta, negative.allConnections().get(i).getPreviousWeightDelta(), 1e-15);
        }
        for (int i = 0; i < positive.getNeuronCount(); i++) {
            double delta = positive.allNeurons().get(i).getPreviousBiasDelta();
            assertEquals(-delta, negative.allNeurons().get(i).getPreviousBiasDelta(), 1e-15);
        }
    }

    @Test
    void testDefaultOverloadUsesRewardOne() {
        NeuralNetwork a = NeuralNetwork.newBuilder().inputs(2).hidden(2).outputs(1).withSeed(9).build();
        NeuralNetwork b = NeuralNetwork.newBuilder().inputs(2).hidden(2).outputs(1).withSeed(9).build();
        Backpropagation bp = new Backpropagation(0.2, 0.1);

        bp.train(a, new double[]{ 0.3, 0.4 }, new double[]{ 1.0 });
        bp.train(b, new double[]{ 0.3, 0.4 }, 1.0, new double[]{ 1.0 });

        assertEquals(a.input(1).output(1).getWeight(), b.input(1).output(1).getWeight());
        assertEquals(a.output(0).getBias(), b.output(0).getBias());
    }
}
