package dev.neuronic.mlp;

import dev.neuronic.mlp.activators.ReluActivator;
import dev.neuronic.mlp.activators.SigmoidActivator;
import dev.neuronic.mlp.activators.TanhActivator;
import dev.neuronic.mlp.initializers.WeightInitializer;
import dev.neuronic.mlp.serialization.NetworkFingerprint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NeuralNetworkBuilderTest {

    /** Hands out 1, 2, 3, ... so tests can see which connection got which weight. */
    private static WeightInitializer counting() {
        double[] next = { 0 };
        return (fanIn, fanOut) -> ++next[0];
    }

    @Test
    void testTopology() {
        NeuralNetwork net = NeuralNetworkBuilder.build(3, 2, 4, 5);

        assertEquals(3, net.getInputCount());
        assertEquals(2, net.getOutputCount());
        assertEquals(2, net.getHiddenLayerCount());
        assertArrayEquals(new int[]{ 4, 5 }, net.getHiddenLayerSizes());
        assertEquals(3 + 4 + 5 + 2, net.getNeuronCount());
        assertEquals(3 * 4 + 4 * 5 + 5 * 2, net.getConnectionCount());

        for (int i = 0; i < 3; i++) {
            assertTrue(net.input(i).isInput());
            assertEquals(0, net.input(i).getInputCount());
            assertEquals(4, net.input(i).getOutputCount());
        }
        for (int n = 0; n < 4; n++) {
            assertEquals(3, net.hidden(0, n).getInputCount());
            assertEquals(5, net.hidden(0, n).getOutputCount());
        }
        for (int n = 0; n < 5; n++) {
            assertEquals(4, net.hidden(1, n).getInputCount());
            assertEquals(2, net.hidden(1, n).getOutputCount());
        }
        for (int o = 0; o < 2; o++) {
            assertTrue(net.output(o).isOutput());
            assertEquals(5, net.output(o).getInputCount());
            assertEquals(0, net.output(o).getOutputCount());
        }
    }

    @Test
    void testPositionalWiring() {
        NeuralNetwork net = NeuralNetwork.newBuilder()
                .inputs(2)
                .hidden(3)
                .outputs(1)
                .weightInit(counting())
                .build();

        // Every connection is the same object from both ends
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 3; j++) {
                Connection c = net.input(i).output(j);
                assertSame(c, net.hidden(0, j).input(i));
                assertSame(net.input(i), c.getInputNode());
                assertSame(net.hidden(0, j), c.getOutputNode());
            }
        }

        // Source-major creation order: input 0 -> hidden 0,1,2 then input 1 -> hidden 0,1,2
        assertEquals(1.0, net.input(0).output(0).getWeight());
        assertEquals(3.0, net.input(0).output(2).getWeight());
        assertEquals(4.0, net.input(1).output(0).getWeight());
        assertEquals(7.0, net.hidden(0, 0).output(0).getWeight());
        assertEquals(9.0, net.hidden(0, 2).output(0).getWeight());
    }

    @Test
    void testAllConnectionsInCreationOrder() {
        NeuralNetwork net = NeuralNetwork.newBuilder()
                .inputs(3)
                .hiddenLayers(2, 2)
                .outputs(2)
                .weightInit(counting())
                .build();

        int expected = 1;
        for (Connection c : net.allConnections())
            assertEquals(expected++, c.getWeight());
        assertEquals(net.getConnectionCount() + 1, expected);
    }

    @Test
    void testNoHiddenLayersWiresInputsToOutputs() {
        NeuralNetwork net = NeuralNetworkBuilder.build(4, 3);

        assertEquals(0, net.getHiddenLayerCount());
        assertEquals(12, net.getConnectionCount());
        assertSame(net.output(2), net.input(3).output(2).getOutputNode());
    }

    @Test
    void testDefaults() {
        NeuralNetwork net = NeuralNetworkBuilder.build(2, 1, 3);

        assertSame(TanhActivator.INSTANCE, net.input(0).getActivator());
        assertSame(TanhActivator.INSTANCE, net.hidden(0, 1).getActivator());
        assertSame(SigmoidActivator.INSTANCE, net.output(0).getActivator());
        for (Neuron neuron : net.allNeurons()) {
            assertEquals(NeuralNetworkBuilder.DEFAULT_INITIAL_BIAS, neuron.getBias());
            assertEquals(0.0, neuron.getPreviousBiasDelta());
        }
        for (Connection c : net.allConnections())
            assertEquals(0.0, c.getPreviousWeightDelta());
    }

    @Test
    void testCustomActivatorsAndBias() {
        NeuralNetwork net = NeuralNetwork.newBuilder()
                .inputs(1)
                .hidden(2)
                .outputs(1)
                .activator(ReluActivator.INSTANCE)
                .outputActivator(TanhActivator.INSTANCE)
                .initialBias(-0.5)
                .build();

        assertSame(ReluActivator.INSTANCE, net.hidden(0, 0).getActivator());
        assertSame(TanhActivator.INSTANCE, net.output(0).getActivator());
        assertEquals(-0.5, net.output(0).getBias());
    }

    @Test
    void testPositionalFactoryNullsFallBackToDefaults() {
        NeuralNetwork net = NeuralNetworkBuilder.build(2, 2, null, null, null, null);

        assertEquals(0, net.getHiddenLayerCount());
        assertSame(SigmoidActivator.INSTANCE, net.output(1).getActivator());
    }

    @Test
    void testSeedIsReproducible() {
        NeuralNetwork a = NeuralNetwork.newBuilder().inputs(3).hidden(4).outputs(2).withSeed(42).build();
        NeuralNetwork b = NeuralNetwork.newBuilder().inputs(3).hidden(4).outputs(2).withSeed(42).build();
        NeuralNetwork c = NeuralNetwork.newBuilder().inputs(3).hidden(4).outputs(2).withSeed(43).build();

        assertEquals(NetworkFingerprint.of(a), NetworkFingerprint.of(b));
        assertNotEquals(NetworkFingerprint.of(a), NetworkFingerprint.of(c));
    }

    @Test
    void testStrategySelection() {
        NeuralNetwork net = NeuralNetwork.newBuilder()
                .inputs(5)
                .hidden(5)
                .outputs(5)
                .weightInit(WeightInitStrategy.NARROW_RANDOM)
                .withSeed(1)
                .build();

        for (Connection c : net.allConnections())
            assertTrue(c.getWeight() >= 0.49 && c.getWeight() < 0.51);
    }

    @Test
    void testHiddenLayersReplacesAndHiddenAppends() {
        NeuralNetwork net = NeuralNetwork.newBuilder()
                .inputs(1)
                .hidden(9)
                .hiddenLayers(2, 3)
                .hidden(4)
                .outputs(1)
                .build();

        assertArrayEquals(new int[]{ 2, 3, 4 }, net.getHiddenLayerSizes());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> NeuralNetwork.newBuilder().inputs(0));
        assertThrows(IllegalArgumentException.class, () -> NeuralNetwork.newBuilder().outputs(-1));
        assertThrows(IllegalArgumentException.class, () -> NeuralNetwork.newBuilder().hidden(0));
        assertThrows(IllegalArgumentException.class, () -> NeuralNetwork.newBuilder().hiddenLayers(3, 0));
        assertThrows(IllegalArgumentException.class, () -> NeuralNetwork.newBuilder().activator(null));
        assertThrows(IllegalArgumentException.class, () -> NeuralNetwork.newBuilder().initialBias(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> NeuralNetworkBuilder.build(0, 1));

        assertThrows(IllegalStateException.class, () -> NeuralNetwork.newBuilder().outputs(1).build());
        assertThrows(IllegalStateException.class, () -> NeuralNetwork.newBuilder().inputs(1).build());
    }
}
