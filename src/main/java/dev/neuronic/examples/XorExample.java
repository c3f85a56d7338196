package dev.neuronic.examples;

import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.optimizers.Backpropagation;
import dev.neuronic.mlp.serialization.NetworkFingerprint;
import dev.neuronic.mlp.training.Trainer;
import dev.neuronic.mlp.training.TrainingData;

public class XorExample {

    public static void main(String[] args) {
        NeuralNetwork net = NeuralNetwork.newBuilder()
                .inputs(2)
                .hidden(3)
                .outputs(1)
                .withSeed(42)
                .build();

        Backpropagation algorithm = Backpropagation.builder()
                .learningRate(0.2)
                .momentum(0.1)
                .build();

        Trainer<String> trainer = new Trainer<>(algorithm, Trainer.Config.builder().verbosity(1).build());
        trainer.addOrUpdateData("0 xor 0", new TrainingData(new double[]{ 0, 0 }, 0));
        trainer.addOrUpdateData("0 xor 1", new TrainingData(new double[]{ 0, 1 }, 1));
        trainer.addOrUpdateData("1 xor 0", new TrainingData(new double[]{ 1, 0 }, 1));
        trainer.addOrUpdateData("1 xor 1", new TrainingData(new double[]{ 1, 1 }, 0));

        boolean converged = trainer.retrain(net, 0.05, 40_000);
        System.out.printf("Converged: %s after %d iterations, fingerprint %s%n",
                converged, trainer.getLastIterationCount(), NetworkFingerprint.toHex(net));

        trainer.getTrainingData().forEach((name, data) ->
                System.out.printf("%s = %.4f%n", name, net.predict(data.getInputs())[0]));
    }

}
