package dev.neuronic.examples;

import dev.neuronic.mlp.NeuralNetwork;
import dev.neuronic.mlp.optimizers.Backpropagation;
import dev.neuronic.mlp.training.Trainer;
import dev.neuronic.mlp.training.TrainingData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Learns x + y for x, y in 1..10 from normalized inputs, holding out 10% of the pairs
 * to check generalization.
 */
public class AdditionExample {

    private static final int MAX_INPUT = 10;
    private static final double MAX_TOTAL = 2.0 * MAX_INPUT;

    public static void main(String[] args) {
        Random random = new Random(7);

        List<int[]> pairs = new ArrayList<>();
        for (int x = 1; x <= MAX_INPUT; x++)
            for (int y = 1; y <= MAX_INPUT; y++)
                pairs.add(new int[]{ x, y });
        Collections.shuffle(pairs, random);

        int validationSize = pairs.size() / 10;
        List<int[]> validation = pairs.subList(0, validationSize);
        List<int[]> training = pairs.subList(validationSize, pairs.size());

        NeuralNetwork net = NeuralNetwork.newBuilder()
                .inputs(2)
                .hidden(3)
                .outputs(1)
                .withSeed(7)
                .build();

        Trainer<String> trainer = new Trainer<>(new Backpropagation(1.1, 0.9),
                Trainer.Config.builder().verbosity(1).build());
        for (int[] pair : training)
            trainer.addOrUpdateData(pair[0] + "+" + pair[1], example(pair));

        boolean converged = trainer.retrain(net, 0.002, 1_000_000);
        System.out.printf("Converged: %s after %d iterations, training MSE %.6f%n",
                converged, trainer.getLastIterationCount(), trainer.meanSquaredError(net));

        int correct = 0;
        for (int[] pair : validation) {
            long predicted = Math.round(net.predict(normalize(pair))[0] * MAX_TOTAL);
            int expected = pair[0] + pair[1];
            if (predicted == expected) correct++;
            System.out.printf("%2d + %2d = %2d (expected %2d)%n", pair[0], pair[1], predicted, expected);
        }
        System.out.printf("Validation accuracy: %d/%d%n", correct, validation.size());
    }

    private static TrainingData example(int[] pair) {
        return new TrainingData(normalize(pair), (pair[0] + pair[1]) / MAX_TOTAL);
    }

    private static double[] normalize(int[] pair) {
        return new double[]{ pair[0] / (double) MAX_INPUT, pair[1] / (double) MAX_INPUT };
    }
}
