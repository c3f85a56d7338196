package dev.neuronic.mlp.math;

/**
 * Small scalar helpers shared by the training code.
 * Methods are prefixed by operation type for intuitive autocomplete.
 */
public final class NetMath {

    private NetMath() {}

    // ========== ERROR METRICS ==========

    /**
     * Largest absolute difference between paired entries: max_i |actual[i] - expected[i]|.
     * NaN in either array yields NaN.
     */
    public static double errorMaxAbsolute(double[] actual, double[] expected) {
        checkLength(actual, expected);

        double max = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double error = Math.abs(actual[i] - expected[i]);
            if (Double.isNaN(error))
                return Double.NaN;
            if (error > max)
                max = error;
        }
        return max;
    }

    /**
     * Mean squared error over paired entries.
     */
    public static double errorMeanSquared(double[] actual, double[] expected) {
        checkLength(actual, expected);
        if (actual.length == 0)
            return 0.0;

        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double diff = actual[i] - expected[i];
            sum += diff * diff;
        }
        return sum / actual.length;
    }

    // ========== NORMS ==========

    /**
     * Root mean square: sqrt(sum(v²) / n). Returns 0 for an empty array.
     */
    public static double normRms(double[] values) {
        if (values.length == 0)
            return 0.0;

        double sum = 0.0;
        for (double v : values)
            sum += v * v;
        return Math.sqrt(sum / values.length);
    }

    private static void checkLength(double[] a, double[] b) {
        if (a.length != b.length)
            throw new IllegalArgumentException("Arrays must have the same length: " + a.length + " vs " + b.length);
    }
}
