package dev.neuronic.mlp;

/**
 * Thrown when an input or target vector does not match the size of the layer it feeds.
 *
 * <p>Vectors are never truncated or padded; the call fails before any neuron is touched.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    private final String what;
    private final int expected;
    private final int actual;

    public ShapeMismatchException(String what, int expected, int actual) {
        super(String.format("%s length mismatch: expected %d values, got %d", what, expected, actual));
        this.what = what;
        this.expected = expected;
        this.actual = actual;
    }

    static void check(String what, int expected, double[] values) {
        if (values == null)
            throw new IllegalArgumentException(what + " must not be null");
        if (values.length != expected)
            throw new ShapeMismatchException(what, expected, values.length);
    }

    /**
     * @return which vector was rejected, e.g. "Input" or "Expected output"
     */
    public String getWhat() {
        return what;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
