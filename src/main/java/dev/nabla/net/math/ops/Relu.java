package dev.nabla.net.math.ops;

import dev.nabla.net.math.ShapeMismatchException;

/**
 * Rectifier and its gradient mask.
 */
public final class Relu {

    /**
     * output[i] = max(0, input[i]). NaN stays NaN. Safe to call with {@code input == output}.
     */
    public static void compute(double[] input, double[] output) {
        checkLength(input, output);
        for (int i = 0; i < input.length; i++)
            output[i] = Math.max(0.0, input[i]);
    }

    /**
     * Zero the upstream gradient wherever the rectified output is exactly zero:
     * output[i] = activations[i] == 0 ? 0 : upstream[i].
     * An exact zero is treated as inactive.
     */
    public static void mask(double[] activations, double[] upstream, double[] output) {
        checkLength(activations, upstream);
        checkLength(activations, output);
        for (int i = 0; i < activations.length; i++)
            output[i] = activations[i] == 0.0 ? 0.0 : upstream[i];
    }

    private static void checkLength(double[] a, double[] b) {
        if (a.length != b.length)
            throw new ShapeMismatchException("Arrays must have same length: " +
                                             "a.length=" + a.length + ", b.length=" + b.length);
    }

    private Relu() {}
}
