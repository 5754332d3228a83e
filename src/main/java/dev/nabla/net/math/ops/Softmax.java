package dev.nabla.net.math.ops;

import dev.nabla.net.math.ShapeMismatchException;

/**
 * Numerically stable softmax and its vector-Jacobian product.
 *
 * <p>Both directions work on v = exp(x - max(x)) and s = sum(v), so large
 * logits never overflow.
 */
public final class Softmax {

    /**
     * output[i] = exp(x[i] - max(x)) / sum(exp(x[j] - max(x)))
     */
    public static void compute(double[] input, double[] output) {
        checkLength(input, output);
        if (input.length == 0)
            return;

        double max = Max.compute(input);
        double sum = 0.0;
        for (int i = 0; i < input.length; i++) {
            output[i] = Math.exp(input[i] - max);
            sum += output[i];
        }
        for (int i = 0; i < input.length; i++)
            output[i] /= sum;
    }

    /**
     * Gradient w.r.t. the softmax input without forming the Jacobian:
     * dJdx = -(dJdy·v / s²)·v + (dJdy ⊙ v) / s
     *
     * @param input the forward-pass input x
     * @param upstream dJdy
     * @param output receives dJdx
     */
    public static void vectorJacobianProduct(double[] input, double[] upstream, double[] output) {
        checkLength(input, upstream);
        checkLength(input, output);
        if (input.length == 0)
            return;

        double max = Max.compute(input);
        double[] v = new double[input.length];
        double s = 0.0;
        for (int i = 0; i < input.length; i++) {
            v[i] = Math.exp(input[i] - max);
            s += v[i];
        }

        double projection = DotProduct.compute(upstream, v) / (s * s);
        for (int i = 0; i < input.length; i++)
            output[i] = -projection * v[i] + upstream[i] * v[i] / s;
    }

    private static void checkLength(double[] a, double[] b) {
        if (a.length != b.length)
            throw new ShapeMismatchException("Arrays must have same length: " +
                                             "a.length=" + a.length + ", b.length=" + b.length);
    }

    private Softmax() {}
}
