package dev.nabla.net.math.ops;

import dev.nabla.net.math.ShapeMismatchException;

/**
 * Dot product: sum(a[i] * b[i])
 */
public final class DotProduct {

    public static double compute(double[] a, double[] b) {
        if (a.length != b.length)
            throw new ShapeMismatchException("Dot product operands must have same length: " +
                                             "a.length=" + a.length + ", b.length=" + b.length);

        double sum = 0.0;
        for (int i = 0; i < a.length; i++)
            sum += a[i] * b[i];
        return sum;
    }

    private DotProduct() {}
}
