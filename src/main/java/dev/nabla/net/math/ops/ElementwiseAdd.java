package dev.nabla.net.math.ops;

import dev.nabla.net.math.ShapeMismatchException;

/**
 * Element-wise accumulation: accumulator[i] += term[i]
 */
public final class ElementwiseAdd {

    public static void accumulate(double[] accumulator, double[] term) {
        checkLength(accumulator, term);
        for (int i = 0; i < accumulator.length; i++)
            accumulator[i] += term[i];
    }

    private static void checkLength(double[] a, double[] b) {
        if (a.length != b.length)
            throw new ShapeMismatchException("Arrays must have same length: " +
                                             "a.length=" + a.length + ", b.length=" + b.length);
    }

    private ElementwiseAdd() {}
}
