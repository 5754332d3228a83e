package dev.nabla.net.math.ops;

import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;

import java.util.Arrays;

/**
 * Transposed weight product: output = Wᵀ·v, ignoring the bias column of the
 * packed {@code [W | b]} matrix.
 */
public final class TransposeMultiply {

    public static void compute(Tensor packed, double[] vector, double[] output) {
        int rows = packed.rows();
        int cols = packed.cols();
        if (vector.length != rows)
            throw new ShapeMismatchException("Vector length must match weight rows: " +
                                             "rows=" + rows + ", vector.length=" + vector.length);
        if (output.length != cols - 1)
            throw new ShapeMismatchException("Output length must match weight columns: " +
                                             "columns=" + (cols - 1) + ", output.length=" + output.length);

        double[] wb = packed.data();
        Arrays.fill(output, 0.0);
        for (int r = 0; r < rows; r++) {
            double v = vector[r];
            int offset = r * cols;
            for (int c = 0; c < output.length; c++)
                output[c] += wb[offset + c] * v;
        }
    }

    private TransposeMultiply() {}
}
