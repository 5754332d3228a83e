package dev.nabla.net.math.ops;

import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;

/**
 * Parameter gradient of an affine map in the packed {@code [dW | db]} layout:
 * dW = delta ⊗ input (outer product) and db = delta.
 */
public final class PackedWeightGradients {

    public static void compute(double[] delta, double[] input, Tensor output) {
        int rows = output.rows();
        int cols = output.cols();
        if (delta.length != rows)
            throw new ShapeMismatchException("Delta length must match gradient rows: " +
                                             "rows=" + rows + ", delta.length=" + delta.length);
        if (input.length != cols - 1)
            throw new ShapeMismatchException("Input length must match gradient columns: " +
                                             "columns=" + (cols - 1) + ", input.length=" + input.length);

        double[] grad = output.data();
        for (int r = 0; r < rows; r++) {
            double d = delta[r];
            int offset = r * cols;
            for (int c = 0; c < input.length; c++)
                grad[offset + c] = d * input[c];
            grad[offset + cols - 1] = d;
        }
    }

    private PackedWeightGradients() {}
}
