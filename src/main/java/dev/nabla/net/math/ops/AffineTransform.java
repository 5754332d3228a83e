package dev.nabla.net.math.ops;

import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;

/**
 * Affine map with packed parameters: output = W·x + b, where {@code packed} is
 * the (outputs × (inputs+1)) matrix {@code [W | b]}.
 */
public final class AffineTransform {

    public static void compute(Tensor packed, double[] input, double[] output) {
        int rows = packed.rows();
        int cols = packed.cols();
        if (cols - 1 != input.length)
            throw new ShapeMismatchException("Weight columns must match input length: " +
                                             "weights=" + rows + "x" + (cols - 1) + ", input.length=" + input.length);
        if (output.length != rows)
            throw new ShapeMismatchException("Output length must match weight rows: " +
                                             "rows=" + rows + ", output.length=" + output.length);

        double[] wb = packed.data();
        for (int r = 0; r < rows; r++) {
            int offset = r * cols;
            double sum = wb[offset + cols - 1];
            for (int c = 0; c < input.length; c++)
                sum += wb[offset + c] * input[c];
            output[r] = sum;
        }
    }

    private AffineTransform() {}
}
