package dev.nabla.net.math.ops;

import dev.nabla.net.math.FastRandom;

/**
 * Xavier/Glorot uniform weight initialization.
 *
 * <p>Initializes weights uniformly in the range [-limit, +limit] where
 * limit = sqrt(6 / (fanIn + fanOut)). Keeps the variance of activations and
 * gradients roughly equal across layers.
 */
public final class WeightInitXavier {

    public static void compute(double[][] weights, int fanIn, int fanOut, FastRandom random) {
        if (fanIn <= 0 || fanOut <= 0)
            throw new IllegalArgumentException("fanIn and fanOut must be positive, got: " + fanIn + ", " + fanOut);

        double limit = limit(fanIn, fanOut);
        for (double[] row : weights)
            random.fillSymmetric(row, limit);
    }

    public static double limit(int fanIn, int fanOut) {
        return Math.sqrt(6.0 / (fanIn + fanOut));
    }

    private WeightInitXavier() {}
}
