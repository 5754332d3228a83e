package dev.nabla.net.math.ops;

import dev.nabla.net.math.FastRandom;

/**
 * He initialization: w = gaussian * sqrt(2 / fanIn).
 * Suited to rectified layers, which zero roughly half of their pre-activations.
 */
public final class WeightInitHe {

    public static void compute(double[][] weights, int fanIn, FastRandom random) {
        if (fanIn <= 0)
            throw new IllegalArgumentException("fanIn must be positive, got: " + fanIn);

        double stddev = Math.sqrt(2.0 / fanIn);
        for (double[] row : weights)
            random.fillGaussian(row, 0.0, stddev);
    }

    private WeightInitHe() {}
}
