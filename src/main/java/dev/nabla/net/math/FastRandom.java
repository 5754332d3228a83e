package dev.nabla.net.math;

import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Seedable random source for weight initialization.
 * Backed by Xoroshiro128++, which is fast and has good statistical quality.
 *
 * <p>Not thread-safe; give each initializing thread its own instance.
 */
public final class FastRandom {

    private static final String ALGORITHM = "Xoroshiro128PlusPlus";

    private final RandomGenerator rng;

    public FastRandom() {
        this.rng = RandomGeneratorFactory.of(ALGORITHM).create();
    }

    public FastRandom(long seed) {
        this.rng = RandomGeneratorFactory.of(ALGORITHM).create(seed);
    }

    /**
     * Fill buffer with uniform doubles in [min, max).
     */
    public void fillUniform(double[] buffer, double min, double max) {
        double range = max - min;
        for (int i = 0; i < buffer.length; i++) {
            buffer[i] = rng.nextDouble() * range + min;
        }
    }

    /** Fill buffer with uniform doubles in [-limit, +limit). */
    public void fillSymmetric(double[] buffer, double limit) {
        fillUniform(buffer, -limit, limit);
    }

    /**
     * Fill buffer with Gaussian-distributed doubles (mean, stddev).
     */
    public void fillGaussian(double[] buffer, double mean, double stddev) {
        for (int i = 0; i < buffer.length; i++) {
            buffer[i] = rng.nextGaussian() * stddev + mean;
        }
    }
}
