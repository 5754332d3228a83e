package dev.nabla.net.math.ops;

/**
 * Largest element of a non-empty array.
 */
public final class Max {

    public static double compute(double[] array) {
        if (array.length == 0)
            throw new IllegalArgumentException("Cannot take max of empty array");

        double max = array[0];
        for (int i = 1; i < array.length; i++) {
            if (array[i] > max)
                max = array[i];
        }
        return max;
    }

    private Max() {}
}
