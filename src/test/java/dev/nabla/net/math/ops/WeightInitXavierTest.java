package dev.nabla.net.math.ops;

import dev.nabla.net.math.FastRandom;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeightInitXavierTest {

    @Test
    void testValuesWithinLimit() {
        double[][] weights = new double[30][40];
        int fanIn = 40;
        int fanOut = 30;
        double limit = Math.sqrt(6.0 / (fanIn + fanOut));

        WeightInitXavier.compute(weights, fanIn, fanOut, new FastRandom(1));

        boolean hasNonZero = false;
        for (double[] row : weights) {
            for (double value : row) {
                assertTrue(value >= -limit && value <= limit, "Value " + value + " outside ±" + limit);
                if (value != 0.0)
                    hasNonZero = true;
            }
        }
        assertTrue(hasNonZero, "Weights should be initialized to non-zero values");
    }

    @Test
    void testRoughlyZeroMean() {
        double[][] weights = new double[100][100];
        WeightInitXavier.compute(weights, 100, 100, new FastRandom(2));

        double sum = 0.0;
        for (double[] row : weights)
            for (double value : row)
                sum += value;

        assertEquals(0.0, sum / 10_000, 0.01);
    }

    @Test
    void testSameSeedSameWeights() {
        double[][] a = new double[3][4];
        double[][] b = new double[3][4];
        WeightInitXavier.compute(a, 4, 3, new FastRandom(42));
        WeightInitXavier.compute(b, 4, 3, new FastRandom(42));

        assertArrayEquals(a, b);
    }

    @Test
    void testInvalidFan() {
        assertThrows(IllegalArgumentException.class,
                () -> WeightInitXavier.compute(new double[1][1], 0, 1, new FastRandom()));
    }
}
