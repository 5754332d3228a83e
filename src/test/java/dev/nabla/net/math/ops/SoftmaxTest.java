package dev.nabla.net.math.ops;

import dev.nabla.net.GradientCheck;
import dev.nabla.net.math.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SoftmaxTest {

    private static final double DELTA = 1e-12;

    @Test
    void testSumsToOne() {
        double[] output = new double[3];
        Softmax.compute(new double[]{1.0, 2.0, 3.0}, output);

        assertEquals(1.0, output[0] + output[1] + output[2], DELTA);
        assertTrue(output[2] > output[1] && output[1] > output[0]);
    }

    @Test
    void testShiftInvariance() {
        Random random = new Random(7);
        for (int trial = 0; trial < 20; trial++) {
            double[] x = GradientCheck.randomVector(random, 5);
            double c = random.nextGaussian() * 50;
            double[] shifted = new double[x.length];
            for (int i = 0; i < x.length; i++)
                shifted[i] = x[i] + c;

            double[] a = new double[x.length];
            double[] b = new double[x.length];
            Softmax.compute(x, a);
            Softmax.compute(shifted, b);

            assertArrayEquals(a, b, 1e-12);
        }
    }

    @Test
    void testNumericalStability() {
        double[] output = new double[3];
        Softmax.compute(new double[]{1000.0, 1001.0, 1002.0}, output);

        for (double value : output)
            assertTrue(Double.isFinite(value));
        assertEquals(1.0, output[0] + output[1] + output[2], DELTA);
    }

    @Test
    void testNaNPropagates() {
        double[] output = new double[3];
        Softmax.compute(new double[]{1.0, Double.NaN, 0.0}, output);

        assertTrue(Double.isNaN(output[0]));
    }

    @Test
    void testVectorJacobianProductMatchesFullJacobian() {
        double[] x = {0.3, -1.2, 2.0, 0.7};
        double[] dJdy = {1.0, -0.5, 0.25, 2.0};
        double[] y = new double[x.length];
        Softmax.compute(x, y);

        // J[i][j] = y_i (delta_ij - y_j); dJdx_j = sum_i dJdy_i J[i][j]
        double[] expected = new double[x.length];
        for (int j = 0; j < x.length; j++)
            for (int i = 0; i < x.length; i++)
                expected[j] += dJdy[i] * y[i] * ((i == j ? 1.0 : 0.0) - y[j]);

        double[] actual = new double[x.length];
        Softmax.vectorJacobianProduct(x, dJdy, actual);

        assertArrayEquals(expected, actual, 1e-12);
    }

    @Test
    void testLengthMismatch() {
        assertThrows(ShapeMismatchException.class, () -> Softmax.compute(new double[3], new double[2]));
        assertThrows(ShapeMismatchException.class,
                () -> Softmax.vectorJacobianProduct(new double[3], new double[2], new double[3]));
    }
}
