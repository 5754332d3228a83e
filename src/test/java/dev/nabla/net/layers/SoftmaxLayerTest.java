package dev.nabla.net.layers;

import dev.nabla.net.GradientCheck;
import dev.nabla.net.math.Shape;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SoftmaxLayerTest {

    private final SoftmaxLayer softmax = new SoftmaxLayer();

    @Test
    void testOutputIsProbabilityVector() {
        double[] y = softmax.forward(new double[]{2.0, 1.0, 3.0});

        assertEquals(1.0, y[0] + y[1] + y[2], 1e-12);
        assertEquals(0.2447, y[0], 1e-4);
        assertEquals(0.0900, y[1], 1e-4);
        assertEquals(0.6652, y[2], 1e-4);
    }

    @Test
    void testHasNoParameters() {
        assertEquals(Shape.empty(), softmax.parameterShape());
        assertTrue(softmax.getParameters().isEmpty());
        softmax.setParameters(Tensor.empty());
        assertThrows(ShapeMismatchException.class, () -> softmax.setParameters(Tensor.of(new double[]{1})));
    }

    @Test
    void testGradientMatchesFiniteDifferences() {
        Random random = new Random(3);
        for (int trial = 0; trial < 10; trial++) {
            double[] x = GradientCheck.randomVector(random, 6);
            double[] seed = GradientCheck.randomVector(random, 6);

            Layer.LayerGradients gradients = softmax.backward(new double[][]{x}, softmax.forward(x), seed);

            double[] numeric = GradientCheck.numericGradient(x, seed, v -> softmax.forward(v));
            GradientCheck.assertClose(numeric, gradients.inputGradient(0), "dJdx");
            assertTrue(gradients.parameterGradient().isEmpty());
        }
    }

    @Test
    void testGradientOfUniformSeedIsZero() {
        // softmax outputs always sum to one, so a constant upstream gradient has no effect
        double[] x = {0.5, -2.0, 1.5};
        Layer.LayerGradients gradients = softmax.backward(new double[][]{x}, softmax.forward(x), new double[]{1, 1, 1});

        assertArrayEquals(new double[3], gradients.inputGradient(0), 1e-15);
    }
}
