package dev.nabla.net.layers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SumLayerTest {

    @Test
    void testForwardSumsInputs() {
        SumLayer sum = new SumLayer(3);

        assertArrayEquals(new double[]{6, 60},
                sum.forward(new double[]{1, 10}, new double[]{2, 20}, new double[]{3, 30}));
    }

    @Test
    void testForwardDoesNotModifyInputs() {
        SumLayer sum = new SumLayer(2);
        double[] first = {1, 1};

        sum.forward(first, new double[]{2, 2});

        assertArrayEquals(new double[]{1, 1}, first);
    }

    @Test
    void testBackwardCopiesGradientToEveryInput() {
        SumLayer sum = new SumLayer(2);
        double[] a = {1, 2};
        double[] b = {3, 4};
        double[] upstream = {0.5, -1};

        Layer.LayerGradients gradients = sum.backward(new double[][]{a, b}, sum.forward(a, b), upstream);

        assertArrayEquals(upstream, gradients.inputGradient(0));
        assertArrayEquals(upstream, gradients.inputGradient(1));
        assertNotSame(gradients.inputGradient(0), gradients.inputGradient(1));
        assertTrue(gradients.parameterGradient().isEmpty());
    }

    @Test
    void testInvalidArity() {
        assertThrows(IllegalArgumentException.class, () -> new SumLayer(0));
        assertThrows(IllegalArgumentException.class, () -> new SumLayer(2).forward(new double[]{1}));
    }
}
