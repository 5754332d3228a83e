package dev.nabla.net.layers;

import dev.nabla.net.GradientCheck;
import dev.nabla.net.WeightInitStrategy;
import dev.nabla.net.math.FastRandom;
import dev.nabla.net.math.Shape;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LinearLayerTest {

    private final LinearLayer layer = new LinearLayer(new double[][]{{1, 2}, {3, 4}}, new double[]{0, 0});

    @Test
    void testForwardClosedForm() {
        assertArrayEquals(new double[]{3, 7}, layer.forward(new double[]{1, 1}));
    }

    @Test
    void testBackwardClosedForm() {
        double[] x = {1, 1};
        double[] y = layer.forward(x);

        Layer.LayerGradients gradients = layer.backward(new double[][]{x}, y, new double[]{1, 1});

        assertArrayEquals(new double[]{4, 6}, gradients.inputGradient(0));
        // packed [dJdW | dJdb]
        assertArrayEquals(new double[][]{{1, 1, 1}, {1, 1, 1}}, gradients.parameterGradient().toMatrix());
    }

    @Test
    void testBiasIsAdded() {
        LinearLayer biased = new LinearLayer(new double[][]{{1, 0}, {0, 1}}, new double[]{10, -10});

        assertArrayEquals(new double[]{11, -8}, biased.forward(new double[]{1, 2}));
    }

    @Test
    void testParameterLayout() {
        Tensor parameters = layer.getParameters();

        assertEquals(Shape.matrix(2, 3), layer.parameterShape());
        assertEquals(Shape.matrix(2, 3), parameters.shape());
        assertArrayEquals(new double[][]{{1, 2, 0}, {3, 4, 0}}, parameters.toMatrix());
        assertArrayEquals(new double[][]{{1, 2}, {3, 4}}, layer.getWeights());
        assertArrayEquals(new double[]{0, 0}, layer.getBias());
    }

    @Test
    void testGetParametersReturnsCopy() {
        Tensor parameters = layer.getParameters();
        parameters.fill(0.0);

        assertArrayEquals(new double[]{3, 7}, layer.forward(new double[]{1, 1}));
    }

    @Test
    void testSetParameters() {
        LinearLayer copy = new LinearLayer(new double[][]{{0, 0}, {0, 0}}, new double[]{0, 0});
        copy.setParameters(Tensor.of(new double[][]{{1, 2, 1}, {3, 4, -1}}));

        assertArrayEquals(new double[]{4, 6}, copy.forward(new double[]{1, 1}));
    }

    @Test
    void testSetParametersWrongShape() {
        assertThrows(ShapeMismatchException.class, () -> layer.setParameters(Tensor.of(new double[][]{{1, 2}})));
    }

    @Test
    void testInputLengthMismatch() {
        assertThrows(ShapeMismatchException.class, () -> layer.forward(new double[]{1, 2, 3}));
    }

    @Test
    void testWrongArity() {
        assertThrows(IllegalArgumentException.class, () -> layer.forward(new double[]{1, 2}, new double[]{1, 2}));
    }

    @Test
    void testGlorotDefaults() {
        int inputs = 6;
        int outputs = 4;
        LinearLayer initialized = new LinearLayer(inputs, outputs);
        double limit = Math.sqrt(6.0 / (inputs + outputs));

        assertEquals(inputs, initialized.getInputSize());
        assertEquals(outputs, initialized.getOutputSize());
        for (double[] row : initialized.getWeights())
            for (double w : row)
                assertTrue(Math.abs(w) <= limit);
        assertArrayEquals(new double[outputs], initialized.getBias());
    }

    @Test
    void testSeededInitializationIsReproducible() {
        LinearLayer a = new LinearLayer(5, 3, WeightInitStrategy.XAVIER, new FastRandom(11));
        LinearLayer b = new LinearLayer(5, 3, WeightInitStrategy.XAVIER, new FastRandom(11));

        assertEquals(a.getParameters(), b.getParameters());
    }

    @Test
    void testGradientMatchesFiniteDifferences() {
        Random random = new Random(1);
        LinearLayer linear = new LinearLayer(4, 3, WeightInitStrategy.XAVIER, new FastRandom(1));
        double[] x = GradientCheck.randomVector(random, 4);
        double[] seed = GradientCheck.randomVector(random, 3);

        Layer.LayerGradients gradients = linear.backward(new double[][]{x}, linear.forward(x), seed);

        double[] numericInput = GradientCheck.numericGradient(x, seed, v -> linear.forward(v));
        GradientCheck.assertClose(numericInput, gradients.inputGradient(0), "dJdx");

        double[] theta = linear.getParameters().toArray();
        double[] numericTheta = GradientCheck.numericGradient(theta, seed, t -> {
            linear.setParameters(Tensor.wrap(linear.parameterShape(), t.clone()));
            return linear.forward(x);
        });
        GradientCheck.assertClose(numericTheta, gradients.parameterGradient().data(), "dJdθ");
    }

    @Test
    void testToString() {
        assertEquals("LinearLayer (2 -> 2)", layer.toString());
    }
}
