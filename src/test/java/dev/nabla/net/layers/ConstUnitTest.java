package dev.nabla.net.layers;

import dev.nabla.net.math.Shape;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConstUnitTest {

    @Test
    void testOutputsValue() {
        ConstUnit unit = new ConstUnit(new double[]{1, 2, 3});

        assertEquals(0, unit.inputArity());
        assertArrayEquals(new double[]{1, 2, 3}, unit.forward());
    }

    @Test
    void testForwardReturnsCopy() {
        ConstUnit unit = new ConstUnit(new double[]{1, 2});
        unit.forward()[0] = 100;

        assertArrayEquals(new double[]{1, 2}, unit.forward());
    }

    @Test
    void testRejectsInputs() {
        ConstUnit unit = new ConstUnit(new double[]{1});

        assertThrows(IllegalArgumentException.class, () -> unit.forward(new double[]{1}));
    }

    @Test
    void testBackwardPassesGradientToParameters() {
        ConstUnit unit = new ConstUnit(new double[]{1, 2});

        Layer.LayerGradients gradients = unit.backward(new double[0][], unit.forward(), new double[]{0.5, -3});

        assertEquals(0, gradients.inputGradients().length);
        assertArrayEquals(new double[]{0.5, -3}, gradients.parameterGradient().data());
        assertEquals(unit.parameterShape(), gradients.parameterGradient().shape());
    }

    @Test
    void testParameters() {
        ConstUnit unit = new ConstUnit(new double[]{1, 2});

        assertEquals(Shape.vector(2), unit.parameterShape());
        assertEquals(Tensor.of(new double[]{1, 2}), unit.getParameters());

        unit.setParameters(Tensor.of(new double[]{5, 6}));
        assertArrayEquals(new double[]{5, 6}, unit.forward());

        assertThrows(ShapeMismatchException.class, () -> unit.setParameters(Tensor.of(new double[]{1})));
    }
}
