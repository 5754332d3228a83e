package dev.nabla.net.layers;

import dev.nabla.net.math.Shape;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import dev.nabla.net.serialization.Serializable;
import dev.nabla.net.serialization.SerializationConstants;
import dev.nabla.net.serialization.SerializationService;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Source layer with no inputs that outputs its own value.
 *
 * <p>The value is the layer's parameter, so the objective's gradient w.r.t. the
 * output is exactly the gradient w.r.t. the parameter. Useful as a trainable bias
 * or learned embedding feeding other layers.
 */
public class ConstUnit implements Layer, Serializable {

    private double[] value;

    public ConstUnit(double[] value) {
        this.value = value.clone();
    }

    @Override
    public int inputArity() {
        return 0;
    }

    @Override
    public double[] forward(double[]... inputs) {
        Layer.checkArity(this, inputs);
        return value.clone();
    }

    @Override
    public LayerGradients backward(double[][] inputs, double[] output, double[] upstreamGradient) {
        if (upstreamGradient.length != value.length)
            throw new ShapeMismatchException("Upstream gradient length must match value length: " +
                                             "value.length=" + value.length + ", gradient.length=" + upstreamGradient.length);

        return new LayerGradients(new double[0][], Tensor.of(upstreamGradient));
    }

    @Override
    public Shape parameterShape() {
        return Shape.vector(value.length);
    }

    @Override
    public Tensor getParameters() {
        return Tensor.of(value);
    }

    @Override
    public void setParameters(Tensor parameters) {
        Layer.super.setParameters(parameters);
        this.value = parameters.toArray();
    }

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        SerializationService.writeTensor(out, getParameters());
    }

    public static ConstUnit deserialize(DataInputStream in, int version) throws IOException {
        return new ConstUnit(SerializationService.readTensor(in).data());
    }

    @Override
    public int getSerializedSize(int version) {
        return SerializationService.tensorSize(getParameters());
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_CONST_UNIT;
    }

    @Override
    public String toString() {
        return "ConstUnit (outputs constant value)";
    }
}
