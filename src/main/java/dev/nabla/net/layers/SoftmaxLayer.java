package dev.nabla.net.layers;

import dev.nabla.net.math.NetMath;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import dev.nabla.net.serialization.Serializable;
import dev.nabla.net.serialization.SerializationConstants;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Softmax over the input vector. Has no parameters.
 *
 * <p>Softmax(x_i) = exp(x_i - max(x)) / sum(exp(x_j - max(x)))
 *
 * <p>The backward step is a vector-Jacobian product computed from the forward
 * input, so the n×n Jacobian is never built.
 */
public final class SoftmaxLayer implements Layer, Serializable {

    @Override
    public int inputArity() {
        return 1;
    }

    @Override
    public double[] forward(double[]... inputs) {
        Layer.checkArity(this, inputs);
        double[] output = new double[inputs[0].length];
        NetMath.softmax(inputs[0], output);
        return output;
    }

    @Override
    public LayerGradients backward(double[][] inputs, double[] output, double[] upstreamGradient) {
        Layer.checkArity(this, inputs);
        double[] x = inputs[0];
        if (upstreamGradient.length != x.length)
            throw new ShapeMismatchException("Upstream gradient length must match input length: " +
                                             "input.length=" + x.length + ", gradient.length=" + upstreamGradient.length);

        double[] inputGradient = new double[x.length];
        NetMath.softmaxVectorJacobianProduct(x, upstreamGradient, inputGradient);
        return new LayerGradients(new double[][]{inputGradient}, Tensor.empty());
    }

    @Override
    public void writeTo(DataOutputStream out, int version) {
        // stateless
    }

    public static SoftmaxLayer deserialize(DataInputStream in, int version) throws IOException {
        return new SoftmaxLayer();
    }

    @Override
    public int getSerializedSize(int version) {
        return 0;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_SOFTMAX_LAYER;
    }

    @Override
    public String toString() {
        return "Softmax";
    }
}
