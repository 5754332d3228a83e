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
 * Element-wise sum of a fixed number of equally sized inputs. Has no parameters.
 *
 * <p>Merges branches of a graph; every input receives the upstream gradient unchanged.
 */
public final class SumLayer implements Layer, Serializable {

    private final int arity;

    public SumLayer(int arity) {
        if (arity < 1)
            throw new IllegalArgumentException("SumLayer needs at least one input, got " + arity);
        this.arity = arity;
    }

    @Override
    public int inputArity() {
        return arity;
    }

    @Override
    public double[] forward(double[]... inputs) {
        Layer.checkArity(this, inputs);
        double[] output = inputs[0].clone();
        for (int p = 1; p < inputs.length; p++)
            NetMath.elementwiseAccumulate(output, inputs[p]);
        return output;
    }

    @Override
    public LayerGradients backward(double[][] inputs, double[] output, double[] upstreamGradient) {
        Layer.checkArity(this, inputs);
        if (upstreamGradient.length != output.length)
            throw new ShapeMismatchException("Upstream gradient length must match output length: " +
                                             "output.length=" + output.length + ", gradient.length=" + upstreamGradient.length);

        double[][] inputGradients = new double[arity][];
        for (int p = 0; p < arity; p++)
            inputGradients[p] = upstreamGradient.clone();
        return new LayerGradients(inputGradients, Tensor.empty());
    }

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        out.writeInt(arity);
    }

    public static SumLayer deserialize(DataInputStream in, int version) throws IOException {
        int arity = in.readInt();
        if (arity < 1)
            throw new IOException("Invalid SumLayer arity: " + arity);
        return new SumLayer(arity);
    }

    @Override
    public int getSerializedSize(int version) {
        return 4;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_SUM_LAYER;
    }

    @Override
    public String toString() {
        return "SumLayer (" + arity + " inputs)";
    }
}
