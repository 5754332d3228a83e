package dev.nabla.net.layers;

import dev.nabla.net.WeightInitStrategy;
import dev.nabla.net.math.FastRandom;
import dev.nabla.net.math.NetMath;
import dev.nabla.net.math.Tensor;
import dev.nabla.net.serialization.SerializationConstants;
import dev.nabla.net.serialization.SerializationService;

import java.io.DataInputStream;
import java.io.IOException;

/**
 * Rectified linear unit: y = max(0, W·x + b).
 *
 * <p>Backward zeroes the upstream gradient wherever the forward output is exactly
 * zero, then applies the linear algebra to the masked gradient. The kink at zero
 * counts as inactive.
 */
public class RectifiedLinearLayer extends AffineLayer {

    public RectifiedLinearLayer(double[][] weights, double[] bias) {
        super(weights, bias);
    }

    public RectifiedLinearLayer(Tensor weightsAndBias) {
        super(weightsAndBias);
    }

    /**
     * Glorot-uniform weights and zero bias.
     */
    public RectifiedLinearLayer(int inputs, int outputs) {
        this(inputs, outputs, WeightInitStrategy.XAVIER, new FastRandom());
    }

    public RectifiedLinearLayer(int inputs, int outputs, WeightInitStrategy initStrategy, FastRandom random) {
        super(inputs, outputs, initStrategy, random);
    }

    @Override
    protected void activate(double[] preActivations) {
        NetMath.relu(preActivations, preActivations);
    }

    @Override
    protected double[] neuronDeltas(double[] output, double[] upstreamGradient) {
        // never overwrite the caller's accumulator
        double[] masked = new double[upstreamGradient.length];
        NetMath.reluMask(output, upstreamGradient, masked);
        return masked;
    }

    public static RectifiedLinearLayer deserialize(DataInputStream in, int version) throws IOException {
        return new RectifiedLinearLayer(SerializationService.readTensor(in));
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_RECTIFIED_LINEAR_LAYER;
    }

    @Override
    public String toString() {
        return "RectifiedLinearLayer (" + inputs + " -> " + outputs + ")";
    }
}
