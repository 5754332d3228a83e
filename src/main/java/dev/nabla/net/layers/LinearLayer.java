package dev.nabla.net.layers;

import dev.nabla.net.WeightInitStrategy;
import dev.nabla.net.math.FastRandom;
import dev.nabla.net.math.Tensor;
import dev.nabla.net.serialization.SerializationConstants;
import dev.nabla.net.serialization.SerializationService;

import java.io.DataInputStream;
import java.io.IOException;

/**
 * Linear unit: y = W·x + b.
 *
 * <p>Backward: dJdx = Wᵀ·dJdy, dJdW = dJdy ⊗ x, dJdb = dJdy.
 */
public class LinearLayer extends AffineLayer {

    public LinearLayer(double[][] weights, double[] bias) {
        super(weights, bias);
    }

    public LinearLayer(Tensor weightsAndBias) {
        super(weightsAndBias);
    }

    /**
     * Glorot-uniform weights and zero bias.
     */
    public LinearLayer(int inputs, int outputs) {
        this(inputs, outputs, WeightInitStrategy.XAVIER, new FastRandom());
    }

    public LinearLayer(int inputs, int outputs, WeightInitStrategy initStrategy, FastRandom random) {
        super(inputs, outputs, initStrategy, random);
    }

    public static LinearLayer deserialize(DataInputStream in, int version) throws IOException {
        return new LinearLayer(SerializationService.readTensor(in));
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_LINEAR_LAYER;
    }

    @Override
    public String toString() {
        return "LinearLayer (" + inputs + " -> " + outputs + ")";
    }
}
