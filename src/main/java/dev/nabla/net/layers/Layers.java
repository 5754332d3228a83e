package dev.nabla.net.layers;

import dev.nabla.net.WeightInitStrategy;
import dev.nabla.net.math.FastRandom;

/**
 * Factory methods for the built-in layers.
 *
 * <pre>{@code
 * Network net = Network.sequential(
 *     Layers.relu(784, 128),
 *     Layers.linear(128, 10),
 *     Layers.softmax());
 * }</pre>
 */
public final class Layers {

    private Layers() {}

    public static ConstUnit constant(double... value) {
        return new ConstUnit(value);
    }

    /**
     * Linear layer with Glorot-uniform weights and zero bias.
     */
    public static LinearLayer linear(int inputs, int outputs) {
        return new LinearLayer(inputs, outputs);
    }

    public static LinearLayer linear(int inputs, int outputs, FastRandom random) {
        return new LinearLayer(inputs, outputs, WeightInitStrategy.XAVIER, random);
    }

    public static LinearLayer linear(double[][] weights, double[] bias) {
        return new LinearLayer(weights, bias);
    }

    /**
     * Rectified linear layer with Glorot-uniform weights and zero bias.
     */
    public static RectifiedLinearLayer relu(int inputs, int outputs) {
        return new RectifiedLinearLayer(inputs, outputs);
    }

    public static RectifiedLinearLayer relu(int inputs, int outputs, FastRandom random) {
        return new RectifiedLinearLayer(inputs, outputs, WeightInitStrategy.XAVIER, random);
    }

    public static RectifiedLinearLayer relu(int inputs, int outputs, WeightInitStrategy initStrategy, FastRandom random) {
        return new RectifiedLinearLayer(inputs, outputs, initStrategy, random);
    }

    public static RectifiedLinearLayer relu(double[][] weights, double[] bias) {
        return new RectifiedLinearLayer(weights, bias);
    }

    public static SoftmaxLayer softmax() {
        return new SoftmaxLayer();
    }

    /**
     * Element-wise sum of {@code inputs} branches.
     */
    public static SumLayer sum(int inputs) {
        return new SumLayer(inputs);
    }
}
