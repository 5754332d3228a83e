package dev.nabla.net.math;

import dev.nabla.net.math.ops.*;

/**
 * Central entry point for all numeric operations used by layers.
 * Methods are prefixed by operation type for intuitive autocomplete.
 *
 * <p>Every operation checks operand dimensions and throws
 * {@link ShapeMismatchException} when they are incompatible.
 */
public final class NetMath {

    // ========== ELEMENT-WISE OPERATIONS ==========

    /**
     * Accumulate in place: accumulator[i] += term[i]
     */
    public static void elementwiseAccumulate(double[] accumulator, double[] term) {
        ElementwiseAdd.accumulate(accumulator, term);
    }

    // ========== MATRIX OPERATIONS ==========

    /**
     * output = W·x + b for packed parameters [W | b].
     */
    public static void matrixAffine(Tensor packed, double[] input, double[] output) {
        AffineTransform.compute(packed, input, output);
    }

    /**
     * output = Wᵀ·v for packed parameters [W | b]; the bias column is ignored.
     */
    public static void matrixTransposeMultiply(Tensor packed, double[] vector, double[] output) {
        TransposeMultiply.compute(packed, vector, output);
    }

    /**
     * output = [delta ⊗ input | delta]
     */
    public static void matrixPackedWeightGradients(double[] delta, double[] input, Tensor output) {
        PackedWeightGradients.compute(delta, input, output);
    }

    // ========== ACTIVATIONS ==========

    public static void relu(double[] input, double[] output) {
        Relu.compute(input, output);
    }

    public static void reluMask(double[] activations, double[] upstream, double[] output) {
        Relu.mask(activations, upstream, output);
    }

    public static void softmax(double[] input, double[] output) {
        Softmax.compute(input, output);
    }

    public static void softmaxVectorJacobianProduct(double[] input, double[] upstream, double[] output) {
        Softmax.vectorJacobianProduct(input, upstream, output);
    }

    // ========== INITIALIZATION ==========

    public static void weightInitXavier(double[][] weights, int fanIn, int fanOut, FastRandom random) {
        WeightInitXavier.compute(weights, fanIn, fanOut, random);
    }

    public static void weightInitHe(double[][] weights, int fanIn, FastRandom random) {
        WeightInitHe.compute(weights, fanIn, random);
    }

    public static void biasInit(double[] biases, double value) {
        BiasInit.compute(biases, value);
    }

    private NetMath() {}
}
