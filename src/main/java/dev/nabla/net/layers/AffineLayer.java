package dev.nabla.net.layers;

import dev.nabla.net.WeightInitStrategy;
import dev.nabla.net.math.FastRandom;
import dev.nabla.net.math.NetMath;
import dev.nabla.net.math.Shape;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import dev.nabla.net.serialization.Serializable;
import dev.nabla.net.serialization.SerializationService;

import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Base for layers computing W·x + b.
 *
 * <p>Weights and bias are stored together as one (outputs × (inputs+1)) matrix
 * whose last column is the bias. The parameter blob and its gradient use the
 * same packed layout.
 */
public abstract class AffineLayer implements Layer, Serializable {

    protected final int inputs;
    protected final int outputs;
    protected Tensor weightsAndBias;

    protected AffineLayer(Tensor weightsAndBias) {
        if (weightsAndBias.shape().rank() != 2 || weightsAndBias.cols() < 1)
            throw new ShapeMismatchException("Packed parameters must be an outputs x (inputs+1) matrix, got " +
                                             weightsAndBias.shape());
        this.outputs = weightsAndBias.rows();
        this.inputs = weightsAndBias.cols() - 1;
        this.weightsAndBias = weightsAndBias.copy();
    }

    protected AffineLayer(double[][] weights, double[] bias) {
        this(pack(weights, bias));
    }

    protected AffineLayer(int inputs, int outputs, WeightInitStrategy initStrategy, FastRandom random) {
        this(initialize(inputs, outputs, initStrategy, random));
    }

    /**
     * Build the packed [W | b] matrix.
     */
    public static Tensor pack(double[][] weights, double[] bias) {
        if (weights.length != bias.length)
            throw new ShapeMismatchException("Bias length must match weight rows: " +
                                             "rows=" + weights.length + ", bias.length=" + bias.length);

        int cols = weights.length == 0 ? 0 : weights[0].length;
        double[][] packed = new double[weights.length][cols + 1];
        for (int r = 0; r < weights.length; r++) {
            if (weights[r].length != cols)
                throw new ShapeMismatchException("Ragged weight matrix: row " + r + " has " +
                                                 weights[r].length + " columns, expected " + cols);
            System.arraycopy(weights[r], 0, packed[r], 0, cols);
            packed[r][cols] = bias[r];
        }
        return Tensor.of(packed);
    }

    private static Tensor initialize(int inputs, int outputs, WeightInitStrategy initStrategy, FastRandom random) {
        double[][] weights = new double[outputs][inputs];
        double[] bias = new double[outputs];

        switch (initStrategy) {
            case XAVIER -> NetMath.weightInitXavier(weights, inputs, outputs, random);
            case HE -> NetMath.weightInitHe(weights, inputs, random);
        }
        NetMath.biasInit(bias, 0.0);

        return pack(weights, bias);
    }

    @Override
    public int inputArity() {
        return 1;
    }

    @Override
    public double[] forward(double[]... in) {
        Layer.checkArity(this, in);
        double[] output = new double[outputs];
        NetMath.matrixAffine(weightsAndBias, in[0], output);
        activate(output);
        return output;
    }

    /**
     * Apply the element-wise nonlinearity in place; identity by default.
     */
    protected void activate(double[] preActivations) {
    }

    /**
     * Turn the upstream gradient into the gradient w.r.t. the pre-activations.
     * Returns {@code upstreamGradient} itself when there is no nonlinearity.
     */
    protected double[] neuronDeltas(double[] output, double[] upstreamGradient) {
        return upstreamGradient;
    }

    @Override
    public LayerGradients backward(double[][] in, double[] output, double[] upstreamGradient) {
        Layer.checkArity(this, in);
        if (upstreamGradient.length != outputs)
            throw new ShapeMismatchException("Upstream gradient length must match outputs: " +
                                             "outputs=" + outputs + ", gradient.length=" + upstreamGradient.length);

        double[] deltas = neuronDeltas(output, upstreamGradient);

        Tensor parameterGradient = Tensor.zeros(parameterShape());
        NetMath.matrixPackedWeightGradients(deltas, in[0], parameterGradient);

        double[] inputGradient = new double[inputs];
        NetMath.matrixTransposeMultiply(weightsAndBias, deltas, inputGradient);

        return new LayerGradients(new double[][]{inputGradient}, parameterGradient);
    }

    @Override
    public Shape parameterShape() {
        return Shape.matrix(outputs, inputs + 1);
    }

    @Override
    public Tensor getParameters() {
        return weightsAndBias.copy();
    }

    @Override
    public void setParameters(Tensor parameters) {
        Layer.super.setParameters(parameters);
        this.weightsAndBias = parameters.copy();
    }

    public int getInputSize() {
        return inputs;
    }

    public int getOutputSize() {
        return outputs;
    }

    /**
     * Copy of the weight matrix W, without the bias column.
     */
    public double[][] getWeights() {
        double[][] weights = new double[outputs][inputs];
        for (int r = 0; r < outputs; r++)
            for (int c = 0; c < inputs; c++)
                weights[r][c] = weightsAndBias.get(r, c);
        return weights;
    }

    public double[] getBias() {
        double[] bias = new double[outputs];
        for (int r = 0; r < outputs; r++)
            bias[r] = weightsAndBias.get(r, inputs);
        return bias;
    }

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        SerializationService.writeTensor(out, weightsAndBias);
    }

    @Override
    public int getSerializedSize(int version) {
        return SerializationService.tensorSize(weightsAndBias);
    }
}
