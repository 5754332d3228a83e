package dev.nabla.net;

import dev.nabla.net.layers.Layer;
import dev.nabla.net.math.NetMath;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Storage for one evaluation of a {@link Network}: the forward output of every
 * layer, the gradient accumulators of every layer output and parameter blob, and
 * the gradient w.r.t. the network input.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #allocate(double[], int)} sizes the buffers against a sample input.</li>
 *   <li>{@link #evaluate(double[], int)} fills the outputs; buffers are reused while
 *       the input length and output layer stay the same.</li>
 *   <li>{@link #gradient(double[])} resets and refills all gradient accumulators.</li>
 * </ol>
 *
 * <p>A context references its network but does not own it. It is not thread-safe:
 * use one context per thread. Many contexts may share a network concurrently.
 */
public class EvaluationContext {

    private static final Logger log = LoggerFactory.getLogger(EvaluationContext.class);

    // identity
    private final Network network;

    // cache, indexed by 1-based layer index; slot 0 unused
    private final double[][] outputs;
    private final double[][] outputGradients;
    private final Tensor[] parameterGradients;
    private final List<Tensor> parameterGradientView;
    private double[] input;
    private double[] inputGradient;
    private int outputLayer;
    private int[] order;
    private boolean evaluated;

    private EvaluationContext(Network network) {
        this.network = network;
        int m = network.layerCount();
        this.outputs = new double[m + 1][];
        this.outputGradients = new double[m + 1][];
        this.parameterGradients = new Tensor[m];
        for (int i = 1; i <= m; i++)
            parameterGradients[i - 1] = Tensor.zeros(network.layer(i).parameterShape());
        this.parameterGradientView = Collections.unmodifiableList(Arrays.asList(parameterGradients));
    }

    /**
     * Create an empty, unallocated context for {@code network}.
     */
    public static EvaluationContext of(Network network) {
        return new EvaluationContext(network);
    }

    /**
     * Create a context for the last layer of {@code network} and allocate it
     * against {@code sampleInput}.
     */
    public static EvaluationContext allocate(Network network, double[] sampleInput) {
        return allocate(network, sampleInput, network.outputLayer());
    }

    public static EvaluationContext allocate(Network network, double[] sampleInput, int outputLayer) {
        return new EvaluationContext(network).allocate(sampleInput, outputLayer);
    }

    /**
     * Size the output and gradient buffers of every layer {@code outputLayer}
     * depends on by evaluating each of them once on {@code sampleInput}.
     *
     * <p>Buffers that already have the right size are kept. Layers the output does
     * not depend on get no output buffers. Afterwards the context holds the sample's
     * evaluation.
     *
     * @return this context
     */
    public EvaluationContext allocate(double[] sampleInput, int outputLayer) {
        int[] newOrder = network.orderFor(outputLayer);

        boolean[] required = new boolean[outputs.length];
        for (int i : newOrder)
            required[i] = true;
        for (int i = 1; i < outputs.length; i++) {
            if (!required[i]) {
                outputs[i] = null;
                outputGradients[i] = null;
            }
        }

        if (inputGradient == null || inputGradient.length != sampleInput.length)
            inputGradient = new double[sampleInput.length];

        this.outputLayer = outputLayer;
        this.order = newOrder;

        log.debug("Allocating {} of {} layers for output layer {} and input length {}",
                  newOrder.length, network.layerCount(), outputLayer, sampleInput.length);

        forwardPass(sampleInput);
        return this;
    }

    public boolean isAllocated() {
        return order != null;
    }

    private boolean isAllocatedFor(double[] input, int outputLayer) {
        return order != null && this.outputLayer == outputLayer && inputGradient.length == input.length;
    }

    // ===== EVALUATION =====

    /**
     * Evaluate the last layer of the network. See {@link #evaluate(double[], int)}.
     */
    public double[] evaluate(double[] input) {
        return evaluate(input, network.outputLayer());
    }

    /**
     * Evaluate {@code outputLayer}, caching every intermediate output.
     *
     * <p>Each layer the output depends on is computed exactly once, however many
     * consumers it has, and its cached output is reused by all of them. Reallocates
     * only when the input length or output layer differ from the last allocation.
     *
     * @return the output buffer of {@code outputLayer}; overwritten by the next call
     */
    public double[] evaluate(double[] input, int outputLayer) {
        if (!isAllocatedFor(input, outputLayer)) {
            if (isAllocated())
                log.debug("Reallocating: input length {} -> {}, output layer {} -> {}",
                          inputGradient.length, input.length, this.outputLayer, outputLayer);
            allocate(input, outputLayer);
            return outputs[outputLayer];
        }
        return forwardPass(input);
    }

    private double[] forwardPass(double[] input) {
        evaluated = false;
        this.input = input; // referenced, not copied

        for (int i : order) {
            double[] output = network.layer(i).forward(gatherInputs(i));
            double[] buffer = outputs[i];
            if (buffer == null || buffer.length != output.length) {
                outputs[i] = output;
                outputGradients[i] = new double[output.length];
            } else {
                System.arraycopy(output, 0, buffer, 0, output.length);
            }
        }

        evaluated = true;
        return outputs[outputLayer];
    }

    private double[][] gatherInputs(int index) {
        int[] inputs = network.inputsOf(index);
        double[][] values = new double[inputs.length][];
        for (int p = 0; p < inputs.length; p++)
            values[p] = inputs[p] == Network.INPUT ? input : outputs[inputs[p]];
        return values;
    }

    // ===== BACKPROPAGATION =====

    /**
     * Backpropagate {@code seed}, the gradient of the objective w.r.t. the output
     * layer, to every parameter blob and to the network input.
     *
     * <p>All accumulators are zeroed first. Layers are then processed in reverse
     * topological order, so a layer runs its backward step only once every consumer
     * has added its contribution to that layer's output gradient.
     *
     * @return the parameter gradients, one per layer in layer order; these are the
     *         context's own accumulators and are overwritten by the next call
     * @throws IllegalStateException if no evaluation has completed
     */
    public List<Tensor> gradient(double[] seed) {
        if (!evaluated)
            throw new IllegalStateException("gradient requires a completed evaluation");

        double[] seedBuffer = outputGradients[outputLayer];
        if (seed.length != seedBuffer.length)
            throw new ShapeMismatchException("Seed gradient length must match output length: " +
                                             "output.length=" + seedBuffer.length + ", seed.length=" + seed.length);

        for (Tensor gradient : parameterGradients)
            gradient.fill(0.0);
        for (int i : order) {
            if (i != outputLayer)
                Arrays.fill(outputGradients[i], 0.0);
        }
        Arrays.fill(inputGradient, 0.0);
        System.arraycopy(seed, 0, seedBuffer, 0, seed.length);

        for (int k = order.length - 1; k >= 0; k--)
            backwardStep(order[k]);

        return parameterGradientView;
    }

    private void backwardStep(int index) {
        Layer layer = network.layer(index);
        Layer.LayerGradients gradients = layer.backward(gatherInputs(index), outputs[index], outputGradients[index]);

        int[] inputs = network.inputsOf(index);
        for (int p = 0; p < inputs.length; p++) {
            double[] target = inputs[p] == Network.INPUT ? inputGradient : outputGradients[inputs[p]];
            NetMath.elementwiseAccumulate(target, gradients.inputGradient(p));
        }
        parameterGradients[index - 1].addInPlace(gradients.parameterGradient());
    }

    // ===== ACCESSORS =====

    public Network network() {
        return network;
    }

    public double[] input() {
        return input;
    }

    public int outputLayer() {
        return outputLayer;
    }

    /**
     * Output of the output layer from the last evaluation.
     */
    public double[] output() {
        return outputs[outputLayer];
    }

    /**
     * Cached output of layer {@code index}; null if the output layer does not depend on it.
     */
    public double[] output(int index) {
        network.checkLayerIndex(index);
        return outputs[index];
    }

    /**
     * Accumulated gradient w.r.t. the output of layer {@code index}.
     */
    public double[] outputGradient(int index) {
        network.checkLayerIndex(index);
        return outputGradients[index];
    }

    public List<Tensor> parameterGradients() {
        return parameterGradientView;
    }

    public Tensor parameterGradient(int index) {
        network.checkLayerIndex(index);
        return parameterGradients[index - 1];
    }

    /**
     * Accumulated gradient w.r.t. the network input.
     */
    public double[] inputGradient() {
        return inputGradient;
    }

    public List<Tensor> getParameters() {
        return network.getParameters();
    }

    public void setParameters(List<Tensor> parameters) {
        network.setParameters(parameters);
    }

    @Override
    public String toString() {
        return network + " with storage for intermediate evaluations and backpropagated gradients";
    }
}
