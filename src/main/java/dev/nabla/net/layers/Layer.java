package dev.nabla.net.layers;

import dev.nabla.net.math.Shape;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;

/**
 * A differentiable unit of a network.
 *
 * <p>A layer knows nothing about the graph it sits in: it maps its inputs to one
 * output vector, and maps a gradient on that output back to gradients on its
 * inputs and on its own parameters. The caller owns all intermediate values.
 *
 * <p>Implementations must keep {@link #parameterShape()}, {@link #getParameters()}
 * and the parameter gradient returned by {@link #backward} consistent with each other.
 */
public interface Layer {

    /**
     * Result of a backward step: one gradient per forward input, in input order,
     * plus the gradient w.r.t. this layer's parameters.
     */
    final class LayerGradients {
        private final double[][] inputGradients;
        private final Tensor parameterGradient;

        public LayerGradients(double[][] inputGradients, Tensor parameterGradient) {
            this.inputGradients = inputGradients;
            this.parameterGradient = parameterGradient;
        }

        public double[][] inputGradients() { return inputGradients; }
        public double[] inputGradient(int position) { return inputGradients[position]; }
        public Tensor parameterGradient() { return parameterGradient; }
    }

    /**
     * Number of inputs {@link #forward} expects.
     */
    int inputArity();

    /**
     * Evaluate this layer. Pure: must not mutate the inputs or any shared state.
     *
     * @param inputs exactly {@link #inputArity()} vectors
     * @return a newly allocated output vector
     */
    default double[] forward(double[]... inputs) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no forward implementation");
    }

    /**
     * Local chain-rule step.
     *
     * @param inputs the inputs seen by the forward pass
     * @param output the output produced by the forward pass for those inputs
     * @param upstreamGradient gradient of the objective w.r.t. {@code output}
     * @return gradients w.r.t. each input and w.r.t. the parameters
     */
    default LayerGradients backward(double[][] inputs, double[] output, double[] upstreamGradient) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no backward implementation");
    }

    /**
     * Shape of the parameter blob, used to pre-allocate gradient accumulators.
     */
    default Shape parameterShape() {
        return Shape.empty();
    }

    /**
     * Copy of the current parameters as one blob; empty for parameter-free layers.
     */
    default Tensor getParameters() {
        return Tensor.empty();
    }

    /**
     * Replace the parameters with a copy of {@code parameters}.
     *
     * @throws ShapeMismatchException if the blob does not have {@link #parameterShape()}
     */
    default void setParameters(Tensor parameters) {
        if (!parameters.shape().equals(parameterShape()))
            throw new ShapeMismatchException(getClass().getSimpleName() + " expects parameters of " +
                                             parameterShape() + ", got " + parameters.shape());
    }

    static void checkArity(Layer layer, double[][] inputs) {
        if (inputs.length != layer.inputArity())
            throw new IllegalArgumentException(layer.getClass().getSimpleName() + " takes " + layer.inputArity() +
                                               " input(s), got " + inputs.length);
    }
}
