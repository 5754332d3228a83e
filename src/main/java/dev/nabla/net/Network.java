package dev.nabla.net;

import dev.nabla.net.layers.Layer;
import dev.nabla.net.math.Shape;
import dev.nabla.net.math.ShapeMismatchException;
import dev.nabla.net.math.Tensor;
import dev.nabla.net.serialization.Serializable;
import dev.nabla.net.serialization.SerializationConstants;
import dev.nabla.net.serialization.SerializationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A directed acyclic graph of layers.
 *
 * <p>Layers are numbered {@code 1..m}; index {@link #INPUT} (0) stands for the
 * network's external input. {@code connections[k]} lists, in argument order, the
 * indices feeding layer {@code k + 1}. Every index must be strictly smaller than
 * the layer it feeds, so index order is already a topological order and the graph
 * cannot contain a cycle. This is checked at construction.
 * <p>
 * Usage:
 * <pre>{@code
 * // diamond: layer 1 feeds layers 2 and 3, which both feed layer 4
 * Network net = new Network(
 *     List.of(Layers.relu(2, 3), Layers.linear(3, 3), Layers.relu(3, 3), Layers.sum(2)),
 *     new int[][]{{0}, {1}, {1}, {2, 3}});
 * }</pre>
 *
 * <p>The network is never mutated by evaluation or backpropagation, so one
 * instance may be shared by any number of {@link EvaluationContext}s on different
 * threads. {@link #setParameters(List)} must not run concurrently with them.
 */
public class Network implements Serializable {

    private static final Logger log = LoggerFactory.getLogger(Network.class);

    public static final int INPUT = 0;

    public static NetworkBuilder newBuilder() {
        return new NetworkBuilder();
    }

    private final Layer[] layers;
    private final int[][] connections;
    private final Map<Integer, int[]> evaluationOrders = new ConcurrentHashMap<>();

    public Network(List<? extends Layer> layers, int[][] connections) {
        if (layers.size() != connections.length)
            throw new IllegalArgumentException("Need one connection list per layer: " +
                                               "layers=" + layers.size() + ", connections=" + connections.length);

        this.layers = layers.toArray(new Layer[0]);
        this.connections = new int[connections.length][];
        for (int k = 0; k < connections.length; k++) {
            if (connections[k] == null)
                throw new NetworkValidationException(k + 1, "connection list is null");
            this.connections[k] = connections[k].clone();
        }

        validate();
        log.debug("Built {}", this);
    }

    /**
     * Chain the layers so that each consumes the previous layer's output and the
     * first consumes the network input.
     */
    public static Network sequential(Layer... layers) {
        int[][] connections = new int[layers.length][];
        for (int k = 0; k < layers.length; k++)
            connections[k] = new int[]{k};
        return new Network(Arrays.asList(layers), connections);
    }

    private void validate() {
        Map<Layer, Integer> seen = new IdentityHashMap<>();
        for (int i = 1; i <= layers.length; i++) {
            Layer layer = layers[i - 1];
            if (layer == null)
                throw new NetworkValidationException(i, "layer is null");

            Integer previous = seen.put(layer, i);
            if (previous != null)
                throw new NetworkValidationException(i, "same layer instance already used as layer " + previous);

            int[] inputs = connections[i - 1];
            for (int input : inputs) {
                if (input < INPUT || input >= i)
                    throw new NetworkValidationException(i, "takes input from " + input +
                            "; connections must reference the network input (0) or an earlier layer");
            }

            if (inputs.length != layer.inputArity())
                throw new NetworkValidationException(i, layer.getClass().getSimpleName() + " takes " +
                        layer.inputArity() + " input(s) but has " + inputs.length + " connection(s)");
        }
    }

    public int layerCount() {
        return layers.length;
    }

    /**
     * Index of the last layer, the default output layer.
     */
    public int outputLayer() {
        return layers.length;
    }

    /**
     * @param index 1-based layer index
     */
    public Layer layer(int index) {
        checkLayerIndex(index);
        return layers[index - 1];
    }

    public List<Layer> getLayers() {
        return Collections.unmodifiableList(Arrays.asList(layers));
    }

    /**
     * Indices feeding layer {@code index}, in argument order.
     */
    public int[] connections(int index) {
        return inputsOf(index).clone();
    }

    int[] inputsOf(int index) {
        checkLayerIndex(index);
        return connections[index - 1];
    }

    void checkLayerIndex(int index) {
        if (index < 1 || index > layers.length)
            throw new IndexOutOfBoundsException("Layer index " + index + " out of range 1.." + layers.length);
    }

    /**
     * Layers that {@code outputLayer} depends on, itself included, in ascending
     * index order. Forward evaluation walks this order; backpropagation walks it
     * in reverse, which visits every layer after all of its consumers.
     */
    public int[] evaluationOrder(int outputLayer) {
        return orderFor(outputLayer).clone();
    }

    int[] orderFor(int outputLayer) {
        checkLayerIndex(outputLayer);
        return evaluationOrders.computeIfAbsent(outputLayer, this::computeOrder);
    }

    private int[] computeOrder(int outputLayer) {
        boolean[] required = new boolean[outputLayer + 1];
        required[outputLayer] = true;
        int count = 0;
        for (int i = outputLayer; i >= 1; i--) {
            if (!required[i])
                continue;
            count++;
            for (int input : connections[i - 1])
                required[input] = true;
        }

        int[] order = new int[count];
        int n = 0;
        for (int i = 1; i <= outputLayer; i++) {
            if (required[i])
                order[n++] = i;
        }
        return order;
    }

    // ===== PARAMETERS =====

    /**
     * One parameter blob per layer, in layer order (element {@code k} belongs to
     * layer {@code k + 1}). Blobs are copies.
     */
    public List<Tensor> getParameters() {
        List<Tensor> parameters = new ArrayList<>(layers.length);
        for (Layer layer : layers)
            parameters.add(layer.getParameters());
        return parameters;
    }

    /**
     * Replace every layer's parameters, positionally matching {@link #getParameters()}.
     * All blobs are checked before any layer is touched, so a rejected call leaves
     * the network unchanged.
     *
     * @throws ShapeMismatchException if a blob does not have its layer's parameter shape
     */
    public void setParameters(List<Tensor> parameters) {
        if (parameters.size() != layers.length)
            throw new IllegalArgumentException("Need one parameter blob per layer: " +
                                               "layers=" + layers.length + ", blobs=" + parameters.size());
        for (int k = 0; k < layers.length; k++) {
            Shape expected = layers[k].parameterShape();
            Shape actual = parameters.get(k).shape();
            if (!actual.equals(expected))
                throw new ShapeMismatchException("Layer " + (k + 1) + " expects parameters of " +
                                                 expected + ", got " + actual);
        }
        for (int k = 0; k < layers.length; k++)
            layers[k].setParameters(parameters.get(k));
    }

    // ===== STATELESS EVALUATION =====

    /**
     * Evaluate the last layer. See {@link #evaluate(double[], int)}.
     */
    public double[] evaluate(double[] input) {
        return evaluate(input, outputLayer());
    }

    /**
     * Evaluate {@code outputLayer} without keeping intermediate results.
     *
     * <p>Inputs are resolved recursively with no caching, so a layer with fan-out
     * is recomputed once per path that reaches it. Meant for one-off inference; use
     * an {@link EvaluationContext} for training loops.
     */
    public double[] evaluate(double[] input, int outputLayer) {
        checkLayerIndex(outputLayer);
        return evaluateLayer(input, outputLayer);
    }

    private double[] evaluateLayer(double[] input, int index) {
        if (index == INPUT)
            return input;

        int[] inputs = connections[index - 1];
        double[][] values = new double[inputs.length][];
        for (int p = 0; p < inputs.length; p++)
            values[p] = evaluateLayer(input, inputs[p]);
        return layers[index - 1].forward(values);
    }

    // ===== SERIALIZATION =====

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        out.writeInt(SerializationConstants.SECTION_LAYERS);
        out.writeInt(layers.length);
        for (int k = 0; k < layers.length; k++) {
            out.writeInt(connections[k].length);
            for (int input : connections[k])
                out.writeInt(input);
            SerializationService.writeLayer(out, layers[k], version);
        }
    }

    public static Network deserialize(DataInputStream in, int version) throws IOException {
        int section = in.readInt();
        if (section != SerializationConstants.SECTION_LAYERS)
            throw new IOException("Invalid file format: expected layer section, got 0x" + Integer.toHexString(section));

        int count = in.readInt();
        if (count < 0)
            throw new IOException("Invalid layer count: " + count);

        List<Layer> layers = new ArrayList<>(count);
        int[][] connections = new int[count][];
        for (int k = 0; k < count; k++) {
            int arity = in.readInt();
            if (arity < 0)
                throw new IOException("Invalid connection count for layer " + (k + 1) + ": " + arity);
            connections[k] = new int[arity];
            for (int p = 0; p < arity; p++)
                connections[k][p] = in.readInt();
            try {
                layers.add(SerializationService.readLayer(in, version));
            } catch (IllegalArgumentException e) {
                throw new IOException("Stored layer " + (k + 1) + " is invalid", e);
            }
        }

        try {
            return new Network(layers, connections);
        } catch (NetworkValidationException e) {
            throw new IOException("Stored network is invalid", e);
        }
    }

    @Override
    public int getSerializedSize(int version) {
        int size = 8; // section marker + layer count
        for (int k = 0; k < layers.length; k++) {
            size += 4 + 4 * connections[k].length;
            size += SerializationService.layerSize(layers[k], version);
        }
        return size;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_NETWORK;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Network with layers (");
        for (int k = 0; k < layers.length; k++) {
            if (k > 0)
                sb.append(", ");
            sb.append(layers[k].getClass().getSimpleName());
        }
        return sb.append(")").toString();
    }
}
