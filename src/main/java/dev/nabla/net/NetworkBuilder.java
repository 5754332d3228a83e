package dev.nabla.net;

import dev.nabla.net.layers.Layer;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for networks with arbitrary connections.
 *
 * <p>Layers get indices 1, 2, ... in the order they are added. Connections are
 * validated when {@link #build()} constructs the {@link Network}.
 *
 * <pre>{@code
 * // diamond: 1 feeds 2 and 3, both feed 4
 * Network net = Network.newBuilder()
 *     .then(Layers.relu(4, 8))            // 1 <- input
 *     .add(Layers.relu(8, 8), 1)          // 2 <- 1
 *     .add(Layers.linear(8, 8), 1)        // 3 <- 1
 *     .add(Layers.sum(2), 2, 3)           // 4 <- 2, 3
 *     .build();
 * }</pre>
 */
public class NetworkBuilder {

    private final List<Layer> layers = new ArrayList<>();
    private final List<int[]> connections = new ArrayList<>();

    /**
     * Add a layer fed by the given layer indices (0 for the network input).
     */
    public NetworkBuilder add(Layer layer, int... inputs) {
        layers.add(layer);
        connections.add(inputs.clone());
        return this;
    }

    /**
     * Add a layer fed by the most recently added layer, or by the network input if
     * this is the first layer. Layers that take no inputs get no connection.
     */
    public NetworkBuilder then(Layer layer) {
        if (layer.inputArity() == 0)
            return add(layer);
        return add(layer, layers.size());
    }

    /**
     * Index the next added layer will receive.
     */
    public int nextIndex() {
        return layers.size() + 1;
    }

    public Network build() {
        return new Network(layers, connections.toArray(new int[0][]));
    }
}
