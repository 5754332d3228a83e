package dev.nabla.net;

/**
 * Thrown when a network's layers and connections do not form a valid DAG in
 * topological index order.
 */
public class NetworkValidationException extends IllegalArgumentException {

    private final int layerIndex;

    public NetworkValidationException(int layerIndex, String message) {
        super("Layer " + layerIndex + ": " + message);
        this.layerIndex = layerIndex;
    }

    /**
     * The offending layer, 1-based.
     */
    public int getLayerIndex() {
        return layerIndex;
    }
}
