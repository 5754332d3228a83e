package dev.nabla.net.serialization;

import dev.nabla.net.layers.ConstUnit;
import dev.nabla.net.layers.Layer;
import dev.nabla.net.layers.LinearLayer;
import dev.nabla.net.layers.RectifiedLinearLayer;
import dev.nabla.net.layers.SoftmaxLayer;
import dev.nabla.net.layers.SumLayer;
import dev.nabla.net.math.Shape;
import dev.nabla.net.math.Tensor;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * Shared encoders for tensors and layers.
 *
 * <p>Layers are written as their type ID followed by their own payload, and read
 * back by dispatching on that ID.
 */
public final class SerializationService {

    private SerializationService() {} // Prevent instantiation

    public static void writeTensor(DataOutputStream out, Tensor tensor) throws IOException {
        Shape shape = tensor.shape();
        out.writeInt(shape.rank());
        for (int i = 0; i < shape.rank(); i++)
            out.writeInt(shape.dim(i));
        for (double value : tensor.data())
            out.writeDouble(value);
    }

    public static Tensor readTensor(DataInputStream in) throws IOException {
        int rank = in.readInt();
        if (rank < 0)
            throw new IOException("Invalid tensor rank: " + rank);

        int[] dims = new int[rank];
        for (int i = 0; i < rank; i++) {
            dims[i] = in.readInt();
            if (dims[i] < 0)
                throw new IOException("Invalid tensor dimension: " + dims[i]);
        }

        int size = 1;
        try {
            for (int dim : dims)
                size = Math.multiplyExact(size, dim);
        } catch (ArithmeticException e) {
            throw new IOException("Tensor too large: " + Arrays.toString(dims), e);
        }

        Shape shape = Shape.of(dims);
        double[] data = new double[size];
        for (int i = 0; i < data.length; i++)
            data[i] = in.readDouble();
        return Tensor.wrap(shape, data);
    }

    public static int tensorSize(Tensor tensor) {
        return 4 + 4 * tensor.shape().rank() + 8 * tensor.size();
    }

    public static void writeLayer(DataOutputStream out, Layer layer, int version) throws IOException {
        if (!(layer instanceof Serializable))
            throw new IOException("Layer type does not support serialization: " + layer.getClass().getName());

        Serializable serializable = (Serializable) layer;
        out.writeInt(serializable.getTypeId());
        serializable.writeTo(out, version);
    }

    public static Layer readLayer(DataInputStream in, int version) throws IOException {
        int typeId = in.readInt();
        return switch (typeId) {
            case SerializationConstants.TYPE_CONST_UNIT -> ConstUnit.deserialize(in, version);
            case SerializationConstants.TYPE_LINEAR_LAYER -> LinearLayer.deserialize(in, version);
            case SerializationConstants.TYPE_RECTIFIED_LINEAR_LAYER -> RectifiedLinearLayer.deserialize(in, version);
            case SerializationConstants.TYPE_SOFTMAX_LAYER -> SoftmaxLayer.deserialize(in, version);
            case SerializationConstants.TYPE_SUM_LAYER -> SumLayer.deserialize(in, version);
            default -> throw new IOException("Unknown layer type ID: " + typeId);
        };
    }

    public static int layerSize(Layer layer, int version) {
        return 4 + ((Serializable) layer).getSerializedSize(version);
    }
}
