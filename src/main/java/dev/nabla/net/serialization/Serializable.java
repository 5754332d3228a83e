package dev.nabla.net.serialization;

import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Interface for binary serialization.
 *
 * <p>Each class writes its own data format. Reading is done by a static
 * {@code deserialize(DataInputStream, int)} on the concrete class, dispatched
 * by {@link SerializationService} on the value of {@link #getTypeId()}.
 */
public interface Serializable {

    /**
     * Write this object's data to the output stream.
     *
     * @param out output stream to write to
     * @param version serialization version for compatibility
     * @throws IOException if writing fails
     */
    void writeTo(DataOutputStream out, int version) throws IOException;

    /**
     * Get the serialized size in bytes, excluding the type identifier.
     *
     * @param version serialization version
     * @return size in bytes
     */
    int getSerializedSize(int version);

    /**
     * Get the type identifier for this serializable class.
     *
     * @return unique type identifier
     */
    int getTypeId();
}
