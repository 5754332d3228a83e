package dev.nabla.net.serialization;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import dev.nabla.net.Network;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and loads networks (layers, connections and parameters) as Zstd-compressed
 * binary files.
 *
 * <p>Format: magic number, version, timestamp, the network, end marker.
 */
public final class ModelSerializer {

    private static final Logger log = LoggerFactory.getLogger(ModelSerializer.class);

    // Compression level: 1=fast, 22=max compression, 3=good balance
    private static final int COMPRESSION_LEVEL = 3;

    private ModelSerializer() {}

    public static void save(Network network, Path filePath) throws IOException {
        try (OutputStream fileOut = Files.newOutputStream(filePath)) {
            write(network, fileOut);
        }
        log.info("Saved {} to {}", network, filePath);
    }

    public static Network load(Path filePath) throws IOException {
        Network network;
        try (InputStream fileIn = Files.newInputStream(filePath)) {
            network = read(fileIn);
        }
        log.info("Loaded {} from {}", network, filePath);
        return network;
    }

    public static byte[] toBytes(Network network) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        write(network, bytes);
        return bytes.toByteArray();
    }

    public static Network fromBytes(byte[] data) throws IOException {
        return read(new ByteArrayInputStream(data));
    }

    /**
     * Write a compressed model to {@code stream}, closing it.
     */
    private static void write(Network network, OutputStream stream) throws IOException {
        try (BufferedOutputStream buffered = new BufferedOutputStream(stream, 64 * 1024);
             ZstdOutputStream zstdOut = new ZstdOutputStream(buffered, COMPRESSION_LEVEL);
             DataOutputStream out = new DataOutputStream(zstdOut)) {

            writeHeader(out);
            network.writeTo(out, SerializationConstants.CURRENT_VERSION);
            out.writeInt(SerializationConstants.SECTION_END);
        }
    }

    /**
     * Read a compressed model from {@code stream}, closing it.
     */
    private static Network read(InputStream stream) throws IOException {
        try (BufferedInputStream buffered = new BufferedInputStream(stream, 64 * 1024);
             ZstdInputStream zstdIn = new ZstdInputStream(buffered);
             DataInputStream in = new DataInputStream(zstdIn)) {

            int version = validateHeader(in);
            Network network = Network.deserialize(in, version);

            int endMarker = in.readInt();
            if (endMarker != SerializationConstants.SECTION_END)
                throw new IOException("Invalid file format: missing end marker");

            return network;
        }
    }

    /**
     * Uncompressed size of the saved model in bytes.
     */
    public static long estimateFileSize(Network network) {
        return 16 + network.getSerializedSize(SerializationConstants.CURRENT_VERSION) + 4; // header + model + end marker
    }

    private static void writeHeader(DataOutputStream out) throws IOException {
        out.writeInt(SerializationConstants.MAGIC_NUMBER);
        out.writeInt(SerializationConstants.CURRENT_VERSION);
        out.writeLong(System.currentTimeMillis()); // Timestamp
    }

    private static int validateHeader(DataInputStream in) throws IOException {
        int magic = in.readInt();
        if (magic != SerializationConstants.MAGIC_NUMBER)
            throw new IOException("Invalid file format: wrong magic number");

        int version = in.readInt();
        if (version > SerializationConstants.CURRENT_VERSION)
            throw new IOException("Unsupported file version: " + version +
                                  " (current version: " + SerializationConstants.CURRENT_VERSION + ")");

        in.readLong(); // timestamp, informational only
        return version;
    }
}
