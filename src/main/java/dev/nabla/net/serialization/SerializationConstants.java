package dev.nabla.net.serialization;

/**
 * Constants for network serialization format.
 */
public final class SerializationConstants {

    // File format identification
    public static final int MAGIC_NUMBER = 0x4E41424C; // "NABL"
    public static final int CURRENT_VERSION = 1;

    // Type IDs
    public static final int TYPE_NETWORK = 0;
    public static final int TYPE_CONST_UNIT = 1;
    public static final int TYPE_LINEAR_LAYER = 2;
    public static final int TYPE_RECTIFIED_LINEAR_LAYER = 3;
    public static final int TYPE_SOFTMAX_LAYER = 4;
    public static final int TYPE_SUM_LAYER = 5;

    // File structure markers
    public static final int SECTION_LAYERS = 0x1001;
    public static final int SECTION_END = 0x1999;

    private SerializationConstants() {} // Prevent instantiation
}
