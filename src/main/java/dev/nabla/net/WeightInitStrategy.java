package dev.nabla.net;

/**
 * Weight initialization strategies for affine layers.
 */
public enum WeightInitStrategy {

    /**
     * Xavier/Glorot uniform initialization, the default.
     *
     * <p>Initializes weights uniformly in the range [-limit, +limit] where
     * limit = sqrt(6 / (fanIn + fanOut)). Keeps the variance of activations
     * roughly equal across layers by considering both inputs and outputs.
     */
    XAVIER,

    /**
     * He initialization: w = random_gaussian * sqrt(2 / fanIn).
     *
     * <p>Accounts for rectified layers zeroing about half their units by using
     * only fanIn and a factor of 2.
     */
    HE
}
