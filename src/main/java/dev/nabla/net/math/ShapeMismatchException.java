package dev.nabla.net.math;

/**
 * Thrown by an arithmetic operation whose operands have incompatible dimensions.
 * Raised at the point of the operation, never pre-validated.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    static void check(boolean condition, String operation, String detail) {
        if (!condition)
            throw new ShapeMismatchException(operation + ": " + detail);
    }
}
