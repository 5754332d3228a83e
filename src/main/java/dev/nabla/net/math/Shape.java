package dev.nabla.net.math;

import java.util.Arrays;

/**
 * Represents the shape of a tensor (multi-dimensional array).
 * This class is immutable.
 */
public record Shape(int[] dims) {

    public Shape {
        dims = dims.clone();
        for (int dim : dims) {
            if (dim < 0)
                throw new IllegalArgumentException("Shape dimensions must be non-negative: " + Arrays.toString(dims));
        }
    }

    public static Shape vector(int size) {
        return new Shape(new int[]{size});
    }

    public static Shape matrix(int rows, int cols) {
        return new Shape(new int[]{rows, cols});
    }

    /**
     * Shape of a parameter-free layer's blob.
     */
    public static Shape empty() {
        return vector(0);
    }

    public static Shape of(int... dimensions) {
        return new Shape(dimensions);
    }

    @Override
    public int[] dims() {
        return dims.clone();
    }

    public int rank() {
        return dims.length;
    }

    public int dim(int i) {
        return dims[i];
    }

    public int toFlatSize() {
        int size = 1;
        for (int dim : dims) {
            size = Math.multiplyExact(size, dim);
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Shape))
            return false;
        return Arrays.equals(dims, ((Shape) o).dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        return "Shape" + Arrays.toString(dims);
    }
}
