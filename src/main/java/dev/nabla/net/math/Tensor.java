package dev.nabla.net.math;

import java.util.Arrays;

/**
 * Dense tensor with a {@link Shape} and flat row-major storage.
 *
 * <p>Used as the opaque per-layer parameter blob and as the parameter-gradient
 * accumulator. Rank-1 tensors are vectors, rank-2 tensors are matrices whose
 * element {@code (r, c)} lives at {@code data[r * cols + c]}.
 */
public final class Tensor {

    private final Shape shape;
    private final double[] data;

    private Tensor(Shape shape, double[] data) {
        ShapeMismatchException.check(shape.toFlatSize() == data.length, "tensor",
                "data length " + data.length + " does not fit " + shape);
        this.shape = shape;
        this.data = data;
    }

    public static Tensor zeros(Shape shape) {
        return new Tensor(shape, new double[shape.toFlatSize()]);
    }

    public static Tensor empty() {
        return zeros(Shape.empty());
    }

    /**
     * Wrap a copy of {@code values} as a vector.
     */
    public static Tensor of(double[] values) {
        return new Tensor(Shape.vector(values.length), values.clone());
    }

    /**
     * Copy a rectangular matrix into a rank-2 tensor.
     */
    public static Tensor of(double[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        double[] data = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            ShapeMismatchException.check(matrix[r].length == cols, "tensor",
                    "ragged matrix: row " + r + " has " + matrix[r].length + " columns, expected " + cols);
            System.arraycopy(matrix[r], 0, data, r * cols, cols);
        }
        return new Tensor(Shape.matrix(rows, cols), data);
    }

    /**
     * Wrap {@code data} without copying.
     */
    public static Tensor wrap(Shape shape, double[] data) {
        return new Tensor(shape, data);
    }

    public Shape shape() {
        return shape;
    }

    /**
     * Backing storage; writes are visible through this tensor.
     */
    public double[] data() {
        return data;
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public int rows() {
        return shape.dim(0);
    }

    public int cols() {
        return shape.rank() < 2 ? 1 : shape.dim(1);
    }

    public double get(int index) {
        return data[index];
    }

    public double get(int row, int col) {
        return data[row * cols() + col];
    }

    public void set(int row, int col, double value) {
        data[row * cols() + col] = value;
    }

    public double[] row(int row) {
        int cols = cols();
        return Arrays.copyOfRange(data, row * cols, (row + 1) * cols);
    }

    public double[][] toMatrix() {
        int rows = rows();
        double[][] matrix = new double[rows][];
        for (int r = 0; r < rows; r++)
            matrix[r] = row(r);
        return matrix;
    }

    public double[] toArray() {
        return data.clone();
    }

    public Tensor copy() {
        return new Tensor(shape, data.clone());
    }

    public void fill(double value) {
        Arrays.fill(data, value);
    }

    /**
     * this += other
     */
    public void addInPlace(Tensor other) {
        ShapeMismatchException.check(shape.equals(other.shape), "add",
                "operand " + other.shape + " does not match accumulator " + shape);
        NetMath.elementwiseAccumulate(data, other.data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Tensor))
            return false;
        Tensor other = (Tensor) o;
        return shape.equals(other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * shape.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Tensor" + shape + Arrays.toString(data);
    }
}
