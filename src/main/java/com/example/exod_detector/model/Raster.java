package com.example.exod_detector.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable two-dimensional grid of doubles indexed {@code [row][col]}.
 * <p>
 * Used for per-tile variability matrices (rows are raw X, columns raw Y), for the assembled
 * mosaic and for the transformed sky-aligned image. Every geometric operation returns a new
 * instance.
 */
public final class Raster {

    private final int rows;
    private final int cols;
    private final double[][] data;

    private Raster(int rows, int cols, double[][] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    public static Raster zeros(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative raster shape: " + rows + "x" + cols);
        }
        return new Raster(rows, cols, new double[rows][cols]);
    }

    /**
     * Copies the given rectangular array.
     *
     * @param values row-major values, every row of equal length.
     * @return raster holding a private copy of {@code values}.
     */
    public static Raster of(double[][] values) {
        Objects.requireNonNull(values, "values");
        int r = values.length;
        int c = r == 0 ? 0 : values[0].length;
        double[][] copy = new double[r][];
        for (int i = 0; i < r; i++) {
            if (values[i].length != c) {
                throw new IllegalArgumentException("Ragged array at row " + i);
            }
            copy[i] = values[i].clone();
        }
        return new Raster(r, c, copy);
    }

    /** Takes ownership of {@code values} without copying; the caller must not touch it afterwards. */
    public static Raster wrap(double[][] values) {
        int r = values.length;
        int c = r == 0 ? 0 : values[0].length;
        for (int i = 0; i < r; i++) {
            if (values[i].length != c) {
                throw new IllegalArgumentException("Ragged array at row " + i);
            }
        }
        return new Raster(r, c, values);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    public double sum() {
        double total = 0.0;
        for (double[] row : data) {
            for (double v : row) {
                total += v;
            }
        }
        return total;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (double[] row : data) {
            for (double v : row) {
                m = Math.max(m, v);
            }
        }
        return m;
    }

    public double[][] toArray() {
        double[][] copy = new double[rows][];
        for (int i = 0; i < rows; i++) {
            copy[i] = data[i].clone();
        }
        return copy;
    }

    /** Appends every value to {@code target} starting at {@code offset}; returns the next offset. */
    public int copyInto(double[] target, int offset) {
        int pos = offset;
        for (double[] row : data) {
            System.arraycopy(row, 0, target, pos, cols);
            pos += cols;
        }
        return pos;
    }

    /** Reverses row order (numpy {@code flipud}). */
    public Raster flipRows() {
        double[][] out = new double[rows][];
        for (int i = 0; i < rows; i++) {
            out[i] = data[rows - 1 - i].clone();
        }
        return new Raster(rows, cols, out);
    }

    /** Reverses column order (numpy {@code fliplr}). */
    public Raster flipCols() {
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[i][j] = data[i][cols - 1 - j];
            }
        }
        return new Raster(rows, cols, out);
    }

    /** Reverses both axes (numpy {@code flip} without axis). */
    public Raster flip() {
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[i][j] = data[rows - 1 - i][cols - 1 - j];
            }
        }
        return new Raster(rows, cols, out);
    }

    public Raster transpose() {
        double[][] out = new double[cols][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[j][i] = data[i][j];
            }
        }
        return new Raster(cols, rows, out);
    }

    /** Quarter turn counter-clockwise (numpy {@code rot90}). */
    public Raster rotate90() {
        double[][] out = new double[cols][rows];
        for (int i = 0; i < cols; i++) {
            for (int j = 0; j < rows; j++) {
                out[i][j] = data[j][cols - 1 - i];
            }
        }
        return new Raster(cols, rows, out);
    }

    /** Quarter turn clockwise, the inverse of {@link #rotate90()}. */
    public Raster rotate270() {
        double[][] out = new double[cols][rows];
        for (int i = 0; i < cols; i++) {
            for (int j = 0; j < rows; j++) {
                out[i][j] = data[rows - 1 - j][i];
            }
        }
        return new Raster(cols, rows, out);
    }

    /**
     * Sub-raster over {@code [rowFrom, rowTo) x [colFrom, colTo)}.
     */
    public Raster crop(int rowFrom, int rowTo, int colFrom, int colTo) {
        if (rowFrom < 0 || colFrom < 0 || rowTo > rows || colTo > cols || rowFrom > rowTo || colFrom > colTo) {
            throw new IllegalArgumentException(String.format(
                    "Crop [%d,%d)x[%d,%d) outside raster %dx%d", rowFrom, rowTo, colFrom, colTo, rows, cols));
        }
        double[][] out = new double[rowTo - rowFrom][];
        for (int i = rowFrom; i < rowTo; i++) {
            out[i - rowFrom] = Arrays.copyOfRange(data[i], colFrom, colTo);
        }
        return new Raster(rowTo - rowFrom, colTo - colFrom, out);
    }

    /** Zero padding on each side (numpy {@code pad} with constant 0). */
    public Raster pad(int top, int bottom, int left, int right) {
        if (top < 0 || bottom < 0 || left < 0 || right < 0) {
            throw new IllegalArgumentException(String.format(
                    "Negative padding top=%d bottom=%d left=%d right=%d", top, bottom, left, right));
        }
        int newCols = cols + left + right;
        double[][] out = new double[rows + top + bottom][newCols];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(data[i], 0, out[i + top], left, cols);
        }
        return new Raster(rows + top + bottom, newCols, out);
    }

    /** Concatenation along axis 0; all parts must share the column count. */
    public static Raster stackRows(List<Raster> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to stack");
        }
        int c = parts.get(0).cols;
        int total = 0;
        for (Raster part : parts) {
            if (part.cols != c) {
                throw new IllegalArgumentException("Column mismatch: " + part.cols + " != " + c);
            }
            total += part.rows;
        }
        double[][] out = new double[total][];
        int pos = 0;
        for (Raster part : parts) {
            for (double[] row : part.data) {
                out[pos++] = row.clone();
            }
        }
        return new Raster(total, c, out);
    }

    /** Concatenation along axis 1; all parts must share the row count. */
    public static Raster stackCols(List<Raster> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to stack");
        }
        int r = parts.get(0).rows;
        int total = 0;
        for (Raster part : parts) {
            if (part.rows != r) {
                throw new IllegalArgumentException("Row mismatch: " + part.rows + " != " + r);
            }
            total += part.cols;
        }
        double[][] out = new double[r][total];
        int pos = 0;
        for (Raster part : parts) {
            for (int i = 0; i < r; i++) {
                System.arraycopy(part.data[i], 0, out[i], pos, part.cols);
            }
            pos += part.cols;
        }
        return new Raster(r, total, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Raster other)) return false;
        return rows == other.rows && cols == other.cols && Arrays.deepEquals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(rows, cols) + Arrays.deepHashCode(data);
    }

    @Override
    public String toString() {
        return "Raster[" + rows + "x" + cols + "]";
    }
}
