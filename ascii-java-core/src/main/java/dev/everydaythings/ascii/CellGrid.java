package dev.everydaythings.ascii;

/**
 * One RGB sample per glyph cell, row-major, three bytes per cell.
 */
public final class CellGrid {

    private final int rows;
    private final int cols;
    private final byte[] samples;

    public CellGrid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.samples = new byte[rows * cols * 3];
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int cellCount() {
        return rows * cols;
    }

    /** Channel value (0 = R, 1 = G, 2 = B) of a cell, 0-255. */
    public int channel(int row, int col, int c) {
        return samples[(row * cols + col) * 3 + c] & 0xFF;
    }

    /** Raw samples; cell {@code i} occupies bytes {@code 3i..3i+2}. */
    byte[] samples() {
        return samples;
    }

    public boolean hasShape(int rows, int cols) {
        return this.rows == rows && this.cols == cols;
    }
}
