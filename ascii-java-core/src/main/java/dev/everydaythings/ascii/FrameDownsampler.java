package dev.everydaythings.ascii;

/**
 * Reduces a frame to one sample per glyph cell by fixed-stride sampling.
 *
 * <p>Cell (r, c) takes the pixel at (c * cellWidth, r * cellHeight). No averaging is done.
 * Partial cells along the right and bottom edges are kept; their sample still lies inside the
 * frame.
 */
public final class FrameDownsampler {

    private FrameDownsampler() {
    }

    /** Number of cell rows needed to cover {@code height} pixels. */
    public static int rows(int height, int cellHeight) {
        return (height + cellHeight - 1) / cellHeight;
    }

    /** Number of cell columns needed to cover {@code width} pixels. */
    public static int cols(int width, int cellWidth) {
        return (width + cellWidth - 1) / cellWidth;
    }

    public static CellGrid downsample(Frame frame, int cellWidth, int cellHeight) {
        return downsample(frame, cellWidth, cellHeight, null);
    }

    /**
     * Sample {@code frame} into a grid of {@code ceil(H / cellHeight) x ceil(W / cellWidth)} cells.
     *
     * @param reuse grid to fill if it already has the required shape; may be null
     * @return {@code reuse} when its shape matched, otherwise a new grid
     */
    public static CellGrid downsample(Frame frame, int cellWidth, int cellHeight, CellGrid reuse) {
        if (cellWidth <= 0 || cellHeight <= 0) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellWidth + "x" + cellHeight);
        }
        int rows = rows(frame.height(), cellHeight);
        int cols = cols(frame.width(), cellWidth);
        CellGrid grid = reuse != null && reuse.hasShape(rows, cols) ? reuse : new CellGrid(rows, cols);

        byte[] src = frame.pixels();
        byte[] dst = grid.samples();
        int rowStride = frame.width() * 3;
        int d = 0;
        for (int r = 0; r < rows; r++) {
            int rowBase = r * cellHeight * rowStride;
            for (int c = 0; c < cols; c++) {
                int s = rowBase + c * cellWidth * 3;
                dst[d++] = src[s];
                dst[d++] = src[s + 1];
                dst[d++] = src[s + 2];
            }
        }
        return grid;
    }
}
