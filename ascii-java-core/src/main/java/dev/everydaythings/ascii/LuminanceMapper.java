package dev.everydaythings.ascii;

/**
 * Scores cell brightness and picks a glyph from the atlas ramp.
 *
 * <p>Luminance is {@code 3R + 4G + B} (0..2040). The index is {@code (L * N) >> 11}, clamped to
 * {@code [0, N-1]}. The shift divides by 2048 rather than 2040, so the top glyph is reached a
 * little before full white for small atlases; that is the expected ramp and must stay as is.
 */
public final class LuminanceMapper {

    /** Largest value {@link #luminance} can return. */
    public static final int MAX_LUMINANCE = 2040;

    private static final int SCALE_SHIFT = 11;

    private LuminanceMapper() {
    }

    public static int luminance(int r, int g, int b) {
        return 3 * r + 4 * g + b;
    }

    /**
     * Glyph index for a luminance value in an atlas of {@code glyphCount} glyphs.
     * Monotonic non-decreasing in {@code luminance}.
     */
    public static int index(int luminance, int glyphCount) {
        if (glyphCount <= 0) {
            throw new IllegalArgumentException("glyphCount must be positive: " + glyphCount);
        }
        int index = (int) (((long) luminance * glyphCount) >> SCALE_SHIFT);
        return Math.max(0, Math.min(index, glyphCount - 1));
    }

    public static int[] map(CellGrid grid, int glyphCount) {
        return map(grid, glyphCount, null);
    }

    /**
     * Map every cell of {@code grid} to a glyph index, row-major.
     *
     * @param reuse index array to fill if its length equals the cell count; may be null
     */
    public static int[] map(CellGrid grid, int glyphCount, int[] reuse) {
        return map(grid, glyphCount, false, reuse);
    }

    /**
     * Map every cell of {@code grid} to a glyph index, row-major, optionally scoring the
     * complement ({@code 255 - v}) of each sample instead of the sample itself. The grid is not
     * modified.
     *
     * @param complement score {@code 255 - v} per channel
     * @param reuse      index array to fill if its length equals the cell count; may be null
     */
    public static int[] map(CellGrid grid, int glyphCount, boolean complement, int[] reuse) {
        int cells = grid.cellCount();
        int[] indices = reuse != null && reuse.length == cells ? reuse : new int[cells];
        byte[] samples = grid.samples();
        int flip = complement ? 0xFF : 0;
        for (int i = 0, s = 0; i < cells; i++, s += 3) {
            int l = luminance((samples[s] & 0xFF) ^ flip, (samples[s + 1] & 0xFF) ^ flip, (samples[s + 2] & 0xFF) ^ flip);
            indices[i] = index(l, glyphCount);
        }
        return indices;
    }
}
