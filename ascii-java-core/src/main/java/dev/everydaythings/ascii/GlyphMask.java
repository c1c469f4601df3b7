package dev.everydaythings.ascii;

/**
 * Single-channel 8-bit coverage of one rendered character, as produced by a {@link FontResource}.
 *
 * <p>Coverage is row-major, {@code width * height} bytes, 0 = untouched, 255 = fully inked.
 * The array is copied on construction, so a font may reuse its scratch buffer.
 */
public final class GlyphMask {

    private final int width;
    private final int height;
    private final byte[] coverage;

    public GlyphMask(int width, int height, byte[] coverage) {
        if (coverage.length != width * height) {
            throw new IllegalArgumentException(String.format(
                    "Coverage length %d does not match %dx%d", coverage.length, width, height));
        }
        this.width = width;
        this.height = height;
        this.coverage = coverage.clone();
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Coverage at (x, y), 0-255. */
    public int coverage(int x, int y) {
        return coverage[y * width + x] & 0xFF;
    }
}
