package dev.everydaythings.ascii;

import java.util.Arrays;

/**
 * One character of an atlas: its symbol, its RGB ink mask and the mask's density.
 *
 * <p>The mask is row-major, {@code width * height * 3} bytes, where higher values mean more ink
 * independent of the atlas polarity.
 */
public final class Glyph {

    private final int codepoint;
    private final int width;
    private final int height;
    private final byte[] mask;
    private final long density;

    Glyph(int codepoint, int width, int height, byte[] mask) {
        this.codepoint = codepoint;
        this.width = width;
        this.height = height;
        this.mask = mask;
        long sum = 0;
        for (byte b : mask) {
            sum += b & 0xFF;
        }
        this.density = sum;
    }

    public int codepoint() {
        return codepoint;
    }

    /** The symbol as a string (handles supplementary code points). */
    public String symbol() {
        return new String(Character.toChars(codepoint));
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Sum of all mask bytes across the three channels. */
    public long density() {
        return density;
    }

    /** Mask value of channel {@code c} at (x, y), 0-255. */
    public int mask(int x, int y, int c) {
        return mask[(y * width + x) * 3 + c] & 0xFF;
    }

    byte[] maskData() {
        return mask;
    }

    /** Whether both glyphs show the same symbol with the same mask. */
    public boolean sameAs(Glyph other) {
        return codepoint == other.codepoint
                && width == other.width
                && height == other.height
                && Arrays.equals(mask, other.mask);
    }

    @Override
    public String toString() {
        return "Glyph['" + symbol() + "' " + width + "x" + height + " density=" + density + "]";
    }
}
