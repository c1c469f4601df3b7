package dev.everydaythings.ascii;

import java.util.Objects;

/**
 * Expands a glyph-index grid into the final ASCII raster.
 *
 * <p>Each output pixel is {@code floor(mask * tint / 255)} per channel, where {@code mask} comes
 * from the glyph chosen for the cell and {@code tint} is the cell's sampled color or the fixed
 * color. Under {@link Polarity#LIGHT} the tint is complemented before blending and the result is
 * complemented once after. With clipping the output matches the source frame size, otherwise it
 * covers every cell in full.
 *
 * <p>Tiling, blending, clipping and inversion are done in one pass over the visible pixels.
 */
public final class Compositor {

    private final GlyphAtlas atlas;
    private final Polarity polarity;
    private final ColorMode colorMode;
    private final boolean clip;

    /**
     * @throws IllegalArgumentException if the atlas is empty
     */
    public Compositor(GlyphAtlas atlas, Polarity polarity, ColorMode colorMode, boolean clip) {
        this.atlas = Objects.requireNonNull(atlas, "atlas");
        if (atlas.isEmpty()) {
            throw new IllegalArgumentException("Cannot composite against an empty atlas");
        }
        this.polarity = Objects.requireNonNull(polarity, "polarity");
        this.colorMode = Objects.requireNonNull(colorMode, "colorMode");
        this.clip = clip;
    }

    /** Output width for a source frame of the given width. */
    public int outputWidth(int frameWidth) {
        int fw = atlas.glyphWidth();
        return clip ? frameWidth : FrameDownsampler.cols(frameWidth, fw) * fw;
    }

    /** Output height for a source frame of the given height. */
    public int outputHeight(int frameHeight) {
        int fh = atlas.glyphHeight();
        return clip ? frameHeight : FrameDownsampler.rows(frameHeight, fh) * fh;
    }

    /**
     * Composite one frame.
     *
     * @param cells       sampled colors as read from the frame
     * @param indices     glyph index per cell, row-major
     * @param frameWidth  width of the source frame
     * @param frameHeight height of the source frame
     * @param reusable    buffer to fill if its shape matches the output; may be null
     * @return {@code reusable} when its shape matched, otherwise a newly allocated frame
     */
    public Frame composite(CellGrid cells, int[] indices, int frameWidth, int frameHeight, Frame reusable) {
        int fw = atlas.glyphWidth();
        int fh = atlas.glyphHeight();
        int rows = cells.rows();
        int cols = cells.cols();
        if (indices.length != rows * cols) {
            throw new IllegalArgumentException("Index grid has " + indices.length + " cells, expected " + rows * cols);
        }
        int outW = outputWidth(frameWidth);
        int outH = outputHeight(frameHeight);
        Frame out = reusable != null && reusable.hasShape(outW, outH) ? reusable : new Frame(outW, outH);

        // Resolved once per frame, not per cell
        int fixedR = -1, fixedG = -1, fixedB = -1;
        if (colorMode instanceof ColorMode.Fixed fixed) {
            Rgb tint = polarity.inverted() ? fixed.color().complement() : fixed.color();
            fixedR = tint.r();
            fixedG = tint.g();
            fixedB = tint.b();
        }
        boolean invert = polarity.inverted();
        int flip = invert ? 0xFF : 0;

        byte[] dst = out.pixels();
        byte[] samples = cells.samples();
        int dstStride = outW * 3;
        int maskStride = fw * 3;

        for (int row = 0; row < rows; row++) {
            int y0 = row * fh;
            int yEnd = Math.min(y0 + fh, outH);
            for (int col = 0; col < cols; col++) {
                int x0 = col * fw;
                int xEnd = Math.min(x0 + fw, outW);
                int cell = row * cols + col;
                byte[] mask = atlas.glyph(indices[cell]).maskData();

                int tr, tg, tb;
                if (fixedR >= 0) {
                    tr = fixedR;
                    tg = fixedG;
                    tb = fixedB;
                } else {
                    int s = cell * 3;
                    tr = (samples[s] & 0xFF) ^ flip;
                    tg = (samples[s + 1] & 0xFF) ^ flip;
                    tb = (samples[s + 2] & 0xFF) ^ flip;
                }

                int span = (xEnd - x0) * 3;
                for (int y = y0; y < yEnd; y++) {
                    int m = (y - y0) * maskStride;
                    int o = y * dstStride + x0 * 3;
                    int end = o + span;
                    while (o < end) {
                        int r = ((mask[m] & 0xFF) * tr) / 255;
                        int g = ((mask[m + 1] & 0xFF) * tg) / 255;
                        int b = ((mask[m + 2] & 0xFF) * tb) / 255;
                        if (invert) {
                            r = 255 - r;
                            g = 255 - g;
                            b = 255 - b;
                        }
                        dst[o] = (byte) r;
                        dst[o + 1] = (byte) g;
                        dst[o + 2] = (byte) b;
                        o += 3;
                        m += 3;
                    }
                }
            }
        }
        return out;
    }
}
