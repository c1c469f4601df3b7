package dev.everydaythings.ascii;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Density-ordered, immutable sequence of equally sized glyphs.
 *
 * <p>Index 0 is the first glyph of the ramp: the least inked one, or the most inked one when the
 * atlas was built with {@code reverseOrder}. Safe to share between threads.
 *
 * @see GlyphAtlasBuilder
 */
public final class GlyphAtlas {

    private static final Logger log = Logger.getLogger(GlyphAtlas.class.getName());

    private static final GlyphAtlas EMPTY = new GlyphAtlas(List.of(), 0, 0);

    private final List<Glyph> glyphs;
    private final int glyphWidth;
    private final int glyphHeight;

    GlyphAtlas(List<Glyph> glyphs, int glyphWidth, int glyphHeight) {
        this.glyphs = List.copyOf(glyphs);
        this.glyphWidth = glyphWidth;
        this.glyphHeight = glyphHeight;
        for (Glyph g : this.glyphs) {
            if (g.width() != glyphWidth || g.height() != glyphHeight) {
                throw new IllegalArgumentException("Glyph " + g + " does not match atlas cell "
                        + glyphWidth + "x" + glyphHeight);
            }
        }
    }

    /** The "no atlas" marker. Converters holding it pass frames through unchanged. */
    public static GlyphAtlas empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return glyphs.isEmpty();
    }

    /** Number of glyphs. */
    public int size() {
        return glyphs.size();
    }

    public Glyph glyph(int index) {
        return glyphs.get(index);
    }

    public List<Glyph> glyphs() {
        return glyphs;
    }

    /** Common glyph cell width in pixels. */
    public int glyphWidth() {
        return glyphWidth;
    }

    /** Common glyph cell height in pixels. */
    public int glyphHeight() {
        return glyphHeight;
    }

    /** The symbols in ramp order, e.g. {@code " .:-=+*#%@"}. */
    public String symbols() {
        StringBuilder sb = new StringBuilder();
        for (Glyph g : glyphs) {
            sb.appendCodePoint(g.codepoint());
        }
        return sb.toString();
    }

    /**
     * Dump the atlas to a PPM file for visual inspection: all glyphs side by side, in ramp order.
     * PPM is a simple image format viewable by most image viewers.
     */
    public void debugDumpAtlas(Path path) throws IOException {
        if (isEmpty()) {
            throw new IllegalStateException("Cannot dump an empty atlas");
        }
        int stripWidth = glyphWidth * glyphs.size();
        try (OutputStream out = Files.newOutputStream(path)) {
            String header = "P6\n" + stripWidth + " " + glyphHeight + "\n255\n";
            out.write(header.getBytes(StandardCharsets.US_ASCII));
            for (int y = 0; y < glyphHeight; y++) {
                for (Glyph g : glyphs) {
                    out.write(g.maskData(), y * glyphWidth * 3, glyphWidth * 3);
                }
            }
        }
        log.info(() -> String.format("Atlas dumped to: %s (%dx%d, %d glyphs)",
                path, stripWidth, glyphHeight, glyphs.size()));
    }

    @Override
    public String toString() {
        return "GlyphAtlas[" + glyphs.size() + " glyphs, " + glyphWidth + "x" + glyphHeight
                + ", \"" + symbols() + "\"]";
    }
}
