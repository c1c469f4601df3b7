package dev.everydaythings.ascii;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Fluent builder that renders a character set into a {@link GlyphAtlas}.
 *
 * <p>Usage:
 * <pre>{@code
 * GlyphAtlas atlas = new GlyphAtlasBuilder(font)
 *     .characterSet(" .:-=+*#%@")
 *     .fontSize(16)
 *     .strokeWeight(2)
 *     .polarity(Polarity.DARK)
 *     .build();
 * }</pre>
 *
 * <p>Building happens in two passes. The first pass only measures every character and keeps
 * the smallest width and the smallest height seen; that pair becomes the cell size of the atlas.
 * The second pass renders each character into its own box and crops it to the cell size, so all
 * glyphs can be tiled on one fixed grid.
 */
public class GlyphAtlasBuilder {

    private static final Logger log = Logger.getLogger(GlyphAtlasBuilder.class.getName());

    private final FontResource font;

    private String characterSet = AsciiConfig.DEFAULT_CHARACTER_SET;
    private int fontSize = AsciiConfig.DEFAULT_FONT_SIZE;
    private int strokeWeight = AsciiConfig.DEFAULT_STROKE_WEIGHT;
    private Polarity polarity = Polarity.DARK;
    private boolean reverseOrder;

    /**
     * @param font font used for measuring and rendering; not closed by the builder
     */
    public GlyphAtlasBuilder(FontResource font) {
        this.font = Objects.requireNonNull(font, "font");
    }

    /** Builder preloaded with the atlas settings of a configuration. */
    public static GlyphAtlasBuilder of(FontResource font, AsciiConfig config) {
        return new GlyphAtlasBuilder(font)
                .characterSet(config.characterSet())
                .fontSize(config.fontSize())
                .strokeWeight(config.strokeWeight())
                .polarity(config.polarity())
                .reverseOrder(config.reverseOrder());
    }

    /** Symbols to include. Repeated symbols are kept once, at their first position. */
    public GlyphAtlasBuilder characterSet(String characterSet) {
        this.characterSet = Objects.requireNonNull(characterSet, "characterSet");
        return this;
    }

    /** Font size in pixels. */
    public GlyphAtlasBuilder fontSize(int fontSize) {
        this.fontSize = fontSize;
        return this;
    }

    /** Extra stroke width in pixels added around each glyph outline (0 = none). */
    public GlyphAtlasBuilder strokeWeight(int strokeWeight) {
        this.strokeWeight = strokeWeight;
        return this;
    }

    public GlyphAtlasBuilder polarity(Polarity polarity) {
        this.polarity = Objects.requireNonNull(polarity, "polarity");
        return this;
    }

    /** Sort the ramp from most to least inked instead of least to most. */
    public GlyphAtlasBuilder reverseOrder(boolean reverseOrder) {
        this.reverseOrder = reverseOrder;
        return this;
    }

    /**
     * Build the atlas.
     *
     * @throws EmptyCharsetException if the character set has no symbols
     * @throws FontLoadException     if the font cannot render the set at this size
     */
    public GlyphAtlas build() {
        if (fontSize <= 0) {
            throw new IllegalStateException("fontSize must be positive: " + fontSize);
        }
        if (strokeWeight < 0) {
            throw new IllegalStateException("strokeWeight must not be negative: " + strokeWeight);
        }
        int[] codepoints = characterSet.codePoints().distinct().toArray();
        if (codepoints.length == 0) {
            throw new EmptyCharsetException();
        }
        if (codepoints.length != characterSet.codePointCount(0, characterSet.length())) {
            log.fine(() -> "Dropped repeated symbols from character set: \"" + characterSet + "\"");
        }

        // Measure first
        int minWidth = Integer.MAX_VALUE;
        int minHeight = Integer.MAX_VALUE;
        Map<Integer, GlyphBounds> measured = new LinkedHashMap<>();
        for (int cp : codepoints) {
            GlyphBounds bounds = font.measure(cp, fontSize, strokeWeight);
            measured.put(cp, bounds);
            minWidth = Math.min(minWidth, bounds.width());
            minHeight = Math.min(minHeight, bounds.height());
        }
        if (minWidth == 0 || minHeight == 0) {
            throw new FontLoadException(String.format(
                    "Glyph cell collapsed to %dx%d at size %d", minWidth, minHeight, fontSize));
        }

        // Render into each measured box, crop to the shared cell
        List<Glyph> glyphs = new ArrayList<>(codepoints.length);
        for (int cp : codepoints) {
            GlyphMask coverage = font.render(cp, fontSize, strokeWeight);
            GlyphBounds bounds = measured.get(cp);
            if (coverage.width() != bounds.width() || coverage.height() != bounds.height()) {
                throw new FontLoadException(String.format(
                        "Rendered U+%04X as %dx%d but measured %dx%d", cp,
                        coverage.width(), coverage.height(), bounds.width(), bounds.height()));
            }
            glyphs.add(new Glyph(cp, minWidth, minHeight, paint(coverage, minWidth, minHeight)));
        }

        // List.sort is stable: equal densities keep character-set order in both directions
        Comparator<Glyph> byDensity = Comparator.comparingLong(Glyph::density);
        glyphs.sort(reverseOrder ? byDensity.reversed() : byDensity);

        GlyphAtlas atlas = new GlyphAtlas(glyphs, minWidth, minHeight);
        final int cellW = minWidth;
        final int cellH = minHeight;
        log.info(() -> String.format("Glyph atlas built: %d glyphs, cell %dx%d, size=%d stroke=%d %s ramp \"%s\"",
                atlas.size(), cellW, cellH, fontSize, strokeWeight, polarity, atlas.symbols()));
        return atlas;
    }

    /**
     * Paint coverage as ink over the polarity background, crop it to the cell, and undo the
     * polarity so the mask always reads "higher = more ink".
     */
    private byte[] paint(GlyphMask coverage, int cellWidth, int cellHeight) {
        int bg = polarity.background();
        int fg = polarity.foreground();
        byte[] mask = new byte[cellWidth * cellHeight * 3];
        int o = 0;
        for (int y = 0; y < cellHeight; y++) {
            for (int x = 0; x < cellWidth; x++) {
                int v = bg + ((fg - bg) * coverage.coverage(x, y)) / 255;
                if (polarity.inverted()) {
                    v = 255 - v;
                }
                byte b = (byte) v;
                mask[o++] = b;
                mask[o++] = b;
                mask[o++] = b;
            }
        }
        return mask;
    }
}
