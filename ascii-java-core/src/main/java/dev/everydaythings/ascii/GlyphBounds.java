package dev.everydaythings.ascii;

/**
 * Size of the box a character is rendered into, in pixels.
 *
 * @param width  box width
 * @param height box height
 */
public record GlyphBounds(int width, int height) {

    public GlyphBounds {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative glyph bounds: " + width + "x" + height);
        }
    }
}
