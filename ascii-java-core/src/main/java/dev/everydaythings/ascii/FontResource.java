package dev.everydaythings.ascii;

/**
 * A loaded font that can size and rasterize single characters.
 *
 * <p>{@link #render} must return a mask whose size equals what {@link #measure} reports for
 * the same arguments.
 */
public interface FontResource extends AutoCloseable {

    /**
     * Query the box a character occupies at the given size and stroke weight. No pixels are kept.
     *
     * @throws FontLoadException if the character cannot be rendered by this font
     */
    GlyphBounds measure(int codepoint, int pixelSize, int strokeWeight);

    /**
     * Rasterize a character into its measured box.
     *
     * @throws FontLoadException if the character cannot be rendered by this font
     */
    GlyphMask render(int codepoint, int pixelSize, int strokeWeight);

    @Override
    void close();
}
