/**
 * Frame to ASCII-art raster conversion.
 *
 * <p>A {@link dev.everydaythings.ascii.GlyphAtlas} is built once from a character set and a
 * {@link dev.everydaythings.ascii.FontResource}; every frame is then sampled once per glyph cell,
 * each sample picks a glyph by luminance, and the glyphs are tinted and tiled into the output.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * AsciiConfig config = AsciiConfig.builder()
 *         .fontPath(Path.of("/usr/share/fonts/truetype/dejavu/DejaVuSansMono.ttf"))
 *         .characterSet(" .:-=+*#%@")
 *         .build();
 *
 * // Falls back to passthrough if the font cannot be loaded
 * AsciiConverter converter = AsciiConverter.create(config, FreeTypeFontResource::open);
 *
 * Frame out = null;
 * while (capturing) {
 *     Frame in = camera.acquireNextFrame();
 *     out = converter.convert(in, out);  // reuses 'out' when the size is unchanged
 * }
 * }</pre>
 *
 * <h2>Mask Convention</h2>
 * <p>Glyph masks always store ink as high values. A light-background atlas is rendered black on
 * white and then inverted, so its masks equal the dark-background ones; the inversion is applied
 * again, once, to the finished frame.
 *
 * <h2>Integer Semantics</h2>
 * <p>All per-pixel math is integer: luminance {@code 3R + 4G + B}, glyph index
 * {@code (L * N) >> 11}, blend {@code mask * tint / 255} with truncation. Output is bit-for-bit
 * reproducible.
 *
 * @see dev.everydaythings.ascii.AsciiConverter
 * @see dev.everydaythings.ascii.GlyphAtlasBuilder
 * @see dev.everydaythings.ascii.live.ConversionLoop
 */
package dev.everydaythings.ascii;
