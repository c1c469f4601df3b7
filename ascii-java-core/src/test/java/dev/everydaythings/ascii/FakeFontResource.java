package dev.everydaythings.ascii;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory font for tests. Every character renders as a box of uniform coverage.
 */
final class FakeFontResource implements FontResource {

    private final int defaultWidth;
    private final int defaultHeight;
    private final Map<Integer, Integer> coverage = new HashMap<>();
    private final Map<Integer, GlyphBounds> boxes = new HashMap<>();
    private final Map<Integer, GlyphBounds> renderedBoxes = new HashMap<>();
    private Integer missing;
    private int measureCalls;
    private boolean closed;

    FakeFontResource(int defaultWidth, int defaultHeight) {
        this.defaultWidth = defaultWidth;
        this.defaultHeight = defaultHeight;
    }

    /** Coverage 0, 25, 50, ... in character-set order, so the ramp keeps that order. */
    static FakeFontResource ramp(String characterSet, int width, int height) {
        FakeFontResource font = new FakeFontResource(width, height);
        int[] cps = characterSet.codePoints().toArray();
        for (int i = 0; i < cps.length; i++) {
            font.coverage(cps[i], Math.min(255, i * 25));
        }
        return font;
    }

    FakeFontResource coverage(int codepoint, int value) {
        coverage.put(codepoint, value);
        return this;
    }

    FakeFontResource box(int codepoint, int width, int height) {
        boxes.put(codepoint, new GlyphBounds(width, height));
        return this;
    }

    /** Make {@link #render} disagree with {@link #measure} for one character. */
    FakeFontResource renderedBox(int codepoint, int width, int height) {
        renderedBoxes.put(codepoint, new GlyphBounds(width, height));
        return this;
    }

    FakeFontResource missing(int codepoint) {
        this.missing = codepoint;
        return this;
    }

    int measureCalls() {
        return measureCalls;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public GlyphBounds measure(int codepoint, int pixelSize, int strokeWeight) {
        measureCalls++;
        check(codepoint);
        return boxes.getOrDefault(codepoint, new GlyphBounds(defaultWidth, defaultHeight));
    }

    @Override
    public GlyphMask render(int codepoint, int pixelSize, int strokeWeight) {
        check(codepoint);
        GlyphBounds box = renderedBoxes.getOrDefault(codepoint,
                boxes.getOrDefault(codepoint, new GlyphBounds(defaultWidth, defaultHeight)));
        byte[] data = new byte[box.width() * box.height()];
        Arrays.fill(data, (byte) (int) coverage.getOrDefault(codepoint, 128));
        return new GlyphMask(box.width(), box.height(), data);
    }

    @Override
    public void close() {
        closed = true;
    }

    private void check(int codepoint) {
        if (missing != null && missing == codepoint) {
            throw new FontLoadException(String.format("No glyph for U+%04X", codepoint));
        }
    }
}
