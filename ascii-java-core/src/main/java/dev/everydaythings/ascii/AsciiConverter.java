package dev.everydaythings.ascii;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts frames into colored ASCII-art rasters.
 *
 * <p>Per frame: the frame is sampled once per glyph cell ({@link FrameDownsampler}), each sample
 * picks a glyph by luminance ({@link LuminanceMapper}), and the chosen glyphs are tinted and
 * tiled into the output ({@link Compositor}).
 *
 * <p>A converter without an atlas is a passthrough: {@link #convert} returns the input frame
 * unchanged. {@link #create} falls back to one when the font cannot be loaded or the character
 * set is empty.
 *
 * <p>Instances are immutable and may be shared; the atlas is never modified after construction.
 */
public final class AsciiConverter {

    private static final Logger log = Logger.getLogger(AsciiConverter.class.getName());

    private final AsciiConfig config;
    private final GlyphAtlas atlas;
    private final Compositor compositor;
    private final AtomicBoolean passthroughWarned = new AtomicBoolean();

    /**
     * Wrap an already built atlas. An empty atlas makes this a passthrough converter.
     */
    public AsciiConverter(GlyphAtlas atlas, AsciiConfig config) {
        this.atlas = Objects.requireNonNull(atlas, "atlas");
        this.config = Objects.requireNonNull(config, "config");
        this.compositor = atlas.isEmpty()
                ? null
                : new Compositor(atlas, config.polarity(), config.colorMode(), config.clipToOriginal());
    }

    /** A converter that forwards every frame unchanged. */
    public static AsciiConverter passthrough(AsciiConfig config) {
        return new AsciiConverter(GlyphAtlas.empty(), config);
    }

    /**
     * Load the configured font and build the atlas. Never throws for font or character-set
     * problems: those are logged and a passthrough converter is returned instead.
     *
     * @param fonts opens the font named by {@link AsciiConfig#fontPath()}
     */
    public static AsciiConverter create(AsciiConfig config, FontProvider fonts) {
        Objects.requireNonNull(fonts, "fonts");
        try {
            Path fontPath = config.fontPath()
                    .orElseThrow(() -> new FontLoadException("No font path configured"));
            GlyphAtlas atlas;
            try (FontResource font = fonts.open(fontPath)) {
                atlas = GlyphAtlasBuilder.of(font, config).build();
            }
            return new AsciiConverter(atlas, config);
        } catch (AtlasBuildException e) {
            log.log(Level.WARNING, "Glyph atlas unavailable, frames will pass through unchanged: "
                    + e.getMessage(), e);
            return passthrough(config);
        }
    }

    /**
     * A converter for {@code next}. The atlas is kept when only compositing settings changed,
     * otherwise it is rebuilt with {@link #create}.
     */
    public AsciiConverter withConfig(AsciiConfig next, FontProvider fonts) {
        if (!isPassthrough() && config.sameAtlasSettings(next)) {
            return next.equals(config) ? this : new AsciiConverter(atlas, next);
        }
        log.info(() -> "Atlas settings changed, rebuilding: " + next);
        return create(next, fonts);
    }

    public Frame convert(Frame frame) {
        return convert(frame, null);
    }

    /**
     * Convert one frame.
     *
     * @param frame    RGB input
     * @param reusable output buffer from a previous call; filled in place and returned when its
     *                 shape matches the required output, otherwise ignored
     * @return the ASCII raster, or {@code frame} itself in passthrough mode
     */
    public Frame convert(Frame frame, Frame reusable) {
        Objects.requireNonNull(frame, "frame");
        if (compositor == null) {
            if (passthroughWarned.compareAndSet(false, true)) {
                log.warning("No glyph atlas, passing frames through unchanged");
            }
            return frame;
        }
        CellGrid cells = FrameDownsampler.downsample(frame, atlas.glyphWidth(), atlas.glyphHeight());
        // Per-cell colors are scored as ink on a light canvas; a fixed tint scores the raw frame
        boolean scoreComplement = config.polarity().inverted() && config.colorMode() instanceof ColorMode.Original;
        int[] indices = LuminanceMapper.map(cells, atlas.size(), scoreComplement, null);
        return compositor.composite(cells, indices, frame.width(), frame.height(), reusable);
    }

    /** Whether frames are forwarded unchanged because no atlas is available. */
    public boolean isPassthrough() {
        return compositor == null;
    }

    public GlyphAtlas atlas() {
        return atlas;
    }

    public AsciiConfig config() {
        return config;
    }

    /** Width of {@link #convert}'s result for a frame of the given width. */
    public int outputWidth(int frameWidth) {
        return compositor == null ? frameWidth : compositor.outputWidth(frameWidth);
    }

    /** Height of {@link #convert}'s result for a frame of the given height. */
    public int outputHeight(int frameHeight) {
        return compositor == null ? frameHeight : compositor.outputHeight(frameHeight);
    }
}
