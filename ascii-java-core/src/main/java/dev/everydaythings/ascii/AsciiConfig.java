package dev.everydaythings.ascii;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable conversion settings.
 *
 * <p>The first six settings (character set, font path, size, stroke, polarity, order) decide the
 * glyph atlas; {@link #sameAtlasSettings(AsciiConfig)} compares exactly those. Color mode and
 * clipping only affect compositing.
 *
 * <p>Properties keys, as read by {@link #fromProperties(Properties)}:
 * <ul>
 *   <li>{@code character_set} - ordered symbols, e.g. {@code "@%#*+=-:. "}</li>
 *   <li>{@code font_path} - TTF/OTF file; absent means the caller picks a system font</li>
 *   <li>{@code font_size} - pixels, positive</li>
 *   <li>{@code stroke_weight} - pixels, zero or more</li>
 *   <li>{@code background_polarity} - {@code dark} or {@code light}</li>
 *   <li>{@code reverse_order} - {@code true} or {@code false}</li>
 *   <li>{@code monochrome_color} - {@code r,g,b}; absent means per-cell colors</li>
 *   <li>{@code clip_to_original} - {@code true} or {@code false}</li>
 * </ul>
 */
public final class AsciiConfig {

    public static final String DEFAULT_CHARACTER_SET = "@%#*+=-:. ";
    public static final int DEFAULT_FONT_SIZE = 16;
    public static final int DEFAULT_STROKE_WEIGHT = 2;

    public static final String KEY_CHARACTER_SET = "character_set";
    public static final String KEY_FONT_PATH = "font_path";
    public static final String KEY_FONT_SIZE = "font_size";
    public static final String KEY_STROKE_WEIGHT = "stroke_weight";
    public static final String KEY_BACKGROUND_POLARITY = "background_polarity";
    public static final String KEY_REVERSE_ORDER = "reverse_order";
    public static final String KEY_MONOCHROME_COLOR = "monochrome_color";
    public static final String KEY_CLIP_TO_ORIGINAL = "clip_to_original";

    private final String characterSet;
    private final Path fontPath;
    private final int fontSize;
    private final int strokeWeight;
    private final Polarity polarity;
    private final boolean reverseOrder;
    private final ColorMode colorMode;
    private final boolean clipToOriginal;

    private AsciiConfig(Builder b) {
        this.characterSet = b.characterSet;
        this.fontPath = b.fontPath;
        this.fontSize = b.fontSize;
        this.strokeWeight = b.strokeWeight;
        this.polarity = b.polarity;
        this.reverseOrder = b.reverseOrder;
        this.colorMode = b.colorMode;
        this.clipToOriginal = b.clipToOriginal;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder starting from this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .characterSet(characterSet)
                .fontPath(fontPath)
                .fontSize(fontSize)
                .strokeWeight(strokeWeight)
                .polarity(polarity)
                .reverseOrder(reverseOrder)
                .colorMode(colorMode)
                .clipToOriginal(clipToOriginal);
    }

    /**
     * Read a configuration from properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException naming the key whose value is invalid
     */
    public static AsciiConfig fromProperties(Properties props) {
        Builder b = builder();
        String charset = props.getProperty(KEY_CHARACTER_SET);
        if (charset != null) {
            b.characterSet(charset);
        }
        String font = trimmed(props, KEY_FONT_PATH);
        if (font != null && !font.isEmpty()) {
            b.fontPath(Path.of(font));
        }
        String size = trimmed(props, KEY_FONT_SIZE);
        if (size != null) {
            b.fontSize(parseInt(KEY_FONT_SIZE, size));
        }
        String stroke = trimmed(props, KEY_STROKE_WEIGHT);
        if (stroke != null) {
            b.strokeWeight(parseInt(KEY_STROKE_WEIGHT, stroke));
        }
        String polarity = trimmed(props, KEY_BACKGROUND_POLARITY);
        if (polarity != null) {
            try {
                b.polarity(Polarity.parse(polarity));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(KEY_BACKGROUND_POLARITY + ": " + e.getMessage(), e);
            }
        }
        String reverse = trimmed(props, KEY_REVERSE_ORDER);
        if (reverse != null) {
            b.reverseOrder(parseBoolean(KEY_REVERSE_ORDER, reverse));
        }
        String mono = trimmed(props, KEY_MONOCHROME_COLOR);
        if (mono != null && !mono.isEmpty()) {
            try {
                b.colorMode(ColorMode.fixed(Rgb.parse(mono)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(KEY_MONOCHROME_COLOR + ": " + e.getMessage(), e);
            }
        }
        String clip = trimmed(props, KEY_CLIP_TO_ORIGINAL);
        if (clip != null) {
            b.clipToOriginal(parseBoolean(KEY_CLIP_TO_ORIGINAL, clip));
        }
        return b.build();
    }

    public String characterSet() {
        return characterSet;
    }

    /** Configured font file; empty when a default system font should be located. */
    public Optional<Path> fontPath() {
        return Optional.ofNullable(fontPath);
    }

    public int fontSize() {
        return fontSize;
    }

    public int strokeWeight() {
        return strokeWeight;
    }

    public Polarity polarity() {
        return polarity;
    }

    public boolean reverseOrder() {
        return reverseOrder;
    }

    public ColorMode colorMode() {
        return colorMode;
    }

    public boolean clipToOriginal() {
        return clipToOriginal;
    }

    /** Whether an atlas built for {@code other} is also valid for this configuration. */
    public boolean sameAtlasSettings(AsciiConfig other) {
        return characterSet.equals(other.characterSet)
                && Objects.equals(fontPath, other.fontPath)
                && fontSize == other.fontSize
                && strokeWeight == other.strokeWeight
                && polarity == other.polarity
                && reverseOrder == other.reverseOrder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AsciiConfig other)) return false;
        return sameAtlasSettings(other)
                && colorMode.equals(other.colorMode)
                && clipToOriginal == other.clipToOriginal;
    }

    @Override
    public int hashCode() {
        return Objects.hash(characterSet, fontPath, fontSize, strokeWeight, polarity, reverseOrder,
                colorMode, clipToOriginal);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "AsciiConfig[chars=\"%s\", font=%s, size=%d, stroke=%d, %s, reverse=%b, color=%s, clip=%b]",
                characterSet, fontPath, fontSize, strokeWeight, polarity, reverseOrder, colorMode, clipToOriginal);
    }

    private static String trimmed(Properties props, String key) {
        String value = props.getProperty(key);
        return value == null ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": not an integer: " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(key + ": expected true or false but got: " + value);
        };
    }

    /**
     * Fluent builder for {@link AsciiConfig}. Starts from the defaults: {@code "@%#*+=-:. "},
     * size 16, stroke 2, dark background, ascending ramp, per-cell colors, clipped output.
     */
    public static final class Builder {

        private String characterSet = DEFAULT_CHARACTER_SET;
        private Path fontPath;
        private int fontSize = DEFAULT_FONT_SIZE;
        private int strokeWeight = DEFAULT_STROKE_WEIGHT;
        private Polarity polarity = Polarity.DARK;
        private boolean reverseOrder;
        private ColorMode colorMode = ColorMode.original();
        private boolean clipToOriginal = true;

        private Builder() {
        }

        public Builder characterSet(String characterSet) {
            this.characterSet = Objects.requireNonNull(characterSet, "characterSet");
            return this;
        }

        /** Font file to render glyphs from; null to locate a system font. */
        public Builder fontPath(Path fontPath) {
            this.fontPath = fontPath;
            return this;
        }

        public Builder fontSize(int fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder strokeWeight(int strokeWeight) {
            this.strokeWeight = strokeWeight;
            return this;
        }

        public Builder polarity(Polarity polarity) {
            this.polarity = Objects.requireNonNull(polarity, "polarity");
            return this;
        }

        public Builder reverseOrder(boolean reverseOrder) {
            this.reverseOrder = reverseOrder;
            return this;
        }

        public Builder colorMode(ColorMode colorMode) {
            this.colorMode = Objects.requireNonNull(colorMode, "colorMode");
            return this;
        }

        /** Shorthand for {@code colorMode(ColorMode.fixed(color))}. */
        public Builder monochrome(Rgb color) {
            return colorMode(ColorMode.fixed(color));
        }

        public Builder clipToOriginal(boolean clipToOriginal) {
            this.clipToOriginal = clipToOriginal;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the size is not positive or the stroke is negative
         */
        public AsciiConfig build() {
            if (fontSize <= 0) {
                throw new IllegalArgumentException(KEY_FONT_SIZE + ": must be positive: " + fontSize);
            }
            if (strokeWeight < 0) {
                throw new IllegalArgumentException(KEY_STROKE_WEIGHT + ": must not be negative: " + strokeWeight);
            }
            return new AsciiConfig(this);
        }
    }
}
