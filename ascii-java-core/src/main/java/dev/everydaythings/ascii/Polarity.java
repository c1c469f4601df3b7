package dev.everydaythings.ascii;

import java.util.Locale;

/**
 * Background polarity of the rendered canvas.
 *
 * <p>Glyph masks in an atlas always store "more ink = higher value" regardless of
 * polarity; {@link #LIGHT} output is inverted once, at the very end of compositing.
 */
public enum Polarity {

    /** Light ink on a black background. */
    DARK(0),

    /** Dark ink on a white background. */
    LIGHT(255);

    private final int background;

    Polarity(int background) {
        this.background = background;
    }

    /** Background channel value (0 or 255). */
    public int background() {
        return background;
    }

    /** Ink channel value, the complement of {@link #background()}. */
    public int foreground() {
        return 255 - background;
    }

    public boolean inverted() {
        return this == LIGHT;
    }

    /**
     * Parse {@code "dark"} or {@code "light"}, case-insensitive.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static Polarity parse(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "dark" -> DARK;
            case "light" -> LIGHT;
            default -> throw new IllegalArgumentException("Unknown polarity: " + text);
        };
    }
}
