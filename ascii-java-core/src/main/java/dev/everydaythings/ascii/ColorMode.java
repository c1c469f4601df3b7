package dev.everydaythings.ascii;

import java.util.Objects;

/**
 * How glyph strokes are tinted: with each cell's own sampled color, or with one fixed color.
 */
public sealed interface ColorMode permits ColorMode.Original, ColorMode.Fixed {

    /** Tint every glyph with the color sampled from its cell ("color ASCII"). */
    record Original() implements ColorMode {}

    /** Tint every glyph with the same color ("monochrome ASCII"). */
    record Fixed(Rgb color) implements ColorMode {
        public Fixed {
            Objects.requireNonNull(color, "color");
        }
    }

    static ColorMode original() {
        return new Original();
    }

    static ColorMode fixed(Rgb color) {
        return new Fixed(color);
    }
}
