package dev.everydaythings.ascii;

/**
 * An 8-bit RGB color triple.
 *
 * @param r red, 0-255
 * @param g green, 0-255
 * @param b blue, 0-255
 */
public record Rgb(int r, int g, int b) {

    public static final Rgb BLACK = new Rgb(0, 0, 0);
    public static final Rgb WHITE = new Rgb(255, 255, 255);

    public Rgb {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
    }

    /** The channel-wise complement ({@code 255 - v}). */
    public Rgb complement() {
        return new Rgb(255 - r, 255 - g, 255 - b);
    }

    /**
     * Parse a color written as {@code "r,g,b"} (whitespace around the parts is ignored).
     *
     * @throws IllegalArgumentException if the text is not three integers in 0-255
     */
    public static Rgb parse(String text) {
        String[] parts = text.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected r,g,b but got: " + text);
        }
        try {
            return new Rgb(
                    Integer.parseInt(parts[0].trim()),
                    Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected r,g,b but got: " + text, e);
        }
    }

    @Override
    public String toString() {
        return r + "," + g + "," + b;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Channel " + name + " out of range 0-255: " + value);
        }
    }
}
