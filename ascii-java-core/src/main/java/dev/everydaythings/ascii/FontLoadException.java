package dev.everydaythings.ascii;

/**
 * The font file could not be read, or it cannot render a character at the requested size.
 */
public class FontLoadException extends AtlasBuildException {

    public FontLoadException(String message) {
        super(message);
    }

    public FontLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
