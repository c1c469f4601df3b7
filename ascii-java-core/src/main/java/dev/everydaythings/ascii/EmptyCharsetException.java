package dev.everydaythings.ascii;

/**
 * The character set has no symbols to build an atlas from.
 */
public class EmptyCharsetException extends AtlasBuildException {

    public EmptyCharsetException() {
        super("Character set is empty");
    }
}
