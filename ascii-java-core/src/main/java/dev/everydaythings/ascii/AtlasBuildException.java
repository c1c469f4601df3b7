package dev.everydaythings.ascii;

/**
 * Glyph atlas construction failed. The converter falls back to passthrough.
 */
public class AtlasBuildException extends RuntimeException {

    public AtlasBuildException(String message) {
        super(message);
    }

    public AtlasBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
