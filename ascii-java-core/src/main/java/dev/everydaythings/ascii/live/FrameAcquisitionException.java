package dev.everydaythings.ascii.live;

/**
 * A frame could not be acquired. The conversion loop skips that tick.
 */
public class FrameAcquisitionException extends Exception {

    public FrameAcquisitionException(String message) {
        super(message);
    }

    public FrameAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
