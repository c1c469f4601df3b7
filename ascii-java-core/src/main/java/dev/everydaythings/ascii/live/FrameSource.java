package dev.everydaythings.ascii.live;

import dev.everydaythings.ascii.Frame;

/**
 * Supplies RGB frames, typically from a camera.
 *
 * <p>Each returned frame belongs to the caller: the source must not write to it afterwards.
 * Sources that deliver BGR data convert with {@link Frame#fromBgr} before returning.
 */
public interface FrameSource extends AutoCloseable {

    /**
     * Block until the next frame is available.
     *
     * @throws FrameAcquisitionException if no frame could be read this time
     */
    Frame acquireNextFrame() throws FrameAcquisitionException;

    /** Release the underlying device. */
    @Override
    default void close() {
    }
}
