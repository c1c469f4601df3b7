package dev.everydaythings.ascii.live;

import dev.everydaythings.ascii.Frame;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-producer, single-consumer frame handoff where the newest frame always wins.
 *
 * <p>The producer (conversion worker) calls {@link #publish}; a frame that was published but
 * never picked up is replaced, never queued. The consumer (presentation) calls {@link #acquire}
 * and may read the returned frame until its next {@code acquire} yields a newer one.
 *
 * <p>Frames nobody reads any more (replaced before pickup, or superseded after display) become
 * available to the producer through {@link #recycled()}, so output buffers can be reused without
 * ever writing to a frame the consumer is still reading.
 */
public final class LatestFrameHandoff {

    /** Replaced and superseded frames kept for reuse; more than this are left to the GC. */
    private static final int MAX_RECYCLED = 2;

    private final AtomicReference<Frame> pending = new AtomicReference<>();
    private final Queue<Frame> recycled = new ConcurrentLinkedQueue<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    /** Consumer-confined. */
    private Frame held;

    /**
     * Offer a finished frame. Replaces any frame not yet acquired.
     * The caller must not write to {@code frame} after this call.
     */
    public void publish(Frame frame) {
        if (frame == null) {
            throw new NullPointerException("frame");
        }
        published.incrementAndGet();
        Frame stale = pending.getAndSet(frame);
        if (stale != null) {
            dropped.incrementAndGet();
            recycle(stale);
        }
    }

    /**
     * Consumer side: take the newest frame if one was published since the last call, otherwise
     * keep the current one.
     *
     * @return the frame to display, or null if nothing was ever published
     */
    public Frame acquire() {
        Frame next = pending.getAndSet(null);
        if (next != null) {
            Frame previous = held;
            held = next;
            if (previous != null && previous != next) {
                recycle(previous);
            }
        }
        return held;
    }

    /** Whether a frame is waiting that {@link #acquire} has not returned yet. */
    public boolean hasPending() {
        return pending.get() != null;
    }

    /**
     * Producer side: a frame no one is reading, free to be overwritten, or null.
     */
    public Frame recycled() {
        return recycled.poll();
    }

    /** Frames published so far. */
    public long publishedCount() {
        return published.get();
    }

    /** Frames replaced before the consumer picked them up. */
    public long droppedCount() {
        return dropped.get();
    }

    private void recycle(Frame frame) {
        if (recycled.size() < MAX_RECYCLED) {
            recycled.offer(frame);
        }
    }
}
