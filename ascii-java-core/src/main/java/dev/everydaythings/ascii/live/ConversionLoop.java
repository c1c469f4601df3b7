package dev.everydaythings.ascii.live;

import dev.everydaythings.ascii.AsciiConverter;
import dev.everydaythings.ascii.Frame;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically acquires a frame, converts it and publishes the result, on a dedicated worker thread.
 *
 * <p>Each tick runs to completion. {@link #stop()} sets a flag that is checked once at the start
 * of every tick; a conversion in progress is never interrupted. A failed acquisition skips the
 * tick. A failed conversion publishes the raw frame instead, so the worker keeps running.
 *
 * <p>Usage:
 * <pre>{@code
 * LatestFrameHandoff handoff = new LatestFrameHandoff();
 * ConversionLoop loop = new ConversionLoop(camera, converter, handoff, 30);
 * loop.start();
 * // presentation thread:
 * Frame latest = handoff.acquire();
 * }</pre>
 */
public final class ConversionLoop implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ConversionLoop.class.getName());

    /** About 33 ticks per second. */
    public static final long DEFAULT_PERIOD_MILLIS = 30;

    private final FrameSource source;
    private final LatestFrameHandoff handoff;
    private final long periodMillis;
    private final ScheduledExecutorService worker;

    private volatile AsciiConverter converter;
    private volatile boolean running;

    private final AtomicLong converted = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public ConversionLoop(FrameSource source, AsciiConverter converter, LatestFrameHandoff handoff) {
        this(source, converter, handoff, DEFAULT_PERIOD_MILLIS);
    }

    public ConversionLoop(FrameSource source, AsciiConverter converter, LatestFrameHandoff handoff,
                          long periodMillis) {
        this.source = Objects.requireNonNull(source, "source");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.handoff = Objects.requireNonNull(handoff, "handoff");
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("periodMillis must be positive: " + periodMillis);
        }
        this.periodMillis = periodMillis;
        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ascii-conversion");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start ticking. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (running) return;
        if (worker.isShutdown()) {
            throw new IllegalStateException("ConversionLoop cannot be restarted after stop()");
        }
        running = true;
        worker.scheduleAtFixedRate(this::tick, 0, periodMillis, TimeUnit.MILLISECONDS);
        log.info(() -> String.format("Conversion loop started (%d ms period)", periodMillis));
    }

    /**
     * Stop after the current tick. Does not wait.
     */
    public synchronized void stop() {
        if (!running && worker.isShutdown()) return;
        running = false;
        worker.shutdown();
        log.info(() -> String.format("Conversion loop stopped: %d converted, %d skipped, %d failed",
                converted.get(), skipped.get(), failed.get()));
    }

    /**
     * Stop and wait for the current tick to finish.
     *
     * @return true if the worker terminated within the timeout
     */
    public boolean stopAndAwait(long timeout, TimeUnit unit) throws InterruptedException {
        stop();
        return worker.awaitTermination(timeout, unit);
    }

    /** Swap the converter; used from the next tick on. */
    public void setConverter(AsciiConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    public AsciiConverter converter() {
        return converter;
    }

    public boolean isRunning() {
        return running;
    }

    public long convertedCount() {
        return converted.get();
    }

    public long skippedCount() {
        return skipped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /**
     * One iteration: acquire, convert, publish. Package-private so tests can drive it directly.
     */
    void tick() {
        if (!running) return;
        try {
            Frame frame;
            try {
                frame = source.acquireNextFrame();
            } catch (FrameAcquisitionException e) {
                skipped.incrementAndGet();
                log.fine(() -> "No frame this tick: " + e.getMessage());
                return;
            }
            if (frame == null) {
                skipped.incrementAndGet();
                return;
            }

            Frame output;
            try {
                output = converter.convert(frame, handoff.recycled());
                converted.incrementAndGet();
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                log.log(Level.WARNING, "Conversion failed, publishing raw frame: " + e.getMessage(), e);
                output = frame;
            }
            handoff.publish(output);
        } catch (RuntimeException e) {
            // An exception escaping here would cancel the schedule
            failed.incrementAndGet();
            log.log(Level.WARNING, "Frame source failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        stop();
        source.close();
    }
}
