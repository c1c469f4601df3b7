package dev.everydaythings.ascii.examples;

import dev.everydaythings.ascii.Frame;
import dev.everydaythings.ascii.live.FrameSource;

/**
 * Animated color plasma standing in for a camera.
 *
 * <p>Every call renders a fresh frame whose pattern advances with wall-clock time.
 */
public class PlasmaFrameSource implements FrameSource {

    private final int width;
    private final int height;
    private final long startNanos = System.nanoTime();

    public PlasmaFrameSource(int width, int height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public Frame acquireNextFrame() {
        double t = (System.nanoTime() - startNanos) / 1e9;
        Frame frame = new Frame(width, height);
        byte[] px = frame.pixels();
        int o = 0;
        for (int y = 0; y < height; y++) {
            double fy = y / (double) height;
            for (int x = 0; x < width; x++) {
                double fx = x / (double) width;
                double v = Math.sin(fx * 10 + t)
                        + Math.sin((fy * 10 + t) / 2)
                        + Math.sin((fx * 10 + fy * 10 + t) / 2)
                        + Math.sin(Math.sqrt(fx * fx * 100 + fy * fy * 100 + 1) + t);
                px[o++] = (byte) (128 + 127 * Math.sin(v * Math.PI));
                px[o++] = (byte) (128 + 127 * Math.sin(v * Math.PI + 2 * Math.PI / 3));
                px[o++] = (byte) (128 + 127 * Math.sin(v * Math.PI + 4 * Math.PI / 3));
            }
        }
        return frame;
    }
}
