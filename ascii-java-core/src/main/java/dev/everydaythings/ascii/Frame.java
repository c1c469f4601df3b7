package dev.everydaythings.ascii;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A packed 8-bit RGB raster, row-major, three bytes per pixel.
 *
 * <p>Used both for camera input and for conversion output. A frame handed to a presentation
 * collaborator must be treated as read-only until it is given back for reuse.
 */
public final class Frame {

    private final int width;
    private final int height;
    private final byte[] pixels;

    /** Allocate a black frame. */
    public Frame(int width, int height) {
        this(width, height, new byte[checkedLength(width, height)]);
    }

    private Frame(int width, int height, byte[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Wrap an existing RGB array without copying.
     *
     * @throws IllegalArgumentException if the array length is not {@code width * height * 3}
     */
    public static Frame wrap(int width, int height, byte[] rgb) {
        Objects.requireNonNull(rgb, "rgb");
        int expected = checkedLength(width, height);
        if (rgb.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Pixel array length %d does not match %dx%dx3 = %d", rgb.length, width, height, expected));
        }
        return new Frame(width, height, rgb);
    }

    /**
     * Copy a BGR-ordered array (as produced by most capture backends) into a new RGB frame.
     */
    public static Frame fromBgr(int width, int height, byte[] bgr) {
        Objects.requireNonNull(bgr, "bgr");
        Frame frame = new Frame(width, height);
        if (bgr.length != frame.pixels.length) {
            throw new IllegalArgumentException(String.format(
                    "Pixel array length %d does not match %dx%dx3", bgr.length, width, height));
        }
        byte[] rgb = frame.pixels;
        for (int i = 0; i < rgb.length; i += 3) {
            rgb[i] = bgr[i + 2];
            rgb[i + 1] = bgr[i + 1];
            rgb[i + 2] = bgr[i];
        }
        return frame;
    }

    /** Copy any {@link BufferedImage} into a new RGB frame (alpha is dropped). */
    public static Frame fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        Frame frame = new Frame(w, h);
        int[] row = new int[w];
        byte[] rgb = frame.pixels;
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            int o = y * w * 3;
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                rgb[o++] = (byte) (argb >> 16);
                rgb[o++] = (byte) (argb >> 8);
                rgb[o++] = (byte) argb;
            }
        }
        return frame;
    }

    /** Copy this frame into a new {@link BufferedImage#TYPE_INT_RGB} image. */
    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            int o = y * width * 3;
            for (int x = 0; x < width; x++) {
                row[x] = ((pixels[o] & 0xFF) << 16) | ((pixels[o + 1] & 0xFF) << 8) | (pixels[o + 2] & 0xFF);
                o += 3;
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** The backing RGB array. Writes are visible to every holder of this frame. */
    public byte[] pixels() {
        return pixels;
    }

    /** Channel value (0 = R, 1 = G, 2 = B) at (x, y), 0-255. */
    public int channel(int x, int y, int c) {
        return pixels[(y * width + x) * 3 + c] & 0xFF;
    }

    /** Packed 0xRRGGBB at (x, y). */
    public int rgb(int x, int y) {
        int o = (y * width + x) * 3;
        return ((pixels[o] & 0xFF) << 16) | ((pixels[o + 1] & 0xFF) << 8) | (pixels[o + 2] & 0xFF);
    }

    public void setRgb(int x, int y, int rgb) {
        int o = (y * width + x) * 3;
        pixels[o] = (byte) (rgb >> 16);
        pixels[o + 1] = (byte) (rgb >> 8);
        pixels[o + 2] = (byte) rgb;
    }

    /** Fill every pixel with one color. */
    public void fill(Rgb color) {
        byte r = (byte) color.r();
        byte g = (byte) color.g();
        byte b = (byte) color.b();
        for (int i = 0; i < pixels.length; i += 3) {
            pixels[i] = r;
            pixels[i + 1] = g;
            pixels[i + 2] = b;
        }
    }

    /** Whether this frame has exactly the given dimensions. */
    public boolean hasShape(int width, int height) {
        return this.width == width && this.height == height;
    }

    private static int checkedLength(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        return Math.multiplyExact(Math.multiplyExact(width, height), 3);
    }

    @Override
    public String toString() {
        return "Frame[" + width + "x" + height + "]";
    }
}
