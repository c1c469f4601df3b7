package dev.everydaythings.ascii.examples;

import dev.everydaythings.ascii.*;
import dev.everydaythings.ascii.freetype.FontLocator;
import dev.everydaythings.ascii.freetype.FreeTypeFontResource;
import dev.everydaythings.ascii.live.ConversionLoop;
import dev.everydaythings.ascii.live.LatestFrameHandoff;

import org.lwjgl.glfw.*;
import org.lwjgl.opengl.GL;

import java.nio.ByteBuffer;
import java.util.concurrent.TimeUnit;

import static org.lwjgl.glfw.GLFW.*;
import static org.lwjgl.opengl.GL11.*;
import static org.lwjgl.system.MemoryUtil.*;

/**
 * Live ASCII preview of an animated test pattern.
 *
 * The conversion loop runs on its own worker thread; the render loop below only
 * displays whatever frame the handoff holds last.
 *
 * Controls:
 *   C: Toggle color / green monochrome
 *   L: Toggle dark / light background (rebuilds the atlas)
 *   Esc: Quit
 */
public class HelloPreview {

    private static final int WINDOW_WIDTH = 960;
    private static final int WINDOW_HEIGHT = 540;

    private static AsciiConfig config;
    private static ConversionLoop loop;

    public static void main(String[] args) throws InterruptedException {
        // --- ASCII pipeline ---
        config = FontLocator.withDefaultFont(AsciiConfig.builder()
                .characterSet(" .:-=+*#%@")
                .fontSize(12)
                .strokeWeight(0)
                .build());
        AsciiConverter converter = AsciiConverter.create(config, FreeTypeFontResource::open);

        LatestFrameHandoff handoff = new LatestFrameHandoff();
        loop = new ConversionLoop(new PlasmaFrameSource(WINDOW_WIDTH, WINDOW_HEIGHT), converter, handoff);

        // --- GLFW init ---
        GLFWErrorCallback.createPrint(System.err).set();
        if (!glfwInit()) {
            throw new RuntimeException("Failed to initialize GLFW");
        }

        glfwWindowHint(GLFW_RESIZABLE, GLFW_FALSE);
        long window = glfwCreateWindow(WINDOW_WIDTH, WINDOW_HEIGHT,
                "hello-preview - live ASCII", NULL, NULL);
        if (window == NULL) {
            glfwTerminate();
            throw new RuntimeException("Failed to create GLFW window");
        }

        glfwSetKeyCallback(window, (w, key, scancode, action, mods) -> {
            if (action != GLFW_PRESS) return;
            switch (key) {
                case GLFW_KEY_ESCAPE -> glfwSetWindowShouldClose(w, true);
                case GLFW_KEY_C -> reconfigure(config.toBuilder().colorMode(
                        config.colorMode() instanceof ColorMode.Fixed
                                ? ColorMode.original()
                                : ColorMode.fixed(new Rgb(0, 255, 0))).build());
                case GLFW_KEY_L -> reconfigure(config.toBuilder().polarity(
                        config.polarity() == Polarity.DARK ? Polarity.LIGHT : Polarity.DARK).build());
                default -> { }
            }
        });

        glfwMakeContextCurrent(window);
        glfwSwapInterval(1);
        GL.createCapabilities();

        int[] fbWidth = new int[1], fbHeight = new int[1];
        glfwGetFramebufferSize(window, fbWidth, fbHeight);
        glViewport(0, 0, fbWidth[0], fbHeight[0]);
        glPixelStorei(GL_UNPACK_ALIGNMENT, 1);

        loop.start();

        // --- Render loop ---
        ByteBuffer upload = null;
        while (!glfwWindowShouldClose(window)) {
            glfwPollEvents();
            glClearColor(0f, 0f, 0f, 1f);
            glClear(GL_COLOR_BUFFER_BIT);

            Frame frame = handoff.acquire();
            if (frame != null) {
                int bytes = frame.pixels().length;
                if (upload == null || upload.capacity() < bytes) {
                    if (upload != null) memFree(upload);
                    upload = memAlloc(bytes);
                }
                upload.clear();
                upload.put(frame.pixels()).flip();

                // Raster origin is bottom-left; draw top-down from the upper-left corner
                float scaleX = (float) fbWidth[0] / WINDOW_WIDTH;
                float scaleY = (float) fbHeight[0] / WINDOW_HEIGHT;
                glRasterPos2f(-1f, 1f);
                glPixelZoom(scaleX, -scaleY);
                glDrawPixels(frame.width(), frame.height(), GL_RGB, GL_UNSIGNED_BYTE, upload);
            }
            glfwSwapBuffers(window);
        }

        // --- Cleanup ---
        loop.stopAndAwait(1, TimeUnit.SECONDS);
        loop.close();
        if (upload != null) memFree(upload);

        glfwDestroyWindow(window);
        glfwTerminate();
    }

    private static void reconfigure(AsciiConfig next) {
        config = next;
        loop.setConverter(loop.converter().withConfig(next, FreeTypeFontResource::open));
    }
}
