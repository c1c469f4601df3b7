package dev.everydaythings.ascii.freetype;

import dev.everydaythings.ascii.FontLoadException;
import dev.everydaythings.ascii.FontResource;
import dev.everydaythings.ascii.GlyphBounds;
import dev.everydaythings.ascii.GlyphMask;
import org.lwjgl.PointerBuffer;
import org.lwjgl.system.MemoryStack;
import org.lwjgl.util.freetype.FT_Bitmap;
import org.lwjgl.util.freetype.FT_Face;
import org.lwjgl.util.freetype.FT_GlyphSlot;
import org.lwjgl.util.freetype.FT_Size;
import org.lwjgl.util.freetype.FT_Size_Metrics;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.lwjgl.util.freetype.FreeType.*;

/**
 * {@link dev.everydaythings.ascii.FontResource} backed by LWJGL's FreeType bindings.
 *
 * <p>Every character is placed in a box one advance wide and one line high, both widened by the
 * stroke weight on each side. The pen sits at {@code (stroke, stroke + ascender)}, so glyphs of
 * one font share a baseline and can be cropped to a common cell from the top-left corner.
 * The stroke weight is applied by emboldening the outline before rasterizing.
 *
 * <p>Not thread-safe: a FreeType face must be used by one thread at a time.
 */
public class FreeTypeFontResource implements FontResource {

    private static final Logger log = Logger.getLogger(FreeTypeFontResource.class.getName());

    private final String name;

    private long ftLibHandle;
    private FT_Face ftFace;

    /** Font data buffer: MUST stay alive as long as the face is open.
     *  FreeType keeps an internal pointer to this memory. */
    private ByteBuffer fontDataBuffer;

    /** Pixel size last applied with FT_Set_Pixel_Sizes, 0 if none yet. */
    private int currentSize;
    private int ascenderPx;
    private int lineHeightPx;

    private FreeTypeFontResource(String name) {
        this.name = name;
    }

    // ==================================================================================
    // Factory
    // ==================================================================================

    /**
     * Open a TTF/OTF file. Usable as a {@link dev.everydaythings.ascii.FontProvider}:
     * {@code FreeTypeFontResource::open}.
     *
     * @throws FontLoadException if the file cannot be read or parsed
     */
    public static FreeTypeFontResource open(Path fontPath) {
        byte[] data;
        try {
            data = Files.readAllBytes(fontPath);
        } catch (IOException e) {
            throw new FontLoadException("Cannot read font file: " + fontPath, e);
        }
        FreeTypeFontResource font = fromBytes(fontPath.toString(), data);
        log.info(() -> String.format("Loaded font: %s (%d bytes)", fontPath, data.length));
        return font;
    }

    /**
     * Load a font from raw TTF/OTF bytes.
     *
     * @param name label used in log and error messages
     * @throws FontLoadException if FreeType cannot parse the data or is not available
     */
    public static FreeTypeFontResource fromBytes(String name, byte[] fontData) {
        FreeTypeFontResource font = new FreeTypeFontResource(name);
        try {
            font.initFreeType(fontData);
        } catch (LinkageError e) {
            throw new FontLoadException("FreeType native library unavailable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            font.close();
            throw e;
        }
        return font;
    }

    private void initFreeType(byte[] fontData) {
        try (MemoryStack stack = MemoryStack.stackPush()) {
            PointerBuffer ftLibPtr = stack.mallocPointer(1);
            int result = FT_Init_FreeType(ftLibPtr);
            if (result != 0) {
                throw new FontLoadException("Failed to init FreeType: " + result);
            }
            ftLibHandle = ftLibPtr.get(0);

            // Load font from memory; keep buffer alive as field (FreeType holds a pointer)
            fontDataBuffer = ByteBuffer.allocateDirect(fontData.length)
                    .order(ByteOrder.nativeOrder());
            fontDataBuffer.put(fontData);
            fontDataBuffer.flip();

            PointerBuffer facePtr = stack.mallocPointer(1);
            result = FT_New_Memory_Face(ftLibHandle, fontDataBuffer, 0, facePtr);
            if (result != 0) {
                throw new FontLoadException(String.format("Failed to load font %s: FreeType error %d", name, result));
            }
            ftFace = FT_Face.create(facePtr.get(0));
        }
    }

    // ==================================================================================
    // FontResource
    // ==================================================================================

    @Override
    public GlyphBounds measure(int codepoint, int pixelSize, int strokeWeight) {
        applySize(pixelSize);
        FT_GlyphSlot slot = loadGlyph(codepoint);
        return bounds(slot, strokeWeight);
    }

    @Override
    public GlyphMask render(int codepoint, int pixelSize, int strokeWeight) {
        applySize(pixelSize);
        FT_GlyphSlot slot = loadGlyph(codepoint);
        GlyphBounds box = bounds(slot, strokeWeight);

        if (strokeWeight > 0 && slot.format() == FT_GLYPH_FORMAT_OUTLINE) {
            // Strength is the total growth in 26.6 units, half of it on each side
            int err = FT_Outline_Embolden(slot.outline(), (long) strokeWeight * 2 * 64);
            if (err != 0) {
                throw new FontLoadException(String.format("Cannot stroke U+%04X in %s: FreeType error %d",
                        codepoint, name, err));
            }
        }
        int err = FT_Render_Glyph(slot, FT_RENDER_MODE_NORMAL);
        if (err != 0) {
            throw new FontLoadException(String.format("Cannot render U+%04X in %s at %dpx: FreeType error %d",
                    codepoint, name, pixelSize, err));
        }

        byte[] coverage = new byte[box.width() * box.height()];
        FT_Bitmap bitmap = slot.bitmap();
        int rows = bitmap.rows();
        int cols = bitmap.width();
        int pitch = bitmap.pitch();
        if (rows > 0 && cols > 0) {
            if ((bitmap.pixel_mode() & 0xFF) != FT_PIXEL_MODE_GRAY) {
                throw new FontLoadException(String.format("Unsupported pixel mode %d for U+%04X in %s",
                        bitmap.pixel_mode() & 0xFF, codepoint, name));
            }
            ByteBuffer pixels = bitmap.buffer(Math.abs(pitch) * rows);
            int originX = strokeWeight + slot.bitmap_left();
            int originY = strokeWeight + ascenderPx - slot.bitmap_top();
            for (int r = 0; r < rows; r++) {
                int dstY = originY + r;
                if (dstY < 0 || dstY >= box.height()) continue;
                // Negative pitch means the bitmap is stored bottom-up
                int rowStart = pitch >= 0 ? r * pitch : (rows - 1 - r) * -pitch;
                for (int c = 0; c < cols; c++) {
                    int dstX = originX + c;
                    if (dstX < 0 || dstX >= box.width()) continue;
                    coverage[dstY * box.width() + dstX] = pixels.get(rowStart + c);
                }
            }
        }
        return new GlyphMask(box.width(), box.height(), coverage);
    }

    // ==================================================================================
    // Private
    // ==================================================================================

    private void applySize(int pixelSize) {
        checkOpen();
        if (pixelSize <= 0) {
            throw new IllegalArgumentException("pixelSize must be positive: " + pixelSize);
        }
        if (pixelSize == currentSize) return;

        int err = FT_Set_Pixel_Sizes(ftFace, 0, pixelSize);
        if (err != 0) {
            throw new FontLoadException(String.format("Font %s does not support %dpx: FreeType error %d",
                    name, pixelSize, err));
        }
        FT_Size size = ftFace.size();
        if (size == null) {
            throw new FontLoadException("Font " + name + " has no active size");
        }
        FT_Size_Metrics metrics = size.metrics();
        // 26.6 fixed point; round the ascender up and the descender down so nothing is clipped
        ascenderPx = (int) ((metrics.ascender() + 63) >> 6);
        int descenderPx = (int) (metrics.descender() >> 6);
        lineHeightPx = ascenderPx - descenderPx;
        currentSize = pixelSize;
        log.fine(() -> String.format("%s at %dpx: ascender=%d lineHeight=%d", name, pixelSize, ascenderPx, lineHeightPx));
    }

    /**
     * Load the outline of a codepoint into the face's glyph slot.
     * FT_Get_Char_Index returns 0 when the font has no mapping for the codepoint;
     * loading anyway would render the .notdef box.
     */
    private FT_GlyphSlot loadGlyph(int codepoint) {
        if (FT_Get_Char_Index(ftFace, codepoint) == 0) {
            throw new FontLoadException(String.format("Font %s has no glyph for U+%04X", name, codepoint));
        }
        int err = FT_Load_Char(ftFace, codepoint, FT_LOAD_NO_BITMAP);
        if (err != 0) {
            throw new FontLoadException(String.format("Cannot load U+%04X from %s: FreeType error %d",
                    codepoint, name, err));
        }
        FT_GlyphSlot slot = ftFace.glyph();
        if (slot == null) {
            throw new FontLoadException("Font " + name + " has no glyph slot");
        }
        return slot;
    }

    private GlyphBounds bounds(FT_GlyphSlot slot, int strokeWeight) {
        int advancePx = (int) ((slot.advance().x() + 32) >> 6);
        return new GlyphBounds(advancePx + 2 * strokeWeight, lineHeightPx + 2 * strokeWeight);
    }

    private void checkOpen() {
        if (ftFace == null) {
            throw new IllegalStateException("Font " + name + " is closed");
        }
    }

    /** Font file this resource was loaded from (or the label given to {@link #fromBytes}). */
    public String name() {
        return name;
    }

    // ==================================================================================
    // Cleanup
    // ==================================================================================

    @Override
    public void close() {
        if (ftFace != null) {
            FT_Done_Face(ftFace);
            ftFace = null;
        }
        if (ftLibHandle != 0) {
            FT_Done_FreeType(ftLibHandle);
            ftLibHandle = 0;
        }
        fontDataBuffer = null;
        currentSize = 0;
    }
}
