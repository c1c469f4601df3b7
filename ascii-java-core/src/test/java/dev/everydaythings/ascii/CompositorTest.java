package dev.everydaythings.ascii;

import org.testng.annotations.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CompositorTest {

    private static final String RAMP = " .:-=+*#%@";

    private static GlyphAtlas atlas() {
        return new GlyphAtlasBuilder(FakeFontResource.ramp(RAMP, 2, 3)).characterSet(RAMP).build();
    }

    private static CellGrid solidGrid(int rows, int cols, Rgb color) {
        Frame frame = new Frame(cols * 2, rows * 3);
        frame.fill(color);
        return FrameDownsampler.downsample(frame, 2, 3);
    }

    @Test
    public void lightOriginalComplementsSampledTint() {
        GlyphAtlas atlas = atlas();
        Compositor compositor = new Compositor(atlas, Polarity.LIGHT, ColorMode.original(), true);
        CellGrid cells = solidGrid(2, 2, new Rgb(200, 100, 50));
        int[] indices = new int[4];
        Arrays.fill(indices, 5);
        int mask = atlas.glyph(5).mask(0, 0, 0);

        Frame out = compositor.composite(cells, indices, 4, 6, null);

        assertThat(out.channel(3, 5, 0)).isEqualTo(255 - mask * 55 / 255);
        assertThat(out.channel(3, 5, 1)).isEqualTo(255 - mask * 155 / 255);
        assertThat(out.channel(3, 5, 2)).isEqualTo(255 - mask * 205 / 255);
        assertThat(cells.channel(0, 0, 0)).as("cells are read only").isEqualTo(200);
    }

    @Test
    public void darkOriginalUsesSampledTint() {
        GlyphAtlas atlas = atlas();
        Compositor compositor = new Compositor(atlas, Polarity.DARK, ColorMode.original(), true);
        int[] indices = new int[4];
        Arrays.fill(indices, 9);
        int mask = atlas.glyph(9).mask(0, 0, 0);

        Frame out = compositor.composite(solidGrid(2, 2, new Rgb(200, 100, 50)), indices, 4, 6, null);

        assertThat(out.channel(0, 0, 0)).isEqualTo(mask * 200 / 255);
        assertThat(out.channel(0, 0, 2)).isEqualTo(mask * 50 / 255);
    }

    @Test
    public void lightFixedComplementsColor() {
        GlyphAtlas atlas = atlas();
        Compositor compositor = new Compositor(atlas, Polarity.LIGHT, ColorMode.fixed(new Rgb(0, 255, 0)), true);
        int[] indices = new int[4];
        Arrays.fill(indices, 0);

        Frame out = compositor.composite(solidGrid(2, 2, new Rgb(10, 20, 30)), indices, 4, 6, null);

        assertThat(out.pixels()).containsOnly((byte) 255);
    }

    @Test
    public void rejectsIndexGridOfWrongSize() {
        Compositor compositor = new Compositor(atlas(), Polarity.DARK, ColorMode.original(), true);

        assertThatThrownBy(() -> compositor.composite(solidGrid(2, 2, Rgb.WHITE), new int[3], 4, 6, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void rejectsEmptyAtlas() {
        assertThatThrownBy(() -> new Compositor(GlyphAtlas.empty(), Polarity.DARK, ColorMode.original(), true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
