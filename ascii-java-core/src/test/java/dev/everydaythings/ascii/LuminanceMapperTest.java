package dev.everydaythings.ascii;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LuminanceMapperTest {

    @Test
    public void luminanceWeightsChannels() {
        assertThat(LuminanceMapper.luminance(0, 0, 0)).isZero();
        assertThat(LuminanceMapper.luminance(1, 0, 0)).isEqualTo(3);
        assertThat(LuminanceMapper.luminance(0, 1, 0)).isEqualTo(4);
        assertThat(LuminanceMapper.luminance(0, 0, 1)).isEqualTo(1);
        assertThat(LuminanceMapper.luminance(255, 255, 255)).isEqualTo(LuminanceMapper.MAX_LUMINANCE);
    }

    @Test
    public void extremesHitBothEndsOfTheRamp() {
        assertThat(LuminanceMapper.index(0, 10)).isZero();
        assertThat(LuminanceMapper.index(2040, 10)).isEqualTo(9);
        assertThat(LuminanceMapper.index(2040, 1)).isZero();
        assertThat(LuminanceMapper.index(2040, 256)).isEqualTo(255);
    }

    @Test
    public void scalesByShiftNotByExactDivision() {
        // 1836 * 10 / 2040 is exactly 9, but 18360 >> 11 is 8
        assertThat(LuminanceMapper.index(1836, 10)).isEqualTo(8);
        assertThat(LuminanceMapper.index(1023, 2)).isZero();
        assertThat(LuminanceMapper.index(1024, 2)).isEqualTo(1);
    }

    @Test
    public void indexIsMonotonicAndInRange() {
        for (int n = 1; n <= 40; n++) {
            int previous = 0;
            for (int l = 0; l <= LuminanceMapper.MAX_LUMINANCE; l++) {
                int index = LuminanceMapper.index(l, n);
                assertThat(index).isBetween(previous, n - 1);
                previous = index;
            }
        }
    }

    @Test
    public void hugeAtlasDoesNotOverflow() {
        assertThat(LuminanceMapper.index(2040, 2_000_000)).isEqualTo(1_992_187);
        assertThat(LuminanceMapper.index(2040, Integer.MAX_VALUE)).isBetween(0, Integer.MAX_VALUE - 1);
    }

    @Test
    public void complementScoringLeavesGridUntouched() {
        Frame frame = new Frame(2, 1);
        frame.setRgb(0, 0, 0x000000);
        frame.setRgb(1, 0, 0xFFFFFF);
        CellGrid grid = FrameDownsampler.downsample(frame, 1, 1);

        assertThat(LuminanceMapper.map(grid, 10, true, null)).containsExactly(9, 0);
        assertThat(grid.channel(0, 0, 0)).isZero();
        assertThat(LuminanceMapper.map(grid, 10, false, null)).containsExactly(0, 9);
    }

    @Test
    public void rejectsEmptyAtlas() {
        assertThatThrownBy(() -> LuminanceMapper.index(100, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void mapsEveryCellRowMajor() {
        Frame frame = new Frame(2, 1);
        frame.setRgb(0, 0, 0x000000);
        frame.setRgb(1, 0, 0xFFFFFF);
        CellGrid grid = FrameDownsampler.downsample(frame, 1, 1);

        int[] reuse = new int[2];
        int[] indices = LuminanceMapper.map(grid, 10, reuse);

        assertThat(indices).isSameAs(reuse).containsExactly(0, 9);
        assertThat(LuminanceMapper.map(grid, 10, new int[5])).hasSize(2);
    }
}
