package dev.everydaythings.ascii;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FrameDownsamplerTest {

    private static Frame coordinateFrame(int w, int h) {
        Frame frame = new Frame(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                frame.setRgb(x, y, (x << 16) | (y << 8) | 7);
            }
        }
        return frame;
    }

    @Test
    public void gridCoversPartialCells() {
        assertThat(FrameDownsampler.rows(7, 3)).isEqualTo(3);
        assertThat(FrameDownsampler.cols(9, 3)).isEqualTo(3);
        assertThat(FrameDownsampler.cols(1, 8)).isEqualTo(1);
    }

    @Test
    public void samplesTopLeftPixelOfEachCell() {
        Frame frame = coordinateFrame(5, 7);
        CellGrid grid = FrameDownsampler.downsample(frame, 2, 3);

        assertThat(grid.rows()).isEqualTo(3);
        assertThat(grid.cols()).isEqualTo(3);
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                assertThat(grid.channel(r, c, 0)).as("x of cell %d,%d", r, c).isEqualTo(c * 2);
                assertThat(grid.channel(r, c, 1)).as("y of cell %d,%d", r, c).isEqualTo(r * 3);
                assertThat(grid.channel(r, c, 2)).isEqualTo(7);
            }
        }
    }

    @Test
    public void reusesGridOnlyWhenShapeMatches() {
        Frame frame = coordinateFrame(8, 8);
        CellGrid matching = new CellGrid(2, 2);
        CellGrid other = new CellGrid(3, 2);

        assertThat(FrameDownsampler.downsample(frame, 4, 4, matching)).isSameAs(matching);
        assertThat(FrameDownsampler.downsample(frame, 4, 4, other)).isNotSameAs(other);
    }

    @Test
    public void cellLargerThanFrameGivesOneCell() {
        CellGrid grid = FrameDownsampler.downsample(coordinateFrame(3, 2), 10, 10);
        assertThat(grid.cellCount()).isEqualTo(1);
        assertThat(grid.channel(0, 0, 0)).isZero();
    }

    @Test
    public void rejectsEmptyCells() {
        assertThatThrownBy(() -> FrameDownsampler.downsample(coordinateFrame(2, 2), 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
