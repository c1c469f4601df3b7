package dev.everydaythings.ascii;

import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AsciiConfigTest {

    @Test
    public void defaults() {
        AsciiConfig config = AsciiConfig.builder().build();

        assertThat(config.characterSet()).isEqualTo("@%#*+=-:. ");
        assertThat(config.fontPath()).isEmpty();
        assertThat(config.fontSize()).isEqualTo(16);
        assertThat(config.strokeWeight()).isEqualTo(2);
        assertThat(config.polarity()).isEqualTo(Polarity.DARK);
        assertThat(config.reverseOrder()).isFalse();
        assertThat(config.colorMode()).isEqualTo(ColorMode.original());
        assertThat(config.clipToOriginal()).isTrue();
    }

    @Test
    public void readsEveryKey() {
        Properties props = new Properties();
        props.setProperty("character_set", " .#");
        props.setProperty("font_path", "/fonts/mono.ttf");
        props.setProperty("font_size", " 12 ");
        props.setProperty("stroke_weight", "0");
        props.setProperty("background_polarity", "Light");
        props.setProperty("reverse_order", "TRUE");
        props.setProperty("monochrome_color", "0, 255, 0");
        props.setProperty("clip_to_original", "false");

        AsciiConfig config = AsciiConfig.fromProperties(props);

        assertThat(config.characterSet()).isEqualTo(" .#");
        assertThat(config.fontPath()).contains(Path.of("/fonts/mono.ttf"));
        assertThat(config.fontSize()).isEqualTo(12);
        assertThat(config.strokeWeight()).isZero();
        assertThat(config.polarity()).isEqualTo(Polarity.LIGHT);
        assertThat(config.reverseOrder()).isTrue();
        assertThat(config.colorMode()).isEqualTo(ColorMode.fixed(new Rgb(0, 255, 0)));
        assertThat(config.clipToOriginal()).isFalse();
    }

    @Test
    public void characterSetIsNotTrimmed() {
        Properties props = new Properties();
        props.setProperty("character_set", "@. ");

        assertThat(AsciiConfig.fromProperties(props).characterSet()).isEqualTo("@. ");
    }

    @Test
    public void emptyPropertiesGiveDefaults() {
        assertThat(AsciiConfig.fromProperties(new Properties())).isEqualTo(AsciiConfig.builder().build());
    }

    @Test
    public void errorsNameTheKey() {
        assertThatThrownBy(() -> AsciiConfig.fromProperties(props("font_size", "big")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("font_size");
        assertThatThrownBy(() -> AsciiConfig.fromProperties(props("font_size", "0")))
                .hasMessageStartingWith("font_size");
        assertThatThrownBy(() -> AsciiConfig.fromProperties(props("stroke_weight", "-2")))
                .hasMessageStartingWith("stroke_weight");
        assertThatThrownBy(() -> AsciiConfig.fromProperties(props("background_polarity", "grey")))
                .hasMessageStartingWith("background_polarity");
        assertThatThrownBy(() -> AsciiConfig.fromProperties(props("reverse_order", "yes")))
                .hasMessageStartingWith("reverse_order");
        assertThatThrownBy(() -> AsciiConfig.fromProperties(props("monochrome_color", "0,300,0")))
                .hasMessageStartingWith("monochrome_color");
    }

    @Test
    public void atlasSettingsIgnoreCompositing() {
        AsciiConfig base = AsciiConfig.builder().build();

        assertThat(base.sameAtlasSettings(base.toBuilder().monochrome(Rgb.WHITE).clipToOriginal(false).build()))
                .isTrue();
        assertThat(base.sameAtlasSettings(base.toBuilder().fontSize(20).build())).isFalse();
        assertThat(base.sameAtlasSettings(base.toBuilder().polarity(Polarity.LIGHT).build())).isFalse();
    }

    @Test
    public void toBuilderRoundTrips() {
        AsciiConfig config = AsciiConfig.builder()
                .characterSet("ab")
                .fontPath(Path.of("x.ttf"))
                .monochrome(new Rgb(1, 2, 3))
                .reverseOrder(true)
                .build();

        assertThat(config.toBuilder().build()).isEqualTo(config).hasSameHashCodeAs(config);
    }

    @Test
    public void rgbParsing() {
        assertThat(Rgb.parse("10,20,30")).isEqualTo(new Rgb(10, 20, 30));
        assertThat(new Rgb(10, 20, 30).complement()).isEqualTo(new Rgb(245, 235, 225));
        assertThatThrownBy(() -> Rgb.parse("1,2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Rgb.parse("a,b,c")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Rgb(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Properties props(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return props;
    }
}
