package dev.everydaythings.ascii.examples;

import dev.everydaythings.ascii.*;
import dev.everydaythings.ascii.freetype.FontLocator;
import dev.everydaythings.ascii.freetype.FreeTypeFontResource;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Converts one image file into an ASCII-art PNG.
 *
 * Usage:
 *   hello-ascii &lt;input image&gt; &lt;output.png&gt; [settings.properties] [atlas.ppm]
 *
 * The optional properties file uses the keys documented on {@link AsciiConfig}.
 * When an atlas path is given, the glyph ramp is dumped there as PPM.
 */
public class HelloAscii {

    private static final Logger log = Logger.getLogger(HelloAscii.class.getName());

    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            System.err.println("usage: hello-ascii <input image> <output.png> [settings.properties] [atlas.ppm]");
            System.exit(2);
        }
        Path input = Path.of(args[0]);
        Path output = Path.of(args[1]);

        AsciiConfig config = args.length > 2 ? loadConfig(Path.of(args[2])) : AsciiConfig.builder().build();
        config = FontLocator.withDefaultFont(config);

        AsciiConverter converter = AsciiConverter.create(config, FreeTypeFontResource::open);
        if (args.length > 3 && !converter.isPassthrough()) {
            converter.atlas().debugDumpAtlas(Path.of(args[3]));
        }

        BufferedImage image = ImageIO.read(input.toFile());
        if (image == null) {
            throw new IOException("Not a readable image: " + input);
        }
        Frame frame = Frame.fromImage(image);

        long start = System.nanoTime();
        Frame ascii = converter.convert(frame);
        long micros = (System.nanoTime() - start) / 1000;

        if (!ImageIO.write(ascii.toImage(), "png", output.toFile())) {
            throw new IOException("No PNG writer available");
        }
        log.info(() -> String.format("%s (%dx%d) -> %s (%dx%d) in %d us",
                input, frame.width(), frame.height(), output, ascii.width(), ascii.height(), micros));
    }

    private static AsciiConfig loadConfig(Path path) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        }
        return AsciiConfig.fromProperties(props);
    }
}
