package dev.everydaythings.ascii.freetype;

import dev.everydaythings.ascii.AsciiConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Finds a usable font file when the configuration does not name one.
 *
 * <p>Candidates are tried in order and the first existing file wins: user-installed monospace
 * fonts, then common Linux, macOS and Windows system fonts.
 */
public final class FontLocator {

    private static final Logger log = Logger.getLogger(FontLocator.class.getName());

    private FontLocator() {
    }

    /** Default candidate paths for the current user, in preference order. */
    public static List<Path> defaultCandidates() {
        String home = System.getProperty("user.home", "");
        List<Path> paths = new ArrayList<>();
        if (!home.isEmpty()) {
            paths.add(Path.of(home, ".local/share/fonts/DejaVuSansMono.ttf"));
        }
        for (String p : new String[]{
                "/usr/share/fonts/truetype/dejavu/DejaVuSansMono.ttf",
                "/usr/share/fonts/TTF/DejaVuSansMono.ttf",
                "/usr/share/fonts/dejavu/DejaVuSansMono.ttf",
                "/usr/share/fonts/truetype/liberation/LiberationMono-Regular.ttf",
                "/usr/share/fonts/liberation-mono/LiberationMono-Regular.ttf",
                "/usr/share/fonts/truetype/freefont/FreeMono.ttf",
                "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                "/Library/Fonts/Arial.ttf",
                "/System/Library/Fonts/Supplemental/Arial.ttf",
                "C:/Windows/Fonts/consola.ttf",
                "C:/Windows/Fonts/Arial.ttf",
        }) {
            paths.add(Path.of(p));
        }
        return paths;
    }

    /** The first existing file among {@link #defaultCandidates()}. */
    public static Optional<Path> findDefault() {
        return findFirst(defaultCandidates());
    }

    /** The first candidate that is a readable regular file. */
    public static Optional<Path> findFirst(List<Path> candidates) {
        for (Path path : candidates) {
            if (Files.isRegularFile(path) && Files.isReadable(path)) {
                log.fine(() -> "Using font: " + path);
                return Optional.of(path);
            }
        }
        log.fine(() -> String.format("No font found, tried %d paths", candidates.size()));
        return Optional.empty();
    }

    /**
     * {@code config} with a located font path filled in when it has none. Returned unchanged if it
     * already names a font or nothing could be found.
     */
    public static AsciiConfig withDefaultFont(AsciiConfig config) {
        if (config.fontPath().isPresent()) {
            return config;
        }
        Optional<Path> found = findDefault();
        if (found.isEmpty()) {
            log.warning("No system font found; set font_path explicitly");
            return config;
        }
        log.info(() -> "Using default font: " + found.get());
        return config.toBuilder().fontPath(found.get()).build();
    }
}
