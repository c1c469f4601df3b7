package dev.everydaythings.ascii;

import java.nio.file.Path;

/**
 * Opens a {@link FontResource} from a font file.
 */
@FunctionalInterface
public interface FontProvider {

    /**
     * @throws FontLoadException if the file is unreadable or not a font
     */
    FontResource open(Path fontPath);
}
