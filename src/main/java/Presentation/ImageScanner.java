package Presentation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Walks files and directories and reports the image files found, as absolute
 * normalized paths.
 */
public final class ImageScanner {

    private static final Logger log = LoggerFactory.getLogger(ImageScanner.class);

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png");

    private final Set<String> extensions;

    /** Accepts .jpg, .jpeg and .png files. */
    public ImageScanner() {
        this(DEFAULT_EXTENSIONS);
    }

    /** @param extensions lower case suffixes with the dot, or empty to accept every file */
    public ImageScanner(Set<String> extensions) {
        this.extensions = Set.copyOf(extensions);
    }

    public void scan(Path root, Consumer<Path> onImageFound) throws IOException {
        Path start = root.toAbsolutePath().normalize();
        if (Files.isRegularFile(start)) {
            if (looksLikeImage(start)) onImageFound.accept(start);
            return;
        }
        try (Stream<Path> stream = Files.walk(start)) {
            stream
                    .filter(Files::isRegularFile)
                    .filter(this::looksLikeImage)
                    .forEach(onImageFound);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public List<Path> scanAll(Collection<Path> roots) throws IOException {
        List<Path> found = new ArrayList<>();
        for (Path root : roots) {
            int before = found.size();
            scan(root, found::add);
            log.debug("Found {} images under {}", found.size() - before, root);
        }
        return found;
    }

    private boolean looksLikeImage(Path p) {
        if (extensions.isEmpty()) return true;
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot));
    }
}
