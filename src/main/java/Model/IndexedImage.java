package Model;

import java.nio.file.Path;
import java.time.Instant;

/** One stored image. Modification times keep millisecond precision. */
public record IndexedImage(String directory, String fileName, long sizeBytes, Instant modifiedTime,
                           String contentHash, CompositeFingerprint fingerprint) {

    public Path path() {
        return Path.of(directory, fileName);
    }

    static String directoryOf(Path normalized) {
        Path parent = normalized.getParent();
        return parent == null ? normalized.getRoot().toString() : parent.toString();
    }

    static String fileNameOf(Path normalized) {
        return normalized.getFileName().toString();
    }
}
