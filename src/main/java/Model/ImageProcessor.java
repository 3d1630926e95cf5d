package Model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Reads one file, fingerprints it and computes its content hash. The file is
 * read once; the digest and the decoder both work on the same bytes.
 */
public class ImageProcessor {

    private final Fingerprinter fingerprinter;

    public ImageProcessor(Fingerprinter fingerprinter) {
        this.fingerprinter = fingerprinter;
    }

    public Fingerprinter fingerprinter() {
        return fingerprinter;
    }

    public ProcessedImage process(Path path) throws IOException {
        long size = Files.size(path);
        Instant modified = Files.getLastModifiedTime(path).toInstant();
        byte[] data = Files.readAllBytes(path);

        String sha256 = sha256Hex(data);
        CompositeFingerprint fingerprint = fingerprinter.fingerprint(data, path.toString());
        return new ProcessedImage(fingerprint, sha256, size, modified);
    }

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
