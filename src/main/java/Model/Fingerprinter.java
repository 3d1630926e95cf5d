package Model;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns decoded images into composite fingerprints for one set of
 * {@link FingerprintSettings}. Stateless and safe to share between threads.
 */
public final class Fingerprinter {

    private final FingerprintSettings settings;

    public Fingerprinter(FingerprintSettings settings) {
        this.settings = settings;
    }

    public FingerprintSettings settings() {
        return settings;
    }

    public CompositeFingerprint fingerprint(GrayImage gray) {
        return settings.strategy().fingerprint(gray, settings);
    }

    public CompositeFingerprint fingerprint(BufferedImage image) {
        return fingerprint(GrayImage.of(image));
    }

    public CompositeFingerprint fingerprint(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fingerprint(decode(in, path.toString()));
        }
    }

    public CompositeFingerprint fingerprint(byte[] encodedImage, String name) throws IOException {
        return fingerprint(decode(new ByteArrayInputStream(encodedImage), name));
    }

    /** A single fingerprint of the whole image, without composite strategy. */
    public Fingerprint single(BufferedImage image) {
        HashAlgorithm algorithm = settings.algorithm();
        return algorithm.hash(algorithm.prepare(GrayImage.of(image), settings), settings);
    }

    static BufferedImage decode(InputStream in, String name) throws IOException {
        BufferedImage image;
        try {
            image = ImageIO.read(in);
        } catch (IOException | RuntimeException e) {
            ImageDecodeException wrapped = new ImageDecodeException("Unable to decode image: " + name + " (" + e.getMessage() + ")");
            wrapped.initCause(e);
            throw wrapped;
        }
        if (image == null) {
            throw new ImageDecodeException("Unable to decode image: " + name + " (unsupported format)");
        }
        return image;
    }
}
