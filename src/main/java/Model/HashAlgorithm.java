package Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Single-image hash algorithms. Each one maps a prepared grayscale image to a
 * {@link Fingerprint} of hashSize x hashSize bits (the perceptive hash rounds up
 * to whole bytes).
 */
public enum HashAlgorithm {

    /** Horizontal difference hash; the default. */
    DIFFERENCE("difference", 1, 0) {
        @Override
        public Fingerprint hash(GrayImage prepared, FingerprintSettings settings) {
            return DifferenceHash.horizontal(this, prepared, settings.hashSize());
        }
    },

    VERTICAL_DIFFERENCE("vertical", 0, 1) {
        @Override
        public Fingerprint hash(GrayImage prepared, FingerprintSettings settings) {
            return DifferenceHash.vertical(this, prepared, settings.hashSize());
        }
    },

    WAVELET("wavelet", 0, 0) {
        @Override
        public Fingerprint hash(GrayImage prepared, FingerprintSettings settings) {
            return WaveletHash.hash(this, prepared, settings.hashSize(),
                    settings.waveletImageScale(), settings.removeMaxHaarLl());
        }
    },

    PERCEPTIVE("perceptive", 0, 0) {
        @Override
        public Fingerprint hash(GrayImage prepared, FingerprintSettings settings) {
            return PerceptiveHashing.hash(this, prepared, settings.hashSize());
        }
    };

    private static final Map<String, HashAlgorithm> BY_KEY;

    static {
        Map<String, HashAlgorithm> keys = new LinkedHashMap<>();
        for (HashAlgorithm a : values()) keys.put(a.key, a);
        keys.put("horizontal", DIFFERENCE);
        BY_KEY = Collections.unmodifiableMap(keys);
    }

    private final String key;
    private final int xOffset;
    private final int yOffset;

    HashAlgorithm(String key, int xOffset, int yOffset) {
        this.key = key;
        this.xOffset = xOffset;
        this.yOffset = yOffset;
    }

    public String key() {
        return key;
    }

    public abstract Fingerprint hash(GrayImage prepared, FingerprintSettings settings);

    /**
     * Box-average pre-shrink. The factor is the largest power of two that keeps
     * the shorter side at least 16x the hash grid. It depends only on the shorter
     * side, and {@link GrayImage#shrinkArea} commutes with rotation, so rotated
     * copies of an image shrink to rotated copies of the same pixels.
     */
    public GrayImage prepare(GrayImage image, FingerprintSettings settings) {
        if (!settings.preShrink()) return image;
        int target = (settings.hashSize() + Math.max(xOffset, yOffset)) * 16;
        int ratio = Math.min(image.width(), image.height()) / target;
        if (ratio < 2) return image;
        return image.shrinkArea(Integer.highestOneBit(ratio));
    }

    public static HashAlgorithm fromKey(String key) {
        HashAlgorithm algorithm = BY_KEY.get(key.toLowerCase(Locale.ROOT));
        if (algorithm == null) {
            throw new IllegalArgumentException("Invalid hash mode '" + key + "' - expected one of: "
                    + String.join(", ", BY_KEY.keySet()));
        }
        return algorithm;
    }

    @Override
    public String toString() {
        return key;
    }
}
