package Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ways of combining several fingerprints of one image into a
 * {@link CompositeFingerprint} that survives rotation or cropping.
 */
public enum CompositeStrategy {

    /** Hashes at 0, 90 and 180 degrees; comparison takes the best pairing. */
    ROTATED("rotated", 1) {
        @Override
        List<Fingerprint> components(GrayImage gray, FingerprintSettings settings) {
            return RotatedHash.components(gray, settings);
        }

        @Override
        double difference(CompositeFingerprint a, CompositeFingerprint b, double bitErrorRate) {
            return RotatedHash.difference(a, b);
        }

        @Override
        double relativeDifference(CompositeFingerprint a, CompositeFingerprint b, double bitErrorRate) {
            return RotatedHash.relativeDifference(a, b);
        }

        @Override
        int matchBitBudget(double maxRelativeDistance, int bitWidth, double bitErrorRate) {
            return (int) Math.floor(maxRelativeDistance * bitWidth);
        }
    },

    /** One hash per bright or dark region of the image. */
    CROP_RESISTANT("crop_resistant", 2) {
        @Override
        List<Fingerprint> components(GrayImage gray, FingerprintSettings settings) {
            return CropResistantHash.components(gray, settings);
        }

        @Override
        double difference(CompositeFingerprint a, CompositeFingerprint b, double bitErrorRate) {
            return CropResistantHash.difference(a, b, null, bitErrorRate);
        }

        @Override
        double relativeDifference(CompositeFingerprint a, CompositeFingerprint b, double bitErrorRate) {
            return CropResistantHash.relativeDifference(a, b, null, bitErrorRate);
        }

        @Override
        int matchBitBudget(double maxRelativeDistance, int bitWidth, double bitErrorRate) {
            // anything below 1.0 needs at least one region within the bit error rate
            if (maxRelativeDistance >= 1.0) return bitWidth;
            return (int) Math.floor(bitWidth * bitErrorRate);
        }
    };

    private static final Map<String, CompositeStrategy> BY_KEY;

    static {
        Map<String, CompositeStrategy> keys = new LinkedHashMap<>();
        for (CompositeStrategy s : values()) keys.put(s.key, s);
        keys.put("crop-resistant", CROP_RESISTANT);
        BY_KEY = Collections.unmodifiableMap(keys);
    }

    private final String key;
    private final int tag;

    CompositeStrategy(String key, int tag) {
        this.key = key;
        this.tag = tag;
    }

    public String key() {
        return key;
    }

    /** Byte written ahead of the components in the serialized form. */
    int tag() {
        return tag;
    }

    public CompositeFingerprint fingerprint(GrayImage gray, FingerprintSettings settings) {
        return new CompositeFingerprint(this, components(gray, settings));
    }

    abstract List<Fingerprint> components(GrayImage gray, FingerprintSettings settings);

    abstract double difference(CompositeFingerprint a, CompositeFingerprint b, double bitErrorRate);

    abstract double relativeDifference(CompositeFingerprint a, CompositeFingerprint b, double bitErrorRate);

    /**
     * Upper bound on the hamming distance between the closest pair of components
     * of any record within {@code maxRelativeDistance} of a query. Candidate
     * pre-filtering by shared bytes is only exhaustive while this stays below the
     * number of bytes per component.
     */
    abstract int matchBitBudget(double maxRelativeDistance, int bitWidth, double bitErrorRate);

    public static CompositeStrategy fromKey(String key) {
        CompositeStrategy strategy = BY_KEY.get(key.toLowerCase(Locale.ROOT));
        if (strategy == null) {
            throw new IllegalArgumentException("Invalid multi mode '" + key + "' - expected one of: "
                    + String.join(", ", BY_KEY.keySet()));
        }
        return strategy;
    }

    static CompositeStrategy fromTag(int tag) {
        for (CompositeStrategy s : values()) {
            if (s.tag == tag) return s;
        }
        throw new IllegalArgumentException("Unknown composite fingerprint tag " + tag);
    }

    @Override
    public String toString() {
        return key;
    }
}
