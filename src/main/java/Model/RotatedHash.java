package Model;

import java.util.List;

/**
 * Rotation invariant composite: the image is hashed at 0, 90 and 180 degrees.
 * Since both stored images and queries carry three rotations, every relative
 * rotation of a pair is covered without hashing 270 degrees.
 */
public final class RotatedHash {

    private RotatedHash() {}

    static List<Fingerprint> components(GrayImage gray, FingerprintSettings settings) {
        HashAlgorithm algorithm = settings.algorithm();
        GrayImage prepared = algorithm.prepare(gray, settings);
        return List.of(
                algorithm.hash(prepared, settings),
                algorithm.hash(prepared.rotate90(), settings),
                algorithm.hash(prepared.rotate180(), settings));
    }

    /** Minimum hamming distance over all 3 x 3 component pairs. */
    public static int difference(CompositeFingerprint a, CompositeFingerprint b) {
        requireRotated(a);
        requireRotated(b);
        int best = Integer.MAX_VALUE;
        for (Fingerprint x : a.components()) {
            for (Fingerprint y : b.components()) {
                best = Math.min(best, x.difference(y));
            }
        }
        return best;
    }

    /** Minimum hamming distance between a bare fingerprint and any of the components. */
    public static int difference(CompositeFingerprint a, Fingerprint b) {
        requireRotated(a);
        int best = Integer.MAX_VALUE;
        for (Fingerprint x : a.components()) {
            best = Math.min(best, x.difference(b));
        }
        return best;
    }

    public static double relativeDifference(CompositeFingerprint a, CompositeFingerprint b) {
        return (double) difference(a, b) / a.componentBitWidth();
    }

    private static void requireRotated(CompositeFingerprint f) {
        if (f.strategy() != CompositeStrategy.ROTATED) {
            throw new IncompatibleFingerprintException("Expected a rotated fingerprint, got " + f.strategy());
        }
    }
}
