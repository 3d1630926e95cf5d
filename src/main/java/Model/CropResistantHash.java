package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Crop resistant composite: one fingerprint per bright or dark region found on
 * a blurred, fixed-size copy of the image. Cropping removes or shrinks some
 * regions but leaves the others, so images still match region by region.
 *
 * <p>About 3x slower to build than {@link RotatedHash}.</p>
 */
public final class CropResistantHash {

    private static final Logger log = LoggerFactory.getLogger(CropResistantHash.class);

    private static final double BLUR_RADIUS = 2.0;
    private static final int MEDIAN_SIZE = 3;

    private CropResistantHash() {}

    static List<Fingerprint> components(GrayImage gray, FingerprintSettings settings) {
        int pre = settings.preSegmentSize();
        GrayImage smoothed = gray.resize(pre, pre)
                .gaussianBlur(BLUR_RADIUS)
                .medianFilter(MEDIAN_SIZE);

        List<Segment> segments = new ArrayList<>(
                Segmenter.segment(smoothed, settings.segmentThreshold(), settings.minSegmentSize()));
        if (segments.isEmpty()) {
            segments.add(Segment.whole(pre, pre));
        }
        if (settings.segmentLimit() > 0 && segments.size() > settings.segmentLimit()) {
            segments.sort(Comparator.comparingInt(Segment::size).reversed());
            segments = new ArrayList<>(segments.subList(0, settings.segmentLimit()));
        }

        double scaleW = (double) gray.width() / pre;
        double scaleH = (double) gray.height() / pre;
        HashAlgorithm algorithm = settings.algorithm();

        List<Fingerprint> hashes = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            double[] box = segment.bounds(scaleW, scaleH);
            GrayImage region = gray.crop(box[0], box[1], box[2], box[3]);
            hashes.add(algorithm.hash(algorithm.prepare(region, settings), settings));
        }
        log.trace("Hashed {} segments of {}", hashes.size(), gray);
        return hashes;
    }

    /**
     * {@code len(a) - (matches - sumDist / (matches * bits))}, or {@code len(a)}
     * when no region of {@code a} has a match in {@code b}.
     *
     * @param maxDistance  hamming cutoff for a region match, or null to derive it
     * @param bitErrorRate share of bits that may differ when maxDistance is null
     */
    public static double difference(CompositeFingerprint a, CompositeFingerprint b,
                                    Double maxDistance, double bitErrorRate) {
        int[] distances = matchingDistances(a, b, maxDistance, bitErrorRate);
        int n = a.size();
        if (distances.length == 0) return n;

        long sum = 0;
        for (int d : distances) sum += d;
        int matches = distances.length;
        double matchScore = matches - ((double) sum / ((double) matches * a.componentBitWidth()));
        return n - matchScore;
    }

    public static double relativeDifference(CompositeFingerprint a, CompositeFingerprint b,
                                            Double maxDistance, double bitErrorRate) {
        return difference(a, b, maxDistance, bitErrorRate) / a.size();
    }

    /** True when more than {@code minRegions} regions of a match a region of b. */
    public static boolean matches(CompositeFingerprint a, CompositeFingerprint b, int minRegions) {
        return matches(a, b, minRegions, null, FingerprintSettings.DEFAULT_BIT_ERROR_RATE);
    }

    public static boolean matches(CompositeFingerprint a, CompositeFingerprint b, int minRegions,
                                  Double maxDistance, double bitErrorRate) {
        return matchingDistances(a, b, maxDistance, bitErrorRate).length > minRegions;
    }

    /**
     * For every component of a, its closest distance to any component of b,
     * kept only when within the cutoff.
     */
    private static int[] matchingDistances(CompositeFingerprint a, CompositeFingerprint b,
                                           Double maxDistance, double bitErrorRate) {
        requireCropResistant(a);
        requireCropResistant(b);
        double cutoff = maxDistance != null ? maxDistance : a.componentBitWidth() * bitErrorRate;

        int[] kept = new int[a.size()];
        int count = 0;
        for (Fingerprint region : a.components()) {
            int lowest = Integer.MAX_VALUE;
            for (Fingerprint other : b.components()) {
                lowest = Math.min(lowest, region.difference(other));
            }
            if (lowest <= cutoff) kept[count++] = lowest;
        }
        int[] out = new int[count];
        System.arraycopy(kept, 0, out, 0, count);
        return out;
    }

    private static void requireCropResistant(CompositeFingerprint f) {
        if (f.strategy() != CompositeStrategy.CROP_RESISTANT) {
            throw new IncompatibleFingerprintException("Expected a crop resistant fingerprint, got " + f.strategy());
        }
    }
}
