package Model;

import java.util.Objects;

/**
 * Immutable configuration of how images are fingerprinted: the hash algorithm,
 * the composite strategy and their parameters.
 *
 * <p>Fingerprints are only comparable when they were computed with equal
 * {@link #storeKey() store keys}.</p>
 */
public final class FingerprintSettings {

    public static final int DEFAULT_HASH_SIZE = 8;
    public static final double DEFAULT_BIT_ERROR_RATE = 0.25;

    private final HashAlgorithm algorithm;
    private final CompositeStrategy strategy;
    private final int hashSize;
    private final boolean preShrink;
    private final int waveletImageScale;
    private final boolean removeMaxHaarLl;
    private final int segmentLimit;
    private final int segmentThreshold;
    private final int minSegmentSize;
    private final int preSegmentSize;
    private final double bitErrorRate;

    private FingerprintSettings(Builder b) {
        this.algorithm = Objects.requireNonNull(b.algorithm, "algorithm");
        this.strategy = Objects.requireNonNull(b.strategy, "strategy");
        this.hashSize = b.hashSize;
        this.preShrink = b.preShrink;
        this.waveletImageScale = b.waveletImageScale;
        this.removeMaxHaarLl = b.removeMaxHaarLl;
        this.segmentLimit = b.segmentLimit;
        this.segmentThreshold = b.segmentThreshold;
        this.minSegmentSize = b.minSegmentSize;
        this.preSegmentSize = b.preSegmentSize;
        this.bitErrorRate = b.bitErrorRate;
    }

    public static FingerprintSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .algorithm(algorithm)
                .strategy(strategy)
                .hashSize(hashSize)
                .preShrink(preShrink)
                .waveletImageScale(waveletImageScale)
                .removeMaxHaarLl(removeMaxHaarLl)
                .segmentLimit(segmentLimit)
                .segmentThreshold(segmentThreshold)
                .minSegmentSize(minSegmentSize)
                .preSegmentSize(preSegmentSize)
                .bitErrorRate(bitErrorRate);
    }

    public HashAlgorithm algorithm() { return algorithm; }
    public CompositeStrategy strategy() { return strategy; }
    public int hashSize() { return hashSize; }
    public boolean preShrink() { return preShrink; }
    /** Wavelet resize scale, 0 to derive it from the image. */
    public int waveletImageScale() { return waveletImageScale; }
    public boolean removeMaxHaarLl() { return removeMaxHaarLl; }
    /** Maximum number of crop-resistant segments, 0 for no limit. */
    public int segmentLimit() { return segmentLimit; }
    public int segmentThreshold() { return segmentThreshold; }
    public int minSegmentSize() { return minSegmentSize; }
    public int preSegmentSize() { return preSegmentSize; }
    public double bitErrorRate() { return bitErrorRate; }

    /**
     * Identifies the fingerprints an index was built with: the layout plus every
     * parameter that changes the stored bits for this algorithm and strategy.
     * The bit error rate only affects comparisons and is left out.
     */
    public String storeKey() {
        StringBuilder key = new StringBuilder()
                .append(strategy.key()).append('/').append(algorithm.key()).append('/').append(hashSize)
                .append(":preShrink=").append(preShrink);
        if (algorithm == HashAlgorithm.WAVELET) {
            key.append(",imageScale=").append(waveletImageScale)
               .append(",removeMaxHaarLl=").append(removeMaxHaarLl);
        }
        if (strategy == CompositeStrategy.CROP_RESISTANT) {
            key.append(",segmentLimit=").append(segmentLimit)
               .append(",segmentThreshold=").append(segmentThreshold)
               .append(",minSegmentSize=").append(minSegmentSize)
               .append(",preSegmentSize=").append(preSegmentSize);
        }
        return key.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FingerprintSettings)) return false;
        FingerprintSettings that = (FingerprintSettings) o;
        return hashSize == that.hashSize
                && preShrink == that.preShrink
                && waveletImageScale == that.waveletImageScale
                && removeMaxHaarLl == that.removeMaxHaarLl
                && segmentLimit == that.segmentLimit
                && segmentThreshold == that.segmentThreshold
                && minSegmentSize == that.minSegmentSize
                && preSegmentSize == that.preSegmentSize
                && Double.compare(bitErrorRate, that.bitErrorRate) == 0
                && algorithm == that.algorithm
                && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, strategy, hashSize, preShrink, waveletImageScale, removeMaxHaarLl,
                segmentLimit, segmentThreshold, minSegmentSize, preSegmentSize, bitErrorRate);
    }

    @Override
    public String toString() {
        return "FingerprintSettings{" +
               "algorithm=" + algorithm +
               ", strategy=" + strategy +
               ", hashSize=" + hashSize +
               ", preShrink=" + preShrink +
               ", waveletImageScale=" + waveletImageScale +
               ", removeMaxHaarLl=" + removeMaxHaarLl +
               ", segmentLimit=" + segmentLimit +
               ", segmentThreshold=" + segmentThreshold +
               ", minSegmentSize=" + minSegmentSize +
               ", preSegmentSize=" + preSegmentSize +
               ", bitErrorRate=" + bitErrorRate +
               '}';
    }

    public static final class Builder {
        private HashAlgorithm algorithm = HashAlgorithm.DIFFERENCE;
        private CompositeStrategy strategy = CompositeStrategy.ROTATED;
        private int hashSize = DEFAULT_HASH_SIZE;
        private boolean preShrink = true;
        private int waveletImageScale = 0;
        private boolean removeMaxHaarLl = true;
        private int segmentLimit = 0;
        private int segmentThreshold = 128;
        private int minSegmentSize = 500;
        private int preSegmentSize = 300;
        private double bitErrorRate = DEFAULT_BIT_ERROR_RATE;

        private Builder() {}

        public Builder algorithm(HashAlgorithm a) { this.algorithm = a; return this; }
        public Builder strategy(CompositeStrategy s) { this.strategy = s; return this; }
        public Builder preShrink(boolean p) { this.preShrink = p; return this; }
        public Builder waveletImageScale(int s) { this.waveletImageScale = s; return this; }
        public Builder removeMaxHaarLl(boolean r) { this.removeMaxHaarLl = r; return this; }
        public Builder segmentLimit(int l) { this.segmentLimit = l; return this; }
        public Builder segmentThreshold(int t) { this.segmentThreshold = t; return this; }
        public Builder minSegmentSize(int s) { this.minSegmentSize = s; return this; }

        public Builder hashSize(int size) {
            if (size < 4 || (size * size) % 8 != 0) {
                throw new IllegalArgumentException("Hash size must be a positive multiple of 4, got " + size);
            }
            this.hashSize = size;
            return this;
        }

        public Builder preSegmentSize(int size) {
            if (size < 1) throw new IllegalArgumentException("Pre-segment size must be positive, got " + size);
            this.preSegmentSize = size;
            return this;
        }

        public Builder bitErrorRate(double rate) {
            if (rate < 0 || rate > 1) throw new IllegalArgumentException("Bit error rate must be in [0, 1], got " + rate);
            this.bitErrorRate = rate;
            return this;
        }

        public FingerprintSettings build() {
            return new FingerprintSettings(this);
        }
    }
}
