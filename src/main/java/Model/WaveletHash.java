package Model;

import java.util.Arrays;

/**
 * Haar wavelet hash ("wHash").
 *
 * <p>The image is resized to a square power-of-two scale, optionally stripped
 * of its deepest low-frequency coefficient (overall brightness), and then
 * decomposed until the low-pass band is hashSize x hashSize. Each bit records
 * whether a coefficient is above the band's median.</p>
 */
final class WaveletHash {

    private WaveletHash() {}

    static Fingerprint hash(HashAlgorithm algorithm, GrayImage image, int hashSize,
                            int imageScale, boolean removeMaxHaarLl) {
        int scale = imageScale > 0
                ? imageScale
                : Math.max(Integer.highestOneBit(Math.min(image.width(), image.height())), hashSize);
        if (!isPowerOfTwo(hashSize) || !isPowerOfTwo(scale)) {
            throw new InvalidHashSizeException(hashSize, scale);
        }

        int llMaxLevel = log2(scale);
        int level = log2(hashSize);
        if (level > llMaxLevel) {
            throw new InvalidHashSizeException(hashSize, scale);
        }

        int[] raw = image.resize(scale, scale).pixels();
        double[] data = new double[raw.length];
        for (int i = 0; i < raw.length; i++) data[i] = raw[i] / 255.0;

        if (removeMaxHaarLl && llMaxLevel > 0) {
            forward(data, scale, llMaxLevel);
            data[0] = 0;
            inverse(data, scale, llMaxLevel);
        }

        forward(data, scale, llMaxLevel - level);
        double[] low = new double[hashSize * hashSize];
        for (int y = 0; y < hashSize; y++) {
            System.arraycopy(data, y * scale, low, y * hashSize, hashSize);
        }

        double median = median(low);
        boolean[] bits = new boolean[low.length];
        for (int i = 0; i < low.length; i++) bits[i] = low[i] > median;
        return Fingerprint.fromBits(algorithm, bits);
    }

    /**
     * In-place multi-level 2D Haar decomposition. After each level the low-pass
     * band occupies the top-left quadrant of the previous band.
     */
    static void forward(double[] data, int size, int levels) {
        double[] tmp = new double[data.length];
        int n = size;
        for (int l = 0; l < levels && n >= 2; l++, n /= 2) {
            int half = n / 2;
            for (int y = 0; y < half; y++) {
                for (int x = 0; x < half; x++) {
                    double a = data[(2 * y) * size + 2 * x];
                    double b = data[(2 * y) * size + 2 * x + 1];
                    double c = data[(2 * y + 1) * size + 2 * x];
                    double d = data[(2 * y + 1) * size + 2 * x + 1];
                    tmp[y * size + x] = (a + b + c + d) / 2;
                    tmp[y * size + x + half] = (a - b + c - d) / 2;
                    tmp[(y + half) * size + x] = (a + b - c - d) / 2;
                    tmp[(y + half) * size + x + half] = (a - b - c + d) / 2;
                }
            }
            for (int y = 0; y < n; y++) {
                System.arraycopy(tmp, y * size, data, y * size, n);
            }
        }
    }

    static void inverse(double[] data, int size, int levels) {
        double[] tmp = new double[data.length];
        int n = size >> (levels - 1);
        for (int l = 0; l < levels; l++, n *= 2) {
            int half = n / 2;
            for (int y = 0; y < half; y++) {
                for (int x = 0; x < half; x++) {
                    double ll = data[y * size + x];
                    double v = data[y * size + x + half];
                    double h = data[(y + half) * size + x];
                    double dd = data[(y + half) * size + x + half];
                    tmp[(2 * y) * size + 2 * x] = (ll + h + v + dd) / 2;
                    tmp[(2 * y) * size + 2 * x + 1] = (ll + h - v - dd) / 2;
                    tmp[(2 * y + 1) * size + 2 * x] = (ll - h + v - dd) / 2;
                    tmp[(2 * y + 1) * size + 2 * x + 1] = (ll - h - v + dd) / 2;
                }
            }
            for (int y = 0; y < n; y++) {
                System.arraycopy(tmp, y * size, data, y * size, n);
            }
        }
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }

    private static boolean isPowerOfTwo(int value) {
        return value > 0 && (value & (value - 1)) == 0;
    }

    private static int log2(int powerOfTwo) {
        return Integer.numberOfTrailingZeros(powerOfTwo);
    }
}
