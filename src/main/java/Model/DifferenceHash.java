package Model;

/**
 * Gradient sign hash ("dHash"): shrink to (size + 1) x size and record, for
 * each pair of neighbours, whether the brightness falls.
 *
 * <p>See http://www.hackerfactor.com/blog/index.php?/archives/529-Kind-of-Like-That.html</p>
 */
final class DifferenceHash {

    private DifferenceHash() {}

    static Fingerprint horizontal(HashAlgorithm algorithm, GrayImage image, int hashSize) {
        GrayImage small = image.resize(hashSize + 1, hashSize);
        boolean[] bits = new boolean[hashSize * hashSize];
        for (int y = 0; y < hashSize; y++) {
            for (int x = 0; x < hashSize; x++) {
                bits[y * hashSize + x] = small.get(x, y) > small.get(x + 1, y);
            }
        }
        return Fingerprint.fromBits(algorithm, bits);
    }

    static Fingerprint vertical(HashAlgorithm algorithm, GrayImage image, int hashSize) {
        GrayImage small = image.resize(hashSize, hashSize + 1);
        boolean[] bits = new boolean[hashSize * hashSize];
        for (int y = 0; y < hashSize; y++) {
            for (int x = 0; x < hashSize; x++) {
                bits[y * hashSize + x] = small.get(x, y) > small.get(x, y + 1);
            }
        }
        return Fingerprint.fromBits(algorithm, bits);
    }
}
