package Model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Fixed width perceptual hash of one image (or one image region).
 *
 * <p>Bits are packed row-major into bytes, most significant bit first. The bit
 * width is always a multiple of 8. Two fingerprints are only comparable when
 * they were produced by the same {@link HashAlgorithm} with the same width.</p>
 */
public final class Fingerprint {

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final HashAlgorithm algorithm;
    private final byte[] bytes;

    public Fingerprint(HashAlgorithm algorithm, byte[] bytes) {
        if (bytes.length == 0) throw new IllegalArgumentException("A fingerprint needs at least one byte");
        this.algorithm = algorithm;
        this.bytes = bytes.clone();
    }

    /**
     * Packs booleans into bytes, most significant bit first.
     */
    public static Fingerprint fromBits(HashAlgorithm algorithm, boolean[] bits) {
        if (bits.length % 8 != 0) {
            throw new IllegalArgumentException("Bit count must be a multiple of 8, got " + bits.length);
        }
        byte[] out = new byte[bits.length / 8];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) out[i >> 3] |= (byte) (0x80 >>> (i & 7));
        }
        return new Fingerprint(algorithm, out);
    }

    public static Fingerprint fromHex(HashAlgorithm algorithm, String hex) {
        return new Fingerprint(algorithm, HEX.parseHex(hex));
    }

    public HashAlgorithm algorithm() {
        return algorithm;
    }

    public int bitWidth() {
        return bytes.length * 8;
    }

    public int byteWidth() {
        return bytes.length;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /** Unsigned value of one packed byte. */
    public int byteAt(int offset) {
        return bytes[offset] & 0xFF;
    }

    public boolean bit(int index) {
        return (bytes[index >> 3] & (0x80 >>> (index & 7))) != 0;
    }

    public boolean[] bits() {
        boolean[] out = new boolean[bitWidth()];
        for (int i = 0; i < out.length; i++) out[i] = bit(i);
        return out;
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    /**
     * Hamming distance.
     *
     * @throws IncompatibleFingerprintException if widths or algorithms differ
     */
    public int difference(Fingerprint other) {
        if (algorithm != other.algorithm || bytes.length != other.bytes.length) {
            throw IncompatibleFingerprintException.of(this, other);
        }
        int diff = 0;
        for (int i = 0; i < bytes.length; i++) {
            diff += Integer.bitCount((bytes[i] ^ other.bytes[i]) & 0xFF);
        }
        return diff;
    }

    /** Hamming distance normalized to [0, 1]. */
    public double relativeDifference(Fingerprint other) {
        return (double) difference(other) / bitWidth();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        Fingerprint that = (Fingerprint) o;
        return algorithm == that.algorithm && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Fingerprint[" + algorithm.key() + ", " + toHex() + ", bits=" + bitWidth() + "]";
    }
}
