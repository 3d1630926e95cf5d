package Model;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * All fingerprints of one image under a {@link CompositeStrategy}.
 *
 * <p>Serialized form: strategy tag (1 byte), component byte width (2 bytes,
 * big-endian), then the component bytes concatenated in order.</p>
 */
public final class CompositeFingerprint {

    private final CompositeStrategy strategy;
    private final List<Fingerprint> components;

    public CompositeFingerprint(CompositeStrategy strategy, List<Fingerprint> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("A composite fingerprint needs at least one component");
        }
        if (strategy == CompositeStrategy.ROTATED && components.size() != 3) {
            throw new IllegalArgumentException("Rotated fingerprints have exactly 3 components, got " + components.size());
        }
        Fingerprint first = components.get(0);
        for (Fingerprint f : components) {
            if (f.algorithm() != first.algorithm() || f.bitWidth() != first.bitWidth()) {
                throw IncompatibleFingerprintException.of(first, f);
            }
        }
        this.strategy = strategy;
        this.components = List.copyOf(components);
    }

    public CompositeStrategy strategy() {
        return strategy;
    }

    public List<Fingerprint> components() {
        return components;
    }

    public int size() {
        return components.size();
    }

    public HashAlgorithm algorithm() {
        return components.get(0).algorithm();
    }

    public int componentBitWidth() {
        return components.get(0).bitWidth();
    }

    public int componentByteWidth() {
        return components.get(0).byteWidth();
    }

    public double difference(CompositeFingerprint other) {
        return difference(other, FingerprintSettings.DEFAULT_BIT_ERROR_RATE);
    }

    public double difference(CompositeFingerprint other, double bitErrorRate) {
        requireSameStrategy(other);
        return strategy.difference(this, other, bitErrorRate);
    }

    /** 0 for identical images, 1 for maximally different ones. */
    public double relativeDifference(CompositeFingerprint other) {
        return relativeDifference(other, FingerprintSettings.DEFAULT_BIT_ERROR_RATE);
    }

    public double relativeDifference(CompositeFingerprint other, double bitErrorRate) {
        requireSameStrategy(other);
        return strategy.relativeDifference(this, other, bitErrorRate);
    }

    private void requireSameStrategy(CompositeFingerprint other) {
        if (other.strategy != strategy) {
            throw new IncompatibleFingerprintException("Unable to compare a " + strategy
                    + " fingerprint with a " + other.strategy + " fingerprint");
        }
    }

    public byte[] encode() {
        int width = componentByteWidth();
        ByteArrayOutputStream out = new ByteArrayOutputStream(3 + width * components.size());
        out.write(strategy.tag());
        out.write(width >>> 8);
        out.write(width);
        for (Fingerprint f : components) {
            out.writeBytes(f.toBytes());
        }
        return out.toByteArray();
    }

    public static CompositeFingerprint decode(byte[] data, HashAlgorithm algorithm) {
        if (data.length < 4) {
            throw new IllegalArgumentException("Serialized fingerprint is too short: " + data.length + " bytes");
        }
        CompositeStrategy strategy = CompositeStrategy.fromTag(data[0] & 0xFF);
        int width = ((data[1] & 0xFF) << 8) | (data[2] & 0xFF);
        if (width == 0 || (data.length - 3) % width != 0) {
            throw new IllegalArgumentException("Serialized fingerprint has an invalid component width " + width);
        }
        List<Fingerprint> parts = new ArrayList<>();
        for (int pos = 3; pos < data.length; pos += width) {
            parts.add(new Fingerprint(algorithm, Arrays.copyOfRange(data, pos, pos + width)));
        }
        return new CompositeFingerprint(strategy, parts);
    }

    public String toHex() {
        StringJoiner joiner = new StringJoiner(":");
        for (Fingerprint f : components) joiner.add(f.toHex());
        return joiner.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompositeFingerprint)) return false;
        CompositeFingerprint that = (CompositeFingerprint) o;
        return strategy == that.strategy && components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return 31 * strategy.hashCode() + components.hashCode();
    }

    @Override
    public String toString() {
        return "CompositeFingerprint[" + strategy + ", " + algorithm() + ", " + toHex() + "]";
    }
}
