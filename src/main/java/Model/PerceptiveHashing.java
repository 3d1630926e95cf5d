package Model;

import dev.brachtendorf.jimagehash.hash.Hash;
import dev.brachtendorf.jimagehash.hashAlgorithms.HashingAlgorithm;
import dev.brachtendorf.jimagehash.hashAlgorithms.PerceptiveHash;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DCT based hash computed by JImageHash, packed into whole bytes so it can be
 * stored and compared like the other fingerprints.
 */
final class PerceptiveHashing {

    private static final Map<Integer, HashingAlgorithm> HASHERS = new ConcurrentHashMap<>();

    private PerceptiveHashing() {}

    static Fingerprint hash(HashAlgorithm algorithm, GrayImage image, int hashSize) {
        HashingAlgorithm hasher = HASHERS.computeIfAbsent(hashSize * hashSize, PerceptiveHash::new);
        Hash h = hasher.hash(image.toBufferedImage());
        return new Fingerprint(algorithm, toFixedUnsignedBytes(h.getHashValue(), hashSize * hashSize));
    }

    static byte[] toFixedUnsignedBytes(BigInteger value, int bitLen) {
        int byteLen = (bitLen + 7) / 8;
        byte[] raw = value.toByteArray();
        byte[] out = new byte[byteLen];

        int srcPos = Math.max(0, raw.length - byteLen);
        int copyLen = Math.min(raw.length, byteLen);
        System.arraycopy(raw, srcPos, out, byteLen - copyLen, copyLen);

        return out;
    }
}
