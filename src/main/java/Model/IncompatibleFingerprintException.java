package Model;

/**
 * Thrown when two fingerprints that were not produced by the same algorithm
 * and bit width are compared, or when an index is opened with settings that
 * differ from the ones it was built with.
 */
public class IncompatibleFingerprintException extends ImageIndexException {

    public IncompatibleFingerprintException(String message) {
        super(message);
    }

    public static IncompatibleFingerprintException of(Fingerprint a, Fingerprint b) {
        return new IncompatibleFingerprintException("Unable to compare " + a + " with " + b
                + " - fingerprints must share algorithm and bit width");
    }
}
