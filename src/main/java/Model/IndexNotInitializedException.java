package Model;

/**
 * Thrown when a query runs against an index that has no images yet, so that
 * "nothing indexed" is never mistaken for "no matches".
 */
public class IndexNotInitializedException extends ImageIndexException {

    public IndexNotInitializedException(String purpose) {
        super("Unable to " + purpose + " - no images were scanned into the index yet");
    }
}
