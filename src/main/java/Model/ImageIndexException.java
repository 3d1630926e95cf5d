package Model;

/**
 * Base exception for fingerprinting and index operations.
 */
public class ImageIndexException extends RuntimeException {

    public ImageIndexException(String message) {
        super(message);
    }

    public ImageIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
