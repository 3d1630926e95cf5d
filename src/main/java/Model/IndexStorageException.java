package Model;

/**
 * Wraps a failure of the underlying store (JDBC or file I/O).
 */
public class IndexStorageException extends ImageIndexException {

    public IndexStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
