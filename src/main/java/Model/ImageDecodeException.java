package Model;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The bytes of a file could not be decoded into an image.
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(Path path) {
        super("Unable to decode image: " + path);
    }

    public ImageDecodeException(String message) {
        super(message);
    }
}
