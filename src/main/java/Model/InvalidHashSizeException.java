package Model;

/**
 * Thrown when a hash size cannot be produced at the requested image scale.
 */
public class InvalidHashSizeException extends ImageIndexException {

    private final int hashSize;
    private final int imageScale;

    public InvalidHashSizeException(int hashSize, int imageScale) {
        super("Invalid hash size " + hashSize + " for image scale " + imageScale);
        this.hashSize = hashSize;
        this.imageScale = imageScale;
    }

    public int getHashSize() {
        return hashSize;
    }

    public int getImageScale() {
        return imageScale;
    }
}
