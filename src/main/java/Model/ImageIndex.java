package Model;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of fingerprinted images answering near-duplicate and exact
 * duplicate queries.
 *
 * <p>An index is bound to the {@link FingerprintSettings} it was built with;
 * opening it with other settings fails with
 * {@link IncompatibleFingerprintException}. Writes come from one thread;
 * queries must not run concurrently with an ingest.</p>
 */
public interface ImageIndex extends AutoCloseable {

    FingerprintSettings settings();

    /**
     * Fingerprints one image inline and stores it. Does not check whether the
     * path is already indexed.
     *
     * @throws ImageDecodeException when the file is not a readable image
     */
    IndexedImage addImage(Path path) throws IOException;

    /**
     * Fingerprints the given files on {@code workers} threads and stores every
     * image that could be read. Failed files are logged and counted in the
     * summary; they never abort the batch.
     *
     * @param workers     worker threads, 0 or less for one per processor
     * @param skipIndexed skip paths that are already in the index
     * @param listener    called on the calling thread for every finished file
     */
    ScanSummary addImages(Collection<Path> paths, int workers, boolean skipIndexed, ScanListener listener);

    default ScanSummary addImages(Collection<Path> paths, int workers) {
        return addImages(paths, workers, true, ScanListener.NONE);
    }

    Optional<IndexedImage> getImage(Path path);

    /**
     * Images within {@code maxRelativeDistance} of the image at {@code query},
     * closest first, ties by path.
     *
     * @throws IndexNotInitializedException when nothing was indexed yet
     */
    List<SimilarImage> findSimilar(Path query, double maxRelativeDistance) throws IOException;

    List<SimilarImage> findSimilar(CompositeFingerprint query, double maxRelativeDistance);

    /**
     * Groups of images with identical content, largest group first.
     *
     * @throws IndexNotInitializedException when nothing was indexed yet
     */
    List<DuplicateGroup> findExactDupes();

    IndexStatus status();

    /** Deletes every image and the recorded fingerprint settings. */
    void reset();

    /** @return true when an image was stored under the path */
    boolean remove(Path path);

    @Override
    void close();
}
