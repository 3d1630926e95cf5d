package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Query and ingest logic shared by every storage backend. Subclasses only
 * provide storage access: writing a batch, looking up records, and listing the
 * records that share at least one component byte with a query.
 *
 * <p>{@link #findSimilar(CompositeFingerprint, double)} first narrows the
 * search to records sharing a byte value at the same offset as some query
 * component, then computes the true relative difference of every candidate.
 * The byte filter is only used when it cannot miss a match: a pair within
 * fewer differing bits than there are bytes per component always has an
 * identical byte. Wider thresholds scan every record.</p>
 */
public abstract class AbstractImageIndex implements ImageIndex {

    private static final Logger log = LoggerFactory.getLogger(AbstractImageIndex.class);

    static final String SETTINGS_KEY = "fingerprint";

    private static final Comparator<SimilarImage> BY_DISTANCE_THEN_PATH =
            Comparator.comparingDouble(SimilarImage::distance)
                    .thenComparing(s -> s.image().path().toString());

    private final FingerprintSettings settings;
    private final ImageProcessor processor;

    protected AbstractImageIndex(ImageProcessor processor) {
        this.processor = processor;
        this.settings = processor.fingerprinter().settings();
    }

    @Override
    public FingerprintSettings settings() {
        return settings;
    }

    protected ImageProcessor processor() {
        return processor;
    }

    // region Storage access

    protected abstract long imageCount();

    protected abstract boolean containsPath(Path normalized);

    protected abstract Optional<IndexedImage> lookup(Path normalized);

    /** Writes and commits one batch; on failure nothing of the batch is kept. */
    protected abstract void store(List<IndexedImage> batch);

    protected abstract Collection<IndexedImage> allImages();

    /**
     * Records having, for some component and some query component, an equal
     * byte at the same offset.
     */
    protected abstract Collection<IndexedImage> candidatesSharingByte(CompositeFingerprint query);

    /** Every record whose content hash occurs more than once. */
    protected abstract List<IndexedImage> imagesWithDuplicateContent();

    protected abstract boolean delete(Path normalized);

    // endregion

    /**
     * Fails when the index was built with other fingerprint settings.
     *
     * @param storedKey settings key read from the store, or null for a new store
     */
    protected void checkSettings(String storedKey, String location) {
        if (storedKey != null && !storedKey.equals(settings.storeKey())) {
            throw new IncompatibleFingerprintException("Index " + location + " was built with " + storedKey
                    + " fingerprints, not " + settings.storeKey());
        }
    }

    protected static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /** Rows written per commit while ingesting {@code total} images. */
    static int commitFrequency(int total) {
        if (total < 1) return 100;
        long scaled = (long) Math.pow(10, Math.floor(Math.log10(total)) - 1) / 2;
        return (int) Math.max(100, scaled);
    }

    @Override
    public IndexedImage addImage(Path path) throws IOException {
        Path normalized = normalize(path);
        IndexedImage image = toRecord(normalized, processor.process(normalized));
        store(List.of(image));
        log.debug("Added {}", normalized);
        return image;
    }

    @Override
    public ScanSummary addImages(Collection<Path> paths, int workers, boolean skipIndexed, ScanListener listener) {
        Set<Path> unique = new LinkedHashSet<>();
        for (Path p : paths) unique.add(normalize(p));

        List<Path> todo = new ArrayList<>(unique.size());
        int alreadyIndexed = 0;
        for (Path p : unique) {
            if (skipIndexed && containsPath(p)) {
                alreadyIndexed++;
            } else {
                todo.add(p);
            }
        }
        if (alreadyIndexed > 0) log.info("Skipping {} images that were already indexed", alreadyIndexed);
        if (todo.isEmpty()) return ScanSummary.empty(unique.size(), alreadyIndexed);

        int batchSize = commitFrequency(todo.size());
        log.info("Hashing {} images; committing every {}", todo.size(), batchSize);

        Map<PipelineResult.FailureKind, Integer> failures = new EnumMap<>(PipelineResult.FailureKind.class);
        int processed = 0;
        List<IndexedImage> pending = new ArrayList<>(batchSize);
        try (HashingPipeline pipeline = HashingPipeline.start(todo, processor, workers)) {
            while (pipeline.hasNext()) {
                PipelineResult result = pipeline.next();
                if (result.isSuccess()) {
                    pending.add(toRecord(result.path(), result.image()));
                    processed++;
                } else {
                    failures.merge(result.failure().kind(), 1, Integer::sum);
                }
                listener.onResult(result.sequence(), pipeline.total(), result);

                if (pending.size() >= batchSize) {
                    List<IndexedImage> batch = pending;
                    pending = new ArrayList<>(batchSize);
                    store(batch);
                    log.debug("Committed {} images", batch.size());
                }
            }
        } finally {
            if (!pending.isEmpty()) store(pending);
        }

        ScanSummary summary = new ScanSummary(unique.size(), alreadyIndexed, processed, failures);
        log.info("Scan finished: {}", summary);
        return summary;
    }

    private static IndexedImage toRecord(Path normalized, ProcessedImage processed) {
        return new IndexedImage(
                IndexedImage.directoryOf(normalized),
                IndexedImage.fileNameOf(normalized),
                processed.sizeBytes(),
                processed.modifiedTime().truncatedTo(ChronoUnit.MILLIS),
                processed.contentHash(),
                processed.fingerprint());
    }

    @Override
    public Optional<IndexedImage> getImage(Path path) {
        return lookup(normalize(path));
    }

    @Override
    public List<SimilarImage> findSimilar(Path query, double maxRelativeDistance) throws IOException {
        requireImages("find similar images");
        return findSimilar(processor.fingerprinter().fingerprint(query), maxRelativeDistance);
    }

    @Override
    public List<SimilarImage> findSimilar(CompositeFingerprint query, double maxRelativeDistance) {
        if (maxRelativeDistance < 0 || maxRelativeDistance > 1) {
            throw new IllegalArgumentException("Max relative distance must be in [0, 1], got " + maxRelativeDistance);
        }
        requireImages("find similar images");
        requireCompatible(query);

        int budget = settings.strategy().matchBitBudget(
                maxRelativeDistance, query.componentBitWidth(), settings.bitErrorRate());
        Collection<IndexedImage> candidates = budget < query.componentByteWidth()
                ? candidatesSharingByte(query)
                : allImages();

        List<SimilarImage> matches = new ArrayList<>();
        for (IndexedImage candidate : candidates) {
            double distance = candidate.fingerprint().relativeDifference(query, settings.bitErrorRate());
            if (distance <= maxRelativeDistance) {
                matches.add(new SimilarImage(candidate, distance));
            }
        }
        matches.sort(BY_DISTANCE_THEN_PATH);
        log.debug("{} of {} candidates within {}", matches.size(), candidates.size(), maxRelativeDistance);
        return matches;
    }

    private void requireCompatible(CompositeFingerprint query) {
        if (query.strategy() != settings.strategy()
                || query.algorithm() != settings.algorithm()
                || query.componentBitWidth() != settings.hashSize() * settings.hashSize()) {
            throw new IncompatibleFingerprintException("Unable to query a " + settings.storeKey()
                    + " index with " + query);
        }
    }

    @Override
    public List<DuplicateGroup> findExactDupes() {
        requireImages("find duplicates");
        Map<String, List<IndexedImage>> byHash = new LinkedHashMap<>();
        for (IndexedImage image : imagesWithDuplicateContent()) {
            byHash.computeIfAbsent(image.contentHash(), k -> new ArrayList<>()).add(image);
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<IndexedImage>> e : byHash.entrySet()) {
            List<IndexedImage> images = e.getValue();
            if (images.size() < 2) continue;
            images.sort(Comparator.comparing(i -> i.path().toString()));
            groups.add(new DuplicateGroup(e.getKey(), images.size(), images));
        }
        groups.sort(Comparator.comparingInt(DuplicateGroup::count).reversed()
                .thenComparing(DuplicateGroup::contentHash));
        return groups;
    }

    @Override
    public boolean remove(Path path) {
        return delete(normalize(path));
    }

    private void requireImages(String purpose) {
        if (imageCount() == 0) throw new IndexNotInitializedException(purpose);
    }
}
