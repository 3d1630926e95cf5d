package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;

/**
 * Groups near-duplicate images of a folder and picks the copies to delete.
 *
 * <p>Images are first indexed (already indexed paths are reused), then every
 * image is looked up with {@link ImageIndex#findSimilar(CompositeFingerprint, double)}.
 * Matches are merged transitively into groups; in each group the largest file
 * is kept and all others are proposed for deletion.</p>
 */
public final class DuplicateScanner {

    private static final Logger log = LoggerFactory.getLogger(DuplicateScanner.class);

    public record Result(Set<Path> toSelect, int groupsFound, ScanSummary summary) {}

    private final ExecutorService pool;
    private final ImageIndex index;

    public DuplicateScanner(ImageIndex index) {
        this.index = index;
        this.pool = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "duplicate-scan");
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<Result> scanAsync(List<Path> images, double threshold, ScanListener listener) {
        return CompletableFuture.supplyAsync(() -> scan(images, threshold, listener), pool);
    }

    /** Runs other index work on the scanner's thread, after any scan in progress. */
    public CompletableFuture<Void> runExclusive(Runnable task) {
        return CompletableFuture.runAsync(task, pool);
    }

    public Result scan(List<Path> images, double threshold, ScanListener listener) {
        ScanSummary summary = index.addImages(images, 0, true, listener);

        Map<Path, IndexedImage> entries = new LinkedHashMap<>();
        for (Path p : images) {
            index.getImage(p).ifPresent(img -> entries.put(img.path(), img));
        }
        if (entries.isEmpty()) return new Result(Set.of(), 0, summary);

        Map<Path, Path> parent = new HashMap<>();
        for (Path p : entries.keySet()) parent.put(p, p);

        for (IndexedImage e : entries.values()) {
            for (SimilarImage match : index.findSimilar(e.fingerprint(), threshold)) {
                Path other = match.image().path();
                if (entries.containsKey(other)) union(parent, e.path(), other);
            }
        }

        Map<Path, List<IndexedImage>> groups = new LinkedHashMap<>();
        for (IndexedImage e : entries.values()) {
            groups.computeIfAbsent(find(parent, e.path()), k -> new ArrayList<>()).add(e);
        }

        Set<Path> toSelect = new HashSet<>();
        int groupsFound = 0;

        for (List<IndexedImage> items : groups.values()) {
            if (items.size() <= 1) continue;
            groupsFound++;

            IndexedImage keep = items.stream()
                    .max(Comparator.comparingLong(IndexedImage::sizeBytes)
                            .thenComparing(x -> x.path().toString(), Comparator.reverseOrder()))
                    .orElse(items.get(0));

            for (IndexedImage it : items) {
                if (!it.path().equals(keep.path())) toSelect.add(it.path());
            }
        }

        log.info("Found {} duplicate groups, {} files proposed for deletion", groupsFound, toSelect.size());
        return new Result(toSelect, groupsFound, summary);
    }

    private static Path find(Map<Path, Path> parent, Path p) {
        Path root = p;
        while (!parent.get(root).equals(root)) root = parent.get(root);
        while (!p.equals(root)) {
            Path next = parent.get(p);
            parent.put(p, root);
            p = next;
        }
        return root;
    }

    private static void union(Map<Path, Path> parent, Path a, Path b) {
        Path ra = find(parent, a);
        Path rb = find(parent, b);
        if (!ra.equals(rb)) parent.put(rb, ra);
    }

    public void shutdown() {
        pool.shutdownNow();
    }
}
