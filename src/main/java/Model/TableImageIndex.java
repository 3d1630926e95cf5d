package Model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Index held in memory as a table and saved as one JSON file of columns after
 * every committed batch. The file is replaced atomically, so a crash leaves the
 * last committed state.
 *
 * <p>Suited to collections that fit in memory; the pre-filter compares every
 * stored component byte by byte.</p>
 */
public final class TableImageIndex extends AbstractImageIndex {

    private static final Logger log = LoggerFactory.getLogger(TableImageIndex.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path file;
    private final List<IndexedImage> rows = new ArrayList<>();
    private final Set<Path> paths = new HashSet<>();
    private String storedKey;

    public TableImageIndex(Path file, FingerprintSettings settings) {
        this(file, new ImageProcessor(new Fingerprinter(settings)));
    }

    public TableImageIndex(Path file, ImageProcessor processor) {
        super(processor);
        this.file = file.toAbsolutePath().normalize();
        if (Files.exists(this.file)) {
            Columns columns;
            try {
                columns = objectMapper.readValue(this.file.toFile(), Columns.class);
            } catch (IOException e) {
                throw new IndexStorageException("Cannot read table index " + this.file, e);
            }
            checkSettings(columns.settings, this.file.toString());
            storedKey = columns.settings;
            rows.addAll(columns.toRows(settings().algorithm()));
            for (IndexedImage row : rows) paths.add(row.path());
        }
        log.debug("Opened {} with {} images", this.file, rows.size());
    }

    // region Writes

    @Override
    protected void store(List<IndexedImage> batch) {
        int before = rows.size();
        rows.addAll(batch);
        try {
            save(settings().storeKey());
        } catch (IOException e) {
            rows.subList(before, rows.size()).clear();
            throw new IndexStorageException("Unable to store " + batch.size() + " images in " + file, e);
        }
        storedKey = settings().storeKey();
        for (IndexedImage image : batch) paths.add(image.path());
    }

    @Override
    protected boolean delete(Path normalized) {
        List<IndexedImage> removed = new ArrayList<>();
        rows.removeIf(row -> {
            if (row.path().equals(normalized)) {
                removed.add(row);
                return true;
            }
            return false;
        });
        if (removed.isEmpty()) return false;
        try {
            save(storedKey);
        } catch (IOException e) {
            rows.addAll(removed);
            throw new IndexStorageException("Unable to remove " + normalized + " from " + file, e);
        }
        paths.remove(normalized);
        return true;
    }

    @Override
    public void reset() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new IndexStorageException("Unable to reset " + file, e);
        }
        rows.clear();
        paths.clear();
        storedKey = null;
        log.info("Reset index {}", file);
    }

    private void save(String key) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(tmp.toFile(), Columns.of(key, rows));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    // endregion

    // region Reads

    @Override
    protected long imageCount() {
        return rows.size();
    }

    @Override
    protected boolean containsPath(Path normalized) {
        return paths.contains(normalized);
    }

    @Override
    protected Optional<IndexedImage> lookup(Path normalized) {
        for (IndexedImage row : rows) {
            if (row.path().equals(normalized)) return Optional.of(row);
        }
        return Optional.empty();
    }

    @Override
    protected Collection<IndexedImage> allImages() {
        return List.copyOf(rows);
    }

    @Override
    protected Collection<IndexedImage> candidatesSharingByte(CompositeFingerprint query) {
        List<byte[]> queryBytes = new ArrayList<>();
        for (Fingerprint f : query.components()) queryBytes.add(f.toBytes());

        List<IndexedImage> candidates = new ArrayList<>();
        for (IndexedImage row : rows) {
            if (sharesByte(row.fingerprint(), queryBytes)) candidates.add(row);
        }
        return candidates;
    }

    /** True when some component pair has an equal byte at an equal offset. */
    private static boolean sharesByte(CompositeFingerprint stored, List<byte[]> query) {
        for (Fingerprint component : stored.components()) {
            byte[] bytes = component.toBytes();
            for (byte[] other : query) {
                int n = Math.min(bytes.length, other.length);
                for (int i = 0; i < n; i++) {
                    if (bytes[i] == other[i]) return true;
                }
            }
        }
        return false;
    }

    @Override
    protected List<IndexedImage> imagesWithDuplicateContent() {
        Map<String, Integer> counts = new HashMap<>();
        for (IndexedImage row : rows) counts.merge(row.contentHash(), 1, Integer::sum);
        List<IndexedImage> out = new ArrayList<>();
        for (IndexedImage row : rows) {
            if (counts.get(row.contentHash()) > 1) out.add(row);
        }
        return out;
    }

    @Override
    public IndexStatus status() {
        Set<String> directories = new HashSet<>();
        long hashes = 0;
        for (IndexedImage row : rows) {
            directories.add(row.directory());
            hashes += row.fingerprint().size();
        }
        return new IndexStatus(file.toString(), directories.size(), rows.size(), hashes);
    }

    // endregion

    @Override
    public void close() {
        log.debug("Closed {}", file);
    }

    /**
     * On-disk layout: one list per column, row i spread over index i of each.
     * Directories are stored once and referenced by position.
     */
    static final class Columns {
        public String settings;
        public List<String> directories = new ArrayList<>();
        public List<Integer> directory = new ArrayList<>();
        public List<String> fileName = new ArrayList<>();
        public List<Long> sizeBytes = new ArrayList<>();
        public List<Long> modifiedMillis = new ArrayList<>();
        public List<String> contentHash = new ArrayList<>();
        public List<byte[]> fingerprint = new ArrayList<>();

        static Columns of(String settings, List<IndexedImage> rows) {
            Columns c = new Columns();
            c.settings = settings;
            Map<String, Integer> dirIndex = new LinkedHashMap<>();
            for (IndexedImage row : rows) {
                Integer idx = dirIndex.get(row.directory());
                if (idx == null) {
                    idx = dirIndex.size();
                    dirIndex.put(row.directory(), idx);
                    c.directories.add(row.directory());
                }
                c.directory.add(idx);
                c.fileName.add(row.fileName());
                c.sizeBytes.add(row.sizeBytes());
                c.modifiedMillis.add(row.modifiedTime().toEpochMilli());
                c.contentHash.add(row.contentHash());
                c.fingerprint.add(row.fingerprint().encode());
            }
            return c;
        }

        List<IndexedImage> toRows(HashAlgorithm algorithm) {
            int n = fileName.size();
            if (directory.size() != n || sizeBytes.size() != n || modifiedMillis.size() != n
                    || contentHash.size() != n || fingerprint.size() != n) {
                throw new IndexStorageException("Table index columns have different lengths", null);
            }
            List<IndexedImage> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(new IndexedImage(
                        directories.get(directory.get(i)),
                        fileName.get(i),
                        sizeBytes.get(i),
                        Instant.ofEpochMilli(modifiedMillis.get(i)),
                        contentHash.get(i),
                        CompositeFingerprint.decode(fingerprint.get(i), algorithm)));
            }
            return out;
        }
    }
}
