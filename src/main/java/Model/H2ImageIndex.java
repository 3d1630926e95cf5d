package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Index stored in an H2 database file.
 *
 * <p>Every byte of every component fingerprint gets its own
 * {@code hash_chunks} row, so the candidate pre-filter is one indexed lookup on
 * {@code (byte_offset, byte_value)} joined back to {@code images}.</p>
 */
public final class H2ImageIndex extends AbstractImageIndex {

    private static final Logger log = LoggerFactory.getLogger(H2ImageIndex.class);

    private static final String SELECT_IMAGE = """
        SELECT d.dir_path, i.file_name, i.size_bytes, i.modified_millis, i.content_hash, i.fingerprint
        FROM images i JOIN dirs d ON d.id = i.dir_id
    """;

    private final Path dbFile;
    private final Connection conn;
    private final Map<String, Long> dirIds = new HashMap<>();
    private boolean settingsStored;

    public H2ImageIndex(Path dbFile, FingerprintSettings settings) {
        this(dbFile, new ImageProcessor(new Fingerprinter(settings)));
    }

    public H2ImageIndex(Path dbFile, ImageProcessor processor) {
        super(processor);
        this.dbFile = dbFile.toAbsolutePath().normalize();
        try {
            conn = DriverManager.getConnection("jdbc:h2:file:" + this.dbFile + ";AUTO_SERVER=TRUE");
        } catch (SQLException e) {
            throw new IndexStorageException("Cannot open H2 index " + this.dbFile, e);
        }
        try {
            init();
            String stored = storedSettingsKey();
            checkSettings(stored, this.dbFile.toString());
            settingsStored = stored != null;
        } catch (SQLException e) {
            closeQuietly();
            throw new IndexStorageException("Cannot initialize H2 index " + this.dbFile, e);
        } catch (RuntimeException e) {
            closeQuietly();
            throw e;
        }
        log.debug("Opened {} with {}", this.dbFile, settings().storeKey());
    }

    private void init() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS settings (
                  name VARCHAR PRIMARY KEY,
                  setting_value VARCHAR NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS dirs (
                  id BIGINT AUTO_INCREMENT PRIMARY KEY,
                  dir_path VARCHAR NOT NULL UNIQUE
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS images (
                  id BIGINT AUTO_INCREMENT PRIMARY KEY,
                  dir_id BIGINT NOT NULL REFERENCES dirs(id),
                  file_name VARCHAR NOT NULL,
                  size_bytes BIGINT NOT NULL,
                  modified_millis BIGINT NOT NULL,
                  content_hash CHAR(64) NOT NULL,
                  fingerprint VARBINARY NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS hashes (
                  id BIGINT AUTO_INCREMENT PRIMARY KEY,
                  image_id BIGINT NOT NULL REFERENCES images(id),
                  component_index INT NOT NULL,
                  hash_bytes VARBINARY NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS hash_chunks (
                  hash_id BIGINT NOT NULL REFERENCES hashes(id),
                  image_id BIGINT NOT NULL,
                  byte_offset INT NOT NULL,
                  byte_value INT NOT NULL
                )
            """);
            st.execute("CREATE INDEX IF NOT EXISTS images_by_path ON images(dir_id, file_name)");
            st.execute("CREATE INDEX IF NOT EXISTS images_by_content ON images(content_hash)");
            st.execute("CREATE INDEX IF NOT EXISTS hashes_by_image ON hashes(image_id)");
            st.execute("CREATE INDEX IF NOT EXISTS chunks_by_value ON hash_chunks(byte_offset, byte_value)");
            st.execute("CREATE INDEX IF NOT EXISTS chunks_by_image ON hash_chunks(image_id)");
        }
    }

    private String storedSettingsKey() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT setting_value FROM settings WHERE name=?")) {
            ps.setString(1, SETTINGS_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    // region Writes

    @Override
    protected void store(List<IndexedImage> batch) {
        try {
            conn.setAutoCommit(false);
            try {
                if (!settingsStored) writeSettings();
                for (IndexedImage image : batch) insert(image);
                conn.commit();
                settingsStored = true;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                dirIds.clear();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Unable to store " + batch.size() + " images in " + dbFile, e);
        }
    }

    private void writeSettings() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "MERGE INTO settings (name, setting_value) KEY(name) VALUES (?, ?)")) {
            ps.setString(1, SETTINGS_KEY);
            ps.setString(2, settings().storeKey());
            ps.executeUpdate();
        }
    }

    private void insert(IndexedImage image) throws SQLException {
        long imageId;
        try (PreparedStatement ps = conn.prepareStatement("""
            INSERT INTO images (dir_id, file_name, size_bytes, modified_millis, content_hash, fingerprint)
            VALUES (?, ?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, dirId(image.directory()));
            ps.setString(2, image.fileName());
            ps.setLong(3, image.sizeBytes());
            ps.setLong(4, image.modifiedTime().toEpochMilli());
            ps.setString(5, image.contentHash());
            ps.setBytes(6, image.fingerprint().encode());
            ps.executeUpdate();
            imageId = generatedKey(ps);
        }

        List<Fingerprint> components = image.fingerprint().components();
        try (PreparedStatement hashes = conn.prepareStatement(
                     "INSERT INTO hashes (image_id, component_index, hash_bytes) VALUES (?, ?, ?)",
                     Statement.RETURN_GENERATED_KEYS);
             PreparedStatement chunks = conn.prepareStatement(
                     "INSERT INTO hash_chunks (hash_id, image_id, byte_offset, byte_value) VALUES (?, ?, ?, ?)")) {
            for (int c = 0; c < components.size(); c++) {
                Fingerprint component = components.get(c);
                hashes.setLong(1, imageId);
                hashes.setInt(2, c);
                hashes.setBytes(3, component.toBytes());
                hashes.executeUpdate();
                long hashId = generatedKey(hashes);

                for (int offset = 0; offset < component.byteWidth(); offset++) {
                    chunks.setLong(1, hashId);
                    chunks.setLong(2, imageId);
                    chunks.setInt(3, offset);
                    chunks.setInt(4, component.byteAt(offset));
                    chunks.addBatch();
                }
            }
            chunks.executeBatch();
        }
    }

    private long dirId(String directory) throws SQLException {
        Long cached = dirIds.get(directory);
        if (cached != null) return cached;

        long id;
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM dirs WHERE dir_path=?")) {
            ps.setString(1, directory);
            try (ResultSet rs = ps.executeQuery()) {
                id = rs.next() ? rs.getLong(1) : -1;
            }
        }
        if (id < 0) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO dirs (dir_path) VALUES (?)", Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, directory);
                ps.executeUpdate();
                id = generatedKey(ps);
            }
        }
        dirIds.put(directory, id);
        return id;
    }

    private static long generatedKey(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) throw new SQLException("No generated key returned");
            return keys.getLong(1);
        }
    }

    @Override
    protected boolean delete(Path normalized) {
        try {
            conn.setAutoCommit(false);
            try {
                List<Long> ids = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT i.id FROM images i JOIN dirs d ON d.id = i.dir_id
                    WHERE d.dir_path=? AND i.file_name=?
                """)) {
                    bindPath(ps, normalized);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) ids.add(rs.getLong(1));
                    }
                }
                for (long id : ids) {
                    executeDelete("DELETE FROM hash_chunks WHERE image_id=?", id);
                    executeDelete("DELETE FROM hashes WHERE image_id=?", id);
                    executeDelete("DELETE FROM images WHERE id=?", id);
                }
                if (!ids.isEmpty()) {
                    try (PreparedStatement ps = conn.prepareStatement("""
                        DELETE FROM dirs d WHERE d.dir_path=?
                        AND NOT EXISTS (SELECT 1 FROM images i WHERE i.dir_id = d.id)
                    """)) {
                        ps.setString(1, IndexedImage.directoryOf(normalized));
                        if (ps.executeUpdate() > 0) dirIds.remove(IndexedImage.directoryOf(normalized));
                    }
                }
                conn.commit();
                return !ids.isEmpty();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Unable to remove " + normalized + " from " + dbFile, e);
        }
    }

    private void executeDelete(String sql, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void reset() {
        try (Statement st = conn.createStatement()) {
            st.execute("DELETE FROM hash_chunks");
            st.execute("DELETE FROM hashes");
            st.execute("DELETE FROM images");
            st.execute("DELETE FROM dirs");
            st.execute("DELETE FROM settings");
        } catch (SQLException e) {
            throw new IndexStorageException("Unable to reset " + dbFile, e);
        }
        dirIds.clear();
        settingsStored = false;
        log.info("Reset index {}", dbFile);
    }

    // endregion

    // region Reads

    @Override
    protected long imageCount() {
        return count("images");
    }

    @Override
    protected boolean containsPath(Path normalized) {
        try (PreparedStatement ps = conn.prepareStatement("""
            SELECT 1 FROM images i JOIN dirs d ON d.id = i.dir_id
            WHERE d.dir_path=? AND i.file_name=? LIMIT 1
        """)) {
            bindPath(ps, normalized);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Unable to look up " + normalized, e);
        }
    }

    @Override
    protected Optional<IndexedImage> lookup(Path normalized) {
        List<IndexedImage> found = query(SELECT_IMAGE + " WHERE d.dir_path=? AND i.file_name=? ORDER BY i.id LIMIT 1",
                ps -> bindPath(ps, normalized));
        return found.stream().findFirst();
    }

    @Override
    protected Collection<IndexedImage> allImages() {
        return query(SELECT_IMAGE, ps -> {});
    }

    @Override
    protected Collection<IndexedImage> candidatesSharingByte(CompositeFingerprint query) {
        // distinct (offset, value) pairs over all query components
        Map<Integer, List<Integer>> pairs = new HashMap<>();
        StringJoiner where = new StringJoiner(" OR ");
        for (Fingerprint component : query.components()) {
            for (int offset = 0; offset < component.byteWidth(); offset++) {
                List<Integer> values = pairs.computeIfAbsent(offset, k -> new ArrayList<>());
                int value = component.byteAt(offset);
                if (!values.contains(value)) {
                    values.add(value);
                    where.add("(byte_offset=? AND byte_value=?)");
                }
            }
        }
        String sql = SELECT_IMAGE + " WHERE i.id IN (SELECT DISTINCT image_id FROM hash_chunks WHERE " + where + ")";
        return query(sql, ps -> {
            int param = 1;
            for (Map.Entry<Integer, List<Integer>> e : pairs.entrySet()) {
                for (int value : e.getValue()) {
                    ps.setInt(param++, e.getKey());
                    ps.setInt(param++, value);
                }
            }
        });
    }

    @Override
    protected List<IndexedImage> imagesWithDuplicateContent() {
        return query(SELECT_IMAGE + """
             WHERE i.content_hash IN (
               SELECT content_hash FROM images GROUP BY content_hash HAVING COUNT(*) > 1
             )
        """, ps -> {});
    }

    @Override
    public IndexStatus status() {
        return new IndexStatus(dbFile.toString(), count("dirs"), count("images"), count("hashes"));
    }

    private long count(String table) {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new IndexStorageException("Unable to count " + table + " in " + dbFile, e);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<IndexedImage> query(String sql, Binder binder) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<IndexedImage> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new IndexedImage(
                            rs.getString(1),
                            rs.getString(2),
                            rs.getLong(3),
                            Instant.ofEpochMilli(rs.getLong(4)),
                            rs.getString(5),
                            CompositeFingerprint.decode(rs.getBytes(6), settings().algorithm())));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Query on " + dbFile + " failed", e);
        }
    }

    private static void bindPath(PreparedStatement ps, Path normalized) throws SQLException {
        ps.setString(1, IndexedImage.directoryOf(normalized));
        ps.setString(2, IndexedImage.fileNameOf(normalized));
    }

    // endregion

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            throw new IndexStorageException("Unable to close " + dbFile, e);
        }
    }

    private void closeQuietly() {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Unable to close {} after a failed open: {}", dbFile, e.getMessage());
        }
    }
}
