package Model;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Table image index")
class TableImageIndexTest extends ImageIndexContract {

    @Override
    protected AbstractImageIndex open(Path dir, FingerprintSettings settings) {
        return new TableImageIndex(dir.resolve("index.json"), settings);
    }

    @Test
    @DisplayName("each commit replaces the JSON file")
    void testSavesJson() throws Exception {
        Path file = tempDir.resolve("db").resolve("index.json");
        try (ImageIndex index = open()) {
            index.addImage(png(TestImages.blocks(1), "a.png"));
        }
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("index.json.tmp")));
        String json = Files.readString(file);
        assertTrue(json.contains("a.png"));
        assertTrue(json.contains(FingerprintSettings.defaults().storeKey()));
    }

    @Test
    @DisplayName("a damaged file is reported as a storage error")
    void testDamagedFile() throws Exception {
        Path file = Files.createDirectories(tempDir.resolve("db")).resolve("index.json");
        Files.writeString(file, "{ not json");
        assertThrows(IndexStorageException.class, this::open);
    }

    @Test
    @DisplayName("reset removes the file")
    void testResetDeletesFile() throws Exception {
        Path file = tempDir.resolve("db").resolve("index.json");
        try (ImageIndex index = open()) {
            index.addImage(png(TestImages.blocks(1), "a.png"));
            index.reset();
        }
        assertFalse(Files.exists(file));
    }

    @Test
    @DisplayName("an error on one file is counted and the rest of the batch is stored")
    void testErrorOnOneFile() throws Exception {
        Path a = png(TestImages.blocks(1), "a.png");
        Path huge = png(TestImages.blocks(2), "huge.png");
        Path b = png(TestImages.blocks(3), "b.png");
        ImageProcessor choking = new ImageProcessor(new Fingerprinter(FingerprintSettings.defaults())) {
            @Override
            public ProcessedImage process(Path path) throws IOException {
                if (path.getFileName().toString().equals("huge.png")) throw new OutOfMemoryError("Java heap space");
                return super.process(path);
            }
        };
        try (ImageIndex index = new TableImageIndex(tempDir.resolve("db").resolve("index.json"), choking)) {
            ScanSummary summary = index.addImages(List.of(a, huge, b), 2);
            assertEquals(3, summary.requested());
            assertEquals(2, summary.processed());
            assertEquals(1, summary.failed(PipelineResult.FailureKind.UNEXPECTED));
            assertEquals(2, index.status().images());
            assertTrue(index.getImage(huge).isEmpty());
        }
    }
}
