package Presentation;

import Model.IndexBackend;
import Model.TestImages;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("image-db command line")
class ImageDbCliTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = ImageDbCli.newCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private int runTable(String... args) {
        List<String> all = new ArrayList<>(List.of("--backend", "table", "--db", tempDir.resolve("index.json").toString()));
        all.addAll(Arrays.asList(args));
        return run(all.toArray(new String[0]));
    }

    private Path album() throws Exception {
        Path dir = tempDir.resolve("album");
        TestImages.write(TestImages.blocks(1), "png", dir.resolve("a.png"));
        TestImages.write(TestImages.rotate90(TestImages.blocks(1)), "png", dir.resolve("a-rotated.png"));
        TestImages.write(TestImages.blocks(2), "png", dir.resolve("b.png"));
        Files.copy(dir.resolve("b.png"), Files.createDirectories(tempDir.resolve("copies")).resolve("b.png"));
        Files.writeString(dir.resolve("readme.txt"), "not an image");
        return dir;
    }

    @Nested
    @DisplayName("scan and status")
    class ScanTest {

        @Test
        @DisplayName("scan adds the images and status counts them")
        void testScanThenStatus() throws Exception {
            Path dir = album();
            assertEquals(0, runTable("scan", dir.toString(), tempDir.resolve("copies").toString()));
            assertTrue(out.toString().contains("Found 4 images: 4 added, 0 already in the DB, 0 failed"), out.toString());

            assertEquals(0, runTable("scan", dir.toString()));
            assertTrue(out.toString().contains("0 added, 3 already in the DB"), out.toString());

            assertEquals(0, runTable("status"));
            assertTrue(out.toString().contains("Saved images: 4"), out.toString());
            assertTrue(out.toString().contains("Saved directories: 2"), out.toString());
            assertTrue(out.toString().contains("Saved hashes: 12"), out.toString());
        }

        @Test
        @DisplayName("without the extension filter unreadable files are counted as failures")
        void testNoExtensionFilter() throws Exception {
            Path dir = album();
            assertEquals(0, runTable("scan", "--no-ext-filter", "-w", "2", dir.toString()));
            assertTrue(out.toString().contains("3 added, 0 already in the DB, 1 failed"), out.toString());
            assertTrue(out.toString().contains("DECODE: 1"), out.toString());
        }

        @Test
        @DisplayName("the H2 backend works the same way")
        void testH2Backend() throws Exception {
            Path dir = album();
            String db = tempDir.resolve("h2/index").toString();
            assertEquals(0, run("--db", db, "scan", dir.toString()));
            assertEquals(0, run("--db", db, "status"));
            assertTrue(out.toString().contains("Saved images: 3"), out.toString());
        }
    }

    @Nested
    @DisplayName("queries")
    class QueryTest {

        @Test
        @DisplayName("find lists the rotated copy at distance 0")
        void testFind() throws Exception {
            Path dir = album();
            runTable("scan", dir.toString());
            assertEquals(0, runTable("find", dir.resolve("a.png").toString()));
            String text = out.toString();
            assertTrue(text.contains("Found 2 matches:"), text);
            assertTrue(text.contains("Difference"), text);
            assertTrue(text.contains("0.000000"), text);
            assertTrue(text.contains(dir.resolve("a-rotated.png").toAbsolutePath().normalize().toString()), text);
        }

        @Test
        @DisplayName("find without matches says so")
        void testFindNothing() throws Exception {
            Path dir = album();
            runTable("scan", dir.resolve("a.png").toString());
            Path other = TestImages.write(TestImages.blocks(77), "png", tempDir.resolve("other.png"));
            assertEquals(0, runTable("find", "-D", "0", other.toString()));
            assertTrue(out.toString().contains("No matches found"), out.toString());
        }

        @Test
        @DisplayName("find rejects a missing file and a bad distance")
        void testFindValidation() throws Exception {
            assertEquals(2, runTable("find", tempDir.resolve("missing.png").toString()));
            assertTrue(err.toString().contains("Not a file"), err.toString());

            Path a = TestImages.write(TestImages.blocks(1), "png", tempDir.resolve("a.png"));
            assertEquals(2, runTable("find", "--max-distance", "1.5", a.toString()));
        }

        @Test
        @DisplayName("queries on an empty DB fail with a message")
        void testEmptyDb() throws Exception {
            Path a = TestImages.write(TestImages.blocks(1), "png", tempDir.resolve("a.png"));
            assertEquals(1, runTable("find", a.toString()));
            assertTrue(err.toString().contains("no images were scanned"), err.toString());
            assertEquals(1, runTable("dupes"));
        }

        @Test
        @DisplayName("dupes prints each group and honours the directory filter")
        void testDupes() throws Exception {
            Path dir = album();
            runTable("scan", dir.toString(), tempDir.resolve("copies").toString());

            assertEquals(0, runTable("dupes"));
            String text = out.toString();
            assertTrue(text.contains(": 2:"), text);
            assertTrue(text.contains(" - " + tempDir.resolve("copies/b.png").toAbsolutePath().normalize()), text);
            assertTrue(text.contains(" - " + dir.resolve("b.png").toAbsolutePath().normalize()), text);

            assertEquals(0, runTable("dupes", "--dir", tempDir.resolve("copies").toString()));
            assertTrue(out.toString().contains(": 2:"));

            assertEquals(0, runTable("dupes", "-d", tempDir.toString()));
            assertEquals("", out.toString());
        }
    }

    @Test
    @DisplayName("reset empties the DB")
    void testReset() throws Exception {
        runTable("scan", album().toString());
        assertEquals(0, runTable("reset"));
        assertTrue(out.toString().startsWith("Reset "), out.toString());
        assertEquals(0, runTable("status"));
        assertTrue(out.toString().contains("Saved images: 0"), out.toString());
    }

    @Test
    @DisplayName("unknown settings are reported as errors")
    void testInvalidSettings() {
        assertEquals(1, runTable("--hash", "md5", "status"));
        assertTrue(err.toString().contains("md5"), err.toString());
        assertEquals(1, run("--backend", "sqlite", "status"));
    }

    @Test
    @DisplayName("a DB built with other settings is refused")
    void testSettingsMismatch() throws Exception {
        runTable("scan", album().toString());
        assertEquals(1, runTable("--hash", "wavelet", "status"));
    }

    @Test
    @DisplayName("sizes are shown in binary units")
    void testReadableBytes() {
        assertEquals("512 B", ImageDbCli.readableBytes(512));
        assertEquals("2.00 KiB", ImageDbCli.readableBytes(2048));
        assertEquals("1.50 MiB", ImageDbCli.readableBytes(1536 * 1024));
    }

    @Test
    @DisplayName("default locations depend on the backend")
    void testDefaultLocation() {
        assertTrue(ImageDbCli.defaultLocation(IndexBackend.H2).endsWith(Path.of(".cache", "image-db", "index")));
        assertTrue(ImageDbCli.defaultLocation(IndexBackend.TABLE).toString().endsWith("index.json"));
    }
}
