package Model;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link ImageIndex} backend must share. Subclasses only say
 * how to open an index in a directory.
 */
abstract class ImageIndexContract {

    @TempDir
    Path tempDir;

    protected abstract AbstractImageIndex open(Path dir, FingerprintSettings settings);

    protected AbstractImageIndex open(FingerprintSettings settings) {
        return open(tempDir.resolve("db"), settings);
    }

    protected AbstractImageIndex open() {
        return open(FingerprintSettings.defaults());
    }

    protected Path png(BufferedImage img, String name) throws Exception {
        return TestImages.write(img, "png", tempDir.resolve("images").resolve(name));
    }

    @Test
    @DisplayName("queries on an empty index fail instead of returning nothing")
    void testEmptyIndex() throws Exception {
        Path query = png(TestImages.blocks(1), "query.png");
        try (ImageIndex index = open()) {
            assertThrows(IndexNotInitializedException.class, () -> index.findSimilar(query, 0.1));
            assertThrows(IndexNotInitializedException.class, index::findExactDupes);
            assertEquals(0, index.status().images());
        }
    }

    @Test
    @DisplayName("byte-identical files form one group, a one-byte change does not join it")
    void testExactDuplicates() throws Exception {
        BufferedImage rgb = TestImages.toRgb(TestImages.blocks(3));
        Path a = TestImages.write(rgb, "bmp", tempDir.resolve("images/a.bmp"));
        Path b = Files.copy(a, Files.createDirectories(tempDir.resolve("images/sub")).resolve("b.bmp"));
        byte[] bytes = Files.readAllBytes(a);
        bytes[bytes.length - 1] ^= 0x01;
        Path c = Files.write(tempDir.resolve("images/c.bmp"), bytes);

        try (ImageIndex index = open()) {
            ScanSummary summary = index.addImages(List.of(a, b, c), 2);
            assertEquals(3, summary.processed());

            List<DuplicateGroup> groups = index.findExactDupes();
            assertEquals(1, groups.size());
            DuplicateGroup group = groups.get(0);
            assertEquals(2, group.count());
            Set<Path> paths = new HashSet<>();
            for (IndexedImage img : group.images()) paths.add(img.path());
            assertEquals(Set.of(a.toAbsolutePath().normalize(), b.toAbsolutePath().normalize()), paths);
            assertEquals(ImageProcessor.sha256Hex(Files.readAllBytes(a)), group.contentHash());
        }
    }

    @Test
    @DisplayName("a re-compressed copy finds its original")
    void testNearDuplicateRecall() throws Exception {
        BufferedImage image = TestImages.blocks(21);
        Path original = png(image, "original.png");
        Path other = png(TestImages.blocks(22), "other.png");
        Path copy = TestImages.writeJpeg(image, 0.85f, tempDir.resolve("copy.jpg"));

        try (ImageIndex index = open()) {
            index.addImages(List.of(original, other), 1);
            List<SimilarImage> matches = index.findSimilar(copy, 0.1);
            SimilarImage hit = matches.stream()
                    .filter(m -> m.image().path().equals(original.toAbsolutePath().normalize()))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("original not found in " + matches));
            assertTrue(hit.distance() <= 0.1);
            assertEquals(hit, matches.get(0));
        }
    }

    @Test
    @DisplayName("the byte pre-filter never drops a record within the threshold")
    void testPrefilterSoundness() throws Exception {
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < 8; i++) paths.add(png(TestImages.blocks(100 + i), "b" + i + ".png"));
        for (int i = 0; i < 4; i++) paths.add(png(TestImages.shaded(200 + i, 200, 160), "s" + i + ".png"));
        paths.add(png(TestImages.rotate90(TestImages.blocks(100)), "b0-rotated.png"));

        try (AbstractImageIndex index = open()) {
            index.addImages(paths, 2);
            Collection<IndexedImage> all = index.allImages();
            assertEquals(paths.size(), all.size());

            Fingerprinter fp = new Fingerprinter(index.settings());
            double rate = index.settings().bitErrorRate();
            List<CompositeFingerprint> queries = new ArrayList<>();
            for (IndexedImage img : all) queries.add(img.fingerprint());
            queries.add(fp.fingerprint(TestImages.blocks(100, 230, 175, 6, 5)));
            queries.add(fp.fingerprint(TestImages.shaded(200, 190, 150)));

            for (double t : new double[] {0.0, 0.05, 0.1, 0.2, 0.5}) {
                for (CompositeFingerprint query : queries) {
                    List<IndexedImage> expected = new ArrayList<>();
                    for (IndexedImage img : all) {
                        if (img.fingerprint().relativeDifference(query, rate) <= t) expected.add(img);
                    }
                    Collection<IndexedImage> candidates = index.candidatesSharingByte(query);
                    int budget = index.settings().strategy().matchBitBudget(t, query.componentBitWidth(), rate);
                    if (budget < query.componentByteWidth()) {
                        for (IndexedImage img : expected) {
                            assertTrue(candidates.contains(img), "pre-filter dropped " + img.path() + " at " + t);
                        }
                    }
                    List<SimilarImage> found = index.findSimilar(query, t);
                    assertEquals(expected.size(), found.size(), "threshold " + t);
                }
            }
        }
    }

    @Test
    @DisplayName("ten images: one exact pair, one rotated copy")
    void testEndToEnd() throws Exception {
        Path dir = tempDir.resolve("album");
        for (int i = 0; i < 7; i++) TestImages.write(TestImages.blocks(300 + i), "png", dir.resolve("p" + i + ".png"));
        Files.copy(dir.resolve("p0.png"), dir.resolve("p0-copy.png"));
        BufferedImage third = TestImages.blocks(400);
        Path thirdPath = TestImages.write(third, "png", dir.resolve("third.png"));
        Path rotated = TestImages.write(TestImages.rotate90(third), "png", dir.resolve("third-rotated.png"));

        List<Path> files;
        try (var stream = Files.list(dir)) {
            files = stream.sorted().toList();
        }
        assertEquals(10, files.size());

        try (ImageIndex index = open()) {
            ScanSummary summary = index.addImages(files, 3);
            assertEquals(10, summary.processed());
            assertEquals(0, summary.failed());

            List<DuplicateGroup> groups = index.findExactDupes();
            assertEquals(1, groups.size());
            assertEquals(2, groups.get(0).count());

            List<SimilarImage> similar = index.findSimilar(rotated, 0.05);
            Optional<SimilarImage> match = similar.stream()
                    .filter(s -> s.image().path().equals(thirdPath.toAbsolutePath().normalize()))
                    .findFirst();
            assertTrue(match.isPresent(), "rotated copy did not find " + thirdPath);
            assertEquals(0.0, match.get().distance());
            for (int i = 1; i < similar.size(); i++) {
                assertTrue(similar.get(i - 1).distance() <= similar.get(i).distance());
            }
        }
    }

    @Test
    @DisplayName("batch ingest skips indexed paths and counts failures")
    void testAddImagesSummary() throws Exception {
        Path a = png(TestImages.blocks(1), "a.png");
        Path b = png(TestImages.blocks(2), "b.png");
        Path broken = Files.writeString(tempDir.resolve("images/broken.png"), "nope");

        try (ImageIndex index = open()) {
            AtomicInteger calls = new AtomicInteger();
            ScanSummary first = index.addImages(List.of(a, b, broken), 2, true, (done, total, r) -> {
                calls.incrementAndGet();
                assertEquals(3, total);
            });
            assertEquals(3, calls.get());
            assertEquals(3, first.requested());
            assertEquals(2, first.processed());
            assertEquals(1, first.failed(PipelineResult.FailureKind.DECODE));

            ScanSummary second = index.addImages(List.of(a, b), 2);
            assertEquals(2, second.alreadyIndexed());
            assertEquals(0, second.processed());
            assertEquals(2, index.status().images());

            ScanSummary forced = index.addImages(List.of(a), 1, false, ScanListener.NONE);
            assertEquals(1, forced.processed());
            assertEquals(3, index.status().images());
        }
    }

    @Test
    @DisplayName("records survive reopening and keep their settings")
    void testPersistence() throws Exception {
        Path a = png(TestImages.blocks(5), "a.png");
        IndexedImage added;
        try (ImageIndex index = open()) {
            added = index.addImage(a);
            assertEquals(a.toAbsolutePath().normalize(), added.path());
        }
        try (ImageIndex index = open()) {
            IndexedImage loaded = index.getImage(a).orElseThrow();
            assertEquals(added, loaded);
            IndexStatus status = index.status();
            assertEquals(1, status.directories());
            assertEquals(1, status.images());
            assertEquals(3, status.hashes());
        }
        FingerprintSettings other = FingerprintSettings.builder().algorithm(HashAlgorithm.WAVELET).build();
        assertThrows(IncompatibleFingerprintException.class, () -> open(other).close());
    }

    @Test
    @DisplayName("changed hashing parameters are rejected, a changed bit error rate is not")
    void testParameterMismatch() throws Exception {
        Path a = png(TestImages.blocks(5), "a.png");
        try (ImageIndex index = open()) {
            index.addImage(a);
        }
        FingerprintSettings noShrink = FingerprintSettings.builder().preShrink(false).build();
        assertThrows(IncompatibleFingerprintException.class, () -> open(noShrink).close());
        FingerprintSettings lenient = FingerprintSettings.builder().bitErrorRate(0.1).build();
        try (ImageIndex index = open(lenient)) {
            assertTrue(index.getImage(a).isPresent());
        }

        Path cropDir = tempDir.resolve("crop");
        FingerprintSettings crop = FingerprintSettings.builder().strategy(CompositeStrategy.CROP_RESISTANT).build();
        try (ImageIndex index = open(cropDir, crop)) {
            index.addImage(a);
        }
        for (FingerprintSettings changed : List.of(
                crop.toBuilder().segmentThreshold(100).build(),
                crop.toBuilder().minSegmentSize(200).build(),
                crop.toBuilder().preSegmentSize(200).build(),
                crop.toBuilder().segmentLimit(2).build())) {
            assertThrows(IncompatibleFingerprintException.class, () -> open(cropDir, changed).close(), changed.storeKey());
        }
    }

    @Test
    @DisplayName("remove and reset delete records")
    void testRemoveAndReset() throws Exception {
        Path a = png(TestImages.blocks(1), "a.png");
        Path b = png(TestImages.blocks(2), "b.png");
        try (ImageIndex index = open()) {
            index.addImages(List.of(a, b), 1);
            assertTrue(index.remove(a));
            assertFalse(index.remove(a));
            assertTrue(index.getImage(a).isEmpty());
            assertTrue(index.getImage(b).isPresent());
            assertEquals(1, index.status().images());

            index.reset();
            assertEquals(0, index.status().images());
            assertThrows(IndexNotInitializedException.class, index::findExactDupes);
        }
        // reset forgets the settings too
        try (ImageIndex index = open(FingerprintSettings.builder().algorithm(HashAlgorithm.WAVELET).build())) {
            assertEquals(HashAlgorithm.WAVELET, index.addImage(a).fingerprint().algorithm());
        }
    }

    @Test
    @DisplayName("queries built with other settings are rejected")
    void testIncompatibleQuery() throws Exception {
        Path a = png(TestImages.blocks(1), "a.png");
        try (ImageIndex index = open()) {
            index.addImage(a);
            CompositeFingerprint wide = new Fingerprinter(FingerprintSettings.builder().hashSize(16).build())
                    .fingerprint(TestImages.blocks(1));
            assertThrows(IncompatibleFingerprintException.class, () -> index.findSimilar(wide, 0.1));
            assertThrows(IllegalArgumentException.class, () -> index.findSimilar(a, 1.5));
        }
    }

    @Test
    @DisplayName("crop resistant indexes answer queries too")
    void testCropResistantIndex() throws Exception {
        Path blobs = png(TestImages.blobs(400), "blobs.png");
        Path cropped = png(TestImages.crop(TestImages.blobs(400), 0.05), "cropped.png");
        FingerprintSettings crop = FingerprintSettings.builder().strategy(CompositeStrategy.CROP_RESISTANT).build();
        try (ImageIndex index = open(crop)) {
            index.addImages(List.of(blobs, png(TestImages.blocks(1), "x.png")), 2);
            List<SimilarImage> found = index.findSimilar(cropped, 0.5);
            assertEquals(blobs.toAbsolutePath().normalize(), found.get(0).image().path());
        }
    }
}
