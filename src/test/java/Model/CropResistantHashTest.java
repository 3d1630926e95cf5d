package Model;

import org.junit.jupiter.api.*;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Crop resistant composite")
class CropResistantHashTest {

    private final Fingerprinter fp = new Fingerprinter(FingerprintSettings.builder()
            .strategy(CompositeStrategy.CROP_RESISTANT)
            .build());

    @Test
    @DisplayName("cropping a 5% border keeps the relative difference below 0.5")
    void testCropTolerance() {
        BufferedImage image = TestImages.blobs(400);
        CompositeFingerprint original = fp.fingerprint(image);
        CompositeFingerprint cropped = fp.fingerprint(TestImages.crop(image, 0.05));

        assertTrue(original.size() >= 2, "expected several regions, got " + original.size());
        double d = original.relativeDifference(cropped);
        assertTrue(d < 0.5, "relative difference " + d);
        assertTrue(CropResistantHash.matches(original, cropped, 1));
    }

    @Test
    @DisplayName("an image compared with itself has difference 0")
    void testIdentity() {
        CompositeFingerprint f = fp.fingerprint(TestImages.blobs(300));
        assertEquals(0.0, f.difference(f), 1e-12);
        assertEquals(0.0, f.relativeDifference(f), 1e-12);
    }

    @Test
    @DisplayName("a flat image hashes as one whole-image region")
    void testSolidImageFallback() {
        int[] flat = new int[120 * 90];
        java.util.Arrays.fill(flat, 200);
        CompositeFingerprint f = fp.fingerprint(GrayImage.of(120, 90, flat));
        assertEquals(1, f.size());
    }

    @Test
    @DisplayName("the segment limit keeps the largest regions")
    void testSegmentLimit() {
        Fingerprinter limited = new Fingerprinter(fp.settings().toBuilder().segmentLimit(2).build());
        CompositeFingerprint all = fp.fingerprint(TestImages.blobs(400));
        CompositeFingerprint two = limited.fingerprint(TestImages.blobs(400));
        assertTrue(all.size() > 2);
        assertEquals(2, two.size());
        // the background is the largest region and comes first after sorting
        assertTrue(all.components().contains(two.components().get(0)));
    }

    @Test
    @DisplayName("no matching region gives the full component count")
    void testNoMatch() {
        Fingerprint zeros = Fingerprint.fromHex(HashAlgorithm.DIFFERENCE, "0000000000000000");
        Fingerprint ones = Fingerprint.fromHex(HashAlgorithm.DIFFERENCE, "FFFFFFFFFFFFFFFF");
        CompositeFingerprint a = new CompositeFingerprint(CompositeStrategy.CROP_RESISTANT, List.of(zeros, zeros));
        CompositeFingerprint b = new CompositeFingerprint(CompositeStrategy.CROP_RESISTANT, List.of(ones));
        assertEquals(2.0, a.difference(b));
        assertEquals(1.0, a.relativeDifference(b));
        assertFalse(CropResistantHash.matches(a, b, 0));
    }

    @Test
    @DisplayName("difference subtracts the mean distance of matched regions")
    void testPartialMatch() {
        Fingerprint zeros = Fingerprint.fromHex(HashAlgorithm.DIFFERENCE, "0000000000000000");
        Fingerprint fourBits = Fingerprint.fromHex(HashAlgorithm.DIFFERENCE, "000000000000000F");
        Fingerprint ones = Fingerprint.fromHex(HashAlgorithm.DIFFERENCE, "FFFFFFFFFFFFFFFF");
        CompositeFingerprint a = new CompositeFingerprint(CompositeStrategy.CROP_RESISTANT, List.of(fourBits, ones));
        CompositeFingerprint b = new CompositeFingerprint(CompositeStrategy.CROP_RESISTANT, List.of(zeros));
        // one match at distance 4: 2 - (1 - 4 / 64)
        assertEquals(2 - (1 - 4.0 / 64), a.difference(b), 1e-12);
        assertTrue(CropResistantHash.matches(a, b, 0));
        assertFalse(CropResistantHash.matches(a, b, 1));
    }
}
