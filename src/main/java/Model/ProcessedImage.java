package Model;

import java.time.Instant;

public record ProcessedImage(CompositeFingerprint fingerprint, String contentHash, long sizeBytes, Instant modifiedTime) {}
