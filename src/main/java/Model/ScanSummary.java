package Model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Counts for one batch ingest; failures are grouped by kind. */
public record ScanSummary(int requested, int alreadyIndexed, int processed,
                          Map<PipelineResult.FailureKind, Integer> failures) {

    public ScanSummary {
        EnumMap<PipelineResult.FailureKind, Integer> copy = new EnumMap<>(PipelineResult.FailureKind.class);
        copy.putAll(failures);
        failures = Collections.unmodifiableMap(copy);
    }

    public static ScanSummary empty(int requested, int alreadyIndexed) {
        return new ScanSummary(requested, alreadyIndexed, 0, Map.of());
    }

    public int failed() {
        int total = 0;
        for (int n : failures.values()) total += n;
        return total;
    }

    public int failed(PipelineResult.FailureKind kind) {
        return failures.getOrDefault(kind, 0);
    }

    @Override
    public String toString() {
        return "ScanSummary{requested=" + requested + ", alreadyIndexed=" + alreadyIndexed
                + ", processed=" + processed + ", failures=" + failures + '}';
    }
}
