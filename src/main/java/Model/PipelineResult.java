package Model;

import java.nio.file.Path;

/**
 * One finished item of a {@link HashingPipeline}. Exactly one of image and
 * failure is set; sequence counts from 1 in completion order.
 */
public record PipelineResult(int sequence, Path path, ProcessedImage image, Failure failure) {

    public enum FailureKind {
        DECODE,
        IO,
        UNEXPECTED
    }

    public record Failure(FailureKind kind, String message, Throwable cause) {}

    public boolean isSuccess() {
        return failure == null;
    }
}
