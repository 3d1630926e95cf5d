package Model;

@FunctionalInterface
public interface ScanListener {

    ScanListener NONE = (completed, total, result) -> {};

    void onResult(int completed, int total, PipelineResult result);
}
