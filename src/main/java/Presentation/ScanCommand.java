package Presentation;

import Model.ImageIndex;
import Model.ScanSummary;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(name = "scan", description = "Scan images to populate the DB.", mixinStandardHelpOptions = true)
public class ScanCommand implements Callable<Integer> {

    @ParentCommand
    private ImageDbCli parent;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "PATH",
            description = "Image files or directories (scanned recursively)")
    private List<Path> paths;

    @Option(names = "--no-ext-filter",
            description = "Do not filter files by extension (default: .jpg, .jpeg, .png only)")
    private boolean noExtFilter;

    @Option(names = {"-w", "--max-workers"},
            description = "Number of worker threads (default: one per processor)")
    private int maxWorkers;

    @Option(names = "--rescan",
            description = "Hash paths that are already in the DB again")
    private boolean rescan;

    @Override
    public Integer call() throws Exception {
        ImageScanner scanner = noExtFilter ? new ImageScanner(Set.of()) : new ImageScanner();
        List<Path> images = scanner.scanAll(paths);
        PrintWriter out = spec.commandLine().getOut();

        ScanSummary summary;
        try (ImageIndex index = parent.openIndex()) {
            summary = index.addImages(images, maxWorkers, !rescan, (completed, total, result) -> {
                if (completed % 100 == 0 || completed == total) {
                    out.printf("Hashed %,d / %,d%n", completed, total);
                    out.flush();
                }
            });
        }
        out.printf("Found %,d images: %,d added, %,d already in the DB, %,d failed%n",
                summary.requested(), summary.processed(), summary.alreadyIndexed(), summary.failed());
        summary.failures().forEach((kind, n) -> out.printf("  %s: %,d%n", kind, n));
        out.flush();
        return 0;
    }
}
