package Presentation;

import Model.ImageIndex;
import Model.IndexedImage;
import Model.SimilarImage;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "find", description = "Find images in the DB similar to the given image.",
        mixinStandardHelpOptions = true)
public class FindCommand implements Callable<Integer> {

    private static final DateTimeFormatter MODIFIED =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(ZoneId.systemDefault());

    @ParentCommand
    private ImageDbCli parent;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "PATH", description = "An image file")
    private Path path;

    @Option(names = {"-D", "--max-distance"},
            description = "Max distance as a share of hash bits that differ, 0 to 1 (default: ${DEFAULT-VALUE})")
    private double maxDistance = 0.05;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(path)) {
            throw new ParameterException(spec.commandLine(), "Not a file: " + path);
        }
        if (maxDistance < 0 || maxDistance > 1) {
            throw new ParameterException(spec.commandLine(), "--max-distance must be between 0 and 1, got " + maxDistance);
        }

        PrintWriter out = spec.commandLine().getOut();
        try (ImageIndex index = parent.openIndex()) {
            List<SimilarImage> rows = index.findSimilar(path, maxDistance);
            if (rows.isEmpty()) {
                out.println("No matches found for " + path);
            } else {
                out.println("Found " + rows.size() + " matches:");
                printTable(out, rows);
            }
        }
        out.flush();
        return 0;
    }

    private static void printTable(PrintWriter out, List<SimilarImage> rows) {
        int sizeWidth = "Size".length();
        for (SimilarImage row : rows) {
            sizeWidth = Math.max(sizeWidth, ImageDbCli.readableBytes(row.image().sizeBytes()).length());
        }
        String format = "%-10s  %" + sizeWidth + "s  %-19s  %s%n";
        out.printf(format, "Difference", "Size", "Last Modified", "Path");
        for (SimilarImage row : rows) {
            IndexedImage image = row.image();
            out.printf(format,
                    String.format(Locale.ROOT, "%.6f", row.distance()),
                    ImageDbCli.readableBytes(image.sizeBytes()),
                    MODIFIED.format(image.modifiedTime()),
                    image.path());
        }
    }
}
