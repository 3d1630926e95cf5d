package Presentation;

import Model.DuplicateGroup;
import Model.ImageIndex;
import Model.IndexedImage;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(name = "dupes", description = "Find exact duplicate images in the DB.", mixinStandardHelpOptions = true)
public class DupesCommand implements Callable<Integer> {

    @ParentCommand
    private ImageDbCli parent;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(names = {"-d", "--dir"}, arity = "1..*", paramLabel = "DIR",
            description = "Only show groups with an image directly in one of these directories")
    private List<Path> dirFilter = List.of();

    @Override
    public Integer call() {
        Set<Path> dirs = new HashSet<>();
        for (Path d : dirFilter) dirs.add(expandHome(d).toAbsolutePath().normalize());

        PrintWriter out = spec.commandLine().getOut();
        try (ImageIndex index = parent.openIndex()) {
            for (DuplicateGroup group : index.findExactDupes()) {
                if (!dirs.isEmpty() && !touches(group, dirs)) continue;
                out.println(group.contentHash() + ": " + group.count() + ":");
                for (IndexedImage image : group.images()) {
                    out.println(" - " + image.path());
                }
            }
        }
        out.flush();
        return 0;
    }

    private static boolean touches(DuplicateGroup group, Set<Path> dirs) {
        for (IndexedImage image : group.images()) {
            if (dirs.contains(image.path().getParent())) return true;
        }
        return false;
    }

    private static Path expandHome(Path p) {
        String s = p.toString();
        if (s.equals("~") || s.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + s.substring(1));
        }
        return p;
    }
}
