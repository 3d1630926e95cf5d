package Presentation;

import Model.ImageIndex;
import Model.IndexStatus;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "status", description = "Show info about the DB.", mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private ImageDbCli parent;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try (ImageIndex index = parent.openIndex()) {
            IndexStatus status = index.status();
            PrintWriter out = spec.commandLine().getOut();
            out.println("DB location: " + status.location());
            out.printf("Fingerprints: %s%n", index.settings().storeKey());
            out.printf("Saved directories: %,d%n", status.directories());
            out.printf("Saved images: %,d%n", status.images());
            out.printf("Saved hashes: %,d%n", status.hashes());
            out.flush();
        }
        return 0;
    }
}
