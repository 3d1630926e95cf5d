package Presentation;

import Model.ImageIndex;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.concurrent.Callable;

@Command(name = "reset", description = "Delete every image and hash from the DB.", mixinStandardHelpOptions = true)
public class ResetCommand implements Callable<Integer> {

    @ParentCommand
    private ImageDbCli parent;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try (ImageIndex index = parent.openIndex()) {
            index.reset();
            spec.commandLine().getOut().println("Reset " + index.status().location());
        }
        spec.commandLine().getOut().flush();
        return 0;
    }
}
