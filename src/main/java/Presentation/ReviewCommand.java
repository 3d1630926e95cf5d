package Presentation;

import javafx.application.Application;
import picocli.CommandLine.*;

import java.util.concurrent.Callable;

@Command(name = "review", description = "Open a window to review and delete near-duplicate images.",
        mixinStandardHelpOptions = true)
public class ReviewCommand implements Callable<Integer> {

    @ParentCommand
    private ImageDbCli parent;

    @Override
    public Integer call() {
        // fail on bad settings before the window opens
        parent.settings();
        parent.backend();
        Application.launch(MainFX.class, parent.reviewParameters().toArray(new String[0]));
        return 0;
    }
}
