package Presentation;

import Model.CompositeStrategy;
import Model.DuplicateScanner;
import Model.FingerprintSettings;
import Model.HashAlgorithm;
import Model.ImageIndex;
import Model.IndexBackend;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.ScrollPane;
import javafx.scene.control.ToolBar;
import javafx.scene.layout.*;
import javafx.stage.DirectoryChooser;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Review window: shows the images of a folder, indexes them on "Scan" and
 * preselects every near-duplicate except the largest file of its group.
 * "Del" deletes the selected files from disk and from the index.
 *
 * <p>Launched by {@code image-db review}, which passes the index location and
 * fingerprint settings as named parameters.</p>
 */
public class MainFX extends Application {

    private static final Logger log = LoggerFactory.getLogger(MainFX.class);

    private final TilePane tilePane = new TilePane();
    private final Button deleteBtn = new Button("Del");
    private final Button setPathBtn = new Button("Path");
    private final Button scanBtn = new Button("Scan");
    private final Label statusLabel = new Label();

    private final Set<Path> selected = ConcurrentHashMap.newKeySet();
    private final Map<Path, PhotoCard> pathToCard = new ConcurrentHashMap<>();
    private final List<Path> allImages = Collections.synchronizedList(new ArrayList<>());

    private static final int UI_BATCH_SIZE = 100;
    static final double DUP_THRESHOLD = 0.10;

    private ImageIndex index;
    private DuplicateScanner duplicateScanner;

    private static final String DARK_CSS = """
.root {
  -fx-base: #2b2b2b;
  -fx-background: #2b2b2b;
  -fx-control-inner-background: #333333;
  -fx-accent: #4f9cff;
  -fx-focus-color: -fx-accent;
  -fx-faint-focus-color: rgba(79,156,255,0.25);
}
.label { -fx-text-fill: #e6e6e6; }
.button { -fx-background-color: #3a3a3a; -fx-text-fill: #e6e6e6; }
.button:hover { -fx-background-color: #444444; }
""";

    @Override
    public void init() {
        Map<String, String> named = getParameters().getNamed();
        FingerprintSettings.Builder settings = FingerprintSettings.builder();
        if (named.containsKey("hash")) settings.algorithm(HashAlgorithm.fromKey(named.get("hash")));
        if (named.containsKey("strategy")) settings.strategy(CompositeStrategy.fromKey(named.get("strategy")));
        if (named.containsKey("hash-size")) settings.hashSize(Integer.parseInt(named.get("hash-size")));

        IndexBackend backend = IndexBackend.fromKey(named.getOrDefault("backend", "h2"));
        Path location = Path.of(named.getOrDefault("db", ImageDbCli.defaultLocation(backend).toString()));
        index = backend.open(location, settings.build());
        duplicateScanner = new DuplicateScanner(index);
        log.info("Review window using {}", index.status().location());
    }

    @Override
    public void start(final Stage stage) {

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        ToolBar toolbar = new ToolBar(scanBtn, statusLabel, spacer, setPathBtn, deleteBtn);
        toolbar.setPrefWidth(Double.MAX_VALUE);

        deleteBtn.setDisable(true);

        tilePane.setHgap(10);
        tilePane.setVgap(10);
        tilePane.setPadding(new Insets(10));
        tilePane.setPrefColumns(5);
        tilePane.setCache(true);

        ScrollPane scrollPane = new ScrollPane(tilePane);
        scrollPane.setFitToWidth(true);
        scrollPane.setPannable(true);

        BorderPane root = new BorderPane();
        root.setTop(toolbar);
        root.setCenter(scrollPane);

        setPathBtn.setOnAction(e -> chooseFolder(stage));
        deleteBtn.setOnAction(e -> deleteSelected());
        scanBtn.setOnAction(e -> runDuplicateScan());

        stage.setTitle("image-db review");
        Scene scene = new Scene(root, 1000, 600);
        scene.getStylesheets().add("data:text/css," + DARK_CSS.replace(" ", "%20"));
        stage.setScene(scene);
        stage.show();
    }

    private void chooseFolder(Stage stage) {
        DirectoryChooser chooser = new DirectoryChooser();
        chooser.setTitle("Choose folder with images");
        File dir = chooser.showDialog(stage);
        if (dir == null) return;

        tilePane.getChildren().clear();
        selected.clear();
        pathToCard.clear();
        allImages.clear();
        updateDeleteButton();

        Path root = dir.toPath();

        Thread t = new Thread(() -> {
            ImageScanner scanner = new ImageScanner();
            List<PhotoCard> batch = new ArrayList<>(UI_BATCH_SIZE);

            try {
                scanner.scan(root, imagePath -> {
                    PhotoCard card = new PhotoCard(imagePath, this::onToggleSelection);
                    pathToCard.put(imagePath, card);
                    allImages.add(imagePath);
                    batch.add(card);

                    if (batch.size() >= UI_BATCH_SIZE) {
                        List<PhotoCard> toAdd = new ArrayList<>(batch);
                        batch.clear();
                        Platform.runLater(() -> tilePane.getChildren().addAll(toAdd));
                    }
                });
            } catch (IOException e) {
                log.error("Unable to list images in {}", root, e);
                setStatus("Unable to read " + root + ": " + e.getMessage());
            }

            if (!batch.isEmpty()) {
                List<PhotoCard> toAdd = new ArrayList<>(batch);
                Platform.runLater(() -> tilePane.getChildren().addAll(toAdd));
            }
            setStatus(allImages.size() + " images");
        }, "image-list-thread");

        t.setDaemon(true);
        t.start();
    }

    private void runDuplicateScan() {
        if (allImages.isEmpty()) return;

        scanBtn.setDisable(true);

        Platform.runLater(() -> {
            for (PhotoCard c : pathToCard.values()) c.setSelected(false);
            selected.clear();
            updateDeleteButton();
        });

        List<Path> snapshot = new ArrayList<>(allImages);

        duplicateScanner.scanAsync(snapshot, DUP_THRESHOLD,
                (completed, total, r) -> setStatus("Hashed " + completed + " / " + total)
        ).thenAccept(result -> {
            List<Path> list = new ArrayList<>(result.toSelect());
            final int batchSize = 200;

            for (int i = 0; i < list.size(); i += batchSize) {
                List<Path> part = list.subList(i, Math.min(i + batchSize, list.size()));

                Platform.runLater(() -> {
                    for (Path p : part) {
                        PhotoCard card = pathToCard.get(p);
                        if (card != null) {
                            card.setSelected(true);
                            selected.add(p);
                        }
                    }
                    updateDeleteButton();
                });
            }
            setStatus(result.groupsFound() + " duplicate groups, " + result.summary().failed() + " unreadable");

        }).whenComplete((ok, ex) -> {
            if (ex != null) {
                log.error("Duplicate scan failed", ex);
                setStatus("Scan failed: " + ex.getMessage());
            }
            Platform.runLater(() -> scanBtn.setDisable(false));
        });
    }

    private void onToggleSelection(Path path, boolean isSelectedNow) {
        if (isSelectedNow) selected.add(path);
        else selected.remove(path);
        updateDeleteButton();
    }

    private void updateDeleteButton() {
        Platform.runLater(() -> deleteBtn.setDisable(selected.isEmpty()));
    }

    private void setStatus(String text) {
        Platform.runLater(() -> statusLabel.setText(text));
    }

    private void deleteSelected() {
        Set<Path> toDelete = new HashSet<>(selected);
        scanBtn.setDisable(true);

        // index writes stay on the scanner's thread
        duplicateScanner.runExclusive(() -> {
            int deleted = 0;
            for (Path p : toDelete) {
                try {
                    Files.deleteIfExists(p);
                    index.remove(p);
                    deleted++;

                    PhotoCard card = pathToCard.remove(p);
                    if (card != null) {
                        Platform.runLater(() -> tilePane.getChildren().remove(card));
                    }
                    allImages.remove(p);
                } catch (IOException e) {
                    log.warn("Unable to delete {}: {}", p, e.getMessage());
                }
            }
            selected.removeAll(toDelete);
            updateDeleteButton();
            setStatus("Deleted " + deleted + " files");
        }).whenComplete((ok, ex) -> {
            if (ex != null) log.error("Delete failed", ex);
            Platform.runLater(() -> scanBtn.setDisable(false));
        });
    }

    @Override
    public void stop() {
        duplicateScanner.shutdown();
        index.close();
    }
}
