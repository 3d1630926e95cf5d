package Presentation;

import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.Label;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.layout.StackPane;
import javafx.scene.paint.Color;
import javafx.scene.shape.Circle;

import java.nio.file.Path;
import java.util.function.BiConsumer;

/**
 * Thumbnail of one image file with a selection marker and its file name.
 * Clicking anywhere toggles the selection.
 */
public final class PhotoCard extends StackPane {

    private static final double CARD_W = 180;
    private static final double CARD_H = 140;

    private static final String BASE_STYLE = """
            -fx-background-color: #3a3a3a;
            -fx-background-radius: 10;
            -fx-border-radius: 10;
        """;
    private static final String SELECTED_STYLE = BASE_STYLE + """
            -fx-border-color: #4f9cff;
            -fx-border-width: 2;
        """;

    private final Path path;
    private final Circle selectCircle;
    private final Label caption;
    private boolean selected;

    public PhotoCard(Path path, BiConsumer<Path, Boolean> onToggle) {
        this.path = path;

        setPrefSize(CARD_W, CARD_H);
        setMaxSize(CARD_W, CARD_H);
        setCache(true);
        setStyle(BASE_STYLE);

        Image img = new Image(path.toUri().toString(), CARD_W, CARD_H, true, true, true);
        ImageView imageView = new ImageView(img);
        imageView.setFitWidth(CARD_W);
        imageView.setFitHeight(CARD_H);
        imageView.setPreserveRatio(true);
        imageView.setSmooth(true);

        selectCircle = new Circle(8);
        selectCircle.setStroke(Color.WHITE);
        selectCircle.setFill(Color.TRANSPARENT);
        StackPane.setAlignment(selectCircle, Pos.TOP_RIGHT);
        StackPane.setMargin(selectCircle, new Insets(6));

        caption = new Label(path.getFileName().toString());
        caption.setMaxWidth(CARD_W - 12);
        caption.setStyle("-fx-background-color: rgba(0,0,0,0.55); -fx-padding: 1 4 1 4; -fx-font-size: 10;");
        StackPane.setAlignment(caption, Pos.BOTTOM_LEFT);
        StackPane.setMargin(caption, new Insets(4));

        getChildren().addAll(imageView, selectCircle, caption);

        setOnMouseClicked(e -> {
            setSelected(!selected);
            onToggle.accept(this.path, this.selected);
        });
    }

    public Path getPath() {
        return path;
    }

    public boolean isSelected() {
        return selected;
    }

    public void setSelected(boolean value) {
        if (this.selected == value) return;
        this.selected = value;
        selectCircle.setFill(selected ? Color.web("#4f9cff") : Color.TRANSPARENT);
        setStyle(selected ? SELECTED_STYLE : BASE_STYLE);
    }
}
