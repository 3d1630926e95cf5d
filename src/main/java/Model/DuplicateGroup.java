package Model;

import java.util.List;

/** Images with byte-identical files, sorted by path. */
public record DuplicateGroup(String contentHash, int count, List<IndexedImage> images) {

    public DuplicateGroup {
        images = List.copyOf(images);
    }
}
