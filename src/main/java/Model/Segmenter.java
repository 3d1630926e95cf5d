package Model;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a brightness map into 4-connected regions above ("hills") and at or
 * below ("valleys") a threshold by flood fill.
 *
 * <p>Every pixel belongs to exactly one region. Hills are found first, then
 * valleys, each seeded in row-major order.</p>
 */
public final class Segmenter {

    private Segmenter() {}

    /**
     * Regions larger than {@code minSegmentSize} pixels. A solid image can yield
     * none; callers fall back to the whole image.
     */
    public static List<Segment> segment(GrayImage brightness, int threshold, int minSegmentSize) {
        List<Segment> kept = new ArrayList<>();
        for (Segment s : findAllRegions(brightness, threshold)) {
            if (s.size() > minSegmentSize) kept.add(s);
        }
        return kept;
    }

    /**
     * Every region regardless of size; together they cover the image exactly once.
     */
    public static List<Segment> findAllRegions(GrayImage brightness, int threshold) {
        int w = brightness.width();
        int h = brightness.height();
        boolean[] above = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                above[y * w + x] = brightness.get(x, y) > threshold;
            }
        }

        boolean[] assigned = new boolean[w * h];
        int[] queue = new int[w * h];
        List<Segment> regions = new ArrayList<>();

        for (boolean bright : new boolean[] {true, false}) {
            for (int seed = 0; seed < above.length; seed++) {
                if (assigned[seed] || above[seed] != bright) continue;
                regions.add(grow(seed, bright, above, assigned, queue, w, h));
            }
        }
        return regions;
    }

    private static Segment grow(int seed, boolean bright, boolean[] above, boolean[] assigned,
                                int[] queue, int w, int h) {
        int head = 0;
        int tail = 0;
        queue[tail++] = seed;
        assigned[seed] = true;

        while (head < tail) {
            int p = queue[head++];
            int x = p % w;
            int y = p / w;
            // bounds checks stand in for a frame of already-segmented pixels around the image
            if (x > 0) tail = visit(p - 1, bright, above, assigned, queue, tail);
            if (x < w - 1) tail = visit(p + 1, bright, above, assigned, queue, tail);
            if (y > 0) tail = visit(p - w, bright, above, assigned, queue, tail);
            if (y < h - 1) tail = visit(p + w, bright, above, assigned, queue, tail);
        }

        int[] xs = new int[tail];
        int[] ys = new int[tail];
        for (int i = 0; i < tail; i++) {
            xs[i] = queue[i] % w;
            ys[i] = queue[i] / w;
        }
        return new Segment(xs, ys, bright);
    }

    private static int visit(int p, boolean bright, boolean[] above, boolean[] assigned, int[] queue, int tail) {
        if (!assigned[p] && above[p] == bright) {
            assigned[p] = true;
            queue[tail++] = p;
        }
        return tail;
    }
}
