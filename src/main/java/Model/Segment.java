package Model;

/**
 * One contiguous region of pixels that are all above, or all at or below, the
 * segmentation threshold.
 */
public final class Segment {

    private final int[] xs;
    private final int[] ys;
    private final boolean bright;

    Segment(int[] xs, int[] ys, boolean bright) {
        this.xs = xs;
        this.ys = ys;
        this.bright = bright;
    }

    /** Every pixel of a width x height image, row by row. */
    static Segment whole(int width, int height) {
        int[] xs = new int[width * height];
        int[] ys = new int[width * height];
        for (int y = 0, i = 0; y < height; y++) {
            for (int x = 0; x < width; x++, i++) {
                xs[i] = x;
                ys[i] = y;
            }
        }
        return new Segment(xs, ys, false);
    }

    public int size() {
        return xs.length;
    }

    public boolean isBright() {
        return bright;
    }

    public int x(int i) {
        return xs[i];
    }

    public int y(int i) {
        return ys[i];
    }

    /**
     * Bounding box (minX, minY, maxX + 1, maxY + 1), scaled per axis.
     */
    public double[] bounds(double scaleW, double scaleH) {
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
        for (int i = 0; i < xs.length; i++) {
            minX = Math.min(minX, xs[i]);
            maxX = Math.max(maxX, xs[i]);
            minY = Math.min(minY, ys[i]);
            maxY = Math.max(maxY, ys[i]);
        }
        return new double[] {minX * scaleW, minY * scaleH, (maxX + 1) * scaleW, (maxY + 1) * scaleH};
    }

    @Override
    public String toString() {
        double[] b = bounds(1, 1);
        return "Segment[size=" + size() + ", bright=" + bright
                + ", box=(" + (int) b[0] + ", " + (int) b[1] + ", " + (int) b[2] + ", " + (int) b[3] + ")]";
    }
}
