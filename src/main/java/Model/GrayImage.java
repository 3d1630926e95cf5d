package Model;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.util.Arrays;

/**
 * Immutable 8-bit grayscale pixel buffer, row-major.
 *
 * <p>All geometric operations return new instances. Luma conversion uses the
 * ITU-R 601-2 weights in 16-bit fixed point, rounded to nearest.</p>
 */
public final class GrayImage {

    private final int width;
    private final int height;
    private final int[] pixels;

    private GrayImage(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public static GrayImage of(int width, int height, int[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
        }
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " pixels, got " + pixels.length);
        }
        int[] copy = pixels.clone();
        for (int i = 0; i < copy.length; i++) copy[i] = clamp(copy[i]);
        return new GrayImage(width, height, copy);
    }

    public static GrayImage of(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] out = new int[w * h];

        // getRGB() on gray images goes through a linear->sRGB conversion, read the raster instead
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            Raster raster = image.getRaster();
            raster.getSamples(0, 0, w, h, 0, out);
            return new GrayImage(w, h, out);
        }

        int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            int r = (p >> 16) & 0xFF;
            int g = (p >> 8) & 0xFF;
            int b = p & 0xFF;
            out[i] = (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
        }
        return new GrayImage(w, h, out);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int get(int x, int y) {
        return pixels[y * width + x];
    }

    public int[] pixels() {
        return pixels.clone();
    }

    public BufferedImage toBufferedImage() {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = out.getRaster();
        raster.setSamples(0, 0, width, height, 0, pixels);
        return out;
    }

    // region Geometry

    /** Rotates 90 degrees counter-clockwise. */
    public GrayImage rotate90() {
        int[] out = new int[pixels.length];
        int nw = height;
        for (int y = 0; y < width; y++) {
            for (int x = 0; x < nw; x++) {
                out[y * nw + x] = pixels[x * width + (width - 1 - y)];
            }
        }
        return new GrayImage(nw, width, out);
    }

    public GrayImage rotate180() {
        int[] out = new int[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            out[i] = pixels[pixels.length - 1 - i];
        }
        return new GrayImage(width, height, out);
    }

    /**
     * Crops to a box given in (possibly fractional) pixel coordinates. Edges are
     * rounded and clamped to the image; the result is at least 1x1.
     */
    public GrayImage crop(double minX, double minY, double maxX, double maxY) {
        int x0 = clampTo((int) Math.round(minX), 0, width - 1);
        int y0 = clampTo((int) Math.round(minY), 0, height - 1);
        int x1 = clampTo((int) Math.round(maxX), x0 + 1, width);
        int y1 = clampTo((int) Math.round(maxY), y0 + 1, height);

        int nw = x1 - x0;
        int nh = y1 - y0;
        int[] out = new int[nw * nh];
        for (int y = 0; y < nh; y++) {
            System.arraycopy(pixels, (y0 + y) * width + x0, out, y * nw, nw);
        }
        return new GrayImage(nw, nh, out);
    }

    /**
     * Box-average shrink by an integer factor. Output pixel (i, j) averages the
     * exact source area it covers, with fractional edge pixels weighted by their
     * overlap, so sides that are not multiples of the factor lose nothing.
     *
     * <p>Integer arithmetic with a single rounding step: the result commutes with
     * {@link #rotate90()} and {@link #rotate180()} for any image size.</p>
     */
    public GrayImage shrinkArea(int factor) {
        if (factor <= 1) return this;
        int nw = Math.max(1, width / factor);
        int nh = Math.max(1, height / factor);

        // source column x spans [x*nw, (x+1)*nw), output column i spans [i*width, (i+1)*width)
        long[] columns = new long[nw * height];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int i = 0; i < nw; i++) {
                long start = (long) i * width;
                long end = start + width;
                long sum = 0;
                for (int x = (int) (start / nw); (long) x * nw < end; x++) {
                    sum += overlap(start, end, (long) x * nw, nw) * pixels[row + x];
                }
                columns[y * nw + i] = sum;
            }
        }

        long total = (long) width * height;
        int[] out = new int[nw * nh];
        for (int j = 0; j < nh; j++) {
            long start = (long) j * height;
            long end = start + height;
            for (int i = 0; i < nw; i++) {
                long sum = 0;
                for (int y = (int) (start / nh); (long) y * nh < end; y++) {
                    sum += overlap(start, end, (long) y * nh, nh) * columns[y * nw + i];
                }
                out[j * nw + i] = (int) ((sum + total / 2) / total);
            }
        }
        return new GrayImage(nw, nh, out);
    }

    private static long overlap(long start, long end, long from, int length) {
        return Math.min(end, from + length) - Math.max(start, from);
    }

    /** Area interpolation when shrinking, Lanczos (8x8 support) otherwise. */
    public GrayImage resize(int newWidth, int newHeight) {
        if (newWidth <= 0 || newHeight <= 0) {
            throw new IllegalArgumentException("Invalid image size " + newWidth + "x" + newHeight);
        }
        if (newWidth == width && newHeight == height) return this;
        int interpolation = newWidth <= width && newHeight <= height ? Imgproc.INTER_AREA : Imgproc.INTER_LANCZOS4;
        Mat src = toMat();
        Mat dst = new Mat();
        try {
            Imgproc.resize(src, dst, new Size(newWidth, newHeight), 0, 0, interpolation);
            return fromMat(dst);
        } finally {
            src.release();
            dst.release();
        }
    }

    // endregion

    // region Filters

    /** Gaussian blur with the given standard deviation, edges replicated. */
    public GrayImage gaussianBlur(double sigma) {
        Mat src = toMat();
        Mat dst = new Mat();
        try {
            Imgproc.GaussianBlur(src, dst, new Size(0, 0), sigma, sigma, Core.BORDER_REPLICATE);
            return fromMat(dst);
        } finally {
            src.release();
            dst.release();
        }
    }

    public GrayImage medianFilter(int size) {
        if (size < 3 || size % 2 == 0) {
            throw new IllegalArgumentException("Median size must be odd and at least 3: " + size);
        }
        Mat src = toMat();
        Mat dst = new Mat();
        try {
            Imgproc.medianBlur(src, dst, size);
            return fromMat(dst);
        } finally {
            src.release();
            dst.release();
        }
    }

    // endregion

    // region OpenCV

    private Mat toMat() {
        OpenCV.loadLocally();
        byte[] bytes = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) bytes[i] = (byte) pixels[i];
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, bytes);
        return mat;
    }

    private static GrayImage fromMat(Mat mat) {
        int w = mat.cols();
        int h = mat.rows();
        byte[] bytes = new byte[w * h];
        mat.get(0, 0, bytes);
        int[] out = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) out[i] = bytes[i] & 0xFF;
        return new GrayImage(w, h, out);
    }

    // endregion

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GrayImage)) return false;
        GrayImage that = (GrayImage) o;
        return width == that.width && height == that.height && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "GrayImage[" + width + "x" + height + "]";
    }

    static int clamp(int value) {
        return clampTo(value, 0, 255);
    }

    private static int clampTo(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
