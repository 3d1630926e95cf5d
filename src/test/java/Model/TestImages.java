package Model;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Generated test images, small enough to hash quickly.
 */
public final class TestImages {

    private TestImages() {}

    /**
     * Grid of flat blocks whose gray levels are all distinct and at least 8 apart.
     */
    public static BufferedImage blocks(long seed, int width, int height, int blocksX, int blocksY) {
        List<Integer> levels = new ArrayList<>();
        for (int v = 4; v <= 252; v += 8) levels.add(v);
        Collections.shuffle(levels, new Random(seed));

        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int bx = x * blocksX / width;
                int by = y * blocksY / height;
                raster.setSample(x, y, 0, levels.get((by * blocksX + bx) % levels.size()));
            }
        }
        return img;
    }

    public static BufferedImage blocks(long seed) {
        return blocks(seed, 240, 180, 6, 5);
    }

    /** Smooth shading, used where lossy compression must not flip many hash bits. */
    public static BufferedImage shaded(long seed, int width, int height) {
        Random rnd = new Random(seed);
        double fx = 1 + rnd.nextInt(3);
        double fy = 1 + rnd.nextInt(3);
        double px = rnd.nextDouble() * Math.PI;
        double py = rnd.nextDouble() * Math.PI;

        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double v = Math.sin(fx * Math.PI * x / width + px) * Math.cos(fy * Math.PI * y / height + py);
                raster.setSample(x, y, 0, (int) Math.round(128 + 110 * v));
            }
        }
        return img;
    }

    /**
     * Dark background shaded left to right with three bright ellipses kept at
     * least 10% away from every border. Each ellipse is shaded right to left.
     */
    public static BufferedImage blobs(int size) {
        double s = size / 400.0;
        double[][] ellipses = {
                {120 * s, 130 * s, 60 * s, 40 * s},
                {280 * s, 120 * s, 50 * s, 45 * s},
                {200 * s, 290 * s, 70 * s, 40 * s},
        };
        BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int v = (int) Math.round(20 + 90.0 * x / size + 10.0 * y / size);
                for (double[] e : ellipses) {
                    double dx = (x - e[0]) / e[2];
                    double dy = (y - e[1]) / e[3];
                    if (dx * dx + dy * dy <= 1) {
                        v = (int) Math.round(200 - 40 * dx + 10 * dy);
                    }
                }
                raster.setSample(x, y, 0, v);
            }
        }
        return img;
    }

    /** Counter-clockwise, matching {@link GrayImage#rotate90()}. */
    public static BufferedImage rotate90(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage out = new BufferedImage(h, w, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < w; y++) {
            for (int x = 0; x < h; x++) {
                out.getRaster().setSample(x, y, 0, src.getRaster().getSample(w - 1 - y, x, 0));
            }
        }
        return out;
    }

    public static BufferedImage crop(BufferedImage src, double border) {
        int dx = (int) Math.round(src.getWidth() * border);
        int dy = (int) Math.round(src.getHeight() * border);
        BufferedImage view = src.getSubimage(dx, dy, src.getWidth() - 2 * dx, src.getHeight() - 2 * dy);
        BufferedImage out = new BufferedImage(view.getWidth(), view.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        out.getRaster().setRect(view.getRaster().createTranslatedChild(0, 0));
        return out;
    }

    public static BufferedImage toRgb(BufferedImage src) {
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        for (int y = 0; y < src.getHeight(); y++) {
            for (int x = 0; x < src.getWidth(); x++) {
                int v = src.getRaster().getSample(x, y, 0);
                out.setRGB(x, y, (v << 16) | (v << 8) | v);
            }
        }
        return out;
    }

    public static Path write(BufferedImage img, String format, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        if (!ImageIO.write(img, format, file.toFile())) {
            throw new IOException("No writer for " + format);
        }
        return file;
    }

    public static Path writeJpeg(BufferedImage img, float quality, Path file) throws IOException {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("jpeg").next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(quality);
        Files.deleteIfExists(file);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(img, null, null), param);
        } finally {
            writer.dispose();
        }
        return file;
    }
}
