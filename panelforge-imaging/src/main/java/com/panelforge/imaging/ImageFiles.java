package com.panelforge.imaging;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Decode/encode helpers. All decoded images are normalized to {@code TYPE_INT_RGB} so slicing,
 * cropping and scoring see one pixel layout regardless of the source format.
 */
public final class ImageFiles {

    private static final String PNG = "png";

    private ImageFiles() {
    }

    /**
     * Reads an image file and converts it to RGB.
     *
     * @throws NoSuchFileException when the file does not exist
     * @throws ImageReadException  when the file cannot be decoded
     */
    public static BufferedImage read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        BufferedImage raw;
        try (InputStream in = Files.newInputStream(file)) {
            raw = ImageIO.read(in);
        } catch (IOException e) {
            throw new ImageReadException("Could not decode image " + file + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new ImageReadException("Could not decode image " + file + ": unsupported or corrupt format");
        }
        return toRgb(raw);
    }

    /**
     * Converts to {@code TYPE_INT_RGB}; transparent pixels are flattened onto black.
     */
    public static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    public static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, PNG, out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    /**
     * Writes {@code image} as PNG. The file is written next to the target and moved into place,
     * so a reader never observes a partially written panel.
     */
    public static void writePng(BufferedImage image, Path target) throws IOException {
        writePng(encodePng(image), target);
    }

    /**
     * Writes already-encoded PNG bytes, with the same write-then-move behaviour. The temporary
     * sibling is removed when the write or the move fails, including an interrupted write.
     */
    public static void writePng(byte[] png, Path target) throws IOException {
        Objects.requireNonNull(png, "png");
        Objects.requireNonNull(target, "target");
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(tmp, png);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
