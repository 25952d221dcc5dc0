package com.panelforge.imaging;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void writePng_thenRead_preservesPixels() throws Exception {
        BufferedImage image = new BufferedImage(5, 3, BufferedImage.TYPE_INT_RGB);
        image.setRGB(4, 2, 0x123456);
        Path file = tempDir.resolve("out").resolve("panel.png");

        ImageFiles.writePng(image, file);
        BufferedImage read = ImageFiles.read(file);

        assertEquals(BufferedImage.TYPE_INT_RGB, read.getType());
        assertEquals(5, read.getWidth());
        assertEquals(0xFF123456, read.getRGB(4, 2));
        assertFalse(Files.exists(tempDir.resolve("out").resolve("panel.png.tmp")));
    }

    @Test
    void writePng_failedMoveRemovesTempFile() throws Exception {
        Path occupied = tempDir.resolve("panel_01_promoted.png");
        Files.createDirectories(occupied);
        Files.writeString(occupied.resolve("keep.txt"), "x", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> ImageFiles.writePng(new byte[]{1, 2, 3}, occupied));

        assertFalse(Files.exists(tempDir.resolve("panel_01_promoted.png.tmp")));
    }

    @Test
    void writePng_interruptedWriteRemovesTempFile() {
        Path target = tempDir.resolve("panel_02_promoted.png");
        Thread.currentThread().interrupt();
        try {
            assertThrows(ClosedByInterruptException.class, () -> ImageFiles.writePng(new byte[]{1, 2, 3}, target));
        } finally {
            Thread.interrupted();
        }

        assertFalse(Files.exists(target));
        assertFalse(Files.exists(tempDir.resolve("panel_02_promoted.png.tmp")));
    }

    @Test
    void encodePng_isStableForSameImage() throws Exception {
        BufferedImage image = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
        image.setRGB(3, 3, 0xABCDEF);

        assertArrayEquals(ImageFiles.encodePng(image), ImageFiles.encodePng(image));
    }

    @Test
    void read_missingFileThrowsNoSuchFile() {
        assertThrows(NoSuchFileException.class, () -> ImageFiles.read(tempDir.resolve("absent.png")));
    }

    @Test
    void read_undecodableFileThrowsImageReadException() throws Exception {
        Path garbage = tempDir.resolve("grid.png");
        Files.writeString(garbage, "not an image", StandardCharsets.UTF_8);

        ImageReadException ex = assertThrows(ImageReadException.class, () -> ImageFiles.read(garbage));
        assertTrue(ex.getMessage().contains("grid.png"));
    }

    @Test
    void toRgb_flattensTransparencyOntoBlack() {
        BufferedImage argb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        argb.setRGB(1, 0, 0xFF00FF00);

        BufferedImage rgb = ImageFiles.toRgb(argb);

        assertEquals(BufferedImage.TYPE_INT_RGB, rgb.getType());
        assertEquals(0xFF000000, rgb.getRGB(0, 0));
        assertEquals(0xFF00FF00, rgb.getRGB(1, 0));
    }
}
