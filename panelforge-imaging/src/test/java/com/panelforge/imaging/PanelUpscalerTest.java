package com.panelforge.imaging;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PanelUpscalerTest {

    @Test
    void upscale_multipliesBothDimensions() {
        BufferedImage cropped = new BufferedImage(300, 169, BufferedImage.TYPE_INT_RGB);

        BufferedImage out = new PanelUpscaler(2, ResamplingMethod.BICUBIC).upscale(cropped);

        assertEquals(600, out.getWidth());
        assertEquals(338, out.getHeight());
    }

    @Test
    void upscale_factorOneReturnsInput() {
        BufferedImage cropped = new BufferedImage(64, 36, BufferedImage.TYPE_INT_RGB);

        assertSame(cropped, new PanelUpscaler(1, ResamplingMethod.BICUBIC).upscale(cropped));
    }

    @Test
    void upscale_nearestReplicatesPixels() {
        BufferedImage two = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        two.setRGB(0, 0, 0xFF0000);
        two.setRGB(1, 0, 0x0000FF);

        BufferedImage out = new PanelUpscaler(2, ResamplingMethod.NEAREST).upscale(two);

        assertEquals(0xFFFF0000, out.getRGB(0, 0));
        assertEquals(0xFFFF0000, out.getRGB(1, 1));
        assertEquals(0xFF0000FF, out.getRGB(2, 0));
        assertEquals(0xFF0000FF, out.getRGB(3, 1));
    }

    @Test
    void upscale_lanczosKeepsFlatRegionsExact() {
        BufferedImage flat = new BufferedImage(5, 3, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 5; x++) {
                flat.setRGB(x, y, 0x808040);
            }
        }

        BufferedImage out = new PanelUpscaler(2, ResamplingMethod.LANCZOS).upscale(flat);

        assertEquals(10, out.getWidth());
        assertEquals(6, out.getHeight());
        for (int y = 0; y < 6; y++) {
            for (int x = 0; x < 10; x++) {
                assertEquals(0xFF808040, out.getRGB(x, y), "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void upscale_lanczosRingsAroundHardEdge() {
        // 12x2 gray step: six columns at 50, six at 200
        BufferedImage step = new BufferedImage(12, 2, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 12; x++) {
                int v = x < 6 ? 50 : 200;
                step.setRGB(x, y, (v << 16) | (v << 8) | v);
            }
        }

        BufferedImage out = new PanelUpscaler(2, ResamplingMethod.LANCZOS).upscale(step);

        int min = 255;
        int max = 0;
        for (int x = 0; x < out.getWidth(); x++) {
            int v = out.getRGB(x, 0) & 0xFF;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        assertEquals(50, out.getRGB(0, 0) & 0xFF);
        assertEquals(200, out.getRGB(23, 3) & 0xFF);
        assertTrue(min < 45, "undershoot expected, min=" + min);
        assertTrue(max > 205, "overshoot expected, max=" + max);
    }

    @Test
    void lanczosKernel_isOneAtZeroAndVanishesAtIntegersAndOutsideSupport() {
        assertEquals(1.0, LanczosResampler.kernel(0.0), 0.0);
        assertEquals(0.0, LanczosResampler.kernel(1.0), 1e-12);
        assertEquals(0.0, LanczosResampler.kernel(-2.0), 1e-12);
        assertEquals(0.0, LanczosResampler.kernel(3.5), 0.0);
        assertEquals(LanczosResampler.kernel(0.4), LanczosResampler.kernel(-0.4), 1e-15);
    }

    @Test
    void constructor_rejectsFactorOutsideRange() {
        assertThrows(IllegalArgumentException.class, () -> new PanelUpscaler(0, ResamplingMethod.BICUBIC));
        assertThrows(IllegalArgumentException.class, () -> new PanelUpscaler(5, ResamplingMethod.BICUBIC));
    }

    @Test
    void resamplingMethod_fromNameIsCaseInsensitive() {
        assertEquals(ResamplingMethod.BICUBIC, ResamplingMethod.fromName("BiCubic"));
        assertEquals(ResamplingMethod.NEAREST, ResamplingMethod.fromName(" nearest "));
        assertEquals(ResamplingMethod.LANCZOS, ResamplingMethod.fromName("LANCZOS"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ResamplingMethod.fromName("hermite"));
        assertTrue(ex.getMessage().contains("lanczos"));
    }
}
