package com.panelforge.imaging;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AspectCropperTest {

    private static final double WIDESCREEN = 16.0 / 9.0;

    private final AspectCropper cropper = new AspectCropper();

    @Test
    void computeCrop_squarePanelLosesTopAndBottom() {
        PanelBounds crop = cropper.computeCrop(300, 300, WIDESCREEN);

        assertEquals(new PanelBounds(0, 65, 300, 234), crop);
    }

    @Test
    void computeCrop_widePanelLosesLeftAndRight() {
        PanelBounds crop = cropper.computeCrop(1000, 300, WIDESCREEN);

        assertEquals(533, crop.width());
        assertEquals(300, crop.height());
        assertEquals(233, crop.left());
    }

    @Test
    void computeCrop_tightensOtherAxisWhenRoundingMissesTolerance() {
        AspectCropper unpadded = new AspectCropper(1, 1);

        // 10 / round(10 / 1.5) = 10 / 7 misses 1.5 by 0.07
        PanelBounds crop = unpadded.computeCrop(10, 10, 1.5);

        assertEquals(9, crop.width());
        assertEquals(6, crop.height());
    }

    @Test
    void computeCrop_ratioAlwaysWithinToleranceForCommonTargets() {
        double[] targets = {WIDESCREEN, 4.0 / 3.0, 1.0};
        for (double target : targets) {
            for (int w = 64; w <= 640; w += 13) {
                for (int h = 36; h <= 480; h += 17) {
                    PanelBounds crop = cropper.computeCrop(w, h, target);
                    double ratio = (double) crop.width() / crop.height();
                    assertTrue(Math.abs(ratio - target) < AspectCropper.RATIO_TOLERANCE,
                            "ratio " + ratio + " for " + w + "x" + h + " target " + target);
                    assertTrue(crop.right() <= w && crop.bottom() <= h);
                }
            }
        }
    }

    @Test
    void centerFillCrop_padsTinyPanelOnBlackCanvas() {
        BufferedImage tiny = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                tiny.setRGB(x, y, 0x3366CC);
            }
        }

        BufferedImage out = cropper.centerFillCrop(tiny, WIDESCREEN);

        assertEquals(64, out.getWidth());
        assertEquals(36, out.getHeight());
        assertEquals(0xFF000000, out.getRGB(0, 0));
        assertEquals(0xFF3366CC, out.getRGB(27, 13));
        assertEquals(0xFF3366CC, out.getRGB(36, 22));
    }

    @Test
    void centerFillCrop_neverStretches() {
        BufferedImage panel = new BufferedImage(300, 300, BufferedImage.TYPE_INT_RGB);
        panel.setRGB(150, 150, 0xFF0000);

        BufferedImage out = cropper.centerFillCrop(panel, WIDESCREEN);

        assertEquals(300, out.getWidth());
        assertEquals(169, out.getHeight());
        assertEquals(0xFFFF0000, out.getRGB(150, 150 - 65));
    }

    @Test
    void centerFillCrop_unreachableRatioThrowsCropException() {
        BufferedImage panel = new BufferedImage(64, 36, BufferedImage.TYPE_INT_RGB);

        assertThrows(CropException.class, () -> cropper.centerFillCrop(panel, 100.0));
    }

    @Test
    void computeCrop_rejectsNonPositiveRatio() {
        assertThrows(IllegalArgumentException.class, () -> cropper.computeCrop(100, 100, 0.0));
        assertThrows(IllegalArgumentException.class, () -> cropper.computeCrop(100, 100, Double.NaN));
    }
}
