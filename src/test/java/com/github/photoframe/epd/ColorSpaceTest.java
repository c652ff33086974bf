package com.github.photoframe.epd;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColorSpaceTest {

    @Test
    void srgbToLinear_endpoints() {
        assertEquals(0.0, ColorSpace.srgbToLinear(0), 1e-12);
        assertEquals(1.0, ColorSpace.srgbToLinear(255), 1e-12);
    }

    @Test
    void srgbToLinear_usesLinearSegmentBelowThreshold() {
        // 10 / 255 is under 0.04045
        assertEquals(10 / 255.0 / 12.92, ColorSpace.srgbToLinear(10), 1e-12);
    }

    @Test
    void srgbToLinear_fractionalMatchesWholeNeighbors() {
        double low = ColorSpace.srgbToLinear(127), high = ColorSpace.srgbToLinear(128);
        double mid = ColorSpace.srgbToLinear(127.5);
        assertTrue(mid > low && mid < high);
    }

    @Test
    void rgbToXyz_whiteIsD65() {
        double[] xyz = ColorSpace.rgbToXyz(255, 255, 255);
        assertEquals(ColorSpace.WHITE_X, xyz[0], 0.01);
        assertEquals(ColorSpace.WHITE_Y, xyz[1], 0.01);
        assertEquals(ColorSpace.WHITE_Z, xyz[2], 0.01);
    }

    @Test
    void rgbToLab_pureWhite() {
        double[] lab = ColorSpace.rgbToLab(255, 255, 255);
        assertEquals(100.0, lab[0], 0.05);
        assertEquals(0.0, lab[1], 0.05);
        assertEquals(0.0, lab[2], 0.05);
    }

    @Test
    void rgbToLab_pureBlack() {
        double[] lab = ColorSpace.rgbToLab(0, 0, 0);
        assertEquals(0.0, lab[0], 1e-9);
        assertEquals(0.0, lab[1], 1e-9);
        assertEquals(0.0, lab[2], 1e-9);
    }

    @Test
    void rgbToLab_pureRed() {
        double[] lab = ColorSpace.rgbToLab(255, 0, 0);
        assertEquals(53.24, lab[0], 0.1);
        assertEquals(80.09, lab[1], 0.2);
        assertEquals(67.20, lab[2], 0.2);
    }

    @Test
    void rgbToLab_midGrayIsNeutral() {
        double[] lab = ColorSpace.rgbToLab(128, 128, 128);
        assertEquals(53.6, lab[0], 0.2);
        assertEquals(0.0, lab[1], 0.05);
        assertEquals(0.0, lab[2], 0.05);
    }

    @Test
    void deltaE_identicalIsZero() {
        assertEquals(0.0, ColorSpace.deltaE(50, 10, -20, 50, 10, -20), 1e-12);
    }

    @Test
    void deltaE_isEuclidean() {
        assertEquals(5.0, ColorSpace.deltaE(new double[]{0, 3, 0}, new double[]{0, 0, 4}), 1e-12);
        assertEquals(ColorSpace.deltaE(10, 20, 30, 40, -5, 2), ColorSpace.deltaE(40, -5, 2, 10, 20, 30), 1e-12);
    }
}
