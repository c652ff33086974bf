package com.github.photoframe.epd;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaletteDithererTest {
    /**
     * Only black and white are usable; the duplicate blacks never win a tie against slot 0.
     */
    private static final Palette BLACK_AND_WHITE = new Palette("bw", new int[]{
            0x000000FF, 0xFFFFFFFF, 0x000000FF, 0x000000FF, 0x000000FF, 0x000000FF, 0x000000FF});

    @Test
    void midGrayDithersToLinearMix() {
        PixelBuffer gray = new PixelBuffer(100, 100, 3).fill(128, 128, 128);
        new PaletteDitherer(BLACK_AND_WHITE, BLACK_AND_WHITE, ColorMethod.RGB).reduceFloydSteinberg(gray);
        int white = 0;
        for (int y = 0; y < 100; y++) {
            for (int x = 0; x < 100; x++) {
                int rgba = gray.getRGBA(x, y);
                assertTrue(rgba == 0x000000FF || rgba == 0xFFFFFFFF);
                if (rgba == 0xFFFFFFFF) white++;
            }
        }
        assertEquals(128.0 / 255.0, white / 10000.0, 0.02);
    }

    @Test
    void errorIsMeasuredAgainstTheErrorPalette() {
        // gray matches slot 1 exactly, so there is no error to spread, yet slot 1 is painted white
        Palette grayWhite = new Palette("gray-white", new int[]{
                0x000000FF, 0x808080FF, 0xFFFF00FF, 0xFF0000FF, 0x000000FF, 0x0000FFFF, 0x00FF00FF});
        PixelBuffer gray = new PixelBuffer(40, 30, 3).fill(128, 128, 128);
        new PaletteDitherer(Palette.THEORETICAL, grayWhite, ColorMethod.RGB).reduceFloydSteinberg(gray);
        for (byte b : gray.getData()) {
            assertEquals(255, b & 255);
        }
    }

    @Test
    void reservedColorNeverAppears() {
        Palette magentaReserved = new Palette("magenta", new int[]{
                0x000000FF, 0xFFFFFFFF, 0xFFFF00FF, 0xFF0000FF, 0xFF00FFFF, 0x0000FFFF, 0x00FF00FF});
        PixelBuffer magenta = new PixelBuffer(64, 64, 3).fill(255, 0, 255);
        for (ColorMethod method : ColorMethod.ALL) {
            PixelBuffer image = magenta.copy();
            new PaletteDitherer(magentaReserved, magentaReserved, method).reduceFloydSteinberg(image);
            for (int y = 0; y < 64; y++) {
                for (int x = 0; x < 64; x++) {
                    assertTrue(magentaReserved.isUsableColor(image.getRGBA(x, y)), method + " at " + x + "," + y);
                }
            }
        }
    }

    @Test
    void outputUsesOnlyOutputPaletteColors() {
        PixelBuffer image = new PixelBuffer(50, 40, 3);
        for (int y = 0; y < 40; y++) {
            for (int x = 0; x < 50; x++) {
                image.set(x, y, 0, x * 5);
                image.set(x, y, 1, y * 6);
                image.set(x, y, 2, 255 - x * 5);
            }
        }
        new PaletteDitherer(Palette.MEASURED, Palette.THEORETICAL, ColorMethod.LAB).reduceFloydSteinberg(image);
        for (int y = 0; y < 40; y++) {
            for (int x = 0; x < 50; x++) {
                assertTrue(Palette.MEASURED.isUsableColor(image.getRGBA(x, y)));
            }
        }
    }

    @Test
    void ditheringIsDeterministic() {
        PixelBuffer image = new PixelBuffer(31, 17, 3);
        for (int i = 0; i < image.getData().length; i++) {
            image.getData()[i] = (byte) (i * 37);
        }
        PixelBuffer first = image.copy(), second = image.copy();
        PaletteDitherer ditherer = new PaletteDitherer(Palette.THEORETICAL, Palette.MEASURED, ColorMethod.RGB);
        ditherer.reduceFloydSteinberg(first);
        ditherer.reduceFloydSteinberg(second);
        assertArrayEquals(first.getData(), second.getData());
    }

    @Test
    void tinyAndNarrowImages() {
        PixelBuffer single = new PixelBuffer(1, 1, 3).fill(250, 250, 250);
        new PaletteDitherer(Palette.THEORETICAL, Palette.THEORETICAL, ColorMethod.RGB).reduceFloydSteinberg(single);
        assertEquals(0xFFFFFFFF, single.getRGBA(0, 0));

        PixelBuffer column = new PixelBuffer(1, 50, 3).fill(128, 128, 128);
        new PaletteDitherer(BLACK_AND_WHITE, BLACK_AND_WHITE, ColorMethod.RGB).reduceFloydSteinberg(column);
        int white = 0;
        for (int y = 0; y < 50; y++) {
            if (column.getRGBA(0, y) == 0xFFFFFFFF) white++;
        }
        assertTrue(white > 15 && white < 35, "white count " + white);
    }

    @Test
    void extraChannelsAreCarriedAlong() {
        PixelBuffer rgba = new PixelBuffer(2, 2, 4,
                new byte[]{10, 10, 10, 1, (byte) 240, (byte) 240, (byte) 240, 2, 10, 10, 10, 3, 0, 0, 0, 4});
        new PaletteDitherer(Palette.THEORETICAL, Palette.THEORETICAL, ColorMethod.RGB).reduceFloydSteinberg(rgba);
        assertEquals(1, rgba.get(0, 0, 3));
        assertEquals(2, rgba.get(1, 0, 3));
        assertEquals(3, rgba.get(0, 1, 3));
        assertEquals(4, rgba.get(1, 1, 3));
    }
}
