package com.github.photoframe.epd;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeometryNormalizerTest {

    private static PixelBuffer gradient(int width, int height) {
        PixelBuffer buffer = new PixelBuffer(width, height, 3);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                buffer.set(x, y, 0, x * 255 / Math.max(width - 1, 1));
                buffer.set(x, y, 1, y * 255 / Math.max(height - 1, 1));
                buffer.set(x, y, 2, (x + y) & 255);
            }
        }
        return buffer;
    }

    @Test
    void coverResizeAlwaysHitsTargetSize() {
        int[][] sources = {{1, 1}, {3, 7}, {7, 3}, {600, 800}, {800, 480}, {801, 479}, {37, 1000}, {1000, 37}};
        int[][] targets = {{800, 480}, {480, 800}, {160, 96}, {1, 1}, {13, 5}, {5, 13}};
        for (int[] s : sources) {
            PixelBuffer source = gradient(s[0], s[1]);
            for (int[] t : targets) {
                PixelBuffer out = GeometryNormalizer.resizeCover(source, t[0], t[1]);
                assertEquals(t[0], out.getWidth(), s[0] + "x" + s[1] + " to " + t[0] + "x" + t[1]);
                assertEquals(t[1], out.getHeight(), s[0] + "x" + s[1] + " to " + t[0] + "x" + t[1]);
                assertEquals(t[0] * t[1] * 3, out.getData().length);
            }
        }
    }

    @Test
    void rotationIsClockwise() {
        PixelBuffer source = new PixelBuffer(3, 2, 3);
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 3; x++) {
                source.set(x, y, 0, 10 * y + x);
            }
        }
        PixelBuffer rotated = GeometryNormalizer.rotate90Clockwise(source);
        assertEquals(2, rotated.getWidth());
        assertEquals(3, rotated.getHeight());
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 3; x++) {
                assertEquals(source.get(x, y, 0), rotated.get(2 - 1 - y, x, 0));
            }
        }
        // the old top-left corner is now the top-right corner
        assertEquals(0, rotated.get(1, 0, 0));
        assertEquals(10, rotated.get(0, 0, 0));
    }

    @Test
    void overflowIsCroppedEvenlyFromBothSides() {
        PixelBuffer source = new PixelBuffer(200, 100, 3).fill(0, 0, 255);
        for (int y = 0; y < 100; y++) {
            for (int x = 50; x < 150; x++) {
                source.setRGBA(x, y, 0xFF0000FF);
            }
        }
        PixelBuffer out = GeometryNormalizer.resizeCover(source, 100, 100);
        for (int y = 0; y < 100; y++) {
            for (int x = 0; x < 100; x++) {
                assertEquals(0xFF0000FF, out.getRGBA(x, y), "at " + x + "," + y);
            }
        }
    }

    @Test
    void uniformColorSurvivesResampling() {
        PixelBuffer source = new PixelBuffer(123, 77, 3).fill(12, 200, 99);
        PixelBuffer out = GeometryNormalizer.resizeCover(source, 800, 480);
        for (int y = 0; y < 480; y += 7) {
            for (int x = 0; x < 800; x += 7) {
                assertEquals(0x0CC863FF, out.getRGBA(x, y));
            }
        }
    }

    @Test
    void portraitIsRotatedForLandscapePanel() {
        PixelBuffer out = GeometryNormalizer.normalize(gradient(600, 800), DisplayTarget.DEFAULT);
        assertEquals(800, out.getWidth());
        assertEquals(480, out.getHeight());
    }

    @Test
    void portraitKeepsOrientationWhenAsked() {
        DisplayTarget keep = new DisplayTarget(800, 480, DisplayTarget.OrientationPolicy.KEEP_ORIENTATION);
        PixelBuffer out = GeometryNormalizer.normalize(gradient(600, 800), keep);
        assertEquals(480, out.getWidth());
        assertEquals(800, out.getHeight());

        PixelBuffer landscape = GeometryNormalizer.normalize(gradient(1600, 1200), keep);
        assertEquals(800, landscape.getWidth());
        assertEquals(480, landscape.getHeight());
    }

    @Test
    void normalizeNeverEditsItsInput() {
        PixelBuffer source = gradient(800, 480);
        byte[] before = source.getData().clone();
        PixelBuffer out = GeometryNormalizer.normalize(source, DisplayTarget.DEFAULT);
        assertNotSame(source, out);
        assertArrayEquals(before, out.getData());
        out.fill(1, 2, 3);
        assertArrayEquals(before, source.getData());
    }

    @Test
    void thumbnailFollowsSourceOrientation() {
        PixelBuffer wide = GeometryNormalizer.thumbnail(gradient(500, 300), 400, 240);
        assertEquals(400, wide.getWidth());
        assertEquals(240, wide.getHeight());

        PixelBuffer tall = GeometryNormalizer.thumbnail(gradient(300, 500), 400, 240);
        assertEquals(240, tall.getWidth());
        assertEquals(400, tall.getHeight());

        PixelBuffer square = GeometryNormalizer.thumbnail(gradient(50, 50), 160, 96);
        assertEquals(160, square.getWidth());
        assertEquals(96, square.getHeight());
    }

    @Test
    void displayTargetRejectsEmptyCanvas() {
        assertThrows(IllegalArgumentException.class,
                () -> new DisplayTarget(0, 480, DisplayTarget.OrientationPolicy.ROTATE_PORTRAIT));
    }
}
