/*
 * Copyright (c) 2022  Tommy Ettinger
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *
 */

package com.github.photoframe.epd;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fits a source image to a panel: optional quarter-turn rotation, then a "cover" resize that scales the image until
 * it fills the whole canvas and crops the overflow evenly from both sides. The result is always exactly the canvas
 * size, with no borders. This is the only stage that changes a buffer's dimensions, so it always returns a new
 * {@link PixelBuffer} and never edits its input.
 */
public final class GeometryNormalizer {
    private GeometryNormalizer() {
    }

    /**
     * Rotates and cover-resizes {@code source} for {@code target}.
     * @param source the decoded image; not modified
     * @param target panel size and orientation policy
     * @return a new buffer with the canvas size {@code target} picks for this source
     */
    public static PixelBuffer normalize(PixelBuffer source, DisplayTarget target) {
        source.validate();
        final int sw = source.getWidth(), sh = source.getHeight();
        PixelBuffer oriented = source;
        if (target.needsRotation(sw, sh)) {
            Logger.getGlobal().log(Level.FINE, "Portrait source " + sw + "x" + sh + ", rotating 90 degrees clockwise");
            oriented = rotate90Clockwise(source);
        }
        final int tw = target.canvasWidth(sw, sh), th = target.canvasHeight(sw, sh);
        if (oriented.getWidth() == tw && oriented.getHeight() == th)
            return oriented == source ? source.copy() : oriented;
        Logger.getGlobal().log(Level.FINE, "Resizing " + oriented.getWidth() + "x" + oriented.getHeight()
                + " to " + tw + "x" + th + " (cover)");
        return resizeCover(oriented, tw, th);
    }

    /**
     * Turns an image a quarter-turn clockwise: source pixel (x, y) lands at (height - 1 - y, x), so the result is
     * height wide and width tall.
     * @param source not modified
     * @return a new, rotated buffer with the same channel count
     */
    public static PixelBuffer rotate90Clockwise(PixelBuffer source) {
        final int w = source.getWidth(), h = source.getHeight(), channels = source.getChannels();
        final byte[] src = source.getData();
        PixelBuffer rotated = new PixelBuffer(h, w, channels);
        final byte[] dst = rotated.getData();
        for (int y = 0; y < h; y++) {
            final int dx = h - 1 - y;
            for (int x = 0; x < w; x++) {
                System.arraycopy(src, (y * w + x) * channels, dst, (x * h + dx) * channels, channels);
            }
        }
        return rotated;
    }

    /**
     * Scales {@code source} by {@code max(targetWidth / width, targetHeight / height)} and crops the centered
     * targetWidth by targetHeight region. Scaled dimensions and crop offsets are rounded the same way at every size,
     * so the output is exactly the requested size. Sampling is bilinear.
     * @param source not modified
     * @param targetWidth output width; must be positive
     * @param targetHeight output height; must be positive
     * @return a new buffer of exactly targetWidth by targetHeight
     */
    public static PixelBuffer resizeCover(PixelBuffer source, int targetWidth, int targetHeight) {
        final int sw = source.getWidth(), sh = source.getHeight(), channels = source.getChannels();
        final double scale = Math.max(targetWidth / (double) sw, targetHeight / (double) sh);
        final int scaledWidth = Math.max((int) Math.round(sw * scale), targetWidth);
        final int scaledHeight = Math.max((int) Math.round(sh * scale), targetHeight);
        final int cropX = (int) Math.round((scaledWidth - targetWidth) * 0.5);
        final int cropY = (int) Math.round((scaledHeight - targetHeight) * 0.5);
        final double stepX = sw / (double) scaledWidth, stepY = sh / (double) scaledHeight;

        PixelBuffer result = new PixelBuffer(targetWidth, targetHeight, channels);
        final byte[] src = source.getData(), dst = result.getData();
        int o = 0;
        for (int y = 0; y < targetHeight; y++) {
            final double fy = Math.min(Math.max((y + cropY + 0.5) * stepY - 0.5, 0.0), sh - 1);
            final int y0 = (int) fy, y1 = Math.min(y0 + 1, sh - 1);
            final double wy = fy - y0;
            for (int x = 0; x < targetWidth; x++) {
                final double fx = Math.min(Math.max((x + cropX + 0.5) * stepX - 0.5, 0.0), sw - 1);
                final int x0 = (int) fx, x1 = Math.min(x0 + 1, sw - 1);
                final double wx = fx - x0;
                final int i00 = (y0 * sw + x0) * channels, i10 = (y0 * sw + x1) * channels,
                        i01 = (y1 * sw + x0) * channels, i11 = (y1 * sw + x1) * channels;
                for (int c = 0; c < channels; c++, o++) {
                    final double top = (src[i00 + c] & 255) * (1.0 - wx) + (src[i10 + c] & 255) * wx;
                    final double bottom = (src[i01 + c] & 255) * (1.0 - wx) + (src[i11 + c] & 255) * wx;
                    dst[o] = (byte) (int) (top * (1.0 - wy) + bottom * wy + 0.5);
                }
            }
        }
        return result;
    }

    /**
     * Makes a small preview of an unprocessed source, keeping its orientation: landscape (or square) sources get a
     * longEdge by shortEdge thumbnail, portrait sources get shortEdge by longEdge.
     * @param source not modified
     * @param longEdge the longer thumbnail side, such as 400
     * @param shortEdge the shorter thumbnail side, such as 240
     * @return a new cover-resized buffer
     */
    public static PixelBuffer thumbnail(PixelBuffer source, int longEdge, int shortEdge) {
        source.validate();
        if (source.isPortrait())
            return resizeCover(source, shortEdge, longEdge);
        return resizeCover(source, longEdge, shortEdge);
    }
}
