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

import com.badlogic.gdx.math.MathUtils;

/**
 * Floyd-Steinberg error-diffusion dithering onto a 6-color panel, using two palettes that play different roles:
 * <ul>
 *     <li>the <em>error palette</em> decides which slot each pixel gets, and is the reference the quantization error
 *     is measured against;</li>
 *     <li>the <em>output palette</em> supplies the color actually written for that slot.</li>
 * </ul>
 * Matching against the colors the panel really shows while writing the nominal colors (or the other way around for a
 * preview) is the point of keeping them apart; if error were measured against the output palette, the accumulated
 * error would drift toward the wrong colors.
 * <br>
 * Pixels are visited strictly in row-major order, top to bottom and left to right, because each pixel's input depends
 * on error pushed forward from its left, upper-left, upper and upper-right neighbors. Error weights are the classic
 * 7/16 right, 3/16 below-left, 5/16 below and 1/16 below-right; neighbors outside the image are skipped.
 * <br>
 * A PaletteDitherer holds no per-image state, so one instance can dither many buffers, even from several threads as
 * long as each thread has its own buffer.
 */
public class PaletteDitherer {
    private final Palette outputPalette;
    private final Palette errorPalette;
    private final ColorMethod method;

    /**
     * @param outputPalette colors written to the result
     * @param errorPalette colors matched against and used as the error reference
     * @param method how to find the closest slot in errorPalette
     */
    public PaletteDitherer(Palette outputPalette, Palette errorPalette, ColorMethod method) {
        this.outputPalette = outputPalette;
        this.errorPalette = errorPalette;
        this.method = method == null ? ColorMethod.RGB : method;
    }

    public Palette getOutputPalette() {
        return outputPalette;
    }

    public Palette getErrorPalette() {
        return errorPalette;
    }

    public ColorMethod getMethod() {
        return method;
    }

    /**
     * Quantization error still waiting to be added to pixels that haven't been visited yet; three floats per pixel.
     * One is made for each call to {@link #reduceFloydSteinberg(PixelBuffer)} and dropped when it returns.
     */
    private static final class ErrorAccumulator {
        final float[] red, green, blue;
        final int width, height;

        ErrorAccumulator(int width, int height) {
            this.width = width;
            this.height = height;
            red = new float[width * height];
            green = new float[width * height];
            blue = new float[width * height];
        }

        void spread(int x, int y, float er, float eg, float eb) {
            final int i = y * width + x;
            if (x + 1 < width) {
                red[i + 1] += er * (7f / 16f);
                green[i + 1] += eg * (7f / 16f);
                blue[i + 1] += eb * (7f / 16f);
            }
            if (y + 1 < height) {
                final int below = i + width;
                if (x > 0) {
                    red[below - 1] += er * (3f / 16f);
                    green[below - 1] += eg * (3f / 16f);
                    blue[below - 1] += eb * (3f / 16f);
                }
                red[below] += er * (5f / 16f);
                green[below] += eg * (5f / 16f);
                blue[below] += eb * (5f / 16f);
                if (x + 1 < width) {
                    red[below + 1] += er * (1f / 16f);
                    green[below + 1] += eg * (1f / 16f);
                    blue[below + 1] += eb * (1f / 16f);
                }
            }
        }
    }

    /**
     * Dithers {@code buffer} in place. Afterwards, every pixel's red, green and blue are exactly the color of some
     * non-reserved slot in the output palette; any extra channels are left alone.
     * @param buffer modified in place
     * @return buffer, for chaining
     */
    public PixelBuffer reduceFloydSteinberg(PixelBuffer buffer) {
        final int w = buffer.getWidth(), h = buffer.getHeight(), channels = buffer.getChannels();
        final byte[] data = buffer.getData();
        final ErrorAccumulator error = new ErrorAccumulator(w, h);
        for (int y = 0, p = 0; y < h; y++) {
            for (int x = 0; x < w; x++, p++) {
                final int i = p * channels;
                final float r = MathUtils.clamp((data[i] & 255) + error.red[p], 0f, 255f);
                final float g = MathUtils.clamp((data[i + 1] & 255) + error.green[p], 0f, 255f);
                final float b = MathUtils.clamp((data[i + 2] & 255) + error.blue[p], 0f, 255f);

                final int index = method.closest(errorPalette, r, g, b);

                final int used = outputPalette.rgba(index);
                data[i] = (byte) (used >>> 24);
                data[i + 1] = (byte) (used >>> 16);
                data[i + 2] = (byte) (used >>> 8);

                error.spread(x, y,
                        r - errorPalette.red(index),
                        g - errorPalette.green(index),
                        b - errorPalette.blue(index));
            }
        }
        return buffer;
    }

    @Override
    public String toString() {
        return "PaletteDitherer{output=" + outputPalette.getName() + ", error=" + errorPalette.getName()
                + ", method=" + method + '}';
    }
}
