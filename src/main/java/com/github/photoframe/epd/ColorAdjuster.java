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
 * Per-pixel exposure, contrast and saturation adjustments. Each works on the red, green and blue channels of a
 * {@link PixelBuffer} in place, clamps its own output to 0-255, and leaves a factor of exactly 1 as a no-op.
 */
public final class ColorAdjuster {
    private ColorAdjuster() {
    }

    /**
     * Multiplies every channel by {@code exposure}, rounding and clamping to 0-255.
     */
    public static void exposure(PixelBuffer buffer, float exposure) {
        if (exposure == 1f)
            return;
        final byte[] data = buffer.getData();
        final int channels = buffer.getChannels();
        for (int i = 0; i < data.length; i += channels) {
            for (int c = 0; c < 3; c++) {
                data[i + c] = (byte) MathUtils.clamp(Math.round((data[i + c] & 255) * exposure), 0, 255);
            }
        }
    }

    /**
     * Scales each channel's distance from 128 by {@code factor}: {@code clamp((v - 128) * factor + 128, 0, 255)}.
     */
    public static void contrast(PixelBuffer buffer, float factor) {
        if (factor == 1f)
            return;
        final byte[] data = buffer.getData();
        final int channels = buffer.getChannels();
        for (int i = 0; i < data.length; i += channels) {
            for (int c = 0; c < 3; c++) {
                data[i + c] = (byte) MathUtils.clamp(Math.round(((data[i + c] & 255) - 128) * factor + 128), 0, 255);
            }
        }
    }

    /**
     * Multiplies each pixel's HSL saturation by {@code factor}, clamping saturation to [0, 1]. Pixels where all three
     * channels are equal have no hue and are left exactly as they are.
     */
    public static void saturation(PixelBuffer buffer, float factor) {
        if (factor == 1f)
            return;
        final byte[] data = buffer.getData();
        final int channels = buffer.getChannels();
        for (int i = 0; i < data.length; i += channels) {
            final int r = data[i] & 255, g = data[i + 1] & 255, b = data[i + 2] & 255;
            final int max = Math.max(r, Math.max(g, b)), min = Math.min(r, Math.min(g, b));
            if (max == min)
                continue;
            final int rgba = saturate(r, g, b, max, min, factor);
            data[i] = (byte) (rgba >>> 24);
            data[i + 1] = (byte) (rgba >>> 16);
            data[i + 2] = (byte) (rgba >>> 8);
        }
    }

    /**
     * Saturation change for a single color.
     * @return the adjusted color as RGBA8888 with full alpha; a gray input comes back unchanged
     */
    public static int saturate(int r, int g, int b, float factor) {
        final int max = Math.max(r, Math.max(g, b)), min = Math.min(r, Math.min(g, b));
        if (max == min || factor == 1f)
            return r << 24 | g << 16 | b << 8 | 0xFF;
        return saturate(r, g, b, max, min, factor);
    }

    private static int saturate(int r, int g, int b, int maxChannel, int minChannel, float factor) {
        final double max = maxChannel / 255.0, min = minChannel / 255.0;
        final double l = (max + min) * 0.5;
        final double d = max - min;
        final double s = l > 0.5 ? d / (2.0 - max - min) : d / (max + min);

        double h;
        if (maxChannel == r) {
            h = ((g - b) / 255.0 / d + (g < b ? 6 : 0)) / 6.0;
        } else if (maxChannel == g) {
            h = ((b - r) / 255.0 / d + 2) / 6.0;
        } else {
            h = ((r - g) / 255.0 / d + 4) / 6.0;
        }

        final double newS = Math.min(Math.max(s * factor, 0.0), 1.0);

        final double c = (1.0 - Math.abs(2.0 * l - 1.0)) * newS;
        final double x = c * (1.0 - Math.abs((h * 6.0) % 2.0 - 1.0));
        final double m = l - c * 0.5;

        double rp, gp, bp;
        switch ((int) Math.floor(h * 6.0)) {
            case 0:
                rp = c; gp = x; bp = 0;
                break;
            case 1:
                rp = x; gp = c; bp = 0;
                break;
            case 2:
                rp = 0; gp = c; bp = x;
                break;
            case 3:
                rp = 0; gp = x; bp = c;
                break;
            case 4:
                rp = x; gp = 0; bp = c;
                break;
            default:
                rp = c; gp = 0; bp = x;
                break;
        }
        return clamp(Math.round((rp + m) * 255.0)) << 24
                | clamp(Math.round((gp + m) * 255.0)) << 16
                | clamp(Math.round((bp + m) * 255.0)) << 8
                | 0xFF;
    }

    private static int clamp(long v) {
        return (int) Math.min(Math.max(v, 0L), 255L);
    }
}
