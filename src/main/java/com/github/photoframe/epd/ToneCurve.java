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
 * A two-segment power-law S-curve that lifts shadows below a pivot and compresses highlights above it. E-paper panels
 * have a narrow dynamic range, so this pulls detail out of dark regions and keeps bright ones from blowing out before
 * dithering.
 * <br>
 * For a channel value v normalized to [0, 1] and pivot m:
 * <ul>
 *     <li>v &lt;= m: {@code (v / m) ^ (1 - strength * shadowBoost) * m}</li>
 *     <li>v &gt; m: {@code m + ((v - m) / (1 - m)) ^ (1 + strength * highlightCompress) * (1 - m)}</li>
 * </ul>
 * The pivot maps to itself exactly. A strength of 0 skips the curve entirely. Any parameter values are accepted;
 * results are always clamped to [0, 1].
 * <br>
 * Instances are immutable.
 */
public class ToneCurve {
    /**
     * strength 0.9, shadowBoost 0.0, highlightCompress 1.5, midpoint 0.5.
     */
    public static final ToneCurve DEFAULT = new ToneCurve(0.9f, 0.0f, 1.5f, 0.5f);

    private final float strength;
    private final float shadowBoost;
    private final float highlightCompress;
    private final float midpoint;

    /**
     * @param strength overall strength, usually 0 to 1; 0 disables the curve
     * @param shadowBoost how much to lift shadows, usually 0 to 1
     * @param highlightCompress how much to compress highlights, usually 0.5 to 3
     * @param midpoint the pivot between the shadow and highlight segments, usually 0.3 to 0.7
     */
    public ToneCurve(float strength, float shadowBoost, float highlightCompress, float midpoint) {
        this.strength = strength;
        this.shadowBoost = shadowBoost;
        this.highlightCompress = highlightCompress;
        this.midpoint = midpoint;
    }

    public float getStrength() {
        return strength;
    }

    public float getShadowBoost() {
        return shadowBoost;
    }

    public float getHighlightCompress() {
        return highlightCompress;
    }

    public float getMidpoint() {
        return midpoint;
    }

    public boolean isBypassed() {
        return strength == 0f;
    }

    /**
     * Applies the curve to one normalized value.
     * @param normalized a channel value from 0 to 1
     * @return the mapped value, clamped to 0 to 1
     */
    public float map(float normalized) {
        if (strength == 0f)
            return normalized;
        final double v = normalized, m = midpoint;
        double result;
        if (v <= m) {
            result = Math.pow(v / m, 1.0 - strength * (double) shadowBoost) * m;
        } else {
            result = m + Math.pow((v - m) / (1.0 - m), 1.0 + strength * (double) highlightCompress) * (1.0 - m);
        }
        // 0/0 at a zero midpoint
        if (result != result)
            result = v;
        return (float) MathUtils.clamp(result, 0.0, 1.0);
    }

    /**
     * Maps one 0-255 channel value through the curve.
     */
    public int mapChannel(int value) {
        return Math.round(map(value / 255f) * 255f);
    }

    /**
     * Applies the curve to the red, green and blue channels of every pixel in {@code buffer}, in place. Does nothing
     * when strength is 0.
     * @param buffer modified in place
     */
    public void apply(PixelBuffer buffer) {
        if (strength == 0f)
            return;
        final byte[] lut = new byte[256];
        for (int i = 0; i < 256; i++) {
            lut[i] = (byte) mapChannel(i);
        }
        final byte[] data = buffer.getData();
        final int channels = buffer.getChannels();
        for (int i = 0; i < data.length; i += channels) {
            data[i] = lut[data[i] & 255];
            data[i + 1] = lut[data[i + 1] & 255];
            data[i + 2] = lut[data[i + 2] & 255];
        }
    }

    @Override
    public String toString() {
        return "ToneCurve{strength=" + strength + ", shadowBoost=" + shadowBoost
                + ", highlightCompress=" + highlightCompress + ", midpoint=" + midpoint + '}';
    }
}
