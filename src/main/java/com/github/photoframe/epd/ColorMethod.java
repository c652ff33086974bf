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

/**
 * The two ways a color can be matched to its closest {@link Palette} slot. Both skip
 * {@link Palette#RESERVED_INDEX}, both return exactly one slot index (never a blend), and both return
 * {@link Palette#FALLBACK_INDEX} (white) if nothing could be compared, such as when the input is NaN.
 */
public enum ColorMethod {
    /**
     * Squared Euclidean distance between raw sRGB channel values. Fast, and what the panel's stock firmware uses.
     */
    RGB("rgb") {
        @Override
        public int closest(Palette palette, float r, float g, float b) {
            double best = Double.POSITIVE_INFINITY;
            int closest = Palette.FALLBACK_INDEX;
            for (int i = 0; i < Palette.SIZE; i++) {
                if (i == Palette.RESERVED_INDEX) continue;
                final double dr = r - palette.red(i), dg = g - palette.green(i), db = b - palette.blue(i);
                final double dist = dr * dr + dg * dg + db * db;
                if (dist < best) {
                    best = dist;
                    closest = i;
                }
            }
            return closest;
        }
    },
    /**
     * CIE76 deltaE in L*a*b*, compared against the table the palette built when it was constructed; only the input
     * color is converted per call.
     */
    LAB("lab") {
        @Override
        public int closest(Palette palette, float r, float g, float b) {
            final double[] lab = ColorSpace.rgbToLab(r, g, b);
            final double[] table = palette.labTable;
            double best = Double.POSITIVE_INFINITY;
            int closest = Palette.FALLBACK_INDEX;
            for (int i = 0; i < Palette.SIZE; i++) {
                if (i == Palette.RESERVED_INDEX) continue;
                final double dist = ColorSpace.deltaE(lab[0], lab[1], lab[2],
                        table[i * 3], table[i * 3 + 1], table[i * 3 + 2]);
                if (dist < best) {
                    best = dist;
                    closest = i;
                }
            }
            return closest;
        }
    };

    /**
     * The name used for this method in settings files and on the command line.
     */
    public final String legibleName;

    ColorMethod(String name) {
        legibleName = name;
    }

    /**
     * Finds the slot in {@code palette} closest to the given color.
     * @param palette the palette to search
     * @param r red, from 0 to 255; may be fractional
     * @param g green, from 0 to 255; may be fractional
     * @param b blue, from 0 to 255; may be fractional
     * @return a slot index from 0 to 6, never {@link Palette#RESERVED_INDEX}
     */
    public abstract int closest(Palette palette, float r, float g, float b);

    public static final ColorMethod[] ALL = values();

    /**
     * @param name "rgb" or "lab", ignoring case
     * @throws IllegalArgumentException for any other name
     */
    public static ColorMethod forName(String name) {
        for (ColorMethod method : ALL) {
            if (method.legibleName.equalsIgnoreCase(name))
                return method;
        }
        throw new IllegalArgumentException("Unknown color method \"" + name + "\"; expected rgb or lab");
    }

    @Override
    public String toString() {
        return legibleName;
    }
}
