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
 * Conversions from sRGB to linear RGB, CIE XYZ and CIE L*a*b*, all using the D65 white point, plus the plain
 * Euclidean deltaE (CIE76) between two L*a*b* colors. Channel inputs are on the 0 to 255 scale but may be fractional,
 * since dithering matches colors that have accumulated fractional error.
 */
public final class ColorSpace {
    private ColorSpace() {
    }

    /**
     * D65 reference white, on the same 0-100 scale that {@link #rgbToXyz(double, double, double)} produces.
     */
    public static final double WHITE_X = 95.047, WHITE_Y = 100.000, WHITE_Z = 108.883;

    /**
     * Lookup table for {@link #srgbToLinear(double)} on whole channel values 0-255.
     */
    private static final double[] LINEAR_LUT = new double[256];

    static {
        for (int i = 0; i < 256; i++) {
            LINEAR_LUT[i] = decode(i / 255.0);
        }
    }

    private static double decode(double c) {
        return c > 0.04045 ? Math.pow((c + 0.055) / 1.055, 2.4) : c / 12.92;
    }

    /**
     * Decodes one sRGB channel to linear light.
     * @param channel an sRGB channel from 0 to 255; may be fractional
     * @return the linear-light value from 0 to 1
     */
    public static double srgbToLinear(double channel) {
        final int whole = (int) channel;
        if (whole == channel && whole >= 0 && whole <= 255)
            return LINEAR_LUT[whole];
        return decode(channel / 255.0);
    }

    /**
     * Converts linear RGB (each 0 to 1) to CIE XYZ scaled so Y of white is 100.
     * @return a new array of {X, Y, Z}
     */
    public static double[] linearToXyz(double r, double g, double b) {
        return new double[]{
                (r * 0.4124564 + g * 0.3575761 + b * 0.1804375) * 100.0,
                (r * 0.2126729 + g * 0.7151522 + b * 0.0721750) * 100.0,
                (r * 0.0193339 + g * 0.1191920 + b * 0.9503041) * 100.0};
    }

    /**
     * Converts an sRGB color with 0-255 channels to CIE XYZ, with Y of white at 100.
     * @return a new array of {X, Y, Z}
     */
    public static double[] rgbToXyz(double r, double g, double b) {
        return linearToXyz(srgbToLinear(r), srgbToLinear(g), srgbToLinear(b));
    }

    private static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : 7.787 * t + 16.0 / 116.0;
    }

    /**
     * Converts CIE XYZ (Y of white at 100) to CIE L*a*b* relative to D65.
     * @return a new array of {L, a, b}
     */
    public static double[] xyzToLab(double x, double y, double z) {
        final double fx = labF(x / WHITE_X);
        final double fy = labF(y / WHITE_Y);
        final double fz = labF(z / WHITE_Z);
        return new double[]{116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz)};
    }

    /**
     * Converts an sRGB color with 0-255 channels straight to CIE L*a*b*.
     * @return a new array of {L, a, b}
     */
    public static double[] rgbToLab(double r, double g, double b) {
        final double[] xyz = rgbToXyz(r, g, b);
        return xyzToLab(xyz[0], xyz[1], xyz[2]);
    }

    /**
     * The CIE76 color difference, which is just Euclidean distance in L*a*b*.
     */
    public static double deltaE(double L1, double a1, double b1, double L2, double a2, double b2) {
        final double dL = L1 - L2, da = a1 - a2, db = b1 - b2;
        return Math.sqrt(dL * dL + da * da + db * db);
    }

    /**
     * @param lab1 an {L, a, b} array
     * @param lab2 another {L, a, b} array
     * @return the Euclidean distance between lab1 and lab2
     */
    public static double deltaE(double[] lab1, double[] lab2) {
        return deltaE(lab1[0], lab1[1], lab1[2], lab2[0], lab2[1], lab2[2]);
    }
}
