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
 * How much work a render does before dithering, and which palette the ditherer measures its error against.
 * <ul>
 *     <li>{@link Stock} skips every color adjustment and dithers with the RGB metric against
 *     {@link Palette#THEORETICAL}.</li>
 *     <li>{@link Enhanced} runs exposure, then saturation, then one {@link ToneAdjustment}, and dithers with its own
 *     {@link ColorMethod} against the device palette.</li>
 * </ul>
 */
public abstract class ProcessingMode {
    private ProcessingMode() {
    }

    /**
     * Adjusts colors before dithering. May do nothing.
     */
    public abstract void adjust(PixelBuffer buffer);

    /**
     * @param device the measured palette, or a custom palette standing in for it
     * @return the palette to match against and to measure error from
     */
    public abstract Palette errorPalette(Palette device);

    public abstract ColorMethod colorMethod();

    /**
     * @return "stock" or "enhanced", as used in settings files and on the command line
     */
    public abstract String legibleName();

    public static final Stock STOCK = new Stock();

    /**
     * Dithering only.
     */
    public static final class Stock extends ProcessingMode {
        private Stock() {
        }

        @Override
        public void adjust(PixelBuffer buffer) {
        }

        @Override
        public Palette errorPalette(Palette device) {
            return Palette.THEORETICAL;
        }

        @Override
        public ColorMethod colorMethod() {
            return ColorMethod.RGB;
        }

        @Override
        public String legibleName() {
            return "stock";
        }

        @Override
        public String toString() {
            return "Stock";
        }
    }

    /**
     * Exposure, saturation and tone adjustment, then dithering against the device's own colors.
     */
    public static final class Enhanced extends ProcessingMode {
        private final float exposure;
        private final float saturation;
        private final ToneAdjustment tone;
        private final ColorMethod method;

        /**
         * Exposure 1.0, saturation 1.3, the default S-curve, and RGB matching.
         */
        public Enhanced() {
            this(1.0f, 1.3f, new ToneAdjustment.SCurve(ToneCurve.DEFAULT), ColorMethod.RGB);
        }

        public Enhanced(float exposure, float saturation, ToneAdjustment tone, ColorMethod method) {
            this.exposure = exposure;
            this.saturation = saturation;
            this.tone = tone == null ? new ToneAdjustment.SCurve(ToneCurve.DEFAULT) : tone;
            this.method = method == null ? ColorMethod.RGB : method;
        }

        public float getExposure() {
            return exposure;
        }

        public float getSaturation() {
            return saturation;
        }

        public ToneAdjustment getTone() {
            return tone;
        }

        @Override
        public void adjust(PixelBuffer buffer) {
            ColorAdjuster.exposure(buffer, exposure);
            ColorAdjuster.saturation(buffer, saturation);
            tone.apply(buffer);
        }

        @Override
        public Palette errorPalette(Palette device) {
            return device;
        }

        @Override
        public ColorMethod colorMethod() {
            return method;
        }

        @Override
        public String legibleName() {
            return "enhanced";
        }

        @Override
        public String toString() {
            return "Enhanced{exposure=" + exposure + ", saturation=" + saturation + ", tone=" + tone
                    + ", method=" + method + '}';
        }
    }
}
