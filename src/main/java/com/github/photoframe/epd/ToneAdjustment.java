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
 * The single tone step an enhanced render applies after exposure and saturation. There are exactly two kinds, and a
 * render gets one or the other, never both: a linear {@link Contrast} stretch around middle gray, or a
 * {@link SCurve} through a {@link ToneCurve}.
 */
public abstract class ToneAdjustment {
    private ToneAdjustment() {
    }

    /**
     * Applies this adjustment to every pixel of {@code buffer}, in place.
     */
    public abstract void apply(PixelBuffer buffer);

    /**
     * @return "contrast" or "scurve", as used in settings files
     */
    public abstract String legibleName();

    /**
     * A linear stretch of each channel's distance from 128.
     */
    public static final class Contrast extends ToneAdjustment {
        private final float factor;

        public Contrast(float factor) {
            this.factor = factor;
        }

        public float getFactor() {
            return factor;
        }

        @Override
        public void apply(PixelBuffer buffer) {
            ColorAdjuster.contrast(buffer, factor);
        }

        @Override
        public String legibleName() {
            return "contrast";
        }

        @Override
        public String toString() {
            return "Contrast{" + factor + '}';
        }
    }

    /**
     * A two-segment power curve around a pivot; see {@link ToneCurve}.
     */
    public static final class SCurve extends ToneAdjustment {
        private final ToneCurve curve;

        public SCurve(ToneCurve curve) {
            this.curve = curve == null ? ToneCurve.DEFAULT : curve;
        }

        public ToneCurve getCurve() {
            return curve;
        }

        @Override
        public void apply(PixelBuffer buffer) {
            curve.apply(buffer);
        }

        @Override
        public String legibleName() {
            return "scurve";
        }

        @Override
        public String toString() {
            return "SCurve{" + curve + '}';
        }
    }
}
