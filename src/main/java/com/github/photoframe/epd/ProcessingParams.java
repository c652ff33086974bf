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
 * Everything {@link EpdPipeline#process(PixelBuffer, ProcessingParams)} needs to know about one render: the
 * {@link ProcessingMode}, whether to paint with the panel's measured colors, and an optional calibrated palette that
 * replaces {@link Palette#MEASURED}. Immutable.
 * <br>
 * Palettes are chosen like this, where "device" is the custom palette if there is one and MEASURED otherwise:
 * <ul>
 *     <li>the output palette is device when rendering measured colors, and {@link Palette#THEORETICAL} otherwise,
 *     in both modes;</li>
 *     <li>the error palette is THEORETICAL in stock mode and device in enhanced mode.</li>
 * </ul>
 */
public class ProcessingParams {
    private final ProcessingMode mode;
    private final boolean renderMeasured;
    private final Palette customPalette;

    /**
     * @param mode stock or enhanced; null means {@link ProcessingMode#STOCK}
     * @param renderMeasured if true, write the device's measured colors instead of the nominal ones
     * @param customPalette a calibrated palette to use instead of {@link Palette#MEASURED}; may be null
     */
    public ProcessingParams(ProcessingMode mode, boolean renderMeasured, Palette customPalette) {
        this.mode = mode == null ? ProcessingMode.STOCK : mode;
        this.renderMeasured = renderMeasured;
        this.customPalette = customPalette;
    }

    public static ProcessingParams stock(boolean renderMeasured) {
        return new ProcessingParams(ProcessingMode.STOCK, renderMeasured, null);
    }

    public static ProcessingParams enhanced(boolean renderMeasured) {
        return new ProcessingParams(new ProcessingMode.Enhanced(), renderMeasured, null);
    }

    /**
     * @return a copy of these params that uses {@code palette} in place of {@link Palette#MEASURED}
     */
    public ProcessingParams withCustomPalette(Palette palette) {
        return new ProcessingParams(mode, renderMeasured, palette);
    }

    public ProcessingMode getMode() {
        return mode;
    }

    public boolean isRenderMeasured() {
        return renderMeasured;
    }

    /**
     * @return the custom palette, or null if none was given
     */
    public Palette getCustomPalette() {
        return customPalette;
    }

    public Palette devicePalette() {
        return customPalette != null ? customPalette : Palette.MEASURED;
    }

    public Palette outputPalette() {
        return renderMeasured ? devicePalette() : Palette.THEORETICAL;
    }

    public Palette errorPalette() {
        return mode.errorPalette(devicePalette());
    }

    public ColorMethod colorMethod() {
        return mode.colorMethod();
    }

    /**
     * @return a ditherer set up with this render's palettes and metric
     */
    public PaletteDitherer ditherer() {
        return new PaletteDitherer(outputPalette(), errorPalette(), colorMethod());
    }

    @Override
    public String toString() {
        return "ProcessingParams{mode=" + mode + ", renderMeasured=" + renderMeasured
                + ", palette=" + (customPalette == null ? "measured" : customPalette.getName()) + '}';
    }
}
