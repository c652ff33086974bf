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
 * Runs the stages in order: {@link GeometryNormalizer} (only from {@link #render(PixelBuffer, DisplayTarget,
 * ProcessingParams)}), then the mode's color adjustments, then {@link PaletteDitherer}. Holds no state between calls,
 * so any number of renders can run at once on different buffers.
 */
public final class EpdPipeline {
    private EpdPipeline() {
    }

    /**
     * Adjusts and dithers {@code buffer} in place. The buffer keeps its dimensions.
     * @param buffer a well-formed buffer, already at the panel's size
     * @param params the render's mode and palettes
     * @throws PixelBufferException if the buffer's data length disagrees with its dimensions
     */
    public static void process(PixelBuffer buffer, ProcessingParams params) {
        buffer.validate();
        final ProcessingMode mode = params.getMode();
        final long start = System.nanoTime();
        mode.adjust(buffer);
        final PaletteDitherer ditherer = params.ditherer();
        Logger.getGlobal().log(Level.FINE, "Dithering " + buffer.getWidth() + "x" + buffer.getHeight()
                + " with " + ditherer);
        ditherer.reduceFloydSteinberg(buffer);
        Logger.getGlobal().log(Level.INFO, "Processed " + buffer.getWidth() + "x" + buffer.getHeight() + " image in "
                + mode.legibleName() + " mode in " + (System.nanoTime() - start) / 1000000L + " ms");
    }

    /**
     * Fits {@code source} to {@code target} and then processes the result.
     * @param source the decoded image; not modified
     * @param target panel size and orientation policy
     * @param params the render's mode and palettes
     * @return a new buffer at the canvas size, containing only output palette colors
     */
    public static PixelBuffer render(PixelBuffer source, DisplayTarget target, ProcessingParams params) {
        PixelBuffer fitted = GeometryNormalizer.normalize(source, target);
        process(fitted, params);
        return fitted;
    }
}
