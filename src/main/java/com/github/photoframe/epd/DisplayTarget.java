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
 * The canvas an image is fitted to before color processing: a panel size plus a rule for what to do with portrait
 * photos. Immutable.
 */
public class DisplayTarget {
    public static final int DEFAULT_WIDTH = 800;
    public static final int DEFAULT_HEIGHT = 480;

    /**
     * What happens when a source's orientation differs from the panel's.
     */
    public enum OrientationPolicy {
        /**
         * Portrait sources on a landscape panel are turned 90 degrees clockwise so they fill the panel, which is
         * what a frame hung in landscape needs.
         */
        ROTATE_PORTRAIT,
        /**
         * Sources are never rotated; a portrait source gets a portrait canvas with the panel's width and height
         * swapped. Used for on-screen previews.
         */
        KEEP_ORIENTATION
    }

    public static final DisplayTarget DEFAULT = new DisplayTarget(DEFAULT_WIDTH, DEFAULT_HEIGHT,
            OrientationPolicy.ROTATE_PORTRAIT);

    private final int width;
    private final int height;
    private final OrientationPolicy policy;

    public DisplayTarget(int width, int height, OrientationPolicy policy) {
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Display dimensions must be positive, but were " + width + "x" + height);
        this.width = width;
        this.height = height;
        this.policy = policy == null ? OrientationPolicy.ROTATE_PORTRAIT : policy;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public OrientationPolicy getPolicy() {
        return policy;
    }

    /**
     * @return true if a source of the given size should be rotated 90 degrees clockwise before resizing
     */
    public boolean needsRotation(int sourceWidth, int sourceHeight) {
        return policy == OrientationPolicy.ROTATE_PORTRAIT && sourceHeight > sourceWidth && width > height;
    }

    /**
     * @return the width of the canvas a source of the given size ends up on
     */
    public int canvasWidth(int sourceWidth, int sourceHeight) {
        return swapsCanvas(sourceWidth, sourceHeight) ? height : width;
    }

    /**
     * @return the height of the canvas a source of the given size ends up on
     */
    public int canvasHeight(int sourceWidth, int sourceHeight) {
        return swapsCanvas(sourceWidth, sourceHeight) ? width : height;
    }

    private boolean swapsCanvas(int sourceWidth, int sourceHeight) {
        return policy == OrientationPolicy.KEEP_ORIENTATION
                && (sourceHeight > sourceWidth) != (height > width);
    }

    @Override
    public String toString() {
        return "DisplayTarget{" + width + "x" + height + ", " + policy + '}';
    }
}
