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

import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.math.MathUtils;

import java.util.Arrays;

/**
 * A flat, mutable block of 8-bit channel values in row-major order, with at least 3 color channels per pixel (red,
 * green, blue, and optionally extra channels such as alpha that the pipeline carries along but never reads). This is
 * the type that every stage of {@link EpdPipeline} reads and writes; it is passed by reference and edited in place.
 * <br>
 * Only {@link GeometryNormalizer} produces a buffer with new dimensions. Every later stage keeps the width and height
 * it was given. A PixelBuffer must not be shared between two pipeline invocations that run at the same time.
 */
public class PixelBuffer {
    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    /**
     * Allocates a zero-filled (black) buffer.
     * @param width width in pixels; must be positive
     * @param height height in pixels; must be positive
     * @param channels channels per pixel; must be at least 3
     */
    public PixelBuffer(int width, int height, int channels) {
        this(width, height, channels, allocate(width, height, channels));
    }

    /**
     * Wraps {@code data} without copying it. The length of data must be exactly
     * {@code width * height * channels}.
     * @param width width in pixels; must be positive
     * @param height height in pixels; must be positive
     * @param channels channels per pixel; must be at least 3
     * @param data channel bytes, treated as unsigned
     * @throws PixelBufferException if the dimensions and data length disagree
     */
    public PixelBuffer(int width, int height, int channels, byte[] data) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
        validate();
    }

    private static byte[] allocate(int width, int height, int channels) {
        if (width <= 0 || height <= 0 || channels < 3)
            throw new PixelBufferException("Cannot allocate a " + width + "x" + height + " buffer with "
                    + channels + " channels");
        return new byte[width * height * channels];
    }

    /**
     * Checks that this buffer's backing array is exactly as long as its dimensions say it should be.
     * @throws PixelBufferException if the buffer is malformed
     */
    public void validate() {
        if (width <= 0 || height <= 0)
            throw new PixelBufferException("Buffer dimensions must be positive, but were " + width + "x" + height);
        if (channels < 3)
            throw new PixelBufferException("Buffer needs at least 3 channels, but has " + channels);
        if (data == null)
            throw new PixelBufferException("Buffer has no pixel data");
        if ((long) width * height * channels != data.length)
            throw new PixelBufferException("Buffer of " + width + "x" + height + "x" + channels + " needs "
                    + ((long) width * height * channels) + " bytes, but has " + data.length);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * The backing array, in row-major order with {@link #getChannels()} bytes per pixel. Changes to it are changes
     * to this buffer.
     * @return the backing array, not a copy
     */
    public byte[] getData() {
        return data;
    }

    public boolean isPortrait() {
        return height > width;
    }

    /**
     * @return the array offset of the first channel of pixel (x, y)
     */
    public int offset(int x, int y) {
        return (y * width + x) * channels;
    }

    /**
     * @return channel {@code c} of pixel (x, y), from 0 to 255
     */
    public int get(int x, int y, int c) {
        return data[(y * width + x) * channels + c] & 255;
    }

    /**
     * Sets channel {@code c} of pixel (x, y), clamping {@code value} to the 0 to 255 range.
     */
    public void set(int x, int y, int c, int value) {
        data[(y * width + x) * channels + c] = (byte) MathUtils.clamp(value, 0, 255);
    }

    /**
     * Gets the color at (x, y) as an RGBA8888 int, the same layout libGDX's Pixmap uses. Alpha is always 255.
     */
    public int getRGBA(int x, int y) {
        final int i = (y * width + x) * channels;
        return (data[i] & 255) << 24 | (data[i + 1] & 255) << 16 | (data[i + 2] & 255) << 8 | 0xFF;
    }

    /**
     * Sets the red, green and blue channels at (x, y) from an RGBA8888 int; alpha in rgba is ignored.
     */
    public void setRGBA(int x, int y, int rgba) {
        final int i = (y * width + x) * channels;
        data[i] = (byte) (rgba >>> 24);
        data[i + 1] = (byte) (rgba >>> 16);
        data[i + 2] = (byte) (rgba >>> 8);
    }

    /**
     * Fills every pixel with the given color; channels past the third are set to 255.
     * @return this, for chaining
     */
    public PixelBuffer fill(int r, int g, int b) {
        for (int i = 0; i < data.length; i += channels) {
            data[i] = (byte) r;
            data[i + 1] = (byte) g;
            data[i + 2] = (byte) b;
            for (int c = 3; c < channels; c++)
                data[i + c] = (byte) 255;
        }
        return this;
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, channels, Arrays.copyOf(data, data.length));
    }

    /**
     * Copies a Pixmap's pixels into a new 3-channel buffer. The Pixmap is not disposed.
     * @param pixmap any Pixmap; its format does not matter because pixels are read as RGBA8888
     * @return a new 3-channel PixelBuffer with the same dimensions as pixmap
     */
    public static PixelBuffer fromPixmap(Pixmap pixmap) {
        final int w = pixmap.getWidth(), h = pixmap.getHeight();
        PixelBuffer buffer = new PixelBuffer(w, h, 3);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                buffer.setRGBA(x, y, pixmap.getPixel(x, y));
            }
        }
        return buffer;
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + width + "x" + height + "x" + channels + '}';
    }
}
