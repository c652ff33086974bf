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

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.ByteArray;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.StreamUtils;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes a {@link PixelBuffer} as the uncompressed 24-bit BMP that the frame firmware reads: a 14-byte file header, a
 * 40-byte BITMAPINFOHEADER, then rows from the bottom of the image up, each pixel as blue, green, red, and each row
 * padded with zeros to a multiple of 4 bytes. Resolution is recorded as 2835 pixels per meter (72 DPI).
 * <br>
 * An instance reuses its row buffer between images and so isn't thread-safe.
 */
public class BmpWriter {
    private static final int FILE_HEADER_SIZE = 14;
    private static final int INFO_HEADER_SIZE = 40;
    private static final int PIXELS_PER_METER = 2835;

    private ByteArray rowBytes;

    /**
     * @return bytes per row of pixel data, padding included
     */
    public static int rowSize(int width) {
        return (width * 3 + 3) & -4;
    }

    /**
     * @return the size of the whole file for an image of the given size
     */
    public static int fileSize(int width, int height) {
        return FILE_HEADER_SIZE + INFO_HEADER_SIZE + rowSize(width) * height;
    }

    /**
     * Writes {@code image} as a BMP file, replacing anything already there.
     */
    public void write(FileHandle file, PixelBuffer image) {
        OutputStream output = file.write(false);
        try {
            write(output, image);
        } finally {
            StreamUtils.closeQuietly(output);
        }
    }

    /**
     * @return the complete BMP file as a new byte array
     */
    public byte[] encode(PixelBuffer image) {
        ByteArrayOutputStream output = new ByteArrayOutputStream(fileSize(image.getWidth(), image.getHeight()));
        write(output, image);
        return output.toByteArray();
    }

    /**
     * Writes {@code image} as a BMP to {@code output} without closing the stream.
     * @throws GdxRuntimeException if the stream can't be written to
     */
    public void write(OutputStream output, PixelBuffer image) {
        image.validate();
        final int width = image.getWidth(), height = image.getHeight(), channels = image.getChannels();
        final int rowSize = rowSize(width);
        DataOutputStream out = new DataOutputStream(output);
        try {
            // BITMAPFILEHEADER, little-endian
            out.writeByte('B');
            out.writeByte('M');
            out.writeInt(Integer.reverseBytes(fileSize(width, height)));
            out.writeInt(0);
            out.writeInt(Integer.reverseBytes(FILE_HEADER_SIZE + INFO_HEADER_SIZE));

            // BITMAPINFOHEADER
            out.writeInt(Integer.reverseBytes(INFO_HEADER_SIZE));
            out.writeInt(Integer.reverseBytes(width));
            out.writeInt(Integer.reverseBytes(height)); // positive height means bottom-up
            out.writeShort(Short.reverseBytes((short) 1));
            out.writeShort(Short.reverseBytes((short) 24));
            out.writeInt(0); // BI_RGB
            out.writeInt(Integer.reverseBytes(rowSize * height));
            out.writeInt(Integer.reverseBytes(PIXELS_PER_METER));
            out.writeInt(Integer.reverseBytes(PIXELS_PER_METER));
            out.writeInt(0);
            out.writeInt(0);

            byte[] row;
            if (rowBytes == null) {
                row = (rowBytes = new ByteArray(rowSize)).items;
            } else {
                row = rowBytes.ensureCapacity(rowSize);
            }
            final byte[] data = image.getData();
            for (int y = height - 1; y >= 0; y--) {
                int i = y * width * channels, x = 0;
                for (int px = 0; px < width; px++, i += channels) {
                    row[x++] = data[i + 2];
                    row[x++] = data[i + 1];
                    row[x++] = data[i];
                }
                while (x < rowSize) {
                    row[x++] = 0;
                }
                out.write(row, 0, rowSize);
            }
            out.flush();
        } catch (IOException e) {
            throw new GdxRuntimeException("Error writing BMP", e);
        }
    }
}
