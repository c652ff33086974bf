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
import com.badlogic.gdx.utils.Disposable;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.StreamUtils;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;

/**
 * Writes a {@link PixelBuffer} as an 8-bit truecolor PNG (color type 2, no alpha), reading red, green and blue from
 * each pixel and ignoring any extra channels. Used for thumbnails and for serving processed images as PNG. An
 * instance can be reused to encode many images with little allocation, but isn't thread-safe; call
 * {@link #dispose()} when done with it.
 * <br>
 * Rows are written top to bottom with no filtering, using a fast deflate level by default.
 * <br>
 * <pre>
 * Copyright (c) 2007 Matthias Mann - www.matthiasmann.de
 * Copyright (c) 2014 Nathan Sweet
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 * </pre>
 */
public class PngWriter implements Disposable {
    private static final byte[] SIGNATURE = {(byte) 137, 80, 78, 71, 13, 10, 26, 10};
    private static final int IHDR = 0x49484452;
    private static final int IDAT = 0x49444154;
    private static final int IEND = 0x49454E44;
    private static final byte COLOR_RGB = 2;
    private static final byte COMPRESSION_DEFLATE = 0;
    private static final byte FILTER_NONE = 0;
    private static final byte INTERLACE_NONE = 0;

    private final ChunkBuffer buffer;
    private final Deflater deflater;
    private ByteArray curLineBytes;

    public PngWriter() {
        this(1024);
    }

    /**
     * @param initialBufferSize the starting size of the buffer that holds one PNG chunk; it grows as needed
     */
    public PngWriter(int initialBufferSize) {
        buffer = new ChunkBuffer(initialBufferSize);
        deflater = new Deflater(2);
    }

    /**
     * Sets the deflate level, from 0 (no compression, fastest) to 9 (smallest, slowest). Default is 2.
     */
    public void setCompression(int level) {
        deflater.setLevel(level);
    }

    /**
     * Writes {@code image} as a PNG file, replacing anything already there.
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
     * @return the complete PNG file as a new byte array
     */
    public byte[] encode(PixelBuffer image) {
        ByteArrayOutputStream output = new ByteArrayOutputStream(image.getWidth() * image.getHeight() + 64);
        write(output, image);
        return output.toByteArray();
    }

    /**
     * Writes {@code image} as a PNG to {@code output} without closing the stream.
     * @throws GdxRuntimeException if the stream can't be written to
     */
    public void write(OutputStream output, PixelBuffer image) {
        image.validate();
        DeflaterOutputStream deflaterOutput = new DeflaterOutputStream(buffer, deflater);
        DataOutputStream dataOutput = new DataOutputStream(output);
        try {
            dataOutput.write(SIGNATURE);

            final int width = image.getWidth(), height = image.getHeight(), channels = image.getChannels();
            buffer.writeInt(IHDR);
            buffer.writeInt(width);
            buffer.writeInt(height);
            buffer.writeByte(8); // 8 bits per component.
            buffer.writeByte(COLOR_RGB);
            buffer.writeByte(COMPRESSION_DEFLATE);
            buffer.writeByte(FILTER_NONE);
            buffer.writeByte(INTERLACE_NONE);
            buffer.endChunk(dataOutput);

            buffer.writeInt(IDAT);
            deflater.reset();

            final int lineLen = width * 3;
            byte[] curLine;
            if (curLineBytes == null) {
                curLine = (curLineBytes = new ByteArray(lineLen)).items;
            } else {
                curLine = curLineBytes.ensureCapacity(lineLen);
            }

            final byte[] data = image.getData();
            for (int y = 0, i = 0; y < height; y++) {
                if (channels == 3) {
                    System.arraycopy(data, i, curLine, 0, lineLen);
                    i += lineLen;
                } else {
                    for (int x = 0; x < lineLen; i += channels) {
                        curLine[x++] = data[i];
                        curLine[x++] = data[i + 1];
                        curLine[x++] = data[i + 2];
                    }
                }
                deflaterOutput.write(FILTER_NONE);
                deflaterOutput.write(curLine, 0, lineLen);
            }
            deflaterOutput.finish();
            buffer.endChunk(dataOutput);

            buffer.writeInt(IEND);
            buffer.endChunk(dataOutput);

            output.flush();
        } catch (IOException e) {
            throw new GdxRuntimeException("Error writing PNG", e);
        }
    }

    /**
     * Frees the native memory the deflater holds. Don't use this PngWriter after calling this.
     */
    @Override
    public void dispose() {
        deflater.end();
    }

    /**
     * Collects one chunk's type and data so that its length and CRC can be written before and after it.
     */
    static class ChunkBuffer extends DataOutputStream {
        final ByteArrayOutputStream buffer;
        final CRC32 crc;

        ChunkBuffer(int initialSize) {
            this(new ByteArrayOutputStream(initialSize), new CRC32());
        }

        private ChunkBuffer(ByteArrayOutputStream buffer, CRC32 crc) {
            super(new CheckedOutputStream(buffer, crc));
            this.buffer = buffer;
            this.crc = crc;
        }

        void endChunk(DataOutputStream target) throws IOException {
            flush();
            target.writeInt(buffer.size() - 4);
            buffer.writeTo(target);
            target.writeInt((int) crc.getValue());
            buffer.reset();
            crc.reset();
        }
    }
}
