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
import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.utils.GdxNativesLoader;

/**
 * Decodes JPEG and PNG files with libGDX's native image loader. Loading the natives happens once, when the first
 * PixmapDecoder is made, so this works from a plain command line without a running libGDX application.
 */
public class PixmapDecoder implements ImageDecoder {
    public PixmapDecoder() {
        GdxNativesLoader.load();
    }

    @Override
    public PixelBuffer decode(FileHandle file) {
        final byte[] bytes = file.readBytes();
        Pixmap pixmap = new Pixmap(bytes, 0, bytes.length);
        try {
            return PixelBuffer.fromPixmap(pixmap);
        } finally {
            pixmap.dispose();
        }
    }
}
