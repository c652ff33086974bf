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

/**
 * Turns an image file into a {@link PixelBuffer} of known dimensions with at least 3 channels.
 */
public interface ImageDecoder {
    /**
     * @param file a JPEG or PNG image
     * @return a new buffer holding the whole image
     * @throws com.badlogic.gdx.utils.GdxRuntimeException if the file can't be read or decoded
     */
    PixelBuffer decode(FileHandle file);
}
