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

import com.badlogic.gdx.utils.GdxRuntimeException;

/**
 * Thrown when a {@link PixelBuffer}'s data does not match its declared width, height and channel count. The pipeline
 * refuses to touch such a buffer.
 */
public class PixelBufferException extends GdxRuntimeException {
    public PixelBufferException(String message) {
        super(message);
    }
}
