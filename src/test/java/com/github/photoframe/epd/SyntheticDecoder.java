package com.github.photoframe.epd;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;

/**
 * Stands in for a real image decoder in tests: ignores file contents and makes a gradient whose shape comes from the
 * file name. Names containing "portrait" give a 300x500 image, "broken" fails, anything else gives 500x300.
 */
class SyntheticDecoder implements ImageDecoder {
    int decodeCount;

    @Override
    public PixelBuffer decode(FileHandle file) {
        decodeCount++;
        if (file.name().contains("broken"))
            throw new GdxRuntimeException("Couldn't load file: " + file.name());
        final boolean portrait = file.name().contains("portrait");
        final int width = portrait ? 300 : 500, height = portrait ? 500 : 300;
        PixelBuffer buffer = new PixelBuffer(width, height, 3);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                buffer.set(x, y, 0, x * 255 / (width - 1));
                buffer.set(x, y, 1, y * 255 / (height - 1));
                buffer.set(x, y, 2, 128);
            }
        }
        return buffer;
    }
}
