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
import com.badlogic.gdx.utils.JsonValue;
import com.badlogic.gdx.utils.JsonWriter;
import com.badlogic.gdx.utils.ObjectMap;

import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * What a photo frame's image server does, without the HTTP part: hand out a random album photo rendered for the
 * panel, hand out thumbnails of the unprocessed photos, and report what it is serving. A transport layer maps
 * {@code GET /image}, {@code GET /thumbnail?file=} and {@code GET /status} onto {@link #serveRandom(String, int, int)},
 * {@link #thumbnail(String)} and {@link #status()}.
 * <br>
 * Thumbnails are cached by file name for the life of the service. All methods can be called from several threads.
 */
public class AlbumImageService {
    public static final int THUMBNAIL_LONG_EDGE = 400;
    public static final int THUMBNAIL_SHORT_EDGE = 240;

    /**
     * The encodings a processed image can be served in.
     */
    public enum ServeFormat {
        PNG("png", "image/png"),
        BMP("bmp", "image/bmp");

        public final String legibleName;
        public final String contentType;

        ServeFormat(String name, String contentType) {
            legibleName = name;
            this.contentType = contentType;
        }

        public static final ServeFormat[] ALL = values();

        /**
         * @throws IllegalArgumentException unless name is "png" or "bmp", ignoring case
         */
        public static ServeFormat forName(String name) {
            for (ServeFormat format : ALL) {
                if (format.legibleName.equalsIgnoreCase(name))
                    return format;
            }
            throw new IllegalArgumentException("Invalid serve format \"" + name + "\". Must be one of: png, bmp");
        }

        @Override
        public String toString() {
            return legibleName;
        }
    }

    /**
     * One processed image, ready to send.
     */
    public static class ServedImage {
        public final byte[] bytes;
        public final String contentType;
        /**
         * Where the unprocessed source's thumbnail can be fetched; sent as the {@code X-Thumbnail-URL} header.
         */
        public final String thumbnailUrl;
        public final AlbumLibrary.Entry entry;

        public ServedImage(byte[] bytes, String contentType, String thumbnailUrl, AlbumLibrary.Entry entry) {
            this.bytes = bytes;
            this.contentType = contentType;
            this.thumbnailUrl = thumbnailUrl;
            this.entry = entry;
        }
    }

    private final AlbumLibrary library;
    private final ImageDecoder decoder;
    private final ProcessingParams params;
    private final ServeFormat format;
    private final Random random;
    private final ObjectMap<String, byte[]> thumbnails = new ObjectMap<>();

    public AlbumImageService(AlbumLibrary library, ImageDecoder decoder, ProcessingParams params, ServeFormat format) {
        this(library, decoder, params, format, new Random());
    }

    /**
     * @param random picks which photo {@link #serveRandom(String, int, int)} renders; seed it for repeatable choices
     */
    public AlbumImageService(AlbumLibrary library, ImageDecoder decoder, ProcessingParams params, ServeFormat format,
                             Random random) {
        this.library = library;
        this.decoder = decoder;
        this.params = params;
        this.format = format == null ? ServeFormat.PNG : format;
        this.random = random;
    }

    public ServeFormat getFormat() {
        return format;
    }

    /**
     * Picks a random photo, renders it for a width by height panel that turns portrait photos sideways, and encodes
     * it in this service's format. The photo's thumbnail is cached as a side effect.
     * @param host the host (and port) clients reach this service at, used in the thumbnail URL
     * @param width panel width in pixels
     * @param height panel height in pixels
     * @throws GdxRuntimeException if the photo can't be decoded; the caller decides whether to try again
     */
    public ServedImage serveRandom(String host, int width, int height) {
        final AlbumLibrary.Entry entry;
        synchronized (random) {
            entry = library.random(random);
        }
        Logger.getGlobal().log(Level.INFO, "Processing " + entry + " for display: " + width + "x" + height);
        final PixelBuffer source = decoder.decode(entry.file);
        cacheThumbnail(entry.name, source);

        final PixelBuffer rendered = EpdPipeline.render(source,
                new DisplayTarget(width, height, DisplayTarget.OrientationPolicy.ROTATE_PORTRAIT), params);
        final byte[] bytes = encode(rendered);
        final String url = thumbnailUrl(host, entry.name);
        Logger.getGlobal().log(Level.INFO, "Served: " + entry + " (" + format.legibleName.toUpperCase()
                + ") [Thumbnail: " + url + "]");
        return new ServedImage(bytes, format.contentType, url, entry);
    }

    private byte[] encode(PixelBuffer image) {
        if (format == ServeFormat.BMP)
            return new BmpWriter().encode(image);
        PngWriter png = new PngWriter();
        try {
            return png.encode(image);
        } finally {
            png.dispose();
        }
    }

    /**
     * Gets the PNG thumbnail of the unprocessed photo with the given file name, making it if it isn't cached yet.
     * @param name a file name as it appears in the library, such as "beach.jpg"
     * @return PNG bytes, or null if no photo has that name
     */
    public byte[] thumbnail(String name) {
        if (name == null)
            return null;
        synchronized (thumbnails) {
            byte[] cached = thumbnails.get(name);
            if (cached != null) {
                Logger.getGlobal().log(Level.FINE, "Served cached thumbnail: " + name);
                return cached;
            }
        }
        final AlbumLibrary.Entry entry = library.find(name);
        if (entry == null)
            return null;
        byte[] made = cacheThumbnail(name, decoder.decode(entry.file));
        Logger.getGlobal().log(Level.INFO, "Generated thumbnail: " + entry);
        return made;
    }

    private byte[] cacheThumbnail(String name, PixelBuffer source) {
        synchronized (thumbnails) {
            byte[] cached = thumbnails.get(name);
            if (cached != null)
                return cached;
        }
        final PixelBuffer small = GeometryNormalizer.thumbnail(source, THUMBNAIL_LONG_EDGE, THUMBNAIL_SHORT_EDGE);
        PngWriter png = new PngWriter();
        final byte[] bytes;
        try {
            bytes = png.encode(small);
        } finally {
            png.dispose();
        }
        synchronized (thumbnails) {
            thumbnails.put(name, bytes);
        }
        return bytes;
    }

    /**
     * @return whether a thumbnail for the given file name is already cached
     */
    public boolean isThumbnailCached(String name) {
        synchronized (thumbnails) {
            return thumbnails.containsKey(name);
        }
    }

    /**
     * @return JSON with {@code totalImages}, {@code albums} and {@code serveFormat}
     */
    public String status() {
        JsonValue root = new JsonValue(JsonValue.ValueType.object);
        root.addChild("totalImages", new JsonValue(library.size()));
        root.addChild("albums", new JsonValue(library.albumCount()));
        root.addChild("serveFormat", new JsonValue(format.legibleName));
        return root.toJson(JsonWriter.OutputType.json);
    }

    /**
     * @return {@code http://host/thumbnail?file=} followed by the percent-encoded file name
     */
    public static String thumbnailUrl(String host, String name) {
        try {
            return "http://" + host + "/thumbnail?file=" + URLEncoder.encode(name, "UTF-8").replace("+", "%20");
        } catch (UnsupportedEncodingException e) {
            throw new GdxRuntimeException(e);
        }
    }
}
