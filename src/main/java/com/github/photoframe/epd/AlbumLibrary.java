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
import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.GdxRuntimeException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The photos available to a frame, found by scanning a directory where each sub-directory is an album. Only files
 * directly inside an album count, and only those ending in .png, .jpg, .jpeg or .heic, ignoring case. Files at the top
 * level and albums with no images are skipped. Entries are sorted by album, then by file name.
 */
public class AlbumLibrary {
    private static final String[] IMAGE_EXTENSIONS = {"png", "jpg", "jpeg", "heic"};
    private static final Comparator<FileHandle> BY_NAME = new Comparator<FileHandle>() {
        @Override
        public int compare(FileHandle a, FileHandle b) {
            return a.name().compareTo(b.name());
        }
    };

    /**
     * One image in one album.
     */
    public static class Entry {
        public final String name;
        public final String album;
        public final FileHandle file;

        public Entry(String name, String album, FileHandle file) {
            this.name = name;
            this.album = album;
            this.file = file;
        }

        @Override
        public String toString() {
            return album + '/' + name;
        }
    }

    private final Array<Entry> entries;
    private final int albumCount;

    private AlbumLibrary(Array<Entry> entries, int albumCount) {
        this.entries = entries;
        this.albumCount = albumCount;
    }

    /**
     * @param directory the directory holding one sub-directory per album
     * @return a library with at least one image
     * @throws GdxRuntimeException if directory isn't a directory or no album holds any image
     */
    public static AlbumLibrary scan(FileHandle directory) {
        if (!directory.isDirectory())
            throw new GdxRuntimeException("Album directory not found: " + directory.path());
        Logger.getGlobal().log(Level.INFO, "Scanning album directory: " + directory.path());
        FileHandle[] albums = directory.list();
        Arrays.sort(albums, BY_NAME);
        Array<Entry> entries = new Array<>(Entry.class);
        int albumCount = 0;
        for (FileHandle album : albums) {
            if (!album.isDirectory())
                continue;
            FileHandle[] files = album.list();
            Arrays.sort(files, BY_NAME);
            int found = 0;
            for (FileHandle file : files) {
                if (!file.isDirectory() && isImage(file)) {
                    entries.add(new Entry(file.name(), album.name(), file));
                    found++;
                }
            }
            if (found > 0) {
                albumCount++;
                Logger.getGlobal().log(Level.INFO, "  Album \"" + album.name() + "\": " + found + " images");
            }
        }
        if (entries.isEmpty())
            throw new GdxRuntimeException("No images found in album directory " + directory.path());
        Logger.getGlobal().log(Level.INFO, "Total images: " + entries.size + " across " + albumCount + " albums");
        return new AlbumLibrary(entries, albumCount);
    }

    static boolean isImage(FileHandle file) {
        final String extension = file.extension();
        for (String ext : IMAGE_EXTENSIONS) {
            if (ext.equalsIgnoreCase(extension))
                return true;
        }
        return false;
    }

    public int size() {
        return entries.size;
    }

    public int albumCount() {
        return albumCount;
    }

    public Entry get(int index) {
        return entries.get(index);
    }

    /**
     * @param name a file name, such as "beach.jpg"
     * @return the first entry with that file name, or null if there is none
     */
    public Entry find(String name) {
        for (int i = 0; i < entries.size; i++) {
            if (entries.get(i).name.equals(name))
                return entries.get(i);
        }
        return null;
    }

    /**
     * @return an entry chosen uniformly at random
     */
    public Entry random(Random random) {
        return entries.get(random.nextInt(entries.size));
    }
}
