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

import com.badlogic.gdx.math.MathUtils;
import com.badlogic.gdx.utils.JsonReader;
import com.badlogic.gdx.utils.JsonValue;
import com.badlogic.gdx.utils.JsonWriter;
import com.badlogic.gdx.utils.SerializationException;

/**
 * The seven color slots of a 6-color e-paper panel, stored as RGBA8888 ints with each slot's CIE L*a*b* value
 * computed once, here in the constructor. Slot {@link #RESERVED_INDEX} exists on the panel's wire format but has no
 * color; no {@link ColorMethod} will ever choose it.
 * <br>
 * Two built-in palettes matter most: {@link #THEORETICAL}, the pure colors each slot is named for (used for screen
 * previews and BMP export), and {@link #MEASURED}, the colors a real panel was observed to show (used as the
 * reference for error diffusion). A device-specific palette can stand in for MEASURED; {@link #DEVICE_DEFAULT} is the
 * calibration shipped with the frame firmware.
 * <br>
 * Palettes are immutable and can be shared freely between threads.
 */
public class Palette {
    /**
     * How many slots every palette has, reserved slot included.
     */
    public static final int SIZE = 7;
    /**
     * The slot that is never matched.
     */
    public static final int RESERVED_INDEX = 4;
    /**
     * The slot (white) returned when no slot could be compared at all.
     */
    public static final int FALLBACK_INDEX = 1;

    /**
     * Names each slot of a palette, in slot order.
     */
    public enum DisplayColor {
        BLACK("black"),
        WHITE("white"),
        YELLOW("yellow"),
        RED("red"),
        RESERVED("reserved"),
        BLUE("blue"),
        GREEN("green");

        public final String legibleName;

        DisplayColor(String name) {
            legibleName = name;
        }

        public int index() {
            return ordinal();
        }

        public static final DisplayColor[] ALL = values();
    }

    public static final Palette THEORETICAL = new Palette("theoretical", new int[]{
            0x000000FF, 0xFFFFFFFF, 0xFFFF00FF, 0xFF0000FF, 0x000000FF, 0x0000FFFF, 0x00FF00FF,
    });

    public static final Palette MEASURED = new Palette("measured", new int[]{
            0x020202FF, 0xBEBEBEFF, 0xCDCA00FF, 0x871300FF, 0x000000FF, 0x05409EFF, 0x27663CFF,
    });

    public static final Palette DEVICE_DEFAULT = new Palette("device", new int[]{
            0x0A0A0AFF, 0xC8D7E1FF, 0xE1DE08FF, 0x952417FF, 0x000000FF, 0x194CB5FF, 0x33755DFF,
    });

    private final String name;
    private final int[] paletteArray = new int[SIZE];
    /**
     * L*, a*, and b* for each slot, in that order, 3 doubles per slot.
     */
    final double[] labTable = new double[SIZE * 3];

    /**
     * @param name a label used only for logging and {@link #toString()}
     * @param rgbaPalette exactly {@link #SIZE} RGBA8888 ints; alpha is ignored
     */
    public Palette(String name, int[] rgbaPalette) {
        if (rgbaPalette == null || rgbaPalette.length != SIZE)
            throw new IllegalArgumentException("A display palette needs exactly " + SIZE + " colors, but got "
                    + (rgbaPalette == null ? "null" : String.valueOf(rgbaPalette.length)));
        this.name = name;
        for (int i = 0; i < SIZE; i++) {
            final int color = rgbaPalette[i] | 0xFF;
            paletteArray[i] = color;
            final double[] lab = ColorSpace.rgbToLab(color >>> 24, color >>> 16 & 255, color >>> 8 & 255);
            System.arraycopy(lab, 0, labTable, i * 3, 3);
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return the RGBA8888 color in the given slot
     */
    public int rgba(int index) {
        return paletteArray[index];
    }

    public int red(int index) {
        return paletteArray[index] >>> 24;
    }

    public int green(int index) {
        return paletteArray[index] >>> 16 & 255;
    }

    public int blue(int index) {
        return paletteArray[index] >>> 8 & 255;
    }

    /**
     * @return a new {L, a, b} array for the given slot, copied from the table built at construction
     */
    public double[] lab(int index) {
        return new double[]{labTable[index * 3], labTable[index * 3 + 1], labTable[index * 3 + 2]};
    }

    /**
     * @return true if {@code rgba} (alpha ignored) is the color of some slot other than the reserved one
     */
    public boolean isUsableColor(int rgba) {
        rgba |= 0xFF;
        for (int i = 0; i < SIZE; i++) {
            if (i != RESERVED_INDEX && paletteArray[i] == rgba)
                return true;
        }
        return false;
    }

    /**
     * Writes this palette in the device calibration format, an object keyed by color name with {@code r},
     * {@code g}, and {@code b} members. The reserved slot is left out.
     * @return compact JSON text
     */
    public String toJson() {
        JsonValue root = new JsonValue(JsonValue.ValueType.object);
        for (DisplayColor color : DisplayColor.ALL) {
            if (color == DisplayColor.RESERVED)
                continue;
            JsonValue entry = new JsonValue(JsonValue.ValueType.object);
            entry.addChild("r", new JsonValue(red(color.index())));
            entry.addChild("g", new JsonValue(green(color.index())));
            entry.addChild("b", new JsonValue(blue(color.index())));
            root.addChild(color.legibleName, entry);
        }
        return root.toJson(JsonWriter.OutputType.json);
    }

    /**
     * Reads a palette in the format {@link #toJson()} writes. Channel values outside 0-255 are clamped.
     * @param name the name the new palette will have
     * @param json JSON text with an entry for each of the six usable colors
     * @return a new Palette
     * @throws IllegalArgumentException if the text is not valid JSON or a color is missing
     */
    public static Palette fromJson(String name, String json) {
        final JsonValue root;
        try {
            root = new JsonReader().parse(json);
        } catch (SerializationException e) {
            throw new IllegalArgumentException("Palette JSON could not be parsed: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject())
            throw new IllegalArgumentException("Palette JSON must be an object");
        int[] colors = new int[SIZE];
        colors[RESERVED_INDEX] = 0x000000FF;
        for (DisplayColor color : DisplayColor.ALL) {
            if (color == DisplayColor.RESERVED)
                continue;
            JsonValue entry = root.get(color.legibleName);
            if (entry == null || !entry.isObject())
                throw new IllegalArgumentException("Palette JSON is missing the color " + color.legibleName);
            colors[color.index()] = channel(entry, "r") << 24 | channel(entry, "g") << 16
                    | channel(entry, "b") << 8 | 0xFF;
        }
        return new Palette(name, colors);
    }

    private static int channel(JsonValue entry, String key) {
        return MathUtils.clamp(entry.getInt(key, 0), 0, 255);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('[');
        for (int i = 0; i < SIZE; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%08X", paletteArray[i]));
        }
        return sb.append(']').toString();
    }
}
