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
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.Json;
import com.badlogic.gdx.utils.JsonReader;
import com.badlogic.gdx.utils.JsonValue;
import com.badlogic.gdx.utils.JsonWriter;
import com.badlogic.gdx.utils.SerializationException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The flat, saved form of a frame's processing options, as edited by hand or sent from a configuration page. Field
 * names match the JSON keys. Use {@link #toParams(Palette)} to turn these into the {@link ProcessingParams} that the
 * pipeline takes; that is also where names like "scurve" or "lab" are checked.
 */
public class ProcessingSettings {
    public float exposure = 1.0f;
    public float saturation = 1.3f;
    /**
     * "scurve" or "contrast".
     */
    public String toneMode = "scurve";
    public float contrast = 1.0f;
    public float strength = 0.9f;
    public float shadowBoost = 0.0f;
    public float highlightCompress = 1.5f;
    public float midpoint = 0.5f;
    /**
     * "rgb" or "lab".
     */
    public String colorMethod = "rgb";
    public boolean renderMeasured = true;
    /**
     * "enhanced" or "stock".
     */
    public String processingMode = "enhanced";

    private static Json json() {
        Json json = new Json(JsonWriter.OutputType.json);
        json.setIgnoreUnknownFields(true);
        json.setUsePrototypes(false);
        return json;
    }

    /**
     * Reads settings from {@code file}. Keys missing from the file keep their defaults; a file that doesn't exist
     * gives all defaults.
     * @throws GdxRuntimeException if the file exists but can't be read or parsed
     */
    public static ProcessingSettings load(FileHandle file) {
        if (!file.exists()) {
            Logger.getGlobal().log(Level.INFO, "No settings at " + file.path() + ", using defaults");
            return new ProcessingSettings();
        }
        return fromJson(file.readString("UTF-8"));
    }

    /**
     * Parses settings, starting from the defaults and overwriting only the keys {@code text} contains.
     * @throws GdxRuntimeException if text is not a JSON object
     */
    public static ProcessingSettings fromJson(String text) {
        ProcessingSettings settings = new ProcessingSettings();
        try {
            JsonValue root = new JsonReader().parse(text);
            if (root == null || !root.isObject())
                throw new GdxRuntimeException("Processing settings must be a JSON object");
            json().readFields(settings, root);
        } catch (SerializationException e) {
            throw new GdxRuntimeException("Could not parse processing settings", e);
        }
        return settings;
    }

    public String toJson() {
        return json().toJson(this);
    }

    /**
     * Writes these settings to {@code file}, replacing what was there.
     */
    public void save(FileHandle file) {
        file.writeString(toJson(), false, "UTF-8");
    }

    /**
     * Builds the tagged params for a render.
     * @param customPalette a calibrated device palette, or null to use {@link Palette#MEASURED}
     * @throws IllegalArgumentException if processingMode, toneMode or colorMethod has an unknown value
     */
    public ProcessingParams toParams(Palette customPalette) {
        final ProcessingMode mode;
        if ("stock".equalsIgnoreCase(processingMode)) {
            mode = ProcessingMode.STOCK;
        } else if ("enhanced".equalsIgnoreCase(processingMode)) {
            final ToneAdjustment tone;
            if ("scurve".equalsIgnoreCase(toneMode))
                tone = new ToneAdjustment.SCurve(new ToneCurve(strength, shadowBoost, highlightCompress, midpoint));
            else if ("contrast".equalsIgnoreCase(toneMode))
                tone = new ToneAdjustment.Contrast(contrast);
            else
                throw new IllegalArgumentException("Unknown tone mode \"" + toneMode + "\"; expected scurve or contrast");
            mode = new ProcessingMode.Enhanced(exposure, saturation, tone, ColorMethod.forName(colorMethod));
        } else {
            throw new IllegalArgumentException("Unknown processing mode \"" + processingMode
                    + "\"; expected enhanced or stock");
        }
        return new ProcessingParams(mode, renderMeasured, customPalette);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
