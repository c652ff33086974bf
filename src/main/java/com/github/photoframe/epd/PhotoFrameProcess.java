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
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.MissingArgumentException;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.UnrecognizedOptionException;

import java.io.File;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line front end: turns one JPEG or PNG photo into a BMP ready for the frame, plus a small PNG thumbnail of
 * the unprocessed photo.
 * <pre>
 * photoframe-process [options] &lt;input&gt;
 * </pre>
 * The BMP is always 800x480, with portrait photos turned sideways, unless {@code --render-measured} is given; then the
 * measured colors are written for an on-screen preview, and portrait photos stay upright at 480x800.
 */
public class PhotoFrameProcess {
    static final String SYNTAX = "photoframe-process [options] <input>";
    static final int THUMBNAIL_LONG_EDGE = 160;
    static final int THUMBNAIL_SHORT_EDGE = 96;

    public static void main(String[] args) {
        System.exit(run(args, new PixmapDecoder()));
    }

    static Options options() {
        final Options options = new Options();
        options.addOption(new Option("h", "help", false, "Shows this help"));
        options.addOption(Option.builder("o").longOpt("output-dir").hasArg().argName("dir")
                .desc("Output directory (default: .)").build());
        options.addOption(Option.builder().longOpt("suffix").hasArg().argName("suffix")
                .desc("Suffix to add to output file names (default: none)").build());
        options.addOption(Option.builder().longOpt("no-thumbnail").desc("Skip thumbnail generation").build());
        options.addOption(Option.builder().longOpt("scurve-strength").hasArg().argName("value")
                .desc("S-curve overall strength, 0.0-1.0 (default: 0.9)").build());
        options.addOption(Option.builder().longOpt("scurve-shadow").hasArg().argName("value")
                .desc("S-curve shadow boost, 0.0-1.0 (default: 0.0)").build());
        options.addOption(Option.builder().longOpt("scurve-highlight").hasArg().argName("value")
                .desc("S-curve highlight compress, 0.5-3.0 (default: 1.5)").build());
        options.addOption(Option.builder().longOpt("scurve-midpoint").hasArg().argName("value")
                .desc("S-curve midpoint, 0.3-0.7 (default: 0.5)").build());
        options.addOption(Option.builder().longOpt("saturation").hasArg().argName("value")
                .desc("Saturation multiplier, 1.0 is unchanged (default: 1.5)").build());
        options.addOption(Option.builder().longOpt("render-measured")
                .desc("Write measured palette colors, for a darker on-screen preview").build());
        options.addOption(Option.builder().longOpt("processing-mode").hasArg().argName("mode")
                .desc("enhanced (S-curve and saturation) or stock (dithering only) (default: enhanced)").build());
        options.addOption(Option.builder().longOpt("palette").hasArg().argName("json")
                .desc("Calibrated device palette to use instead of the built-in measured colors").build());
        return options;
    }

    /**
     * Does everything {@link #main(String[])} does, returning the exit status instead of exiting.
     * @param args command line arguments
     * @param decoder reads the input photo
     * @return 0 on success, 1 on any failure
     */
    static int run(String[] args, ImageDecoder decoder) {
        final Options options = options();
        final CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (MissingArgumentException e) {
            new HelpFormatter().printHelp("Missing argument: " + e.getMessage() + "\n" + SYNTAX, options);
            return 1;
        } catch (UnrecognizedOptionException e) {
            new HelpFormatter().printHelp("Unrecognized option: " + e.getOption() + "\n" + SYNTAX, options);
            return 1;
        } catch (ParseException e) {
            new HelpFormatter().printHelp(e.getMessage() + "\n" + SYNTAX, options);
            return 1;
        }
        if (cmd.hasOption('h')) {
            new HelpFormatter().printHelp(SYNTAX, options);
            return 0;
        }
        if (cmd.getArgs().length != 1) {
            new HelpFormatter().printHelp("Exactly one input file is required\n" + SYNTAX, options);
            return 1;
        }

        final FileHandle input = new FileHandle(new File(cmd.getArgs()[0]).getAbsoluteFile());
        if (!input.exists() || input.isDirectory()) {
            System.err.println("Error: Input file not found: " + input.path());
            return 1;
        }

        final ProcessingSettings settings = new ProcessingSettings();
        final ProcessingParams params;
        try {
            settings.strength = floatOption(cmd, "scurve-strength", 0.9f);
            settings.shadowBoost = floatOption(cmd, "scurve-shadow", 0.0f);
            settings.highlightCompress = floatOption(cmd, "scurve-highlight", 1.5f);
            settings.midpoint = floatOption(cmd, "scurve-midpoint", 0.5f);
            settings.saturation = floatOption(cmd, "saturation", 1.5f);
            settings.renderMeasured = cmd.hasOption("render-measured");
            settings.processingMode = cmd.getOptionValue("processing-mode", "enhanced");
            Palette custom = null;
            if (cmd.hasOption("palette")) {
                FileHandle paletteFile = new FileHandle(new File(cmd.getOptionValue("palette")).getAbsoluteFile());
                custom = Palette.fromJson(paletteFile.nameWithoutExtension(), paletteFile.readString("UTF-8"));
            }
            params = settings.toParams(custom);
        } catch (IllegalArgumentException | GdxRuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        final FileHandle outputDir = new FileHandle(new File(cmd.getOptionValue('o', ".")).getAbsoluteFile());
        outputDir.mkdirs();
        final String base = input.nameWithoutExtension() + cmd.getOptionValue("suffix", "");
        final FileHandle bmpFile = outputDir.child(base + ".bmp");

        try {
            process(input, bmpFile, cmd.hasOption("no-thumbnail") ? null : outputDir.child(base + ".png"),
                    params, decoder);
        } catch (GdxRuntimeException e) {
            System.err.println("Error processing image: " + e.getMessage());
            Logger.getGlobal().log(Level.FINE, "Processing failed", e);
            return 1;
        }
        return 0;
    }

    private static float floatOption(CommandLine cmd, String name, float defaultValue) {
        final String value = cmd.getOptionValue(name);
        if (value == null)
            return defaultValue;
        try {
            return Float.parseFloat(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " needs a number, but got \"" + value + "\"", e);
        }
    }

    /**
     * Renders {@code input} into {@code bmpFile} and, if {@code thumbnailFile} isn't null, writes a thumbnail of the
     * unprocessed photo there.
     */
    static void process(FileHandle input, FileHandle bmpFile, FileHandle thumbnailFile, ProcessingParams params,
                        ImageDecoder decoder) {
        final Logger log = Logger.getGlobal();
        log.log(Level.INFO, "Processing: " + input.path());
        final PixelBuffer source = decoder.decode(input);
        log.log(Level.INFO, "  Original size: " + source.getWidth() + "x" + source.getHeight());

        final DisplayTarget target = new DisplayTarget(DisplayTarget.DEFAULT_WIDTH, DisplayTarget.DEFAULT_HEIGHT,
                params.isRenderMeasured()
                        ? DisplayTarget.OrientationPolicy.KEEP_ORIENTATION
                        : DisplayTarget.OrientationPolicy.ROTATE_PORTRAIT);
        if (params.getMode() instanceof ProcessingMode.Stock)
            log.log(Level.INFO, "  Using stock algorithm (no S-curve, theoretical palette)");
        else
            log.log(Level.INFO, "  Using enhanced algorithm: " + params.getMode());
        log.log(Level.INFO, params.isRenderMeasured()
                ? "  Rendering BMP with measured colors (darker output for preview)"
                : "  Rendering BMP with theoretical colors (standard output)");

        final PixelBuffer rendered = EpdPipeline.render(source, target, params);
        log.log(Level.INFO, "  Writing BMP: " + bmpFile.path());
        new BmpWriter().write(bmpFile, rendered);

        if (thumbnailFile != null) {
            log.log(Level.INFO, "  Generating thumbnail: " + thumbnailFile.path());
            PngWriter png = new PngWriter();
            try {
                png.write(thumbnailFile,
                        GeometryNormalizer.thumbnail(source, THUMBNAIL_LONG_EDGE, THUMBNAIL_SHORT_EDGE));
            } finally {
                png.dispose();
            }
        }
        log.log(Level.INFO, "Done!");
    }
}
