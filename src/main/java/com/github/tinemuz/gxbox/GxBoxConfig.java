/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.gxbox;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default parameters for box construction and magnetogram processing.
 *
 * <p>Values are read from the classpath resource <code>gxbox.properties</code>
 * the first time {@link #defaults()} is called. A missing or malformed file is
 * reported as an {@link IllegalStateException}. Tests and embedding
 * applications can parse an explicit stream with {@link #load(InputStream)}.</p>
 */
public final class GxBoxConfig {
    private static final Logger log = LoggerFactory.getLogger(GxBoxConfig.class);
    private static final String RESOURCE = "gxbox.properties";
    private static volatile GxBoxConfig defaults;

    private final double solarRadiusMm;
    private final double resolutionMm;
    private final int[] dimsPix;
    private final double padFraction;
    private final double padFloorArcsec;
    private final int disambiguationMethod;

    private GxBoxConfig(
            double solarRadiusMm,
            double resolutionMm,
            int[] dimsPix,
            double padFraction,
            double padFloorArcsec,
            int disambiguationMethod) {
        this.solarRadiusMm = solarRadiusMm;
        this.resolutionMm = resolutionMm;
        this.dimsPix = dimsPix;
        this.padFraction = padFraction;
        this.padFloorArcsec = padFloorArcsec;
        this.disambiguationMethod = disambiguationMethod;
    }

    /**
     * Configuration loaded from the classpath. Safe to call repeatedly; the
     * first caller reads the resource.
     *
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static GxBoxConfig defaults() {
        GxBoxConfig cfg = defaults;
        if (cfg != null) return cfg;
        synchronized (GxBoxConfig.class) {
            if (defaults == null) {
                defaults = loadFromResource();
            }
            return defaults;
        }
    }

    private static GxBoxConfig loadFromResource() {
        InputStream in = GxBoxConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Configuration file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException(
                    "Configuration file '" + RESOURCE + "' not found on classpath");
        }
        return load(in);
    }

    /**
     * Parse configuration from a properties stream. The stream is closed.
     *
     * @throws IllegalStateException if the stream cannot be read or a value
     *         is missing or not a number
     */
    public static GxBoxConfig load(InputStream in) {
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.error("Failed to read configuration", e);
            throw new IllegalStateException("Failed to read configuration", e);
        }
        try {
            GxBoxConfig cfg =
                    new GxBoxConfig(
                            positive(props, "solar.radius.mm"),
                            positive(props, "box.resolution.mm"),
                            parseDims(required(props, "box.dims.pix")),
                            Double.parseDouble(required(props, "box.pad.fraction")),
                            Double.parseDouble(required(props, "box.pad.floor.arcsec")),
                            Integer.parseInt(required(props, "disambiguation.method")));
            log.debug(
                    "Loaded configuration: rsun={} Mm, resolution={} Mm, pad floor={} arcsec",
                    cfg.solarRadiusMm,
                    cfg.resolutionMm,
                    cfg.padFloorArcsec);
            return cfg;
        } catch (RuntimeException e) {
            log.error("Failed to parse configuration", e);
            throw new IllegalStateException("Failed to parse configuration", e);
        }
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing configuration key '" + key + "'");
        }
        return value.trim();
    }

    private static double positive(Properties props, String key) {
        double v = Double.parseDouble(required(props, key));
        if (!(v > 0)) {
            throw new IllegalArgumentException(key + " must be positive, got " + v);
        }
        return v;
    }

    private static int[] parseDims(String value) {
        String[] toks = value.split("\\s*,\\s*");
        if (toks.length != 3) {
            throw new IllegalArgumentException("box.dims.pix needs three integers, got " + value);
        }
        int[] dims = new int[3];
        for (int i = 0; i < 3; i++) dims[i] = Integer.parseInt(toks[i]);
        return dims;
    }

    /** Solar radius in megameters used for box origins and CEA scale. */
    public double solarRadiusMm() {
        return solarRadiusMm;
    }

    /** Default box resolution in megameters per pixel. */
    public double resolutionMm() {
        return resolutionMm;
    }

    /** Default box pixel dimensions (nx, ny, nz). */
    public int[] dimsPix() {
        return dimsPix.clone();
    }

    /** Default fractional padding of the field of view. */
    public double padFraction() {
        return padFraction;
    }

    /** Minimum extent, in observer-frame arcsec, used when sizing padding. */
    public double padFloorArcsec() {
        return padFloorArcsec;
    }

    /** Default disambiguation bit index (not yet clamped). */
    public int disambiguationMethod() {
        return disambiguationMethod;
    }
}
