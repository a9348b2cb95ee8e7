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
package com.github.tinemuz.gxbox.field;

import com.github.tinemuz.gxbox.GxBoxConfig;
import com.github.tinemuz.gxbox.grid.ScalarGrid;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the 180 degree ambiguity of an azimuth grid.
 *
 * <p>The disambiguation code is a per-pixel bitmask; each
 * {@link DisambiguationMethod} reads one bit. Where that bit is set the
 * azimuth is rotated by 180 degrees. Every output value is reduced into
 * {@code [0, 360)}, flipped or not.</p>
 */
public final class AzimuthDisambiguator {
    private static final Logger log = LoggerFactory.getLogger(AzimuthDisambiguator.class);

    private AzimuthDisambiguator() {}

    /** Disambiguate with the configured default method. */
    public static ScalarGrid disambiguate(ScalarGrid azimuth, ScalarGrid code) {
        return disambiguate(azimuth, code, GxBoxConfig.defaults().disambiguationMethod());
    }

    /**
     * Disambiguate with a method index; out-of-range indices fall back to
     * {@link DisambiguationMethod#RADIAL_ACUTE}.
     */
    public static ScalarGrid disambiguate(ScalarGrid azimuth, ScalarGrid code, int methodIndex) {
        return disambiguate(azimuth, code, DisambiguationMethod.fromIndex(methodIndex));
    }

    /**
     * Apply a disambiguation code to an azimuth grid.
     *
     * @param azimuth azimuth in degrees
     * @param code disambiguation bitmask; fractional values are truncated
     * @param method selects the authoritative bit
     * @return azimuth in {@code [0, 360)} with the input mapping and keywords
     * @throws com.github.tinemuz.gxbox.grid.ShapeMismatchException if the
     *         grids differ in shape
     */
    public static ScalarGrid disambiguate(
            ScalarGrid azimuth, ScalarGrid code, DisambiguationMethod method) {
        Objects.requireNonNull(method, "method");
        azimuth.requireSameShape(code, "azimuth and disambiguation images");
        int bit = method.bit();
        double[] out = azimuth.values();
        int flipped = 0;
        for (int i = 0; i < out.length; i++) {
            int c = (int) code.at(i);
            if (((c >> bit) & 1) != 0) {
                out[i] += 180.0;
                flipped++;
            }
            out[i] = reduce360(out[i]);
        }
        log.debug("Disambiguation ({}) flipped {} of {} pixels", method, flipped, out.length);
        return azimuth.withValues(out, azimuth.unit());
    }

    // Floor modulo into [0, 360)
    static double reduce360(double deg) {
        double r = deg - 360.0 * Math.floor(deg / 360.0);
        return r >= 360.0 || r == 0.0 ? 0.0 : r;
    }
}
