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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Which bit of the disambiguation code decides a 180 degree flip.
 */
public enum DisambiguationMethod {
    /** Bit 0: azimuth closest to the potential-field azimuth. */
    POTENTIAL_ACUTE(0),
    /** Bit 1: random choice. */
    RANDOM(1),
    /** Bit 2: field closest to radial. */
    RADIAL_ACUTE(2);

    private static final Logger log = LoggerFactory.getLogger(DisambiguationMethod.class);

    private final int bit;

    DisambiguationMethod(int bit) {
        this.bit = bit;
    }

    /** Bit index within the disambiguation code. */
    public int bit() {
        return bit;
    }

    /**
     * Method for a bit index. Indices outside 0..2 fall back to
     * {@link #RADIAL_ACUTE} with a warning.
     */
    public static DisambiguationMethod fromIndex(int index) {
        for (DisambiguationMethod m : values()) {
            if (m.bit == index) return m;
        }
        log.warn("Invalid disambiguation method {}, set to default method = {}", index, RADIAL_ACUTE.bit);
        return RADIAL_ACUTE;
    }
}
