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
package com.github.tinemuz.gxbox.coords;

/**
 * Solar reference frames supported by {@link Point#transformTo(Frame)}.
 *
 * <p>Component meaning of a {@link Point} depends on the kind of its frame.</p>
 */
public enum FrameKind {
    /** Observer-centred angles: Tx, Ty (arcsec) and distance from the observer (Mm). */
    HELIOPROJECTIVE(true),
    /** Sun-centred Cartesian x, y, z (Mm), z pointing at the observer. */
    HELIOCENTRIC(true),
    /** Longitude, latitude (deg) and radius (Mm); longitude 0 faces Earth. */
    HELIOGRAPHIC_STONYHURST(false),
    /** Longitude, latitude (deg) and radius (Mm); longitude rotates with the Sun. */
    HELIOGRAPHIC_CARRINGTON(false);

    private final boolean needsObserver;

    FrameKind(boolean needsObserver) {
        this.needsObserver = needsObserver;
    }

    /** Whether frames of this kind are defined relative to an observer. */
    public boolean needsObserver() {
        return needsObserver;
    }
}
