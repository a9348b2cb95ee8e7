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

import java.time.Instant;
import java.util.Objects;

/**
 * A position tagged with its reference frame.
 *
 * <p>The three components are interpreted by {@link FrameKind}:</p>
 * <ul>
 *   <li>helioprojective: Tx (arcsec), Ty (arcsec), distance from the observer
 *       (Mm, NaN when unknown)</li>
 *   <li>heliocentric: x, y, z (Mm)</li>
 *   <li>Stonyhurst and Carrington: longitude (deg), latitude (deg), radius (Mm)</li>
 * </ul>
 *
 * @param frame reference frame
 * @param c1 first component
 * @param c2 second component
 * @param c3 third component
 */
public record Point(Frame frame, double c1, double c2, double c3) {

    public Point {
        Objects.requireNonNull(frame, "frame");
    }

    /** Helioprojective point with unknown distance; resolved onto the solar surface on transform. */
    public static Point helioprojective(Frame frame, double txArcsec, double tyArcsec) {
        return helioprojective(frame, txArcsec, tyArcsec, Double.NaN);
    }

    public static Point helioprojective(
            Frame frame, double txArcsec, double tyArcsec, double distanceMm) {
        requireKind(frame, FrameKind.HELIOPROJECTIVE);
        return new Point(frame, txArcsec, tyArcsec, distanceMm);
    }

    public static Point heliocentric(Frame frame, double xMm, double yMm, double zMm) {
        requireKind(frame, FrameKind.HELIOCENTRIC);
        return new Point(frame, xMm, yMm, zMm);
    }

    public static Point stonyhurst(Instant obstime, double lonDeg, double latDeg, double radiusMm) {
        return new Point(Frame.stonyhurst(obstime), lonDeg, latDeg, radiusMm);
    }

    public static Point carrington(Instant obstime, double lonDeg, double latDeg, double radiusMm) {
        return new Point(Frame.carrington(obstime), lonDeg, latDeg, radiusMm);
    }

    /**
     * Express this point in another frame.
     *
     * <p>Returns {@code this} when the target equals the current frame.
     * Helioprojective points whose line of sight misses the Sun come back
     * with NaN components unless the source frame uses a spherical screen.</p>
     */
    public Point transformTo(Frame target) {
        Objects.requireNonNull(target, "target");
        if (frame.equals(target)) return this;
        return FrameTransforms.transform(this, target);
    }

    /** Observation time of the frame. */
    public Instant obstime() {
        return frame.obstime();
    }

    /** True when all three components are finite. */
    public boolean isFinite() {
        return Double.isFinite(c1) && Double.isFinite(c2) && Double.isFinite(c3);
    }

    private static void requireKind(Frame frame, FrameKind kind) {
        if (frame.kind() != kind) {
            throw new IllegalArgumentException("Expected a " + kind + " frame, got " + frame.kind());
        }
    }
}
