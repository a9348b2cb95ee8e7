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
package com.github.tinemuz.gxbox.grid;

import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.FrameKind;
import com.github.tinemuz.gxbox.coords.Point;
import java.time.Instant;
import java.util.Objects;

/**
 * FITS-style linear mapping from pixels to helioprojective angles.
 *
 * <p>Reference pixels are one-based as in FITS headers. The CROTA2 rotation
 * is applied to the scaled pixel offsets before adding the reference value.
 * The gnomonic distortion of a TAN projection is neglected; over a solar
 * field of view it is far below one pixel.</p>
 *
 * @param frame helioprojective frame of the observing instrument
 * @param crpix1 reference pixel along columns (one-based)
 * @param crpix2 reference pixel along rows (one-based)
 * @param crval1 Tx at the reference pixel (arcsec)
 * @param crval2 Ty at the reference pixel (arcsec)
 * @param cdelt1 arcsec per pixel along columns
 * @param cdelt2 arcsec per pixel along rows
 * @param crota2Deg image rotation relative to solar north (deg)
 */
public record HelioprojectiveMapping(
        Frame frame,
        double crpix1,
        double crpix2,
        double crval1,
        double crval2,
        double cdelt1,
        double cdelt2,
        double crota2Deg)
        implements CoordinateMapping {

    public HelioprojectiveMapping {
        Objects.requireNonNull(frame, "frame");
        if (frame.kind() != FrameKind.HELIOPROJECTIVE) {
            throw new IllegalArgumentException("Expected a helioprojective frame, got " + frame.kind());
        }
    }

    @Override
    public Point pixelToWorld(double col, double row) {
        double p1 = col + 1.0 - crpix1;
        double p2 = row + 1.0 - crpix2;
        double rho = Math.toRadians(crota2Deg);
        double cos = Math.cos(rho);
        double sin = Math.sin(rho);
        double x = cdelt1 * cos * p1 - cdelt2 * sin * p2;
        double y = cdelt1 * sin * p1 + cdelt2 * cos * p2;
        return Point.helioprojective(frame, crval1 + x, crval2 + y);
    }

    /**
     * Zero-based fractional pixel {@code {col, row}} of a helioprojective
     * position, the inverse of {@link #pixelToWorld}.
     */
    public double[] worldToPixel(double tx, double ty) {
        double dx = tx - crval1;
        double dy = ty - crval2;
        double rho = Math.toRadians(crota2Deg);
        double cos = Math.cos(rho);
        double sin = Math.sin(rho);
        double p1 = (cos * dx + sin * dy) / cdelt1;
        double p2 = (-sin * dx + cos * dy) / cdelt2;
        return new double[] {p1 + crpix1 - 1.0, p2 + crpix2 - 1.0};
    }

    /** Mapping of the sub-grid whose first pixel is {@code (col0, row0)} of this one. */
    public HelioprojectiveMapping offset(int col0, int row0) {
        return new HelioprojectiveMapping(
                frame, crpix1 - col0, crpix2 - row0, crval1, crval2, cdelt1, cdelt2, crota2Deg);
    }

    @Override
    public Instant referenceTime() {
        return frame.obstime();
    }
}
