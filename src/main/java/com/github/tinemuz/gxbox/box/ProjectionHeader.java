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
package com.github.tinemuz.gxbox.box;

import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.Point;
import com.github.tinemuz.gxbox.grid.CoordinateMapping;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cylindrical equal-area (CEA) map header in Stonyhurst coordinates.
 *
 * <p>Describes the pixel grid of the bottom face of a box. The reference
 * pixel sits at the grid centre and maps to {@code (crval1, crval2)}.
 * {@link #pixelToWorld} inverts the projection with the default
 * {@code PV2_1 = 1}, rotating the native sphere so the reference point lands
 * on the reference value.</p>
 *
 * @param rows number of rows (NAXIS2)
 * @param cols number of columns (NAXIS1)
 * @param crpix1 reference pixel along columns (one-based)
 * @param crpix2 reference pixel along rows (one-based)
 * @param crval1 Stonyhurst longitude of the reference pixel (deg)
 * @param crval2 Stonyhurst latitude of the reference pixel (deg)
 * @param cdelt1 degrees per pixel along columns
 * @param cdelt2 degrees per pixel along rows
 * @param dateObs observation time
 * @param rsunMm solar radius of the projected sphere (Mm)
 * @param rsunRefM RSUN_REF keyword (m), NaN when unset
 * @param observatory OBSRVTRY keyword
 */
public record ProjectionHeader(
        int rows,
        int cols,
        double crpix1,
        double crpix2,
        double crval1,
        double crval2,
        double cdelt1,
        double cdelt2,
        Instant dateObs,
        double rsunMm,
        double rsunRefM,
        String observatory)
        implements CoordinateMapping {

    public static final String CTYPE1 = "HGLN-CEA";
    public static final String CTYPE2 = "HGLT-CEA";

    public ProjectionHeader {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Header shape must be positive, got " + rows + "x" + cols);
        }
        Objects.requireNonNull(dateObs, "dateObs");
        Objects.requireNonNull(observatory, "observatory");
    }

    /** Header with the RSUN_REF keyword set, in meters. */
    public ProjectionHeader withRsunRef(double meters) {
        return new ProjectionHeader(
                rows, cols, crpix1, crpix2, crval1, crval2, cdelt1, cdelt2, dateObs, rsunMm, meters,
                observatory);
    }

    @Override
    public Point pixelToWorld(double col, double row) {
        double x = cdelt1 * (col + 1.0 - crpix1);
        double y = cdelt2 * (row + 1.0 - crpix2);
        double phi = Math.toRadians(x);
        double sinTheta = Math.toRadians(y);
        Instant t = dateObs;
        if (Math.abs(sinTheta) > 1.0) {
            return Point.stonyhurst(t, Double.NaN, Double.NaN, rsunMm);
        }
        double cosTheta = Math.sqrt(1.0 - sinTheta * sinTheta);
        double nx = cosTheta * Math.cos(phi);
        double ny = cosTheta * Math.sin(phi);
        double nz = sinTheta;

        // Tilt the native equator up to the reference latitude, then turn to its longitude
        double lat0 = Math.toRadians(crval2);
        double lon0 = Math.toRadians(crval1);
        double x1 = nx * Math.cos(lat0) - nz * Math.sin(lat0);
        double z1 = nx * Math.sin(lat0) + nz * Math.cos(lat0);
        double x2 = x1 * Math.cos(lon0) - ny * Math.sin(lon0);
        double y2 = x1 * Math.sin(lon0) + ny * Math.cos(lon0);
        double lon = Math.toDegrees(Math.atan2(y2, x2));
        double lat = Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, z1))));
        return new Point(Frame.stonyhurst(t).withRsun(rsunMm), lon, lat, rsunMm);
    }

    @Override
    public Instant referenceTime() {
        return dateObs;
    }

    /** FITS keywords of this header, in conventional order. */
    public Map<String, Object> toCards() {
        Map<String, Object> cards = new LinkedHashMap<>();
        cards.put("NAXIS", 2);
        cards.put("NAXIS1", cols);
        cards.put("NAXIS2", rows);
        cards.put("CTYPE1", CTYPE1);
        cards.put("CTYPE2", CTYPE2);
        cards.put("CUNIT1", "deg");
        cards.put("CUNIT2", "deg");
        cards.put("CRPIX1", crpix1);
        cards.put("CRPIX2", crpix2);
        cards.put("CRVAL1", crval1);
        cards.put("CRVAL2", crval2);
        cards.put("CDELT1", cdelt1);
        cards.put("CDELT2", cdelt2);
        cards.put("DATE-OBS", dateObs.toString());
        if (Double.isFinite(rsunRefM)) cards.put("RSUN_REF", rsunRefM);
        cards.put("OBSRVTRY", observatory);
        return cards;
    }
}
