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

import com.github.tinemuz.gxbox.grid.ScalarGrid;
import com.github.tinemuz.gxbox.grid.ShapeMismatchException;
import com.github.tinemuz.gxbox.grid.VectorBasis;
import com.github.tinemuz.gxbox.grid.VectorGridTriple;

/**
 * Converts a vector magnetogram given as field strength, inclination and
 * azimuth into heliographic components.
 *
 * <p>The measurement is first written in the local image basis
 * (xi, eta, zeta), with zeta along the line of sight. A rotation built from
 * the grid-wide angles {@code b}, {@code p} and each pixel's longitude and
 * latitude then takes it to (phi, theta, r). See Gary and Hagyard (1990),
 * Solar Physics 126, 21.</p>
 */
public final class FieldVectorRotator {

    private FieldVectorRotator() {}

    /**
     * Local-basis components (b_xi, b_eta, b_zeta).
     *
     * @param field field strength
     * @param inclination inclination from the line of sight (deg)
     * @param azimuth disambiguated azimuth (deg)
     */
    public static VectorGridTriple toLocal(
            ScalarGrid field, ScalarGrid inclination, ScalarGrid azimuth) {
        requireCoRegistered(field, inclination, azimuth);
        int n = field.size();
        double[] bXi = new double[n];
        double[] bEta = new double[n];
        double[] bZeta = new double[n];
        for (int i = 0; i < n; i++) {
            double b = field.at(i);
            double gamma = Math.toRadians(inclination.at(i));
            double psi = Math.toRadians(azimuth.at(i));
            double sinGamma = Math.sin(gamma);
            bXi[i] = -b * sinGamma * Math.sin(psi);
            bEta[i] = b * sinGamma * Math.cos(psi);
            bZeta[i] = b * Math.cos(gamma);
        }
        return new VectorGridTriple(
                VectorBasis.LOCAL,
                field.withValues(bXi, field.unit()),
                field.withValues(bEta, field.unit()),
                field.withValues(bZeta, field.unit()));
    }

    /** Heliographic components with geometry derived from the field grid's mapping. */
    public static VectorGridTriple toHeliographic(
            ScalarGrid field, ScalarGrid inclination, ScalarGrid azimuth) {
        requireCoRegistered(field, inclination, azimuth);
        return toHeliographic(field, inclination, azimuth, RotationGeometry.of(field));
    }

    /**
     * Heliographic components (b_phi, b_theta, b_r).
     *
     * <p>The outputs carry the field grid's mapping and keywords.</p>
     *
     * @throws ShapeMismatchException if the inputs or the geometry differ in shape
     */
    public static VectorGridTriple toHeliographic(
            ScalarGrid field, ScalarGrid inclination, ScalarGrid azimuth, RotationGeometry geometry) {
        VectorGridTriple local = toLocal(field, inclination, azimuth);
        if (geometry.rows() != field.rows() || geometry.cols() != field.cols()) {
            throw new ShapeMismatchException(
                    String.format(
                            "Geometry %dx%d does not match field %dx%d",
                            geometry.rows(), geometry.cols(), field.rows(), field.cols()));
        }
        ScalarGrid xi = local.c1();
        ScalarGrid eta = local.c2();
        ScalarGrid zeta = local.c3();

        // b and p are the same for every pixel
        double b = Math.toRadians(geometry.bDeg());
        double p = Math.toRadians(geometry.pDeg());
        double sinb = Math.sin(b);
        double cosb = Math.cos(b);
        double sinp = Math.sin(p);
        double cosp = Math.cos(p);

        int n = field.size();
        double[] bPhi = new double[n];
        double[] bTheta = new double[n];
        double[] bR = new double[n];
        for (int i = 0; i < n; i++) {
            double phi = Math.toRadians(geometry.phiDeg(i));
            double lam = Math.toRadians(geometry.lambdaDeg(i));
            double sinphi = Math.sin(phi);
            double cosphi = Math.cos(phi);
            double sinlam = Math.sin(lam);
            double coslam = Math.cos(lam);

            double k11 = coslam * (sinb * sinp * cosphi + cosp * sinphi) - sinlam * cosb * sinp;
            double k12 = -coslam * (sinb * cosp * cosphi - sinp * sinphi) + sinlam * cosb * cosp;
            double k13 = coslam * cosb * cosphi + sinlam * sinb;
            double k21 = sinlam * (sinb * sinp * cosphi + cosp * sinphi) + coslam * cosb * sinp;
            double k22 = -sinlam * (sinb * cosp * cosphi - sinp * sinphi) - coslam * cosb * cosp;
            double k23 = sinlam * cosb * cosphi - coslam * sinb;
            double k31 = -sinb * sinp * sinphi + cosp * cosphi;
            double k32 = sinb * cosp * sinphi + sinp * cosphi;
            double k33 = -cosb * sinphi;

            double x = xi.at(i);
            double y = eta.at(i);
            double z = zeta.at(i);
            bPhi[i] = k31 * x + k32 * y + k33 * z;
            bTheta[i] = k21 * x + k22 * y + k23 * z;
            bR[i] = k11 * x + k12 * y + k13 * z;
        }
        return new VectorGridTriple(
                VectorBasis.HELIOGRAPHIC,
                field.withValues(bPhi, field.unit()),
                field.withValues(bTheta, field.unit()),
                field.withValues(bR, field.unit()));
    }

    private static void requireCoRegistered(
            ScalarGrid field, ScalarGrid inclination, ScalarGrid azimuth) {
        field.requireSameShape(inclination, "field and inclination");
        field.requireSameShape(azimuth, "field and azimuth");
    }
}
