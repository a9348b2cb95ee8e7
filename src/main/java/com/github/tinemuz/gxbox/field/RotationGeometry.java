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

import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.Point;
import com.github.tinemuz.gxbox.grid.CoordinateMapping;
import com.github.tinemuz.gxbox.grid.HelioprojectiveMapping;
import com.github.tinemuz.gxbox.grid.ScalarGrid;
import com.github.tinemuz.gxbox.grid.ShapeMismatchException;
import java.util.Arrays;

/**
 * Observer geometry needed to rotate a vector magnetogram: per-pixel
 * Stonyhurst longitude and latitude, plus the grid-wide angles {@code b}
 * (sub-observer latitude) and {@code p} (negated instrument roll).
 */
public final class RotationGeometry {
    private final int rows;
    private final int cols;
    private final double[] phiDeg;
    private final double[] lambdaDeg;
    private final double bDeg;
    private final double pDeg;

    public RotationGeometry(
            int rows, int cols, double[] phiDeg, double[] lambdaDeg, double bDeg, double pDeg) {
        if (phiDeg.length != rows * cols || lambdaDeg.length != rows * cols) {
            throw new ShapeMismatchException(
                    "Longitude/latitude arrays do not match a " + rows + "x" + cols + " grid");
        }
        this.rows = rows;
        this.cols = cols;
        this.phiDeg = phiDeg.clone();
        this.lambdaDeg = lambdaDeg.clone();
        this.bDeg = bDeg;
        this.pDeg = pDeg;
    }

    /** Same longitude and latitude at every pixel. */
    public static RotationGeometry uniform(
            int rows, int cols, double phiDeg, double lambdaDeg, double bDeg, double pDeg) {
        double[] phi = new double[rows * cols];
        double[] lam = new double[rows * cols];
        Arrays.fill(phi, phiDeg);
        Arrays.fill(lam, lambdaDeg);
        return new RotationGeometry(rows, cols, phi, lam, bDeg, pDeg);
    }

    /**
     * Geometry of a grid: every pixel centre is transformed into the
     * Stonyhurst frame at the grid's reference time. Off-disk pixels get NaN.
     * {@code b} is read from {@link ScalarGrid#CRLT_OBS} and {@code p} is the
     * negated {@link ScalarGrid#CROTA2}; for a helioprojective mapping missing
     * keywords fall back to the observer latitude and the mapping rotation.
     *
     * @throws IllegalStateException if {@code b} or {@code p} cannot be determined
     */
    public static RotationGeometry of(ScalarGrid grid) {
        CoordinateMapping mapping = grid.mapping();
        Frame hgs = Frame.stonyhurst(mapping.referenceTime());
        int n = grid.size();
        double[] phi = new double[n];
        double[] lam = new double[n];
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                Point p = mapping.pixelToWorld(c, r).transformTo(hgs);
                int i = r * grid.cols() + c;
                phi[i] = p.c1();
                lam[i] = p.c2();
            }
        }
        HelioprojectiveMapping hpc =
                mapping instanceof HelioprojectiveMapping ? (HelioprojectiveMapping) mapping : null;
        double b;
        if (grid.keyword(ScalarGrid.CRLT_OBS).isPresent()) {
            b = grid.keyword(ScalarGrid.CRLT_OBS).getAsDouble();
        } else if (hpc != null) {
            b = hpc.frame().observer().c2();
        } else {
            throw new IllegalStateException("Grid has no " + ScalarGrid.CRLT_OBS + " keyword");
        }
        double roll;
        if (grid.keyword(ScalarGrid.CROTA2).isPresent()) {
            roll = grid.keyword(ScalarGrid.CROTA2).getAsDouble();
        } else if (hpc != null) {
            roll = hpc.crota2Deg();
        } else {
            throw new IllegalStateException("Grid has no " + ScalarGrid.CROTA2 + " keyword");
        }
        return new RotationGeometry(grid.rows(), grid.cols(), phi, lam, b, -roll);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    /** Stonyhurst longitude of a pixel (deg), flat row-major index. */
    public double phiDeg(int index) {
        return phiDeg[index];
    }

    /** Stonyhurst latitude of a pixel (deg), flat row-major index. */
    public double lambdaDeg(int index) {
        return lambdaDeg[index];
    }

    /** Heliographic latitude of the sub-observer point (deg). */
    public double bDeg() {
        return bDeg;
    }

    /** Negated roll angle of the instrument (deg). */
    public double pDeg() {
        return pDeg;
    }
}
