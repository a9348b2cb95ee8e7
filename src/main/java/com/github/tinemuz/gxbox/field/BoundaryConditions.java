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

import com.github.tinemuz.gxbox.box.ProjectionHeader;
import com.github.tinemuz.gxbox.box.ReprojectionService;
import com.github.tinemuz.gxbox.grid.ScalarGrid;
import com.github.tinemuz.gxbox.grid.ShapeMismatchException;
import com.github.tinemuz.gxbox.grid.VectorBasis;
import com.github.tinemuz.gxbox.grid.VectorGridTriple;

/**
 * Assembles the bottom boundary of a box from heliographic magnetogram
 * components.
 */
public final class BoundaryConditions {

    private BoundaryConditions() {}

    /**
     * Reproject heliographic components onto the box bottom and express them
     * in the box basis: {@code bx = -bt}, {@code by = bp}, {@code bz = br}.
     * Pixels without data (NaN) become 0.
     *
     * @param heliographic components in the {@link VectorBasis#HELIOGRAPHIC} basis
     * @param header CEA header of the box bottom
     * @param reprojection resampling collaborator
     * @throws IllegalArgumentException if the triple is not heliographic
     * @throws ShapeMismatchException if a reprojected grid does not match the header
     */
    public static VectorGridTriple forBox(
            VectorGridTriple heliographic, ProjectionHeader header, ReprojectionService reprojection) {
        if (heliographic.basis() != VectorBasis.HELIOGRAPHIC) {
            throw new IllegalArgumentException("Expected heliographic components, got " + heliographic.basis());
        }
        ScalarGrid bp = onHeader(reprojection.reproject(heliographic.component("bp"), header), header, 1.0);
        ScalarGrid bt = onHeader(reprojection.reproject(heliographic.component("bt"), header), header, -1.0);
        ScalarGrid br = onHeader(reprojection.reproject(heliographic.component("br"), header), header, 1.0);
        return new VectorGridTriple(VectorBasis.BOX, bt, bp, br);
    }

    private static ScalarGrid onHeader(ScalarGrid grid, ProjectionHeader header, double sign) {
        if (grid.rows() != header.rows() || grid.cols() != header.cols()) {
            throw new ShapeMismatchException(
                    String.format(
                            "Reprojected grid %dx%d does not match header %dx%d",
                            grid.rows(), grid.cols(), header.rows(), header.cols()));
        }
        double[] v = grid.values();
        for (int i = 0; i < v.length; i++) {
            v[i] = Double.isNaN(v[i]) ? 0.0 : sign * v[i];
        }
        return new ScalarGrid(grid.rows(), grid.cols(), v, header, grid.unit(), grid.keywords());
    }
}
