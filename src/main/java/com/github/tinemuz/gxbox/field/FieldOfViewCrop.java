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

import com.github.tinemuz.gxbox.box.Bounds;
import com.github.tinemuz.gxbox.grid.HelioprojectiveMapping;
import com.github.tinemuz.gxbox.grid.ScalarGrid;

/**
 * Cuts a magnetogram segment down to a field of view.
 *
 * <p>The bounds' Tx/Ty values are read directly in the grid's own
 * helioprojective frame. The kept pixels are those whose centres round into
 * the pixel range spanned by the four corners of the bounds, clipped to the
 * grid.</p>
 */
public final class FieldOfViewCrop {

    private FieldOfViewCrop() {}

    /**
     * @throws IllegalArgumentException if the grid is not helioprojective or
     *     the field of view misses it entirely
     */
    public static ScalarGrid crop(ScalarGrid grid, Bounds fov) {
        if (!(grid.mapping() instanceof HelioprojectiveMapping)) {
            throw new IllegalArgumentException(
                    "Cropping needs a helioprojective grid, got " + grid.mapping().getClass().getSimpleName());
        }
        HelioprojectiveMapping mapping = (HelioprojectiveMapping) grid.mapping();
        double minCol = Double.POSITIVE_INFINITY;
        double maxCol = Double.NEGATIVE_INFINITY;
        double minRow = Double.POSITIVE_INFINITY;
        double maxRow = Double.NEGATIVE_INFINITY;
        double[][] corners = {
            {fov.minTx(), fov.minTy()}, {fov.maxTx(), fov.minTy()},
            {fov.minTx(), fov.maxTy()}, {fov.maxTx(), fov.maxTy()}
        };
        for (double[] c : corners) {
            double[] px = mapping.worldToPixel(c[0], c[1]);
            minCol = Math.min(minCol, px[0]);
            maxCol = Math.max(maxCol, px[0]);
            minRow = Math.min(minRow, px[1]);
            maxRow = Math.max(maxRow, px[1]);
        }
        int col0 = Math.max(0, (int) Math.floor(minCol + 0.5));
        int col1 = Math.min(grid.cols(), (int) Math.floor(maxCol + 0.5) + 1);
        int row0 = Math.max(0, (int) Math.floor(minRow + 0.5));
        int row1 = Math.min(grid.rows(), (int) Math.floor(maxRow + 0.5) + 1);
        if (col1 <= col0 || row1 <= row0) {
            throw new IllegalArgumentException("Field of view " + fov + " does not overlap " + grid);
        }
        int cols = col1 - col0;
        int rows = row1 - row0;
        double[] values = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                values[r * cols + c] = grid.get(row0 + r, col0 + c);
            }
        }
        return new ScalarGrid(rows, cols, values, mapping.offset(col0, row0), grid.unit(), grid.keywords());
    }
}
