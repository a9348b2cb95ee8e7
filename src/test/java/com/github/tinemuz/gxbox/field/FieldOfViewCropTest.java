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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.gxbox.box.Bounds;
import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.Point;
import com.github.tinemuz.gxbox.coords.SolarEphemeris;
import com.github.tinemuz.gxbox.grid.CoordinateMapping;
import com.github.tinemuz.gxbox.grid.HelioprojectiveMapping;
import com.github.tinemuz.gxbox.grid.ScalarGrid;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FieldOfViewCropTest {

    private static final Instant T = Instant.parse("2024-05-09T17:12:00Z");
    private static final Frame HPC = Frame.helioprojective(T, SolarEphemeris.earth(T));

    @Test
    @DisplayName("Only the pixels inside the field of view are kept")
    void cropsToBounds() {
        ScalarGrid grid = indexed(11);

        ScalarGrid cropped = FieldOfViewCrop.crop(grid, new Bounds(HPC, -2, -1, 2, 3));

        assertEquals(5, cropped.rows());
        assertEquals(5, cropped.cols());
        assertEquals(4 * 11 + 3, cropped.get(0, 0), 0.0);
        assertEquals(8 * 11 + 7, cropped.get(4, 4), 0.0);
    }

    @Test
    @DisplayName("The cropped mapping still points at the same sky")
    void mappingFollowsCrop() {
        ScalarGrid cropped = FieldOfViewCrop.crop(indexed(11), new Bounds(HPC, -2, -1, 2, 3));

        Point first = cropped.mapping().pixelToWorld(0, 0);

        assertEquals(-2.0, first.c1(), 1e-9);
        assertEquals(-1.0, first.c2(), 1e-9);
        assertEquals("G", cropped.unit());
        assertEquals(1.0, cropped.keyword(ScalarGrid.CRLT_OBS).orElseThrow(), 0.0);
    }

    @Test
    @DisplayName("Bounds larger than the grid are clipped to it")
    void clipsToGrid() {
        ScalarGrid grid = indexed(5);

        ScalarGrid cropped = FieldOfViewCrop.crop(grid, new Bounds(HPC, -100, -100, 1, 100));

        assertEquals(5, cropped.rows());
        assertEquals(4, cropped.cols());
        assertEquals(0.0, cropped.get(0, 0), 0.0);
    }

    @Test
    @DisplayName("A field of view off the grid is rejected")
    void noOverlap() {
        ScalarGrid grid = indexed(5);

        assertThrows(
                IllegalArgumentException.class,
                () -> FieldOfViewCrop.crop(grid, new Bounds(HPC, 50, 50, 60, 60)));
    }

    @Test
    @DisplayName("Only helioprojective grids can be cropped")
    void needsHelioprojectiveMapping() {
        CoordinateMapping other =
                new CoordinateMapping() {
                    @Override
                    public Point pixelToWorld(double col, double row) {
                        return Point.helioprojective(HPC, col, row);
                    }

                    @Override
                    public Instant referenceTime() {
                        return T;
                    }
                };
        ScalarGrid grid = new ScalarGrid(1, 1, new double[] {1}, other, "", null);

        assertThrows(
                IllegalArgumentException.class,
                () -> FieldOfViewCrop.crop(grid, new Bounds(HPC, -1, -1, 1, 1)));
    }

    // Helper methods

    // n x n grid of flat indices, one arcsec pixels centred on disk centre
    private static ScalarGrid indexed(int n) {
        double[] values = new double[n * n];
        for (int i = 0; i < values.length; i++) values[i] = i;
        double ref = (n + 1) / 2.0;
        return new ScalarGrid(
                n,
                n,
                values,
                new HelioprojectiveMapping(HPC, ref, ref, 0, 0, 1, 1, 0),
                "G",
                Map.of(ScalarGrid.CRLT_OBS, 1.0));
    }
}
