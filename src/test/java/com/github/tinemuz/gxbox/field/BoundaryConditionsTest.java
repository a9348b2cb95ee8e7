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

import com.github.tinemuz.gxbox.box.ProjectionHeader;
import com.github.tinemuz.gxbox.box.ReprojectionService;
import com.github.tinemuz.gxbox.grid.ScalarGrid;
import com.github.tinemuz.gxbox.grid.ShapeMismatchException;
import com.github.tinemuz.gxbox.grid.VectorBasis;
import com.github.tinemuz.gxbox.grid.VectorGridTriple;
import java.time.Instant;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BoundaryConditionsTest {

    private static final ProjectionHeader HEADER =
            new ProjectionHeader(
                    2, 3, 2.0, 1.5, 0.0, -3.0, 0.1, 0.1,
                    Instant.parse("2024-05-09T17:12:00Z"), 696.0, 696.0e6, "None");

    private final VectorGridTriple heliographic =
            new VectorGridTriple(
                    VectorBasis.HELIOGRAPHIC,
                    FieldVectorRotatorTest.filled(1.0),
                    FieldVectorRotatorTest.filled(2.0),
                    FieldVectorRotatorTest.filled(3.0));

    @Test
    @DisplayName("Heliographic components become box components")
    void boxBasis() {
        VectorGridTriple box = BoundaryConditions.forBox(heliographic, HEADER, constantReprojection());

        assertEquals(VectorBasis.BOX, box.basis());
        assertEquals(-2.0, box.component("bx").at(1), 1e-12);
        assertEquals(1.0, box.component("by").at(1), 1e-12);
        assertEquals(3.0, box.component("bz").at(1), 1e-12);
        assertEquals(HEADER, box.c1().mapping());
    }

    @Test
    @DisplayName("Pixels without data become zero")
    void nanToZero() {
        VectorGridTriple box = BoundaryConditions.forBox(heliographic, HEADER, constantReprojection());

        for (ScalarGrid g : box.components()) {
            assertEquals(0.0, g.at(0), "first pixel of " + g);
        }
    }

    @Test
    @DisplayName("Reprojection onto another shape is rejected")
    void shapeMismatch() {
        ReprojectionService wrong =
                (source, target) -> new ScalarGrid(1, 1, new double[] {0}, target, source.unit(), null);

        assertThrows(ShapeMismatchException.class, () -> BoundaryConditions.forBox(heliographic, HEADER, wrong));
    }

    @Test
    @DisplayName("Only heliographic triples are accepted")
    void basisChecked() {
        VectorGridTriple local =
                new VectorGridTriple(VectorBasis.LOCAL, heliographic.c1(), heliographic.c2(), heliographic.c3());

        assertThrows(
                IllegalArgumentException.class,
                () -> BoundaryConditions.forBox(local, HEADER, constantReprojection()));
    }

    // Helper methods

    // Fills the target with the source's first value and leaves pixel 0 empty
    private static ReprojectionService constantReprojection() {
        return (source, target) -> {
            double[] values = new double[target.rows() * target.cols()];
            Arrays.fill(values, source.at(0));
            values[0] = Double.NaN;
            return new ScalarGrid(target.rows(), target.cols(), values, target, source.unit(), null);
        };
    }
}
