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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FieldModelSetTest {

    @Test
    @DisplayName("Models are added and removed without touching the original")
    void withAndWithout() {
        FieldModelSet empty = FieldModelSet.empty();

        FieldModelSet pot = empty.with(FieldModelKind.POTENTIAL, components(2, 3, 4));

        assertTrue(pot.has(FieldModelKind.POTENTIAL));
        assertFalse(empty.has(FieldModelKind.POTENTIAL));
        assertEquals(Set.of(FieldModelKind.POTENTIAL), pot.kinds());
        assertFalse(pot.without(FieldModelKind.POTENTIAL).has(FieldModelKind.POTENTIAL));
        assertTrue(pot.get(FieldModelKind.NLFFF).isEmpty());
    }

    @Test
    @DisplayName("Every component is required")
    void missingComponent() {
        Map<String, FieldCube> partial = Map.of("bx", cube(2, 2, 2), "by", cube(2, 2, 2));

        assertThrows(IllegalArgumentException.class, () -> FieldModelSet.empty().with(FieldModelKind.NLFFF, partial));
    }

    @Test
    @DisplayName("Components must share one shape")
    void shapeMismatch() {
        Map<String, FieldCube> mixed = Map.of("bx", cube(2, 2, 2), "by", cube(2, 2, 2), "bz", cube(2, 2, 3));

        assertThrows(IllegalArgumentException.class, () -> FieldModelSet.empty().with(FieldModelKind.NLFFF, mixed));
    }

    @Test
    @DisplayName("Cube values are indexed with z fastest")
    void cubeIndexing() {
        FieldCube c = new FieldCube(2, 3, 4, sequence(24));

        assertEquals(0.0, c.get(0, 0, 0));
        assertEquals(1.0, c.get(0, 0, 1));
        assertEquals(4.0, c.get(0, 1, 0));
        assertEquals(12.0, c.get(1, 0, 0));
        assertEquals(23.0, c.get(1, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> new FieldCube(2, 3, 4, new double[23]));
    }

    @Test
    @DisplayName("Model tags round-trip")
    void tags() {
        assertEquals(FieldModelKind.POTENTIAL, FieldModelKind.fromTag("pot"));
        assertEquals(FieldModelKind.NLFFF, FieldModelKind.fromTag(FieldModelKind.NLFFF.tag()));
        assertThrows(IllegalArgumentException.class, () -> FieldModelKind.fromTag("bnd"));
    }

    // Helper methods

    private static Map<String, FieldCube> components(int nx, int ny, int nz) {
        return Map.of("bx", cube(nx, ny, nz), "by", cube(nx, ny, nz), "bz", cube(nx, ny, nz));
    }

    private static FieldCube cube(int nx, int ny, int nz) {
        return new FieldCube(nx, ny, nz, new double[nx * ny * nz]);
    }

    private static double[] sequence(int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = i;
        return out;
    }
}
