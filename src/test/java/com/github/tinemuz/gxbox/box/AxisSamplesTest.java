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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AxisSamplesTest {

    @Test
    @DisplayName("Samples are evenly spaced and end exactly at stop")
    void evenSpacing() {
        AxisSamples s = new AxisSamples(0.0, 1.0, 5);

        assertArrayEquals(new double[] {0.0, 0.25, 0.5, 0.75, 1.0}, s.toArray(), 1e-15);
        assertEquals(0.25, s.step(), 1e-15);
    }

    @Test
    @DisplayName("Last sample equals stop without rounding drift")
    void exactStop() {
        AxisSamples s = new AxisSamples(0.1, 0.7, 7);

        assertEquals(0.7, s.get(6), 0.0);
    }

    @Test
    @DisplayName("A single sample sits at start")
    void singleSample() {
        AxisSamples s = new AxisSamples(3.0, 9.0, 1);

        assertEquals(3.0, s.get(0), 0.0);
        assertEquals(0.0, s.step(), 0.0);
    }

    @Test
    @DisplayName("Iteration can be restarted")
    void restartable() {
        AxisSamples s = new AxisSamples(-1.0, 1.0, 3);

        List<Double> first = collect(s);
        List<Double> second = collect(s);

        assertEquals(List.of(-1.0, 0.0, 1.0), first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Exhausted iterator throws")
    void exhausted() {
        Iterator<Double> it = new AxisSamples(0.0, 1.0, 1).iterator();
        it.next();

        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    @DisplayName("Count must be positive and indices in range")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new AxisSamples(0.0, 1.0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> new AxisSamples(0.0, 1.0, 2).get(2));
    }

    // Helper methods

    private static List<Double> collect(Iterable<Double> values) {
        List<Double> out = new ArrayList<>();
        for (double v : values) out.add(v);
        return out;
    }
}
