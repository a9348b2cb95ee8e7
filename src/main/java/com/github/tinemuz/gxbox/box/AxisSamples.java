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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Evenly spaced samples from {@code start} to {@code stop} inclusive.
 *
 * <p>Values are computed on demand; every call to {@link #iterator()} starts
 * over. The last sample is exactly {@code stop}.</p>
 */
public final class AxisSamples implements Iterable<Double> {
    private final double start;
    private final double stop;
    private final int count;

    public AxisSamples(double start, double stop, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Sample count must be positive, got " + count);
        }
        this.start = start;
        this.stop = stop;
        this.count = count;
    }

    public double start() {
        return start;
    }

    public double stop() {
        return stop;
    }

    public int count() {
        return count;
    }

    /** Sample spacing; zero for a single sample. */
    public double step() {
        return count == 1 ? 0.0 : (stop - start) / (count - 1);
    }

    public double get(int i) {
        Objects.checkIndex(i, count);
        if (count > 1 && i == count - 1) return stop;
        return start + i * step();
    }

    public double[] toArray() {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) out[i] = get(i);
        return out;
    }

    @Override
    public Iterator<Double> iterator() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < count;
            }

            @Override
            public Double next() {
                if (next >= count) throw new NoSuchElementException();
                return get(next++);
            }
        };
    }
}
