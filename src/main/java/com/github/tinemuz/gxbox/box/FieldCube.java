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

import java.util.Objects;

/**
 * One component of a 3D field solution, indexed {@code (x, y, z)} with z
 * varying fastest.
 */
public final class FieldCube {
    private final int nx;
    private final int ny;
    private final int nz;
    private final double[] data;

    public FieldCube(int nx, int ny, int nz, double[] data) {
        if (nx <= 0 || ny <= 0 || nz <= 0) {
            throw new IllegalArgumentException("Cube shape must be positive");
        }
        Objects.requireNonNull(data, "data");
        if (data.length != nx * ny * nz) {
            throw new IllegalArgumentException(
                    "Expected " + nx * ny * nz + " values, got " + data.length);
        }
        this.nx = nx;
        this.ny = ny;
        this.nz = nz;
        this.data = data.clone();
    }

    public int nx() {
        return nx;
    }

    public int ny() {
        return ny;
    }

    public int nz() {
        return nz;
    }

    public double get(int x, int y, int z) {
        Objects.checkIndex(x, nx);
        Objects.checkIndex(y, ny);
        Objects.checkIndex(z, nz);
        return data[(x * ny + y) * nz + z];
    }

    public double[] data() {
        return data.clone();
    }

    public boolean sameShape(FieldCube other) {
        return nx == other.nx && ny == other.ny && nz == other.nz;
    }
}
