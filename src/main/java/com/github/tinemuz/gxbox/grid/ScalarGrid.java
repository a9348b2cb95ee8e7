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
package com.github.tinemuz.gxbox.grid;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable two-dimensional grid of one physical quantity.
 *
 * <p>Values are stored row-major ({@code rows x cols}) and copied on the way
 * in and out. The grid carries a {@link CoordinateMapping}, a unit string and
 * FITS-like header keywords such as {@link #CRLT_OBS} and {@link #CROTA2}.</p>
 */
public final class ScalarGrid {
    /** Carrington latitude of the observer, i.e. the sub-observer latitude B0 (deg). */
    public static final String CRLT_OBS = "CRLT_OBS";
    /** Instrument roll angle relative to solar north (deg). */
    public static final String CROTA2 = "CROTA2";
    /** Reference solar radius (m). */
    public static final String RSUN_REF = "RSUN_REF";

    private final int rows;
    private final int cols;
    private final double[] values;
    private final CoordinateMapping mapping;
    private final String unit;
    private final Map<String, Double> keywords;

    public ScalarGrid(
            int rows,
            int cols,
            double[] values,
            CoordinateMapping mapping,
            String unit,
            Map<String, Double> keywords) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid shape must be positive, got " + rows + "x" + cols);
        }
        Objects.requireNonNull(values, "values");
        if (values.length != rows * cols) {
            throw new ShapeMismatchException(
                    "Expected " + rows * cols + " values for a " + rows + "x" + cols
                            + " grid, got " + values.length);
        }
        this.rows = rows;
        this.cols = cols;
        this.values = values.clone();
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.unit = unit == null ? "" : unit;
        this.keywords =
                keywords == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    /** Grid from a rectangular array indexed {@code [row][col]}. */
    public static ScalarGrid of(
            double[][] data, CoordinateMapping mapping, String unit, Map<String, Double> keywords) {
        int rows = data.length;
        int cols = rows == 0 ? 0 : data[0].length;
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (data[r].length != cols) {
                throw new ShapeMismatchException("Ragged row " + r + ": " + data[r].length + " != " + cols);
            }
            System.arraycopy(data[r], 0, flat, r * cols, cols);
        }
        return new ScalarGrid(rows, cols, flat, mapping, unit, keywords);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int size() {
        return values.length;
    }

    public double get(int row, int col) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(col, cols);
        return values[row * cols + col];
    }

    /** Value at a flat row-major index. */
    public double at(int index) {
        return values[index];
    }

    /** Copy of the row-major values. */
    public double[] values() {
        return values.clone();
    }

    /** Copy of the values indexed {@code [row][col]}. */
    public double[][] toArray() {
        double[][] out = new double[rows][];
        for (int r = 0; r < rows; r++) {
            out[r] = Arrays.copyOfRange(values, r * cols, (r + 1) * cols);
        }
        return out;
    }

    public CoordinateMapping mapping() {
        return mapping;
    }

    public String unit() {
        return unit;
    }

    public Map<String, Double> keywords() {
        return keywords;
    }

    public OptionalDouble keyword(String name) {
        Double v = keywords.get(name);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public boolean sameShape(ScalarGrid other) {
        return rows == other.rows && cols == other.cols;
    }

    /**
     * @throws ShapeMismatchException if the other grid has a different shape
     */
    public void requireSameShape(ScalarGrid other, String what) {
        if (!sameShape(other)) throw ShapeMismatchException.of(what, this, other);
    }

    /** New grid with the same shape, mapping and keywords. */
    public ScalarGrid withValues(double[] newValues, String newUnit) {
        return new ScalarGrid(rows, cols, newValues, mapping, newUnit, keywords);
    }

    /** Element-wise transform keeping mapping, unit and keywords. */
    public ScalarGrid map(DoubleUnaryOperator op) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = op.applyAsDouble(values[i]);
        return new ScalarGrid(rows, cols, out, mapping, unit, keywords);
    }

    @Override
    public String toString() {
        return "ScalarGrid[" + rows + "x" + cols + ", unit=" + unit + "]";
    }
}
