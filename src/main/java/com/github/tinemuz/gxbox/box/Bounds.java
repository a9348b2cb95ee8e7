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

import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.Point;
import java.util.List;

/**
 * Axis-aligned extent of a set of box edges in the observing frame (arcsec).
 *
 * <p>Offers both representations callers use: the bottom-left and top-right
 * corner points, or the coordinate pair {@code {{minTx, maxTx}, {minTy, maxTy}}}.</p>
 */
public record Bounds(Frame frame, double minTx, double minTy, double maxTx, double maxTy) {

    public Point bottomLeft() {
        return Point.helioprojective(frame, minTx, minTy);
    }

    public Point topRight() {
        return Point.helioprojective(frame, maxTx, maxTy);
    }

    /** Bottom-left and top-right points. */
    public List<Point> corners() {
        return List.of(bottomLeft(), topRight());
    }

    /** {@code {{minTx, maxTx}, {minTy, maxTy}}}. */
    public double[][] coordinatePair() {
        return new double[][] {{minTx, maxTx}, {minTy, maxTy}};
    }

    public double width() {
        return maxTx - minTx;
    }

    public double height() {
        return maxTy - minTy;
    }

    public boolean contains(Bounds other) {
        return other.minTx >= minTx
                && other.maxTx <= maxTx
                && other.minTy >= minTy
                && other.maxTy <= maxTy;
    }
}
