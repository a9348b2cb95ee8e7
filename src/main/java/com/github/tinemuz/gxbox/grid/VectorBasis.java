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

import java.util.List;

/**
 * Named bases for a {@link VectorGridTriple}, with component names in
 * storage order.
 */
public enum VectorBasis {
    /** Local image-plane basis of the inversion: xi, eta, zeta (line of sight). */
    LOCAL("b_xi", "b_eta", "b_zeta"),
    /** Heliographic basis: longitude, colatitude and radial components. */
    HELIOGRAPHIC("bp", "bt", "br"),
    /** Box-aligned Cartesian basis used as a solver boundary. */
    BOX("bx", "by", "bz");

    private final List<String> components;

    VectorBasis(String c1, String c2, String c3) {
        this.components = List.of(c1, c2, c3);
    }

    /** Component names in storage order. */
    public List<String> components() {
        return components;
    }
}
