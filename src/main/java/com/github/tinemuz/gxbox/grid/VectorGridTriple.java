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
import java.util.Objects;

/**
 * Three co-registered grids holding one vector field in a named basis.
 *
 * @param basis basis the components are expressed in
 * @param c1 first component (see {@link VectorBasis#components()})
 * @param c2 second component
 * @param c3 third component
 */
public record VectorGridTriple(VectorBasis basis, ScalarGrid c1, ScalarGrid c2, ScalarGrid c3) {

    public VectorGridTriple {
        Objects.requireNonNull(basis, "basis");
        Objects.requireNonNull(c1, "c1");
        Objects.requireNonNull(c2, "c2");
        Objects.requireNonNull(c3, "c3");
        c1.requireSameShape(c2, "vector components");
        c1.requireSameShape(c3, "vector components");
        if (!c1.mapping().equals(c2.mapping()) || !c1.mapping().equals(c3.mapping())) {
            throw new IllegalArgumentException("Vector components must share one coordinate mapping");
        }
    }

    /** Component by name, e.g. {@code "br"} for a heliographic triple. */
    public ScalarGrid component(String name) {
        List<String> names = basis.components();
        int i = names.indexOf(name);
        if (i < 0) {
            throw new IllegalArgumentException(
                    "No component '" + name + "' in basis " + basis + "; expected one of " + names);
        }
        return i == 0 ? c1 : i == 1 ? c2 : c3;
    }

    public List<ScalarGrid> components() {
        return List.of(c1, c2, c3);
    }
}
