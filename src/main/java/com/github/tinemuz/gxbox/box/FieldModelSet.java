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

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Field solutions attached to a box, keyed by model kind. Each present entry
 * maps the component names {@code bx}, {@code by}, {@code bz} to a cube of
 * one shape. Absent kinds have not been computed or loaded.
 */
public final class FieldModelSet {
    public static final List<String> COMPONENTS = List.of("bx", "by", "bz");
    private static final FieldModelSet EMPTY = new FieldModelSet(new EnumMap<>(FieldModelKind.class));

    private final Map<FieldModelKind, Map<String, FieldCube>> models;

    private FieldModelSet(EnumMap<FieldModelKind, Map<String, FieldCube>> models) {
        this.models = Collections.unmodifiableMap(models);
    }

    public static FieldModelSet empty() {
        return EMPTY;
    }

    /**
     * Copy of this set with one model replaced.
     *
     * @throws IllegalArgumentException if a component is missing or shapes differ
     */
    public FieldModelSet with(FieldModelKind kind, Map<String, FieldCube> components) {
        Objects.requireNonNull(kind, "kind");
        Map<String, FieldCube> copy = new LinkedHashMap<>();
        FieldCube first = null;
        for (String name : COMPONENTS) {
            FieldCube cube = components.get(name);
            if (cube == null) {
                throw new IllegalArgumentException("Model " + kind.tag() + " lacks component " + name);
            }
            if (first == null) {
                first = cube;
            } else if (!first.sameShape(cube)) {
                throw new IllegalArgumentException("Model " + kind.tag() + " components differ in shape");
            }
            copy.put(name, cube);
        }
        EnumMap<FieldModelKind, Map<String, FieldCube>> next = new EnumMap<>(FieldModelKind.class);
        next.putAll(models);
        next.put(kind, Collections.unmodifiableMap(copy));
        return new FieldModelSet(next);
    }

    /** Copy of this set without the given model. */
    public FieldModelSet without(FieldModelKind kind) {
        EnumMap<FieldModelKind, Map<String, FieldCube>> next = new EnumMap<>(FieldModelKind.class);
        next.putAll(models);
        next.remove(kind);
        return new FieldModelSet(next);
    }

    public Optional<Map<String, FieldCube>> get(FieldModelKind kind) {
        return Optional.ofNullable(models.get(kind));
    }

    public boolean has(FieldModelKind kind) {
        return models.containsKey(kind);
    }

    public Set<FieldModelKind> kinds() {
        return models.keySet();
    }
}
