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

import com.github.tinemuz.gxbox.GxBoxConfig;
import com.github.tinemuz.gxbox.box.Bounds;
import com.github.tinemuz.gxbox.grid.GridLoader;
import com.github.tinemuz.gxbox.grid.ScalarGrid;
import com.github.tinemuz.gxbox.grid.VectorBasis;
import com.github.tinemuz.gxbox.grid.VectorGridTriple;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads vector magnetogram segments and derives heliographic products on
 * demand, caching every grid it has produced.
 *
 * <p>Segments come from the {@link GridLoader}, cropped to the field of view
 * when one is given. {@code azimuth} is returned disambiguated. Requesting any of the
 * products {@code bp}, {@code bt}, {@code br} computes all three.</p>
 */
public final class MagnetogramProducts {
    private static final Logger log = LoggerFactory.getLogger(MagnetogramProducts.class);

    public static final List<String> SEGMENTS = List.of("field", "inclination", "azimuth", "disambig");
    public static final List<String> PRODUCTS = VectorBasis.HELIOGRAPHIC.components();

    private final GridLoader loader;
    private final DisambiguationMethod method;
    private final Bounds fieldOfView;
    private final Map<String, ScalarGrid> cache = new HashMap<>();

    /** Products using the configured disambiguation method. */
    public MagnetogramProducts(GridLoader loader) {
        this(loader, DisambiguationMethod.fromIndex(GxBoxConfig.defaults().disambiguationMethod()));
    }

    public MagnetogramProducts(GridLoader loader, DisambiguationMethod method) {
        this(loader, method, null);
    }

    /**
     * Products whose segments, {@code disambig} included, are cropped to a
     * field of view.
     *
     * @param fieldOfView bounds to crop to, or {@code null} to keep full segments
     */
    public MagnetogramProducts(GridLoader loader, DisambiguationMethod method, Bounds fieldOfView) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.method = Objects.requireNonNull(method, "method");
        this.fieldOfView = fieldOfView;
    }

    /**
     * A segment or product by name.
     *
     * @throws IllegalArgumentException if the name is neither a segment nor a product
     * @throws IOException if the loader fails
     */
    public synchronized ScalarGrid get(String name) throws IOException {
        ScalarGrid cached = cache.get(name);
        if (cached != null) return cached;
        if (SEGMENTS.contains(name)) {
            return loadSegment(name);
        }
        if (PRODUCTS.contains(name)) {
            heliographic();
            return cache.get(name);
        }
        throw new IllegalArgumentException(
                "Map " + name + " is not available. Must be one of " + SEGMENTS + " or " + PRODUCTS);
    }

    /**
     * Heliographic components (bp, bt, br) of the magnetogram.
     *
     * @throws IOException if a segment cannot be loaded
     */
    public synchronized VectorGridTriple heliographic() throws IOException {
        if (cache.containsKey("bp")) {
            return new VectorGridTriple(
                    VectorBasis.HELIOGRAPHIC, cache.get("bp"), cache.get("bt"), cache.get("br"));
        }
        ScalarGrid field = get("field");
        ScalarGrid inclination = get("inclination");
        ScalarGrid azimuth = get("azimuth");
        VectorGridTriple ptr = FieldVectorRotator.toHeliographic(field, inclination, azimuth);
        cache.put("bp", ptr.c1());
        cache.put("bt", ptr.c2());
        cache.put("br", ptr.c3());
        log.debug("Derived heliographic products on a {}x{} grid", field.rows(), field.cols());
        return ptr;
    }

    public synchronized boolean isLoaded(String name) {
        return cache.containsKey(name);
    }

    public DisambiguationMethod method() {
        return method;
    }

    public Optional<Bounds> fieldOfView() {
        return Optional.ofNullable(fieldOfView);
    }

    private ScalarGrid loadSegment(String name) throws IOException {
        ScalarGrid grid = loader.load(name);
        if (fieldOfView != null) {
            ScalarGrid full = grid;
            grid = FieldOfViewCrop.crop(full, fieldOfView);
            log.debug("Cropped {} from {}x{} to {}x{}", name, full.rows(), full.cols(), grid.rows(), grid.cols());
        }
        if (name.equals("azimuth")) {
            grid = AzimuthDisambiguator.disambiguate(grid, get("disambig"), method);
        }
        cache.put(name, grid);
        return grid;
    }
}
