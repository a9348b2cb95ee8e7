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

import com.github.tinemuz.gxbox.GxBoxConfig;
import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.FrameKind;
import com.github.tinemuz.gxbox.coords.Point;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A 3D analysis volume anchored on the solar surface.
 *
 * <p>The box is defined by its origin (centre of the bottom face), its
 * geometric centre, its pixel dimensions and a resolution in megameters per
 * pixel. Its working frame is heliocentric with the box origin as observer,
 * so the local z axis points radially out of the surface at the origin.</p>
 *
 * <p>All derived values are computed once in the constructor: the eight
 * corners, the twelve edges split into four bottom and eight side edges, the
 * unpadded observer-frame bounds, the sampling grid and the CEA header of
 * the bottom face. Instances are immutable.</p>
 *
 * <pre>{@code
 * ObservationContext ctx = ObservationContext.fromEarth(Instant.parse("2024-05-09T17:12:00Z"));
 * Point origin = ctx.originAt(FrameKind.HELIOPROJECTIVE, 450, -256);
 * BoxSession session = BoxSession.create(ctx, origin, new int[] {100, 100, 50}, 1.4, 0.25);
 * Bounds fov = session.fieldOfView();
 * }</pre>
 */
public final class Box {
    private static final Logger log = LoggerFactory.getLogger(Box.class);
    // numpy.allclose defaults
    private static final double RTOL = 1e-5;
    private static final double ATOL = 1e-8;

    private final Frame observingFrame;
    private final Frame workingFrame;
    private final Point origin;
    private final Point center;
    private final int[] dimsPix;
    private final double resolutionMm;
    private final double[] dims;
    private final double padFloorArcsec;
    private final List<Point3d> corners;
    private final List<BoxEdge> edges;
    private final List<BoxEdge> bottomEdges;
    private final List<BoxEdge> sideEdges;
    private final Bounds bounds;
    private final Bounds bottomBounds;
    private final SamplingGrid samplingGrid;
    private final ProjectionHeader bottomHeader;
    private final FieldModelSet fieldModels;

    /**
     * Box with the configured padding floor and no field models.
     *
     * @param observingFrame helioprojective frame bounds are reported in
     * @param origin centre of the bottom face
     * @param center geometric centre; transformed into the working frame if needed
     * @param dimsPix pixel dimensions (nx, ny, nz)
     * @param resolutionMm megameters per pixel
     */
    public Box(Frame observingFrame, Point origin, Point center, int[] dimsPix, double resolutionMm) {
        this(
                observingFrame,
                origin,
                center,
                dimsPix,
                resolutionMm,
                GxBoxConfig.defaults().padFloorArcsec(),
                FieldModelSet.empty());
    }

    /**
     * @param padFloorArcsec minimum extent used to size padding in {@link #bounds(List, double)}
     * @param fieldModels field solutions attached to the box
     */
    public Box(
            Frame observingFrame,
            Point origin,
            Point center,
            int[] dimsPix,
            double resolutionMm,
            double padFloorArcsec,
            FieldModelSet fieldModels) {
        Objects.requireNonNull(observingFrame, "observingFrame");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(center, "center");
        Objects.requireNonNull(dimsPix, "dimsPix");
        if (observingFrame.kind() != FrameKind.HELIOPROJECTIVE) {
            throw new IllegalArgumentException(
                    "Observing frame must be helioprojective, got " + observingFrame.kind());
        }
        if (dimsPix.length != 3) {
            throw new IllegalArgumentException("Box needs three pixel dimensions, got " + dimsPix.length);
        }
        for (int d : dimsPix) {
            if (d <= 0) throw new IllegalArgumentException("Pixel dimensions must be positive");
        }
        if (!(resolutionMm > 0)) {
            throw new IllegalArgumentException("Resolution must be positive, got " + resolutionMm);
        }
        this.observingFrame = observingFrame;
        this.origin = origin;
        this.dimsPix = dimsPix.clone();
        this.resolutionMm = resolutionMm;
        this.padFloorArcsec = padFloorArcsec;
        this.fieldModels = Objects.requireNonNull(fieldModels, "fieldModels");
        this.dims = new double[3];
        for (int i = 0; i < 3; i++) dims[i] = dimsPix[i] * resolutionMm;

        if (center.frame().kind() == FrameKind.HELIOCENTRIC) {
            this.center = center;
        } else {
            this.center = center.transformTo(Frame.heliocentric(origin.obstime(), origin));
        }
        this.workingFrame = this.center.frame();

        // STEP 1: corner offsets, x slowest and z fastest
        List<Point3d> arena = new ArrayList<>(8);
        for (int sx = -1; sx <= 1; sx += 2) {
            for (int sy = -1; sy <= 1; sy += 2) {
                for (int sz = -1; sz <= 1; sz += 2) {
                    arena.add(new Point3d(sx * dims[0] / 2, sy * dims[1] / 2, sz * dims[2] / 2));
                }
            }
        }
        this.corners = Collections.unmodifiableList(arena);

        // STEP 2: edges join corners that differ along exactly one axis
        double minZ = Double.POSITIVE_INFINITY;
        for (Point3d c : arena) minZ = Math.min(minZ, c.z);
        List<BoxEdge> all = new ArrayList<>(12);
        List<BoxEdge> bottom = new ArrayList<>(4);
        List<BoxEdge> side = new ArrayList<>(8);
        for (int i = 0; i < arena.size(); i++) {
            for (int j = i + 1; j < arena.size(); j++) {
                Point3d a = arena.get(i);
                Point3d b = arena.get(j);
                int differing = (a.x != b.x ? 1 : 0) + (a.y != b.y ? 1 : 0) + (a.z != b.z ? 1 : 0);
                if (differing != 1) continue;
                EdgeKind kind = a.z == minZ && b.z == minZ ? EdgeKind.BOTTOM : EdgeKind.SIDE;
                BoxEdge edge = new BoxEdge(kind, i, j, absolute(a), absolute(b));
                all.add(edge);
                (kind == EdgeKind.BOTTOM ? bottom : side).add(edge);
            }
        }
        this.edges = Collections.unmodifiableList(all);
        this.bottomEdges = Collections.unmodifiableList(bottom);
        this.sideEdges = Collections.unmodifiableList(side);

        // STEP 3: remaining derived values
        this.bounds = bounds(edges, 0.0);
        this.bottomBounds = bounds(bottomEdges, 0.0);
        this.samplingGrid =
                new SamplingGrid(
                        axis(this.center.c1(), 0), axis(this.center.c2(), 1), axis(this.center.c3(), 2),
                        workingFrame);
        this.bottomHeader = computeBottomHeader();
        log.debug(
                "Box {}x{}x{} px at {} Mm/px: {} x {} x {} Mm",
                dimsPix[0], dimsPix[1], dimsPix[2], resolutionMm, dims[0], dims[1], dims[2]);
    }

    private Point absolute(Point3d offset) {
        return Point.heliocentric(
                workingFrame, center.c1() + offset.x, center.c2() + offset.y, center.c3() + offset.z);
    }

    private AxisSamples axis(double mid, int axis) {
        return new AxisSamples(mid - dims[axis] / 2, mid + dims[axis] / 2, dimsPix[axis]);
    }

    private ProjectionHeader computeBottomHeader() {
        Point o = origin.transformTo(Frame.stonyhurst(origin.obstime()));
        // Shape is (rows, cols) = (y, x)
        int rows = (int) Math.ceil(dims[1] / resolutionMm);
        int cols = (int) Math.ceil(dims[0] / resolutionMm);
        double rsun = origin.frame().rsunMm();
        double scale = Math.toDegrees(Math.asin(resolutionMm / rsun));
        return new ProjectionHeader(
                rows,
                cols,
                (cols + 1) / 2.0,
                (rows + 1) / 2.0,
                o.c1(),
                o.c2(),
                scale,
                scale,
                origin.obstime(),
                rsun,
                rsun * 1e6,
                "None");
    }

    /**
     * Extent of a set of edges in the observing frame.
     *
     * <p>When {@code padFraction > 0} every side grows by
     * {@code padFraction * max(width, height, padFloor)}.</p>
     *
     * @throws IllegalArgumentException if no edges are given or the padding
     *         fraction is negative
     */
    public Bounds bounds(List<BoxEdge> edgeSet, double padFraction) {
        if (edgeSet.isEmpty()) {
            throw new IllegalArgumentException("No edges to bound");
        }
        if (!(padFraction >= 0)) {
            throw new IllegalArgumentException("Padding fraction must be >= 0, got " + padFraction);
        }
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (BoxEdge e : edgeSet) {
            for (Point p : List.of(e.start(), e.end())) {
                Point q = p.transformTo(observingFrame);
                minX = Math.min(minX, q.c1());
                maxX = Math.max(maxX, q.c1());
                minY = Math.min(minY, q.c2());
                maxY = Math.max(maxY, q.c2());
            }
        }
        if (padFraction > 0) {
            double pad = padFraction * Math.max(Math.max(maxX - minX, maxY - minY), padFloorArcsec);
            minX -= pad;
            maxX += pad;
            minY -= pad;
            maxY += pad;
        }
        return new Bounds(observingFrame, minX, minY, maxX, maxY);
    }

    /** Padded bounds of all edges; bottom-left and top-right via {@link Bounds#corners()}. */
    public Bounds boundsBlTr(double padFraction) {
        return bounds(edges, padFraction);
    }

    /** Unpadded bounds of all edges. */
    public Bounds bounds() {
        return bounds;
    }

    /** Unpadded bounds of the bottom edges. */
    public Bounds bottomBounds() {
        return bottomBounds;
    }

    /** First bottom edge whose endpoints share x and z, i.e. the edge along local y. */
    public Optional<BoxEdge> viewUpEdge() {
        for (BoxEdge e : bottomEdges) {
            if (close(e.start().c1(), e.end().c1()) && close(e.start().c3(), e.end().c3())) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /** First side edge whose endpoints share x and y, i.e. a vertical edge. */
    public Optional<BoxEdge> normalEdge() {
        for (BoxEdge e : sideEdges) {
            if (close(e.start().c1(), e.end().c1()) && close(e.start().c2(), e.end().c2())) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    private static boolean close(double a, double b) {
        return Math.abs(a - b) <= ATOL + RTOL * Math.abs(b);
    }

    /** Box with the given field models attached. */
    public Box withFieldModels(FieldModelSet models) {
        return new Box(observingFrame, origin, center, dimsPix, resolutionMm, padFloorArcsec, models);
    }

    public Frame observingFrame() {
        return observingFrame;
    }

    /** Heliocentric frame with the box origin as observer. */
    public Frame workingFrame() {
        return workingFrame;
    }

    public Point origin() {
        return origin;
    }

    public Point center() {
        return center;
    }

    public int[] dimsPix() {
        return dimsPix.clone();
    }

    public double resolutionMm() {
        return resolutionMm;
    }

    /** Physical dimensions (Mm): pixel dimensions times resolution. */
    public Vector3d dims() {
        return new Vector3d(dims[0], dims[1], dims[2]);
    }

    public double padFloorArcsec() {
        return padFloorArcsec;
    }

    /** Corner offsets from the centre (Mm); edges refer to them by index. */
    public List<Point3d> corners() {
        List<Point3d> copy = new ArrayList<>(corners.size());
        for (Point3d c : corners) copy.add(new Point3d(c));
        return copy;
    }

    public List<BoxEdge> edges() {
        return edges;
    }

    public List<BoxEdge> bottomEdges() {
        return bottomEdges;
    }

    public List<BoxEdge> sideEdges() {
        return sideEdges;
    }

    public SamplingGrid samplingGrid() {
        return samplingGrid;
    }

    public ProjectionHeader bottomProjectionHeader() {
        return bottomHeader;
    }

    public FieldModelSet fieldModels() {
        return fieldModels;
    }
}
