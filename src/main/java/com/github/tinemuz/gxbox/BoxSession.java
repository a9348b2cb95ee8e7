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
package com.github.tinemuz.gxbox;

import com.github.tinemuz.gxbox.box.Bounds;
import com.github.tinemuz.gxbox.box.Box;
import com.github.tinemuz.gxbox.box.BoxEdge;
import com.github.tinemuz.gxbox.box.FieldModelSet;
import com.github.tinemuz.gxbox.box.ProjectionHeader;
import com.github.tinemuz.gxbox.box.ReprojectionService;
import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.FrameTransforms;
import com.github.tinemuz.gxbox.coords.Point;
import com.github.tinemuz.gxbox.field.BoundaryConditions;
import com.github.tinemuz.gxbox.field.DisambiguationMethod;
import com.github.tinemuz.gxbox.field.MagnetogramProducts;
import com.github.tinemuz.gxbox.grid.GridLoader;
import com.github.tinemuz.gxbox.grid.VectorGridTriple;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import javax.vecmath.Vector3d;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One box analysis: the observation context, the box built around an
 * origin on the surface, and the frames and field of view derived from them.
 *
 * <p>The box centre lies half the box height above the origin along the
 * local vertical, i.e. the z axis of the heliocentric frame whose observer is
 * the origin itself.</p>
 */
public final class BoxSession {
    private static final Logger log = LoggerFactory.getLogger(BoxSession.class);

    private final ObservationContext context;
    private final Frame observingFrame;
    private final Frame workingFrame;
    private final Box box;
    private final Bounds fieldOfView;
    private final double padFraction;

    private BoxSession(
            ObservationContext context,
            Frame observingFrame,
            Frame workingFrame,
            Box box,
            double padFraction) {
        this.context = context;
        this.observingFrame = observingFrame;
        this.workingFrame = workingFrame;
        this.box = box;
        this.padFraction = padFraction;
        this.fieldOfView = box.boundsBlTr(padFraction);
    }

    /** Session using the configured default dimensions, resolution and padding. */
    public static BoxSession create(ObservationContext context, Point origin) {
        GxBoxConfig cfg = GxBoxConfig.defaults();
        return create(context, origin, cfg.dimsPix(), cfg.resolutionMm(), cfg.padFraction());
    }

    /**
     * Build the box for an origin.
     *
     * @param context observation time and observer
     * @param origin centre of the box bottom, in any frame
     * @param dimsPix pixel dimensions (nx, ny, nz)
     * @param resolutionMm megameters per pixel
     * @param padFraction fractional padding of the field of view
     */
    public static BoxSession create(
            ObservationContext context,
            Point origin,
            int[] dimsPix,
            double resolutionMm,
            double padFraction) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(origin, "origin");
        Frame observing = context.observingFrame();
        Frame working = Frame.heliocentric(context.time(), origin);
        Point local = origin.transformTo(working);
        if (!local.isFinite()) {
            throw new IllegalArgumentException("Box origin " + origin + " does not lie on the Sun");
        }
        double height = dimsPix.length == 3 ? dimsPix[2] * resolutionMm : Double.NaN;
        Point center = Point.heliocentric(working, local.c1(), local.c2(), local.c3() + height / 2);
        Box box = new Box(observing, origin, center, dimsPix, resolutionMm);
        BoxSession session = new BoxSession(context, observing, working, box, padFraction);
        for (Point corner : session.fieldOfView.corners()) {
            if (!FrameTransforms.isOnSolarDisk(corner)) {
                log.warn(
                        "Some of the box corners are not on the solar disk ({}, {} arcsec). "
                                + "Please check the box dimensions.",
                        String.format("%.1f", corner.c1()),
                        String.format("%.1f", corner.c2()));
                break;
            }
        }
        return session;
    }

    /** Session whose box carries the given field models. */
    public BoxSession withFieldModels(FieldModelSet models) {
        return new BoxSession(context, observingFrame, workingFrame, box.withFieldModels(models), padFraction);
    }

    /**
     * Unit vector from Sun centre to the box origin, in heliocentric
     * coordinates of the observer.
     */
    public Vector3d normalDirection() {
        Vector3d v = FrameTransforms.toHeliocentric(box.origin(), context.observer());
        v.normalize();
        return v;
    }

    /**
     * Unit vector along the view-up edge of the box bottom, in heliocentric
     * coordinates of the observer, oriented so that its y component is
     * positive. Empty when the box has no view-up edge.
     */
    public Optional<Vector3d> viewUpDirection() {
        Optional<BoxEdge> edge = box.viewUpEdge();
        if (edge.isEmpty()) return Optional.empty();
        Vector3d a = FrameTransforms.toHeliocentric(edge.get().start(), context.observer());
        Vector3d b = FrameTransforms.toHeliocentric(edge.get().end(), context.observer());
        Vector3d d = new Vector3d();
        d.sub(b, a);
        d.normalize();
        if (d.y < 0) d.negate();
        return Optional.of(d);
    }

    /**
     * Magnetogram products cropped to this session's field of view, using the
     * configured disambiguation method.
     */
    public MagnetogramProducts magnetogramProducts(GridLoader loader) {
        DisambiguationMethod method =
                DisambiguationMethod.fromIndex(GxBoxConfig.defaults().disambiguationMethod());
        return new MagnetogramProducts(loader, method, fieldOfView);
    }

    /**
     * Bottom boundary for a field solver: the heliographic magnetogram products
     * reprojected onto the box bottom.
     *
     * @throws IOException if a magnetogram segment cannot be loaded
     */
    public VectorGridTriple boundaryConditions(
            MagnetogramProducts products, ReprojectionService reprojection) throws IOException {
        return BoundaryConditions.forBox(products.heliographic(), box.bottomProjectionHeader(), reprojection);
    }

    public ObservationContext context() {
        return context;
    }

    public Frame observingFrame() {
        return observingFrame;
    }

    /** Heliocentric frame with the box origin as observer. */
    public Frame workingFrame() {
        return workingFrame;
    }

    public Box box() {
        return box;
    }

    /** Padded bounds of the box in the observing frame. */
    public Bounds fieldOfView() {
        return fieldOfView;
    }

    public double padFraction() {
        return padFraction;
    }

    public ProjectionHeader bottomHeader() {
        return box.bottomProjectionHeader();
    }
}
