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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.gxbox.ObservationContext;
import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.FrameKind;
import com.github.tinemuz.gxbox.coords.Point;
import java.time.Instant;
import java.util.List;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BoxTest {

    private static final Instant T = Instant.parse("2024-05-09T17:12:00Z");
    private static final double RSUN = 695.7;
    private static final double TOLERANCE = 1e-9;

    private final ObservationContext ctx = ObservationContext.fromEarth(T);

    @Nested
    @DisplayName("Geometry")
    class Geometry {

        @Test
        @DisplayName("Box has eight corners and twelve edges")
        void topology() {
            Box box = box(0, 0, new int[] {4, 4, 4}, 1.0);

            assertEquals(8, box.corners().size());
            assertEquals(12, box.edges().size());
            assertEquals(4, box.bottomEdges().size());
            assertEquals(8, box.sideEdges().size());
            for (BoxEdge e : box.bottomEdges()) {
                assertTrue(e.isBottom());
                assertEquals(EdgeKind.BOTTOM, e.kind());
            }
        }

        @Test
        @DisplayName("Corners sit at half the dimensions from the centre")
        void corners() {
            Box box = box(0, 0, new int[] {4, 4, 4}, 1.0);

            for (Point3d c : box.corners()) {
                assertEquals(2.0, Math.abs(c.x), TOLERANCE);
                assertEquals(2.0, Math.abs(c.y), TOLERANCE);
                assertEquals(2.0, Math.abs(c.z), TOLERANCE);
            }
            assertEquals(-2.0, box.corners().get(0).x, TOLERANCE);
            assertEquals(-2.0, box.corners().get(0).z, TOLERANCE);
            assertEquals(2.0, box.corners().get(1).z, TOLERANCE);
        }

        @Test
        @DisplayName("Physical dimensions are pixels times resolution")
        void dims() {
            Box box = box(0, 0, new int[] {64, 32, 16}, 1.4);

            Vector3d d = box.dims();
            assertEquals(64 * 1.4, d.x, TOLERANCE);
            assertEquals(32 * 1.4, d.y, TOLERANCE);
            assertEquals(16 * 1.4, d.z, TOLERANCE);
        }

        @Test
        @DisplayName("Edges join corners that differ along one axis")
        void edgeEndpoints() {
            Box box = box(0, 0, new int[] {4, 6, 8}, 1.0);

            for (BoxEdge e : box.edges()) {
                Point a = e.start();
                Point b = e.end();
                double dx = Math.abs(a.c1() - b.c1());
                double dy = Math.abs(a.c2() - b.c2());
                double dz = Math.abs(a.c3() - b.c3());
                int moving = (dx > TOLERANCE ? 1 : 0) + (dy > TOLERANCE ? 1 : 0) + (dz > TOLERANCE ? 1 : 0);
                assertEquals(1, moving, "edge " + e);
                assertEquals(box.workingFrame(), a.frame());
            }
        }

        @Test
        @DisplayName("Bottom face sits on the surface at the origin")
        void bottomOnSurface() {
            Box box = box(0, 0, new int[] {4, 4, 4}, 1.0);

            for (BoxEdge e : box.bottomEdges()) {
                assertEquals(RSUN, e.start().c3(), 1e-6);
            }
        }

        @Test
        @DisplayName("View-up edge runs along y and normal edge along z")
        void namedEdges() {
            Box box = box(300, 200, new int[] {4, 6, 8}, 1.0);

            BoxEdge up = box.viewUpEdge().orElseThrow();
            assertTrue(up.isBottom());
            assertEquals(6.0, Math.abs(up.end().c2() - up.start().c2()), 1e-6);

            BoxEdge normal = box.normalEdge().orElseThrow();
            assertFalse(normal.isBottom());
            assertEquals(8.0, Math.abs(normal.end().c3() - normal.start().c3()), 1e-6);
        }
    }

    @Nested
    @DisplayName("Bounds")
    class BoundsTests {

        @Test
        @DisplayName("Padding grows the bounds on every side")
        void paddedContainsUnpadded() {
            Box box = box(450, -256, new int[] {64, 64, 32}, 1.4);

            Bounds plain = box.bounds();
            Bounds padded = box.boundsBlTr(0.25);

            assertTrue(padded.contains(plain));
            double pad = 0.25 * Math.max(Math.max(plain.width(), plain.height()), 20.0);
            assertEquals(plain.minTx() - pad, padded.minTx(), 1e-6);
            assertEquals(plain.maxTy() + pad, padded.maxTy(), 1e-6);
        }

        @Test
        @DisplayName("Small boxes are padded by the floor")
        void paddingFloor() {
            Box box = box(0, 0, new int[] {2, 2, 2}, 1.0);

            Bounds plain = box.bounds();
            Bounds padded = box.boundsBlTr(0.5);

            assertTrue(plain.width() < 20.0);
            assertEquals(plain.minTx() - 10.0, padded.minTx(), 1e-6);
        }

        @Test
        @DisplayName("Bottom bounds lie inside the full bounds")
        void bottomInside() {
            Box box = box(450, -256, new int[] {64, 64, 32}, 1.4);

            assertTrue(box.bounds().contains(box.bottomBounds()));
            assertEquals(box.observingFrame(), box.bounds().frame());
            assertEquals(2, box.bounds().corners().size());
        }

        @Test
        @DisplayName("Empty edge sets and negative padding are rejected")
        void invalid() {
            Box box = box(0, 0, new int[] {4, 4, 4}, 1.0);

            assertThrows(IllegalArgumentException.class, () -> box.bounds(List.of(), 0.0));
            assertThrows(IllegalArgumentException.class, () -> box.boundsBlTr(-0.1));
            assertThrows(IllegalArgumentException.class, () -> box.boundsBlTr(Double.NaN));
        }
    }

    @Nested
    @DisplayName("Sampling grid and bottom header")
    class Derived {

        @Test
        @DisplayName("Sampling axes span the box with one sample per pixel")
        void samplingGrid() {
            Box box = box(0, 0, new int[] {4, 6, 8}, 1.0);
            SamplingGrid grid = box.samplingGrid();

            assertEquals(4, grid.x().count());
            assertEquals(6, grid.y().count());
            assertEquals(8, grid.z().count());
            assertEquals(box.center().c1() - 2.0, grid.x().get(0), TOLERANCE);
            assertEquals(box.center().c1() + 2.0, grid.x().get(3), TOLERANCE);
            assertEquals(RSUN, grid.z().start(), 1e-6);
            assertEquals(RSUN + 8.0, grid.z().stop(), 1e-6);
            assertIncreasing(grid.y().toArray());
            assertEquals(box.workingFrame(), grid.frame());
        }

        @Test
        @DisplayName("Bottom header matches the box footprint")
        void bottomHeader() {
            Box box = box(0, 0, new int[] {100, 64, 50}, 1.4);
            ProjectionHeader h = box.bottomProjectionHeader();

            assertEquals(64, h.rows());
            assertEquals(100, h.cols());
            assertEquals(50.5, h.crpix1(), TOLERANCE);
            assertEquals(32.5, h.crpix2(), TOLERANCE);
            assertEquals(Math.toDegrees(Math.asin(1.4 / 695.7)), h.cdelt1(), 1e-15);
            assertEquals(0.11529990722663515, h.cdelt1(), 1e-12);
            assertEquals(h.cdelt1(), h.cdelt2(), 0.0);
            assertEquals(RSUN * 1e6, h.rsunRefM(), 1e-3);
            assertEquals("None", h.observatory());
        }

        @Test
        @DisplayName("Off-centre origins sit on the nominal solar sphere")
        void nominalRadius() {
            Box box = box(450, -256, new int[] {100, 100, 50}, 1.4);
            ProjectionHeader h = box.bottomProjectionHeader();

            Point origin = box.origin().transformTo(Frame.stonyhurst(T));
            assertEquals(RSUN, origin.c3(), 1e-6);
            assertEquals(0.11529990722663515, h.cdelt1(), 1e-12);
            assertEquals(100, h.rows());
            assertEquals(100, h.cols());
        }

        @Test
        @DisplayName("Reference pixel of the bottom header is the origin")
        void referencePixel() {
            Box box = box(450, -256, new int[] {50, 50, 50}, 1.4);
            ProjectionHeader h = box.bottomProjectionHeader();
            Point origin = box.origin().transformTo(Frame.stonyhurst(T));

            Point ref = h.pixelToWorld(h.crpix1() - 1, h.crpix2() - 1);

            assertEquals(origin.c1(), ref.c1(), 1e-6);
            assertEquals(origin.c2(), ref.c2(), 1e-6);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Observing frame must be helioprojective")
        void observingFrame() {
            Point origin = ctx.originAt(FrameKind.HELIOPROJECTIVE, 0, 0);
            Point center = centerAbove(origin, 2.0);

            assertThrows(
                    IllegalArgumentException.class,
                    () -> new Box(Frame.stonyhurst(T), origin, center, new int[] {4, 4, 4}, 1.0));
        }

        @Test
        @DisplayName("Dimensions and resolution are checked")
        void dimsAndResolution() {
            Point origin = ctx.originAt(FrameKind.HELIOPROJECTIVE, 0, 0);
            Point center = centerAbove(origin, 2.0);
            Frame hpc = ctx.observingFrame();

            assertThrows(IllegalArgumentException.class, () -> new Box(hpc, origin, center, new int[] {4, 4}, 1.0));
            assertThrows(IllegalArgumentException.class, () -> new Box(hpc, origin, center, new int[] {4, 0, 4}, 1.0));
            assertThrows(IllegalArgumentException.class, () -> new Box(hpc, origin, center, new int[] {4, 4, 4}, 0.0));
        }

        @Test
        @DisplayName("Centre given in another frame is moved into the working frame")
        void centerTransformed() {
            Point origin = ctx.originAt(FrameKind.HELIOPROJECTIVE, 0, 0);
            Point center = centerAbove(origin, 2.0).transformTo(Frame.stonyhurst(T));

            Box box = new Box(ctx.observingFrame(), origin, center, new int[] {4, 4, 4}, 1.0);

            assertEquals(FrameKind.HELIOCENTRIC, box.center().frame().kind());
            assertEquals(RSUN + 2.0, box.center().c3(), 1e-6);
        }
    }

    // Helper methods

    private Box box(double txArcsec, double tyArcsec, int[] dimsPix, double res) {
        Point origin = ctx.originAt(FrameKind.HELIOPROJECTIVE, txArcsec, tyArcsec);
        Point center = centerAbove(origin, dimsPix[2] * res / 2);
        return new Box(ctx.observingFrame(), origin, center, dimsPix, res);
    }

    private static Point centerAbove(Point origin, double height) {
        Frame working = Frame.heliocentric(T, origin);
        Point local = origin.transformTo(working);
        return Point.heliocentric(working, local.c1(), local.c2(), local.c3() + height);
    }

    private static void assertIncreasing(double[] values) {
        for (int i = 1; i < values.length; i++) {
            assertTrue(values[i] > values[i - 1], "index " + i);
        }
    }
}
