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
package com.github.tinemuz.gxbox.coords;

import javax.vecmath.Vector3d;

/**
 * Conversions between solar reference frames.
 *
 * <p>Every conversion goes through heliocentric Earth equatorial (HEEQ)
 * Cartesian coordinates, the Cartesian form of the Stonyhurst frame: X towards
 * Stonyhurst longitude 0 on the equator, Z towards solar north. Formulas
 * follow Thompson (2006), A&amp;A 449, 791. Stonyhurst coordinates are treated
 * as fixed across observation times; no differential rotation is applied.</p>
 */
public final class FrameTransforms {
    private static final double ARCSEC_PER_RAD = 180.0 * 3600.0 / Math.PI;

    private FrameTransforms() {}

    static Point transform(Point p, Frame target) {
        Vector3d heeq = toHeeq(p);
        return fromHeeq(heeq, target);
    }

    /** HEEQ Cartesian position (Mm) of a point in any supported frame. */
    public static Vector3d toHeeq(Point p) {
        Frame f = p.frame();
        switch (f.kind()) {
            case HELIOGRAPHIC_STONYHURST:
                return sphericalToCartesian(p.c1(), p.c2(), p.c3());
            case HELIOGRAPHIC_CARRINGTON:
                return sphericalToCartesian(p.c1() - carringtonOffset(f), p.c2(), p.c3());
            case HELIOCENTRIC:
                return heliocentricToHeeq(p.c1(), p.c2(), p.c3(), f.observer());
            case HELIOPROJECTIVE:
                Vector3d hcc = helioprojectiveToHeliocentric(p);
                return heliocentricToHeeq(hcc.x, hcc.y, hcc.z, f.observer());
            default:
                throw new IllegalArgumentException("Unsupported frame " + f.kind());
        }
    }

    /** Express a HEEQ Cartesian position (Mm) in the target frame. */
    public static Point fromHeeq(Vector3d v, Frame target) {
        switch (target.kind()) {
            case HELIOGRAPHIC_STONYHURST: {
                double[] s = cartesianToSpherical(v);
                return new Point(target, wrap180(s[0]), s[1], s[2]);
            }
            case HELIOGRAPHIC_CARRINGTON: {
                double[] s = cartesianToSpherical(v);
                return new Point(
                        target, SolarEphemeris.normalize360(s[0] + carringtonOffset(target)), s[1], s[2]);
            }
            case HELIOCENTRIC: {
                Vector3d hcc = heeqToHeliocentric(v, target.observer());
                return new Point(target, hcc.x, hcc.y, hcc.z);
            }
            case HELIOPROJECTIVE: {
                Vector3d hcc = heeqToHeliocentric(v, target.observer());
                double d0 = target.observerDistanceMm();
                double dz = d0 - hcc.z;
                double distance = Math.sqrt(hcc.x * hcc.x + hcc.y * hcc.y + dz * dz);
                double tx = Math.atan2(hcc.x, dz);
                double ty = Math.asin(hcc.y / distance);
                return new Point(target, tx * ARCSEC_PER_RAD, ty * ARCSEC_PER_RAD, distance);
            }
            default:
                throw new IllegalArgumentException("Unsupported frame " + target.kind());
        }
    }

    /**
     * Whether a helioprojective point lies within the apparent solar disk of
     * its observer.
     *
     * @throws IllegalArgumentException if the point is not helioprojective
     */
    public static boolean isOnSolarDisk(Point p) {
        Frame f = p.frame();
        if (f.kind() != FrameKind.HELIOPROJECTIVE) {
            throw new IllegalArgumentException("Expected a helioprojective point, got " + f.kind());
        }
        double radiusArcsec = Math.asin(f.rsunMm() / f.observerDistanceMm()) * ARCSEC_PER_RAD;
        return Math.hypot(p.c1(), p.c2()) < radiusArcsec;
    }

    /** Heliocentric Cartesian components (Mm) of a point, for the given observer. */
    public static Vector3d toHeliocentric(Point p, Point observer) {
        Point obs = observer.transformTo(Frame.stonyhurst(observer.obstime()));
        return heeqToHeliocentric(toHeeq(p), obs);
    }

    // Stonyhurst longitude = Carrington longitude - L0
    private static double carringtonOffset(Frame f) {
        return SolarEphemeris.at(f.obstime()).l0Deg();
    }

    private static Vector3d helioprojectiveToHeliocentric(Point p) {
        Frame f = p.frame();
        double d0 = f.observerDistanceMm();
        double tx = p.c1() / ARCSEC_PER_RAD;
        double ty = p.c2() / ARCSEC_PER_RAD;
        double cosTy = Math.cos(ty);
        double d = p.c3();
        if (Double.isNaN(d)) {
            // Near-side intersection of the line of sight with the solar sphere
            double b = d0 * cosTy * Math.cos(tx);
            double disc = b * b - d0 * d0 + f.rsunMm() * f.rsunMm();
            if (disc >= 0) {
                d = b - Math.sqrt(disc);
            } else if (f.sphericalScreen()) {
                d = d0;
            }
        }
        return new Vector3d(d * cosTy * Math.sin(tx), d * Math.sin(ty), d0 - d * cosTy * Math.cos(tx));
    }

    private static Vector3d heeqToHeliocentric(Vector3d v, Point observer) {
        double lon0 = Math.toRadians(observer.c1());
        double b0 = Math.toRadians(observer.c2());
        double cosL = Math.cos(lon0);
        double sinL = Math.sin(lon0);
        double cosB = Math.cos(b0);
        double sinB = Math.sin(b0);
        // Rotate longitude of the observer onto the X axis, then tilt by B0
        double xr = v.x * cosL + v.y * sinL;
        double yr = -v.x * sinL + v.y * cosL;
        double zr = v.z;
        return new Vector3d(yr, zr * cosB - xr * sinB, zr * sinB + xr * cosB);
    }

    private static Vector3d heliocentricToHeeq(double x, double y, double z, Point observer) {
        double lon0 = Math.toRadians(observer.c1());
        double b0 = Math.toRadians(observer.c2());
        double cosL = Math.cos(lon0);
        double sinL = Math.sin(lon0);
        double cosB = Math.cos(b0);
        double sinB = Math.sin(b0);
        double xr = z * cosB - y * sinB;
        double yr = x;
        double zr = z * sinB + y * cosB;
        return new Vector3d(xr * cosL - yr * sinL, xr * sinL + yr * cosL, zr);
    }

    private static Vector3d sphericalToCartesian(double lonDeg, double latDeg, double r) {
        double lon = Math.toRadians(lonDeg);
        double lat = Math.toRadians(latDeg);
        double cosLat = Math.cos(lat);
        return new Vector3d(r * cosLat * Math.cos(lon), r * cosLat * Math.sin(lon), r * Math.sin(lat));
    }

    // {lon deg, lat deg, radius}
    private static double[] cartesianToSpherical(Vector3d v) {
        double r = v.length();
        double lon = Math.toDegrees(Math.atan2(v.y, v.x));
        double lat = r == 0 ? 0.0 : Math.toDegrees(Math.asin(v.z / r));
        return new double[] {lon, lat, r};
    }

    private static double wrap180(double deg) {
        double r = SolarEphemeris.normalize360(deg);
        return r > 180.0 ? r - 360.0 : r;
    }
}
