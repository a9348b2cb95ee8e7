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

import java.time.Instant;

/**
 * Low-precision solar ephemeris for physical observations of the Sun.
 *
 * <p>Follows Meeus, <em>Astronomical Algorithms</em> (2nd ed.), chapters 25
 * and 29. Accuracy is about 0.01 degree in the orientation angles, which is
 * well below the pixel scale of a vector magnetogram. The instant is used as
 * dynamical time; the ~70 s offset between UTC and TT is ignored.</p>
 */
public final class SolarEphemeris {
    /** Astronomical unit in megameters. */
    public static final double AU_MM = 149_597.870_700;

    private static final double JD_UNIX_EPOCH = 2_440_587.5;
    private static final double JD_J2000 = 2_451_545.0;
    private static final double MS_PER_DAY = 86_400_000.0;
    // Inclination of the solar equator on the ecliptic
    private static final double SOLAR_EQUATOR_INCLINATION_DEG = 7.25;

    private SolarEphemeris() {}

    /** Julian day of an instant. */
    public static double julianDay(Instant time) {
        return JD_UNIX_EPOCH + time.toEpochMilli() / MS_PER_DAY;
    }

    /** Orientation of the Sun as seen from Earth at the given instant. */
    public static Orientation at(Instant time) {
        return atJulianDay(julianDay(time));
    }

    /**
     * Orientation of the Sun as seen from Earth at the given Julian day.
     *
     * @param jd Julian day (dynamical time)
     * @return position angle P, latitude B0, Carrington longitude L0 of the
     *         disk centre (degrees) and Sun-Earth distance (AU)
     */
    public static Orientation atJulianDay(double jd) {
        double t = (jd - JD_J2000) / 36525.0;

        // STEP 1: apparent geocentric longitude and distance of the Sun (ch. 25)
        double meanLon = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double meanAnom = 357.52911 + 35999.05029 * t - 0.0001537 * t * t;
        double ecc = 0.016708634 - 0.000042037 * t - 0.0000001267 * t * t;
        double m = Math.toRadians(meanAnom);
        double center =
                (1.914602 - 0.004817 * t - 0.000014 * t * t) * Math.sin(m)
                        + (0.019993 - 0.000101 * t) * Math.sin(2 * m)
                        + 0.000289 * Math.sin(3 * m);
        double trueLon = meanLon + center;
        double trueAnom = Math.toRadians(meanAnom + center);
        double distanceAu = 1.000001018 * (1 - ecc * ecc) / (1 + ecc * Math.cos(trueAnom));
        double omega = Math.toRadians(125.04 - 1934.136 * t);
        double apparentLon = trueLon - 0.00569 - 0.00478 * Math.sin(omega);

        // Obliquity of the ecliptic, corrected for nutation in obliquity
        double eps0 =
                23.0 + 26.0 / 60.0 + 21.448 / 3600.0
                        - (46.8150 * t + 0.00059 * t * t - 0.001813 * t * t * t) / 3600.0;
        double eps = Math.toRadians(eps0 + 0.00256 * Math.cos(omega));

        // STEP 2: orientation of the solar rotation axis (ch. 29)
        double theta = (jd - 2_398_220.0) * 360.0 / 25.38;
        double incl = Math.toRadians(SOLAR_EQUATOR_INCLINATION_DEG);
        double node = 73.6667 + 1.3958333 * (jd - 2_396_758.0) / 36525.0;
        double lam = Math.toRadians(apparentLon);
        double lk = Math.toRadians(apparentLon - node);

        double x = Math.toDegrees(Math.atan(-Math.cos(lam) * Math.tan(eps)));
        double y = Math.toDegrees(Math.atan(-Math.cos(lk) * Math.tan(incl)));
        double p = x + y;
        double b0 = Math.toDegrees(Math.asin(Math.sin(lk) * Math.sin(incl)));
        double eta = Math.toDegrees(Math.atan2(-Math.sin(lk) * Math.cos(incl), -Math.cos(lk)));
        double l0 = normalize360(eta - theta);
        return new Orientation(p, b0, l0, distanceAu);
    }

    /**
     * Earth as an observer: a Stonyhurst point at longitude 0, latitude B0 and
     * the Sun-Earth distance.
     */
    public static Point earth(Instant time) {
        Orientation o = at(time);
        return Point.stonyhurst(time, 0.0, o.b0Deg(), o.distanceAu() * AU_MM);
    }

    static double normalize360(double deg) {
        double r = deg % 360.0;
        if (r < 0) r += 360.0;
        return r >= 360.0 ? 0.0 : r;
    }

    /**
     * Solar orientation angles.
     *
     * @param pDeg position angle of the northern rotation axis, east of north
     * @param b0Deg heliographic latitude of the disk centre
     * @param l0Deg Carrington longitude of the disk centre, in [0, 360)
     * @param distanceAu Sun-Earth distance
     */
    public record Orientation(double pDeg, double b0Deg, double l0Deg, double distanceAu) {}
}
