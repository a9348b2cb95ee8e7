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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.gxbox.coords.SolarEphemeris.Orientation;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SolarEphemerisTest {

    private static final Instant T = Instant.parse("2024-05-09T17:12:00Z");

    @Nested
    @DisplayName("Reference values")
    class ReferenceValues {

        @Test
        @DisplayName("Meeus example 29.a (1992 October 13)")
        void meeusExample() {
            Orientation o = SolarEphemeris.atJulianDay(2_448_908.50068);

            assertEquals(26.27, o.pDeg(), 0.01, "P");
            assertEquals(5.99, o.b0Deg(), 0.01, "B0");
            assertEquals(238.64, o.l0Deg(), 0.01, "L0");
            assertEquals(0.99766, o.distanceAu(), 1e-4, "R");
        }

        @Test
        @DisplayName("J2000 epoch maps to JD 2451545.0")
        void julianDayOfJ2000() {
            assertEquals(2_451_545.0, SolarEphemeris.julianDay(Instant.parse("2000-01-01T12:00:00Z")), 1e-9);
        }

        @Test
        @DisplayName("Early May has B0 near -3 degrees")
        void mayLatitude() {
            Orientation o = SolarEphemeris.at(T);

            assertEquals(-3.23, o.b0Deg(), 0.05);
            assertEquals(317.38, o.l0Deg(), 0.1);
        }
    }

    @Nested
    @DisplayName("Earth observer")
    class EarthObserver {

        @Test
        @DisplayName("Earth sits at Stonyhurst longitude 0 and latitude B0")
        void earthPosition() {
            Point earth = SolarEphemeris.earth(T);
            Orientation o = SolarEphemeris.at(T);

            assertEquals(FrameKind.HELIOGRAPHIC_STONYHURST, earth.frame().kind());
            assertEquals(0.0, earth.c1(), 1e-12);
            assertEquals(o.b0Deg(), earth.c2(), 1e-12);
            assertEquals(o.distanceAu() * SolarEphemeris.AU_MM, earth.c3(), 1e-6);
        }

        @Test
        @DisplayName("Angles are normalized into [0, 360)")
        void normalizesAngles() {
            assertEquals(10.0, SolarEphemeris.normalize360(370.0), 1e-12);
            assertEquals(350.0, SolarEphemeris.normalize360(-10.0), 1e-12);
            assertEquals(0.0, SolarEphemeris.normalize360(720.0), 1e-12);
        }
    }
}
