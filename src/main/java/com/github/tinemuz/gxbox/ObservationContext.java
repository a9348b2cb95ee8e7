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

import com.github.tinemuz.gxbox.coords.Frame;
import com.github.tinemuz.gxbox.coords.FrameKind;
import com.github.tinemuz.gxbox.coords.Point;
import com.github.tinemuz.gxbox.coords.SolarEphemeris;
import java.time.Instant;
import java.util.Objects;

/**
 * Observation time and observer position for one analysis session.
 *
 * <p>The observer is stored in the Stonyhurst frame at the observation time.</p>
 *
 * @param time observation time
 * @param observer observer position (Stonyhurst)
 */
public record ObservationContext(Instant time, Point observer) {

    public ObservationContext {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(observer, "observer");
        observer = observer.transformTo(Frame.stonyhurst(time));
        if (!(observer.c3() > 0)) {
            throw new IllegalArgumentException("Observer distance must be positive");
        }
    }

    /** Context for an Earth-based observer at the given time. */
    public static ObservationContext fromEarth(Instant time) {
        return new ObservationContext(time, SolarEphemeris.earth(time));
    }

    /** Helioprojective frame of this observer. */
    public Frame observingFrame() {
        return Frame.helioprojective(time, observer);
    }

    /** Stonyhurst frame at the observation time. */
    public Frame stonyhurstFrame() {
        return Frame.stonyhurst(time);
    }

    /**
     * Box origin from two coordinates: arcsec for helioprojective, degrees
     * for Stonyhurst or Carrington. Heliographic origins sit at the
     * configured solar radius; helioprojective origins use it to resolve the
     * line of sight onto the surface.
     *
     * @throws IllegalArgumentException for a heliocentric frame kind
     */
    public Point originAt(FrameKind kind, double a, double b) {
        double rsun = GxBoxConfig.defaults().solarRadiusMm();
        switch (kind) {
            case HELIOPROJECTIVE:
                return Point.helioprojective(observingFrame().withRsun(rsun), a, b);
            case HELIOGRAPHIC_CARRINGTON:
                return Point.carrington(time, a, b, rsun);
            case HELIOGRAPHIC_STONYHURST:
                return Point.stonyhurst(time, a, b, rsun);
            default:
                throw new IllegalArgumentException(
                        "Box origin must be helioprojective, Carrington or Stonyhurst, got " + kind);
        }
    }
}
