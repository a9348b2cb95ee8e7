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

import com.github.tinemuz.gxbox.GxBoxConfig;
import java.time.Instant;
import java.util.Objects;

/**
 * A solar reference frame at an observation time.
 *
 * <p>Helioprojective and heliocentric frames are defined relative to an
 * observer, always stored as a Stonyhurst point. The solar radius is used to
 * place helioprojective points on the solar surface when their distance is
 * not known. With {@code sphericalScreen} set, lines of sight that miss the
 * Sun land on a sphere centred on the observer through Sun centre instead of
 * producing NaN.</p>
 *
 * @param kind frame kind
 * @param obstime observation time
 * @param observer observer position (Stonyhurst), or null where not needed
 * @param rsunMm solar radius in megameters
 * @param sphericalScreen whether off-disk helioprojective points use the screen
 */
public record Frame(
        FrameKind kind, Instant obstime, Point observer, double rsunMm, boolean sphericalScreen) {

    public Frame {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(obstime, "obstime");
        if (kind.needsObserver()) {
            if (observer == null) {
                throw new IllegalArgumentException(kind + " frame requires an observer");
            }
            if (observer.frame().kind() != FrameKind.HELIOGRAPHIC_STONYHURST) {
                observer = observer.transformTo(stonyhurst(observer.frame().obstime()));
            }
            if (!(observer.c3() > 0)) {
                throw new IllegalArgumentException("Observer distance must be positive");
            }
        }
        if (!(rsunMm > 0)) {
            throw new IllegalArgumentException("Solar radius must be positive, got " + rsunMm);
        }
    }

    /** Helioprojective frame of an observer. */
    public static Frame helioprojective(Instant obstime, Point observer) {
        return new Frame(FrameKind.HELIOPROJECTIVE, obstime, observer, defaultRsun(), false);
    }

    /** Heliocentric frame aligned with the direction of an observer. */
    public static Frame heliocentric(Instant obstime, Point observer) {
        return new Frame(FrameKind.HELIOCENTRIC, obstime, observer, defaultRsun(), false);
    }

    /** Heliographic Stonyhurst frame. */
    public static Frame stonyhurst(Instant obstime) {
        return new Frame(FrameKind.HELIOGRAPHIC_STONYHURST, obstime, null, defaultRsun(), false);
    }

    /** Heliographic Carrington frame. */
    public static Frame carrington(Instant obstime) {
        return new Frame(FrameKind.HELIOGRAPHIC_CARRINGTON, obstime, null, defaultRsun(), false);
    }

    /** Same frame with off-disk lines of sight resolved onto the spherical screen. */
    public Frame withSphericalScreen() {
        return new Frame(kind, obstime, observer, rsunMm, true);
    }

    /** Same frame with a different solar radius. */
    public Frame withRsun(double rsunMm) {
        return new Frame(kind, obstime, observer, rsunMm, sphericalScreen);
    }

    /** Observer distance from Sun centre in Mm; only for observer frames. */
    public double observerDistanceMm() {
        if (observer == null) {
            throw new IllegalStateException(kind + " frame has no observer");
        }
        return observer.c3();
    }

    private static double defaultRsun() {
        return GxBoxConfig.defaults().solarRadiusMm();
    }
}
