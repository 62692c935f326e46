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
package com.github.tinemuz.illumination.ephemeris;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Sun geometry at one instant: body-fixed position and apparent disk radius.
 *
 * <p>Recomputed every step, never cached.</p>
 *
 * @param position           sun position from the Moon (kilometers, not normalized)
 * @param apparentRadiusDeg  half-angle subtended by the solar disk (degrees)
 */
public record SunState(Vector3D position, double apparentRadiusDeg) {

    /** Physical solar radius (kilometers). */
    public static final double SUN_RADIUS_KM = 696_340.0;

    public static SunState of(Vector3D positionKm) {
        return new SunState(positionKm, apparentRadiusDeg(positionKm));
    }

    /** {@code asin(R_sun / |r|)} in degrees; shrinks as the distance grows. */
    public static double apparentRadiusDeg(Vector3D positionKm) {
        double distance = positionKm.getNorm();
        if (!(distance > SUN_RADIUS_KM)) {
            throw new IllegalArgumentException("Sun distance " + distance + " km is inside the solar radius");
        }
        return Math.toDegrees(Math.asin(SUN_RADIUS_KM / distance));
    }

    /** Unit vector toward the sun. */
    public Vector3D direction() {
        return position.normalize();
    }
}
