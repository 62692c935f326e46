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

import java.time.Instant;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Source of the sun's position relative to the Moon.
 *
 * <p>An implementation is a session: it acquires whatever data it needs when
 * created and releases it in {@link #close()}. Sessions are not shared
 * between concurrent simulations.</p>
 */
public interface EphemerisProvider extends AutoCloseable {

    /**
     * Sun position seen from the Moon's center at {@code time}, in the Moon
     * body-fixed frame, corrected for light time and stellar aberration.
     *
     * @return position vector in kilometers (not normalized)
     */
    Vector3D sunVector(Instant time);

    /** Apparent angular radius of the sun (degrees) from its true distance at {@code time}. */
    default double apparentSunRadius(Instant time) {
        return SunState.apparentRadiusDeg(sunVector(time));
    }

    /** Position and apparent radius from a single ephemeris query. */
    default SunState sunState(Instant time) {
        return SunState.of(sunVector(time));
    }

    @Override
    void close();
}
