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
package com.github.tinemuz.illumination.terrain;

/**
 * Converts projected map coordinates to geographic coordinates on the body.
 *
 * <p>Called once per grid load with every pixel center, so implementations
 * should work on whole arrays.</p>
 */
public interface Reprojection {

    /**
     * @param x projected easting per point (meters)
     * @param y projected northing per point (meters), same length as {@code x}
     * @return longitudes and latitudes in degrees, same order as the inputs
     */
    GeographicPoints toGeographic(double[] x, double[] y);

    /** Parallel longitude/latitude arrays in degrees. */
    record GeographicPoints(double[] longitudesDeg, double[] latitudesDeg) {}
}
