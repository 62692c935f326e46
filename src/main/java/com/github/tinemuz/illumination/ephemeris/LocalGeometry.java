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

import com.github.tinemuz.illumination.terrain.SurfaceGrid;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Sun direction in each pixel's local horizontal frame.
 *
 * <p>For a pixel at latitude {@code phi} and longitude {@code lambda} the
 * topocentric basis in the body-fixed frame is
 * <pre>
 *   up    = ( cos phi cos lambda,  cos phi sin lambda, sin phi)
 *   north = (-sin phi cos lambda, -sin phi sin lambda, cos phi)
 *   east  = (-sin lambda,          cos lambda,         0      )
 * </pre>
 * Elevation is {@code asin(s . up)}; the true-north bearing is
 * {@code atan2(s . east, s . north)}.</p>
 *
 * <p>The bearing is then moved into image space. Adding the pixel longitude
 * turns it into a bearing relative to grid north of the polar projection, and
 * subtracting 90 degrees rebases it on the +x axis with rows growing
 * downward, which is how horizon profiles were cast.</p>
 */
public final class LocalGeometry {

    private LocalGeometry() {}

    /**
     * @param sunVector sun position in the body-fixed frame, any length
     * @param surface   pixel latitudes and longitudes
     * @return per-pixel image-space azimuth in [0, 360) and elevation, degrees
     */
    public static GeometryGrid compute(Vector3D sunVector, SurfaceGrid surface) {
        double norm = sunVector.getNorm();
        if (!(norm > 0.0)) {
            throw new IllegalArgumentException("Sun vector has no direction");
        }
        double sx = sunVector.getX() / norm;
        double sy = sunVector.getY() / norm;
        double sz = sunVector.getZ() / norm;

        int pixels = surface.pixelCount();
        double[] azimuth = new double[pixels];
        double[] elevation = new double[pixels];
        for (int i = 0; i < pixels; i++) {
            double lonDeg = surface.longitudeDeg(i);
            double lat = Math.toRadians(surface.latitudeDeg(i));
            double lon = Math.toRadians(lonDeg);
            double cosLat = Math.cos(lat);
            double sinLat = Math.sin(lat);
            double cosLon = Math.cos(lon);
            double sinLon = Math.sin(lon);

            double dotUp = sx * cosLat * cosLon + sy * cosLat * sinLon + sz * sinLat;
            double dotNorth = -sx * sinLat * cosLon - sy * sinLat * sinLon + sz * cosLat;
            double dotEast = -sx * sinLon + sy * cosLon;

            // Rounding can push |dotUp| a hair past 1
            elevation[i] = Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, dotUp))));
            double bearing = Math.toDegrees(Math.atan2(dotEast, dotNorth)) + lonDeg;
            azimuth[i] = floorMod360(bearing - 90.0);
        }
        return new GeometryGrid(surface.rows(), surface.cols(), azimuth, elevation);
    }

    static double floorMod360(double deg) {
        double a = deg % 360.0;
        if (a < 0) a += 360.0;
        return a >= 360.0 ? 0.0 : a;
    }
}
