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
package com.github.tinemuz.illumination.physics;

/**
 * Visible solar disk fraction from the circular-segment area model.
 *
 * <p>The sun is treated as a flat disk of angular radius {@code r} and the
 * local horizon as a straight chord crossing it. With
 * {@code h = horizonElevation - sunElevation}, the disk is fully visible for
 * {@code h <= -r}, fully hidden for {@code h >= r}, and in between the
 * visible share is derived from the area of the segment cut off by a chord at
 * distance {@code |h|} from the disk center. All inputs are in degrees; the
 * math runs in radians.</p>
 *
 * <p>Every pixel is independent, so the array overloads are plain loops over
 * the scalar kernel.</p>
 */
public final class IlluminationPhysics {

    private IlluminationPhysics() {}

    /**
     * Fraction of the solar disk above the horizon for one pixel.
     *
     * @param sunElevationDeg     sun center elevation (degrees)
     * @param horizonElevationDeg skyline elevation in the sun's direction (degrees)
     * @param sunRadiusDeg        apparent angular radius of the sun (degrees)
     * @return fraction in [0, 1]; NaN only if an input is NaN
     */
    public static double fraction(double sunElevationDeg, double horizonElevationDeg, double sunRadiusDeg) {
        double r = Math.toRadians(sunRadiusDeg);
        double h = Math.toRadians(horizonElevationDeg - sunElevationDeg);

        if (h <= -r) return 1.0;
        if (h >= r) return 0.0;
        if (Double.isNaN(h) || Double.isNaN(r)) return Double.NaN;

        // Clamp guards rounding overshoot right at the band edge
        double x = Math.min(Math.abs(h), r);
        double r2 = r * r;
        double segmentArea = r2 * Math.acos(x / r) - x * Math.sqrt(r2 - x * x);
        double segmentFraction = segmentArea / (Math.PI * r2);

        // h >= 0: horizon at or above the disk center, only the segment shows
        return h >= 0 ? segmentFraction : 1.0 - segmentFraction;
    }

    /**
     * Per-pixel fractions with one sun radius shared by the whole grid.
     *
     * @throws IllegalArgumentException if the elevation arrays differ in length
     */
    public static double[] fractions(double[] sunElevationDeg, double[] horizonElevationDeg, double sunRadiusDeg) {
        requireSameLength(sunElevationDeg, horizonElevationDeg);
        double[] out = new double[sunElevationDeg.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = fraction(sunElevationDeg[i], horizonElevationDeg[i], sunRadiusDeg);
        }
        return out;
    }

    /**
     * Per-pixel fractions with a radius array. A one-element radius array is
     * broadcast to every pixel; any other length must match the grid exactly.
     *
     * @throws IllegalArgumentException on any shape mismatch
     */
    public static double[] fractions(double[] sunElevationDeg, double[] horizonElevationDeg, double[] sunRadiusDeg) {
        if (sunRadiusDeg.length == 1) {
            return fractions(sunElevationDeg, horizonElevationDeg, sunRadiusDeg[0]);
        }
        requireSameLength(sunElevationDeg, horizonElevationDeg);
        requireSameLength(sunElevationDeg, sunRadiusDeg);
        double[] out = new double[sunElevationDeg.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = fraction(sunElevationDeg[i], horizonElevationDeg[i], sunRadiusDeg[i]);
        }
        return out;
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Grid size mismatch: " + a.length + " vs " + b.length + " pixels");
        }
    }
}
