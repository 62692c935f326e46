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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the circular-segment illumination model: band edges, the
 * half-disk point, shape of the curve inside the band, and the array forms.
 */
class IlluminationPhysicsTest {

    private static final double SUN_RADIUS = 0.25; // degrees, roughly the real disk
    private static final double EPS = 1e-12;

    @Nested
    @DisplayName("Band Edges")
    class BandEdgeTests {

        @Test
        @DisplayName("h = -r gives a fully visible disk")
        void lowerEdge() {
            for (double r : new double[] {0.01, 0.25, 0.27, 1.0, 5.0}) {
                assertEquals(1.0, IlluminationPhysics.fraction(r, 0.0, r), EPS, "r=" + r);
            }
        }

        @Test
        @DisplayName("h = r gives a fully hidden disk")
        void upperEdge() {
            for (double r : new double[] {0.01, 0.25, 0.27, 1.0, 5.0}) {
                assertEquals(0.0, IlluminationPhysics.fraction(-r, 0.0, r), EPS, "r=" + r);
            }
        }

        @Test
        @DisplayName("h = 0 gives exactly half the disk")
        void halfDisk() {
            for (double r : new double[] {0.01, 0.25, 0.27, 1.0, 5.0}) {
                assertEquals(0.5, IlluminationPhysics.fraction(3.0, 3.0, r), EPS, "r=" + r);
            }
        }

        @Test
        @DisplayName("Just inside the band the partial formula meets the edges")
        void continuityAtEdges() {
            double r = SUN_RADIUS;
            double inside = r * (1 - 1e-9);
            assertEquals(1.0, IlluminationPhysics.fraction(inside, 0.0, r), 1e-6);
            assertEquals(0.0, IlluminationPhysics.fraction(-inside, 0.0, r), 1e-6);
        }

        @Test
        @DisplayName("Zero radius acts as a point sun")
        void pointSun() {
            assertEquals(1.0, IlluminationPhysics.fraction(1.0, 0.0, 0.0));
            assertEquals(0.0, IlluminationPhysics.fraction(-1.0, 0.0, 0.0));
        }

        @Test
        @DisplayName("NaN horizon propagates instead of throwing")
        void nanInput() {
            assertTrue(Double.isNaN(IlluminationPhysics.fraction(1.0, Double.NaN, SUN_RADIUS)));
        }
    }

    @Nested
    @DisplayName("Partial Band")
    class PartialBandTests {

        @Test
        @DisplayName("Fraction is non-increasing as the horizon rises")
        void monotonic() {
            double r = SUN_RADIUS;
            double previous = Double.POSITIVE_INFINITY;
            for (int i = -1000; i <= 1000; i++) {
                double h = r * i / 1000.0;
                double f = IlluminationPhysics.fraction(0.0, h, r);
                assertTrue(f <= previous + EPS, "not monotonic at h=" + h);
                assertTrue(f >= 0.0 && f <= 1.0, "out of range at h=" + h);
                previous = f;
            }
        }

        @Test
        @DisplayName("f(h) + f(-h) = 1")
        void complementary() {
            double r = SUN_RADIUS;
            for (int i = 0; i <= 100; i++) {
                double h = r * i / 100.0;
                double sum = IlluminationPhysics.fraction(0.0, h, r) + IlluminationPhysics.fraction(0.0, -h, r);
                assertEquals(1.0, sum, 1e-9, "h=" + h);
            }
        }

        @Test
        @DisplayName("Segment at half radius matches the closed form")
        void halfRadiusSegment() {
            // Chord at r/2: segment = r^2 (pi/3 - sqrt(3)/4)
            double expected = (Math.PI / 3 - Math.sqrt(3) / 4) / Math.PI;
            assertEquals(expected, IlluminationPhysics.fraction(0.0, SUN_RADIUS / 2, SUN_RADIUS), 1e-9);
            assertEquals(1 - expected, IlluminationPhysics.fraction(SUN_RADIUS / 2, 0.0, SUN_RADIUS), 1e-9);
        }
    }

    @Nested
    @DisplayName("Reference Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Sun 20 deg above a flat horizon is fully lit")
        void sunHigh() {
            assertEquals(1.0, IlluminationPhysics.fraction(20.0, 0.0, 0.25));
        }

        @Test
        @DisplayName("Sun 20 deg below a flat horizon is dark")
        void sunLow() {
            assertEquals(0.0, IlluminationPhysics.fraction(-20.0, 0.0, 0.25));
        }

        @Test
        @DisplayName("Sun centred on the horizon is half lit")
        void sunOnHorizon() {
            assertEquals(0.5, IlluminationPhysics.fraction(0.0, 0.0, 0.25), EPS);
        }
    }

    @Nested
    @DisplayName("Grid Evaluation")
    class GridTests {

        @Test
        @DisplayName("Scalar radius applies to every pixel")
        void scalarRadius() {
            double[] sun = {20.0, -20.0, 0.0};
            double[] horizon = {0.0, 0.0, 0.0};
            double[] f = IlluminationPhysics.fractions(sun, horizon, 0.25);
            assertArrayEquals(new double[] {1.0, 0.0, 0.5}, f, EPS);
        }

        @Test
        @DisplayName("Per-pixel radius array matches scalar evaluation")
        void perPixelRadius() {
            double[] sun = {0.1, 0.1, 0.1};
            double[] horizon = {0.0, 0.0, 0.0};
            double[] radius = {0.05, 0.2, 0.3};
            double[] f = IlluminationPhysics.fractions(sun, horizon, radius);
            for (int i = 0; i < f.length; i++) {
                assertEquals(IlluminationPhysics.fraction(sun[i], horizon[i], radius[i]), f[i], EPS);
            }
            assertEquals(1.0, f[0]);
            assertTrue(f[1] > 0.5 && f[1] < 1.0);
        }

        @Test
        @DisplayName("One-element radius array is broadcast")
        void broadcastRadius() {
            double[] sun = {0.0, 1.0};
            double[] horizon = {0.0, 0.0};
            assertArrayEquals(
                    IlluminationPhysics.fractions(sun, horizon, 0.25),
                    IlluminationPhysics.fractions(sun, horizon, new double[] {0.25}),
                    EPS);
        }

        @Test
        @DisplayName("Mismatched shapes are rejected")
        void shapeMismatch() {
            assertThrows(IllegalArgumentException.class,
                    () -> IlluminationPhysics.fractions(new double[2], new double[3], 0.25));
            assertThrows(IllegalArgumentException.class,
                    () -> IlluminationPhysics.fractions(new double[2], new double[2], new double[3]));
        }
    }
}
