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

/**
 * Sun azimuth and elevation per pixel for one instant, row-major.
 *
 * <p>Azimuth is in image space: degrees in [0, 360) measured from the +x
 * (column) axis toward +row, i.e. toward the South of the image. Elevation is
 * measured from the local horizontal plane.</p>
 */
public record GeometryGrid(int rows, int cols, double[] azimuthDeg, double[] elevationDeg) {

    public GeometryGrid {
        if (azimuthDeg.length != rows * cols || elevationDeg.length != rows * cols) {
            throw new IllegalArgumentException("Geometry arrays do not match a " + rows + "x" + cols + " grid");
        }
        azimuthDeg = azimuthDeg.clone();
        elevationDeg = elevationDeg.clone();
    }

    @Override
    public double[] azimuthDeg() {
        return azimuthDeg.clone();
    }

    @Override
    public double[] elevationDeg() {
        return elevationDeg.clone();
    }
}
