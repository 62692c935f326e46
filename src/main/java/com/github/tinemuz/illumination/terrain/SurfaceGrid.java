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

import java.util.Arrays;

/**
 * Projected coordinates and latitude/longitude of every simulated pixel.
 *
 * <p>Built once when the horizon grid loads and never modified afterwards.
 * Per-pixel arrays are row-major with {@code index = row * cols + col}.</p>
 */
public final class SurfaceGrid {
    private final int rows;
    private final int cols;
    private final double[] xCoords;
    private final double[] yCoords;
    private final double[] latitudesDeg;
    private final double[] longitudesDeg;

    /**
     * @param xCoords       pixel-center easting per column (meters)
     * @param yCoords       pixel-center northing per row (meters)
     * @param latitudesDeg  per-pixel latitude (degrees)
     * @param longitudesDeg per-pixel longitude (degrees)
     */
    public SurfaceGrid(double[] xCoords, double[] yCoords, double[] latitudesDeg, double[] longitudesDeg) {
        this.cols = xCoords.length;
        this.rows = yCoords.length;
        if (rows == 0 || cols == 0) {
            throw new IllegalArgumentException("Surface grid is empty");
        }
        if (latitudesDeg.length != rows * cols || longitudesDeg.length != rows * cols) {
            throw new IllegalArgumentException(
                    "Expected " + rows * cols + " lat/lon values for a " + rows + "x" + cols + " grid");
        }
        this.xCoords = xCoords.clone();
        this.yCoords = yCoords.clone();
        this.latitudesDeg = latitudesDeg.clone();
        this.longitudesDeg = longitudesDeg.clone();
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int pixelCount() {
        return rows * cols;
    }

    public double latitudeDeg(int index) {
        return latitudesDeg[index];
    }

    public double longitudeDeg(int index) {
        return longitudesDeg[index];
    }

    /** Column coordinates, west to east as stored. */
    public double[] xCoordinates() {
        return xCoords.clone();
    }

    /** Row coordinates, North to South once loaded through {@link HorizonGrid}. */
    public double[] yCoordinates() {
        return yCoords.clone();
    }

    public double minLatitudeDeg() {
        return Arrays.stream(latitudesDeg).min().orElse(Double.NaN);
    }

    public double maxLatitudeDeg() {
        return Arrays.stream(latitudesDeg).max().orElse(Double.NaN);
    }

    public double minLongitudeDeg() {
        return Arrays.stream(longitudesDeg).min().orElse(Double.NaN);
    }

    public double maxLongitudeDeg() {
        return Arrays.stream(longitudesDeg).max().orElse(Double.NaN);
    }

    /** Same grid with row order reversed. */
    SurfaceGrid flipRows() {
        double[] y = yCoords.clone();
        for (int i = 0, j = y.length - 1; i < j; i++, j--) {
            double t = y[i];
            y[i] = y[j];
            y[j] = t;
        }
        return new SurfaceGrid(xCoords, y, flipRows(latitudesDeg, rows, cols), flipRows(longitudesDeg, rows, cols));
    }

    private static double[] flipRows(double[] data, int rows, int cols) {
        double[] out = new double[data.length];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(data, r * cols, out, (rows - 1 - r) * cols, cols);
        }
        return out;
    }
}
