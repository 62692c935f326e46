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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Horizon profile of the simulated region plus its surface coordinates.
 *
 * <p>The profile stores, for every pixel and every integer azimuth bucket
 * 0..359, the elevation of the terrain skyline in hundredths of a degree.
 * Azimuth is circular: bucket 360 is bucket 0.</p>
 *
 * <p>Rows are always exposed North to South (decreasing y). Both the profile
 * and the surface grid are read-only after construction.</p>
 */
public final class HorizonGrid {
    private static final Logger log = LoggerFactory.getLogger(HorizonGrid.class);

    /** Number of azimuth buckets per pixel. */
    public static final int AZIMUTH_BUCKETS = 360;

    private static final int BYTES_PER_VALUE = Short.BYTES;

    private final SurfaceGrid surface;
    // profile[row][col * AZIMUTH_BUCKETS + bucket], centidegrees; one array per row keeps
    // indices within int range for large regions
    private final short[][] profile;

    /**
     * Wrap an in-memory profile.
     *
     * @param surface coordinates of the pixels, rows North to South
     * @param profile row-major {@code rows x cols x 360} centidegree values
     */
    public HorizonGrid(SurfaceGrid surface, short[] profile) {
        this(splitRows(profile, surface), surface);
    }

    // Takes ownership of the row arrays
    private HorizonGrid(short[][] profile, SurfaceGrid surface) {
        int rowValues = surface.cols() * AZIMUTH_BUCKETS;
        if (profile.length != surface.rows()) {
            throw new IllegalArgumentException(
                    "Horizon profile has " + profile.length + " rows, expected " + surface.rows());
        }
        for (short[] row : profile) {
            if (row.length != rowValues) {
                throw new IllegalArgumentException(
                        "Horizon profile row has " + row.length + " values, expected " + rowValues);
            }
        }
        this.surface = surface;
        this.profile = profile;
    }

    private static short[][] splitRows(short[] flat, SurfaceGrid surface) {
        long expected = (long) surface.pixelCount() * AZIMUTH_BUCKETS;
        if (flat.length != expected) {
            throw new IllegalArgumentException(
                    "Horizon profile has " + flat.length + " values, expected " + expected);
        }
        int rowValues = surface.cols() * AZIMUTH_BUCKETS;
        short[][] rows = new short[surface.rows()][];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = Arrays.copyOfRange(flat, r * rowValues, (r + 1) * rowValues);
        }
        return rows;
    }

    /**
     * Load the region of interest from a horizon-profile file covering the full DEM.
     *
     * <p>The file is a flat little-endian array of 16-bit signed integers with
     * shape {@code (height, width, 360)}. The interior
     * {@code [buffer, dim - buffer)} along both axes is read; the buffer only
     * exists to keep ray casting away from tile edges.</p>
     *
     * @param metadata     full-grid description
     * @param horizonFile  profile for the full grid
     * @param reprojection projected to geographic transform for the DEM's CRS
     * @throws NoSuchFileException if the profile file does not exist
     * @throws IOException         if it is truncated or cannot be read
     */
    public static HorizonGrid load(DemMetadata metadata, Path horizonFile, Reprojection reprojection)
            throws IOException {
        if (!Files.isRegularFile(horizonFile)) {
            log.error("Horizon mask missing: {}", horizonFile);
            throw new NoSuchFileException(horizonFile.toString(), null, "Horizon mask missing");
        }
        int fullWidth = metadata.width();
        int fullHeight = metadata.height();
        int buffer = metadata.bufferPixels();
        int xStart = buffer;
        int xEnd = fullWidth - buffer;
        int yStart = buffer;
        int yEnd = fullHeight - buffer;
        int cols = xEnd - xStart;
        int rows = yEnd - yStart;
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException(
                    "Buffer of " + buffer + "px leaves no region inside a " + fullWidth + "x" + fullHeight + " DEM");
        }
        log.info("ROI Size: {}x{} (Buffer: {}px)", cols, rows, buffer);

        short[][] profile = readRegion(horizonFile, fullWidth, fullHeight, xStart, yStart, cols, rows);

        // Pixel centers: index + 0.5 through the affine transform
        double[] t = metadata.transform();
        double[] x = new double[cols];
        for (int c = 0; c < cols; c++) {
            x[c] = t[0] + (xStart + c + 0.5) * t[1];
        }
        double[] y = new double[rows];
        for (int r = 0; r < rows; r++) {
            y[r] = t[3] + (yStart + r + 0.5) * t[5];
        }

        double[] gridX = new double[rows * cols];
        double[] gridY = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                gridX[r * cols + c] = x[c];
                gridY[r * cols + c] = y[r];
            }
        }
        Reprojection.GeographicPoints geo = reprojection.toGeographic(gridX, gridY);
        SurfaceGrid surface = new SurfaceGrid(x, y, geo.latitudesDeg(), geo.longitudesDeg());

        if (rows > 1 && y[0] < y[rows - 1]) {
            log.warn("Y coordinates increasing, flipping rows to North-to-South order");
            surface = surface.flipRows();
            profile = flipRows(profile);
        }
        return new HorizonGrid(profile, surface);
    }

    public SurfaceGrid surface() {
        return surface;
    }

    public int rows() {
        return surface.rows();
    }

    public int cols() {
        return surface.cols();
    }

    /** Stored skyline elevation (degrees) of one pixel at an integer bucket. */
    public double storedElevationDeg(int pixel, int bucket) {
        int cols = surface.cols();
        return profile[pixel / cols][(pixel % cols) * AZIMUTH_BUCKETS + bucket] / 100.0;
    }

    /**
     * Skyline elevation toward an arbitrary azimuth for every pixel.
     *
     * <p>The azimuth is wrapped into [0, 360); the result interpolates
     * linearly between the floor bucket and the next one, with 359 wrapping
     * to 0.</p>
     *
     * @param azimuthDeg per-pixel azimuth in degrees, any real value
     * @return per-pixel horizon elevation in degrees
     */
    public double[] lookup(double[] azimuthDeg) {
        int pixels = surface.pixelCount();
        if (azimuthDeg.length != pixels) {
            throw new IllegalArgumentException(
                    "Azimuth grid has " + azimuthDeg.length + " values, expected " + pixels);
        }
        int cols = surface.cols();
        double[] out = new double[pixels];
        for (int i = 0; i < pixels; i++) {
            double az = wrapAzimuth(azimuthDeg[i]);
            int lo = (int) Math.floor(az);
            int hi = (lo + 1) % AZIMUTH_BUCKETS;
            double frac = az - lo;
            short[] row = profile[i / cols];
            int base = (i % cols) * AZIMUTH_BUCKETS;
            double h1 = row[base + lo] / 100.0;
            double h2 = row[base + hi] / 100.0;
            out[i] = h1 + (h2 - h1) * frac;
        }
        return out;
    }

    static double wrapAzimuth(double azimuthDeg) {
        double az = azimuthDeg % 360.0;
        if (az < 0) az += 360.0;
        // -1e-17 % 360 + 360 rounds to 360.0
        if (az >= 360.0) az = 0.0;
        return az;
    }

    private static short[][] readRegion(
            Path file, int fullWidth, int fullHeight, int xStart, int yStart, int cols, int rows)
            throws IOException {
        long expectedBytes = (long) fullWidth * fullHeight * AZIMUTH_BUCKETS * BYTES_PER_VALUE;
        long actualBytes = Files.size(file);
        if (actualBytes < expectedBytes) {
            log.error("Horizon mask {} is truncated: {} bytes, expected {}", file, actualBytes, expectedBytes);
            throw new IOException(
                    "Horizon mask " + file + " is truncated: " + actualBytes + " bytes, expected " + expectedBytes);
        }
        log.info("Loading ROI into RAM...");
        int rowValues = cols * AZIMUTH_BUCKETS;
        short[][] profile = new short[rows][rowValues];
        ByteBuffer buf = ByteBuffer.allocate(rowValues * BYTES_PER_VALUE).order(ByteOrder.LITTLE_ENDIAN);
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            for (int r = 0; r < rows; r++) {
                long offset = (((long) (yStart + r) * fullWidth) + xStart) * AZIMUTH_BUCKETS * BYTES_PER_VALUE;
                buf.clear();
                while (buf.hasRemaining()) {
                    int n = ch.read(buf, offset + buf.position());
                    if (n < 0) {
                        throw new IOException("Unexpected end of horizon mask " + file);
                    }
                }
                buf.flip();
                buf.asShortBuffer().get(profile[r]);
            }
        }
        return profile;
    }

    private static short[][] flipRows(short[][] data) {
        short[][] out = new short[data.length][];
        for (int r = 0; r < data.length; r++) {
            out[data.length - 1 - r] = data[r];
        }
        return out;
    }
}
