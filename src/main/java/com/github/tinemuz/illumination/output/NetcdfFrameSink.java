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
package com.github.tinemuz.illumination.output;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.github.tinemuz.illumination.physics.IlluminationFrame;
import com.github.tinemuz.illumination.terrain.PolarStereographicReprojection;
import com.github.tinemuz.illumination.terrain.SurfaceGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.Dimension;
import ucar.nc2.NetcdfFileWriter;
import ucar.nc2.Variable;
import ucar.nc2.write.Nc4Chunking;
import ucar.nc2.write.Nc4ChunkingStrategy;

/**
 * CF-1.7 NetCDF time series of packed illumination fractions.
 *
 * <p>Layout: unlimited {@code time}, fixed {@code y} (decreasing) and
 * {@code x}; a scalar {@code polar_stereographic} grid mapping; coordinate
 * variables {@code time} (hours since start), {@code y}, {@code x} in meters;
 * and the {@code illumination} byte variable with scale 1/254, offset 0.5 and
 * fill value -128. In NetCDF-4 format the data variable is stored one time
 * slice per chunk, deflated and byte-shuffled; NetCDF-3 has no compression
 * and writes the same variables uncompressed.</p>
 */
public final class NetcdfFrameSink implements FrameSink {
    private static final Logger log = LoggerFactory.getLogger(NetcdfFrameSink.class);

    public static final String VAR_ILLUMINATION = "illumination";
    public static final String VAR_TIME = "time";
    public static final String VAR_GRID_MAPPING = "polar_stereographic";

    /** Storage options for the output file. */
    public record Options(NetcdfFileWriter.Version version, int deflateLevel) {
        public static final Options DEFAULT = new Options(NetcdfFileWriter.Version.netcdf4, 4);

        public Options {
            if (deflateLevel < 0 || deflateLevel > 9) {
                throw new IllegalArgumentException("Deflate level must be 0..9, got " + deflateLevel);
            }
        }
    }

    private final NetcdfFileWriter writer;
    private final Variable timeVar;
    private final Variable illumVar;
    private final int rows;
    private final int cols;
    private final Path location;
    private int frames = 0;
    private boolean closed = false;

    private NetcdfFrameSink(
            NetcdfFileWriter writer, Variable timeVar, Variable illumVar, int rows, int cols, Path location) {
        this.writer = writer;
        this.timeVar = timeVar;
        this.illumVar = illumVar;
        this.rows = rows;
        this.cols = cols;
        this.location = location;
    }

    /**
     * Create the output file, write its header and coordinates, and leave it
     * open for frames.
     *
     * @param output path of the file to create (overwritten if present)
     * @param grid   pixel coordinates, rows North to South
     * @param start  mission start; time values count hours from here
     * @param end    mission end, recorded in the coverage attributes
     */
    public static NetcdfFrameSink create(Path output, SurfaceGrid grid, Instant start, Instant end, Options options)
            throws IOException {
        log.info("Saving NetCDF ({}, 8-bit packed) to {}", options.version(), output);
        Nc4Chunking chunker = chunking(options);
        NetcdfFileWriter writer = NetcdfFileWriter.createNew(options.version(), output.toString(), chunker);
        try {
            int rows = grid.rows();
            int cols = grid.cols();

            writer.addGroupAttribute(null, new Attribute("title", "Lunar Surface Illumination Map"));
            writer.addGroupAttribute(null, new Attribute("institution", "Mission Planning"));
            writer.addGroupAttribute(null, new Attribute("source", "LRO LOLA DEM, JPL DE ephemeris"));
            writer.addGroupAttribute(null, new Attribute("history",
                    DateTimeFormatter.ISO_LOCAL_DATE.format(Instant.now().atOffset(ZoneOffset.UTC))
                            + ": Created with lunar-illumination"));
            writer.addGroupAttribute(null, new Attribute("Conventions", "CF-1.7"));
            writer.addGroupAttribute(null, new Attribute("geospatial_lat_min", grid.minLatitudeDeg()));
            writer.addGroupAttribute(null, new Attribute("geospatial_lat_max", grid.maxLatitudeDeg()));
            writer.addGroupAttribute(null, new Attribute("geospatial_lon_min", grid.minLongitudeDeg()));
            writer.addGroupAttribute(null, new Attribute("geospatial_lon_max", grid.maxLongitudeDeg()));
            writer.addGroupAttribute(null, new Attribute("time_coverage_start", start.toString()));
            writer.addGroupAttribute(null, new Attribute("time_coverage_end", end.toString()));

            writer.addUnlimitedDimension("time");
            writer.addDimension(null, "y", rows);
            writer.addDimension(null, "x", cols);

            Variable crs = writer.addVariable(null, VAR_GRID_MAPPING, DataType.INT, new ArrayList<Dimension>());
            writer.addVariableAttribute(crs, new Attribute("grid_mapping_name", "polar_stereographic"));
            writer.addVariableAttribute(crs, new Attribute("latitude_of_projection_origin", -90.0));
            writer.addVariableAttribute(crs, new Attribute("straight_vertical_longitude_from_pole", 0.0));
            writer.addVariableAttribute(crs, new Attribute("scale_factor_at_projection_origin", 1.0));
            writer.addVariableAttribute(crs, new Attribute("false_easting", 0.0));
            writer.addVariableAttribute(crs, new Attribute("false_northing", 0.0));
            writer.addVariableAttribute(crs,
                    new Attribute("semi_major_axis", PolarStereographicReprojection.MOON_RADIUS_M));
            writer.addVariableAttribute(crs, new Attribute("inverse_flattening", 0.0));
            writer.addVariableAttribute(crs,
                    new Attribute("spatial_ref", PolarStereographicReprojection.LUNAR_SOUTH_POLE_PROJ));

            Variable time = writer.addVariable(null, VAR_TIME, DataType.DOUBLE, "time");
            writer.addVariableAttribute(time, new Attribute("units", "hours since " + start));
            writer.addVariableAttribute(time, new Attribute("standard_name", "time"));

            Variable y = writer.addVariable(null, "y", DataType.DOUBLE, "y");
            writer.addVariableAttribute(y, new Attribute("standard_name", "projection_y_coordinate"));
            writer.addVariableAttribute(y, new Attribute("units", "m"));
            writer.addVariableAttribute(y, new Attribute("axis", "Y"));

            Variable x = writer.addVariable(null, "x", DataType.DOUBLE, "x");
            writer.addVariableAttribute(x, new Attribute("standard_name", "projection_x_coordinate"));
            writer.addVariableAttribute(x, new Attribute("units", "m"));
            writer.addVariableAttribute(x, new Attribute("axis", "X"));

            Variable illum = declareIllumination(writer, rows, cols, chunker != null);

            writer.create();

            writer.write(crs, Array.factory(DataType.INT, new int[0], new int[] {0}));
            writer.write(y, Array.factory(DataType.DOUBLE, new int[] {rows}, grid.yCoordinates()));
            writer.write(x, Array.factory(DataType.DOUBLE, new int[] {cols}, grid.xCoordinates()));
            writer.flush();
            return new NetcdfFrameSink(writer, time, illum, rows, cols, output);
        } catch (InvalidRangeException e) {
            IOException failure = new IOException("Failed to initialise " + output, e);
            abortQuietly(writer, output, failure);
            throw failure;
        } catch (IOException | RuntimeException e) {
            abortQuietly(writer, output, e);
            throw e;
        }
    }

    /** Deflated, shuffled chunking for NetCDF-4; {@code null} for the classic format. */
    static Nc4Chunking chunking(Options options) {
        if (options.version() == NetcdfFileWriter.Version.netcdf3) {
            return null;
        }
        return Nc4ChunkingStrategy.factory(Nc4Chunking.Strategy.standard, options.deflateLevel(), true);
    }

    /**
     * Declare the packed data variable on a writer in define mode. The
     * {@code time}, {@code y} and {@code x} dimensions must already exist.
     */
    static Variable declareIllumination(NetcdfFileWriter writer, int rows, int cols, boolean chunked) {
        Variable illum = writer.addVariable(null, VAR_ILLUMINATION, DataType.BYTE, "time y x");
        writer.addVariableAttribute(illum,
                new Attribute("standard_name", "surface_downwelling_shortwave_flux_in_air"));
        writer.addVariableAttribute(illum, new Attribute("long_name", "Solar Illumination Fraction"));
        writer.addVariableAttribute(illum, new Attribute("units", "1"));
        writer.addVariableAttribute(illum, new Attribute("_FillValue", Packing.FILL_VALUE));
        writer.addVariableAttribute(illum, new Attribute("valid_range",
                Array.factory(DataType.BYTE, new int[] {2}, new byte[] {Packing.MIN_PACKED, Packing.MAX_PACKED})));
        writer.addVariableAttribute(illum, new Attribute("grid_mapping", VAR_GRID_MAPPING));
        writer.addVariableAttribute(illum, new Attribute("scale_factor", Packing.SCALE_FACTOR));
        writer.addVariableAttribute(illum, new Attribute("add_offset", Packing.ADD_OFFSET));
        if (chunked) {
            // One time slice per chunk
            writer.addVariableAttribute(illum, new Attribute("_ChunkSizes",
                    Array.factory(DataType.INT, new int[] {3}, new int[] {1, rows, cols})));
        }
        return illum;
    }

    private static void abortQuietly(NetcdfFileWriter writer, Path output, Exception cause) {
        log.error("Failed to initialise NetCDF output {}", output, cause);
        try {
            writer.abort();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void append(double elapsedHours, IlluminationFrame frame) throws IOException {
        if (closed) {
            throw new IllegalStateException("NetCDF output " + location + " is closed");
        }
        if (frame.rows() != rows || frame.cols() != cols) {
            throw new IllegalArgumentException(
                    "Frame is " + frame.rows() + "x" + frame.cols() + ", output is " + rows + "x" + cols);
        }
        int index = frames;
        try {
            writer.write(timeVar, new int[] {index},
                    Array.factory(DataType.DOUBLE, new int[] {1}, new double[] {elapsedHours}));
            writer.write(illumVar, new int[] {index, 0, 0},
                    Array.factory(DataType.BYTE, new int[] {1, rows, cols}, Packing.pack(frame.fractions())));
        } catch (InvalidRangeException e) {
            throw new IOException("Cannot write frame " + index + " to " + location, e);
        }
        frames++;
    }

    @Override
    public void flush() throws IOException {
        if (closed) return;
        writer.flush();
    }

    @Override
    public int frameCount() {
        return frames;
    }

    public Path location() {
        return location;
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        writer.close();
        log.info("NetCDF file closed safely ({} frames).", frames);
    }
}
