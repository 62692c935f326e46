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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

import com.github.tinemuz.illumination.physics.IlluminationFrame;
import com.github.tinemuz.illumination.terrain.SurfaceGrid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ucar.nc2.NetcdfFile;
import ucar.nc2.NetcdfFileWriter;
import ucar.nc2.Variable;
import ucar.nc2.write.Nc4Chunking;

/**
 * Writes small series in classic NetCDF format (no native library needed)
 * and reads them back with netCDF-Java.
 */
class NetcdfFrameSinkTest {

    private static final Instant START = Instant.parse("2030-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2030-01-01T01:00:00Z");
    private static final NetcdfFrameSink.Options CLASSIC =
            new NetcdfFrameSink.Options(NetcdfFileWriter.Version.netcdf3, 0);

    @TempDir
    Path tmp;

    private static SurfaceGrid grid() {
        double[] x = {100.0, 120.0, 140.0};
        double[] y = {-40.0, -60.0};
        double[] lat = {-85.0, -85.1, -85.2, -85.3, -85.4, -85.5};
        double[] lon = {30.0, 31.0, 32.0, 30.5, 31.5, 32.5};
        return new SurfaceGrid(x, y, lat, lon);
    }

    @Test
    @DisplayName("Frames, times and coordinates land in the file")
    void writesSeries() throws IOException {
        Path out = tmp.resolve("series.nc");
        try (NetcdfFrameSink sink = NetcdfFrameSink.create(out, grid(), START, END, CLASSIC)) {
            sink.append(0.0, new IlluminationFrame(2, 3, new double[] {0, 0.5, 1, 1, 0.5, 0}));
            sink.append(1.0, new IlluminationFrame(2, 3, new double[] {1, 1, 1, 0, 0, Double.NaN}));
            sink.flush();
            assertEquals(2, sink.frameCount());
        }

        try (NetcdfFile nc = NetcdfFile.open(out.toString())) {
            assertTrue(nc.findDimension("time").isUnlimited());
            assertEquals(2, nc.findDimension("time").getLength());
            assertEquals(2, nc.findDimension("y").getLength());
            assertEquals(3, nc.findDimension("x").getLength());

            double[] time = (double[]) nc.findVariable("time").read().copyTo1DJavaArray();
            assertArrayEquals(new double[] {0.0, 1.0}, time);

            double[] y = (double[]) nc.findVariable("y").read().copyTo1DJavaArray();
            assertTrue(y[0] > y[1], "y decreasing");

            byte[] packed = (byte[]) nc.findVariable("illumination").read().copyTo1DJavaArray();
            assertArrayEquals(new byte[] {-127, 0, 127, 127, 0, -127, 127, 127, 127, -127, -127, -128}, packed);
        }
    }

    @Test
    @DisplayName("Packing, grid mapping and CF attributes are declared")
    void writesAttributes() throws IOException {
        Path out = tmp.resolve("attrs.nc");
        NetcdfFrameSink.create(out, grid(), START, END, CLASSIC).close();

        try (NetcdfFile nc = NetcdfFile.open(out.toString())) {
            assertEquals("CF-1.7", nc.findGlobalAttribute("Conventions").getStringValue());
            assertEquals("2030-01-01T00:00:00Z", nc.findGlobalAttribute("time_coverage_start").getStringValue());
            assertEquals(-85.5, nc.findGlobalAttribute("geospatial_lat_min").getNumericValue().doubleValue(), 1e-12);

            Variable illum = nc.findVariable("illumination");
            assertEquals(1.0 / 254.0, illum.findAttribute("scale_factor").getNumericValue().doubleValue(), 1e-15);
            assertEquals(0.5, illum.findAttribute("add_offset").getNumericValue().doubleValue());
            assertEquals(-128, illum.findAttribute("_FillValue").getNumericValue().intValue());
            assertEquals("polar_stereographic", illum.findAttribute("grid_mapping").getStringValue());

            Variable crs = nc.findVariable("polar_stereographic");
            assertEquals(-90.0,
                    crs.findAttribute("latitude_of_projection_origin").getNumericValue().doubleValue());
            assertEquals(1737400.0, crs.findAttribute("semi_major_axis").getNumericValue().doubleValue());

            assertEquals("hours since 2030-01-01T00:00:00Z",
                    nc.findVariable("time").findAttribute("units").getStringValue());
        }
    }

    @Test
    @DisplayName("Close is idempotent and appends after close are refused")
    void closeOnce() throws IOException {
        NetcdfFrameSink sink = NetcdfFrameSink.create(tmp.resolve("closed.nc"), grid(), START, END, CLASSIC);
        sink.close();
        sink.close();
        assertThrows(IllegalStateException.class,
                () -> sink.append(0.0, new IlluminationFrame(2, 3, new double[6])));
    }

    @Nested
    @DisplayName("Data variable storage")
    class Storage {

        private Variable declare(boolean chunked) throws IOException {
            NetcdfFileWriter writer =
                    NetcdfFileWriter.createNew(NetcdfFileWriter.Version.netcdf3, tmp.resolve("define.nc").toString());
            writer.addUnlimitedDimension("time");
            writer.addDimension(null, "y", 300);
            writer.addDimension(null, "x", 400);
            return NetcdfFrameSink.declareIllumination(writer, 300, 400, chunked);
        }

        @Test
        @DisplayName("NetCDF-4 stores one deflated, shuffled time slice per chunk")
        void netcdf4Chunking() throws IOException {
            Nc4Chunking chunker = NetcdfFrameSink.chunking(NetcdfFrameSink.Options.DEFAULT);
            Variable illum = declare(true);

            assertNotNull(chunker);
            assertTrue(chunker.isChunked(illum));
            assertArrayEquals(new long[] {1, 300, 400}, chunker.computeChunking(illum));
            assertEquals(4, chunker.getDeflateLevel(illum));
            assertTrue(chunker.isShuffle(illum));
        }

        @Test
        @DisplayName("Deflate level follows the options")
        void deflateLevel() throws IOException {
            Nc4Chunking chunker = NetcdfFrameSink.chunking(
                    new NetcdfFrameSink.Options(NetcdfFileWriter.Version.netcdf4, 9));
            assertEquals(9, chunker.getDeflateLevel(declare(true)));
        }

        @Test
        @DisplayName("Classic format has no chunking")
        void classic() throws IOException {
            assertNull(NetcdfFrameSink.chunking(CLASSIC));
            assertNull(declare(false).findAttribute("_ChunkSizes"));
        }

        @Test
        @DisplayName("Deflate level outside 0..9 is rejected")
        void badDeflate() {
            assertThrows(IllegalArgumentException.class,
                    () -> new NetcdfFrameSink.Options(NetcdfFileWriter.Version.netcdf4, 10));
        }
    }

    @Test
    @DisplayName("Frames of the wrong size are rejected")
    void wrongSize() throws IOException {
        try (NetcdfFrameSink sink = NetcdfFrameSink.create(tmp.resolve("size.nc"), grid(), START, END, CLASSIC)) {
            assertThrows(IllegalArgumentException.class,
                    () -> sink.append(0.0, new IlluminationFrame(3, 2, new double[6])));
            assertEquals(0, sink.frameCount());
        }
    }
}
