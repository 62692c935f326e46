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
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Description of the full (buffered) DEM tile the horizon profile was cast on.
 *
 * <p>Read from the JSON sidecar written by terrain extraction. The affine
 * transform uses GDAL coefficient order:
 * {@code x = t[0] + col * t[1] + row * t[2]}, {@code y = t[3] + col * t[4] + row * t[5]}.</p>
 *
 * @param width           full grid width in pixels
 * @param height          full grid height in pixels
 * @param transform       six GDAL geotransform coefficients
 * @param crs             PROJ definition of the projected coordinate system
 * @param observerHeightM observer height above terrain used when casting horizons
 * @param bufferMeters    edge buffer trimmed before simulation (defaults to 50 km)
 * @param pixelScale      pixel size in meters (defaults to {@code |t[1]|})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DemMetadata(
        @JsonProperty("width") int width,
        @JsonProperty("height") int height,
        @JsonProperty("transform") double[] transform,
        @JsonProperty("crs") String crs,
        @JsonProperty("observer_height_m") double observerHeightM,
        @JsonProperty("buffer_meters") Double bufferMeters,
        @JsonProperty("pixel_scale") Double pixelScale) {

    public static final double DEFAULT_BUFFER_METERS = 50_000.0;

    private static final Logger log = LoggerFactory.getLogger(DemMetadata.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public DemMetadata {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("DEM size must be positive, got " + width + "x" + height);
        }
        if (transform == null || transform.length != 6) {
            throw new IllegalArgumentException("DEM transform must have 6 GDAL coefficients");
        }
        if (transform[1] == 0.0 || transform[5] == 0.0) {
            throw new IllegalArgumentException("DEM transform has a zero pixel size");
        }
        if (bufferMeters == null) bufferMeters = DEFAULT_BUFFER_METERS;
        if (pixelScale == null || !(pixelScale > 0.0)) pixelScale = Math.abs(transform[1]);
    }

    /** Buffer width in whole pixels, rounded to nearest. */
    public int bufferPixels() {
        return (int) Math.round(bufferMeters / pixelScale);
    }

    /**
     * Read metadata from a JSON file.
     *
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException         if it cannot be read or parsed
     */
    public static DemMetadata load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            log.error("DEM metadata missing: {}", path);
            throw new NoSuchFileException(path.toString(), null, "DEM metadata missing");
        }
        return MAPPER.readValue(path.toFile(), DemMetadata.class);
    }
}
