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
package com.github.tinemuz.illumination.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tinemuz.illumination.ephemeris.OrekitEphemerisProvider;
import com.github.tinemuz.illumination.output.NetcdfFrameSink;
import com.github.tinemuz.illumination.simulation.SimulationDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ucar.nc2.NetcdfFileWriter;

/**
 * Mission run configuration, read from JSON.
 *
 * <p>Relative paths are resolved against the directory holding the
 * configuration file. Dates without an offset are taken as UTC.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MissionConfig(
        @JsonProperty("paths") Paths paths,
        @JsonProperty("mission") Mission mission,
        @JsonProperty("output") Output output,
        @JsonProperty("ephemeris") Ephemeris ephemeris) {

    private static final Logger log = LoggerFactory.getLogger(MissionConfig.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public MissionConfig {
        if (paths == null) throw new IllegalArgumentException("Configuration has no 'paths' section");
        if (mission == null) throw new IllegalArgumentException("Configuration has no 'mission' section");
        if (output == null) output = new Output(null, null, null);
        if (ephemeris == null) ephemeris = new Ephemeris(null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Paths(
            @JsonProperty("output_meta") String demMetadata,
            @JsonProperty("output_horizon") String horizonProfile,
            @JsonProperty("output_netcdf") String netcdfOutput,
            @JsonProperty("kernel_dir") String kernelDirectory) {

        public Paths {
            if (demMetadata == null || horizonProfile == null || netcdfOutput == null) {
                throw new IllegalArgumentException(
                        "paths.output_meta, paths.output_horizon and paths.output_netcdf are required");
            }
            if (kernelDirectory == null) kernelDirectory = "input_data";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Mission(
            @JsonProperty("start_date") String startDate,
            @JsonProperty("end_date") String endDate,
            @JsonProperty("time_step_hours") Double timeStepHours) {

        public Mission {
            if (startDate == null || endDate == null) {
                throw new IllegalArgumentException("mission.start_date and mission.end_date are required");
            }
            if (timeStepHours == null) timeStepHours = 1.0;
            if (!(timeStepHours > 0.0)) {
                throw new IllegalArgumentException("mission.time_step_hours must be positive");
            }
        }

        public Instant start() {
            return parseUtc(startDate);
        }

        public Instant end() {
            return parseUtc(endDate);
        }

        public Duration timeStep() {
            return Duration.ofMillis(Math.round(timeStepHours * 3_600_000.0));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Output(
            @JsonProperty("format") String format,
            @JsonProperty("deflate_level") Integer deflateLevel,
            @JsonProperty("checkpoint_interval") Integer checkpointInterval) {

        public Output {
            if (format == null) format = "netcdf4";
            if (deflateLevel == null) deflateLevel = 4;
            if (checkpointInterval == null) checkpointInterval = SimulationDriver.DEFAULT_CHECKPOINT_INTERVAL;
        }

        public NetcdfFrameSink.Options sinkOptions() {
            NetcdfFileWriter.Version version;
            switch (format.toLowerCase(Locale.ROOT)) {
                case "netcdf3":
                    version = NetcdfFileWriter.Version.netcdf3;
                    break;
                case "netcdf4":
                    version = NetcdfFileWriter.Version.netcdf4;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown output.format '" + format + "'");
            }
            return new NetcdfFrameSink.Options(version, deflateLevel);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ephemeris(@JsonProperty("required_files") List<String> requiredFiles) {

        public Ephemeris {
            requiredFiles = requiredFiles == null
                    ? OrekitEphemerisProvider.DEFAULT_REQUIRED_FILES
                    : List.copyOf(requiredFiles);
        }
    }

    /**
     * Read a configuration file and resolve its relative paths.
     *
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException         if it cannot be read or is invalid
     */
    public static MissionConfig load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            log.error("Config file not found: {}", file);
            throw new NoSuchFileException(file.toString(), null, "Config file not found");
        }
        MissionConfig raw = MAPPER.readValue(file.toFile(), MissionConfig.class);
        Path base = file.toAbsolutePath().getParent();
        Paths p = raw.paths();
        return new MissionConfig(
                new Paths(
                        resolve(base, p.demMetadata()),
                        resolve(base, p.horizonProfile()),
                        resolve(base, p.netcdfOutput()),
                        resolve(base, p.kernelDirectory())),
                raw.mission(),
                raw.output(),
                raw.ephemeris());
    }

    /** ISO-8601 instant, offset date-time, local date-time or date; no offset means UTC. */
    static Instant parseUtc(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                try {
                    return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Cannot parse date '" + text + "'", e);
                }
            }
        }
    }

    private static String resolve(Path base, String path) {
        Path p = Path.of(path);
        return p.isAbsolute() || base == null ? p.toString() : base.resolve(p).normalize().toString();
    }
}
