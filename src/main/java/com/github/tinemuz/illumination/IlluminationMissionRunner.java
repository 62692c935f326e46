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
package com.github.tinemuz.illumination;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

import com.github.tinemuz.illumination.config.MissionConfig;
import com.github.tinemuz.illumination.ephemeris.OrekitEphemerisProvider;
import com.github.tinemuz.illumination.output.FrameSink;
import com.github.tinemuz.illumination.output.NetcdfFrameSink;
import com.github.tinemuz.illumination.simulation.RunResult;
import com.github.tinemuz.illumination.simulation.SimulationDriver;
import com.github.tinemuz.illumination.terrain.DemMetadata;
import com.github.tinemuz.illumination.terrain.HorizonGrid;
import com.github.tinemuz.illumination.terrain.PolarStereographicReprojection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: {@code java -jar lunar-illumination.jar [config.json]}.
 *
 * <p>Ctrl-C stops the run after the frame in progress; the output file is
 * closed with every committed frame before the JVM exits.</p>
 */
public final class IlluminationMissionRunner {
    private static final Logger log = LoggerFactory.getLogger(IlluminationMissionRunner.class);

    private static final String DEFAULT_CONFIG = "config.json";

    private IlluminationMissionRunner() {}

    public static void main(String[] args) {
        Path configFile = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        int status;
        try {
            RunResult result = run(MissionConfig.load(configFile));
            log.info("Run {} with {} frames written", result.outcome(), result.framesWritten());
            status = 0;
        } catch (Exception e) {
            log.error("CRITICAL ERROR: {}", e.getMessage(), e);
            status = 1;
        }
        System.exit(status);
    }

    /** Load inputs, open the ephemeris session and stream the whole mission to NetCDF. */
    public static RunResult run(MissionConfig config) throws Exception {
        log.info("Initializing Mission...");
        MissionConfig.Paths paths = config.paths();
        DemMetadata metadata = DemMetadata.load(Path.of(paths.demMetadata()));
        HorizonGrid horizon = HorizonGrid.load(
                metadata,
                Path.of(paths.horizonProfile()),
                PolarStereographicReprojection.fromProj(metadata.crs()));

        MissionConfig.Mission mission = config.mission();
        try (OrekitEphemerisProvider ephemeris = OrekitEphemerisProvider.open(
                Path.of(paths.kernelDirectory()), config.ephemeris().requiredFiles())) {
            SimulationDriver driver = new SimulationDriver(
                    horizon,
                    ephemeris,
                    mission.start(),
                    mission.end(),
                    mission.timeStep(),
                    config.output().checkpointInterval());
            NetcdfFrameSink.Options sinkOptions = config.output().sinkOptions();
            Path output = Path.of(paths.netcdfOutput());
            return runWithStopHook(driver, () -> NetcdfFrameSink.create(
                    output, horizon.surface(), mission.start(), mission.end(), sinkOptions));
        }
    }

    /** Opens the output once the stop hook is in place. */
    interface SinkOpener {
        FrameSink open() throws IOException;
    }

    /**
     * Run {@code driver} with a shutdown hook that requests a stop and waits
     * for the sink to be closed. The hook is registered before the sink is
     * opened, so a refused registration leaves nothing open.
     */
    static RunResult runWithStopHook(SimulationDriver driver, SinkOpener openSink) throws IOException {
        CountDownLatch finished = new CountDownLatch(1);
        Thread stopHook = new Thread(() -> {
            driver.requestStop();
            try {
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "illumination-stop");
        Runtime.getRuntime().addShutdownHook(stopHook);
        try {
            return driver.run(openSink.open());
        } finally {
            finished.countDown();
            removeHook(stopHook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running and will see the latch
            log.debug("Shutdown in progress, stop hook left in place");
        }
    }
}
