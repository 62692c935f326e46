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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.bodies.CelestialBody;
import org.orekit.data.DirectoryCrawler;
import org.orekit.data.LazyLoadedDataContext;
import org.orekit.frames.Frame;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;
import org.orekit.utils.Constants;
import org.orekit.utils.PVCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ephemeris session backed by Orekit and a JPL DE ephemeris file.
 *
 * <p>Each session owns a private {@link LazyLoadedDataContext} fed from one
 * data directory, so nothing is registered in Orekit's default context and
 * two sessions never see each other's data. All required files must be
 * present when the session opens; they are parsed on the first query.</p>
 *
 * <p>The sun is observed from the Moon's center: the emission time is found
 * by light-time iteration in the barycentric ICRF, first-order stellar
 * aberration is applied with the Moon's barycentric velocity, and the result
 * is rotated into the Moon body-oriented frame at the observation time.</p>
 */
public final class OrekitEphemerisProvider implements EphemerisProvider {
    private static final Logger log = LoggerFactory.getLogger(OrekitEphemerisProvider.class);

    /** Leap-second table and planetary/lunar ephemeris expected by default. */
    public static final List<String> DEFAULT_REQUIRED_FILES =
            List.of("tai-utc.dat", "linux_p1550p2650.440");

    private static final int LIGHT_TIME_ITERATIONS = 3;

    private final LazyLoadedDataContext context;
    private CelestialBody sun;
    private CelestialBody moon;
    private Frame icrf;
    private Frame moonFixed;
    private TimeScale utc;
    private volatile boolean closed = false;

    private OrekitEphemerisProvider(LazyLoadedDataContext context) {
        this.context = context;
    }

    private void resolveBodies() {
        if (sun != null) return;
        log.info("Loading ephemeris data...");
        sun = context.getCelestialBodies().getSun();
        moon = context.getCelestialBodies().getMoon();
        icrf = context.getFrames().getICRF();
        moonFixed = moon.getBodyOrientedFrame();
        utc = context.getTimeScales().getUTC();
    }

    /**
     * Open a session on a data directory.
     *
     * @param dataDirectory directory searched recursively for data files
     * @param requiredFiles file names that must exist somewhere below it
     * @throws NoSuchFileException if the directory or any required file is missing
     * @throws IOException         if the directory cannot be scanned
     */
    public static OrekitEphemerisProvider open(Path dataDirectory, List<String> requiredFiles)
            throws IOException {
        if (!Files.isDirectory(dataDirectory)) {
            log.error("Ephemeris data directory missing: {}", dataDirectory);
            throw new NoSuchFileException(dataDirectory.toString(), null, "Ephemeris data directory missing");
        }
        List<String> missing = missingFiles(dataDirectory, requiredFiles);
        if (!missing.isEmpty()) {
            log.error("Missing ephemeris files in {}: {}", dataDirectory, missing);
            throw new NoSuchFileException(
                    dataDirectory.resolve(missing.get(0)).toString(), null, "Missing " + String.join(", ", missing));
        }
        LazyLoadedDataContext context = new LazyLoadedDataContext();
        context.getDataProvidersManager().addProvider(new DirectoryCrawler(dataDirectory.toFile()));
        log.info("Ephemeris data registered from {}", dataDirectory);
        return new OrekitEphemerisProvider(context);
    }

    static List<String> missingFiles(Path dataDirectory, List<String> requiredFiles) throws IOException {
        Set<String> present = new HashSet<>();
        try (Stream<Path> files = Files.walk(dataDirectory)) {
            files.filter(Files::isRegularFile).forEach(p -> present.add(p.getFileName().toString()));
        }
        List<String> missing = new ArrayList<>();
        for (String name : requiredFiles) {
            if (!present.contains(name)) missing.add(name);
        }
        return missing;
    }

    @Override
    public Vector3D sunVector(Instant time) {
        if (closed) {
            throw new IllegalStateException("Ephemeris session is closed");
        }
        resolveBodies();
        AbsoluteDate date = new AbsoluteDate(Date.from(time), utc);
        PVCoordinates observer = moon.getPVCoordinates(date, icrf);
        Vector3D observerPosition = observer.getPosition();

        // Emission time: iterate tau = |sun(t - tau) - moon(t)| / c
        double tau = 0.0;
        Vector3D relative = Vector3D.ZERO;
        for (int i = 0; i < LIGHT_TIME_ITERATIONS; i++) {
            Vector3D sunPosition = sun.getPVCoordinates(date.shiftedBy(-tau), icrf).getPosition();
            relative = sunPosition.subtract(observerPosition);
            tau = relative.getNorm() / Constants.SPEED_OF_LIGHT;
        }

        Vector3D apparent = aberrate(relative, observer.getVelocity());
        Vector3D bodyFixed = icrf.getTransformTo(moonFixed, date).transformVector(apparent);
        return bodyFixed.scalarMultiply(1.0e-3);
    }

    /** First-order stellar aberration; keeps the geometric distance. */
    static Vector3D aberrate(Vector3D relative, Vector3D observerVelocity) {
        double distance = relative.getNorm();
        Vector3D u = relative.normalize();
        Vector3D beta = observerVelocity.scalarMultiply(1.0 / Constants.SPEED_OF_LIGHT);
        Vector3D shifted = u.add(beta).subtract(u.scalarMultiply(Vector3D.dotProduct(u, beta)));
        return shifted.normalize().scalarMultiply(distance);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        context.getDataProvidersManager().clearProviders();
        context.getDataProvidersManager().clearLoadedDataNames();
        log.info("Ephemeris session closed");
    }
}
