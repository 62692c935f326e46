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
package com.github.tinemuz.illumination.simulation;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

import com.github.tinemuz.illumination.ephemeris.EphemerisProvider;
import com.github.tinemuz.illumination.ephemeris.GeometryGrid;
import com.github.tinemuz.illumination.ephemeris.LocalGeometry;
import com.github.tinemuz.illumination.ephemeris.SunState;
import com.github.tinemuz.illumination.output.FrameSink;
import com.github.tinemuz.illumination.physics.IlluminationFrame;
import com.github.tinemuz.illumination.physics.IlluminationPhysics;
import com.github.tinemuz.illumination.terrain.HorizonGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advances simulated time and streams illumination frames to a sink.
 *
 * <p>Each step runs, in order and on the calling thread: one ephemeris query,
 * the local geometry transform, the horizon lookup and the physics model.
 * Steps run from {@code start} to {@code end} inclusive. A frame is committed
 * to the sink before the next one is computed, and the sink is flushed every
 * {@code checkpointInterval} frames starting with the first.</p>
 *
 * <p>A driver runs once. {@link #requestStop()} and thread interruption are
 * honoured between frames.</p>
 */
public final class SimulationDriver {
    private static final Logger log = LoggerFactory.getLogger(SimulationDriver.class);

    public static final Duration DEFAULT_STEP = Duration.ofHours(1);
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 24;

    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private final HorizonGrid horizon;
    private final EphemerisProvider ephemeris;
    private final Instant start;
    private final Instant end;
    private final Duration step;
    private final int checkpointInterval;

    private boolean started = false;
    private volatile boolean stopRequested = false;
    private volatile Checkpoint lastCheckpoint;

    public SimulationDriver(HorizonGrid horizon, EphemerisProvider ephemeris, Instant start, Instant end) {
        this(horizon, ephemeris, start, end, DEFAULT_STEP, DEFAULT_CHECKPOINT_INTERVAL);
    }

    public SimulationDriver(
            HorizonGrid horizon,
            EphemerisProvider ephemeris,
            Instant start,
            Instant end,
            Duration step,
            int checkpointInterval) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("End " + end + " is before start " + start);
        }
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Time step must be positive, got " + step);
        }
        if (checkpointInterval <= 0) {
            throw new IllegalArgumentException("Checkpoint interval must be positive, got " + checkpointInterval);
        }
        this.horizon = horizon;
        this.ephemeris = ephemeris;
        this.start = start;
        this.end = end;
        this.step = step;
        this.checkpointInterval = checkpointInterval;
    }

    /** Number of steps between start and end inclusive. */
    public long stepCount() {
        return Duration.between(start, end).toNanos() / step.toNanos() + 1;
    }

    /**
     * Illumination of the whole grid at one instant.
     *
     * <p>Nothing computed here outlives the call except the returned frame.</p>
     */
    public IlluminationFrame computeFrame(Instant time) {
        SunState sun = ephemeris.sunState(time);
        GeometryGrid geometry = LocalGeometry.compute(sun.position(), horizon.surface());
        double[] horizonElevation = horizon.lookup(geometry.azimuthDeg());
        double[] fractions = IlluminationPhysics.fractions(
                geometry.elevationDeg(), horizonElevation, sun.apparentRadiusDeg());
        return new IlluminationFrame(horizon.rows(), horizon.cols(), fractions);
    }

    /**
     * Lazy sequence of frames from start to end. Each {@code next()} computes
     * one step.
     *
     * @throws IllegalStateException if the sequence was already handed out
     */
    public synchronized Iterator<TimedFrame> frames() {
        if (started) {
            throw new IllegalStateException("Simulation frames can only be iterated once");
        }
        started = true;
        log.info("Physics Engine: Grid {}x{}, {} steps from {} to {}",
                horizon.rows(), horizon.cols(), stepCount(), start, end);
        return new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return !timeAt(index).isAfter(end);
            }

            @Override
            public TimedFrame next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Instant time = timeAt(index);
                TimedFrame frame = new TimedFrame(index, time, elapsedHours(time), computeFrame(time));
                index++;
                return frame;
            }
        };
    }

    /**
     * Run the whole simulation into {@code sink}.
     *
     * <p>The driver owns the sink from here on and closes it on every exit
     * path. Frames committed before a failure or a stop stay in the sink.</p>
     *
     * @return {@link RunResult.Outcome#COMPLETED} or, after a stop request or
     *         thread interruption, {@link RunResult.Outcome#INTERRUPTED}
     * @throws IOException if the sink fails; computation errors propagate unchanged
     */
    public RunResult run(FrameSink sink) throws IOException {
        RunResult.Outcome outcome = RunResult.Outcome.COMPLETED;
        try (FrameSink out = sink) {
            Iterator<TimedFrame> it = frames();
            log.info("Starting Simulation Loop (Streaming to Disk)...");
            while (it.hasNext()) {
                if (stopRequested || Thread.currentThread().isInterrupted()) {
                    log.info("Simulation interrupted by user. Saving progress...");
                    outcome = RunResult.Outcome.INTERRUPTED;
                    break;
                }
                TimedFrame frame = it.next();
                out.append(frame.elapsedHours(), frame.frame());
                lastCheckpoint = new Checkpoint(frame.index(), frame.time(), frame.elapsedHours());
                if (frame.index() % checkpointInterval == 0) {
                    out.flush();
                    log.info("Saved Frame {} ({})", frame.index(), frame.time());
                }
            }
            if (outcome == RunResult.Outcome.COMPLETED) {
                log.info("Mission Complete.");
            }
            return new RunResult(outcome, out.frameCount(), lastCheckpoint());
        } catch (IOException | RuntimeException e) {
            log.error("Simulation failed after {} committed frames", sink.frameCount(), e);
            throw e;
        }
    }

    /** Ask a running simulation to stop after the frame in progress. */
    public void requestStop() {
        stopRequested = true;
    }

    /** Last frame committed by {@link #run}, if any. */
    public Optional<Checkpoint> lastCheckpoint() {
        return Optional.ofNullable(lastCheckpoint);
    }

    private Instant timeAt(int index) {
        return start.plus(step.multipliedBy(index));
    }

    private double elapsedHours(Instant time) {
        return Duration.between(start, time).toNanos() / NANOS_PER_HOUR;
    }
}
