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

import java.io.Closeable;
import java.io.IOException;

import com.github.tinemuz.illumination.physics.IlluminationFrame;

/**
 * Append-only destination for the illumination time series.
 *
 * <p>Frames are appended in time order and committed one by one; nothing
 * already appended is ever rewritten. {@link #close()} may be called more
 * than once but only the first call has an effect.</p>
 */
public interface FrameSink extends Closeable {

    /**
     * Commit one frame.
     *
     * @param elapsedHours hours since mission start
     * @param frame        fractions for the whole grid
     * @throws IllegalStateException if the sink is closed
     */
    void append(double elapsedHours, IlluminationFrame frame) throws IOException;

    /** Push committed frames to durable storage. */
    void flush() throws IOException;

    /** Number of frames committed so far. */
    int frameCount();
}
