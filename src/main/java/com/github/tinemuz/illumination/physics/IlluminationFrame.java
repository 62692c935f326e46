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
package com.github.tinemuz.illumination.physics;

/**
 * Illumination fractions of one instant, row-major, rows North to South.
 *
 * <p>Frames are handed to the output sink once and then dropped. The
 * fractions are copied in and out, so a frame never changes.</p>
 */
public record IlluminationFrame(int rows, int cols, double[] fractions) {

    public IlluminationFrame {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Frame must have positive size, got " + rows + "x" + cols);
        }
        if (fractions.length != rows * cols) {
            throw new IllegalArgumentException(
                    "Expected " + rows * cols + " fractions, got " + fractions.length);
        }
        fractions = fractions.clone();
    }

    /** Copy of the row-major fractions. */
    @Override
    public double[] fractions() {
        return fractions.clone();
    }

    public double at(int row, int col) {
        return fractions[row * cols + col];
    }
}
