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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IlluminationFrameTest {

    @Test
    @DisplayName("Cells are addressed row-major")
    void rowMajor() {
        IlluminationFrame frame = new IlluminationFrame(2, 3, new double[] {0, 0.1, 0.2, 1, 0.9, 0.8});
        assertEquals(0.2, frame.at(0, 2));
        assertEquals(1.0, frame.at(1, 0));
    }

    @Test
    @DisplayName("Changing the input or returned array leaves the frame intact")
    void copies() {
        double[] input = {0.25, 0.75};
        IlluminationFrame frame = new IlluminationFrame(1, 2, input);

        input[0] = 1.0;
        frame.fractions()[1] = 0.0;

        assertEquals(0.25, frame.at(0, 0));
        assertEquals(0.75, frame.at(0, 1));
        assertArrayEquals(new double[] {0.25, 0.75}, frame.fractions());
    }

    @Test
    @DisplayName("Size must match the fraction count")
    void sizeMismatch() {
        assertThrows(IllegalArgumentException.class, () -> new IlluminationFrame(2, 2, new double[3]));
        assertThrows(IllegalArgumentException.class, () -> new IlluminationFrame(0, 2, new double[0]));
    }
}
