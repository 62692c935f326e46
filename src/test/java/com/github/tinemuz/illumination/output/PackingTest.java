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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PackingTest {

    @Test
    @DisplayName("Endpoints pack to -127 and 127, midpoint to 0")
    void endpoints() {
        assertEquals(-127, Packing.pack(0.0));
        assertEquals(127, Packing.pack(1.0));
        assertEquals(0, Packing.pack(0.5));
    }

    @Test
    @DisplayName("Unpacked value is within half a packing step")
    void roundTripPrecision() {
        double halfStep = 0.5 / 254.0;
        for (int i = 0; i <= 10_000; i++) {
            double v = i / 10_000.0;
            double back = Packing.unpack(Packing.pack(v));
            assertEquals(v, back, halfStep + 1e-12, "v=" + v);
        }
    }

    @Test
    @DisplayName("Out-of-range values clamp and never hit the fill value")
    void clamping() {
        assertEquals(-127, Packing.pack(-0.2));
        assertEquals(127, Packing.pack(1.7));
        assertEquals(-127, Packing.pack(Double.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("NaN packs to the fill value and back")
    void fillValue() {
        assertEquals(Packing.FILL_VALUE, Packing.pack(Double.NaN));
        assertTrue(Double.isNaN(Packing.unpack(Packing.FILL_VALUE)));
    }

    @Test
    @DisplayName("Array packing matches element packing")
    void arrayPacking() {
        double[] values = {0.0, 0.25, 0.5, 1.0, Double.NaN};
        byte[] packed = Packing.pack(values);
        for (int i = 0; i < values.length; i++) {
            assertEquals(Packing.pack(values[i]), packed[i]);
        }
    }
}
