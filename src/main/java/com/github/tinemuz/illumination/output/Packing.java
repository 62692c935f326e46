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

/**
 * Signed 8-bit packing of illumination fractions.
 *
 * <p>{@code value = packed * SCALE_FACTOR + ADD_OFFSET}, so 0 packs to -127,
 * 0.5 to 0 and 1 to 127. -128 is reserved as the fill value.</p>
 */
public final class Packing {

    public static final double SCALE_FACTOR = 1.0 / 254.0;
    public static final double ADD_OFFSET = 0.5;
    public static final byte FILL_VALUE = -128;
    public static final byte MIN_PACKED = -127;
    public static final byte MAX_PACKED = 127;

    private Packing() {}

    /** Pack one fraction; out-of-range values clamp, NaN becomes the fill value. */
    public static byte pack(double fraction) {
        if (Double.isNaN(fraction)) return FILL_VALUE;
        long packed = Math.round((fraction - ADD_OFFSET) / SCALE_FACTOR);
        if (packed < MIN_PACKED) return MIN_PACKED;
        if (packed > MAX_PACKED) return MAX_PACKED;
        return (byte) packed;
    }

    /** Unpack one value; the fill value unpacks to NaN. */
    public static double unpack(byte packed) {
        if (packed == FILL_VALUE) return Double.NaN;
        return packed * SCALE_FACTOR + ADD_OFFSET;
    }

    public static byte[] pack(double[] fractions) {
        byte[] out = new byte[fractions.length];
        for (int i = 0; i < fractions.length; i++) {
            out[i] = pack(fractions[i]);
        }
        return out;
    }
}
