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
package com.github.tinemuz.transfer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ComplexArrayTest {

    @Test
    @DisplayName("fftShift moves index 0 to the centre of each axis")
    void fftShiftEven() {
        ComplexArray a = new ComplexArray(4, 4);
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 4; j++) a.set(i, j, 10 * i + j, -(10 * i + j));
        }
        ComplexArray shifted = a.fftShift();
        assertEquals(0.0, shifted.re(2, 2), 0.0);
        assertEquals(-0.0, shifted.im(2, 2), 0.0);
        assertEquals(33.0, shifted.re(1, 1), 0.0);
        assertEquals(21.0, shifted.re(0, 3), 0.0);
        assertEquals(0.0, a.re(0, 0), 0.0, "source untouched");
    }

    @Test
    @DisplayName("fftShift of odd lengths rotates by n / 2")
    void fftShiftOdd() {
        ComplexArray a = new ComplexArray(1, 5);
        for (int j = 0; j < 5; j++) a.set(0, j, j, 0.0);
        ComplexArray shifted = a.fftShift();
        double[] expected = {3, 4, 0, 1, 2};
        for (int j = 0; j < 5; j++) assertEquals(expected[j], shifted.re(0, j), 0.0);
    }

    @Test
    @DisplayName("Real scaling, modulus and exp")
    void arithmetic() {
        ComplexArray a = ComplexArray.exp(new double[][] {{0.0, Math.PI / 2}});
        assertEquals(1.0, a.re(0, 0), 0.0);
        assertEquals(1.0, a.im(0, 1), 1e-15);
        ComplexArray b = a.multiply(new double[][] {{2.0, 3.0}});
        assertEquals(2.0, b.abs()[0][0], 1e-15);
        assertEquals(9.0, b.abs2()[0][1], 1e-12);
        assertThrows(IllegalArgumentException.class, () -> a.multiply(new double[][] {{1.0}}));
    }

    @Test
    @DisplayName("Copies are deep and compare by value")
    void copyAndEquality() {
        ComplexArray a = ComplexArray.ofReal(new double[][] {{1.0, 2.0}, {3.0, 4.0}});
        ComplexArray copy = a.copy();
        assertEquals(a, copy);
        copy.set(0, 0, 5.0, 0.0);
        assertNotEquals(a, copy);
        assertEquals(1.0, a.re(0, 0), 0.0);
    }
}
