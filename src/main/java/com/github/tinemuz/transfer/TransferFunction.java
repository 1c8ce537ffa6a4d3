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

import java.util.Arrays;

/**
 * A built transfer function: the batch of complex arrays with the zero
 * frequency centred, together with the real-space extent (Å) and beam energy
 * (eV) it was computed for.
 */
public final class TransferFunction {
    private final ComplexArray[] array;
    private final double[] extent;

    /** Beam energy in electronvolts (eV). */
    public final double energy;

    TransferFunction(ComplexArray[] array, double[] extent, double energy) {
        this.array = array.clone();
        this.extent = extent.clone();
        this.energy = energy;
    }

    /** The centred arrays, one per image of the batch. */
    public ComplexArray[] getArray() {
        return array.clone();
    }

    /** Real-space extent (Å) of each axis. */
    public double[] getExtent() {
        return extent.clone();
    }

    /** The single image of a batch of one. */
    public ComplexArray image() {
        return array[0];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransferFunction)) return false;
        TransferFunction other = (TransferFunction) o;
        return Double.compare(energy, other.energy) == 0
                && Arrays.equals(array, other.array)
                && Arrays.equals(extent, other.extent);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(array) + Arrays.hashCode(extent)) + Double.hashCode(energy);
    }

    @Override
    public String toString() {
        return "TransferFunction{" + array.length + " x " + (array.length == 0 ? "-" : array[0])
                + ", extent=" + Arrays.toString(extent) + ", energy=" + energy + " eV}";
    }
}
