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
 * A batch of two-dimensional complex wave functions sampled on a common grid
 * at a common beam energy.
 */
public final class Waves {
    private final ComplexArray[] array;
    private final Grid grid;
    private final Energy energy;

    /**
     * The grid and energy are copied, so later changes to the arguments do
     * not affect this batch.
     *
     * @param array one complex array per wave, all of the grid's shape
     * @throws ConfigurationException if a slice does not match the grid
     */
    public Waves(ComplexArray[] array, Grid grid, Energy energy) {
        grid.checkIsDefined();
        int[] gpts = grid.getGpts();
        for (ComplexArray slice : array) {
            if (slice.rows() != gpts[0] || slice.cols() != gpts[1]) {
                throw new ConfigurationException("Wave of shape " + slice.rows() + "x" + slice.cols()
                        + " does not match grid of " + gpts[0] + "x" + gpts[1] + " points");
            }
        }
        this.array = array.clone();
        this.grid = grid.copy();
        this.energy = energy.copy();
    }

    /** Batch of one plane wave of unit amplitude. */
    public static Waves planeWave(Grid grid, Energy energy) {
        grid.checkIsDefined();
        int[] gpts = grid.getGpts();
        double[][] ones = new double[gpts[0]][gpts[1]];
        for (double[] row : ones) Arrays.fill(row, 1.0);
        return new Waves(new ComplexArray[] {ComplexArray.ofReal(ones)}, grid, energy);
    }

    public ComplexArray[] getArray() {
        return array;
    }

    public int size() {
        return array.length;
    }

    /** Copy of the grid the waves are sampled on. */
    public Grid getGrid() {
        return grid.copy();
    }

    public Energy getEnergy() {
        return energy.copy();
    }
}
