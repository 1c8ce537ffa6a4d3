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
 * Two-dimensional complex array.
 *
 * <p>Values are stored row by row with real and imaginary parts interleaved,
 * {@code data[row][2 * col]} and {@code data[row][2 * col + 1]}. This is the
 * layout JTransforms uses for in-place complex transforms, so {@link #data()}
 * can be handed to it directly.</p>
 */
public final class ComplexArray {
    private final int rows;
    private final int cols;
    private final double[][] data;

    /** Zero-filled array. */
    public ComplexArray(int rows, int cols) {
        this(rows, cols, new double[rows][2 * cols]);
    }

    private ComplexArray(int rows, int cols, double[][] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /** Complex array with the given real part and zero imaginary part. */
    public static ComplexArray ofReal(double[][] real) {
        int rows = real.length;
        int cols = rows == 0 ? 0 : real[0].length;
        ComplexArray out = new ComplexArray(rows, cols);
        for (int i = 0; i < rows; i++) {
            double[] row = out.data[i];
            for (int j = 0; j < cols; j++) row[2 * j] = real[i][j];
        }
        return out;
    }

    /**
     * {@code exp(i * phase)} elementwise. Every element has modulus one.
     */
    public static ComplexArray exp(double[][] phase) {
        int rows = phase.length;
        int cols = rows == 0 ? 0 : phase[0].length;
        ComplexArray out = new ComplexArray(rows, cols);
        for (int i = 0; i < rows; i++) {
            double[] row = out.data[i];
            for (int j = 0; j < cols; j++) {
                row[2 * j] = Math.cos(phase[i][j]);
                row[2 * j + 1] = Math.sin(phase[i][j]);
            }
        }
        return out;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double re(int row, int col) {
        return data[row][2 * col];
    }

    public double im(int row, int col) {
        return data[row][2 * col + 1];
    }

    public void set(int row, int col, double re, double im) {
        data[row][2 * col] = re;
        data[row][2 * col + 1] = im;
    }

    /** Backing interleaved storage (not a copy). */
    public double[][] data() {
        return data;
    }

    /** Elementwise product with a real array of the same shape, as a new array. */
    public ComplexArray multiply(double[][] factor) {
        checkShape(factor);
        ComplexArray out = new ComplexArray(rows, cols);
        for (int i = 0; i < rows; i++) {
            double[] src = data[i];
            double[] dst = out.data[i];
            double[] f = factor[i];
            for (int j = 0; j < cols; j++) {
                dst[2 * j] = src[2 * j] * f[j];
                dst[2 * j + 1] = src[2 * j + 1] * f[j];
            }
        }
        return out;
    }

    /** Squared modulus of every element. */
    public double[][] abs2() {
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            double[] row = data[i];
            for (int j = 0; j < cols; j++) {
                double re = row[2 * j];
                double im = row[2 * j + 1];
                out[i][j] = re * re + im * im;
            }
        }
        return out;
    }

    /** Modulus of every element. */
    public double[][] abs() {
        double[][] out = abs2();
        for (double[] row : out) {
            for (int j = 0; j < row.length; j++) row[j] = Math.sqrt(row[j]);
        }
        return out;
    }

    /**
     * Move the zero-frequency element to the centre by rotating each axis by
     * half its length ({@code n / 2}, rounded down).
     */
    public ComplexArray fftShift() {
        ComplexArray out = new ComplexArray(rows, cols);
        int rowShift = rows / 2;
        int colShift = cols / 2;
        for (int i = 0; i < rows; i++) {
            double[] src = data[i];
            double[] dst = out.data[(i + rowShift) % rows];
            for (int j = 0; j < cols; j++) {
                int k = (j + colShift) % cols;
                dst[2 * k] = src[2 * j];
                dst[2 * k + 1] = src[2 * j + 1];
            }
        }
        return out;
    }

    public ComplexArray copy() {
        double[][] copy = new double[rows][];
        for (int i = 0; i < rows; i++) copy[i] = data[i].clone();
        return new ComplexArray(rows, cols, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexArray)) return false;
        ComplexArray other = (ComplexArray) o;
        return rows == other.rows && cols == other.cols && Arrays.deepEquals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(data);
    }

    @Override
    public String toString() {
        return "ComplexArray{" + rows + "x" + cols + "}";
    }

    private void checkShape(double[][] other) {
        if (other.length != rows || (rows > 0 && other[0].length != cols)) {
            throw new IllegalArgumentException("Shape mismatch: " + rows + "x" + cols + " vs "
                    + other.length + "x" + (other.length == 0 ? 0 : other[0].length));
        }
    }
}
