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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-dimensional real-space sampling grid.
 *
 * <p>A grid is described by its extent (Å), number of grid points and
 * sampling (Å per pixel) along each axis. Any two of these determine the
 * third, which is derived when the second is set. Setting the sampling of a
 * grid with a known extent rounds the number of points up and then adjusts
 * the sampling so that {@code extent = gpts * sampling} holds exactly.</p>
 *
 * <p>Axis 0 is the first (row) index of every array produced from the grid.</p>
 */
public final class Grid {
    private static final Logger log = LoggerFactory.getLogger(Grid.class);
    private static final double RELATIVE_TOLERANCE = 1e-9;

    private double[] extent;
    private int[] gpts;
    private double[] sampling;

    /** Undefined grid. */
    public Grid() {}

    /**
     * Grid from any combination of extent, grid points and sampling; pass
     * {@code null} for the unknowns.
     *
     * @throws ConfigurationException if all three are given and disagree
     */
    public Grid(double[] extent, int[] gpts, double[] sampling) {
        if (extent != null && gpts != null && sampling != null) {
            double[] e = checkPair(extent, "extent");
            int[] g = checkPair(gpts);
            double[] s = checkPair(sampling, "sampling");
            for (int i = 0; i < 2; i++) {
                if (Math.abs(e[i] - g[i] * s[i]) > RELATIVE_TOLERANCE * e[i]) {
                    throw new ConfigurationException(
                            "Inconsistent grid: extent " + Arrays.toString(e) + " != gpts "
                                    + Arrays.toString(g) + " * sampling " + Arrays.toString(s));
                }
            }
            this.extent = e;
            this.gpts = g;
            this.sampling = s;
            return;
        }
        if (extent != null) setExtent(extent);
        if (gpts != null) setGpts(gpts);
        if (sampling != null) setSampling(sampling);
    }

    /** Square grid with {@code gpts} points spanning {@code extent} Å on each axis. */
    public static Grid of(double extent, int gpts) {
        return new Grid(new double[] {extent, extent}, new int[] {gpts, gpts}, null);
    }

    public double[] getExtent() {
        return extent == null ? null : extent.clone();
    }

    public int[] getGpts() {
        return gpts == null ? null : gpts.clone();
    }

    public double[] getSampling() {
        return sampling == null ? null : sampling.clone();
    }

    public void setExtent(double extent) {
        setExtent(new double[] {extent, extent});
    }

    public void setExtent(double[] extent) {
        this.extent = checkPair(extent, "extent");
        if (gpts != null) {
            sampling = divide(this.extent, gpts);
        } else if (sampling != null) {
            gpts = pointsFor(this.extent, sampling);
            sampling = divide(this.extent, gpts);
        }
    }

    public void setGpts(int gpts) {
        setGpts(new int[] {gpts, gpts});
    }

    public void setGpts(int[] gpts) {
        this.gpts = checkPair(gpts);
        if (extent != null) {
            sampling = divide(extent, this.gpts);
        } else if (sampling != null) {
            extent = new double[] {this.gpts[0] * sampling[0], this.gpts[1] * sampling[1]};
        }
    }

    public void setSampling(double sampling) {
        setSampling(new double[] {sampling, sampling});
    }

    public void setSampling(double[] sampling) {
        double[] s = checkPair(sampling, "sampling");
        if (extent != null) {
            gpts = pointsFor(extent, s);
            this.sampling = divide(extent, gpts);
        } else {
            this.sampling = s;
            if (gpts != null) {
                extent = new double[] {gpts[0] * s[0], gpts[1] * s[1]};
            }
        }
    }

    /** True once extent, gpts and sampling are all known. */
    public boolean isDefined() {
        return extent != null && gpts != null && sampling != null;
    }

    /**
     * @throws ConfigurationException if fewer than two of extent, gpts and
     *     sampling have been given
     */
    public void checkIsDefined() {
        if (!isDefined()) {
            throw new ConfigurationException("Grid is not defined");
        }
    }

    /**
     * Adopt the extent, grid points and sampling of {@code other}.
     *
     * @throws ConfigurationException if {@code other} is not defined
     */
    public void matchTo(Grid other) {
        other.checkIsDefined();
        if (Arrays.equals(extent, other.extent)
                && Arrays.equals(gpts, other.gpts)
                && Arrays.equals(sampling, other.sampling)) {
            return;
        }
        log.debug("Grid resynchronised to extent {} gpts {}",
                Arrays.toString(other.extent), Arrays.toString(other.gpts));
        extent = other.extent.clone();
        gpts = other.gpts.clone();
        sampling = other.sampling.clone();
    }

    /**
     * Spatial frequencies (1/Å) of each axis in discrete Fourier transform
     * order: zero first, then positive, then negative frequencies.
     */
    public double[][] spatialFrequencies() {
        checkIsDefined();
        return new double[][] {fftfreq(gpts[0], sampling[0]), fftfreq(gpts[1], sampling[1])};
    }

    /**
     * Scattering semi-angles (radians) of each axis for electrons of the given
     * wavelength (Å), in discrete Fourier transform order.
     */
    public double[][] semiangles(double wavelength) {
        double[][] k = spatialFrequencies();
        for (double[] axis : k) {
            for (int i = 0; i < axis.length; i++) axis[i] *= wavelength;
        }
        return k;
    }

    public Grid copy() {
        Grid copy = new Grid();
        copy.extent = getExtent();
        copy.gpts = getGpts();
        copy.sampling = getSampling();
        return copy;
    }

    @Override
    public String toString() {
        return "Grid{extent=" + Arrays.toString(extent) + ", gpts=" + Arrays.toString(gpts)
                + ", sampling=" + Arrays.toString(sampling) + "}";
    }

    /**
     * Sample frequencies of an {@code n}-point transform with spacing {@code d},
     * matching the usual {@code fftfreq} layout.
     */
    static double[] fftfreq(int n, double d) {
        double[] f = new double[n];
        double scale = 1.0 / (n * d);
        int positive = (n + 1) / 2;
        for (int i = 0; i < n; i++) {
            f[i] = (i < positive ? i : i - n) * scale;
        }
        return f;
    }

    private static double[] divide(double[] extent, int[] gpts) {
        return new double[] {extent[0] / gpts[0], extent[1] / gpts[1]};
    }

    private static int[] pointsFor(double[] extent, double[] sampling) {
        return new int[] {
            (int) Math.ceil(extent[0] / sampling[0]), (int) Math.ceil(extent[1] / sampling[1])
        };
    }

    private static double[] checkPair(double[] values, String name) {
        if (values == null || values.length != 2) {
            throw new InvalidParameterException(name + " must have two components");
        }
        for (double v : values) {
            if (!(v > 0.0) || Double.isInfinite(v)) {
                throw new InvalidParameterException(name + " must be positive and finite, got "
                        + Arrays.toString(values));
            }
        }
        return values.clone();
    }

    private static int[] checkPair(int[] values) {
        if (values == null || values.length != 2) {
            throw new InvalidParameterException("gpts must have two components");
        }
        for (int v : values) {
            if (v <= 0) {
                throw new InvalidParameterException("gpts must be positive, got " + Arrays.toString(values));
            }
        }
        return values.clone();
    }
}
