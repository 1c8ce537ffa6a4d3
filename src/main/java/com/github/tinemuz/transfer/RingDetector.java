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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jtransforms.fft.DoubleFFT_2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annular detector integrating the diffracted intensity between an inner and
 * an outer scattering angle.
 *
 * <p>With a zero rolloff the detector is a hard ring, collecting everything
 * with {@code inner <= alpha <= outer}. A positive rolloff (radians) softens
 * both edges with raised cosines: the efficiency rises from zero at
 * {@code inner - rolloff} to one at {@code inner}, and falls from one at
 * {@code outer} to zero at {@code outer + rolloff}.</p>
 *
 * <p>The detector keeps its own grid and energy, which are resynchronised to
 * each wave batch it detects. Not thread-safe.</p>
 */
public final class RingDetector implements Detector {
    private static final Logger log = LoggerFactory.getLogger(RingDetector.class);

    public static final String INNER = "inner";
    public static final String OUTER = "outer";
    public static final String ROLLOFF = "rolloff";

    private final Grid grid;
    private final Energy energy;
    private final DependencyCache cache = new DependencyCache();
    private final List<ParameterListener> listeners = new CopyOnWriteArrayList<>();
    private double inner;
    private double outer;
    private double rolloff;

    /**
     * Detector with undefined grid and energy; both are taken from the first
     * wave batch detected.
     *
     * @param inner inner collection angle (radians)
     * @param outer outer collection angle (radians), may be infinite
     */
    public RingDetector(double inner, double outer) {
        this(inner, outer, 0.0, new Grid(), new Energy());
    }

    public RingDetector(double inner, double outer, double rolloff, Grid grid, Energy energy) {
        checkRadii(inner, outer);
        checkRolloff(rolloff);
        this.inner = inner;
        this.outer = outer;
        this.rolloff = rolloff;
        this.grid = grid;
        this.energy = energy;
    }

    public double getInner() {
        return inner;
    }

    public void setInner(double inner) {
        checkRadii(inner, outer);
        double old = this.inner;
        this.inner = inner;
        fireParameterChanged(INNER, Double.compare(old, inner) != 0);
    }

    public double getOuter() {
        return outer;
    }

    public void setOuter(double outer) {
        checkRadii(inner, outer);
        double old = this.outer;
        this.outer = outer;
        fireParameterChanged(OUTER, Double.compare(old, outer) != 0);
    }

    public double getRolloff() {
        return rolloff;
    }

    public void setRolloff(double rolloff) {
        checkRolloff(rolloff);
        double old = this.rolloff;
        this.rolloff = rolloff;
        fireParameterChanged(ROLLOFF, Double.compare(old, rolloff) != 0);
    }

    public Grid getGrid() {
        return grid;
    }

    public Energy getEnergy() {
        return energy;
    }

    public void addListener(ParameterListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ParameterListener listener) {
        listeners.remove(listener);
    }

    @Override
    public int[] outShape() {
        return new int[] {1};
    }

    /**
     * Collection efficiency of every pixel of the diffraction pattern, in
     * discrete Fourier transform order.
     *
     * @throws ConfigurationException if the grid or energy is undefined
     */
    public double[][] getEfficiency() {
        grid.checkIsDefined();
        energy.checkIsDefined();
        Object[] snapshot = {
            grid.getExtent(), grid.getGpts(), grid.getSampling(), energy.getEnergy(), inner, outer, rolloff
        };
        return cache.getOrCompute("efficiency", snapshot, this::computeEfficiency);
    }

    /**
     * Fraction of the diffracted intensity of each wave that is collected.
     *
     * <p>The detector first adopts the grid and energy of {@code waves}.</p>
     *
     * @return one efficiency-weighted fraction per wave
     * @throws NumericDomainException if a wave has zero total intensity
     */
    @Override
    public double[] detect(Waves waves) {
        grid.matchTo(waves.getGrid());
        energy.matchTo(waves.getEnergy());
        double[][] efficiency = getEfficiency();

        int[] gpts = grid.getGpts();
        DoubleFFT_2D fft = new DoubleFFT_2D(gpts[0], gpts[1]);
        ComplexArray[] slices = waves.getArray();
        double[] detected = new double[slices.length];
        for (int n = 0; n < slices.length; n++) {
            ComplexArray transformed = slices[n].copy();
            fft.complexForward(transformed.data());
            double[][] intensity = transformed.abs2();
            double collected = 0.0;
            double total = 0.0;
            for (int i = 0; i < intensity.length; i++) {
                for (int j = 0; j < intensity[i].length; j++) {
                    collected += intensity[i][j] * efficiency[i][j];
                    total += intensity[i][j];
                }
            }
            if (total == 0.0) {
                throw new NumericDomainException("Wave " + n + " has zero total intensity");
            }
            detected[n] = collected / total;
        }
        log.debug("Detected {} waves between {} and {} rad", slices.length, inner, outer);
        return detected;
    }

    private double[][] computeEfficiency() {
        double[][] angles = grid.semiangles(energy.getWavelength());
        double[] ax = angles[0];
        double[] ay = angles[1];
        double[][] efficiency = new double[ax.length][ay.length];
        for (int i = 0; i < ax.length; i++) {
            for (int j = 0; j < ay.length; j++) {
                double alpha = Math.sqrt(ax[i] * ax[i] + ay[j] * ay[j]);
                efficiency[i][j] = rolloff > 0.0
                        ? innerEdge(alpha) * outerEdge(alpha)
                        : (alpha >= inner && alpha <= outer ? 1.0 : 0.0);
            }
        }
        return efficiency;
    }

    private double outerEdge(double alpha) {
        if (alpha <= outer) return 1.0;
        if (alpha >= outer + rolloff) return 0.0;
        return 0.5 * (1.0 + Math.cos(Math.PI * (alpha - outer) / rolloff));
    }

    private double innerEdge(double alpha) {
        if (alpha >= inner) return 1.0;
        if (alpha <= inner - rolloff) return 0.0;
        return 0.5 * (1.0 + Math.cos(Math.PI * (inner - alpha) / rolloff));
    }

    private void fireParameterChanged(String name, boolean changed) {
        for (ParameterListener listener : listeners) {
            listener.parameterChanged(name, changed);
        }
    }

    private static void checkRadii(double inner, double outer) {
        if (!(inner >= 0.0) || !(outer >= inner)) {
            throw new InvalidParameterException(
                    "Ring detector needs 0 <= inner <= outer, got inner=" + inner + ", outer=" + outer);
        }
    }

    private static void checkRolloff(double rolloff) {
        if (!(rolloff >= 0.0) || Double.isInfinite(rolloff)) {
            throw new InvalidParameterException("rolloff must be non-negative and finite, got " + rolloff);
        }
    }
}
