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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contrast transfer function of an objective lens.
 *
 * <p>The transfer function is the aberration phase factor
 * {@code exp(-i chi)}, multiplied by an objective aperture when the cutoff is
 * finite, by the temporal envelope when the focal spread is positive and by
 * the spatial envelope when the angular spread is positive. Every intermediate
 * array is cached and recomputed only when one of the values it depends on
 * has changed.</p>
 *
 * <p>Typical use:</p>
 * <pre>{@code
 * ContrastTransferFunction ctf = ContrastTransferFunction.builder()
 *         .extent(10.0).gpts(64).energy(300e3)
 *         .cutoff(0.02).parameter("Cs", -1e4).parameter("defocus", 50.0)
 *         .build();
 * ComplexArray[] array = ctf.getArray();
 * }</pre>
 *
 * <p>Instances are not thread-safe; a parameter write racing a read from
 * another thread must be serialized by the caller.</p>
 */
public final class ContrastTransferFunction {
    private static final Logger log = LoggerFactory.getLogger(ContrastTransferFunction.class);

    public static final String EXTENT = "extent";
    public static final String GPTS = "gpts";
    public static final String SAMPLING = "sampling";
    public static final String ENERGY = "energy";
    public static final String CUTOFF = "cutoff";
    public static final String ROLLOFF = "rolloff";
    public static final String FOCAL_SPREAD = "focal_spread";
    public static final String ANGULAR_SPREAD = "angular_spread";

    static final List<String> ANGLE_DEPENDENCIES = List.of(EXTENT, GPTS, SAMPLING, ENERGY);
    static final List<String> APERTURE_DEPENDENCIES = concat(ANGLE_DEPENDENCIES, List.of(CUTOFF, ROLLOFF));
    static final List<String> TEMPORAL_DEPENDENCIES = concat(ANGLE_DEPENDENCIES, List.of(FOCAL_SPREAD));
    static final List<String> SPATIAL_DEPENDENCIES =
            concat(ANGLE_DEPENDENCIES, concat(List.of(ANGULAR_SPREAD), AberrationCoefficients.SYMBOLS));
    static final List<String> ABERRATION_DEPENDENCIES = concat(
            ANGLE_DEPENDENCIES, concat(List.of(AberrationCoefficients.DEFOCUS), AberrationCoefficients.SYMBOLS));
    static final List<String> ARRAY_DEPENDENCIES = concat(
            ABERRATION_DEPENDENCIES, List.of(CUTOFF, ROLLOFF, FOCAL_SPREAD, ANGULAR_SPREAD));

    private final Grid grid;
    private final Energy energy;
    private final AberrationCoefficients coefficients;
    private final DependencyCache cache = new DependencyCache();
    private final List<ParameterListener> listeners = new CopyOnWriteArrayList<>();
    private double cutoff = Double.POSITIVE_INFINITY;
    private double rolloff = 0.0;
    private double focalSpread = 0.0;
    private double angularSpread = 0.0;

    /** No aberrations, no aperture, undefined grid and energy. */
    public ContrastTransferFunction() {
        this(new Grid(), new Energy(), new AberrationCoefficients());
    }

    /**
     * Transfer function over the given grid and energy. The collaborators are
     * owned by the new instance from here on.
     */
    public ContrastTransferFunction(Grid grid, Energy energy, AberrationCoefficients coefficients) {
        this.grid = grid;
        this.energy = energy;
        this.coefficients = coefficients;
        this.coefficients.addListener(this::fireParameterChanged);
    }

    public static Builder builder() {
        return new Builder();
    }

    // Grid and energy

    public Grid getGrid() {
        return grid;
    }

    public Energy getEnergy() {
        return energy;
    }

    public void setExtent(double extent) {
        grid.setExtent(extent);
        fireParameterChanged(EXTENT, true);
    }

    public void setExtent(double[] extent) {
        grid.setExtent(extent);
        fireParameterChanged(EXTENT, true);
    }

    public void setGpts(int gpts) {
        grid.setGpts(gpts);
        fireParameterChanged(GPTS, true);
    }

    public void setGpts(int[] gpts) {
        grid.setGpts(gpts);
        fireParameterChanged(GPTS, true);
    }

    public void setSampling(double sampling) {
        grid.setSampling(sampling);
        fireParameterChanged(SAMPLING, true);
    }

    public void setSampling(double[] sampling) {
        grid.setSampling(sampling);
        fireParameterChanged(SAMPLING, true);
    }

    public void setEnergy(Double value) {
        Double old = energy.getEnergy();
        energy.setEnergy(value);
        fireParameterChanged(ENERGY, old == null ? value != null : !old.equals(value));
    }

    /**
     * @throws ConfigurationException if the energy is not defined
     */
    public double getWavelength() {
        return energy.getWavelength();
    }

    // Scalar lens parameters

    public double getCutoff() {
        return cutoff;
    }

    /**
     * @param cutoff largest transmitted scattering angle (radians), or
     *     {@link Double#POSITIVE_INFINITY} for no aperture; 0 blocks everything
     * @throws InvalidParameterException if {@code cutoff} is negative or NaN
     */
    public void setCutoff(double cutoff) {
        if (!(cutoff >= 0.0)) {
            throw new InvalidParameterException("cutoff must be non-negative, got " + cutoff);
        }
        double old = this.cutoff;
        this.cutoff = cutoff;
        fireParameterChanged(CUTOFF, Double.compare(old, cutoff) != 0);
    }

    public double getRolloff() {
        return rolloff;
    }

    /**
     * @param rolloff width of the aperture edge as a fraction of the cutoff;
     *     0 gives a hard edge, 1 the softest possible edge
     * @throws InvalidParameterException if {@code rolloff} is outside [0, 1]
     */
    public void setRolloff(double rolloff) {
        if (!(rolloff >= 0.0 && rolloff <= 1.0)) {
            throw new InvalidParameterException("rolloff must be in [0, 1], got " + rolloff);
        }
        double old = this.rolloff;
        this.rolloff = rolloff;
        fireParameterChanged(ROLLOFF, Double.compare(old, rolloff) != 0);
    }

    public double getFocalSpread() {
        return focalSpread;
    }

    /**
     * @param focalSpread standard deviation of the focus (Å) from chromatic
     *     aberration and lens current instabilities
     * @throws InvalidParameterException if negative
     */
    public void setFocalSpread(double focalSpread) {
        if (!(focalSpread >= 0.0)) {
            throw new InvalidParameterException("focal_spread must be non-negative, got " + focalSpread);
        }
        double old = this.focalSpread;
        this.focalSpread = focalSpread;
        fireParameterChanged(FOCAL_SPREAD, Double.compare(old, focalSpread) != 0);
    }

    public double getAngularSpread() {
        return angularSpread;
    }

    /**
     * @param angularSpread source angular spread (radians)
     * @throws InvalidParameterException if negative
     */
    public void setAngularSpread(double angularSpread) {
        if (!(angularSpread >= 0.0)) {
            throw new InvalidParameterException("angular_spread must be non-negative, got " + angularSpread);
        }
        double old = this.angularSpread;
        this.angularSpread = angularSpread;
        fireParameterChanged(ANGULAR_SPREAD, Double.compare(old, angularSpread) != 0);
    }

    // Aberration coefficients

    /** Live coefficient set. Writes through it invalidate dependent arrays. */
    public AberrationCoefficients getCoefficients() {
        return coefficients;
    }

    /** Canonical coefficient snapshot. */
    public Map<String, Double> getParameters() {
        return coefficients.asMap();
    }

    public double getParameter(String symbol) {
        return coefficients.get(symbol);
    }

    public void setParameter(String symbol, double value) {
        coefficients.set(symbol, value);
    }

    /**
     * Set several coefficients. Nothing is written if any key is unknown.
     *
     * @throws InvalidParameterException if a key is not a known symbol or alias
     */
    public void setParameters(Map<String, Double> parameters) {
        coefficients.update(parameters);
    }

    public double getDefocus() {
        return coefficients.getDefocus();
    }

    public void setDefocus(double defocus) {
        coefficients.setDefocus(defocus);
    }

    public void addListener(ParameterListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ParameterListener listener) {
        listeners.remove(listener);
    }

    // Derived arrays

    /**
     * Scattering angle magnitude of every pixel (radians).
     *
     * <p>The returned array is shared with the cache and must not be
     * modified.</p>
     */
    public double[][] getAlpha() {
        checkIsConfigured();
        return cache.getOrCompute("alpha", snapshot(ANGLE_DEPENDENCIES), () -> {
            double[][] angles = grid.semiangles(energy.getWavelength());
            double[] ax = angles[0];
            double[] ay = angles[1];
            double[][] alpha = new double[ax.length][ay.length];
            for (int i = 0; i < ax.length; i++) {
                for (int j = 0; j < ay.length; j++) {
                    alpha[i][j] = Math.sqrt(ax[i] * ax[i] + ay[j] * ay[j]);
                }
            }
            return alpha;
        });
    }

    /**
     * Azimuth of every pixel, {@code atan2(alpha_x, alpha_y)} (radians).
     *
     * <p>The returned array is shared with the cache and must not be
     * modified.</p>
     */
    public double[][] getPhi() {
        checkIsConfigured();
        return cache.getOrCompute("phi", snapshot(ANGLE_DEPENDENCIES), () -> {
            double[][] angles = grid.semiangles(energy.getWavelength());
            double[] ax = angles[0];
            double[] ay = angles[1];
            double[][] phi = new double[ax.length][ay.length];
            for (int i = 0; i < ax.length; i++) {
                for (int j = 0; j < ay.length; j++) {
                    phi[i][j] = Math.atan2(ax[i], ay[j]);
                }
            }
            return phi;
        });
    }

    /**
     * Objective aperture transmission of every pixel.
     *
     * <p>The returned array is shared with the cache and must not be
     * modified.</p>
     */
    public double[][] getAperture() {
        checkIsConfigured();
        return cache.getOrCompute("aperture", snapshot(APERTURE_DEPENDENCIES),
                () -> AberrationModel.aperture(getAlpha(), cutoff, rolloff));
    }

    /**
     * Damping from the focal spread.
     *
     * <p>The returned array is shared with the cache and must not be
     * modified.</p>
     */
    public double[][] getTemporalEnvelope() {
        checkIsConfigured();
        return cache.getOrCompute("temporal_envelope", snapshot(TEMPORAL_DEPENDENCIES),
                () -> AberrationModel.temporalEnvelope(getAlpha(), energy.getWavelength(), focalSpread));
    }

    /**
     * Damping from the angular spread.
     *
     * <p>The returned array is shared with the cache and must not be
     * modified.</p>
     */
    public double[][] getSpatialEnvelope() {
        checkIsConfigured();
        return cache.getOrCompute("spatial_envelope", snapshot(SPATIAL_DEPENDENCIES),
                () -> AberrationModel.spatialEnvelope(
                        getAlpha(), getPhi(), energy.getWavelength(), angularSpread, coefficients));
    }

    /** Aberration phase factor {@code exp(-i chi)}. */
    public ComplexArray getAberrations() {
        checkIsConfigured();
        return cache.getOrCompute("aberrations", snapshot(ABERRATION_DEPENDENCIES),
                () -> AberrationModel.polarAberrations(
                        getAlpha(), getPhi(), energy.getWavelength(), coefficients));
    }

    /**
     * The transfer function with a leading batch axis of length one, in
     * discrete Fourier transform order (zero frequency at index 0).
     *
     * <p>The returned arrays are shared with the cache and must not be
     * modified.</p>
     */
    public ComplexArray[] getArray() {
        checkIsConfigured();
        return cache.getOrCompute("array", snapshot(ARRAY_DEPENDENCIES), () -> {
            ComplexArray array = getAberrations();
            if (cutoff < Double.POSITIVE_INFINITY) {
                array = array.multiply(getAperture());
            }
            if (focalSpread > 0.0) {
                array = array.multiply(getTemporalEnvelope());
            }
            if (angularSpread > 0.0) {
                array = array.multiply(getSpatialEnvelope());
            }
            return new ComplexArray[] {array};
        });
    }

    /**
     * The transfer function with the zero frequency moved to the centre of
     * both spatial axes.
     */
    public TransferFunction build() {
        ComplexArray[] array = getArray();
        ComplexArray[] shifted = new ComplexArray[array.length];
        for (int i = 0; i < array.length; i++) {
            shifted[i] = array[i].fftShift();
        }
        return new TransferFunction(shifted, grid.getExtent(), energy.getEnergy());
    }

    @Override
    public String toString() {
        return "ContrastTransferFunction{cutoff=" + cutoff + ", rolloff=" + rolloff
                + ", focal_spread=" + focalSpread + ", angular_spread=" + angularSpread
                + ", " + coefficients + ", " + grid + ", " + energy + "}";
    }

    private void checkIsConfigured() {
        grid.checkIsDefined();
        energy.checkIsDefined();
    }

    private Object[] snapshot(List<String> fields) {
        Object[] values = new Object[fields.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = valueOf(fields.get(i));
        }
        return values;
    }

    private Object valueOf(String field) {
        switch (field) {
            case EXTENT: return grid.getExtent();
            case GPTS: return grid.getGpts();
            case SAMPLING: return grid.getSampling();
            case ENERGY: return energy.getEnergy();
            case CUTOFF: return cutoff;
            case ROLLOFF: return rolloff;
            case FOCAL_SPREAD: return focalSpread;
            case ANGULAR_SPREAD: return angularSpread;
            default: return coefficients.get(field);
        }
    }

    private void fireParameterChanged(String name, boolean changed) {
        if (changed) {
            log.debug("Parameter {} changed", name);
        }
        for (ParameterListener listener : listeners) {
            listener.parameterChanged(name, changed);
        }
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> out = new ArrayList<>(a);
        out.addAll(b);
        return Collections.unmodifiableList(out);
    }

    /** Fluent construction of a {@link ContrastTransferFunction}. */
    public static final class Builder {
        private double cutoff = Double.POSITIVE_INFINITY;
        private double rolloff = 0.0;
        private double focalSpread = 0.0;
        private double angularSpread = 0.0;
        private final Map<String, Double> parameters = new LinkedHashMap<>();
        private double[] extent;
        private int[] gpts;
        private double[] sampling;
        private Double energy;

        private Builder() {}

        public Builder cutoff(double cutoff) {
            this.cutoff = cutoff;
            return this;
        }

        public Builder rolloff(double rolloff) {
            this.rolloff = rolloff;
            return this;
        }

        public Builder focalSpread(double focalSpread) {
            this.focalSpread = focalSpread;
            return this;
        }

        public Builder angularSpread(double angularSpread) {
            this.angularSpread = angularSpread;
            return this;
        }

        public Builder parameter(String symbol, double value) {
            parameters.put(symbol, value);
            return this;
        }

        public Builder parameters(Map<String, Double> values) {
            parameters.putAll(values);
            return this;
        }

        public Builder extent(double extent) {
            return extent(new double[] {extent, extent});
        }

        public Builder extent(double[] extent) {
            this.extent = extent;
            return this;
        }

        public Builder gpts(int gpts) {
            return gpts(new int[] {gpts, gpts});
        }

        public Builder gpts(int[] gpts) {
            this.gpts = gpts;
            return this;
        }

        public Builder sampling(double sampling) {
            return sampling(new double[] {sampling, sampling});
        }

        public Builder sampling(double[] sampling) {
            this.sampling = sampling;
            return this;
        }

        public Builder energy(double energy) {
            this.energy = energy;
            return this;
        }

        /**
         * @throws InvalidParameterException for an unknown coefficient symbol
         *     or an out-of-range scalar
         * @throws ConfigurationException for an inconsistent grid
         */
        public ContrastTransferFunction build() {
            ContrastTransferFunction ctf = new ContrastTransferFunction(
                    new Grid(extent, gpts, sampling), new Energy(energy), new AberrationCoefficients(parameters));
            ctf.setCutoff(cutoff);
            ctf.setRolloff(rolloff);
            ctf.setFocalSpread(focalSpread);
            ctf.setAngularSpread(angularSpread);
            return ctf;
        }
    }
}
