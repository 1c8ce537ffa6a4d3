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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Electron beam energy and the derived relativistic wavelength.
 *
 * <p>The energy is optional until a wavelength is requested.</p>
 */
public final class Energy {
    private static final Logger log = LoggerFactory.getLogger(Energy.class);
    // CODATA 2014, SI units
    private static final double PLANCK = 6.62607004e-34;
    private static final double SPEED_OF_LIGHT = 299792458.0;
    private static final double ELECTRON_MASS = 9.10938356e-31;
    private static final double ELEMENTARY_CHARGE = 1.6021766208e-19;

    private Double energy;

    /** Energy not yet defined. */
    public Energy() {}

    /**
     * @param energy acceleration energy in eV, or {@code null} if not yet known
     */
    public Energy(Double energy) {
        setEnergy(energy);
    }

    /** Energy in eV, or {@code null} if not defined. */
    public Double getEnergy() {
        return energy;
    }

    /**
     * @throws InvalidParameterException if {@code energy} is not strictly positive
     */
    public void setEnergy(Double energy) {
        if (energy != null && !(energy > 0.0)) {
            throw new InvalidParameterException("Energy must be positive, got " + energy);
        }
        this.energy = energy;
    }

    public boolean isDefined() {
        return energy != null;
    }

    /**
     * @throws ConfigurationException if the energy is not defined
     */
    public void checkIsDefined() {
        if (energy == null) {
            throw new ConfigurationException("Energy is not defined");
        }
    }

    /**
     * Relativistic electron wavelength in Å.
     *
     * @throws ConfigurationException if the energy is not defined
     */
    public double getWavelength() {
        checkIsDefined();
        return energyToWavelength(energy);
    }

    /** Adopt the energy of {@code other}. */
    public void matchTo(Energy other) {
        other.checkIsDefined();
        if (!other.energy.equals(energy)) {
            log.debug("Energy resynchronised from {} to {} eV", energy, other.energy);
            energy = other.energy;
        }
    }

    /**
     * Relativistic wavelength (Å) of an electron accelerated through
     * {@code energy} volts.
     */
    public static double energyToWavelength(double energy) {
        double restEnergy = 2.0 * ELECTRON_MASS * SPEED_OF_LIGHT * SPEED_OF_LIGHT / ELEMENTARY_CHARGE;
        return PLANCK * SPEED_OF_LIGHT
                / Math.sqrt(energy * (restEnergy + energy))
                / ELEMENTARY_CHARGE
                * 1e10;
    }

    public Energy copy() {
        return new Energy(energy);
    }

    @Override
    public String toString() {
        return "Energy{" + energy + " eV}";
    }
}
