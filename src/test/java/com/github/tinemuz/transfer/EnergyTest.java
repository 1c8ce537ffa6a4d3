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

class EnergyTest {

    @Test
    @DisplayName("Relativistic wavelengths of common acceleration voltages")
    void knownWavelengths() {
        assertEquals(0.037013, Energy.energyToWavelength(100e3), 1e-5, "100 kV");
        assertEquals(0.025079, Energy.energyToWavelength(200e3), 1e-5, "200 kV");
        assertEquals(0.019687, Energy.energyToWavelength(300e3), 1e-5, "300 kV");
        assertEquals(0.019687, new Energy(300e3).getWavelength(), 1e-5);
    }

    @Test
    @DisplayName("Wavelength of an undefined energy is a configuration error")
    void undefinedEnergy() {
        Energy energy = new Energy();
        assertFalse(energy.isDefined());
        ConfigurationException e = assertThrows(ConfigurationException.class, energy::getWavelength);
        assertTrue(e.getMessage().contains("Energy"));
    }

    @Test
    @DisplayName("Non-positive energies are rejected")
    void invalidEnergy() {
        assertThrows(InvalidParameterException.class, () -> new Energy(0.0));
        assertThrows(InvalidParameterException.class, () -> new Energy(-200e3));
        assertThrows(InvalidParameterException.class, () -> new Energy(Double.NaN));
    }

    @Test
    @DisplayName("matchTo adopts the other energy")
    void matchTo() {
        Energy energy = new Energy(80e3);
        energy.matchTo(new Energy(300e3));
        assertEquals(300e3, energy.getEnergy(), 0.0);
        assertThrows(ConfigurationException.class, () -> energy.matchTo(new Energy()));
    }
}
