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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ContrastTransferFunctionTest {

    private static ContrastTransferFunction defaultCtf() {
        return ContrastTransferFunction.builder()
                .extent(10.0)
                .gpts(64)
                .energy(300e3)
                .build();
    }

    @Nested
    @DisplayName("Transfer function array")
    class ArrayTests {

        @Test
        @DisplayName("Aberration-free lens with hard aperture is a real disk")
        void aberrationFreeDisk() {
            ContrastTransferFunction ctf = ContrastTransferFunction.builder()
                    .extent(10.0)
                    .gpts(64)
                    .energy(300e3)
                    .cutoff(0.02)
                    .rolloff(0.0)
                    .parameter("C10", 0.0)
                    .build();

            ComplexArray[] array = ctf.getArray();
            assertEquals(1, array.length, "single-image batch axis");
            ComplexArray image = array[0];
            assertEquals(64, image.rows());
            assertEquals(64, image.cols());

            double[][] alpha = ctf.getAlpha();
            int inside = 0;
            int outside = 0;
            for (int i = 0; i < 64; i++) {
                for (int j = 0; j < 64; j++) {
                    assertEquals(0.0, image.im(i, j), 0.0, "purely real");
                    if (alpha[i][j] < 0.02) {
                        assertEquals(1.0, image.re(i, j), 0.0);
                        inside++;
                    } else {
                        assertEquals(0.0, image.re(i, j), 0.0);
                        outside++;
                    }
                }
            }
            assertTrue(inside > 1 && outside > 1, inside + " inside, " + outside + " outside");
            assertEquals(1.0, image.re(0, 0), 0.0, "zero frequency transmitted");
        }

        @Test
        @DisplayName("Without aperture or envelopes the array is the phase factor")
        void phaseOnly() {
            ContrastTransferFunction ctf = defaultCtf();
            ctf.setParameters(Map.of("defocus", 200.0, "Cs", 1e6));
            ComplexArray[] array = ctf.getArray();
            assertSame(ctf.getAberrations(), array[0]);
            for (double[] row : array[0].abs()) {
                for (double v : row) assertEquals(1.0, v, 1e-12);
            }
        }

        @Test
        @DisplayName("Envelopes are multiplied in when enabled")
        void envelopesApplied() {
            ContrastTransferFunction ctf = defaultCtf();
            ctf.setParameter("defocus", 100.0);
            ctf.setCutoff(0.03);
            ctf.setRolloff(0.1);
            ctf.setFocalSpread(40.0);
            ctf.setAngularSpread(1e-4);

            ComplexArray image = ctf.getArray()[0];
            ComplexArray aberrations = ctf.getAberrations();
            double[][] aperture = ctf.getAperture();
            double[][] temporal = ctf.getTemporalEnvelope();
            double[][] spatial = ctf.getSpatialEnvelope();
            for (int i = 0; i < 64; i++) {
                for (int j = 0; j < 64; j++) {
                    double factor = aperture[i][j] * temporal[i][j] * spatial[i][j];
                    assertEquals(aberrations.re(i, j) * factor, image.re(i, j), 1e-12);
                    assertEquals(aberrations.im(i, j) * factor, image.im(i, j), 1e-12);
                }
            }
        }

        @Test
        @DisplayName("build centres the zero frequency")
        void buildIsShifted() {
            ContrastTransferFunction ctf = defaultCtf();
            ctf.setCutoff(0.02);
            ctf.setDefocus(50.0);

            TransferFunction built = ctf.build();
            ComplexArray raw = ctf.getArray()[0];
            ComplexArray centred = built.image();
            assertEquals(raw.re(0, 0), centred.re(32, 32), 0.0);
            assertEquals(raw.im(5, 60), centred.im(37, 28), 0.0);
            assertArrayEquals(new double[] {10.0, 10.0}, built.getExtent(), 0.0);
            assertEquals(300e3, built.energy, 0.0);
        }

        @Test
        @DisplayName("Zero cutoff blocks every frequency")
        void zeroCutoff() {
            ContrastTransferFunction ctf = defaultCtf();
            ctf.setCutoff(0.0);

            for (double[] row : ctf.getAperture()) {
                for (double v : row) assertEquals(0.0, v, 0.0);
            }
            double[][] modulus = ctf.getArray()[0].abs();
            for (double[] row : modulus) {
                for (double v : row) assertEquals(0.0, v, 0.0);
            }
        }

        @Test
        @DisplayName("Built result keeps its own extent")
        void builtExtentIsCopied() {
            ContrastTransferFunction ctf = defaultCtf();
            TransferFunction built = ctf.build();
            assertEquals(built, ctf.build());

            built.getExtent()[0] = 99.0;
            ctf.setExtent(20.0);

            assertArrayEquals(new double[] {10.0, 10.0}, built.getExtent(), 0.0);
            assertNotEquals(built, ctf.build());
        }

        @Test
        @DisplayName("Azimuth follows atan2 of the two angle axes")
        void phiLayout() {
            ContrastTransferFunction ctf = defaultCtf();
            double[][] phi = ctf.getPhi();
            assertEquals(Math.PI / 2, phi[1][0], 1e-12);
            assertEquals(0.0, phi[0][1], 1e-12);
            assertEquals(-Math.PI / 2, phi[63][0], 1e-12);
        }
    }

    @Nested
    @DisplayName("Caching")
    class CacheTests {

        @Test
        @DisplayName("Repeated reads return the cached arrays")
        void repeatedReads() {
            ContrastTransferFunction ctf = defaultCtf();
            ctf.setCutoff(0.02);
            assertSame(ctf.getAlpha(), ctf.getAlpha());
            assertSame(ctf.getAberrations(), ctf.getAberrations());
            assertSame(ctf.getArray(), ctf.getArray());
        }

        @Test
        @DisplayName("Every coefficient invalidates the aberrations")
        void coefficientsInvalidateAberrations() {
            ContrastTransferFunction ctf = defaultCtf();
            for (String symbol : AberrationCoefficients.SYMBOLS) {
                ComplexArray before = ctf.getAberrations();
                double value = symbol.startsWith("phi") ? 0.5 : 1e3;
                if (symbol.startsWith("phi")) {
                    // an orientation only matters with a matching amplitude
                    ctf.setParameter("C" + symbol.substring(3), 1e3);
                    before = ctf.getAberrations();
                }
                ctf.setParameter(symbol, value);
                ComplexArray after = ctf.getAberrations();
                assertNotSame(before, after, symbol);
                assertNotEquals(before, after, symbol);
            }
        }

        @Test
        @DisplayName("Rolloff leaves the aberrations cached but recomputes the aperture")
        void unrelatedFieldKeepsAberrations() {
            ContrastTransferFunction ctf = defaultCtf();
            ctf.setCutoff(0.02);
            ctf.setRolloff(0.1);
            ComplexArray aberrations = ctf.getAberrations();
            double[][] aperture = ctf.getAperture();

            ctf.setRolloff(0.3);

            assertSame(aberrations, ctf.getAberrations());
            double[][] recomputed = ctf.getAperture();
            assertNotSame(aperture, recomputed);
            assertFalse(Arrays.deepEquals(aperture, recomputed));
        }

        @Test
        @DisplayName("Writing the same value keeps cached arrays")
        void sameValueKeepsCache() {
            ContrastTransferFunction ctf = defaultCtf();
            ctf.setParameter("C30", 1e4);
            ComplexArray aberrations = ctf.getAberrations();
            ctf.setParameter("Cs", 1e4);
            assertSame(aberrations, ctf.getAberrations());
        }

        @Test
        @DisplayName("Grid and energy changes invalidate everything")
        void gridAndEnergyInvalidate() {
            ContrastTransferFunction ctf = defaultCtf();
            double[][] alpha = ctf.getAlpha();
            ComplexArray[] array = ctf.getArray();

            ctf.setEnergy(200e3);
            double[][] alpha200 = ctf.getAlpha();
            assertNotSame(alpha, alpha200);
            assertTrue(alpha200[0][1] > alpha[0][1], "longer wavelength, larger angles");
            assertNotSame(array, ctf.getArray());

            ctf.setGpts(32);
            assertEquals(32, ctf.getAlpha().length);
            assertEquals(32, ctf.getArray()[0].rows());
        }

        @Test
        @DisplayName("Writes through the live coefficient set invalidate too")
        void liveCoefficients() {
            ContrastTransferFunction ctf = defaultCtf();
            ComplexArray before = ctf.getAberrations();
            ctf.getCoefficients().set("coma", 1e3);
            assertNotSame(before, ctf.getAberrations());
        }
    }

    @Nested
    @DisplayName("Parameters")
    class ParameterTests {

        @Test
        @DisplayName("Alias round trips through the engine")
        void aliasRoundTrip() {
            ContrastTransferFunction ctf = new ContrastTransferFunction();
            ctf.setParameters(Map.of("Cs", 2.5e6));
            assertEquals(2.5e6, ctf.getParameter("C30"), 0.0);

            ctf.setParameters(Map.of("astigmatism", 12.0, "astigmatism_angle", 0.25));
            assertEquals(12.0, ctf.getParameter("C12"), 0.0);
            assertEquals(0.25, ctf.getParameter("phi12"), 0.0);

            ctf.setDefocus(80.0);
            assertEquals(-80.0, ctf.getParameter("C10"), 0.0);
            ctf.setParameter("C10", -15.0);
            assertEquals(15.0, ctf.getDefocus(), 0.0);
            assertEquals(-15.0, ctf.getParameters().get("C10"), 0.0);
        }

        @Test
        @DisplayName("Unknown symbols are rejected and nothing is applied")
        void unknownSymbol() {
            ContrastTransferFunction ctf = new ContrastTransferFunction();
            Map<String, Double> values = new LinkedHashMap<>();
            values.put("C30", 1.0);
            values.put("C33", 1.0);
            assertThrows(InvalidParameterException.class, () -> ctf.setParameters(values));
            assertEquals(0.0, ctf.getParameter("C30"), 0.0);
            assertThrows(InvalidParameterException.class, () -> ctf.setParameter("focus", 1.0));
            assertThrows(InvalidParameterException.class,
                    () -> ContrastTransferFunction.builder().parameter("C7", 1.0).build());
        }

        @Test
        @DisplayName("Out-of-range scalars are rejected")
        void scalarValidation() {
            ContrastTransferFunction ctf = new ContrastTransferFunction();
            assertThrows(InvalidParameterException.class, () -> ctf.setRolloff(-0.1));
            assertThrows(InvalidParameterException.class, () -> ctf.setRolloff(1.5));
            assertThrows(InvalidParameterException.class, () -> ctf.setFocalSpread(-1.0));
            assertThrows(InvalidParameterException.class, () -> ctf.setAngularSpread(-1e-3));
            assertThrows(InvalidParameterException.class, () -> ctf.setCutoff(-0.01));
            assertThrows(InvalidParameterException.class, () -> ctf.setCutoff(Double.NaN));
            assertDoesNotThrow(() -> ctf.setCutoff(Double.POSITIVE_INFINITY));
            assertDoesNotThrow(() -> ctf.setRolloff(1.0));
        }

        @Test
        @DisplayName("Listeners are notified of every write")
        void listeners() {
            ContrastTransferFunction ctf = new ContrastTransferFunction();
            List<String> events = new ArrayList<>();
            ctf.addListener((name, changed) -> events.add(name + ":" + changed));

            ctf.setCutoff(0.02);
            ctf.setCutoff(0.02);
            ctf.setParameter("Cs", 1.0);
            ctf.setFocalSpread(0.0);
            ctf.setEnergy(300e3);

            assertEquals(List.of("cutoff:true", "cutoff:false", "Cs:true", "focal_spread:false", "energy:true"),
                    events);
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationTests {

        @Test
        @DisplayName("Missing grid")
        void missingGrid() {
            ContrastTransferFunction ctf = new ContrastTransferFunction();
            ctf.setEnergy(300e3);
            ConfigurationException e = assertThrows(ConfigurationException.class, ctf::getArray);
            assertTrue(e.getMessage().contains("Grid"));
            assertThrows(ConfigurationException.class, ctf::getAperture);
        }

        @Test
        @DisplayName("Missing energy")
        void missingEnergy() {
            ContrastTransferFunction ctf = new ContrastTransferFunction();
            ctf.setExtent(10.0);
            ctf.setGpts(64);
            ConfigurationException e = assertThrows(ConfigurationException.class, ctf::getAberrations);
            assertTrue(e.getMessage().contains("Energy"));
            assertThrows(ConfigurationException.class, ctf::build);
        }

        @Test
        @DisplayName("Underdetermined grid")
        void underdeterminedGrid() {
            ContrastTransferFunction ctf = ContrastTransferFunction.builder().extent(10.0).energy(300e3).build();
            assertThrows(ConfigurationException.class, ctf::getAlpha);
            ctf.setSampling(0.1);
            assertEquals(100, ctf.getAlpha().length);
        }
    }
}
