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
 * Closed-form lens aberration model.
 *
 * <p>All functions are pure. Angles are in radians, lengths in Å. Arrays are
 * indexed {@code [row][col]} and all inputs of one call share a shape. The
 * phase error follows the polar expansion of Kirkland, <i>Advanced Computing
 * in Electron Microscopy</i> (2nd ed.), Eq. 2.22:</p>
 *
 * <pre>
 *   chi(alpha, phi) = 2 pi / lambda * sum_n alpha^(n+1) / (n+1)
 *                     * sum_m C_nm cos(m (phi - phi_nm))
 * </pre>
 */
public final class AberrationModel {
    private static final double TWO_PI = 2.0 * Math.PI;

    private AberrationModel() {}

    /**
     * Phase error of the full polar expansion up to fifth order. An order is
     * only evaluated when one of its coefficients is non-zero; a skipped order
     * would contribute exactly zero.
     */
    public static double[][] polarChi(
            double[][] alpha, double[][] phi, double wavelength, AberrationCoefficients p) {
        final double c10 = p.get("C10");
        final double c12 = p.get("C12");
        final double phi12 = p.get("phi12");
        final double c21 = p.get("C21");
        final double phi21 = p.get("phi21");
        final double c23 = p.get("C23");
        final double phi23 = p.get("phi23");
        final double c30 = p.get("C30");
        final double c32 = p.get("C32");
        final double phi32 = p.get("phi32");
        final double c34 = p.get("C34");
        final double phi34 = p.get("phi34");
        final double c41 = p.get("C41");
        final double phi41 = p.get("phi41");
        final double c43 = p.get("C43");
        final double phi43 = p.get("phi43");
        final double c45 = p.get("C45");
        final double phi45 = p.get("phi45");
        final double c50 = p.get("C50");
        final double c52 = p.get("C52");
        final double phi52 = p.get("phi52");
        final double c54 = p.get("C54");
        final double phi54 = p.get("phi54");
        final double c56 = p.get("C56");
        final double phi56 = p.get("phi56");

        final boolean first = !p.allZero("C10", "C12", "phi12");
        final boolean second = !p.allZero("C21", "phi21", "C23", "phi23");
        final boolean third = !p.allZero("C30", "C32", "phi32", "C34", "phi34");
        final boolean fourth = !p.allZero("C41", "phi41", "C43", "phi43", "C45", "phi45");
        final boolean fifth = !p.allZero("C50", "C52", "phi52", "C54", "phi54", "C56", "phi56");

        final double scale = TWO_PI / wavelength;
        double[][] chi = new double[alpha.length][];
        for (int i = 0; i < alpha.length; i++) {
            double[] a = alpha[i];
            double[] f = phi[i];
            double[] out = new double[a.length];
            for (int j = 0; j < a.length; j++) {
                double a1 = a[j];
                double a2 = a1 * a1;
                double t = f[j];
                double sum = 0.0;
                if (first) {
                    sum += 0.5 * a2 * (c10 + c12 * Math.cos(2.0 * (t - phi12)));
                }
                if (second) {
                    sum += (1.0 / 3.0) * a2 * a1
                            * (c21 * Math.cos(t - phi21) + c23 * Math.cos(3.0 * (t - phi23)));
                }
                if (third) {
                    sum += 0.25 * a2 * a2
                            * (c30
                                    + c32 * Math.cos(2.0 * (t - phi32))
                                    + c34 * Math.cos(4.0 * (t - phi34)));
                }
                if (fourth) {
                    sum += 0.2 * a2 * a2 * a1
                            * (c41 * Math.cos(t - phi41)
                                    + c43 * Math.cos(3.0 * (t - phi43))
                                    + c45 * Math.cos(5.0 * (t - phi45)));
                }
                if (fifth) {
                    sum += (1.0 / 6.0) * a2 * a2 * a2
                            * (c50
                                    + c52 * Math.cos(2.0 * (t - phi52))
                                    + c54 * Math.cos(4.0 * (t - phi54))
                                    + c56 * Math.cos(6.0 * (t - phi56)));
                }
                out[j] = scale * sum;
            }
            chi[i] = out;
        }
        return chi;
    }

    /**
     * Phase error of the round (azimuth independent) terms C10, C30 and C50.
     * See Kirkland Eq. 2.6.
     */
    public static double[][] symmetricChi(double[][] alpha, double wavelength, AberrationCoefficients p) {
        final double c10 = p.get("C10");
        final double c30 = p.get("C30");
        final double c50 = p.get("C50");
        final double scale = TWO_PI / wavelength;
        double[][] chi = new double[alpha.length][];
        for (int i = 0; i < alpha.length; i++) {
            double[] a = alpha[i];
            double[] out = new double[a.length];
            for (int j = 0; j < a.length; j++) {
                double a2 = a[j] * a[j];
                out[j] = scale * (0.5 * a2 * c10 + 0.25 * a2 * a2 * c30 + (1.0 / 6.0) * a2 * a2 * a2 * c50);
            }
            chi[i] = out;
        }
        return chi;
    }

    /** {@code exp(-i chi)} of the polar expansion. */
    public static ComplexArray polarAberrations(
            double[][] alpha, double[][] phi, double wavelength, AberrationCoefficients p) {
        return ComplexArray.exp(negate(polarChi(alpha, phi, wavelength, p)));
    }

    /** {@code exp(-i chi)} of the round terms only. */
    public static ComplexArray symmetricAberrations(
            double[][] alpha, double wavelength, AberrationCoefficients p) {
        return ComplexArray.exp(negate(symmetricChi(alpha, wavelength, p)));
    }

    /**
     * Objective aperture transmission.
     *
     * <p>With {@code rolloff == 0} the aperture is a hard step, one below
     * {@code cutoff} and zero from it on. A positive {@code rolloff} is a
     * fraction of {@code cutoff} over which the edge falls off as a raised
     * cosine ending at {@code cutoff}. An infinite cutoff transmits
     * everything.</p>
     */
    public static double[][] aperture(double[][] alpha, double cutoff, double rolloff) {
        double[][] out = new double[alpha.length][];
        if (Double.isInfinite(cutoff)) {
            for (int i = 0; i < alpha.length; i++) out[i] = ones(alpha[i].length);
            return out;
        }
        final double width = rolloff * cutoff;
        for (int i = 0; i < alpha.length; i++) {
            double[] a = alpha[i];
            double[] row = new double[a.length];
            for (int j = 0; j < a.length; j++) {
                if (rolloff > 0.0) {
                    if (a[j] > cutoff) {
                        row[j] = 0.0;
                    } else if (a[j] > cutoff - width) {
                        row[j] = 0.5 * (1.0 + Math.cos(Math.PI * (a[j] - cutoff + width) / width));
                    } else {
                        row[j] = 1.0;
                    }
                } else {
                    row[j] = a[j] < cutoff ? 1.0 : 0.0;
                }
            }
            out[i] = row;
        }
        return out;
    }

    /**
     * Damping from the focal spread {@code focalSpread} (Å),
     * {@code exp(-(pi / 2 / lambda * focalSpread * alpha^2)^2)}.
     */
    public static double[][] temporalEnvelope(double[][] alpha, double wavelength, double focalSpread) {
        final double scale = 0.5 * Math.PI / wavelength * focalSpread;
        double[][] out = new double[alpha.length][];
        for (int i = 0; i < alpha.length; i++) {
            double[] a = alpha[i];
            double[] row = new double[a.length];
            for (int j = 0; j < a.length; j++) {
                double x = scale * a[j] * a[j];
                row[j] = Math.exp(-(x * x));
            }
            out[i] = row;
        }
        return out;
    }

    /**
     * Damping from a finite source angular spread (radians),
     * {@code exp(-sign(beta) (beta / 2)^2 |grad chi|^2)} where the gradient is
     * taken in polar coordinates of the scattering angle.
     */
    public static double[][] spatialEnvelope(double[][] alpha, double[][] phi, double wavelength,
            double angularSpread, AberrationCoefficients p) {
        final double c10 = p.get("C10");
        final double c12 = p.get("C12");
        final double phi12 = p.get("phi12");
        final double c21 = p.get("C21");
        final double phi21 = p.get("phi21");
        final double c23 = p.get("C23");
        final double phi23 = p.get("phi23");
        final double c30 = p.get("C30");
        final double c32 = p.get("C32");
        final double phi32 = p.get("phi32");
        final double c34 = p.get("C34");
        final double phi34 = p.get("phi34");
        final double c41 = p.get("C41");
        final double phi41 = p.get("phi41");
        final double c43 = p.get("C43");
        final double phi43 = p.get("phi43");
        final double c45 = p.get("C45");
        final double phi45 = p.get("phi45");
        final double c50 = p.get("C50");
        final double c52 = p.get("C52");
        final double phi52 = p.get("phi52");
        final double c54 = p.get("C54");
        final double phi54 = p.get("phi54");
        final double c56 = p.get("C56");
        final double phi56 = p.get("phi56");

        final double scale = TWO_PI / wavelength;
        final double half = angularSpread / 2.0;
        final double damping = Math.signum(angularSpread) * half * half;
        double[][] out = new double[alpha.length][];
        for (int i = 0; i < alpha.length; i++) {
            double[] a = alpha[i];
            double[] f = phi[i];
            double[] row = new double[a.length];
            for (int j = 0; j < a.length; j++) {
                double a1 = a[j];
                double a2 = a1 * a1;
                double a3 = a2 * a1;
                double a4 = a2 * a2;
                double a5 = a4 * a1;
                double t = f[j];

                double dChiDAlpha = scale * (
                        (c12 * Math.cos(2.0 * (t - phi12)) + c10) * a1
                        + (c23 * Math.cos(3.0 * (t - phi23)) + c21 * Math.cos(t - phi21)) * a2
                        + (c34 * Math.cos(4.0 * (t - phi34)) + c32 * Math.cos(2.0 * (t - phi32)) + c30) * a3
                        + (c45 * Math.cos(5.0 * (t - phi45)) + c43 * Math.cos(3.0 * (t - phi43))
                                + c41 * Math.cos(t - phi41)) * a4
                        + (c56 * Math.cos(6.0 * (t - phi56)) + c54 * Math.cos(4.0 * (t - phi54))
                                + c52 * Math.cos(2.0 * (t - phi52)) + c50) * a5);

                double dChiDPhi = -scale * (
                        0.5 * (2.0 * c12 * Math.sin(2.0 * (t - phi12))) * a1
                        + (1.0 / 3.0) * (3.0 * c23 * Math.sin(3.0 * (t - phi23))
                                + c21 * Math.sin(t - phi21)) * a2
                        + 0.25 * (4.0 * c34 * Math.sin(4.0 * (t - phi34))
                                + 2.0 * c32 * Math.sin(2.0 * (t - phi32))) * a3
                        + 0.2 * (5.0 * c45 * Math.sin(5.0 * (t - phi45))
                                + 3.0 * c43 * Math.sin(3.0 * (t - phi43))
                                + c41 * Math.sin(t - phi41)) * a4
                        + (1.0 / 6.0) * (6.0 * c56 * Math.sin(6.0 * (t - phi56))
                                + 4.0 * c54 * Math.sin(4.0 * (t - phi54))
                                + 2.0 * c52 * Math.sin(2.0 * (t - phi52))) * a5);

                row[j] = Math.exp(-damping * (dChiDAlpha * dChiDAlpha + dChiDPhi * dChiDPhi));
            }
            out[i] = row;
        }
        return out;
    }

    private static double[][] negate(double[][] values) {
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) row[j] = -row[j];
        }
        return values;
    }

    private static double[] ones(int n) {
        double[] row = new double[n];
        Arrays.fill(row, 1.0);
        return row;
    }
}
