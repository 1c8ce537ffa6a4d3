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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polar expansion coefficients of the objective lens phase error, up to fifth
 * order.
 *
 * <p>The set of symbols is closed: {@code Cnm} is the amplitude of the term of
 * order {@code n} and azimuthal multiplicity {@code m} (Å), {@code phinm} its
 * orientation (radians). Every symbol always holds a value; unset symbols are
 * zero. A handful of conventional names are accepted as aliases, see
 * {@link #ALIASES}. {@code defocus} is special in that it maps to {@code C10}
 * with the sign inverted.</p>
 *
 * <p>Instances are mutable and not thread-safe.</p>
 */
public final class AberrationCoefficients {
    private static final Logger log = LoggerFactory.getLogger(AberrationCoefficients.class);

    /** Canonical symbols, in expansion order. */
    public static final List<String> SYMBOLS = Collections.unmodifiableList(Arrays.asList(
            "C10", "C12", "phi12",
            "C21", "phi21", "C23", "phi23",
            "C30", "C32", "phi32", "C34", "phi34",
            "C41", "phi41", "C43", "phi43", "C45", "phi45",
            "C50", "C52", "phi52", "C54", "phi54", "C56", "phi56"));

    /** Alias to canonical symbol. */
    public static final Map<String, String> ALIASES;

    public static final String DEFOCUS = "defocus";

    static {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put(DEFOCUS, "C10");
        aliases.put("astigmatism", "C12");
        aliases.put("astigmatism_angle", "phi12");
        aliases.put("coma", "C21");
        aliases.put("coma_angle", "phi21");
        aliases.put("Cs", "C30");
        aliases.put("C5", "C50");
        ALIASES = Collections.unmodifiableMap(aliases);
    }

    private double c10;
    private double c12;
    private double phi12;
    private double c21;
    private double phi21;
    private double c23;
    private double phi23;
    private double c30;
    private double c32;
    private double phi32;
    private double c34;
    private double phi34;
    private double c41;
    private double phi41;
    private double c43;
    private double phi43;
    private double c45;
    private double phi45;
    private double c50;
    private double c52;
    private double phi52;
    private double c54;
    private double phi54;
    private double c56;
    private double phi56;

    private final List<ParameterListener> listeners = new CopyOnWriteArrayList<>();

    /** All coefficients zero. */
    public AberrationCoefficients() {}

    /**
     * Coefficients initialised from a symbol to value mapping. Aliases are
     * accepted.
     *
     * @throws InvalidParameterException if a key is not a known symbol or alias
     */
    public AberrationCoefficients(Map<String, Double> values) {
        update(values);
    }

    /**
     * Returns true if {@code symbol} is a canonical symbol or an alias.
     */
    public static boolean isKnown(String symbol) {
        return SYMBOLS.contains(symbol) || ALIASES.containsKey(symbol);
    }

    /**
     * Resolve an alias to its canonical symbol. Canonical symbols resolve to
     * themselves.
     *
     * @throws InvalidParameterException for an unknown symbol
     */
    public static String canonical(String symbol) {
        if (symbol != null && SYMBOLS.contains(symbol)) return symbol;
        String resolved = symbol == null ? null : ALIASES.get(symbol);
        if (resolved == null) {
            throw new InvalidParameterException(symbol + " not a recognized parameter");
        }
        return resolved;
    }

    /**
     * Read a coefficient by canonical symbol or alias. Reading
     * {@code defocus} returns {@code -C10}.
     *
     * @throws InvalidParameterException for an unknown symbol
     */
    public double get(String symbol) {
        double value = read(canonical(symbol));
        return DEFOCUS.equals(symbol) ? -value : value;
    }

    /**
     * Write a coefficient by canonical symbol or alias and notify listeners.
     * Writing {@code defocus = d} stores {@code C10 = -d}.
     *
     * @return whether the stored value changed
     * @throws InvalidParameterException for an unknown symbol
     */
    public boolean set(String symbol, double value) {
        String key = canonical(symbol);
        double stored = DEFOCUS.equals(symbol) ? 0.0 - value : value;
        double old = read(key);
        write(key, stored);
        boolean changed = old != stored && Double.compare(old, stored) != 0;
        for (ParameterListener listener : listeners) {
            listener.parameterChanged(symbol, changed);
        }
        return changed;
    }

    /**
     * Apply several coefficients at once. Every key is resolved before any
     * value is written, so an unknown key or a missing value leaves this
     * instance unchanged.
     *
     * @throws InvalidParameterException if any key is unknown or any value is null
     */
    public void update(Map<String, Double> values) {
        for (Map.Entry<String, Double> e : values.entrySet()) {
            canonical(e.getKey());
            if (e.getValue() == null) {
                throw new InvalidParameterException("No value given for " + e.getKey());
            }
        }
        for (Map.Entry<String, Double> e : values.entrySet()) {
            set(e.getKey(), e.getValue());
        }
    }

    public double getDefocus() {
        return -c10;
    }

    public void setDefocus(double defocus) {
        set(DEFOCUS, defocus);
    }

    /** Immutable canonical snapshot, in {@link #SYMBOLS} order. */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (String symbol : SYMBOLS) {
            map.put(symbol, read(symbol));
        }
        return Collections.unmodifiableMap(map);
    }

    /** Values in {@link #SYMBOLS} order. */
    double[] values() {
        double[] values = new double[SYMBOLS.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = read(SYMBOLS.get(i));
        }
        return values;
    }

    /** Returns true if every listed canonical symbol is exactly zero. */
    boolean allZero(String... symbols) {
        for (String symbol : symbols) {
            if (read(symbol) != 0.0) return false;
        }
        return true;
    }

    /** Independent copy of the values. Listeners are not copied. */
    public AberrationCoefficients copy() {
        AberrationCoefficients copy = new AberrationCoefficients();
        for (String symbol : SYMBOLS) {
            copy.write(symbol, read(symbol));
        }
        return copy;
    }

    public void addListener(ParameterListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ParameterListener listener) {
        listeners.remove(listener);
    }

    /**
     * Load coefficients from the classpath.
     *
     * @see #load(InputStream)
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static AberrationCoefficients loadResource(String name) {
        InputStream in = AberrationCoefficients.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            log.error("Aberration table '{}' not found on classpath", name);
            throw new IllegalStateException("Aberration table '" + name + "' not found on classpath");
        }
        return load(in);
    }

    /**
     * Parse a table of {@code symbol value} rows. Blank lines and lines
     * starting with {@code #} are skipped; aliases are accepted. The stream is
     * closed.
     *
     * @throws IllegalStateException if the table cannot be read or parsed
     */
    public static AberrationCoefficients load(InputStream in) {
        Map<String, Double> values = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length != 2) {
                    throw new IllegalStateException(
                            "Expected 'symbol value' on line " + lineNo + ": " + line);
                }
                if (!isKnown(toks[0])) {
                    unknown.add(toks[0]);
                    continue;
                }
                values.put(toks[0], Double.parseDouble(toks[1]));
            }
        } catch (IOException e) {
            log.error("Failed to read aberration table", e);
            throw new IllegalStateException("Failed to read aberration table", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse aberration table", e);
            throw new IllegalStateException("Failed to parse aberration table", e);
        }
        if (!unknown.isEmpty()) {
            log.error("Aberration table contains unknown symbols {}", unknown);
            throw new IllegalStateException("Aberration table contains unknown symbols " + unknown);
        }
        if (values.isEmpty()) {
            log.warn("Aberration table has no entries; all coefficients are zero");
        }
        return new AberrationCoefficients(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AberrationCoefficients)) return false;
        return Arrays.equals(values(), ((AberrationCoefficients) o).values());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AberrationCoefficients{");
        boolean first = true;
        for (String symbol : SYMBOLS) {
            double value = read(symbol);
            if (value == 0.0) continue;
            if (!first) sb.append(", ");
            sb.append(symbol).append('=').append(value);
            first = false;
        }
        return sb.append('}').toString();
    }

    private double read(String symbol) {
        switch (symbol) {
            case "C10": return c10;
            case "C12": return c12;
            case "phi12": return phi12;
            case "C21": return c21;
            case "phi21": return phi21;
            case "C23": return c23;
            case "phi23": return phi23;
            case "C30": return c30;
            case "C32": return c32;
            case "phi32": return phi32;
            case "C34": return c34;
            case "phi34": return phi34;
            case "C41": return c41;
            case "phi41": return phi41;
            case "C43": return c43;
            case "phi43": return phi43;
            case "C45": return c45;
            case "phi45": return phi45;
            case "C50": return c50;
            case "C52": return c52;
            case "phi52": return phi52;
            case "C54": return c54;
            case "phi54": return phi54;
            case "C56": return c56;
            case "phi56": return phi56;
            default: throw new InvalidParameterException(symbol + " not a recognized parameter");
        }
    }

    private void write(String symbol, double value) {
        switch (symbol) {
            case "C10": c10 = value; break;
            case "C12": c12 = value; break;
            case "phi12": phi12 = value; break;
            case "C21": c21 = value; break;
            case "phi21": phi21 = value; break;
            case "C23": c23 = value; break;
            case "phi23": phi23 = value; break;
            case "C30": c30 = value; break;
            case "C32": c32 = value; break;
            case "phi32": phi32 = value; break;
            case "C34": c34 = value; break;
            case "phi34": phi34 = value; break;
            case "C41": c41 = value; break;
            case "phi41": phi41 = value; break;
            case "C43": c43 = value; break;
            case "phi43": phi43 = value; break;
            case "C45": c45 = value; break;
            case "phi45": phi45 = value; break;
            case "C50": c50 = value; break;
            case "C52": c52 = value; break;
            case "phi52": phi52 = value; break;
            case "C54": c54 = value; break;
            case "phi54": phi54 = value; break;
            case "C56": c56 = value; break;
            case "phi56": phi56 = value; break;
            default: throw new InvalidParameterException(symbol + " not a recognized parameter");
        }
    }
}
