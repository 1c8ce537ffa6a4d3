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
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-slot memoizer keyed by the values a derived quantity depends on.
 *
 * <p>Each key holds at most one entry: the last computed value together with a
 * snapshot of its dependency values. A lookup returns the stored value when
 * the current snapshot equals the stored one element by element (arrays are
 * compared by content), and recomputes otherwise. Stale entries are replaced
 * lazily on the next lookup.</p>
 *
 * <p>Not thread-safe. Owned by exactly one engine instance.</p>
 */
public final class DependencyCache {
    private static final Logger log = LoggerFactory.getLogger(DependencyCache.class);

    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * Return the value cached under {@code key} if it was computed from the
     * same dependency values, otherwise compute, store and return it. Nothing
     * is stored if {@code compute} throws.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, Object[] snapshot, Supplier<T> compute) {
        Entry entry = entries.get(key);
        if (entry != null && Arrays.deepEquals(entry.snapshot, snapshot)) {
            log.trace("Cache hit for {}", key);
            return (T) entry.value;
        }
        log.debug("Computing {}", key);
        T value = compute.get();
        entries.put(key, new Entry(snapshot.clone(), value));
        return value;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        final Object[] snapshot;
        final Object value;

        Entry(Object[] snapshot, Object value) {
            this.snapshot = snapshot;
            this.value = value;
        }
    }
}
