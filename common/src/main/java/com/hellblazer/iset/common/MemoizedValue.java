/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.iset.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A derived value computed on first read and held until explicitly invalidated.
 * <p>
 * The owner calls {@link #invalidate()} at every site that writes the source data. The value can also be stored
 * directly with {@link #set(Object)}, which is how a caller installs a value it computed itself.
 * <p>
 * Not thread safe; owners that need concurrent access guard the write/read pair with their own lock.
 *
 * @param <T> type of the derived value
 * @author hal.hildebrand
 */
public final class MemoizedValue<T> {

    private final Supplier<T> computation;
    private T     value;
    private long  computations;

    /**
     * @param computation produces the value from the current source data
     */
    public MemoizedValue(Supplier<T> computation) {
        this.computation = Objects.requireNonNull(computation, "computation");
    }

    /**
     * Get the value, computing it if unset.
     *
     * @return the cached or freshly computed value
     */
    public T get() {
        if (value == null) {
            value = computation.get();
            computations++;
        }
        return value;
    }

    /**
     * Get the value only if it is currently cached.
     *
     * @return cached value, or empty if unset
     */
    public Optional<T> peek() {
        return Optional.ofNullable(value);
    }

    /**
     * Store a value directly. Passing null is equivalent to {@link #invalidate()}.
     *
     * @param value the value to cache
     */
    public void set(T value) {
        this.value = value;
    }

    /**
     * Mark the value unset so the next {@link #get()} recomputes it.
     */
    public void invalidate() {
        value = null;
    }

    /**
     * @return true if a value is cached
     */
    public boolean isSet() {
        return value != null;
    }

    /**
     * Number of times the computation has run.
     *
     * @return computation count
     */
    public long computations() {
        return computations;
    }
}
