/* Copyright (C) 2022 The DFA-Identify Authors
 * This file is part of DFA-Identify.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dfaidentify.algorithm.satidentify;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An inclusive range of candidate DFA sizes. Either side may be absent.
 */
public final class Bounds {

    private static final Bounds UNBOUNDED = new Bounds(null, null);

    private final @Nullable Integer min;
    private final @Nullable Integer max;

    private Bounds(@Nullable Integer min, @Nullable Integer max) {
        if (min != null && min < 0) {
            throw new IllegalArgumentException("Lower bound must not be negative, got " + min);
        }
        if (max != null && max < 0) {
            throw new IllegalArgumentException("Upper bound must not be negative, got " + max);
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Lower bound " + min + " exceeds upper bound " + max);
        }
        this.min = min;
        this.max = max;
    }

    public static Bounds unbounded() {
        return UNBOUNDED;
    }

    public static Bounds of(@Nullable Integer min, @Nullable Integer max) {
        if (min == null && max == null) {
            return UNBOUNDED;
        }
        return new Bounds(min, max);
    }

    public static Bounds atMost(int max) {
        return new Bounds(null, max);
    }

    public static Bounds atLeast(int min) {
        return new Bounds(min, null);
    }

    public @Nullable Integer getMin() {
        return min;
    }

    public @Nullable Integer getMax() {
        return max;
    }

    /**
     * Returns the first candidate size to check, i.e. the larger of {@code 1} and the lower bound.
     *
     * @return the first candidate size
     */
    public int firstSize() {
        return min == null ? 1 : Math.max(1, min);
    }

    /**
     * Checks whether the given size does not exceed the upper bound.
     *
     * @param size
     *         the candidate size
     *
     * @return {@code true} iff the size does not exceed the upper bound
     */
    public boolean admits(int size) {
        return max == null || size <= max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bounds)) {
            return false;
        }
        final Bounds that = (Bounds) o;
        return Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "[" + (min == null ? "-" : min) + ", " + (max == null ? "-" : max) + ']';
    }
}
