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
package de.dfaidentify.api.sat;

/**
 * Translates cardinality constraints over a set of literals into clauses. Auxiliary variables introduced by an
 * encoding are numbered strictly above the given {@code topId}, so the largest variable of the resulting formula (see
 * {@link CNF#maxVariable()}) is the next {@code topId} to use when combining several encodings.
 */
public interface CardinalityEncoder {

    /**
     * Encodes "at most {@code bound} of {@code literals} are true".
     */
    CNF atMost(int[] literals, int bound, int topId);

    /**
     * Encodes "at least {@code bound} of {@code literals} are true".
     */
    CNF atLeast(int[] literals, int bound, int topId);

    /**
     * Encodes "exactly {@code bound} of {@code literals} are true".
     */
    default CNF exactly(int[] literals, int bound, int topId) {
        final CNF upper = atMost(literals, bound, topId);
        final CNF lower = atLeast(literals, bound, Math.max(topId, upper.maxVariable()));
        return new CNF(upper).addAll(lower);
    }
}
