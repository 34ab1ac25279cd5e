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
package de.dfaidentify.oracle.sat;

import de.dfaidentify.api.sat.CNF;
import de.dfaidentify.api.sat.CardinalityEncoder;

/**
 * A {@link CardinalityEncoder} based on the sequential counter encoding of Sinz ("Towards an Optimal CNF Encoding of
 * Boolean Cardinality Constraints", CP 2005). An "at most k of n" constraint requires {@code O(n * k)} auxiliary
 * variables and clauses. "At least" constraints are encoded as "at most" constraints over the negated literals.
 */
public class SequentialCounterEncoder implements CardinalityEncoder {

    @Override
    public CNF atMost(int[] literals, int bound, int topId) {
        final CNF cnf = new CNF();
        final int n = literals.length;

        if (bound < 0) {
            // unsatisfiable, encoded by complementary units over a fresh variable
            cnf.add(topId + 1);
            cnf.add(-(topId + 1));
            return cnf;
        }
        if (bound >= n) {
            return cnf;
        }
        if (bound == 0) {
            for (int lit : literals) {
                cnf.add(-lit);
            }
            return cnf;
        }

        // s(i, j): among the first i + 1 literals, at least j + 1 are true
        final int k = bound;
        final int base = topId + 1;

        cnf.add(-literals[0], s(base, k, 0, 0));
        for (int j = 1; j < k; j++) {
            cnf.add(-s(base, k, 0, j));
        }

        for (int i = 1; i < n - 1; i++) {
            cnf.add(-literals[i], s(base, k, i, 0));
            cnf.add(-s(base, k, i - 1, 0), s(base, k, i, 0));
            for (int j = 1; j < k; j++) {
                cnf.add(-literals[i], -s(base, k, i - 1, j - 1), s(base, k, i, j));
                cnf.add(-s(base, k, i - 1, j), s(base, k, i, j));
            }
            cnf.add(-literals[i], -s(base, k, i - 1, k - 1));
        }

        cnf.add(-literals[n - 1], -s(base, k, n - 2, k - 1));
        return cnf;
    }

    @Override
    public CNF atLeast(int[] literals, int bound, int topId) {
        if (bound <= 0) {
            return new CNF();
        }

        final int[] negated = new int[literals.length];
        for (int i = 0; i < literals.length; i++) {
            negated[i] = -literals[i];
        }
        return atMost(negated, literals.length - bound, topId);
    }

    private static int s(int base, int k, int i, int j) {
        return base + i * k + j;
    }
}
