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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A formula in conjunctive normal form. Clauses are stored in DIMACS convention, i.e. variables are positive integers
 * and a negative integer denotes the negation of the respective variable.
 * <p>
 * Instances are append-only. Clause arrays handed to {@link #add(int...)} are copied.
 */
public final class CNF implements Iterable<int[]> {

    private final List<int[]> clauses;
    private int maxVariable;

    public CNF() {
        this.clauses = new ArrayList<>();
    }

    public CNF(CNF other) {
        this.clauses = new ArrayList<>(other.clauses);
        this.maxVariable = other.maxVariable;
    }

    /**
     * Adds a clause, i.e. the disjunction of the given literals.
     *
     * @param literals
     *         the (non-zero) literals of the clause
     *
     * @return {@code this}, for chaining
     */
    public CNF add(int... literals) {
        final int[] clause = Arrays.copyOf(literals, literals.length);
        for (int lit : clause) {
            if (lit == 0) {
                throw new IllegalArgumentException("0 is not a valid literal");
            }
            maxVariable = Math.max(maxVariable, Math.abs(lit));
        }
        clauses.add(clause);
        return this;
    }

    public CNF addAll(Iterable<int[]> other) {
        for (int[] clause : other) {
            add(clause);
        }
        return this;
    }

    public List<int[]> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    public int size() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * Returns the largest variable id that occurs in any clause, or {@code 0} if the formula is empty.
     *
     * @return the largest occurring variable id
     */
    public int maxVariable() {
        return maxVariable;
    }

    @Override
    public Iterator<int[]> iterator() {
        return getClauses().iterator();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("p cnf ").append(maxVariable).append(' ').append(clauses.size()).append('\n');
        for (int[] clause : clauses) {
            for (int lit : clause) {
                sb.append(lit).append(' ');
            }
            sb.append("0\n");
        }
        return sb.toString();
    }
}
