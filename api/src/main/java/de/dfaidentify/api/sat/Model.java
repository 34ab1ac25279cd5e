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

import java.util.Arrays;

/**
 * A (total) truth assignment to the variables {@code 1..numVariables()} of a formula. Variables not mentioned by the
 * originating oracle are considered to be {@code false}.
 */
public final class Model {

    private final boolean[] values;

    private Model(boolean[] values) {
        this.values = values;
    }

    /**
     * Creates a model from a DIMACS-style list of literals, e.g. {@code [1, -2, 3]}.
     *
     * @param literals
     *         the literals that are true in the model
     * @param numVariables
     *         the number of variables the model should cover at least
     *
     * @return the model
     */
    public static Model fromLiterals(int[] literals, int numVariables) {
        int max = numVariables;
        for (int lit : literals) {
            max = Math.max(max, Math.abs(lit));
        }

        final boolean[] values = new boolean[max + 1];
        for (int lit : literals) {
            if (lit > 0) {
                values[lit] = true;
            }
        }
        return new Model(values);
    }

    public int numVariables() {
        return values.length - 1;
    }

    public boolean isTrue(int variable) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variables are positive, got " + variable);
        }
        return variable < values.length && values[variable];
    }

    /**
     * Evaluates a (possibly negative) literal.
     *
     * @param literal
     *         the literal
     *
     * @return {@code true} iff the literal is satisfied by this model
     */
    public boolean value(int literal) {
        return literal > 0 ? isTrue(literal) : !isTrue(-literal);
    }

    public boolean satisfies(int[] clause) {
        for (int lit : clause) {
            if (value(lit)) {
                return true;
            }
        }
        return false;
    }

    public boolean satisfies(CNF cnf) {
        for (int[] clause : cnf) {
            if (!satisfies(clause)) {
                return false;
            }
        }
        return true;
    }

    public int[] toLiterals() {
        final int[] result = new int[numVariables()];
        for (int v = 1; v < values.length; v++) {
            result[v - 1] = values[v] ? v : -v;
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Model)) {
            return false;
        }
        return Arrays.equals(values, ((Model) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(toLiterals());
    }
}
